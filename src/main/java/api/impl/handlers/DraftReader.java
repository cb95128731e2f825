package api.impl.handlers;

import api.impl.json.PostJson;
import api.interfaces.http.HttpRequest;
import api.interfaces.http.HttpResponse;
import api.interfaces.http.HttpStatus;
import com.google.gson.JsonParseException;
import domain.model.PostDraft;

import java.util.List;

/** Decodes and validates create/update bodies for {@link CreatePostHandler} and {@link UpdatePostHandler}. */
final class DraftReader {

    static final String INVALID_BODY = "invalid request body";
    static final String REQUIRED = "title and content are required";

    private DraftReader() {}

    /**
     * @return the draft, or {@code null} after a 400 has been written to {@code res}
     */
    static PostDraft readValid(HttpRequest req, HttpResponse res) {
        PostDraft draft;
        try {
            draft = PostJson.readDraft(req.body());
        } catch (JsonParseException e) {
            Responses.error(res, HttpStatus.BAD_REQUEST, INVALID_BODY);
            return null;
        }
        if (draft.hasNullTag()) {
            Responses.error(res, HttpStatus.BAD_REQUEST, INVALID_BODY);
            return null;
        }
        List<String> missing = draft.missingRequiredFields();
        if (!missing.isEmpty()) {
            Responses.json(res, HttpStatus.BAD_REQUEST, PostJson.error(REQUIRED, missing));
            return null;
        }
        return draft;
    }
}
