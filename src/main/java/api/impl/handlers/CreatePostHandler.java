package api.impl.handlers;

import api.impl.json.PostJson;
import api.interfaces.IHttpHandler;
import api.interfaces.http.HttpRequest;
import api.interfaces.http.HttpResponse;
import api.interfaces.http.HttpStatus;
import domain.exceptions.StoreException;
import domain.interfaces.IPostStore;
import domain.model.Post;
import domain.model.PostDraft;

/**
 * POST /posts. Answers with the post as stored, read back by its new id,
 * so the client sees the assigned id and timestamps.
 */
public class CreatePostHandler implements IHttpHandler {
    private final IPostStore store;

    public CreatePostHandler(IPostStore store) { this.store = store; }

    @Override
    public void handle(HttpRequest req, HttpResponse res) {
        PostDraft draft = DraftReader.readValid(req, res);
        if (draft == null) return;

        long id;
        try {
            id = store.create(draft);
        } catch (StoreException e) {
            Responses.error(res, HttpStatus.INTERNAL_SERVER_ERROR, "failed to create post");
            return;
        }

        Post created;
        try {
            created = store.get(id);
        } catch (StoreException e) {
            // includes a concurrent delete between create and read-back
            Responses.error(res, HttpStatus.INTERNAL_SERVER_ERROR, "failed to retrieve created post");
            return;
        }
        Responses.json(res, HttpStatus.CREATED, PostJson.toJson(created));
    }
}
