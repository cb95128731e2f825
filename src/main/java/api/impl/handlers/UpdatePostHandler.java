package api.impl.handlers;

import api.impl.json.PostJson;
import api.interfaces.IHttpHandler;
import api.interfaces.http.HttpRequest;
import api.interfaces.http.HttpResponse;
import api.interfaces.http.HttpStatus;
import domain.exceptions.PostNotFoundException;
import domain.exceptions.StoreException;
import domain.interfaces.IPostStore;
import domain.model.PostDraft;

/** PUT /posts/{id}. The body is validated before the store is consulted. */
public class UpdatePostHandler implements IHttpHandler {
    private final IPostStore store;
    private final long id;

    public UpdatePostHandler(IPostStore store, long id) {
        this.store = store;
        this.id = id;
    }

    @Override
    public void handle(HttpRequest req, HttpResponse res) {
        PostDraft draft = DraftReader.readValid(req, res);
        if (draft == null) return;

        try {
            Responses.json(res, HttpStatus.OK, PostJson.toJson(store.update(id, draft)));
        } catch (PostNotFoundException e) {
            Responses.error(res, HttpStatus.NOT_FOUND, e.getMessage());
        } catch (StoreException e) {
            Responses.error(res, HttpStatus.INTERNAL_SERVER_ERROR, "failed to update post");
        }
    }
}
