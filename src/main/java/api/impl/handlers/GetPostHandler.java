package api.impl.handlers;

import api.impl.json.PostJson;
import api.interfaces.IHttpHandler;
import api.interfaces.http.HttpRequest;
import api.interfaces.http.HttpResponse;
import api.interfaces.http.HttpStatus;
import domain.exceptions.PostNotFoundException;
import domain.exceptions.StoreException;
import domain.interfaces.IPostStore;

/** GET /posts/{id} */
public class GetPostHandler implements IHttpHandler {
    private final IPostStore store;
    private final long id;

    public GetPostHandler(IPostStore store, long id) {
        this.store = store;
        this.id = id;
    }

    @Override
    public void handle(HttpRequest req, HttpResponse res) {
        try {
            Responses.json(res, HttpStatus.OK, PostJson.toJson(store.get(id)));
        } catch (PostNotFoundException e) {
            Responses.error(res, HttpStatus.NOT_FOUND, e.getMessage());
        } catch (StoreException e) {
            Responses.error(res, HttpStatus.INTERNAL_SERVER_ERROR, "failed to get post");
        }
    }
}
