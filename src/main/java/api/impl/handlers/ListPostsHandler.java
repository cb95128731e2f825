package api.impl.handlers;

import api.impl.json.PostJson;
import api.interfaces.IHttpHandler;
import api.interfaces.http.HttpRequest;
import api.interfaces.http.HttpResponse;
import api.interfaces.http.HttpStatus;
import domain.exceptions.StoreException;
import domain.interfaces.IPostStore;
import domain.model.Post;

import java.util.List;

/** GET /posts[?term=...] */
public class ListPostsHandler implements IHttpHandler {
    private final IPostStore store;

    public ListPostsHandler(IPostStore store) { this.store = store; }

    @Override
    public void handle(HttpRequest req, HttpResponse res) {
        String term = req.query("term");
        try {
            List<Post> posts = store.list(term == null ? "" : term);
            Responses.json(res, HttpStatus.OK, PostJson.toJson(posts));
        } catch (StoreException e) {
            Responses.error(res, HttpStatus.INTERNAL_SERVER_ERROR, "failed to list posts");
        }
    }
}
