package api.impl.handlers;

import api.interfaces.IHandlerFactory;
import api.interfaces.IHttpHandler;
import api.interfaces.http.HttpRequest;
import domain.interfaces.IPostStore;

/**
 * Routes requests for the post collection ({@code /posts}), single posts
 * ({@code /posts/{id}}) and {@code /health}.
 */
public class HandlerFactory implements IHandlerFactory {

    static final String COLLECTION = "/posts";
    static final String HEALTH = "/health";
    static final String INVALID_ID = "invalid identifier";

    private final IPostStore store;
    public HandlerFactory(IPostStore store) { this.store = store; }

    @Override
    public IHttpHandler create(HttpRequest req) {
        // methods are case-sensitive: "delete" is not DELETE
        String m = req.method() == null ? "" : req.method();
        String p = req.path();

        if (COLLECTION.equals(p) || (COLLECTION + "/").equals(p)) {
            if ("GET".equals(m)) return new ListPostsHandler(store);
            if ("POST".equals(m)) return new CreatePostHandler(store);
            return new MethodNotAllowedHandler("GET", "POST");
        }

        if (p.startsWith(COLLECTION + "/")) {
            // a bad id is a 400 whatever the method
            Long id = parseId(p.substring(COLLECTION.length() + 1));
            if (id == null) return new BadRequestHandler(INVALID_ID);

            if ("GET".equals(m)) return new GetPostHandler(store, id);
            if ("PUT".equals(m)) return new UpdatePostHandler(store, id);
            if ("DELETE".equals(m)) return new DeletePostHandler(store, id);
            return new MethodNotAllowedHandler("GET", "PUT", "DELETE");
        }

        if (HEALTH.equals(p)) {
            if ("GET".equals(m)) return new HealthHandler();
            return new MethodNotAllowedHandler("GET");
        }

        return new NotFoundHandler();
    }

    /** Decimal digits only (no sign), within the range of a long; otherwise {@code null}. */
    static Long parseId(String token) {
        if (token.isEmpty()) return null;
        for (int i = 0; i < token.length(); i++) {
            char c = token.charAt(i);
            if (c < '0' || c > '9') return null;
        }
        try {
            return Long.parseLong(token);
        } catch (NumberFormatException e) {
            return null; // overflow
        }
    }
}
