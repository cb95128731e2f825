package api.impl.handlers;

import api.interfaces.IHttpHandler;
import api.interfaces.http.HttpRequest;
import api.interfaces.http.HttpResponse;
import api.interfaces.http.HttpStatus;

/** Rejects a request that failed routing-level checks, e.g. a malformed id. */
public class BadRequestHandler implements IHttpHandler {
    private final String message;

    public BadRequestHandler(String message) { this.message = message; }

    @Override
    public void handle(HttpRequest req, HttpResponse res) {
        Responses.error(res, HttpStatus.BAD_REQUEST, message);
    }
}
