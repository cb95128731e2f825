package api.impl.handlers;

import api.interfaces.IHttpHandler;
import api.interfaces.http.HttpRequest;
import api.interfaces.http.HttpResponse;
import api.interfaces.http.HttpStatus;

/** 405 for a known path with an unsupported verb. */
public class MethodNotAllowedHandler implements IHttpHandler {
    private final String allow;

    public MethodNotAllowedHandler(String... allowed) {
        this.allow = String.join(", ", allowed);
    }

    @Override
    public void handle(HttpRequest req, HttpResponse res) {
        res.header("Allow", allow);
        Responses.error(res, HttpStatus.METHOD_NOT_ALLOWED, "method not allowed");
    }
}
