package api.impl.handlers;

import api.interfaces.IHttpHandler;
import api.interfaces.http.HttpRequest;
import api.interfaces.http.HttpResponse;
import api.interfaces.http.HttpStatus;

public class NotFoundHandler implements IHttpHandler {
    @Override
    public void handle(HttpRequest req, HttpResponse res) {
        Responses.error(res, HttpStatus.NOT_FOUND, "no route for " + req.method() + " " + req.path());
    }
}
