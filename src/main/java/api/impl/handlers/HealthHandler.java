package api.impl.handlers;

import api.interfaces.IHttpHandler;
import api.interfaces.http.HttpRequest;
import api.interfaces.http.HttpResponse;
import api.interfaces.http.HttpStatus;

public class HealthHandler implements IHttpHandler {
    @Override
    public void handle(HttpRequest req, HttpResponse res) {
        Responses.json(res, HttpStatus.OK, "{\"status\":\"ok\"}");
    }
}
