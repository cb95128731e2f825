package api.impl.handlers;

import api.impl.json.PostJson;
import api.interfaces.http.HttpResponse;
import api.interfaces.http.HttpStatus;

/** Shared response shapes for the handlers in this package. */
final class Responses {

    static final String JSON = "application/json; charset=utf-8";

    private Responses() {}

    static void json(HttpResponse res, int status, String json) {
        res.status(status);
        res.header("Content-Type", JSON);
        res.body(json);
    }

    static void error(HttpResponse res, int status, String message) {
        json(res, status, PostJson.error(message));
    }

    static void noContent(HttpResponse res) {
        res.status(HttpStatus.NO_CONTENT);
        res.body("");
    }
}
