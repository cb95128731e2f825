package api.interfaces;

import api.interfaces.http.HttpRequest;
import api.interfaces.http.HttpResponse;

/**
 * Serves one request. Anything thrown out of {@link #handle} is turned into
 * a 500 by the server.
 */
public interface IHttpHandler {
    void handle(HttpRequest req, HttpResponse res) throws Exception;
}
