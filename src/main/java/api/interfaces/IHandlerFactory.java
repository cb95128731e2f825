package api.interfaces;

import api.interfaces.http.HttpRequest;

/** Picks the handler for a request from its method and path. */
public interface IHandlerFactory {
    IHttpHandler create(HttpRequest req);
}
