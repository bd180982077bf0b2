package sloth.api.interfaces;

import sloth.api.interfaces.http.HttpRequest;
import sloth.api.interfaces.http.HttpResponse;

/** Handles one request by writing to the response; no return value. */
@FunctionalInterface
public interface IHttpHandler {
    void handle(HttpRequest req, HttpResponse res) throws Exception;
}
