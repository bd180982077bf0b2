package sloth.api.impl.handlers;

import sloth.api.impl.HttpStatus;
import sloth.api.interfaces.IHttpHandler;
import sloth.api.interfaces.http.HttpRequest;
import sloth.api.interfaces.http.HttpResponse;

/** Answers requests no route matched: 404 with an empty body. */
public class NotFoundHandler implements IHttpHandler {
    @Override
    public void handle(HttpRequest req, HttpResponse res) {
        res.status(HttpStatus.NOT_FOUND);
    }
}
