package sloth.domain.interfaces;

import sloth.api.interfaces.http.HttpRequest;
import sloth.domain.model.ResourceResponse;

/** Implemented by resources that answer HTTP POST requests. */
@FunctionalInterface
public interface PostSupported {
    ResourceResponse post(HttpRequest request);
}
