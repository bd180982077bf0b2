package sloth.domain.interfaces;

import sloth.api.interfaces.http.HttpRequest;
import sloth.domain.model.ResourceResponse;

/** Implemented by resources that answer HTTP PUT requests. */
@FunctionalInterface
public interface PutSupported {
    ResourceResponse put(HttpRequest request);
}
