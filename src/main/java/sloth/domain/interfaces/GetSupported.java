package sloth.domain.interfaces;

import sloth.api.interfaces.http.HttpRequest;
import sloth.domain.model.ResourceResponse;

/** Implemented by resources that answer HTTP GET requests. */
@FunctionalInterface
public interface GetSupported {
    ResourceResponse get(HttpRequest request);
}
