package sloth.domain.interfaces;

import sloth.api.interfaces.http.HttpRequest;
import sloth.domain.model.ResourceResponse;

/** Implemented by resources that answer HTTP DELETE requests. */
@FunctionalInterface
public interface DeleteSupported {
    ResourceResponse delete(HttpRequest request);
}
