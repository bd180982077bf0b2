package sloth.domain.interfaces;

import sloth.api.interfaces.http.HttpRequest;
import sloth.domain.model.ResourceResponse;

/** Implemented by resources that answer HTTP PATCH requests. */
@FunctionalInterface
public interface PatchSupported {
    ResourceResponse patch(HttpRequest request);
}
