package sloth.domain.interfaces;

import sloth.api.interfaces.http.HttpRequest;
import sloth.domain.model.ResourceResponse;

/** Implemented by resources that answer HTTP HEAD requests. */
@FunctionalInterface
public interface HeadSupported {
    ResourceResponse head(HttpRequest request);
}
