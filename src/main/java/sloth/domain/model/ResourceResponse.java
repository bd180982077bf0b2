package sloth.domain.model;

import java.util.Objects;

/**
 * Result of a resource method: status code, payload and extra headers.
 * {@code null} headers are treated as no headers.
 */
public record ResourceResponse(int status, Payload payload, Headers headers) {

    public ResourceResponse {
        Objects.requireNonNull(payload, "payload");
        if (headers == null) headers = Headers.empty();
    }

    public static ResourceResponse of(int status, Payload payload) {
        return new ResourceResponse(status, payload, null);
    }

    public static ResourceResponse text(int status, String text) {
        return of(status, Payload.text(text));
    }

    public static ResourceResponse json(int status, Object value) {
        return of(status, Payload.structured(value));
    }

    /** Status only, empty body. */
    public static ResourceResponse status(int status) {
        return of(status, Payload.empty());
    }

    /** Copy of this response with one more header value. */
    public ResourceResponse withHeader(String name, String value) {
        return new ResourceResponse(status, payload, headers.copy().add(name, value));
    }
}
