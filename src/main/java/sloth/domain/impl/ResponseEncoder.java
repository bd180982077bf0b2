package sloth.domain.impl;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import sloth.domain.model.Headers;
import sloth.domain.model.Payload;

import java.nio.charset.StandardCharsets;

/**
 * Turns a {@link Payload} into response bytes.
 * <p>
 * Text is UTF-8 encoded and bytes pass through unchanged. Structured values
 * are written as indented JSON with Gson; only that branch asks for the
 * default content type and only that branch can fail.
 */
public final class ResponseEncoder {

    /** Encoded body plus whether a default Content-Type should be filled in. */
    public record EncodedBody(byte[] bytes, boolean contentTypeDefaultApplies) {}

    private static final Gson gson = new GsonBuilder()
            .serializeNulls()
            .setPrettyPrinting()
            .create();

    private final String defaultContentType;

    public ResponseEncoder(String defaultContentType) {
        this.defaultContentType = defaultContentType == null ? "" : defaultContentType;
    }

    public EncodedBody encode(Payload payload) throws ResponseEncodingException {
        if (payload instanceof Payload.Text text) {
            return new EncodedBody(text.toBytes(), false);
        }
        if (payload instanceof Payload.Bytes bytes) {
            return new EncodedBody(bytes.value(), false);
        }
        Object value = ((Payload.Structured) payload).value();
        try {
            return new EncodedBody(gson.toJson(value).getBytes(StandardCharsets.UTF_8), true);
        } catch (JsonParseException | IllegalArgumentException | UnsupportedOperationException e) {
            // NaN/Infinity, types Gson cannot reflect on, adapters refusing to write
            String type = value == null ? "null" : value.getClass().getName();
            throw new ResponseEncodingException("cannot encode " + type + " as JSON", e);
        } catch (StackOverflowError e) {
            // Gson has no cycle check; a value that contains itself recurses until the stack runs out
            throw new ResponseEncodingException("cannot encode cyclic " + value.getClass().getName() + " as JSON", e);
        }
    }

    /**
     * Adds the default Content-Type to {@code headers} when the body was
     * JSON-encoded, a default is configured and no non-empty Content-Type
     * is set yet. An explicit value always wins over the default.
     *
     * @return true if the header was added
     */
    public boolean applyDefaultContentType(EncodedBody body, Headers headers) {
        if (!body.contentTypeDefaultApplies() || defaultContentType.isEmpty()) return false;
        String current = headers.get(Headers.CONTENT_TYPE);
        if (current != null && !current.isEmpty()) return false;
        headers.set(Headers.CONTENT_TYPE, defaultContentType);
        return true;
    }
}
