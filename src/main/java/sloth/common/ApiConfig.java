package sloth.common;

import java.util.Objects;

/**
 * Per-API settings, fixed at construction.
 *
 * @param parseFormByDefault parse query and form body before dispatching; malformed input is answered with 400
 * @param defaultContentType Content-Type added to JSON-encoded responses that do not set one; empty disables it
 */
public record ApiConfig(boolean parseFormByDefault, String defaultContentType) {

    public static final String JSON = "application/json";

    public static final String PARSE_FORM_PROPERTY = "sloth.parseForm";
    public static final String CONTENT_TYPE_PROPERTY = "sloth.defaultContentType";

    public ApiConfig {
        Objects.requireNonNull(defaultContentType, "defaultContentType");
    }

    public static ApiConfig defaults() {
        return new ApiConfig(true, JSON);
    }

    /** Defaults, overridden by {@code -Dsloth.parseForm} and {@code -Dsloth.defaultContentType}. */
    public static ApiConfig fromSystemProperties() {
        ApiConfig d = defaults();
        String parse = System.getProperty(PARSE_FORM_PROPERTY);
        return new ApiConfig(
                parse == null ? d.parseFormByDefault() : Boolean.parseBoolean(parse.trim()),
                System.getProperty(CONTENT_TYPE_PROPERTY, d.defaultContentType()));
    }

    public ApiConfig withParseFormByDefault(boolean parseForm) {
        return new ApiConfig(parseForm, defaultContentType);
    }

    public ApiConfig withDefaultContentType(String contentType) {
        return new ApiConfig(parseFormByDefault, contentType);
    }
}
