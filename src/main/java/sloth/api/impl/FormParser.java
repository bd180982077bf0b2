package sloth.api.impl;

import sloth.api.interfaces.http.FormParseException;
import sloth.api.interfaces.http.HttpRequest;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Decodes {@code application/x-www-form-urlencoded} data from the query
 * string and, for POST, PUT and PATCH, from the request body.
 * <p>
 * Body values come before query values when a key appears in both.
 * Multipart bodies and other content types leave the body untouched.
 */
public final class FormParser {

    public static final String FORM_URLENCODED = "application/x-www-form-urlencoded";

    /** Form bodies larger than this are rejected. */
    public static final int MAX_FORM_BYTES = 10 << 20;

    private FormParser() {}

    public static Map<String, List<String>> parse(HttpRequest req) throws FormParseException {
        Map<String, List<String>> form = new LinkedHashMap<>();
        if (hasFormBody(req.method())) {
            parseBody(req, form);
        }
        parseQuery(req.rawQuery(), form);
        return form;
    }

    /** Parses {@code k=v&k2=v2} pairs into {@code into}. */
    public static void parseQuery(String query, Map<String, List<String>> into) throws FormParseException {
        if (query == null || query.isEmpty()) return;
        for (String pair : query.split("&", -1)) {
            if (pair.isEmpty()) continue;
            if (pair.indexOf(';') >= 0) {
                throw new FormParseException("invalid semicolon separator in query");
            }
            int eq = pair.indexOf('=');
            String key = eq < 0 ? pair : pair.substring(0, eq);
            String value = eq < 0 ? "" : pair.substring(eq + 1);
            into.computeIfAbsent(unescape(key), k -> new ArrayList<>()).add(unescape(value));
        }
    }

    private static void parseBody(HttpRequest req, Map<String, List<String>> into) throws FormParseException {
        String mediaType = mediaType(req.header("Content-Type"));
        if (!FORM_URLENCODED.equals(mediaType)) return;

        byte[] body = req.body();
        if (body == null) throw new FormParseException("missing form body");
        if (body.length > MAX_FORM_BYTES) throw new FormParseException("form body too large: " + body.length + " bytes");

        parseQuery(new String(body, StandardCharsets.UTF_8), into);
    }

    /** Lower-cased media type without parameters; absent means application/octet-stream. */
    static String mediaType(String contentType) throws FormParseException {
        if (contentType == null || contentType.isBlank()) return "application/octet-stream";
        int semi = contentType.indexOf(';');
        String type = (semi < 0 ? contentType : contentType.substring(0, semi)).trim().toLowerCase(Locale.ROOT);
        int slash = type.indexOf('/');
        if (type.isEmpty() || slash <= 0 || slash == type.length() - 1) {
            throw new FormParseException("malformed content type: " + contentType);
        }
        return type;
    }

    private static boolean hasFormBody(String method) {
        return "POST".equals(method) || "PUT".equals(method) || "PATCH".equals(method);
    }

    private static String unescape(String s) throws FormParseException {
        try {
            return URLDecoder.decode(s, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw new FormParseException("invalid URL escape in \"" + s + "\"", e);
        }
    }
}
