package sloth.api.impl;

import sloth.api.interfaces.http.FormParseException;
import sloth.api.interfaces.http.HttpRequest;
import sloth.domain.model.Headers;

import java.util.Collections;
import java.util.List;
import java.util.Map;

public class MinimalHttpRequest implements HttpRequest {
    private final String method;
    private final String path;
    private final String rawQuery;
    private final String version;
    private final Headers headers;
    private final byte[] body;
    private final Map<String, String> pathParams;
    private Map<String, List<String>> form;

    public MinimalHttpRequest(String method, String target, String version,
                              Headers headers, byte[] body) {
        this(method, pathOf(target), queryOf(target), version,
                headers == null ? Headers.empty() : headers,
                body == null ? new byte[0] : body,
                Map.of(), null);
    }

    private MinimalHttpRequest(String method, String path, String rawQuery, String version,
                               Headers headers, byte[] body,
                               Map<String, String> pathParams, Map<String, List<String>> form) {
        this.method = method;
        this.path = path;
        this.rawQuery = rawQuery;
        this.version = version;
        this.headers = headers;
        this.body = body;
        this.pathParams = pathParams;
        this.form = form;
    }

    /** Shorthand for tests and tools: HTTP/1.1, no headers, no body. */
    public static MinimalHttpRequest of(String method, String target) {
        return new MinimalHttpRequest(method, target, "HTTP/1.1", Headers.empty(), new byte[0]);
    }

    @Override public String method(){ return method; }
    @Override public String path(){ return path; }
    @Override public String rawQuery(){ return rawQuery; }
    @Override public String version(){ return version; }

    @Override
    public String header(String name){
        if (name == null) return null;
        return headers.get(name);
    }

    @Override public Headers headers() { return headers; }
    @Override public byte[] body() { return body; }

    @Override
    public String pathParam(String name) { return pathParams.get(name); }

    @Override
    public HttpRequest withPathParams(Map<String, String> params) {
        return new MinimalHttpRequest(method, path, rawQuery, version, headers, body,
                Map.copyOf(params), form);
    }

    @Override
    public void parseForm() throws FormParseException {
        if (form == null) {
            form = Collections.unmodifiableMap(FormParser.parse(this));
        }
    }

    /** Parsed form values; empty until {@link #parseForm()} succeeded. */
    @Override
    public Map<String, List<String>> form() {
        return form == null ? Map.of() : form;
    }

    @Override
    public String formValue(String name) {
        List<String> values = form().get(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }

    private static String pathOf(String target) {
        if (target == null || target.isEmpty()) return "/";
        int q = target.indexOf('?');
        return q < 0 ? target : target.substring(0, q);
    }

    private static String queryOf(String target) {
        if (target == null) return "";
        int q = target.indexOf('?');
        return q < 0 ? "" : target.substring(q + 1);
    }
}
