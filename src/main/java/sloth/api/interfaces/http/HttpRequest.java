package sloth.api.interfaces.http;

import sloth.domain.model.Headers;

import java.util.List;
import java.util.Map;

/** Minimal request contract */
public interface HttpRequest {
    String method();
    /** Path without the query string. */
    String path();
    /** Query string without the leading '?', empty if there is none. */
    String rawQuery();
    String version();

    String header(String name);
    Headers headers();
    byte[] body();

    /** Value captured by a {@code {name}} route segment, or null. */
    String pathParam(String name);
    HttpRequest withPathParams(Map<String, String> params);

    // form handling, populated by parseForm()
    void parseForm() throws FormParseException;
    Map<String, List<String>> form();
    String formValue(String name);
}
