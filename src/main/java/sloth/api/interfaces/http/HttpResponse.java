package sloth.api.interfaces.http;

import sloth.domain.model.Headers;

/** Minimal response contract */
public interface HttpResponse {
    void status(int code);
    int status();

    /** Adds a value; earlier values for the same name are kept. */
    void header(String name, String value);
    Headers headers();

    void body(byte[] bytes);
    void body(String text);
    byte[] body();
}
