package sloth.api.impl;

import sloth.api.interfaces.http.HttpResponse;
import sloth.domain.model.Headers;

import java.nio.charset.StandardCharsets;

public class HttpResponseImpl implements HttpResponse {
    private int status = 200;
    private final Headers headers = new Headers();
    private byte[] body = new byte[0];

    @Override
    public void status(int code) {
        this.status = code;
    }

    @Override
    public void header(String name, String value) {
        headers.add(name, value);
    }

    @Override
    public void body(byte[] bytes) {
        this.body = bytes == null ? new byte[0] : bytes;
    }

    @Override
    public void body(String text) {
        this.body = text == null ? new byte[0] : text.getBytes(StandardCharsets.UTF_8);
    }

    // getters used by writer
    @Override public int status() { return status; }
    @Override public Headers headers() { return headers; }
    @Override public byte[] body() { return body; }
}
