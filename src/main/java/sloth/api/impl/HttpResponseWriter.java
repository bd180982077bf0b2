package sloth.api.impl;

import sloth.api.interfaces.http.HttpResponse;
import sloth.domain.model.Headers;

import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;

public final class HttpResponseWriter {

    private HttpResponseWriter() {}

    /**
     * Writes status line, headers and body. HEAD responses keep their
     * Content-Length but carry no body; 1xx, 204 and 304 responses carry
     * neither. CR and LF inside header values are written as spaces.
     */
    public static void write(OutputStream out, HttpResponse res, boolean headRequest) throws IOException {
        Headers headers = res.headers();
        boolean bodyAllowed = bodyAllowedForStatus(res.status());
        if (!headers.contains("Connection")) {
            headers.add("Connection", "close");
        }
        if (!bodyAllowed) {
            headers.remove(Headers.CONTENT_LENGTH);
        } else if (!headers.contains(Headers.CONTENT_LENGTH)) {
            headers.add(Headers.CONTENT_LENGTH, String.valueOf(res.body().length));
        }

        OutputStreamWriter w = new OutputStreamWriter(out, StandardCharsets.US_ASCII);

        w.write("HTTP/1.1 " + res.status() + " " + HttpStatus.reason(res.status()) + "\r\n");

        StringBuilder sb = new StringBuilder();
        headers.forEach((name, value) -> sb.append(name).append(": ").append(singleLine(value)).append("\r\n"));
        w.write(sb.toString());

        w.write("\r\n"); // end headers
        w.flush();

        if (!headRequest && bodyAllowed) {
            out.write(res.body());
        }
        out.flush();
    }

    static boolean bodyAllowedForStatus(int status) {
        return !(status >= 100 && status < 200) && status != HttpStatus.NO_CONTENT && status != HttpStatus.NOT_MODIFIED;
    }

    static String singleLine(String value) {
        if (value == null) return "";
        return value.replace('\r', ' ').replace('\n', ' ');
    }

    public static void write(OutputStream out, HttpResponse res) throws IOException {
        write(out, res, false);
    }
}
