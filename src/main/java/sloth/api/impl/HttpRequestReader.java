package sloth.api.impl;

import sloth.domain.model.Headers;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;

/**
 * Reads one HTTP/1.1 request: request line, header block and a
 * Content-Length delimited body. Chunked bodies are not supported.
 */
public final class HttpRequestReader {

    /** Bodies above this size are refused with 413 before being read. */
    public static final int MAX_BODY_BYTES = 32 << 20;

    private HttpRequestReader() {}

    public static MinimalHttpRequest read(BufferedInputStream in, OutputStream out)
            throws IOException, MalformedRequestException {
        String start = readLineAscii(in); // e.g. "GET /items/1?x=y HTTP/1.1"
        if (start == null || start.isEmpty()) {
            throw new MalformedRequestException(HttpStatus.BAD_REQUEST, "empty request line");
        }
        String[] p = start.split(" ");
        if (p.length < 2 || p[0].isEmpty() || !p[1].startsWith("/")) {
            throw new MalformedRequestException(HttpStatus.BAD_REQUEST, "malformed request line: " + start);
        }
        String method = p[0];
        String target = p[1];
        String ver    = p.length > 2 ? p[2] : "HTTP/1.1";

        Headers headers = new Headers();
        String line;
        while ((line = readLineAscii(in)) != null && !line.isEmpty()) {
            int idx = line.indexOf(':');
            if (idx <= 0) {
                throw new MalformedRequestException(HttpStatus.BAD_REQUEST, "malformed header line: " + line);
            }
            String name = line.substring(0, idx).trim();
            if (!Headers.isValidName(name)) {
                throw new MalformedRequestException(HttpStatus.BAD_REQUEST, "malformed header name: " + name);
            }
            headers.add(name, line.substring(idx + 1).trim());
        }

        int len = contentLength(headers);
        if (len > MAX_BODY_BYTES) {
            throw new MalformedRequestException(HttpStatus.PAYLOAD_TOO_LARGE, "body of " + len + " bytes");
        }

        String expect = headers.get("Expect");
        if (len > 0 && expect != null && expect.equalsIgnoreCase("100-continue")) {
            OutputStreamWriter w100 = new OutputStreamWriter(out, StandardCharsets.US_ASCII);
            w100.write("HTTP/1.1 100 Continue\r\n\r\n");
            w100.flush();
        }

        byte[] body = new byte[len];
        int total = 0;
        while (total < len) {
            int n = in.read(body, total, len - total);
            if (n < 0) throw new EOFException("body ended after " + total + " of " + len + " bytes");
            total += n;
        }

        return new MinimalHttpRequest(method, target, ver, headers, body);
    }

    static int contentLength(Headers headers) throws MalformedRequestException {
        String raw = headers.get(Headers.CONTENT_LENGTH);
        if (raw == null || raw.isEmpty()) return 0;
        try {
            int len = Integer.parseInt(raw.trim());
            if (len < 0) throw new MalformedRequestException(HttpStatus.BAD_REQUEST, "negative Content-Length");
            return len;
        } catch (NumberFormatException e) {
            throw new MalformedRequestException(HttpStatus.BAD_REQUEST, "bad Content-Length: " + raw);
        }
    }

    /** Reads up to CRLF; returns null at end of stream with nothing read. */
    static String readLineAscii(BufferedInputStream in) throws IOException {
        ByteArrayOutputStream buf = new ByteArrayOutputStream(128);
        int prev = -1, b;
        while ((b = in.read()) != -1) {
            if (prev == '\r' && b == '\n') {
                byte[] bytes = buf.toByteArray();
                int len = Math.max(0, bytes.length - 1);
                return new String(bytes, 0, len, StandardCharsets.US_ASCII);
            }
            buf.write(b);
            prev = b;
        }
        return (buf.size() == 0) ? null : buf.toString(StandardCharsets.US_ASCII);
    }
}
