package sloth.api.impl;

import org.junit.jupiter.api.Test;

import java.io.BufferedInputStream;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class HttpRequestReaderTest {

    private static BufferedInputStream in(String raw) {
        return new BufferedInputStream(new ByteArrayInputStream(raw.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void readsRequestLineHeadersAndBody() throws Exception {
        String raw = "PUT /items/7?x=1 HTTP/1.1\r\n" +
                "Host: localhost\r\n" +
                "content-type: text/plain\r\n" +
                "Content-Length: 5\r\n\r\n" +
                "hello";

        MinimalHttpRequest req = HttpRequestReader.read(in(raw), new ByteArrayOutputStream());

        assertEquals("PUT", req.method());
        assertEquals("/items/7", req.path());
        assertEquals("x=1", req.rawQuery());
        assertEquals("HTTP/1.1", req.version());
        assertEquals("text/plain", req.header("Content-Type"));
        assertEquals("hello", new String(req.body(), StandardCharsets.UTF_8));
    }

    @Test
    void emptyRequestIsBadRequest() {
        MalformedRequestException e = assertThrows(MalformedRequestException.class,
                () -> HttpRequestReader.read(in("\r\n\r\n"), new ByteArrayOutputStream()));
        assertEquals(400, e.status());
    }

    @Test
    void garbageRequestLineIsBadRequest() {
        assertThrows(MalformedRequestException.class,
                () -> HttpRequestReader.read(in("hello\r\n\r\n"), new ByteArrayOutputStream()));
        assertThrows(MalformedRequestException.class,
                () -> HttpRequestReader.read(in("GET nope HTTP/1.1\r\n\r\n"), new ByteArrayOutputStream()));
    }

    @Test
    void invalidHeaderNameIsBadRequest() {
        MalformedRequestException e = assertThrows(MalformedRequestException.class,
                () -> HttpRequestReader.read(in("GET / HTTP/1.1\r\nBad Name: x\r\n\r\n"), new ByteArrayOutputStream()));
        assertEquals(400, e.status());
    }

    @Test
    void badContentLengthIsBadRequest() {
        MalformedRequestException e = assertThrows(MalformedRequestException.class,
                () -> HttpRequestReader.read(in("POST / HTTP/1.1\r\nContent-Length: ten\r\n\r\n"), new ByteArrayOutputStream()));
        assertEquals(400, e.status());
    }

    @Test
    void hugeBodyIsRefusedUpFront() {
        String raw = "POST / HTTP/1.1\r\nContent-Length: " + (HttpRequestReader.MAX_BODY_BYTES + 1) + "\r\n\r\n";
        MalformedRequestException e = assertThrows(MalformedRequestException.class,
                () -> HttpRequestReader.read(in(raw), new ByteArrayOutputStream()));
        assertEquals(413, e.status());
    }

    @Test
    void truncatedBodyFails() {
        assertThrows(EOFException.class,
                () -> HttpRequestReader.read(in("POST / HTTP/1.1\r\nContent-Length: 10\r\n\r\nabc"), new ByteArrayOutputStream()));
    }

    @Test
    void expectContinueIsAnswered() throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        HttpRequestReader.read(in("POST / HTTP/1.1\r\nExpect: 100-continue\r\nContent-Length: 2\r\n\r\nok"), out);
        assertEquals("HTTP/1.1 100 Continue\r\n\r\n", out.toString(StandardCharsets.US_ASCII));
    }
}
