package sloth.app;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;

public final class NetTestUtils {
    private NetTestUtils() {}

    public static int freePort() throws IOException {
        try (ServerSocket ss = new ServerSocket(0)) { return ss.getLocalPort(); }
    }

    /** Polls until the TCP port is open or times out. */
    public static void waitForPortOpen(String host, int port, long timeoutMs) throws IOException {
        long end = System.currentTimeMillis() + Math.max(0L, timeoutMs);
        IOException last = null;
        while (System.currentTimeMillis() < end) {
            try (Socket s = new Socket()) {
                s.connect(new InetSocketAddress(host, port), 200);
                return; // success
            } catch (IOException e) {
                last = e;
                try { Thread.sleep(50); } catch (InterruptedException ie) { Thread.currentThread().interrupt(); return; }
            }
        }
        if (last != null) throw last;
    }

    /** Sends raw bytes and reads until the server closes the connection. */
    public static String sendRaw(int port, String head, byte[] body) throws IOException {
        try (Socket s = new Socket("localhost", port)) {
            s.setSoTimeout(5000);
            OutputStream out = s.getOutputStream();
            InputStream in = s.getInputStream();
            out.write(head.getBytes(StandardCharsets.UTF_8));
            if (body != null && body.length > 0) out.write(body);
            out.flush();
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    public static String request(int port, String method, String target) throws IOException {
        return sendRaw(port, method + " " + target + " HTTP/1.1\r\nHost: localhost:" + port + "\r\n\r\n", null);
    }

    /** Body after the blank line ending the header block. */
    public static String bodyOf(String response) {
        int i = response.indexOf("\r\n\r\n");
        return i < 0 ? "" : response.substring(i + 4);
    }
}
