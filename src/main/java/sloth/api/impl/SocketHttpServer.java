package sloth.api.impl;

import sloth.api.interfaces.IHttpHandler;
import sloth.api.interfaces.IHttpServer;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * HTTP/1.1 server on a plain {@link ServerSocket}.
 * <p>
 * Every accepted connection gets its own thread and carries exactly one
 * request; the response always closes the connection. Anything the handler
 * throws becomes an empty 500 response, and the accept loop keeps running.
 */
public final class SocketHttpServer implements IHttpServer {

    private static final Logger LOG = Logger.getLogger(SocketHttpServer.class.getName());

    /** How long a connection may stay silent while its request is read. */
    public static final int DEFAULT_READ_TIMEOUT_MS = 30_000;

    private final IHttpHandler handler;
    private final int readTimeoutMs;
    private final AtomicLong connections = new AtomicLong();
    private volatile ServerSocket serverSocket;
    private volatile boolean closed;

    public SocketHttpServer(IHttpHandler handler) {
        this(handler, DEFAULT_READ_TIMEOUT_MS);
    }

    public SocketHttpServer(IHttpHandler handler, int readTimeoutMs) {
        if (readTimeoutMs <= 0) throw new IllegalArgumentException("readTimeoutMs must be positive: " + readTimeoutMs);
        this.handler = Objects.requireNonNull(handler, "handler");
        this.readTimeoutMs = readTimeoutMs;
    }

    /**
     * Binds {@code port} and serves until {@link #close()} is called.
     *
     * @throws IOException if the port cannot be bound or accepting fails
     *                     while the server is still open
     */
    @Override
    public void start(int port) throws IOException {
        if (serverSocket != null) throw new IllegalStateException("server already started");
        try (ServerSocket ss = new ServerSocket()) {
            ss.setReuseAddress(true);
            ss.bind(new InetSocketAddress(port));
            serverSocket = ss;
            if (closed) return;
            LOG.info(() -> "listening on port " + ss.getLocalPort());

            while (true) {
                Socket s;
                try {
                    s = ss.accept();
                } catch (IOException e) {
                    if (closed) {
                        LOG.info("listener closed");
                        return;
                    }
                    throw e;
                }
                try {
                    s.setSoTimeout(readTimeoutMs);
                } catch (SocketException e) {
                    LOG.fine(() -> "dropping connection: " + e.getMessage());
                    s.close();
                    continue;
                }
                Thread t = new Thread(() -> handle(s), "sloth-conn-" + connections.incrementAndGet());
                t.setDaemon(true);
                t.start();
            }
        }
    }

    /** Local port once bound, -1 before. */
    public int port() {
        ServerSocket ss = serverSocket;
        return ss == null ? -1 : ss.getLocalPort();
    }

    @Override
    public void close() throws IOException {
        closed = true;
        ServerSocket ss = serverSocket;
        if (ss != null) ss.close();
    }

    /** Reads one request, runs the handler, writes the response. */
    void handle(Socket s) {
        try (s; BufferedInputStream in = new BufferedInputStream(s.getInputStream());
             OutputStream out = s.getOutputStream()) {

            MinimalHttpRequest req;
            try {
                req = HttpRequestReader.read(in, out);
            } catch (MalformedRequestException e) {
                LOG.fine(() -> "rejected request: " + e.getMessage());
                HttpResponseImpl rejected = new HttpResponseImpl();
                rejected.status(e.status());
                HttpResponseWriter.write(out, rejected);
                return;
            }

            HttpResponseImpl res = new HttpResponseImpl();
            try {
                handler.handle(req, res);
            } catch (Exception e) {
                LOG.log(Level.WARNING, "handler failed for " + req.method() + " " + req.path(), e);
                res = new HttpResponseImpl();
                res.status(HttpStatus.INTERNAL_SERVER_ERROR);
            }

            HttpResponseWriter.write(out, res, "HEAD".equals(req.method()));

        } catch (SocketTimeoutException te) {
            LOG.fine(() -> "closing idle connection after " + readTimeoutMs + " ms");
        } catch (SocketException se) {
            if (!isClientDisconnect(se)) {
                LOG.warning("socket error: " + se.getMessage());
            }
        } catch (IOException e) {
            LOG.warning("connection error: " + e.getMessage());
        }
    }

    private static boolean isClientDisconnect(SocketException se) {
        String msg = String.valueOf(se.getMessage()).toLowerCase(Locale.ROOT);
        return msg.contains("connection reset") || msg.contains("broken pipe")
                || msg.contains("socket write error") || msg.contains("software caused connection abort");
    }
}
