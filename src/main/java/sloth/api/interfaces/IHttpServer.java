package sloth.api.interfaces;

/*
AutoCloseable so a running server can be stopped from another thread
 */
public interface IHttpServer extends AutoCloseable {
    /** Binds the port and serves until closed or the listener fails. */
    void start(int port) throws Exception;
    @Override void close() throws Exception;
}
