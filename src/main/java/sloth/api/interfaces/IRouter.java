package sloth.api.interfaces;

/**
 * Path-to-handler table. Serving a request means finding the bound handler
 * for its path and calling it.
 */
public interface IRouter extends IHttpHandler {
    void bind(String pattern, IHttpHandler handler);
}
