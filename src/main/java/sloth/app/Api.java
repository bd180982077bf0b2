package sloth.app;

import sloth.api.impl.SocketHttpServer;
import sloth.api.impl.handlers.PathRouter;
import sloth.api.interfaces.IHttpHandler;
import sloth.api.interfaces.IRouter;
import sloth.common.ApiConfig;
import sloth.common.WriteOnce;
import sloth.domain.impl.ResourceDispatcher;

import java.io.IOException;
import java.util.Objects;
import java.util.function.UnaryOperator;
import java.util.logging.Logger;

/**
 * A group of resources served together.
 * <p>
 * Requests matching one of a resource's paths are routed to the resource
 * method for the request's HTTP method, and the returned payload is written
 * as the response. Separate {@code Api} instances can serve separate sets of
 * resources on separate ports.
 * <p>
 * Setup ({@link #setRouter}, {@link #addResource}) is single-threaded and must
 * finish before {@link #start(int)}.
 *
 * <pre>{@code
 * Api api = new Api();
 * api.addResource(new HelloResource(), "/hello");
 * api.start(4567);
 * }</pre>
 */
public final class Api {

    private static final Logger LOG = Logger.getLogger(Api.class.getName());

    private final ApiConfig config;
    private final ResourceDispatcher dispatcher;
    private final WriteOnce<IRouter> router = new WriteOnce<>(RouterAlreadyInitializedException::new);
    private volatile SocketHttpServer server;

    public Api() {
        this(ApiConfig.defaults());
    }

    public Api(ApiConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.dispatcher = new ResourceDispatcher(config);
    }

    public ApiConfig config() { return config; }

    /** The router in use; a {@link PathRouter} is created on first call if none was set. */
    public IRouter router() {
        return router.getOrSet(PathRouter::new);
    }

    /**
     * Installs a custom router.
     *
     * @throws RouterAlreadyInitializedException if a router exists already, including
     *         the default one created by {@link #router()} or {@link #addResource}
     */
    public void setRouter(IRouter custom) {
        router.set(custom);
    }

    /** Routes each of {@code paths} to {@code resource}. */
    public void addResource(Object resource, String... paths) {
        addResourceWithWrapper(resource, UnaryOperator.identity(), paths);
    }

    /**
     * Like {@link #addResource} but passes the generated handler through
     * {@code wrapper} before binding it, e.g. to add compression or auth.
     */
    public void addResourceWithWrapper(Object resource, UnaryOperator<IHttpHandler> wrapper, String... paths) {
        Objects.requireNonNull(wrapper, "wrapper");
        // the router is created only once a path gets bound
        for (String path : paths) {
            router().bind(path, wrapper.apply(dispatcher.handlerFor(resource)));
        }
    }

    /**
     * Serves on {@code port} until the listener fails or {@link #stop()} is called.
     *
     * @throws NoResourceRegisteredException if neither a resource nor a router was set up
     * @throws IOException                   if the port cannot be bound or the listener fails
     */
    public void start(int port) throws IOException {
        if (!router.isSet()) throw new NoResourceRegisteredException();
        SocketHttpServer s = new SocketHttpServer(router.get());
        server = s;
        LOG.info(() -> "starting API on port " + port);
        s.start(port);
    }

    /** Stops a running {@link #start(int)}; does nothing if the API is not serving. */
    public void stop() throws IOException {
        SocketHttpServer s = server;
        if (s != null) s.close();
    }
}
