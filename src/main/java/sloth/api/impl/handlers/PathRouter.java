package sloth.api.impl.handlers;

import sloth.api.interfaces.IHttpHandler;
import sloth.api.interfaces.IRouter;
import sloth.api.interfaces.http.HttpRequest;
import sloth.api.interfaces.http.HttpResponse;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Default router. Patterns are matched segment by segment:
 * <ul>
 *   <li>{@code /items} matches exactly that path,</li>
 *   <li>{@code /items/{id}} captures one non-empty segment as path parameter {@code id},</li>
 *   <li>{@code /static/*} matches {@code /static} and everything below it.</li>
 * </ul>
 * Routes are tried in the order they were bound; binding a pattern again
 * replaces its handler in place. Unmatched requests go to {@link NotFoundHandler}.
 */
public class PathRouter implements IRouter {

    private final List<Route> routes = new CopyOnWriteArrayList<>();
    private final IHttpHandler notFound;

    public PathRouter() {
        this(new NotFoundHandler());
    }

    public PathRouter(IHttpHandler notFound) {
        this.notFound = Objects.requireNonNull(notFound, "notFound");
    }

    @Override
    public void bind(String pattern, IHttpHandler handler) {
        Objects.requireNonNull(handler, "handler");
        Route route = Route.compile(pattern, handler);
        for (int i = 0; i < routes.size(); i++) {
            if (routes.get(i).pattern().equals(pattern)) {
                routes.set(i, route);
                return;
            }
        }
        routes.add(route);
    }

    @Override
    public void handle(HttpRequest req, HttpResponse res) throws Exception {
        for (Route route : routes) {
            Map<String, String> params = route.match(req.path());
            if (params != null) {
                route.handler().handle(params.isEmpty() ? req : req.withPathParams(params), res);
                return;
            }
        }
        notFound.handle(req, res);
    }

    /** Patterns bound so far, in matching order. */
    public List<String> patterns() {
        return routes.stream().map(Route::pattern).toList();
    }

    private record Route(String pattern, String[] segments, boolean prefix, IHttpHandler handler) {

        static Route compile(String pattern, IHttpHandler handler) {
            if (pattern == null || !pattern.startsWith("/")) {
                throw new IllegalArgumentException("route pattern must start with '/': " + pattern);
            }
            boolean prefix = pattern.endsWith("/*");
            String body = prefix ? pattern.substring(0, pattern.length() - 2) : pattern;
            String[] segments = body.isEmpty() ? new String[0] : split(body);
            for (String s : segments) {
                if (s.equals("{}")) throw new IllegalArgumentException("empty parameter name in " + pattern);
                if (s.contains("*")) throw new IllegalArgumentException("'*' is only allowed as last segment: " + pattern);
            }
            return new Route(pattern, segments, prefix, handler);
        }

        /** Captured parameters on a match, null otherwise. */
        Map<String, String> match(String path) {
            String[] parts = split(path);
            if (prefix ? parts.length < segments.length : parts.length != segments.length) {
                return null;
            }
            Map<String, String> params = new LinkedHashMap<>();
            for (int i = 0; i < segments.length; i++) {
                String seg = segments[i];
                if (isParam(seg)) {
                    if (parts[i].isEmpty()) return null;
                    params.put(seg.substring(1, seg.length() - 1), parts[i]);
                } else if (!seg.equals(parts[i])) {
                    return null;
                }
            }
            return params;
        }

        private static boolean isParam(String seg) {
            return seg.length() > 2 && seg.startsWith("{") && seg.endsWith("}");
        }

        // "/a/b" -> [a, b], "/" -> [""], "/a/" -> [a, ""]
        private static String[] split(String path) {
            return path.substring(1).split("/", -1);
        }
    }
}
