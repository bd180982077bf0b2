package sloth.api.impl.handlers;

import org.junit.jupiter.api.Test;
import sloth.api.impl.HttpResponseImpl;
import sloth.api.impl.MinimalHttpRequest;
import sloth.api.interfaces.IHttpHandler;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PathRouterTest {

    private static IHttpHandler says(String text) {
        return (req, res) -> res.body(text);
    }

    private static String route(PathRouter router, String target) throws Exception {
        HttpResponseImpl res = new HttpResponseImpl();
        router.handle(MinimalHttpRequest.of("GET", target), res);
        return res.status() + " " + new String(res.body(), StandardCharsets.UTF_8);
    }

    @Test
    void exactPathsMatchIgnoringQuery() throws Exception {
        PathRouter r = new PathRouter();
        r.bind("/", says("root"));
        r.bind("/items", says("items"));

        assertEquals("200 root", route(r, "/"));
        assertEquals("200 items", route(r, "/items?page=2"));
        assertEquals("404 ", route(r, "/items/"));
        assertEquals("404 ", route(r, "/other"));
    }

    @Test
    void placeholdersCapturePathParams() throws Exception {
        PathRouter r = new PathRouter();
        r.bind("/users/{user}/items/{id}", (req, res) -> res.body(req.pathParam("user") + ":" + req.pathParam("id")));

        assertEquals("200 ada:42", route(r, "/users/ada/items/42"));
        assertEquals("404 ", route(r, "/users//items/42"));
        assertEquals("404 ", route(r, "/users/ada/items"));
    }

    @Test
    void starMatchesTheWholeSubtree() throws Exception {
        PathRouter r = new PathRouter();
        r.bind("/static/*", says("static"));

        assertEquals("200 static", route(r, "/static"));
        assertEquals("200 static", route(r, "/static/css/site.css"));
        assertEquals("404 ", route(r, "/statics"));
    }

    @Test
    void firstBoundRouteWinsAndRebindReplacesInPlace() throws Exception {
        PathRouter r = new PathRouter();
        r.bind("/items/new", says("form"));
        r.bind("/items/{id}", says("item"));
        r.bind("/items/new", says("form v2"));

        assertEquals("200 form v2", route(r, "/items/new"));
        assertEquals("200 item", route(r, "/items/3"));
        assertEquals(List.of("/items/new", "/items/{id}"), r.patterns());
    }

    @Test
    void customNotFoundHandlerIsUsed() throws Exception {
        PathRouter r = new PathRouter((req, res) -> { res.status(410); res.body("gone"); });
        assertEquals("410 gone", route(r, "/anything"));
    }

    @Test
    void badPatternsAreRejected() {
        PathRouter r = new PathRouter();
        assertThrows(IllegalArgumentException.class, () -> r.bind("items", says("x")));
        assertThrows(IllegalArgumentException.class, () -> r.bind("/items/{}", says("x")));
        assertThrows(IllegalArgumentException.class, () -> r.bind("/a/*/b", says("x")));
        assertThrows(NullPointerException.class, () -> r.bind("/a", null));
    }
}
