package sloth.app;

import sloth.api.interfaces.http.HttpRequest;
import sloth.common.ApiConfig;
import sloth.domain.interfaces.DeleteSupported;
import sloth.domain.interfaces.GetSupported;
import sloth.domain.interfaces.PutSupported;
import sloth.domain.model.ResourceResponse;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.LogManager;

/**
 * Small demo API.
 * <ul>
 *   <li>{@code GET /hello[?name=x]} plain text greeting</li>
 *   <li>{@code GET /items} all items as JSON</li>
 *   <li>{@code GET|PUT|DELETE /items/{id}} one item; PUT stores the request body as its value</li>
 * </ul>
 * Usage: {@code HelloServer [port]} (default 4567).
 */
public class HelloServer {

    static final class Hello implements GetSupported {
        @Override
        public ResourceResponse get(HttpRequest request) {
            String name = request.formValue("name");
            return ResourceResponse.text(200, "hello" + (name == null || name.isBlank() ? "" : ", " + name));
        }
    }

    static final class Items implements GetSupported, PutSupported, DeleteSupported {
        private final Map<String, String> items = new ConcurrentHashMap<>();

        @Override
        public ResourceResponse get(HttpRequest request) {
            String id = request.pathParam("id");
            if (id == null) return ResourceResponse.json(200, new TreeMap<>(items));
            String value = items.get(id);
            if (value == null) return ResourceResponse.json(404, Map.of("error", "no item " + id));
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("id", id);
            item.put("value", value);
            return ResourceResponse.json(200, item);
        }

        @Override
        public ResourceResponse put(HttpRequest request) {
            String id = request.pathParam("id");
            String value = new String(request.body(), StandardCharsets.UTF_8).trim();
            boolean created = items.put(id, value) == null;
            return ResourceResponse.status(created ? 201 : 204);
        }

        @Override
        public ResourceResponse delete(HttpRequest request) {
            return ResourceResponse.status(items.remove(request.pathParam("id")) == null ? 404 : 204);
        }
    }

    static Api build(ApiConfig config) {
        Api api = new Api(config);
        api.addResource(new Hello(), "/hello");
        api.addResource(new Items(), "/items", "/items/{id}");
        return api;
    }

    /** Uses the bundled logging.properties unless one is given with -Djava.util.logging.config.file. */
    static void configureLogging() throws IOException {
        if (System.getProperty("java.util.logging.config.file") != null) return;
        try (InputStream in = HelloServer.class.getResourceAsStream("/logging.properties")) {
            if (in != null) LogManager.getLogManager().readConfiguration(in);
        }
    }

    public static void main(String[] args) throws Exception {
        configureLogging();
        int port = args.length > 0 ? Integer.parseInt(args[0]) : 4567;
        build(ApiConfig.fromSystemProperties()).start(port);
    }
}
