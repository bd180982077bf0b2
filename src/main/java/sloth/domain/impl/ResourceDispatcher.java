package sloth.domain.impl;

import sloth.api.interfaces.http.FormParseException;
import sloth.api.impl.HttpStatus;
import sloth.api.interfaces.IHttpHandler;
import sloth.api.interfaces.http.HttpRequest;
import sloth.api.interfaces.http.HttpResponse;
import sloth.common.ApiConfig;
import sloth.domain.interfaces.DeleteSupported;
import sloth.domain.interfaces.GetSupported;
import sloth.domain.interfaces.HeadSupported;
import sloth.domain.interfaces.PatchSupported;
import sloth.domain.interfaces.PostSupported;
import sloth.domain.interfaces.PutSupported;
import sloth.domain.model.Headers;
import sloth.domain.model.ResourceResponse;

import java.util.Objects;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Builds the request handler for one resource.
 * <p>
 * Per request the handler
 * <ol>
 *   <li>parses the form if configured to (400 on malformed input),</li>
 *   <li>picks the resource method for the request's HTTP method (405 if the resource has none),</li>
 *   <li>calls it and encodes the payload (500 if encoding fails),</li>
 *   <li>copies the returned headers, adds the default Content-Type where it applies,
 *       and writes status and body.</li>
 * </ol>
 * The three error answers carry no body and no resource headers.
 * <p>
 * The resource object is shared by every request on its routes, so it has to be
 * stateless or thread-safe.
 */
public final class ResourceDispatcher {

    private static final Logger LOG = Logger.getLogger(ResourceDispatcher.class.getName());

    private final ApiConfig config;
    private final ResponseEncoder encoder;

    public ResourceDispatcher(ApiConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.encoder = new ResponseEncoder(config.defaultContentType());
    }

    public IHttpHandler handlerFor(Object resource) {
        Objects.requireNonNull(resource, "resource");
        return (req, res) -> dispatch(resource, req, res);
    }

    void dispatch(Object resource, HttpRequest req, HttpResponse res) {
        if (config.parseFormByDefault()) {
            try {
                req.parseForm();
            } catch (FormParseException e) {
                LOG.fine(() -> "bad form in " + req.method() + " " + req.path() + ": " + e.getMessage());
                res.status(HttpStatus.BAD_REQUEST);
                return;
            }
        }

        Function<HttpRequest, ResourceResponse> method = capability(resource, req.method());
        if (method == null) {
            LOG.fine(() -> req.method() + " not supported by " + resource.getClass().getName());
            res.status(HttpStatus.METHOD_NOT_ALLOWED);
            return;
        }

        ResourceResponse result = method.apply(req);
        if (result == null) {
            LOG.warning(() -> resource.getClass().getName() + " returned no response for " + req.method() + " " + req.path());
            res.status(HttpStatus.INTERNAL_SERVER_ERROR);
            return;
        }

        ResponseEncoder.EncodedBody body;
        try {
            body = encoder.encode(result.payload());
        } catch (ResponseEncodingException e) {
            LOG.log(Level.WARNING, "encoding failed for " + req.method() + " " + req.path(), e);
            res.status(HttpStatus.INTERNAL_SERVER_ERROR);
            return;
        }

        Headers headers = result.headers().copy();
        encoder.applyDefaultContentType(body, headers);
        headers.forEach(res::header);
        res.status(result.status());
        res.body(body.bytes());
    }

    /**
     * The resource method serving {@code httpMethod}, or null when the resource
     * does not implement it or the method is not one of the six supported verbs.
     */
    static Function<HttpRequest, ResourceResponse> capability(Object resource, String httpMethod) {
        if (httpMethod == null) return null;
        return switch (httpMethod) {
            case "GET" -> resource instanceof GetSupported r ? r::get : null;
            case "POST" -> resource instanceof PostSupported r ? r::post : null;
            case "PUT" -> resource instanceof PutSupported r ? r::put : null;
            case "DELETE" -> resource instanceof DeleteSupported r ? r::delete : null;
            case "HEAD" -> resource instanceof HeadSupported r ? r::head : null;
            case "PATCH" -> resource instanceof PatchSupported r ? r::patch : null;
            default -> null;
        };
    }
}
