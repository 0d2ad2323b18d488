package com.conveyal.trackingauth.controllers;

import com.conveyal.trackingauth.AuthServerException;
import com.conveyal.trackingauth.authorization.ApiRequest;
import com.conveyal.trackingauth.authorization.RouteTable;
import com.google.common.collect.ImmutableSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import spark.Request;
import spark.Response;
import spark.Route;

import javax.servlet.ServletRequest;
import javax.servlet.ServletRequestWrapper;
import javax.servlet.http.HttpServletRequest;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Forwards every request not answered by another controller to the tracking server, and relays its response. By the
 * time a request gets here it has been authorized, and the response relayed from here is what the after-request
 * handlers (grants for new resources, filtering of search results) operate on.
 *
 * Must be registered after all other controllers, since its catch-all routes would shadow theirs.
 */
public class TrackingProxyController implements HttpController {

    private static final Logger LOG = LoggerFactory.getLogger(TrackingProxyController.class);

    /**
     * Headers never copied in either direction: hop-by-hop headers, headers the HTTP client computes itself, and the
     * caller's credentials, which are meaningless to the tracking server.
     */
    private static final Set<String> EXCLUDED_HEADERS = ImmutableSet.of(
            "authorization", "cookie", "connection", "content-length", "expect", "host", "upgrade",
            "transfer-encoding", "keep-alive", "te", "trailer", "proxy-authorization", "proxy-authenticate",
            "proxy-connection", "set-cookie"
    );

    public interface Config {
        String trackingServerUri ();
    }

    private final String baseUri;
    private final HttpClient httpClient;

    public TrackingProxyController (Config config) {
        String uri = config.trackingServerUri();
        this.baseUri = uri.endsWith("/") ? uri.substring(0, uri.length() - 1) : uri;
        // Redirects are relayed to the caller, not followed.
        this.httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(10))
                .followRedirects(HttpClient.Redirect.NEVER)
                .build();
    }

    @Override
    public void registerEndpoints (spark.Service sparkService) {
        Route proxy = this::proxyRequest;
        for (String path : List.of("/", "/*")) {
            sparkService.get(path, proxy);
            sparkService.post(path, proxy);
            sparkService.put(path, proxy);
            sparkService.patch(path, proxy);
            sparkService.delete(path, proxy);
            sparkService.head(path, proxy);
        }
    }

    /**
     * @return the response body as a String for JSON responses to API operations, so that after-request handlers can
     *         read and rewrite it, and as a stream for everything else (artifacts, pages, images), which Spark copies
     *         to the client without holding it in memory.
     */
    private Object proxyRequest (Request req, Response res) throws IOException {
        String targetUri = baseUri + req.pathInfo() + (req.queryString() == null ? "" : "?" + req.queryString());
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(targetUri))
                .timeout(Duration.ofMinutes(5))
                .method(req.requestMethod(), bodyPublisher(req));
        for (String header : req.headers()) {
            if (!EXCLUDED_HEADERS.contains(header.toLowerCase(Locale.ROOT))) {
                builder.header(header, req.headers(header));
            }
        }
        LOG.debug("Forwarding {} {} to the tracking server", req.requestMethod(), req.pathInfo());
        HttpResponse<InputStream> upstream;
        try {
            upstream = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofInputStream());
        } catch (IOException e) {
            throw AuthServerException.upstream(e, "The tracking server could not be reached.");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw AuthServerException.upstream(e, "Interrupted while waiting for the tracking server.");
        }
        res.status(upstream.statusCode());
        for (Map.Entry<String, List<String>> header : upstream.headers().map().entrySet()) {
            String name = header.getKey();
            String lowerCaseName = name.toLowerCase(Locale.ROOT);
            if (EXCLUDED_HEADERS.contains(lowerCaseName) || "content-type".equals(lowerCaseName)) continue;
            for (String value : header.getValue()) {
                res.raw().addHeader(name, value);
            }
        }
        String contentType = upstream.headers().firstValue("Content-Type").orElse(null);
        if (contentType != null) res.type(contentType);
        if (buffersResponse(req.pathInfo(), contentType)) {
            try (InputStream body = upstream.body()) {
                return new String(body.readAllBytes(), StandardCharsets.UTF_8);
            }
        }
        return upstream.body();
    }

    /**
     * Bodies already read for authorization are forwarded from memory. Any other body is streamed straight from the
     * servlet container, underneath the request wrapper Spark installs, which would otherwise keep a copy of it.
     */
    private static HttpRequest.BodyPublisher bodyPublisher (Request req) {
        long contentLength = req.contentLength();
        if (ApiRequest.readsBody(req.contentType(), contentLength)) {
            byte[] body = req.bodyAsBytes();
            return (body == null || body.length == 0)
                    ? HttpRequest.BodyPublishers.noBody()
                    : HttpRequest.BodyPublishers.ofByteArray(body);
        }
        boolean chunked = req.headers("Transfer-Encoding") != null;
        if (contentLength <= 0 && !chunked) return HttpRequest.BodyPublishers.noBody();
        HttpServletRequest raw = req.raw();
        ServletRequest container = raw instanceof ServletRequestWrapper ? ((ServletRequestWrapper) raw).getRequest() : raw;
        HttpRequest.BodyPublisher stream = HttpRequest.BodyPublishers.ofInputStream(() -> {
            try {
                return container.getInputStream();
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        });
        // Keep the declared length, so the tracking server does not receive a chunked upload.
        return contentLength > 0 ? HttpRequest.BodyPublishers.fromPublisher(stream, contentLength) : stream;
    }

    /** Only JSON answers to API operations are read into memory. Artifacts are streamed whatever their type. */
    static boolean buffersResponse (String path, String contentType) {
        return isJson(contentType) && RouteTable.isApiPath(path) && !RouteTable.isArtifactProxyPath(path);
    }

    static boolean isJson (String contentType) {
        return contentType != null && contentType.toLowerCase(Locale.ROOT).contains("json");
    }

}
