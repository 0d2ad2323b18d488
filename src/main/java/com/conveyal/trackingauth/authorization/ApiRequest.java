package com.conveyal.trackingauth.authorization;

import com.conveyal.trackingauth.AuthServerException;
import com.conveyal.trackingauth.util.JsonUtil;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ListMultimap;
import spark.Request;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * An immutable view of an inbound HTTP request, holding everything authorization needs and nothing tied to the
 * servlet container, so the decision logic can be exercised without a running server.
 *
 * Request arguments are looked up in a place that depends on the HTTP method. GET reads the query string, POST and
 * PATCH read the JSON body, and DELETE reads the JSON body when the request carries JSON and the query string
 * otherwise. Path parameters captured by the route table are layered on top and take precedence.
 */
public class ApiRequest {

    /** Bodies without a declared type are only read for arguments up to this size. */
    public static final int MAX_UNTYPED_BODY_BYTES = 1024 * 1024;

    public final String method;
    public final String path;

    /** The path followed by the query string if any, used as the post-login target. */
    public final String url;

    /** Null when the body was not read, see {@link #readsBody}. */
    public final String body;

    private final ListMultimap<String, String> queryParams;
    private final Map<String, String> pathParams;
    // Keys are lower case, header names are case insensitive.
    private final Map<String, String> headers;
    private final Map<String, String> cookies;

    // Set for operations whose arguments travel in the query string whatever the method.
    private final boolean queryArgumentsOnly;

    // Built on first use. Requests are handled on a single thread, so no synchronization.
    private Map<String, JsonNode> arguments;

    private ApiRequest (Builder builder) {
        this.method = builder.method.toUpperCase(Locale.ROOT);
        this.path = builder.path;
        this.url = builder.url != null ? builder.url : builder.path;
        this.body = builder.body;
        this.queryParams = builder.queryParams.build();
        this.pathParams = ImmutableMap.copyOf(builder.pathParams);
        this.headers = ImmutableMap.copyOf(builder.headers);
        this.cookies = ImmutableMap.copyOf(builder.cookies);
        this.queryArgumentsOnly = builder.queryArgumentsOnly;
    }

    /**
     * Capture a Spark request. Query parameters are decoded from the raw query string rather than through the servlet
     * parameter API, which would consume a form-encoded body before it can be read (and forwarded) as bytes. The body
     * itself is only read when it may hold arguments.
     */
    public static ApiRequest from (Request req) {
        Builder builder = builder(req.requestMethod(), req.pathInfo())
                .url(req.queryString() == null ? req.pathInfo() : req.pathInfo() + "?" + req.queryString())
                .queryString(req.queryString());
        if (readsBody(req.contentType(), req.contentLength())) {
            builder.body(req.body());
        }
        for (String header : req.headers()) {
            builder.header(header, req.headers(header));
        }
        req.cookies().forEach(builder::cookie);
        return builder.build();
    }

    /**
     * Whether the body of a request is read to find arguments, which holds it in memory. Only JSON bodies carry
     * arguments. Anything else, artifact uploads in particular, is left unread for the proxy to stream.
     * @param contentLength negative when unknown.
     */
    public static boolean readsBody (String contentType, long contentLength) {
        if (contentType == null) return contentLength >= 0 && contentLength <= MAX_UNTYPED_BODY_BYTES;
        return isJsonContentType(contentType);
    }

    private static boolean isJsonContentType (String contentType) {
        return contentType != null && contentType.toLowerCase(Locale.ROOT).contains("application/json");
    }

    public static Builder builder (String method, String path) {
        return new Builder(method, path);
    }

    /** A copy of this request with additional path parameters, which override same-named request arguments. */
    public ApiRequest withPathParams (Map<String, String> additionalPathParams) {
        if (additionalPathParams.isEmpty()) return this;
        Builder builder = copy();
        builder.pathParams.putAll(additionalPathParams);
        return builder.build();
    }

    /** A copy of this request whose arguments are read from the query string for every HTTP method. */
    public ApiRequest withQueryArguments () {
        if (queryArgumentsOnly) return this;
        Builder builder = copy();
        builder.queryArgumentsOnly = true;
        return builder.build();
    }

    private Builder copy () {
        Builder builder = new Builder(method, path);
        builder.url = url;
        builder.body = body;
        builder.queryParams.putAll(queryParams);
        builder.pathParams.putAll(pathParams);
        builder.headers.putAll(headers);
        builder.cookies.putAll(cookies);
        builder.queryArgumentsOnly = queryArgumentsOnly;
        return builder;
    }

    /**
     * @return the named request argument as text.
     * @throws AuthServerException INVALID_REQUEST when the argument is absent. A missing run_id falls back to
     *         run_uuid, the name older clients send.
     */
    public String param (String name) {
        String value = optionalParam(name);
        if (value == null) {
            if ("run_id".equals(name)) return param("run_uuid");
            throw AuthServerException.missingParameter(name);
        }
        return value;
    }

    /** @return the named request argument as text, or null if it is absent. */
    public String optionalParam (String name) {
        JsonNode node = paramNode(name);
        if (node == null || node.isNull()) return null;
        if (node.isArray()) {
            return node.size() == 0 ? null : node.get(0).asText();
        }
        return node.isValueNode() ? node.asText() : node.toString();
    }

    /**
     * An argument that may carry several values: a JSON array in a body, or a repeated query parameter.
     * @return an empty list when the argument is absent.
     */
    public List<String> paramList (String name) {
        JsonNode node = paramNode(name);
        List<String> values = new ArrayList<>();
        if (node == null || node.isNull()) return values;
        if (node.isArray()) {
            node.forEach(element -> values.add(element.asText()));
        } else {
            values.add(node.asText());
        }
        return values;
    }

    /** @return the raw JSON value of the named argument, or null if it is absent. */
    public JsonNode paramNode (String name) {
        return arguments().get(name);
    }

    public boolean hasParam (String name) {
        return arguments().containsKey(name);
    }

    public String pathParam (String name) {
        return pathParams.get(name);
    }

    public String header (String name) {
        return headers.get(name.toLowerCase(Locale.ROOT));
    }

    public String cookie (String name) {
        return cookies.get(name);
    }

    public boolean isJson () {
        return isJsonContentType(header("Content-Type"));
    }

    public boolean isGet () {
        return "GET".equals(method);
    }

    /** Browsers announce that they accept HTML. Other API clients are answered with status codes instead. */
    public boolean acceptsHtml () {
        String accept = header("Accept");
        return accept != null && accept.contains("text/html");
    }

    /** The body parsed as a JSON object. An empty body is an empty object. */
    public ObjectNode jsonBody () {
        if (body == null || body.isBlank()) return JsonUtil.objectNode();
        return JsonUtil.parseObject(body);
    }

    private Map<String, JsonNode> arguments () {
        if (arguments == null) {
            Map<String, JsonNode> args = new HashMap<>(queryArgumentsOnly ? queryArguments() : methodArguments());
            pathParams.forEach((key, value) -> args.put(key, TextNode.valueOf(value)));
            arguments = args;
        }
        return arguments;
    }

    private Map<String, JsonNode> methodArguments () {
        switch (method) {
            case "GET":
                return queryArguments();
            case "POST":
            case "PATCH":
                return bodyArguments();
            case "DELETE":
                return isJson() ? bodyArguments() : queryArguments();
            default:
                throw AuthServerException.invalidRequest(String.format("Unsupported HTTP method '%s'", method));
        }
    }

    private Map<String, JsonNode> queryArguments () {
        Map<String, JsonNode> args = new HashMap<>();
        for (Map.Entry<String, Collection<String>> entry : queryParams.asMap().entrySet()) {
            Collection<String> values = entry.getValue();
            if (values.size() == 1) {
                args.put(entry.getKey(), TextNode.valueOf(values.iterator().next()));
            } else {
                ArrayNode array = JsonUtil.arrayNode();
                values.forEach(array::add);
                args.put(entry.getKey(), array);
            }
        }
        return args;
    }

    private Map<String, JsonNode> bodyArguments () {
        Map<String, JsonNode> args = new HashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = jsonBody().fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            args.put(field.getKey(), field.getValue());
        }
        return args;
    }

    /** Decode an application/x-www-form-urlencoded string, which is also the format of URL query strings. */
    public static ListMultimap<String, String> parseQueryString (String queryString) {
        ImmutableListMultimap.Builder<String, String> params = ImmutableListMultimap.builder();
        if (queryString == null || queryString.isEmpty()) return params.build();
        for (String pair : queryString.split("&")) {
            if (pair.isEmpty()) continue;
            int equals = pair.indexOf('=');
            String key = equals < 0 ? pair : pair.substring(0, equals);
            String value = equals < 0 ? "" : pair.substring(equals + 1);
            params.put(URLDecoder.decode(key, StandardCharsets.UTF_8), URLDecoder.decode(value, StandardCharsets.UTF_8));
        }
        return params.build();
    }

    @Override
    public String toString () {
        return method + " " + path;
    }

    public static class Builder {

        private final String method;
        private final String path;
        private String url;
        private String body;
        private final ImmutableListMultimap.Builder<String, String> queryParams = ImmutableListMultimap.builder();
        private final Map<String, String> pathParams = new HashMap<>();
        private final Map<String, String> headers = new HashMap<>();
        private final Map<String, String> cookies = new HashMap<>();
        private boolean queryArgumentsOnly;

        private Builder (String method, String path) {
            this.method = checkNotNull(method);
            this.path = checkNotNull(path);
        }

        public Builder url (String url) {
            this.url = url;
            return this;
        }

        public Builder queryParam (String name, String value) {
            queryParams.put(name, value);
            return this;
        }

        public Builder queryString (String queryString) {
            queryParams.putAll(parseQueryString(queryString));
            return this;
        }

        public Builder header (String name, String value) {
            if (value != null) headers.put(name.toLowerCase(Locale.ROOT), value);
            return this;
        }

        public Builder cookie (String name, String value) {
            if (value != null) cookies.put(name, value);
            return this;
        }

        public Builder pathParam (String name, String value) {
            pathParams.put(name, value);
            return this;
        }

        public Builder body (String body) {
            this.body = body;
            return this;
        }

        /** Set a JSON body and the matching content type. */
        public Builder json (JsonNode json) {
            this.body = JsonUtil.toJsonString(json);
            return header("Content-Type", "application/json");
        }

        public ApiRequest build () {
            return new ApiRequest(this);
        }
    }

}
