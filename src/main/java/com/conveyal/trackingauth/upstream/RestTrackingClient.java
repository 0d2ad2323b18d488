package com.conveyal.trackingauth.upstream;

import com.conveyal.trackingauth.AuthServerException;
import com.conveyal.trackingauth.authorization.SearchQuery;
import com.conveyal.trackingauth.util.HttpStatus;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static com.conveyal.trackingauth.util.JsonUtil.objectMapper;
import static com.conveyal.trackingauth.util.JsonUtil.objectNode;
import static com.conveyal.trackingauth.util.JsonUtil.parseObject;
import static com.conveyal.trackingauth.util.JsonUtil.toJsonString;

/**
 * Reads from the tracking server over its own REST API, using Java's built-in HTTP client. These calls go straight to
 * the tracking server and never pass back through the authorization layer.
 */
public class RestTrackingClient implements TrackingStore, ModelRegistryStore {

    private static final Logger LOG = LoggerFactory.getLogger(RestTrackingClient.class);

    private static final String API_PREFIX = "/api/2.0/mlflow";

    public interface Config {
        String trackingServerUri ();
    }

    private final String baseUri;
    private final HttpClient httpClient;

    public RestTrackingClient (Config config) {
        this(config, HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build());
    }

    public RestTrackingClient (Config config, HttpClient httpClient) {
        String uri = config.trackingServerUri();
        this.baseUri = uri.endsWith("/") ? uri.substring(0, uri.length() - 1) : uri;
        this.httpClient = httpClient;
        LOG.info("Tracking server requests will be sent to {}.", baseUri);
    }

    @Override
    public Experiment getExperiment (String experimentId) {
        ObjectNode response = get("/experiments/get?experiment_id=" + encode(experimentId));
        return convert(response.get("experiment"), Experiment.class);
    }

    @Override
    public Experiment getExperimentByName (String name) {
        try {
            ObjectNode response = get("/experiments/get-by-name?experiment_name=" + encode(name));
            return convert(response.get("experiment"), Experiment.class);
        } catch (AuthServerException e) {
            if (e.isNotFound()) return null;
            throw e;
        }
    }

    @Override
    public Run getRun (String runId) {
        ObjectNode response = get("/runs/get?run_id=" + encode(runId));
        return convert(response.get("run"), Run.class);
    }

    @Override
    public LoggedModel getLoggedModel (String modelId) {
        ObjectNode response = get("/logged-models/" + encode(modelId));
        return convert(response.get("model"), LoggedModel.class);
    }

    @Override
    public TraceInfo getTraceInfo (String requestId) {
        ObjectNode response = get("/traces/" + encode(requestId) + "/info");
        return convert(response.get("trace_info"), TraceInfo.class);
    }

    @Override
    public PagedList<ObjectNode> searchExperiments (SearchQuery query, String pageToken) {
        ObjectNode body = objectNode();
        body.put("max_results", query.maxResults);
        if (query.filter != null) body.put("filter", query.filter);
        if (query.viewType != null) body.put("view_type", query.viewType);
        if (query.orderBy != null) body.set("order_by", query.orderBy);
        if (pageToken != null) body.put("page_token", pageToken);
        return pagedList(post("/experiments/search", body), "experiments");
    }

    @Override
    public PagedList<ObjectNode> searchLoggedModels (SearchQuery query, String pageToken) {
        ObjectNode body = objectNode();
        ArrayNode experimentIds = body.putArray("experiment_ids");
        query.experimentIds.forEach(experimentIds::add);
        body.put("max_results", query.maxResults);
        if (query.filter != null) body.put("filter", query.filter);
        if (query.orderBy != null) body.set("order_by", query.orderBy);
        if (pageToken != null) body.put("page_token", pageToken);
        return pagedList(post("/logged-models/search", body), "models");
    }

    @Override
    public PagedList<ObjectNode> searchRegisteredModels (SearchQuery query, String pageToken) {
        // The registry only accepts GET for this endpoint, so the query travels in the URL.
        StringBuilder path = new StringBuilder("/registered-models/search?max_results=").append(query.maxResults);
        if (query.filter != null) path.append("&filter=").append(encode(query.filter));
        if (query.orderBy != null) {
            for (JsonNode clause : query.orderBy) {
                path.append("&order_by=").append(encode(clause.asText()));
            }
        }
        if (pageToken != null) path.append("&page_token=").append(encode(pageToken));
        return pagedList(get(path.toString()), "registered_models");
    }

    @Override
    public String createExperiment (String name) {
        ObjectNode response = post("/experiments/create", objectNode().put("name", name));
        return response.path("experiment_id").asText();
    }

    @Override
    public void deleteExperiment (String experimentId) {
        post("/experiments/delete", objectNode().put("experiment_id", experimentId));
    }

    private ObjectNode get (String path) {
        return send(HttpRequest.newBuilder().GET().uri(URI.create(baseUri + API_PREFIX + path)));
    }

    private ObjectNode post (String path, ObjectNode body) {
        return send(HttpRequest.newBuilder()
                .POST(HttpRequest.BodyPublishers.ofString(toJsonString(body), StandardCharsets.UTF_8))
                .header("Content-Type", "application/json")
                .uri(URI.create(baseUri + API_PREFIX + path)));
    }

    private ObjectNode send (HttpRequest.Builder requestBuilder) {
        HttpRequest request = requestBuilder.timeout(Duration.ofSeconds(60)).build();
        LOG.debug("Tracking server request {} {}", request.method(), request.uri());
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw AuthServerException.upstream(e, "Could not reach the tracking server.");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw AuthServerException.upstream(e, "Interrupted while waiting for the tracking server.");
        }
        int status = response.statusCode();
        if (status >= HttpStatus.BAD_REQUEST_400) {
            String message = errorMessage(response.body());
            if (status == HttpStatus.NOT_FOUND_404) throw AuthServerException.notFound(message);
            if (status == HttpStatus.BAD_REQUEST_400) throw AuthServerException.invalidRequest(message);
            LOG.warn("Tracking server answered {} {} with status {}: {}", request.method(), request.uri(), status, message);
            throw new AuthServerException(AuthServerException.Type.UPSTREAM, message, HttpStatus.BAD_GATEWAY_502);
        }
        String body = response.body();
        return (body == null || body.isBlank()) ? objectNode() : parseObject(body);
    }

    /** The tracking server reports errors as {"error_code": ..., "message": ...}. */
    private static String errorMessage (String body) {
        try {
            JsonNode json = objectMapper.readTree(body);
            if (json != null && json.hasNonNull("message")) return json.get("message").asText();
        } catch (IOException e) {
            LOG.debug("Tracking server error body is not JSON: {}", body);
        }
        return body == null || body.isBlank() ? "Tracking server request failed." : body;
    }

    private static PagedList<ObjectNode> pagedList (ObjectNode response, String arrayField) {
        List<ObjectNode> items = new ArrayList<>();
        for (JsonNode item : response.path(arrayField)) {
            if (item.isObject()) items.add((ObjectNode) item);
        }
        return new PagedList<>(items, response.path("next_page_token").asText(null));
    }

    private static <T> T convert (JsonNode node, Class<T> type) {
        if (node == null || node.isNull()) {
            throw AuthServerException.internal("Tracking server response is missing the expected entity.");
        }
        return objectMapper.convertValue(node, type);
    }

    private static String encode (String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

}
