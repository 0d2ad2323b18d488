package com.conveyal.trackingauth.authorization;

import com.conveyal.trackingauth.AuthServerException;
import com.conveyal.trackingauth.util.JsonUtil;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * The arguments of a search request that stay fixed while further pages are fetched: everything except the page
 * token. Refill requests to the tracking server are made with exactly these arguments.
 */
public class SearchQuery {

    public final int maxResults;

    /** Null when the client did not filter. */
    public final String filter;

    /**
     * Order clauses as sent by the client: strings for experiments and registered models, objects for logged models.
     * Null when the client did not specify an order.
     */
    public final ArrayNode orderBy;

    /** Only meaningful for experiment searches. */
    public final String viewType;

    /** Only meaningful for logged model searches. */
    public final List<String> experimentIds;

    public SearchQuery (int maxResults, String filter, ArrayNode orderBy, String viewType, List<String> experimentIds) {
        this.maxResults = maxResults;
        this.filter = (filter == null || filter.isEmpty()) ? null : filter;
        this.orderBy = (orderBy == null || orderBy.size() == 0) ? null : orderBy;
        this.viewType = viewType;
        this.experimentIds = experimentIds == null ? ImmutableList.of() : ImmutableList.copyOf(experimentIds);
    }

    /** Read the search arguments from the request, where they sit according to the usual per-method rules. */
    public static SearchQuery fromRequest (ApiRequest request, int defaultMaxResults) {
        String maxResultsParam = request.optionalParam("max_results");
        int maxResults = defaultMaxResults;
        if (maxResultsParam != null) {
            try {
                maxResults = Integer.parseInt(maxResultsParam);
            } catch (NumberFormatException e) {
                throw AuthServerException.invalidRequest("Invalid value for max_results: " + maxResultsParam);
            }
        }
        if (maxResults <= 0) {
            throw AuthServerException.invalidRequest("max_results must be a positive integer.");
        }
        ArrayNode orderBy = null;
        JsonNode orderByNode = request.paramNode("order_by");
        if (orderByNode != null && !orderByNode.isNull()) {
            if (orderByNode.isArray()) {
                orderBy = (ArrayNode) orderByNode;
            } else {
                orderBy = JsonUtil.arrayNode().add(orderByNode);
            }
        }
        return new SearchQuery(
                maxResults,
                request.optionalParam("filter"),
                orderBy,
                request.optionalParam("view_type"),
                request.paramList("experiment_ids")
        );
    }

}
