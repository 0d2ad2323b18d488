package com.conveyal.trackingauth.authorization;

import com.conveyal.trackingauth.upstream.ModelRegistryStore;
import com.conveyal.trackingauth.upstream.PagedList;
import com.conveyal.trackingauth.upstream.TrackingStore;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * The families of search results that are filtered down to what the caller may read. Each one knows where its items
 * sit in a response, which resource governs an item, and how to fetch further pages from the tracking server.
 */
public enum SearchableResource {

    EXPERIMENTS ("experiments", ResourceType.EXPERIMENT, 1000) {
        @Override
        String keyOf (JsonNode item) {
            return item.path("experiment_id").asText(null);
        }

        @Override
        PagedList<ObjectNode> fetch (TrackingStore tracking, ModelRegistryStore registry, SearchQuery query,
                                     String pageToken) {
            return tracking.searchExperiments(query, pageToken);
        }
    },

    /** Logged models are governed by their experiment, found in their info block. */
    LOGGED_MODELS ("models", ResourceType.EXPERIMENT, 100) {
        @Override
        String keyOf (JsonNode item) {
            return item.path("info").path("experiment_id").asText(null);
        }

        @Override
        PagedList<ObjectNode> fetch (TrackingStore tracking, ModelRegistryStore registry, SearchQuery query,
                                     String pageToken) {
            return tracking.searchLoggedModels(query, pageToken);
        }

        @Override
        String pageToken (SearchQuery query, int offset) {
            return PageToken.encodeWithQuery(offset, query);
        }
    },

    REGISTERED_MODELS ("registered_models", ResourceType.REGISTERED_MODEL, 100) {
        @Override
        String keyOf (JsonNode item) {
            return item.path("name").asText(null);
        }

        @Override
        PagedList<ObjectNode> fetch (TrackingStore tracking, ModelRegistryStore registry, SearchQuery query,
                                     String pageToken) {
            return registry.searchRegisteredModels(query, pageToken);
        }
    };

    /** The name of the array holding the results in a search response. */
    public final String resultsField;

    public final ResourceType resourceType;

    /** The page size the tracking server uses when the client does not ask for one. */
    public final int defaultMaxResults;

    SearchableResource (String resultsField, ResourceType resourceType, int defaultMaxResults) {
        this.resultsField = resultsField;
        this.resourceType = resourceType;
        this.defaultMaxResults = defaultMaxResults;
    }

    /** @return the key of the resource governing the item, or null if the item does not carry one. */
    abstract String keyOf (JsonNode item);

    abstract PagedList<ObjectNode> fetch (TrackingStore tracking, ModelRegistryStore registry, SearchQuery query,
                                          String pageToken);

    String pageToken (SearchQuery query, int offset) {
        return PageToken.encode(offset);
    }

}
