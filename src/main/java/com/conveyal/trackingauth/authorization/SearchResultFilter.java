package com.conveyal.trackingauth.authorization;

import com.conveyal.trackingauth.AuthenticatedUser;
import com.conveyal.trackingauth.upstream.ModelRegistryStore;
import com.conveyal.trackingauth.upstream.PagedList;
import com.conveyal.trackingauth.upstream.TrackingStore;
import com.conveyal.trackingauth.util.JsonUtil;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Removes the entries a user may not read from a page of search results, then refills the page from further upstream
 * pages so the client still receives up to the number of results it asked for.
 *
 * The page token returned to the client points just past the last upstream row that was examined. Concatenating all
 * the pages a client receives by following these tokens therefore yields exactly the readable subsequence of the
 * unfiltered result order, with no entry repeated or skipped.
 */
public class SearchResultFilter {

    private static final Logger LOG = LoggerFactory.getLogger(SearchResultFilter.class);

    private final PermissionEvaluator evaluator;
    private final TrackingStore trackingStore;
    private final ModelRegistryStore registryStore;

    public SearchResultFilter (
            PermissionEvaluator evaluator,
            TrackingStore trackingStore,
            ModelRegistryStore registryStore
    ) {
        this.evaluator = evaluator;
        this.trackingStore = trackingStore;
        this.registryStore = registryStore;
    }

    public AfterRequestHandler handlerFor (SearchableResource resource) {
        return (request, user, responseBody) -> filter(resource, request, user, responseBody);
    }

    /** @return the response body unchanged for administrators, otherwise the rewritten body. */
    public String filter (SearchableResource resource, ApiRequest request, AuthenticatedUser user, String responseBody) {
        if (user == null || user.admin) return responseBody;
        SearchQuery query = SearchQuery.fromRequest(request, resource.defaultMaxResults);
        ObjectNode response = JsonUtil.parseObject(responseBody);
        ReadAccess access = evaluator.readAccessFor(resource.resourceType, user.username);
        return JsonUtil.toJsonString(filterPage(resource, query, access, response));
    }

    /** Filter and refill a parsed response in place. */
    ObjectNode filterPage (SearchableResource resource, SearchQuery query, ReadAccess access, ObjectNode response) {
        ArrayNode readable = JsonUtil.arrayNode();
        int removed = 0;
        for (JsonNode item : response.path(resource.resultsField)) {
            if (isReadable(resource, access, item)) {
                readable.add(item);
            } else {
                removed++;
            }
        }
        String token = response.path("next_page_token").asText(null);
        if (token != null && token.isEmpty()) token = null;

        int fetches = 0;
        while (readable.size() < query.maxResults && token != null) {
            PagedList<ObjectNode> batch = resource.fetch(trackingStore, registryStore, query, token);
            fetches++;
            if (batch.isEmpty()) {
                token = null;
                break;
            }
            int offset = PageToken.offsetOf(token);
            int lastIndex = batch.size() - 1;
            boolean filled = false;
            for (int i = 0; i <= lastIndex; i++) {
                ObjectNode item = batch.items.get(i);
                if (!isReadable(resource, access, item)) {
                    removed++;
                    continue;
                }
                readable.add(item);
                if (readable.size() >= query.maxResults) {
                    boolean examinedEverything = batch.isLastPage() && i == lastIndex;
                    token = examinedEverything ? null : resource.pageToken(query, offset + i + 1);
                    filled = true;
                    break;
                }
            }
            if (!filled) {
                token = batch.isLastPage() ? null : resource.pageToken(query, offset + batch.size());
            }
        }
        LOG.debug("Filtered {} search: removed {} unreadable entries, made {} refill requests.",
                resource, removed, fetches);

        if (readable.size() > 0) {
            response.set(resource.resultsField, readable);
        } else {
            response.remove(resource.resultsField);
        }
        if (token != null) {
            response.put("next_page_token", token);
        } else {
            response.remove("next_page_token");
        }
        return response;
    }

    private static boolean isReadable (SearchableResource resource, ReadAccess access, JsonNode item) {
        String key = resource.keyOf(item);
        return key != null && access.canRead(key);
    }

}
