package com.conveyal.trackingauth.authorization;

import com.conveyal.trackingauth.AuthenticatedUser;
import com.conveyal.trackingauth.persistence.InMemoryPermissionStore;
import com.conveyal.trackingauth.upstream.FakeTrackingStore;
import com.conveyal.trackingauth.util.JsonUtil;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.lessThanOrEqualTo;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class SearchResultFilterTest {

    private final InMemoryPermissionStore store = new InMemoryPermissionStore();
    private final FakeTrackingStore tracking = new FakeTrackingStore();

    private SearchResultFilter filterWithDefault (Permission defaultPermission) {
        return new SearchResultFilter(new PermissionEvaluator(store, () -> defaultPermission), tracking, tracking);
    }

    private ReadAccess readAccess (Permission defaultPermission, ResourceType type, String username) {
        return new PermissionEvaluator(store, () -> defaultPermission).readAccessFor(type, username);
    }

    @Test
    public void hidesExperimentsTheUserMayNotRead () {
        store.createUser("alice", "password1", false);
        tracking.withExperiment("1", "visible").withExperiment("2", "hidden");
        store.createPermission(ResourceKey.experiment("2"), "alice", Permission.NO_PERMISSIONS);

        SearchQuery query = new SearchQuery(10, null, null, null, null);
        ObjectNode response = FakeTrackingStore.response("experiments", tracking.searchExperiments(query, null));
        ObjectNode filtered = filterWithDefault(Permission.READ).filterPage(SearchableResource.EXPERIMENTS, query,
                readAccess(Permission.READ, ResourceType.EXPERIMENT, "alice"), response);

        assertEquals(1, filtered.get("experiments").size());
        assertEquals("1", filtered.get("experiments").get(0).get("experiment_id").asText());
        assertFalse(filtered.has("next_page_token"));
    }

    @Test
    public void grantsOverrideARestrictiveDefault () {
        store.createUser("bob", "password1", false);
        tracking.withRegisteredModel("a").withRegisteredModel("b").withRegisteredModel("c");
        store.createPermission(ResourceKey.registeredModel("b"), "bob", Permission.READ);

        SearchQuery query = new SearchQuery(100, null, null, null, null);
        ObjectNode response = FakeTrackingStore.response("registered_models",
                tracking.searchRegisteredModels(query, null));
        ObjectNode filtered = filterWithDefault(Permission.NO_PERMISSIONS).filterPage(
                SearchableResource.REGISTERED_MODELS, query,
                readAccess(Permission.NO_PERMISSIONS, ResourceType.REGISTERED_MODEL, "bob"), response);

        assertEquals(1, filtered.get("registered_models").size());
        assertEquals("b", filtered.get("registered_models").get(0).get("name").asText());
    }

    @Test
    public void emptyResultsLeaveNoResultsField () {
        store.createUser("carol", "password1", false);
        tracking.withExperiment("1", "only");
        SearchQuery query = new SearchQuery(5, null, null, null, null);
        ObjectNode response = FakeTrackingStore.response("experiments", tracking.searchExperiments(query, null));
        ObjectNode filtered = filterWithDefault(Permission.NO_PERMISSIONS).filterPage(SearchableResource.EXPERIMENTS,
                query, readAccess(Permission.NO_PERMISSIONS, ResourceType.EXPERIMENT, "carol"), response);
        assertFalse(filtered.has("experiments"));
        assertFalse(filtered.has("next_page_token"));
    }

    /**
     * Following the returned tokens page by page must yield exactly the readable experiments in upstream order, with
     * full pages whenever more results follow.
     */
    @Test
    public void pagesConcatenateToTheReadableSubsequence () {
        store.createUser("alice", "password1", false);
        List<String> readable = new ArrayList<>();
        for (int i = 1; i <= 20; i++) {
            String id = Integer.toString(i);
            tracking.withExperiment(id, "experiment " + id);
            if (i % 3 == 0 || i > 16) {
                store.createPermission(ResourceKey.experiment(id), "alice", Permission.NO_PERMISSIONS);
            } else {
                readable.add(id);
            }
        }
        ReadAccess access = readAccess(Permission.READ, ResourceType.EXPERIMENT, "alice");
        SearchResultFilter filter = filterWithDefault(Permission.READ);

        for (int pageSize = 1; pageSize <= 8; pageSize++) {
            SearchQuery query = new SearchQuery(pageSize, null, null, null, null);
            List<String> seen = new ArrayList<>();
            String token = null;
            int pages = 0;
            do {
                ObjectNode response = FakeTrackingStore.response("experiments",
                        tracking.searchExperiments(query, token));
                ObjectNode filtered = filter.filterPage(SearchableResource.EXPERIMENTS, query, access, response);
                JsonNode items = filtered.path("experiments");
                assertThat(items.size(), lessThanOrEqualTo(pageSize));
                items.forEach(item -> seen.add(item.get("experiment_id").asText()));
                token = filtered.path("next_page_token").asText(null);
                if (token != null) assertEquals(pageSize, items.size());
                assertTrue(++pages <= 20, "Pagination does not terminate");
            } while (token != null);
            assertEquals(readable, seen, "page size " + pageSize);
        }
    }

    @Test
    public void loggedModelTokensKeepTheSearchArguments () {
        store.createUser("alice", "password1", false);
        tracking.withExperiment("1", "mine").withExperiment("2", "theirs");
        for (int i = 0; i < 6; i++) {
            tracking.withLoggedModel("m" + i, i % 2 == 0 ? "2" : "1");
        }
        store.createPermission(ResourceKey.experiment("2"), "alice", Permission.NO_PERMISSIONS);
        SearchQuery query = new SearchQuery(2, "name LIKE 'model%'", null, null, List.of("1", "2"));

        ObjectNode response = FakeTrackingStore.response("models", tracking.searchLoggedModels(query, null));
        ObjectNode filtered = filterWithDefault(Permission.READ).filterPage(SearchableResource.LOGGED_MODELS, query,
                readAccess(Permission.READ, ResourceType.EXPERIMENT, "alice"), response);

        List<String> ids = new ArrayList<>();
        filtered.get("models").forEach(model -> ids.add(model.get("info").get("model_id").asText()));
        assertThat(ids, contains("m1", "m3"));
        String token = filtered.get("next_page_token").asText();
        JsonNode decoded = JsonUtil.parse(new String(Base64.getDecoder().decode(token), StandardCharsets.UTF_8));
        assertEquals(4, decoded.get("offset").asInt());
        assertEquals("name LIKE 'model%'", decoded.get("filter_string").asText());
        assertEquals(2, decoded.get("experiment_ids").size());

        ObjectNode next = FakeTrackingStore.response("models", tracking.searchLoggedModels(query, token));
        ObjectNode lastPage = filterWithDefault(Permission.READ).filterPage(SearchableResource.LOGGED_MODELS, query,
                readAccess(Permission.READ, ResourceType.EXPERIMENT, "alice"), next);
        assertEquals(1, lastPage.get("models").size());
        assertEquals("m5", lastPage.get("models").get(0).get("info").get("model_id").asText());
        assertFalse(lastPage.has("next_page_token"));
    }

    @Test
    public void administratorsSeeTheUnfilteredResponse () {
        tracking.withExperiment("1", "a");
        String body = "{\"experiments\":[{\"experiment_id\":\"1\"}]}";
        ApiRequest request = ApiRequest.builder("GET", "/api/2.0/mlflow/experiments/search").build();
        String result = filterWithDefault(Permission.NO_PERMISSIONS).filter(SearchableResource.EXPERIMENTS, request,
                new AuthenticatedUser("root", 1, true), body);
        assertSame(body, result);
    }

}
