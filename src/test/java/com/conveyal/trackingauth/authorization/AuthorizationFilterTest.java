package com.conveyal.trackingauth.authorization;

import com.conveyal.trackingauth.AuthServerException;
import com.conveyal.trackingauth.components.BasicAuthentication;
import com.conveyal.trackingauth.components.eventbus.EventBus;
import com.conveyal.trackingauth.persistence.InMemoryPermissionStore;
import com.conveyal.trackingauth.upstream.FakeTrackingStore;
import com.conveyal.trackingauth.util.JsonUtil;
import com.google.common.util.concurrent.MoreExecutors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class AuthorizationFilterTest {

    private InMemoryPermissionStore store;
    private FakeTrackingStore tracking;
    private AuthorizationFilter filter;

    @BeforeEach
    public void setUp () {
        store = new InMemoryPermissionStore();
        store.createUser("root", "root-password", true);
        store.createUser("alice", "alice-password", false);
        tracking = new FakeTrackingStore()
                .withExperiment("1", "shared")
                .withExperiment("2", "private")
                .withRun("run-1", "1")
                .withRun("run-2", "2")
                .withLoggedModel("m-1", "1")
                .withLoggedModel("m-2", "2")
                .withTrace("tr-1", "1")
                .withTrace("tr-2", "2");
        store.createPermission(ResourceKey.experiment("2"), "alice", Permission.NO_PERMISSIONS);

        EventBus eventBus = new EventBus(MoreExecutors.newDirectExecutorService());
        PermissionEvaluator evaluator = new PermissionEvaluator(store, () -> Permission.READ);
        Validators validators = new Validators(new ResourceResolver(tracking), evaluator);
        AuthorizationRules rules = AuthorizationRules.standard(validators, new OwnershipHandlers(store, eventBus),
                new SearchResultFilter(evaluator, tracking, tracking));
        RouteTable routeTable = RouteTable.build(AuthorizationRules.allOperations(), rules);
        filter = new AuthorizationFilter(new BasicAuthentication(store), routeTable, validators, eventBus);
    }

    @Test
    public void unprotectedPathsNeedNoCredentials () {
        AuthorizationDecision decision = filter.beforeRequest(ApiRequest.builder("GET", "/health").build());
        assertTrue(decision.isAllowed());
        assertNull(decision.user);
    }

    @Test
    public void requestsWithoutCredentialsAreUnauthenticated () {
        AuthServerException e = assertThrows(AuthServerException.class,
                () -> filter.beforeRequest(ApiRequest.builder("GET", "/api/2.0/mlflow/experiments/get")
                        .queryParam("experiment_id", "1").build()));
        assertEquals(401, e.httpCode);
        AuthServerException wrongPassword = assertThrows(AuthServerException.class,
                () -> filter.beforeRequest(as("alice", "nope", "GET", "/").build()));
        assertEquals(AuthServerException.Type.UNAUTHENTICATED, wrongPassword.type);
    }

    @Test
    public void defaultPermissionAppliesWithoutAGrant () {
        assertTrue(alice("GET", "/api/2.0/mlflow/experiments/get").queryParam("experiment_id", "1").decide());
        assertFalse(alice("GET", "/api/2.0/mlflow/experiments/get").queryParam("experiment_id", "2").decide());
        assertFalse(alice("POST", "/api/2.0/mlflow/experiments/delete")
                .json("{\"experiment_id\":\"1\"}").decide());
    }

    @Test
    public void grantsOverrideTheDefault () {
        store.createPermission(ResourceKey.experiment("1"), "alice", Permission.MANAGE);
        assertTrue(alice("POST", "/api/2.0/mlflow/experiments/delete").json("{\"experiment_id\":\"1\"}").decide());
        store.updatePermission(ResourceKey.experiment("1"), "alice", Permission.EDIT);
        assertTrue(alice("POST", "/api/2.0/mlflow/runs/log-metric").json("{\"run_id\":\"run-1\"}").decide());
        assertFalse(alice("POST", "/api/2.0/mlflow/runs/delete").json("{\"run_id\":\"run-1\"}").decide());
    }

    @Test
    public void runsAndLoggedModelsFollowTheirExperiment () {
        assertTrue(alice("GET", "/api/2.0/mlflow/runs/get").queryParam("run_id", "run-1").decide());
        assertFalse(alice("GET", "/ajax-api/2.0/mlflow/runs/get").queryParam("run_id", "run-2").decide());
        assertFalse(alice("GET", "/api/2.0/mlflow/logged-models/m-2").decide());
        AuthServerException e = assertThrows(AuthServerException.class,
                () -> alice("GET", "/api/2.0/mlflow/runs/get").queryParam("run_id", "missing").decide());
        assertTrue(e.isNotFound());
    }

    @Test
    public void runSearchNeedsReadOnEveryExperiment () {
        assertTrue(alice("POST", "/api/2.0/mlflow/runs/search").json("{\"experiment_ids\":[\"1\"]}").decide());
        assertFalse(alice("POST", "/api/2.0/mlflow/runs/search")
                .json("{\"experiment_ids\":[\"1\",\"2\"]}").decide());
    }

    @Test
    public void managersCanUseEveryOperationOnTheirExperiment () {
        store.createPermission(ResourceKey.experiment("1"), "alice", Permission.MANAGE);
        assertTrue(alice("POST", "/api/2.0/mlflow/runs/outputs").json("{\"run_id\":\"run-1\"}").decide());
        assertTrue(alice("GET", "/ajax-api/2.0/mlflow/metrics/get-history-bulk")
                .queryParam("run_id", "run-1").queryParam("metric_key", "loss").decide());
        assertTrue(alice("GET", "/ajax-api/2.0/mlflow/metrics/get-history-bulk-interval")
                .queryParam("run_ids", "run-1").queryParam("metric_key", "loss").decide());
        assertTrue(alice("POST", "/ajax-api/2.0/mlflow/experiments/search-datasets")
                .json("{\"experiment_ids\":[\"1\"]}").decide());
        assertTrue(alice("GET", "/api/2.0/mlflow/traces").queryParam("experiment_ids", "1").decide());
        assertTrue(alice("POST", "/api/2.0/mlflow/traces").json("{\"experiment_id\":\"1\"}").decide());
        assertTrue(alice("PATCH", "/api/2.0/mlflow/traces/tr-1").json("{}").decide());
        assertTrue(alice("GET", "/api/2.0/mlflow/traces/tr-1/info").decide());
        assertTrue(alice("DELETE", "/api/2.0/mlflow/traces/tr-1/tags").queryParam("key", "k").decide());
        assertTrue(alice("POST", "/api/2.0/mlflow/traces/delete-traces").json("{\"experiment_id\":\"1\"}").decide());
        assertTrue(alice("GET", "/ajax-api/2.0/mlflow/get-trace-artifact").queryParam("request_id", "tr-1").decide());
        assertTrue(alice("GET", "/ajax-api/2.0/mlflow/logged-models/m-1/artifacts/files").decide());
        assertTrue(alice("POST", "/ajax-api/2.0/mlflow/upload-artifact")
                .queryParam("run_uuid", "run-1").queryParam("path", "plot.png").decide());
    }

    @Test
    public void operationsSpanningSeveralResourcesNeedAccessToEachOfThem () {
        assertTrue(alice("GET", "/ajax-api/2.0/mlflow/metrics/get-history-bulk")
                .queryParam("run_id", "run-1").queryParam("metric_key", "loss").decide());
        assertFalse(alice("GET", "/ajax-api/2.0/mlflow/metrics/get-history-bulk")
                .queryParam("run_id", "run-1").queryParam("run_id", "run-2").decide());
        assertFalse(alice("GET", "/ajax-api/2.0/mlflow/metrics/get-history-bulk-interval")
                .queryParam("run_ids", "run-2").decide());
        assertFalse(alice("POST", "/ajax-api/2.0/mlflow/experiments/search-datasets")
                .json("{\"experiment_ids\":[\"1\",\"2\"]}").decide());
        assertFalse(alice("GET", "/api/2.0/mlflow/traces").queryParam("experiment_ids", "2").decide());
    }

    @Test
    public void tracesFollowTheirExperiment () {
        assertTrue(alice("GET", "/api/2.0/mlflow/traces/tr-1/info").decide());
        assertFalse(alice("GET", "/api/2.0/mlflow/traces/tr-2/info").decide());
        assertFalse(alice("PATCH", "/api/2.0/mlflow/traces/tr-1/tags").json("{\"key\":\"k\"}").decide());
        assertFalse(alice("GET", "/ajax-api/2.0/mlflow/get-trace-artifact").queryParam("request_id", "tr-2").decide());
        AuthServerException e = assertThrows(AuthServerException.class,
                () -> alice("GET", "/api/2.0/mlflow/traces/unknown/info").decide());
        assertTrue(e.isNotFound());
    }

    @Test
    public void uploadsAreAuthorizedFromTheQueryString () {
        // The body of an upload is the file, never read for arguments.
        RequestAs upload = alice("POST", "/ajax-api/2.0/mlflow/upload-artifact")
                .queryParam("run_uuid", "run-1").queryParam("path", "plot.png");
        upload.builder.header("Content-Type", "image/png");
        assertFalse(upload.decide());
        store.createPermission(ResourceKey.experiment("1"), "alice", Permission.EDIT);
        assertTrue(upload.decide());
        assertFalse(alice("POST", "/ajax-api/2.0/mlflow/upload-artifact")
                .queryParam("run_uuid", "run-2").decide());
    }

    @Test
    public void usersMayOnlyReadTheirOwnAccount () {
        assertTrue(alice("GET", "/api/2.0/mlflow/users/get").queryParam("username", "alice").decide());
        assertFalse(alice("GET", "/api/2.0/mlflow/users/get").queryParam("username", "root").decide());
        assertFalse(alice("POST", "/api/2.0/mlflow/users/create")
                .json("{\"username\":\"x\",\"password\":\"y\"}").decide());
        assertFalse(alice("GET", "/admin/users").decide());
    }

    @Test
    public void administratorsAreAllowedEverything () {
        ApiRequest request = as("root", "root-password", "POST", "/api/2.0/mlflow/experiments/delete")
                .json(JsonUtil.objectNode().put("experiment_id", "2")).build();
        AuthorizationDecision decision = filter.beforeRequest(request);
        assertTrue(decision.isAllowed());
        assertTrue(decision.user.admin);
        assertTrue(filter.beforeRequest(as("root", "root-password", "GET", "/api/2.0/mlflow/unknown").build())
                .isAllowed());
    }

    @Test
    public void unknownApiPathsAreDeniedButUserInterfacePathsAreNot () {
        assertFalse(alice("GET", "/api/2.0/mlflow/not-an-operation").decide());
        assertFalse(alice("POST", "/graphql").json("{}").decide());
        assertTrue(alice("GET", "/").decide());
        assertTrue(alice("GET", "/static-files/index.html").decide());
    }

    @Test
    public void artifactProxyAccessDependsOnMethod () {
        String artifact = "/api/2.0/mlflow-artifacts/artifacts/1/run-1/artifacts/model.pkl";
        assertTrue(alice("GET", artifact).decide());
        assertFalse(alice("PUT", artifact).decide());
        assertFalse(alice("GET", "/api/2.0/mlflow-artifacts/artifacts/2/run-2/artifacts/model.pkl").decide());
        assertFalse(alice("GET", "/api/2.0/mlflow-artifacts/artifacts").queryParam("path", "2/run-2").decide());
        assertTrue(alice("GET", "/api/2.0/mlflow-artifacts/artifacts").queryParam("path", "1/run-1").decide());

        store.createPermission(ResourceKey.experiment("1"), "alice", Permission.EDIT);
        assertTrue(alice("PUT", artifact).decide());
        assertFalse(alice("DELETE", artifact).decide());
        assertFalse(alice("POST", artifact).decide());
    }

    @Test
    public void creatingAnExperimentGrantsManageAfterward () {
        ApiRequest request = as("alice", "alice-password", "POST", "/api/2.0/mlflow/experiments/create")
                .json(JsonUtil.objectNode().put("name", "new")).build();
        AuthorizationDecision decision = filter.beforeRequest(request);
        assertTrue(decision.isAllowed());

        filter.afterRequest(decision, 400, "{\"experiment_id\":\"9\"}");
        assertThrows(AuthServerException.class, () -> store.getPermission(ResourceKey.experiment("9"), "alice"));

        String body = "{\"experiment_id\":\"9\"}";
        assertEquals(body, filter.afterRequest(decision, 200, body));
        assertEquals(Permission.MANAGE, store.getPermission(ResourceKey.experiment("9"), "alice").permission);
    }

    private ApiRequest.Builder as (String username, String password, String method, String path) {
        String credentials = Base64.getEncoder()
                .encodeToString((username + ":" + password).getBytes(StandardCharsets.UTF_8));
        return ApiRequest.builder(method, path).header("Authorization", "Basic " + credentials);
    }

    private RequestAs alice (String method, String path) {
        return new RequestAs(as("alice", "alice-password", method, path));
    }

    /** Builds a request for alice and reports whether it is allowed. */
    private class RequestAs {
        private final ApiRequest.Builder builder;

        RequestAs (ApiRequest.Builder builder) {
            this.builder = builder;
        }

        RequestAs queryParam (String name, String value) {
            builder.queryParam(name, value);
            return this;
        }

        RequestAs json (String body) {
            builder.header("Content-Type", "application/json").body(body);
            return this;
        }

        boolean decide () {
            return filter.beforeRequest(builder.build()).isAllowed();
        }
    }

}
