package com.conveyal.trackingauth.authorization;

import com.conveyal.trackingauth.AuthServerException;
import com.conveyal.trackingauth.upstream.FakeTrackingStore;
import com.conveyal.trackingauth.util.JsonUtil;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class ResourceResolverTest {

    private final FakeTrackingStore tracking = new FakeTrackingStore()
            .withExperiment("1", "first")
            .withExperiment("2", "second")
            .withRun("run-a", "2")
            .withLoggedModel("m-a", "1")
            .withTrace("tr-a", "2");

    private final ResourceResolver resolver = new ResourceResolver(tracking);

    @Test
    public void resolvesExperimentsByIdAndByName () {
        ApiRequest byId = get("/api/2.0/mlflow/experiments/get").queryParam("experiment_id", "1").build();
        assertEquals(ResourceKey.experiment("1"), resolver.resolve(ResolutionStrategy.EXPERIMENT_ID, byId));
        ApiRequest byName = get("/api/2.0/mlflow/experiments/get-by-name")
                .queryParam("experiment_name", "second").build();
        assertEquals(ResourceKey.experiment("2"), resolver.resolve(ResolutionStrategy.EXPERIMENT_NAME, byName));
    }

    @Test
    public void runsAndLoggedModelsResolveToTheirExperiment () {
        ApiRequest run = ApiRequest.builder("POST", "/api/2.0/mlflow/runs/log-metric")
                .json(JsonUtil.objectNode().put("run_id", "run-a")).build();
        assertEquals(ResourceKey.experiment("2"), resolver.resolve(ResolutionStrategy.RUN_ID, run));
        ApiRequest model = get("/api/2.0/mlflow/logged-models/m-a").build()
                .withPathParams(Map.of("model_id", "m-a"));
        assertEquals(ResourceKey.experiment("1"), resolver.resolve(ResolutionStrategy.LOGGED_MODEL_ID, model));
    }

    @Test
    public void tracesResolveToTheirExperiment () {
        ApiRequest trace = get("/api/2.0/mlflow/traces/tr-a/info").build()
                .withPathParams(Map.of("request_id", "tr-a"));
        assertEquals(ResourceKey.experiment("2"), resolver.resolve(ResolutionStrategy.TRACE_REQUEST_ID, trace));
        ApiRequest artifact = get("/ajax-api/2.0/mlflow/get-trace-artifact").queryParam("request_id", "tr-a").build();
        assertEquals(ResourceKey.experiment("2"), resolver.resolve(ResolutionStrategy.TRACE_REQUEST_ID, artifact));
        assertEquals(ResourceKey.experiment("2"), resolver.experimentOfRun("run-a"));
    }

    @Test
    public void registeredModelsAreKeyedByName () {
        ApiRequest request = get("/api/2.0/mlflow/registered-models/get").queryParam("name", "churn").build();
        assertEquals(ResourceKey.registeredModel("churn"),
                resolver.resolve(ResolutionStrategy.REGISTERED_MODEL_NAME, request));
    }

    @Test
    public void unknownEntitiesAreNotFound () {
        ApiRequest run = get("/api/2.0/mlflow/runs/get").queryParam("run_id", "nope").build();
        AuthServerException e = assertThrows(AuthServerException.class,
                () -> resolver.resolve(ResolutionStrategy.RUN_ID, run));
        assertEquals(AuthServerException.Type.RESOURCE_NOT_FOUND, e.type);
        ApiRequest byName = get("/x").queryParam("experiment_name", "missing").build();
        assertThrows(AuthServerException.class, () -> resolver.resolve(ResolutionStrategy.EXPERIMENT_NAME, byName));
    }

    @Test
    public void artifactPathsNameTheirExperimentFirst () {
        assertEquals("12", ResourceResolver.experimentIdFromArtifactPath("12/abc/artifacts/model.pkl"));
        assertNull(ResourceResolver.experimentIdFromArtifactPath("12"));
        assertNull(ResourceResolver.experimentIdFromArtifactPath("abc/12/x"));
        assertNull(ResourceResolver.experimentIdFromArtifactPath(null));

        ApiRequest request = get("/a").build()
                .withPathParams(Map.of(ResourceResolver.ARTIFACT_PATH_PARAM, "3/run/artifacts"));
        assertEquals(ResourceKey.experiment("3"), resolver.resolve(ResolutionStrategy.ARTIFACT_PATH, request));
        ApiRequest unscoped = get("/a").build()
                .withPathParams(Map.of(ResourceResolver.ARTIFACT_PATH_PARAM, "shared/file"));
        assertNull(resolver.resolve(ResolutionStrategy.ARTIFACT_PATH, unscoped));
    }

    private static ApiRequest.Builder get (String path) {
        return ApiRequest.builder("GET", path);
    }

}
