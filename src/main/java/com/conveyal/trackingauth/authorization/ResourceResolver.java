package com.conveyal.trackingauth.authorization;

import com.conveyal.trackingauth.AuthServerException;
import com.conveyal.trackingauth.upstream.Experiment;
import com.conveyal.trackingauth.upstream.TrackingStore;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Determines which resource a request acts upon. Runs and logged models are resolved to the experiment that owns them,
 * which takes a round trip to the tracking store.
 */
public class ResourceResolver {

    public static final String ARTIFACT_PATH_PARAM = "artifact_path";

    private static final Pattern EXPERIMENT_ID_IN_ARTIFACT_PATH = Pattern.compile("^(\\d+)/");

    private final TrackingStore trackingStore;

    public ResourceResolver (TrackingStore trackingStore) {
        this.trackingStore = trackingStore;
    }

    /**
     * @return the governing resource, or null when the request is not tied to any specific resource (artifact paths
     *         without a leading experiment id).
     * @throws AuthServerException INVALID_REQUEST if a required argument is missing, RESOURCE_NOT_FOUND if a name or
     *         id does not exist in the tracking store.
     */
    public ResourceKey resolve (ResolutionStrategy strategy, ApiRequest request) {
        switch (strategy) {
            case EXPERIMENT_ID:
                return ResourceKey.experiment(request.param("experiment_id"));
            case EXPERIMENT_NAME:
                String experimentName = request.param("experiment_name");
                Experiment experiment = trackingStore.getExperimentByName(experimentName);
                if (experiment == null) {
                    throw AuthServerException.notFound(
                            String.format("Could not find experiment with name %s", experimentName));
                }
                return ResourceKey.experiment(experiment.experimentId);
            case RUN_ID:
                return experimentOfRun(request.param("run_id"));
            case LOGGED_MODEL_ID:
                return experimentOf(trackingStore.getLoggedModel(request.param("model_id")).experimentId(), "model");
            case TRACE_REQUEST_ID:
                return experimentOf(trackingStore.getTraceInfo(request.param("request_id")).experimentId, "trace");
            case REGISTERED_MODEL_NAME:
                return ResourceKey.registeredModel(request.param("name"));
            case ARTIFACT_PATH:
                String experimentId = experimentIdFromArtifactPath(request.pathParam(ARTIFACT_PATH_PARAM));
                return experimentId == null ? null : ResourceKey.experiment(experimentId);
            default:
                throw new IllegalArgumentException("Unknown resolution strategy " + strategy);
        }
    }

    /** @throws AuthServerException RESOURCE_NOT_FOUND if there is no such run. */
    public ResourceKey experimentOfRun (String runId) {
        return experimentOf(trackingStore.getRun(runId).experimentId(), "run");
    }

    /** @return the leading run of digits of the path if it is followed by a slash, otherwise null. */
    public static String experimentIdFromArtifactPath (String artifactPath) {
        if (artifactPath == null) return null;
        Matcher matcher = EXPERIMENT_ID_IN_ARTIFACT_PATH.matcher(artifactPath);
        return matcher.find() ? matcher.group(1) : null;
    }

    private static ResourceKey experimentOf (String experimentId, String entity) {
        if (experimentId == null || experimentId.isEmpty()) {
            throw AuthServerException.internal(String.format("Tracking server returned a %s without experiment.", entity));
        }
        return ResourceKey.experiment(experimentId);
    }

}
