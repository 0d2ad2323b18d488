package com.conveyal.trackingauth.authorization;

import com.google.common.collect.ImmutableSet;

import java.util.Set;

/** The tracking server endpoints that requests are forwarded to once authorized. */
public enum TrackingOperation implements ApiOperation {

    // Experiments
    CREATE_EXPERIMENT ("/mlflow/experiments/create", "POST"),
    SEARCH_EXPERIMENTS ("/mlflow/experiments/search", "GET", "POST"),
    GET_EXPERIMENT ("/mlflow/experiments/get", "GET"),
    GET_EXPERIMENT_BY_NAME ("/mlflow/experiments/get-by-name", "GET"),
    DELETE_EXPERIMENT ("/mlflow/experiments/delete", "POST"),
    RESTORE_EXPERIMENT ("/mlflow/experiments/restore", "POST"),
    UPDATE_EXPERIMENT ("/mlflow/experiments/update", "POST"),
    SET_EXPERIMENT_TAG ("/mlflow/experiments/set-experiment-tag", "POST"),
    DELETE_EXPERIMENT_TAG ("/mlflow/experiments/delete-experiment-tag", "POST"),

    // Runs
    CREATE_RUN ("/mlflow/runs/create", "POST"),
    GET_RUN ("/mlflow/runs/get", "GET"),
    SEARCH_RUNS ("/mlflow/runs/search", "POST"),
    DELETE_RUN ("/mlflow/runs/delete", "POST"),
    RESTORE_RUN ("/mlflow/runs/restore", "POST"),
    UPDATE_RUN ("/mlflow/runs/update", "POST"),
    LOG_METRIC ("/mlflow/runs/log-metric", "POST"),
    LOG_BATCH ("/mlflow/runs/log-batch", "POST"),
    LOG_MODEL ("/mlflow/runs/log-model", "POST"),
    LOG_INPUTS ("/mlflow/runs/log-inputs", "POST"),
    SET_TAG ("/mlflow/runs/set-tag", "POST"),
    DELETE_TAG ("/mlflow/runs/delete-tag", "POST"),
    LOG_PARAM ("/mlflow/runs/log-parameter", "POST"),
    LOG_OUTPUTS ("/mlflow/runs/outputs", "POST"),
    GET_METRIC_HISTORY ("/mlflow/metrics/get-history", "GET"),
    GET_METRIC_HISTORY_BULK ("/mlflow/metrics/get-history-bulk", "GET"),
    GET_METRIC_HISTORY_BULK_INTERVAL ("/mlflow/metrics/get-history-bulk-interval", "GET"),
    SEARCH_DATASETS ("/mlflow/experiments/search-datasets", "POST"),
    LIST_ARTIFACTS ("/mlflow/artifacts/list", "GET"),
    UPLOAD_ARTIFACT ("/mlflow/upload-artifact", "POST"),
    GET_ARTIFACT (false, "/get-artifact", "GET"),

    // Traces. Those addressed by request id are governed by the experiment the trace was logged to.
    START_TRACE ("/mlflow/traces", "POST"),
    SEARCH_TRACES ("/mlflow/traces", "GET"),
    DELETE_TRACES ("/mlflow/traces/delete-traces", "POST"),
    END_TRACE ("/mlflow/traces/<request_id>", "PATCH"),
    GET_TRACE_INFO ("/mlflow/traces/<request_id>/info", "GET"),
    SET_TRACE_TAG ("/mlflow/traces/<request_id>/tags", "PATCH"),
    DELETE_TRACE_TAG ("/mlflow/traces/<request_id>/tags", "DELETE"),
    GET_TRACE_ARTIFACT ("/mlflow/get-trace-artifact", "GET"),

    // Logged models. Most of these carry the model id in the path.
    CREATE_LOGGED_MODEL ("/mlflow/logged-models", "POST"),
    SEARCH_LOGGED_MODELS ("/mlflow/logged-models/search", "POST"),
    GET_LOGGED_MODEL ("/mlflow/logged-models/<model_id>", "GET"),
    DELETE_LOGGED_MODEL ("/mlflow/logged-models/<model_id>", "DELETE"),
    FINALIZE_LOGGED_MODEL ("/mlflow/logged-models/<model_id>", "PATCH"),
    SET_LOGGED_MODEL_TAGS ("/mlflow/logged-models/<model_id>/tags", "PATCH"),
    DELETE_LOGGED_MODEL_TAG ("/mlflow/logged-models/<model_id>/tags/<tag_key>", "DELETE"),
    LOG_LOGGED_MODEL_PARAMS ("/mlflow/logged-models/<model_id>/params", "POST"),
    LIST_LOGGED_MODEL_ARTIFACTS ("/mlflow/logged-models/<model_id>/artifacts/files", "GET"),

    // Model registry
    CREATE_REGISTERED_MODEL ("/mlflow/registered-models/create", "POST"),
    SEARCH_REGISTERED_MODELS ("/mlflow/registered-models/search", "GET"),
    GET_REGISTERED_MODEL ("/mlflow/registered-models/get", "GET"),
    UPDATE_REGISTERED_MODEL ("/mlflow/registered-models/update", "PATCH"),
    RENAME_REGISTERED_MODEL ("/mlflow/registered-models/rename", "POST"),
    DELETE_REGISTERED_MODEL ("/mlflow/registered-models/delete", "DELETE"),
    GET_LATEST_VERSIONS ("/mlflow/registered-models/get-latest-versions", "GET", "POST"),
    SET_REGISTERED_MODEL_TAG ("/mlflow/registered-models/set-tag", "POST"),
    DELETE_REGISTERED_MODEL_TAG ("/mlflow/registered-models/delete-tag", "DELETE"),
    SET_REGISTERED_MODEL_ALIAS ("/mlflow/registered-models/alias", "POST"),
    DELETE_REGISTERED_MODEL_ALIAS ("/mlflow/registered-models/alias", "DELETE"),
    GET_MODEL_VERSION_BY_ALIAS ("/mlflow/registered-models/alias", "GET"),
    CREATE_MODEL_VERSION ("/mlflow/model-versions/create", "POST"),
    SEARCH_MODEL_VERSIONS ("/mlflow/model-versions/search", "GET"),
    GET_MODEL_VERSION ("/mlflow/model-versions/get", "GET"),
    UPDATE_MODEL_VERSION ("/mlflow/model-versions/update", "PATCH"),
    DELETE_MODEL_VERSION ("/mlflow/model-versions/delete", "DELETE"),
    TRANSITION_MODEL_VERSION_STAGE ("/mlflow/model-versions/transition-stage", "POST"),
    GET_MODEL_VERSION_DOWNLOAD_URI ("/mlflow/model-versions/get-download-uri", "GET"),
    SET_MODEL_VERSION_TAG ("/mlflow/model-versions/set-tag", "POST"),
    DELETE_MODEL_VERSION_TAG ("/mlflow/model-versions/delete-tag", "DELETE"),
    GET_MODEL_VERSION_ARTIFACT (false, "/model-versions/get-artifact", "GET");

    private final boolean restApi;
    private final String path;
    private final Set<String> methods;

    TrackingOperation (String path, String... methods) {
        this(true, path, methods);
    }

    TrackingOperation (boolean restApi, String path, String... methods) {
        this.restApi = restApi;
        this.path = path;
        this.methods = ImmutableSet.copyOf(methods);
    }

    @Override
    public String path () {
        return path;
    }

    @Override
    public Set<String> methods () {
        return methods;
    }

    @Override
    public boolean restApi () {
        return restApi;
    }

}
