package com.conveyal.trackingauth.authorization;

/**
 * How the resource governing a request is found from the request arguments. Each protected route declares one.
 */
public enum ResolutionStrategy {

    /** The experiment_id argument names the experiment directly. */
    EXPERIMENT_ID,

    /** The experiment_name argument is looked up in the tracking store to find the experiment id. */
    EXPERIMENT_NAME,

    /** The run_id (or legacy run_uuid) argument is looked up to find the experiment the run belongs to. */
    RUN_ID,

    /** The model_id argument is looked up to find the experiment the logged model belongs to. */
    LOGGED_MODEL_ID,

    /** The request_id argument is looked up to find the experiment the trace was logged to. */
    TRACE_REQUEST_ID,

    /** The name argument names the registered model directly. */
    REGISTERED_MODEL_NAME,

    /**
     * Proxied artifact paths begin with the experiment id. Paths that do not are not tied to any experiment, and
     * access to them is governed by the default permission.
     */
    ARTIFACT_PATH

}
