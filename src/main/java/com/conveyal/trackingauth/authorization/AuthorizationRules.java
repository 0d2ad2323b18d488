package com.conveyal.trackingauth.authorization;

import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.conveyal.trackingauth.authorization.Capability.DELETE;
import static com.conveyal.trackingauth.authorization.Capability.MANAGE;
import static com.conveyal.trackingauth.authorization.Capability.READ;
import static com.conveyal.trackingauth.authorization.Capability.UPDATE;
import static com.conveyal.trackingauth.authorization.ResolutionStrategy.EXPERIMENT_ID;
import static com.conveyal.trackingauth.authorization.ResolutionStrategy.EXPERIMENT_NAME;
import static com.conveyal.trackingauth.authorization.ResolutionStrategy.LOGGED_MODEL_ID;
import static com.conveyal.trackingauth.authorization.ResolutionStrategy.REGISTERED_MODEL_NAME;
import static com.conveyal.trackingauth.authorization.ResolutionStrategy.RUN_ID;
import static com.conveyal.trackingauth.authorization.ResolutionStrategy.TRACE_REQUEST_ID;

/**
 * Declares, for each operation, the check a non-admin caller has to pass and what happens after the operation
 * succeeds. Every operation must either have a validator or be declared unrestricted; the route table refuses to
 * build otherwise.
 */
public class AuthorizationRules {

    private final Map<ApiOperation, PermissionValidator> validators = new HashMap<>();
    private final Set<ApiOperation> unrestricted = new HashSet<>();
    private final Map<ApiOperation, AfterRequestHandler> afterHandlers = new HashMap<>();

    public AuthorizationRules require (ApiOperation operation, PermissionValidator validator) {
        validators.put(operation, validator);
        return this;
    }

    /** Any authenticated user may call the operation. */
    public AuthorizationRules unrestricted (ApiOperation operation) {
        unrestricted.add(operation);
        return this;
    }

    public AuthorizationRules after (ApiOperation operation, AfterRequestHandler handler) {
        afterHandlers.put(operation, handler);
        return this;
    }

    public PermissionValidator validatorFor (ApiOperation operation) {
        return validators.get(operation);
    }

    public boolean isUnrestricted (ApiOperation operation) {
        return unrestricted.contains(operation);
    }

    public AfterRequestHandler afterHandlerFor (ApiOperation operation) {
        return afterHandlers.get(operation);
    }

    public static List<ApiOperation> allOperations () {
        List<ApiOperation> operations = new ArrayList<>();
        operations.addAll(EnumSet.allOf(TrackingOperation.class));
        operations.addAll(EnumSet.allOf(AuthOperation.class));
        return ImmutableList.copyOf(operations);
    }

    public static AuthorizationRules standard (
            Validators v,
            OwnershipHandlers ownership,
            SearchResultFilter searchResultFilter
    ) {
        AuthorizationRules rules = new AuthorizationRules();

        // Experiments. Creating and searching are open to everyone, search results are filtered afterward.
        rules.unrestricted(TrackingOperation.CREATE_EXPERIMENT)
             .after(TrackingOperation.CREATE_EXPERIMENT, ownership::grantManageOnCreatedExperiment);
        rules.unrestricted(TrackingOperation.SEARCH_EXPERIMENTS)
             .after(TrackingOperation.SEARCH_EXPERIMENTS, searchResultFilter.handlerFor(SearchableResource.EXPERIMENTS));
        rules.require(TrackingOperation.GET_EXPERIMENT, v.resource(EXPERIMENT_ID, READ));
        rules.require(TrackingOperation.GET_EXPERIMENT_BY_NAME, v.resource(EXPERIMENT_NAME, READ));
        rules.require(TrackingOperation.DELETE_EXPERIMENT, v.resource(EXPERIMENT_ID, DELETE));
        rules.require(TrackingOperation.RESTORE_EXPERIMENT, v.resource(EXPERIMENT_ID, DELETE));
        rules.require(TrackingOperation.UPDATE_EXPERIMENT, v.resource(EXPERIMENT_ID, UPDATE));
        rules.require(TrackingOperation.SET_EXPERIMENT_TAG, v.resource(EXPERIMENT_ID, UPDATE));
        rules.require(TrackingOperation.DELETE_EXPERIMENT_TAG, v.resource(EXPERIMENT_ID, UPDATE));

        // Runs are governed by their experiment.
        rules.require(TrackingOperation.CREATE_RUN, v.resource(EXPERIMENT_ID, UPDATE));
        rules.require(TrackingOperation.GET_RUN, v.resource(RUN_ID, READ));
        rules.require(TrackingOperation.SEARCH_RUNS, v.allExperiments(READ));
        rules.require(TrackingOperation.DELETE_RUN, v.resource(RUN_ID, DELETE));
        rules.require(TrackingOperation.RESTORE_RUN, v.resource(RUN_ID, DELETE));
        rules.require(TrackingOperation.UPDATE_RUN, v.resource(RUN_ID, UPDATE));
        rules.require(TrackingOperation.LOG_METRIC, v.resource(RUN_ID, UPDATE));
        rules.require(TrackingOperation.LOG_BATCH, v.resource(RUN_ID, UPDATE));
        rules.require(TrackingOperation.LOG_MODEL, v.resource(RUN_ID, UPDATE));
        rules.require(TrackingOperation.LOG_INPUTS, v.resource(RUN_ID, UPDATE));
        rules.require(TrackingOperation.SET_TAG, v.resource(RUN_ID, UPDATE));
        rules.require(TrackingOperation.DELETE_TAG, v.resource(RUN_ID, UPDATE));
        rules.require(TrackingOperation.LOG_PARAM, v.resource(RUN_ID, UPDATE));
        rules.require(TrackingOperation.LOG_OUTPUTS, v.resource(RUN_ID, UPDATE));
        rules.require(TrackingOperation.GET_METRIC_HISTORY, v.resource(RUN_ID, READ));
        rules.require(TrackingOperation.GET_METRIC_HISTORY_BULK, v.allRuns("run_id", READ));
        rules.require(TrackingOperation.GET_METRIC_HISTORY_BULK_INTERVAL, v.allRuns("run_ids", READ));
        rules.require(TrackingOperation.SEARCH_DATASETS, v.allExperiments(READ));
        rules.require(TrackingOperation.LIST_ARTIFACTS, v.resource(RUN_ID, READ));
        rules.require(TrackingOperation.UPLOAD_ARTIFACT, v.resourceInQuery(RUN_ID, UPDATE));
        rules.require(TrackingOperation.GET_ARTIFACT, v.resource(RUN_ID, READ));

        // Traces
        rules.require(TrackingOperation.START_TRACE, v.resource(EXPERIMENT_ID, UPDATE));
        rules.require(TrackingOperation.SEARCH_TRACES, v.allExperiments(READ));
        rules.require(TrackingOperation.DELETE_TRACES, v.resource(EXPERIMENT_ID, DELETE));
        rules.require(TrackingOperation.END_TRACE, v.resource(TRACE_REQUEST_ID, UPDATE));
        rules.require(TrackingOperation.GET_TRACE_INFO, v.resource(TRACE_REQUEST_ID, READ));
        rules.require(TrackingOperation.SET_TRACE_TAG, v.resource(TRACE_REQUEST_ID, UPDATE));
        rules.require(TrackingOperation.DELETE_TRACE_TAG, v.resource(TRACE_REQUEST_ID, UPDATE));
        rules.require(TrackingOperation.GET_TRACE_ARTIFACT, v.resource(TRACE_REQUEST_ID, READ));

        // Logged models are governed by their experiment too.
        rules.require(TrackingOperation.CREATE_LOGGED_MODEL, v.resource(EXPERIMENT_ID, UPDATE));
        rules.unrestricted(TrackingOperation.SEARCH_LOGGED_MODELS)
             .after(TrackingOperation.SEARCH_LOGGED_MODELS,
                     searchResultFilter.handlerFor(SearchableResource.LOGGED_MODELS));
        rules.require(TrackingOperation.GET_LOGGED_MODEL, v.resource(LOGGED_MODEL_ID, READ));
        rules.require(TrackingOperation.DELETE_LOGGED_MODEL, v.resource(LOGGED_MODEL_ID, DELETE));
        rules.require(TrackingOperation.FINALIZE_LOGGED_MODEL, v.resource(LOGGED_MODEL_ID, UPDATE));
        rules.require(TrackingOperation.SET_LOGGED_MODEL_TAGS, v.resource(LOGGED_MODEL_ID, UPDATE));
        rules.require(TrackingOperation.DELETE_LOGGED_MODEL_TAG, v.resource(LOGGED_MODEL_ID, DELETE));
        rules.require(TrackingOperation.LOG_LOGGED_MODEL_PARAMS, v.resource(LOGGED_MODEL_ID, UPDATE));
        rules.require(TrackingOperation.LIST_LOGGED_MODEL_ARTIFACTS, v.resource(LOGGED_MODEL_ID, READ));

        // Model registry
        rules.unrestricted(TrackingOperation.CREATE_REGISTERED_MODEL)
             .after(TrackingOperation.CREATE_REGISTERED_MODEL, ownership::grantManageOnCreatedRegisteredModel);
        rules.unrestricted(TrackingOperation.SEARCH_REGISTERED_MODELS)
             .after(TrackingOperation.SEARCH_REGISTERED_MODELS,
                     searchResultFilter.handlerFor(SearchableResource.REGISTERED_MODELS));
        rules.require(TrackingOperation.GET_REGISTERED_MODEL, v.resource(REGISTERED_MODEL_NAME, READ));
        rules.require(TrackingOperation.UPDATE_REGISTERED_MODEL, v.resource(REGISTERED_MODEL_NAME, UPDATE));
        rules.require(TrackingOperation.RENAME_REGISTERED_MODEL, v.resource(REGISTERED_MODEL_NAME, UPDATE))
             .after(TrackingOperation.RENAME_REGISTERED_MODEL, ownership::moveGrantsOfRenamedRegisteredModel);
        rules.require(TrackingOperation.DELETE_REGISTERED_MODEL, v.resource(REGISTERED_MODEL_NAME, DELETE))
             .after(TrackingOperation.DELETE_REGISTERED_MODEL, ownership::removeGrantsOnDeletedRegisteredModel);
        rules.require(TrackingOperation.GET_LATEST_VERSIONS, v.resource(REGISTERED_MODEL_NAME, READ));
        rules.require(TrackingOperation.SET_REGISTERED_MODEL_TAG, v.resource(REGISTERED_MODEL_NAME, UPDATE));
        rules.require(TrackingOperation.DELETE_REGISTERED_MODEL_TAG, v.resource(REGISTERED_MODEL_NAME, UPDATE));
        rules.require(TrackingOperation.SET_REGISTERED_MODEL_ALIAS, v.resource(REGISTERED_MODEL_NAME, UPDATE));
        rules.require(TrackingOperation.DELETE_REGISTERED_MODEL_ALIAS, v.resource(REGISTERED_MODEL_NAME, DELETE));
        rules.require(TrackingOperation.GET_MODEL_VERSION_BY_ALIAS, v.resource(REGISTERED_MODEL_NAME, READ));
        rules.require(TrackingOperation.CREATE_MODEL_VERSION, v.resource(REGISTERED_MODEL_NAME, UPDATE));
        // Model version search is not filtered: any authenticated user can list the versions of every model.
        rules.unrestricted(TrackingOperation.SEARCH_MODEL_VERSIONS);
        rules.require(TrackingOperation.GET_MODEL_VERSION, v.resource(REGISTERED_MODEL_NAME, READ));
        rules.require(TrackingOperation.UPDATE_MODEL_VERSION, v.resource(REGISTERED_MODEL_NAME, UPDATE));
        rules.require(TrackingOperation.DELETE_MODEL_VERSION, v.resource(REGISTERED_MODEL_NAME, DELETE));
        rules.require(TrackingOperation.TRANSITION_MODEL_VERSION_STAGE, v.resource(REGISTERED_MODEL_NAME, UPDATE));
        rules.require(TrackingOperation.GET_MODEL_VERSION_DOWNLOAD_URI, v.resource(REGISTERED_MODEL_NAME, READ));
        rules.require(TrackingOperation.SET_MODEL_VERSION_TAG, v.resource(REGISTERED_MODEL_NAME, UPDATE));
        rules.require(TrackingOperation.DELETE_MODEL_VERSION_TAG, v.resource(REGISTERED_MODEL_NAME, DELETE));
        rules.require(TrackingOperation.GET_MODEL_VERSION_ARTIFACT, v.resource(REGISTERED_MODEL_NAME, READ));

        // Accounts. Creating users and changing admin status is for administrators, who never reach a validator.
        rules.require(AuthOperation.CREATE_USER, Validators.adminOnly());
        rules.require(AuthOperation.GET_USER, Validators.usernameIsSender());
        rules.require(AuthOperation.UPDATE_USER_PASSWORD, Validators.usernameIsSender());
        rules.require(AuthOperation.UPDATE_USER_ADMIN, Validators.adminOnly());
        rules.require(AuthOperation.DELETE_USER, Validators.adminOnly());

        // Managing grants on a resource requires the MANAGE level on it.
        rules.require(AuthOperation.CREATE_EXPERIMENT_PERMISSION, v.resource(EXPERIMENT_ID, MANAGE));
        rules.require(AuthOperation.GET_EXPERIMENT_PERMISSION, v.resource(EXPERIMENT_ID, MANAGE));
        rules.require(AuthOperation.UPDATE_EXPERIMENT_PERMISSION, v.resource(EXPERIMENT_ID, MANAGE));
        rules.require(AuthOperation.DELETE_EXPERIMENT_PERMISSION, v.resource(EXPERIMENT_ID, MANAGE));
        rules.require(AuthOperation.CREATE_REGISTERED_MODEL_PERMISSION, v.resource(REGISTERED_MODEL_NAME, MANAGE));
        rules.require(AuthOperation.GET_REGISTERED_MODEL_PERMISSION, v.resource(REGISTERED_MODEL_NAME, MANAGE));
        rules.require(AuthOperation.UPDATE_REGISTERED_MODEL_PERMISSION, v.resource(REGISTERED_MODEL_NAME, MANAGE));
        rules.require(AuthOperation.DELETE_REGISTERED_MODEL_PERMISSION, v.resource(REGISTERED_MODEL_NAME, MANAGE));

        rules.unrestricted(AuthOperation.LOGOUT);

        rules.require(AuthOperation.ADMIN_LIST_USERS, Validators.adminOnly());
        rules.require(AuthOperation.ADMIN_CREATE_USER, Validators.adminOnly());
        rules.require(AuthOperation.ADMIN_DELETE_USER, Validators.adminOnly());
        rules.require(AuthOperation.ADMIN_GET_EXPERIMENT_PERMISSIONS, Validators.adminOnly());
        rules.require(AuthOperation.ADMIN_UPDATE_EXPERIMENT_PERMISSION, Validators.adminOnly());
        rules.require(AuthOperation.ADMIN_CREATE_EXPERIMENT, Validators.adminOnly());
        rules.require(AuthOperation.ADMIN_DELETE_EXPERIMENT, Validators.adminOnly());

        return rules;
    }

}
