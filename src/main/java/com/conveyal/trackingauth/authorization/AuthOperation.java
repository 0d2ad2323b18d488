package com.conveyal.trackingauth.authorization;

import com.google.common.collect.ImmutableSet;

import java.util.Set;

/** Endpoints served by the authorization layer itself: account and grant management, logout and the admin API. */
public enum AuthOperation implements ApiOperation {

    CREATE_USER ("/mlflow/users/create", "POST"),
    GET_USER ("/mlflow/users/get", "GET"),
    UPDATE_USER_PASSWORD ("/mlflow/users/update-password", "PATCH"),
    UPDATE_USER_ADMIN ("/mlflow/users/update-admin", "PATCH"),
    DELETE_USER ("/mlflow/users/delete", "DELETE"),

    CREATE_EXPERIMENT_PERMISSION ("/mlflow/experiments/permissions/create", "POST"),
    GET_EXPERIMENT_PERMISSION ("/mlflow/experiments/permissions/get", "GET"),
    UPDATE_EXPERIMENT_PERMISSION ("/mlflow/experiments/permissions/update", "PATCH"),
    DELETE_EXPERIMENT_PERMISSION ("/mlflow/experiments/permissions/delete", "DELETE"),

    CREATE_REGISTERED_MODEL_PERMISSION ("/mlflow/registered-models/permissions/create", "POST"),
    GET_REGISTERED_MODEL_PERMISSION ("/mlflow/registered-models/permissions/get", "GET"),
    UPDATE_REGISTERED_MODEL_PERMISSION ("/mlflow/registered-models/permissions/update", "PATCH"),
    DELETE_REGISTERED_MODEL_PERMISSION ("/mlflow/registered-models/permissions/delete", "DELETE"),

    LOGOUT (false, "/logout", "GET"),

    ADMIN_LIST_USERS (false, "/admin/users", "GET"),
    ADMIN_CREATE_USER (false, "/admin/users", "POST"),
    ADMIN_DELETE_USER (false, "/admin/users/<user_id>/delete", "POST"),
    ADMIN_GET_EXPERIMENT_PERMISSIONS (false, "/admin/experiments/<experiment_id>/permissions", "GET"),
    ADMIN_UPDATE_EXPERIMENT_PERMISSION (false, "/admin/experiments/<experiment_id>/permissions", "POST"),
    ADMIN_CREATE_EXPERIMENT (false, "/admin/experiments/create", "POST"),
    ADMIN_DELETE_EXPERIMENT (false, "/admin/experiments/<experiment_id>/delete", "POST");

    private final boolean restApi;
    private final String path;
    private final Set<String> methods;

    AuthOperation (String path, String... methods) {
        this(true, path, methods);
    }

    AuthOperation (boolean restApi, String path, String... methods) {
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

    /** The path in Spark's route syntax, with :name in place of each bracketed parameter. */
    public String sparkPath () {
        return path.replaceAll("<([^>:]+:)?([^>]+)>", ":$2");
    }

}
