package com.conveyal.trackingauth.controllers;

import com.conveyal.trackingauth.AuthServerException;
import com.conveyal.trackingauth.AuthenticatedUser;
import com.conveyal.trackingauth.authorization.ApiRequest;
import com.conveyal.trackingauth.authorization.Permission;
import com.conveyal.trackingauth.authorization.ResourceKey;
import com.conveyal.trackingauth.components.eventbus.EventBus;
import com.conveyal.trackingauth.components.eventbus.PermissionChangeEvent;
import com.conveyal.trackingauth.models.ResourcePermission;
import com.conveyal.trackingauth.models.User;
import com.conveyal.trackingauth.persistence.PermissionStore;
import com.conveyal.trackingauth.upstream.Experiment;
import com.conveyal.trackingauth.upstream.TrackingStore;
import com.google.common.collect.ImmutableMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import spark.Request;
import spark.Response;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static com.conveyal.trackingauth.authorization.AuthOperation.ADMIN_CREATE_EXPERIMENT;
import static com.conveyal.trackingauth.authorization.AuthOperation.ADMIN_CREATE_USER;
import static com.conveyal.trackingauth.authorization.AuthOperation.ADMIN_DELETE_EXPERIMENT;
import static com.conveyal.trackingauth.authorization.AuthOperation.ADMIN_DELETE_USER;
import static com.conveyal.trackingauth.authorization.AuthOperation.ADMIN_GET_EXPERIMENT_PERMISSIONS;
import static com.conveyal.trackingauth.authorization.AuthOperation.ADMIN_LIST_USERS;
import static com.conveyal.trackingauth.authorization.AuthOperation.ADMIN_UPDATE_EXPERIMENT_PERMISSION;
import static com.conveyal.trackingauth.components.eventbus.PermissionChangeEvent.Action.GRANTED;
import static com.conveyal.trackingauth.components.eventbus.PermissionChangeEvent.Action.REVOKED;
import static com.conveyal.trackingauth.components.eventbus.PermissionChangeEvent.Action.USER_CREATED;
import static com.conveyal.trackingauth.components.eventbus.PermissionChangeEvent.Action.USER_DELETED;
import static com.conveyal.trackingauth.util.JsonUtil.toJson;

/**
 * JSON API behind the administration panel: listing, creating and deleting users, and managing experiments together
 * with their grants. All of these are restricted to administrators by the authorization filter.
 *
 * Deleting users is further limited. Nobody deletes their own account or the bootstrap administrator configured at
 * startup, and only the bootstrap administrator deletes other administrators.
 */
public class AdminController implements HttpController {

    private static final Logger LOG = LoggerFactory.getLogger(AdminController.class);

    /** The experiment every tracking server starts out with. */
    static final String DEFAULT_EXPERIMENT_NAME = "Default";

    public interface Config {
        String adminUsername ();
    }

    private final PermissionStore store;
    private final TrackingStore trackingStore;
    private final EventBus eventBus;
    private final Config config;

    public AdminController (PermissionStore store, TrackingStore trackingStore, EventBus eventBus, Config config) {
        this.store = store;
        this.trackingStore = trackingStore;
        this.eventBus = eventBus;
        this.config = config;
    }

    @Override
    public void registerEndpoints (spark.Service sparkService) {
        sparkService.get(ADMIN_LIST_USERS.sparkPath(), this::listUsers, toJson);
        sparkService.post(ADMIN_CREATE_USER.sparkPath(), this::createUser, toJson);
        sparkService.post(ADMIN_DELETE_USER.sparkPath(), this::deleteUser, toJson);
        sparkService.get(ADMIN_GET_EXPERIMENT_PERMISSIONS.sparkPath(), this::getExperimentPermissions, toJson);
        sparkService.post(ADMIN_UPDATE_EXPERIMENT_PERMISSION.sparkPath(), this::updateExperimentPermission, toJson);
        sparkService.post(ADMIN_CREATE_EXPERIMENT.sparkPath(), this::createExperiment, toJson);
        sparkService.post(ADMIN_DELETE_EXPERIMENT.sparkPath(), this::deleteExperiment, toJson);
    }

    private Map<String, Object> listUsers (Request req, Response res) {
        List<User> users = store.listUsers().stream()
                .map(user -> UserController.withPermissions(store, user))
                .collect(Collectors.toList());
        return ImmutableMap.of("users", users);
    }

    private Map<String, Object> createUser (Request req, Response res) {
        ApiRequest request = ApiRequest.from(req);
        String username = request.param("username");
        String password = request.param("password");
        boolean admin = request.hasParam("is_admin") && UserController.booleanParam(request, "is_admin");
        if (username.isBlank() || password.isEmpty()) {
            throw AuthServerException.invalidRequest("Username and password must not be empty.");
        }
        User user = store.createUser(username, password, admin);
        eventBus.send(new PermissionChangeEvent(USER_CREATED, null, username, admin ? "administrator" : null)
                .forUser(AuthenticatedUser.from(req)));
        return ImmutableMap.of("user", UserController.withPermissions(store, user));
    }

    private Map<String, Object> deleteUser (Request req, Response res) {
        AuthenticatedUser caller = AuthenticatedUser.from(req);
        User target = store.getUserById(longPathParam(req, "user_id"));
        checkDeletable(caller, target);
        store.deleteUser(target.username);
        eventBus.send(new PermissionChangeEvent(USER_DELETED, null, target.username, null).forUser(caller));
        return ImmutableMap.of();
    }

    /** @throws AuthServerException FORBIDDEN when the caller may not delete the target account. */
    void checkDeletable (AuthenticatedUser caller, User target) {
        if (target.username.equals(caller.username)) {
            throw AuthServerException.forbidden("You cannot delete your own account.");
        }
        if (target.username.equals(config.adminUsername())) {
            throw AuthServerException.forbidden("The bootstrap administrator cannot be deleted.");
        }
        if (target.admin && !caller.username.equals(config.adminUsername())) {
            throw AuthServerException.forbidden("Only the bootstrap administrator can delete other administrators.");
        }
    }

    private Map<String, Object> getExperimentPermissions (Request req, Response res) {
        Experiment experiment = trackingStore.getExperiment(req.params("experiment_id"));
        List<ResourcePermission> grants = store.listPermissionsForResource(
                ResourceKey.experiment(experiment.experimentId));
        return ImmutableMap.of(
                "experiment_id", experiment.experimentId,
                "experiment_name", experiment.name == null ? "" : experiment.name,
                "experiment_permissions", grants
        );
    }

    private Map<String, Object> updateExperimentPermission (Request req, Response res) {
        ApiRequest request = ApiRequest.from(req);
        Experiment experiment = trackingStore.getExperiment(req.params("experiment_id"));
        ResourceKey resource = ResourceKey.experiment(experiment.experimentId);
        String username = request.param("username");
        Permission permission = Permission.fromName(request.param("permission"));
        ResourcePermission grant = store.updateOrCreatePermission(resource, username, permission);
        eventBus.send(new PermissionChangeEvent(GRANTED, resource.toString(), username, permission.name())
                .forUser(AuthenticatedUser.from(req)));
        return ImmutableMap.of(grant.envelopeName(), grant);
    }

    /** The administrator creating the experiment becomes its manager, as anyone creating one through the API does. */
    private Map<String, Object> createExperiment (Request req, Response res) {
        AuthenticatedUser caller = AuthenticatedUser.from(req);
        String name = ApiRequest.from(req).param("name");
        if (name.isBlank()) {
            throw AuthServerException.invalidRequest("Experiment name must not be empty.");
        }
        String experimentId = trackingStore.createExperiment(name);
        ResourceKey resource = ResourceKey.experiment(experimentId);
        store.updateOrCreatePermission(resource, caller.username, Permission.MANAGE);
        eventBus.send(new PermissionChangeEvent(GRANTED, resource.toString(), caller.username, "MANAGE as creator")
                .forUser(caller));
        return ImmutableMap.of("experiment_id", experimentId);
    }

    /**
     * Deletes the experiment on the tracking server, then removes its grants. The tracking server has already
     * deleted the experiment when grant removal runs, so a failure there is logged rather than reported.
     */
    private Map<String, Object> deleteExperiment (Request req, Response res) {
        Experiment experiment = trackingStore.getExperiment(req.params("experiment_id"));
        if (DEFAULT_EXPERIMENT_NAME.equals(experiment.name)) {
            throw AuthServerException.invalidRequest("The Default experiment cannot be deleted.");
        }
        trackingStore.deleteExperiment(experiment.experimentId);
        ResourceKey resource = ResourceKey.experiment(experiment.experimentId);
        try {
            int removed = store.deletePermissionsForResource(resource);
            eventBus.send(new PermissionChangeEvent(REVOKED, resource.toString(), null,
                    removed + " grants removed with the experiment").forUser(AuthenticatedUser.from(req)));
        } catch (RuntimeException e) {
            LOG.error("Experiment {} was deleted but its grants could not be removed.", experiment.experimentId, e);
        }
        return ImmutableMap.of();
    }

    private static long longPathParam (Request req, String name) {
        String value = req.params(name);
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw AuthServerException.invalidRequest(String.format("Parameter '%s' must be an integer, got '%s'.",
                    name, value));
        }
    }

}
