package com.conveyal.trackingauth.controllers;

import com.conveyal.trackingauth.AuthServerException;
import com.conveyal.trackingauth.AuthenticatedUser;
import com.conveyal.trackingauth.authorization.ApiRequest;
import com.conveyal.trackingauth.authorization.ResourceType;
import com.conveyal.trackingauth.authorization.RouteTable;
import com.conveyal.trackingauth.components.eventbus.EventBus;
import com.conveyal.trackingauth.components.eventbus.PermissionChangeEvent;
import com.conveyal.trackingauth.models.User;
import com.conveyal.trackingauth.persistence.PermissionStore;
import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableMap;
import spark.Request;
import spark.Response;

import java.util.Map;

import static com.conveyal.trackingauth.authorization.AuthOperation.CREATE_USER;
import static com.conveyal.trackingauth.authorization.AuthOperation.DELETE_USER;
import static com.conveyal.trackingauth.authorization.AuthOperation.GET_USER;
import static com.conveyal.trackingauth.authorization.AuthOperation.UPDATE_USER_ADMIN;
import static com.conveyal.trackingauth.authorization.AuthOperation.UPDATE_USER_PASSWORD;
import static com.conveyal.trackingauth.components.eventbus.PermissionChangeEvent.Action.USER_CREATED;
import static com.conveyal.trackingauth.components.eventbus.PermissionChangeEvent.Action.USER_DELETED;
import static com.conveyal.trackingauth.components.eventbus.PermissionChangeEvent.Action.USER_UPDATED;
import static com.conveyal.trackingauth.util.JsonUtil.toJson;

/**
 * REST endpoints managing user accounts. Who may call each of them was already decided by the authorization filter:
 * users may read their own account and change their own password, everything else is for administrators.
 */
public class UserController implements HttpController {

    private final PermissionStore store;
    private final EventBus eventBus;

    public UserController (PermissionStore store, EventBus eventBus) {
        this.store = store;
        this.eventBus = eventBus;
    }

    @Override
    public void registerEndpoints (spark.Service sparkService) {
        for (String prefix : RouteTable.REST_PREFIXES) {
            sparkService.post(prefix + CREATE_USER.path(), this::createUser, toJson);
            sparkService.get(prefix + GET_USER.path(), this::getUser, toJson);
            sparkService.patch(prefix + UPDATE_USER_PASSWORD.path(), this::updatePassword, toJson);
            sparkService.patch(prefix + UPDATE_USER_ADMIN.path(), this::updateAdmin, toJson);
            sparkService.delete(prefix + DELETE_USER.path(), this::deleteUser, toJson);
        }
        // Accounts are not self-service. The page only exists so that the path does not reach the tracking server.
        sparkService.get("/signup", (req, res) -> {
            res.type("text/plain");
            return "Accounts are created by an administrator.";
        });
    }

    private Map<String, Object> createUser (Request req, Response res) {
        ApiRequest request = ApiRequest.from(req);
        if (!request.isJson()) {
            throw AuthServerException.invalidRequest("Invalid content type, expected application/json.");
        }
        String username = request.param("username");
        String password = request.param("password");
        if (username.isBlank() || password.isEmpty()) {
            throw AuthServerException.invalidRequest("Username and password must not be empty.");
        }
        User user = store.createUser(username, password, false);
        eventBus.send(new PermissionChangeEvent(USER_CREATED, null, username, null).forUser(AuthenticatedUser.from(req)));
        return ImmutableMap.of("user", withPermissions(store, user));
    }

    private Map<String, Object> getUser (Request req, Response res) {
        User user = store.getUser(ApiRequest.from(req).param("username"));
        return ImmutableMap.of("user", withPermissions(store, user));
    }

    private Map<String, Object> updatePassword (Request req, Response res) {
        ApiRequest request = ApiRequest.from(req);
        String username = request.param("username");
        String password = request.param("password");
        if (password.isEmpty()) {
            throw AuthServerException.invalidRequest("Password must not be empty.");
        }
        store.updateUserPassword(username, password);
        eventBus.send(new PermissionChangeEvent(USER_UPDATED, null, username, "password changed")
                .forUser(AuthenticatedUser.from(req)));
        return ImmutableMap.of();
    }

    private Map<String, Object> updateAdmin (Request req, Response res) {
        ApiRequest request = ApiRequest.from(req);
        String username = request.param("username");
        boolean admin = booleanParam(request, "is_admin");
        store.updateUserAdmin(username, admin);
        eventBus.send(new PermissionChangeEvent(USER_UPDATED, null, username, "is_admin=" + admin)
                .forUser(AuthenticatedUser.from(req)));
        return ImmutableMap.of();
    }

    private Map<String, Object> deleteUser (Request req, Response res) {
        String username = ApiRequest.from(req).param("username");
        store.deleteUser(username);
        eventBus.send(new PermissionChangeEvent(USER_DELETED, null, username, null)
                .forUser(AuthenticatedUser.from(req)));
        return ImmutableMap.of();
    }

    /** The account as returned over the API, with every grant the user holds. */
    static User withPermissions (PermissionStore store, User user) {
        return user.withPermissions(
                store.listPermissions(ResourceType.EXPERIMENT, user.username),
                store.listPermissions(ResourceType.REGISTERED_MODEL, user.username)
        );
    }

    /** Accepts a JSON boolean or its text form. */
    static boolean booleanParam (ApiRequest request, String name) {
        JsonNode node = request.paramNode(name);
        if (node == null || node.isNull()) throw AuthServerException.missingParameter(name);
        if (node.isBoolean()) return node.booleanValue();
        String text = node.asText();
        if ("true".equalsIgnoreCase(text)) return true;
        if ("false".equalsIgnoreCase(text)) return false;
        throw AuthServerException.invalidRequest(String.format("Parameter '%s' must be true or false.", name));
    }

}
