package com.conveyal.trackingauth.controllers;

import com.conveyal.trackingauth.AuthenticatedUser;
import com.conveyal.trackingauth.authorization.ApiRequest;
import com.conveyal.trackingauth.authorization.AuthOperation;
import com.conveyal.trackingauth.authorization.Permission;
import com.conveyal.trackingauth.authorization.ResourceKey;
import com.conveyal.trackingauth.authorization.ResourceType;
import com.conveyal.trackingauth.authorization.RouteTable;
import com.conveyal.trackingauth.components.eventbus.EventBus;
import com.conveyal.trackingauth.components.eventbus.PermissionChangeEvent;
import com.conveyal.trackingauth.models.ResourcePermission;
import com.conveyal.trackingauth.persistence.PermissionStore;
import com.google.common.collect.ImmutableMap;
import spark.Request;
import spark.Response;

import java.util.Map;

import static com.conveyal.trackingauth.components.eventbus.PermissionChangeEvent.Action.GRANTED;
import static com.conveyal.trackingauth.components.eventbus.PermissionChangeEvent.Action.REVOKED;
import static com.conveyal.trackingauth.components.eventbus.PermissionChangeEvent.Action.UPDATED;
import static com.conveyal.trackingauth.util.JsonUtil.toJson;

/**
 * REST endpoints creating, reading, changing and removing grants on experiments and registered models. Callers need
 * MANAGE on the resource concerned, which the authorization filter has checked. The two resource types only differ
 * in the argument naming the resource and in the envelope the grant is wrapped in.
 */
public class PermissionController implements HttpController {

    private final PermissionStore store;
    private final EventBus eventBus;

    public PermissionController (PermissionStore store, EventBus eventBus) {
        this.store = store;
        this.eventBus = eventBus;
    }

    @Override
    public void registerEndpoints (spark.Service sparkService) {
        for (String prefix : RouteTable.REST_PREFIXES) {
            register(sparkService, prefix, ResourceType.EXPERIMENT,
                    AuthOperation.CREATE_EXPERIMENT_PERMISSION,
                    AuthOperation.GET_EXPERIMENT_PERMISSION,
                    AuthOperation.UPDATE_EXPERIMENT_PERMISSION,
                    AuthOperation.DELETE_EXPERIMENT_PERMISSION);
            register(sparkService, prefix, ResourceType.REGISTERED_MODEL,
                    AuthOperation.CREATE_REGISTERED_MODEL_PERMISSION,
                    AuthOperation.GET_REGISTERED_MODEL_PERMISSION,
                    AuthOperation.UPDATE_REGISTERED_MODEL_PERMISSION,
                    AuthOperation.DELETE_REGISTERED_MODEL_PERMISSION);
        }
    }

    private void register (spark.Service sparkService, String prefix, ResourceType type, AuthOperation create,
                           AuthOperation get, AuthOperation update, AuthOperation delete) {
        sparkService.post(prefix + create.path(), (req, res) -> createPermission(type, req), toJson);
        sparkService.get(prefix + get.path(), (req, res) -> getPermission(type, req), toJson);
        sparkService.patch(prefix + update.path(), (req, res) -> updatePermission(type, req), toJson);
        sparkService.delete(prefix + delete.path(), (req, res) -> deletePermission(type, req), toJson);
    }

    private Map<String, Object> createPermission (ResourceType type, Request req) {
        ApiRequest request = ApiRequest.from(req);
        ResourceKey resource = resourceOf(type, request);
        String username = request.param("username");
        Permission permission = Permission.fromName(request.param("permission"));
        ResourcePermission grant = store.createPermission(resource, username, permission);
        eventBus.send(new PermissionChangeEvent(GRANTED, resource.toString(), username, permission.name())
                .forUser(AuthenticatedUser.from(req)));
        return ImmutableMap.of(grant.envelopeName(), grant);
    }

    private Map<String, Object> getPermission (ResourceType type, Request req) {
        ApiRequest request = ApiRequest.from(req);
        ResourcePermission grant = store.getPermission(resourceOf(type, request), request.param("username"));
        return ImmutableMap.of(grant.envelopeName(), grant);
    }

    private Map<String, Object> updatePermission (ResourceType type, Request req) {
        ApiRequest request = ApiRequest.from(req);
        ResourceKey resource = resourceOf(type, request);
        String username = request.param("username");
        Permission permission = Permission.fromName(request.param("permission"));
        store.updatePermission(resource, username, permission);
        eventBus.send(new PermissionChangeEvent(UPDATED, resource.toString(), username, permission.name())
                .forUser(AuthenticatedUser.from(req)));
        return ImmutableMap.of();
    }

    private Map<String, Object> deletePermission (ResourceType type, Request req) {
        ApiRequest request = ApiRequest.from(req);
        ResourceKey resource = resourceOf(type, request);
        String username = request.param("username");
        store.deletePermission(resource, username);
        eventBus.send(new PermissionChangeEvent(REVOKED, resource.toString(), username, null)
                .forUser(AuthenticatedUser.from(req)));
        return ImmutableMap.of();
    }

    private static ResourceKey resourceOf (ResourceType type, ApiRequest request) {
        return new ResourceKey(type, request.param(type.keyField));
    }

}
