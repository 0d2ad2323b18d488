package com.conveyal.trackingauth.models;

import com.conveyal.trackingauth.authorization.Permission;
import com.conveyal.trackingauth.authorization.ResourceKey;
import com.conveyal.trackingauth.authorization.ResourceType;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.node.ObjectNode;

import static com.conveyal.trackingauth.util.JsonUtil.objectNode;

/**
 * A grant of one permission level to one user on one resource. There is at most one grant per resource and user.
 */
public class ResourcePermission {

    public final ResourceKey resource;
    public final long userId;
    public final String username;
    public final Permission permission;

    public ResourcePermission (ResourceKey resource, long userId, String username, Permission permission) {
        this.resource = resource;
        this.userId = userId;
        this.username = username;
        this.permission = permission;
    }

    public ResourcePermission withPermission (Permission newPermission) {
        return new ResourcePermission(resource, userId, username, newPermission);
    }

    public ResourcePermission withResource (ResourceKey newResource) {
        return new ResourcePermission(newResource, userId, username, permission);
    }

    /**
     * The wire form depends on the resource type: experiment grants carry experiment_id, registered model grants
     * carry name.
     */
    @JsonValue
    public ObjectNode toJson () {
        ObjectNode json = objectNode();
        json.put(resource.type.keyField, resource.key);
        json.put("user_id", userId);
        json.put("username", username);
        json.put("permission", permission.name());
        return json;
    }

    /** The name of the envelope property a single grant of this type is wrapped in when returned over the API. */
    public String envelopeName () {
        return resource.type == ResourceType.EXPERIMENT ? "experiment_permission" : "registered_model_permission";
    }

    @Override
    public String toString () {
        return String.format("%s on %s for %s", permission, resource, username);
    }
}
