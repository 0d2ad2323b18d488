package com.conveyal.trackingauth.authorization;

import com.conveyal.trackingauth.AuthServerException;
import com.conveyal.trackingauth.models.ResourcePermission;
import com.conveyal.trackingauth.persistence.PermissionStore;

import java.util.HashMap;
import java.util.Map;

/**
 * Finds the permission level a user holds on a resource. A user without a grant holds the configured default level;
 * this is the only place where a missing grant is turned into something other than an error.
 */
public class PermissionEvaluator {

    public interface Config {
        Permission defaultPermission ();
    }

    private final PermissionStore store;
    private final Permission defaultPermission;

    public PermissionEvaluator (PermissionStore store, Config config) {
        this.store = store;
        this.defaultPermission = config.defaultPermission();
    }

    /** @param resource may be null for requests not tied to a specific resource, which get the default level. */
    public Permission permissionFor (ResourceKey resource, String username) {
        if (resource == null) return defaultPermission;
        try {
            return store.getPermission(resource, username).permission;
        } catch (AuthServerException e) {
            if (e.isNotFound()) return defaultPermission;
            throw e;
        }
    }

    public ReadAccess readAccessFor (ResourceType resourceType, String username) {
        Map<String, Boolean> canRead = new HashMap<>();
        for (ResourcePermission grant : store.listPermissions(resourceType, username)) {
            canRead.put(grant.resource.key, grant.permission.canRead);
        }
        return new ReadAccess(canRead, defaultPermission.canRead);
    }

    public Permission defaultPermission () {
        return defaultPermission;
    }

}
