package com.conveyal.trackingauth.persistence;

import com.conveyal.trackingauth.AuthServerException;
import com.conveyal.trackingauth.authorization.Permission;
import com.conveyal.trackingauth.authorization.ResourceKey;
import com.conveyal.trackingauth.authorization.ResourceType;
import com.conveyal.trackingauth.models.ResourcePermission;
import com.conveyal.trackingauth.models.User;
import com.conveyal.trackingauth.util.PasswordHasher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Keeps users and grants in memory, for running locally without a database. Everything is lost on restart.
 * All methods synchronize on the store instance, which makes each of them atomic within this process.
 */
public class InMemoryPermissionStore implements PermissionStore {

    private static final Logger LOG = LoggerFactory.getLogger(InMemoryPermissionStore.class);

    private final Map<String, User> usersByName = new TreeMap<>();

    // Outer key is the resource, inner key is the username.
    private final Map<ResourceKey, Map<String, ResourcePermission>> grants = new HashMap<>();

    private long nextUserId = 1;

    @Override
    public synchronized User createUser (String username, String password, boolean admin) {
        if (usersByName.containsKey(username)) {
            throw AuthServerException.alreadyExists(String.format("User '%s' already exists.", username));
        }
        User user = new User(nextUserId++, username, PasswordHasher.hash(password), admin);
        usersByName.put(username, user);
        LOG.info("Created user {}", user);
        return user;
    }

    @Override
    public synchronized boolean hasUser (String username) {
        return usersByName.containsKey(username);
    }

    @Override
    public synchronized User getUser (String username) {
        User user = usersByName.get(username);
        if (user == null) {
            throw AuthServerException.notFound(String.format("User with username=%s not found", username));
        }
        return user;
    }

    @Override
    public synchronized User getUserById (long id) {
        return usersByName.values().stream()
                .filter(u -> u.id == id)
                .findFirst()
                .orElseThrow(() -> AuthServerException.notFound(String.format("User with id=%d not found", id)));
    }

    @Override
    public synchronized List<User> listUsers () {
        return new ArrayList<>(usersByName.values());
    }

    @Override
    public synchronized boolean authenticateUser (String username, String password) {
        User user = usersByName.get(username);
        return user != null && PasswordHasher.matches(password, user.passwordHash);
    }

    @Override
    public synchronized void updateUserPassword (String username, String password) {
        getUser(username).passwordHash = PasswordHasher.hash(password);
    }

    @Override
    public synchronized void updateUserAdmin (String username, boolean admin) {
        getUser(username).admin = admin;
    }

    @Override
    public synchronized void deleteUser (String username) {
        getUser(username);
        int removed = 0;
        for (Map<String, ResourcePermission> grantsOnResource : grants.values()) {
            if (grantsOnResource.remove(username) != null) removed++;
        }
        grants.values().removeIf(Map::isEmpty);
        usersByName.remove(username);
        LOG.info("Deleted user {} and {} grants held by that user.", username, removed);
    }

    @Override
    public synchronized ResourcePermission createPermission (
            ResourceKey resource, String username, Permission permission
    ) {
        User user = getUser(username);
        Map<String, ResourcePermission> grantsOnResource = grants.computeIfAbsent(resource, r -> new TreeMap<>());
        if (grantsOnResource.containsKey(username)) {
            throw AuthServerException.alreadyExists(
                    String.format("Permission on %s for user %s already exists.", resource, username));
        }
        ResourcePermission grant = new ResourcePermission(resource, user.id, username, permission);
        grantsOnResource.put(username, grant);
        return grant;
    }

    @Override
    public synchronized ResourcePermission getPermission (ResourceKey resource, String username) {
        ResourcePermission grant = grants.getOrDefault(resource, Map.of()).get(username);
        if (grant == null) {
            throw AuthServerException.notFound(
                    String.format("Permission on %s for user %s not found.", resource, username));
        }
        return grant;
    }

    @Override
    public synchronized ResourcePermission updatePermission (
            ResourceKey resource, String username, Permission permission
    ) {
        ResourcePermission updated = getPermission(resource, username).withPermission(permission);
        grants.get(resource).put(username, updated);
        return updated;
    }

    @Override
    public synchronized ResourcePermission updateOrCreatePermission (
            ResourceKey resource, String username, Permission permission
    ) {
        if (grants.getOrDefault(resource, Map.of()).containsKey(username)) {
            return updatePermission(resource, username, permission);
        }
        return createPermission(resource, username, permission);
    }

    @Override
    public synchronized void deletePermission (ResourceKey resource, String username) {
        getPermission(resource, username);
        Map<String, ResourcePermission> grantsOnResource = grants.get(resource);
        grantsOnResource.remove(username);
        if (grantsOnResource.isEmpty()) grants.remove(resource);
    }

    @Override
    public synchronized List<ResourcePermission> listPermissions (ResourceType resourceType, String username) {
        return grants.values().stream()
                .map(grantsOnResource -> grantsOnResource.get(username))
                .filter(grant -> grant != null && grant.resource.type == resourceType)
                .sorted(Comparator.comparing(grant -> grant.resource.key))
                .collect(Collectors.toList());
    }

    @Override
    public synchronized List<ResourcePermission> listPermissionsForResource (ResourceKey resource) {
        // The inner maps are TreeMaps, so values come out ordered by username.
        return new ArrayList<>(grants.getOrDefault(resource, Map.of()).values());
    }

    @Override
    public synchronized int deletePermissionsForResource (ResourceKey resource) {
        Map<String, ResourcePermission> removed = grants.remove(resource);
        return removed == null ? 0 : removed.size();
    }

    @Override
    public synchronized void renameRegisteredModelPermissions (String oldName, String newName) {
        ResourceKey oldKey = ResourceKey.registeredModel(oldName);
        ResourceKey newKey = ResourceKey.registeredModel(newName);
        if (oldKey.equals(newKey)) return;
        Map<String, ResourcePermission> moving = grants.remove(oldKey);
        if (moving == null) return;
        Map<String, ResourcePermission> target = grants.computeIfAbsent(newKey, r -> new TreeMap<>());
        for (ResourcePermission grant : moving.values()) {
            ResourcePermission replaced = target.put(grant.username, grant.withResource(newKey));
            if (replaced != null) {
                LOG.info("Grant {} replaced by the grant moved from {}.", replaced, oldKey);
            }
        }
    }

}
