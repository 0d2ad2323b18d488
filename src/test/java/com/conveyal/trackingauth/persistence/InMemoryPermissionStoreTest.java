package com.conveyal.trackingauth.persistence;

import com.conveyal.trackingauth.AuthServerException;
import com.conveyal.trackingauth.authorization.Permission;
import com.conveyal.trackingauth.authorization.ResourceKey;
import com.conveyal.trackingauth.authorization.ResourceType;
import com.conveyal.trackingauth.models.ResourcePermission;
import com.conveyal.trackingauth.models.User;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class InMemoryPermissionStoreTest {

    private InMemoryPermissionStore store;

    @BeforeEach
    public void setUp () {
        store = new InMemoryPermissionStore();
    }

    @Test
    public void usersGetDistinctIdsAndHashedPasswords () {
        User alice = store.createUser("alice", "secret-1", false);
        User bob = store.createUser("bob", "secret-2", true);
        assertNotEquals(alice.id, bob.id);
        assertNotEquals("secret-1", alice.passwordHash);
        assertTrue(store.authenticateUser("alice", "secret-1"));
        assertFalse(store.authenticateUser("alice", "secret-2"));
        assertFalse(store.authenticateUser("nobody", "secret-1"));
        assertEquals("bob", store.getUserById(bob.id).username);
    }

    @Test
    public void duplicateUsersAreRejected () {
        store.createUser("alice", "secret-1", false);
        AuthServerException e = assertThrows(AuthServerException.class,
                () -> store.createUser("alice", "other", false));
        assertEquals(AuthServerException.Type.ALREADY_EXISTS, e.type);
        assertEquals(409, e.httpCode);
    }

    @Test
    public void adminBootstrapIsIdempotent () {
        store.createAdminUser("admin", "password1234");
        store.createAdminUser("admin", "changed");
        assertEquals(1, store.listUsers().size());
        assertTrue(store.getUser("admin").admin);
        assertTrue(store.authenticateUser("admin", "password1234"));
    }

    @Test
    public void passwordAndAdminUpdates () {
        store.createUser("alice", "secret-1", false);
        store.updateUserPassword("alice", "secret-2");
        assertTrue(store.authenticateUser("alice", "secret-2"));
        store.updateUserAdmin("alice", true);
        assertTrue(store.getUser("alice").admin);
    }

    @Test
    public void deletingTwiceIsNotFound () {
        store.createUser("alice", "secret-1", false);
        store.createPermission(ResourceKey.experiment("1"), "alice", Permission.READ);
        store.deletePermission(ResourceKey.experiment("1"), "alice");
        AuthServerException again = assertThrows(AuthServerException.class,
                () -> store.deletePermission(ResourceKey.experiment("1"), "alice"));
        assertTrue(again.isNotFound());

        store.deleteUser("alice");
        assertThrows(AuthServerException.class, () -> store.deleteUser("alice"));
    }

    @Test
    public void deletingAUserDeletesTheirGrants () {
        store.createUser("bob", "secret-1", false);
        store.createUser("carol", "secret-2", false);
        store.createPermission(ResourceKey.experiment("42"), "bob", Permission.EDIT);
        store.createPermission(ResourceKey.experiment("42"), "carol", Permission.READ);

        store.deleteUser("bob");

        assertFalse(store.hasUser("bob"));
        assertThrows(AuthServerException.class, () -> store.getPermission(ResourceKey.experiment("42"), "bob"));
        List<String> holders = store.listPermissionsForResource(ResourceKey.experiment("42")).stream()
                .map(grant -> grant.username)
                .collect(Collectors.toList());
        assertThat(holders, contains("carol"));
        store.createUser("bob", "secret-3", false);
        assertThat(store.listPermissions(ResourceType.EXPERIMENT, "bob"), empty());
    }

    @Test
    public void grantsNeedAnExistingUserAndAreUniquePerResource () {
        assertThrows(AuthServerException.class,
                () -> store.createPermission(ResourceKey.experiment("1"), "ghost", Permission.READ));
        store.createUser("alice", "secret-1", false);
        store.createPermission(ResourceKey.experiment("1"), "alice", Permission.READ);
        AuthServerException e = assertThrows(AuthServerException.class,
                () -> store.createPermission(ResourceKey.experiment("1"), "alice", Permission.EDIT));
        assertEquals(AuthServerException.Type.ALREADY_EXISTS, e.type);
        // The same key under another resource type is a different resource.
        store.createPermission(ResourceKey.registeredModel("1"), "alice", Permission.MANAGE);
        assertEquals(Permission.READ, store.getPermission(ResourceKey.experiment("1"), "alice").permission);
    }

    @Test
    public void updateOrCreateUpserts () {
        store.createUser("alice", "secret-1", false);
        ResourcePermission created = store.updateOrCreatePermission(ResourceKey.experiment("7"), "alice",
                Permission.READ);
        assertEquals(Permission.READ, created.permission);
        store.updateOrCreatePermission(ResourceKey.experiment("7"), "alice", Permission.MANAGE);
        assertEquals(Permission.MANAGE, store.getPermission(ResourceKey.experiment("7"), "alice").permission);
        assertThrows(AuthServerException.class,
                () -> store.updatePermission(ResourceKey.experiment("8"), "alice", Permission.READ));
    }

    @Test
    public void renamingMovesEveryGrant () {
        store.createUser("alice", "secret-1", false);
        store.createUser("bob", "secret-2", false);
        store.createPermission(ResourceKey.registeredModel("old"), "alice", Permission.MANAGE);
        store.createPermission(ResourceKey.registeredModel("old"), "bob", Permission.READ);

        store.renameRegisteredModelPermissions("old", "new");

        assertThat(store.listPermissionsForResource(ResourceKey.registeredModel("old")), empty());
        List<ResourcePermission> moved = store.listPermissionsForResource(ResourceKey.registeredModel("new"));
        assertEquals(2, moved.size());
        assertEquals("new", moved.get(0).resource.key);
        assertEquals(Permission.MANAGE, store.getPermission(ResourceKey.registeredModel("new"), "alice").permission);
        // Renaming a model without grants does nothing.
        store.renameRegisteredModelPermissions("unknown", "other");
        assertThat(store.listPermissionsForResource(ResourceKey.registeredModel("other")), empty());
    }

    @Test
    public void listsGrantsByTypeOrderedByKey () {
        store.createUser("alice", "secret-1", false);
        store.createPermission(ResourceKey.experiment("9"), "alice", Permission.READ);
        store.createPermission(ResourceKey.experiment("10"), "alice", Permission.EDIT);
        store.createPermission(ResourceKey.registeredModel("m"), "alice", Permission.READ);
        List<String> keys = store.listPermissions(ResourceType.EXPERIMENT, "alice").stream()
                .map(grant -> grant.resource.key)
                .collect(Collectors.toList());
        assertThat(keys, contains("10", "9"));
        assertEquals(2, store.deletePermissionsForResource(ResourceKey.experiment("9"))
                + store.deletePermissionsForResource(ResourceKey.experiment("10")));
    }

}
