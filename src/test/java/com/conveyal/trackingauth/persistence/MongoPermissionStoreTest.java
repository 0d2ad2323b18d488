package com.conveyal.trackingauth.persistence;

import com.conveyal.trackingauth.AuthServerException;
import com.conveyal.trackingauth.authorization.Permission;
import com.conveyal.trackingauth.authorization.ResourceKey;
import com.conveyal.trackingauth.authorization.ResourceType;
import com.conveyal.trackingauth.models.ResourcePermission;
import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.MongoException;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import org.bson.Document;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * Runs against a MongoDB server on localhost, in a throwaway database dropped after each test. Tests needing the
 * server are skipped when none is reachable.
 */
public class MongoPermissionStoreTest {

    private static final String DATABASE_URI = "mongodb://127.0.0.1:27017";

    private static MongoClient adminClient;
    private static boolean mongoAvailable;

    private String databaseName;
    private MongoPermissionStore store;

    @BeforeAll
    public static void connect () {
        MongoClientSettings settings = MongoClientSettings.builder()
                .applyConnectionString(new ConnectionString(DATABASE_URI))
                .applyToClusterSettings(cluster -> cluster.serverSelectionTimeout(2, TimeUnit.SECONDS))
                .build();
        adminClient = MongoClients.create(settings);
        try {
            adminClient.getDatabase("admin").runCommand(new Document("ping", 1));
            mongoAvailable = true;
        } catch (MongoException e) {
            mongoAvailable = false;
        }
    }

    @AfterAll
    public static void disconnect () {
        adminClient.close();
    }

    @BeforeEach
    public void setUp () {
        assumeTrue(mongoAvailable, "No MongoDB server on " + DATABASE_URI);
        databaseName = "tracking-auth-test-" + UUID.randomUUID();
        store = new MongoPermissionStore(new AuthDB(new AuthDB.Config() {
            @Override
            public String databaseName () {
                return databaseName;
            }
        }));
        store.createUser("alice", "secret-1", false);
        store.createUser("bob", "secret-2", false);
    }

    @AfterEach
    public void tearDown () {
        if (databaseName != null) adminClient.getDatabase(databaseName).drop();
    }

    @Test
    public void duplicateGrantsAreRejectedByTheIndex () {
        ResourceKey experiment = ResourceKey.experiment("1");
        store.createPermission(experiment, "alice", Permission.READ);
        AuthServerException e = assertThrows(AuthServerException.class,
                () -> store.createPermission(experiment, "alice", Permission.EDIT));
        assertEquals(AuthServerException.Type.ALREADY_EXISTS, e.type);
        assertEquals(409, e.httpCode);
        assertEquals(Permission.READ, store.getPermission(experiment, "alice").permission);
    }

    @Test
    public void duplicateUsersAreRejected () {
        AuthServerException e = assertThrows(AuthServerException.class,
                () -> store.createUser("alice", "other", false));
        assertEquals(AuthServerException.Type.ALREADY_EXISTS, e.type);
    }

    @Test
    public void renamingMovesGrantsAndReplacesConflictingOnes () {
        ResourceKey oldModel = ResourceKey.registeredModel("old");
        ResourceKey newModel = ResourceKey.registeredModel("new");
        store.createPermission(oldModel, "alice", Permission.MANAGE);
        store.createPermission(oldModel, "bob", Permission.READ);
        store.createPermission(newModel, "alice", Permission.READ);
        store.createPermission(ResourceKey.registeredModel("other"), "bob", Permission.EDIT);

        store.renameRegisteredModelPermissions("old", "new");

        assertThat(store.listPermissionsForResource(oldModel), empty());
        List<String> holders = store.listPermissionsForResource(newModel).stream()
                .map(grant -> grant.username)
                .collect(Collectors.toList());
        assertThat(holders, contains("alice", "bob"));
        assertEquals(Permission.MANAGE, store.getPermission(newModel, "alice").permission);
        assertEquals(Permission.READ, store.getPermission(newModel, "bob").permission);
        List<ResourcePermission> bobsModels = store.listPermissions(ResourceType.REGISTERED_MODEL, "bob");
        assertEquals(2, bobsModels.size());
        assertEquals(Permission.EDIT, store.getPermission(ResourceKey.registeredModel("other"), "bob").permission);
    }

    @Test
    public void deletingTwiceIsNotFound () {
        ResourceKey experiment = ResourceKey.experiment("1");
        store.createPermission(experiment, "alice", Permission.READ);
        store.deletePermission(experiment, "alice");
        AuthServerException again = assertThrows(AuthServerException.class,
                () -> store.deletePermission(experiment, "alice"));
        assertTrue(again.isNotFound());
    }

    @Test
    public void deletingAUserRemovesTheirGrants () {
        store.createPermission(ResourceKey.experiment("1"), "alice", Permission.EDIT);
        store.createPermission(ResourceKey.experiment("1"), "bob", Permission.READ);
        store.deleteUser("alice");
        assertFalse(store.hasUser("alice"));
        assertEquals(1, store.listPermissionsForResource(ResourceKey.experiment("1")).size());
    }

}
