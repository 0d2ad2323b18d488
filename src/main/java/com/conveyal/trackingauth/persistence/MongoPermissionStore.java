package com.conveyal.trackingauth.persistence;

import com.conveyal.trackingauth.AuthServerException;
import com.conveyal.trackingauth.authorization.Permission;
import com.conveyal.trackingauth.authorization.ResourceKey;
import com.conveyal.trackingauth.authorization.ResourceType;
import com.conveyal.trackingauth.models.ResourcePermission;
import com.conveyal.trackingauth.models.User;
import com.conveyal.trackingauth.util.PasswordHasher;
import com.mongodb.ErrorCategory;
import com.mongodb.MongoWriteException;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.FindOneAndUpdateOptions;
import com.mongodb.client.model.IndexOptions;
import com.mongodb.client.model.Indexes;
import com.mongodb.client.model.ReplaceOptions;
import com.mongodb.client.model.ReturnDocument;
import com.mongodb.client.model.Sorts;
import com.mongodb.client.model.Updates;
import com.mongodb.client.result.DeleteResult;
import com.mongodb.client.result.UpdateResult;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static com.mongodb.client.model.Filters.and;
import static com.mongodb.client.model.Filters.eq;

/**
 * Users and grants stored in MongoDB. Users are keyed by username, with a numeric id drawn from a counter document.
 * Grants carry a unique index on (resource type, resource key, username). Uniqueness is enforced by the database, so
 * several server processes can share one database; a duplicate key error on insert is reported as ALREADY_EXISTS.
 */
public class MongoPermissionStore implements PermissionStore {

    private static final Logger LOG = LoggerFactory.getLogger(MongoPermissionStore.class);

    /** Grants created on the old name during a rename are picked up by another pass, up to this many. */
    private static final int MAX_RENAME_PASSES = 10;

    private final MongoCollection<Document> users;
    private final MongoCollection<Document> grants;
    private final MongoCollection<Document> counters;

    public MongoPermissionStore (AuthDB database) {
        users = database.getBsonCollection("users");
        grants = database.getBsonCollection("permissions");
        counters = database.getBsonCollection("counters");
        users.createIndex(Indexes.ascending("userId"), new IndexOptions().unique(true));
        grants.createIndex(Indexes.ascending("resourceType", "resourceKey", "username"),
                new IndexOptions().unique(true));
        grants.createIndex(Indexes.ascending("username", "resourceType"));
    }

    // USERS

    @Override
    public User createUser (String username, String password, boolean admin) {
        if (hasUser(username)) {
            throw AuthServerException.alreadyExists(String.format("User '%s' already exists.", username));
        }
        User user = new User(nextUserId(), username, PasswordHasher.hash(password), admin);
        try {
            users.insertOne(new Document("_id", username)
                    .append("userId", user.id)
                    .append("passwordHash", user.passwordHash)
                    .append("admin", admin));
        } catch (MongoWriteException e) {
            // Another process created the same user between the check and the insert.
            if (isDuplicateKey(e)) {
                throw AuthServerException.alreadyExists(String.format("User '%s' already exists.", username));
            }
            throw e;
        }
        LOG.info("Created user {}", user);
        return user;
    }

    @Override
    public boolean hasUser (String username) {
        return users.countDocuments(eq("_id", username)) > 0;
    }

    @Override
    public User getUser (String username) {
        Document document = users.find(eq("_id", username)).first();
        if (document == null) {
            throw AuthServerException.notFound(String.format("User with username=%s not found", username));
        }
        return toUser(document);
    }

    @Override
    public User getUserById (long id) {
        Document document = users.find(eq("userId", id)).first();
        if (document == null) {
            throw AuthServerException.notFound(String.format("User with id=%d not found", id));
        }
        return toUser(document);
    }

    @Override
    public List<User> listUsers () {
        List<User> result = new ArrayList<>();
        for (Document document : users.find().sort(Sorts.ascending("_id"))) {
            result.add(toUser(document));
        }
        return result;
    }

    @Override
    public boolean authenticateUser (String username, String password) {
        Document document = users.find(eq("_id", username)).first();
        return document != null && PasswordHasher.matches(password, document.getString("passwordHash"));
    }

    @Override
    public void updateUserPassword (String username, String password) {
        requireMatched(users.updateOne(eq("_id", username), Updates.set("passwordHash", PasswordHasher.hash(password))),
                username);
    }

    @Override
    public void updateUserAdmin (String username, boolean admin) {
        requireMatched(users.updateOne(eq("_id", username), Updates.set("admin", admin)), username);
    }

    /** Grants go first, so a crash in between leaves a user without grants rather than grants without a user. */
    @Override
    public void deleteUser (String username) {
        getUser(username);
        DeleteResult removedGrants = grants.deleteMany(eq("username", username));
        DeleteResult removedUser = users.deleteOne(eq("_id", username));
        if (removedUser.getDeletedCount() == 0) {
            throw AuthServerException.notFound(String.format("User with username=%s not found", username));
        }
        LOG.info("Deleted user {} and {} grants held by that user.", username, removedGrants.getDeletedCount());
    }

    // GRANTS

    @Override
    public ResourcePermission createPermission (ResourceKey resource, String username, Permission permission) {
        User user = getUser(username);
        try {
            grants.insertOne(grantFilterDocument(resource, username)
                    .append("userId", user.id)
                    .append("permission", permission.name()));
        } catch (MongoWriteException e) {
            if (isDuplicateKey(e)) {
                throw AuthServerException.alreadyExists(
                        String.format("Permission on %s for user %s already exists.", resource, username));
            }
            throw e;
        }
        return new ResourcePermission(resource, user.id, username, permission);
    }

    @Override
    public ResourcePermission getPermission (ResourceKey resource, String username) {
        Document document = grants.find(grantFilter(resource, username)).first();
        if (document == null) throw grantNotFound(resource, username);
        return toGrant(document);
    }

    @Override
    public ResourcePermission updatePermission (ResourceKey resource, String username, Permission permission) {
        Document document = grants.findOneAndUpdate(
                grantFilter(resource, username),
                Updates.set("permission", permission.name()),
                new FindOneAndUpdateOptions().returnDocument(ReturnDocument.AFTER)
        );
        if (document == null) throw grantNotFound(resource, username);
        return toGrant(document);
    }

    @Override
    public ResourcePermission updateOrCreatePermission (ResourceKey resource, String username, Permission permission) {
        User user = getUser(username);
        Document document = grants.findOneAndUpdate(
                grantFilter(resource, username),
                Updates.combine(
                        Updates.set("permission", permission.name()),
                        Updates.setOnInsert("userId", user.id)
                ),
                new FindOneAndUpdateOptions().upsert(true).returnDocument(ReturnDocument.AFTER)
        );
        return toGrant(document);
    }

    @Override
    public void deletePermission (ResourceKey resource, String username) {
        if (grants.deleteOne(grantFilter(resource, username)).getDeletedCount() == 0) {
            throw grantNotFound(resource, username);
        }
    }

    @Override
    public List<ResourcePermission> listPermissions (ResourceType resourceType, String username) {
        List<ResourcePermission> result = new ArrayList<>();
        Bson filter = and(eq("username", username), eq("resourceType", resourceType.name()));
        for (Document document : grants.find(filter).sort(Sorts.ascending("resourceKey"))) {
            result.add(toGrant(document));
        }
        return result;
    }

    @Override
    public List<ResourcePermission> listPermissionsForResource (ResourceKey resource) {
        List<ResourcePermission> result = new ArrayList<>();
        Bson filter = and(eq("resourceType", resource.type.name()), eq("resourceKey", resource.key));
        for (Document document : grants.find(filter).sort(Sorts.ascending("username"))) {
            result.add(toGrant(document));
        }
        return result;
    }

    @Override
    public int deletePermissionsForResource (ResourceKey resource) {
        Bson filter = and(eq("resourceType", resource.type.name()), eq("resourceKey", resource.key));
        return (int) grants.deleteMany(filter).getDeletedCount();
    }

    /**
     * Each grant is moved by upserting it under the new name (replacing the same user's grant there, if any) and then
     * deleting it under the old name. Passes repeat until no grant remains under the old name.
     */
    @Override
    public void renameRegisteredModelPermissions (String oldName, String newName) {
        ResourceKey oldKey = ResourceKey.registeredModel(oldName);
        ResourceKey newKey = ResourceKey.registeredModel(newName);
        if (oldKey.equals(newKey)) return;
        for (int pass = 0; pass < MAX_RENAME_PASSES; pass++) {
            List<ResourcePermission> moving = listPermissionsForResource(oldKey);
            if (moving.isEmpty()) return;
            for (ResourcePermission grant : moving) {
                try {
                    grants.replaceOne(
                            grantFilter(newKey, grant.username),
                            grantFilterDocument(newKey, grant.username)
                                    .append("userId", grant.userId)
                                    .append("permission", grant.permission.name()),
                            new ReplaceOptions().upsert(true)
                    );
                } catch (MongoWriteException e) {
                    // A concurrent upsert of the same grant won the race. Retried on the next pass.
                    if (!isDuplicateKey(e)) throw e;
                    LOG.warn("Concurrent write while moving {} to {}, will retry.", grant, newKey);
                    continue;
                }
                grants.deleteOne(grantFilter(oldKey, grant.username));
            }
        }
        throw AuthServerException.internal(String.format(
                "Grants on %s kept appearing while renaming to %s, giving up.", oldKey, newKey));
    }

    private long nextUserId () {
        Document counter = counters.findOneAndUpdate(
                eq("_id", "users"),
                Updates.inc("seq", 1L),
                new FindOneAndUpdateOptions().upsert(true).returnDocument(ReturnDocument.AFTER)
        );
        return counter.get("seq", Number.class).longValue();
    }

    private static Bson grantFilter (ResourceKey resource, String username) {
        return and(
                eq("resourceType", resource.type.name()),
                eq("resourceKey", resource.key),
                eq("username", username)
        );
    }

    private static Document grantFilterDocument (ResourceKey resource, String username) {
        return new Document("resourceType", resource.type.name())
                .append("resourceKey", resource.key)
                .append("username", username);
    }

    private static User toUser (Document document) {
        return new User(
                document.get("userId", Number.class).longValue(),
                document.getString("_id"),
                document.getString("passwordHash"),
                Boolean.TRUE.equals(document.getBoolean("admin"))
        );
    }

    private static ResourcePermission toGrant (Document document) {
        ResourceKey resource = new ResourceKey(
                ResourceType.valueOf(document.getString("resourceType")),
                document.getString("resourceKey")
        );
        Number userId = document.get("userId", Number.class);
        return new ResourcePermission(
                resource,
                userId == null ? 0 : userId.longValue(),
                document.getString("username"),
                Permission.fromName(document.getString("permission"))
        );
    }

    private static void requireMatched (UpdateResult result, String username) {
        if (result.getMatchedCount() == 0) {
            throw AuthServerException.notFound(String.format("User with username=%s not found", username));
        }
    }

    private static AuthServerException grantNotFound (ResourceKey resource, String username) {
        return AuthServerException.notFound(
                String.format("Permission on %s for user %s not found.", resource, username));
    }

    static boolean isDuplicateKey (MongoWriteException e) {
        return ErrorCategory.fromErrorCode(e.getError().getCode()) == ErrorCategory.DUPLICATE_KEY;
    }

}
