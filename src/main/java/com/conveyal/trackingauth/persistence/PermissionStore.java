package com.conveyal.trackingauth.persistence;

import com.conveyal.trackingauth.AuthServerException;
import com.conveyal.trackingauth.authorization.Permission;
import com.conveyal.trackingauth.authorization.ResourceKey;
import com.conveyal.trackingauth.authorization.ResourceType;
import com.conveyal.trackingauth.components.Component;
import com.conveyal.trackingauth.models.ResourcePermission;
import com.conveyal.trackingauth.models.User;

import java.util.List;

/**
 * Persistent user accounts and the grants (resource, user) -> permission level. Every method is individually
 * atomic. Failures are reported as AuthServerException: RESOURCE_NOT_FOUND when the user or grant does not exist,
 * ALREADY_EXISTS on duplicate creation.
 *
 * Implementations must never leave a grant referring to a user that no longer exists.
 */
public interface PermissionStore extends Component {

    // USERS

    /** @throws AuthServerException ALREADY_EXISTS if the username is taken. */
    User createUser (String username, String password, boolean admin);

    /**
     * Create the bootstrap admin account if it does not exist yet. Several server processes starting at the same time
     * may all try to do this; losing the race is not an error.
     */
    default void createAdminUser (String username, String password) {
        if (hasUser(username)) return;
        try {
            createUser(username, password, true);
        } catch (AuthServerException e) {
            if (e.type != AuthServerException.Type.ALREADY_EXISTS) throw e;
        }
    }

    boolean hasUser (String username);

    User getUser (String username);

    User getUserById (long id);

    List<User> listUsers ();

    /** @return true only if the user exists and the password matches its stored hash. */
    boolean authenticateUser (String username, String password);

    void updateUserPassword (String username, String password);

    void updateUserAdmin (String username, boolean admin);

    /** Removes the user and every grant the user holds. */
    void deleteUser (String username);

    // GRANTS

    /**
     * @throws AuthServerException ALREADY_EXISTS if the user already has a grant on the resource, RESOURCE_NOT_FOUND
     *         if the user does not exist.
     */
    ResourcePermission createPermission (ResourceKey resource, String username, Permission permission);

    ResourcePermission getPermission (ResourceKey resource, String username);

    ResourcePermission updatePermission (ResourceKey resource, String username, Permission permission);

    /** Update the grant if one exists, otherwise create it. */
    ResourcePermission updateOrCreatePermission (ResourceKey resource, String username, Permission permission);

    void deletePermission (ResourceKey resource, String username);

    /** All grants held by one user on resources of one type, ordered by resource key. */
    List<ResourcePermission> listPermissions (ResourceType resourceType, String username);

    /** All grants on one resource, ordered by username. */
    List<ResourcePermission> listPermissionsForResource (ResourceKey resource);

    /** @return the number of grants removed. */
    int deletePermissionsForResource (ResourceKey resource);

    /**
     * Move every grant on a registered model from its old name to its new name. When a user already holds a grant on
     * the new name, the grant being moved replaces it. Grants on the new name held by other users are not touched.
     */
    void renameRegisteredModelPermissions (String oldName, String newName);

}
