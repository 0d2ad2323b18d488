package com.conveyal.trackingauth.authorization;

import com.conveyal.trackingauth.AuthServerException;

import java.util.Locale;

/**
 * The permission levels that can be granted to a user on a resource, each projecting to a fixed set of capabilities.
 * The declaration order is the strength order used when two grants have to be compared: every level grants at least
 * the capabilities of the levels declared before it.
 */
public enum Permission {

    NO_PERMISSIONS (false, false, false, false),
    READ           (true,  false, false, false),
    EDIT           (true,  true,  false, false),
    MANAGE         (true,  true,  true,  true);

    public final boolean canRead;
    public final boolean canUpdate;
    public final boolean canDelete;
    public final boolean canManage;

    Permission (boolean canRead, boolean canUpdate, boolean canDelete, boolean canManage) {
        this.canRead = canRead;
        this.canUpdate = canUpdate;
        this.canDelete = canDelete;
        this.canManage = canManage;
    }

    /**
     * Look up a permission level by name, ignoring case.
     * @throws AuthServerException of type INVALID_PERMISSION_LEVEL for anything but the four known names.
     */
    public static Permission fromName (String name) {
        if (name == null) {
            throw AuthServerException.invalidPermissionLevel(null);
        }
        try {
            return Permission.valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw AuthServerException.invalidPermissionLevel(name);
        }
    }

    /** The capability projection of a level given by name. The enum constant itself carries the four booleans. */
    public static Permission capabilitiesOf (String name) {
        return fromName(name);
    }

    public static boolean isValid (String name) {
        try {
            fromName(name);
            return true;
        } catch (AuthServerException e) {
            return false;
        }
    }

    /** True if this level grants every capability the other one grants. */
    public boolean dominates (Permission other) {
        return this.compareTo(other) >= 0;
    }

}
