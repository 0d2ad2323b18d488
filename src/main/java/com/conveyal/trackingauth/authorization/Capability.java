package com.conveyal.trackingauth.authorization;

/** An action an operation requires on a resource. Validators are parameterized by one of these. */
public enum Capability {

    READ, UPDATE, DELETE, MANAGE;

    public boolean isGrantedBy (Permission permission) {
        switch (this) {
            case READ: return permission.canRead;
            case UPDATE: return permission.canUpdate;
            case DELETE: return permission.canDelete;
            case MANAGE: return permission.canManage;
            default: throw new IllegalStateException("Unknown capability " + this);
        }
    }

}
