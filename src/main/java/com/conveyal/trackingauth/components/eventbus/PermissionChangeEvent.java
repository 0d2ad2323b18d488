package com.conveyal.trackingauth.components.eventbus;

/**
 * Fired whenever users or grants change, whether through the management API or as a side effect of an operation on
 * the tracking server (creating, deleting or renaming a resource).
 */
public class PermissionChangeEvent extends Event {

    public enum Action {
        USER_CREATED, USER_UPDATED, USER_DELETED, GRANTED, UPDATED, REVOKED, RENAMED
    }

    public final Action action;

    /** The resource concerned, or null for changes to users themselves. */
    public final String resource;

    /** The user whose account or grant changed. */
    public final String subject;

    public final String detail;

    public PermissionChangeEvent (Action action, String resource, String subject, String detail) {
        this.action = action;
        this.resource = resource;
        this.subject = subject;
        this.detail = detail;
    }

    @Override
    public String toString () {
        return String.format("[%s %s%s by %s%s]", action, subject == null ? "" : subject,
                resource == null ? "" : " on " + resource, user == null ? "system" : user,
                detail == null ? "" : ": " + detail);
    }
}
