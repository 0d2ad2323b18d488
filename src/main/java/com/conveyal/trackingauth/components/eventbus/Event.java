package com.conveyal.trackingauth.components.eventbus;

import com.conveyal.trackingauth.AuthenticatedUser;

import java.util.Date;

/**
 * Metadata about server operation and user activity. These are intended to be serialized into a log, so the field
 * visibility and types of every subclass should take that into consideration.
 */
public abstract class Event {

    public Date timestamp = new Date();
    public String user;
    public boolean admin;
    public boolean success = true;

    /**
     * Set the user from the supplied identity (if any) and return the modified instance.
     * @param user if this is null, the call will have no effect.
     */
    public Event forUser (AuthenticatedUser user) {
        if (user != null) {
            this.user = user.username;
            this.admin = user.admin;
        }
        return this;
    }

    public String getType () {
        // Will resolve to specific subclass
        return this.getClass().getSimpleName();
    }

}
