package com.conveyal.trackingauth.models;

import java.time.Duration;
import java.time.Instant;

/**
 * A server-side login session. The client only holds the random session id in a cookie.
 */
public class Session {

    public final String sessionId;
    public final String username;
    public final Long userId;
    public final boolean admin;
    public final Instant issuedAt;

    public Session (String sessionId, String username, Long userId, boolean admin, Instant issuedAt) {
        this.sessionId = sessionId;
        this.username = username;
        this.userId = userId;
        this.admin = admin;
        this.issuedAt = issuedAt;
    }

    /** Sessions written by an older or foreign writer may lack the identity fields, which makes them unusable. */
    public boolean hasIdentity () {
        return username != null && userId != null;
    }

    /**
     * A session remains valid up to and including the instant its lifetime has fully elapsed.
     * Sessions without an issuance time never expire by age.
     */
    public boolean isExpired (Instant now, Duration lifetime) {
        if (issuedAt == null) return false;
        return Duration.between(issuedAt, now).compareTo(lifetime) > 0;
    }

    @Override
    public String toString () {
        return "Session{username='" + username + "', issuedAt=" + issuedAt + '}';
    }
}
