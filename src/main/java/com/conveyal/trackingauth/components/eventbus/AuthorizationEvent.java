package com.conveyal.trackingauth.components.eventbus;

import com.conveyal.trackingauth.authorization.AuthorizationState;

/** Records the outcome of authorizing one request. */
public class AuthorizationEvent extends Event {

    public final String method;

    public final String path;

    /** The matched operation, or null if the request did not match any declared operation. */
    public final String operation;

    /** Either ALLOWED or DENIED. */
    public final AuthorizationState outcome;

    public final String reason;

    public AuthorizationEvent (String method, String path, String operation, AuthorizationState outcome, String reason) {
        this.method = method;
        this.path = path;
        this.operation = operation;
        this.outcome = outcome;
        this.reason = reason;
        this.success = outcome == AuthorizationState.ALLOWED;
    }

    @Override
    public String toString () {
        return String.format("[%s %s %s by %s as %s: %s]",
                outcome, method, path, user, operation == null ? "undeclared operation" : operation, reason);
    }
}
