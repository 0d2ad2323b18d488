package com.conveyal.trackingauth.components.eventbus;

import com.google.common.base.Throwables;

/**
 * Fired each time a Throwable reaches the HTTP layer without being handled.
 */
public class ErrorEvent extends Event {

    public final String summary;

    /**
     * The path portion of the HTTP URL, if the error has occurred while responding to an HTTP request.
     * May be null if this information is unavailable.
     */
    public final String httpPath;

    /** The full stack trace of the exception that occurred. */
    public final String stackTrace;

    public ErrorEvent (Throwable throwable, String httpPath) {
        this.summary = throwable.toString();
        this.stackTrace = Throwables.getStackTraceAsString(throwable);
        this.httpPath = httpPath;
    }

    /** Return a string intended for logging on the console. */
    public String traceWithContext (boolean verbose) {
        StringBuilder builder = new StringBuilder();
        if (user == null) {
            builder.append("Unknown/unauthenticated user");
        } else {
            builder.append("User ").append(user);
        }
        if (httpPath != null) {
            builder.append(" accessing ").append(httpPath);
        }
        builder.append(": ");
        builder.append(verbose ? stackTrace : summary);
        return builder.toString();
    }

}
