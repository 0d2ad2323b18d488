package com.conveyal.trackingauth.components.eventbus;

/**
 * Signals that a request has been processed over the HTTP API, whether it was answered here or by the tracking
 * server behind us.
 */
public class HttpApiEvent extends Event {

    public final String method;

    public final int statusCode;

    /** The URL path of the API endpoint. */
    public final String path;

    /** Total time taken to process the API request, including any time spent waiting on the tracking server. */
    public final long durationMsec;

    public HttpApiEvent (String method, int statusCode, String path, long durationMsec) {
        this.method = method;
        this.statusCode = statusCode;
        this.path = path;
        this.durationMsec = durationMsec;
    }

    @Override
    public String toString () {
        return String.format("[HTTP %s %s by %s, status code %d, duration %d msec]",
                method, path, user, statusCode, durationMsec);
    }
}
