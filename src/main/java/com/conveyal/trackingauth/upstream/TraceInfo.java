package com.conveyal.trackingauth.upstream;

/** Traces belong to an experiment and are governed by its grants, like runs. */
public class TraceInfo {

    public String requestId;
    public String experimentId;

}
