package com.conveyal.trackingauth.upstream;

/**
 * A run has no grants of its own: access to it is governed by the experiment it was logged to.
 * The tracking server nests these identifiers inside an "info" object.
 */
public class Run {

    public RunInfo info;

    public static class RunInfo {
        public String runId;
        public String experimentId;
    }

    public String experimentId () {
        return info == null ? null : info.experimentId;
    }

}
