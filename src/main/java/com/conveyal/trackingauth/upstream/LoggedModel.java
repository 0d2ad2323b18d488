package com.conveyal.trackingauth.upstream;

/** Like runs, logged models are governed by the grants on the experiment that owns them. */
public class LoggedModel {

    public LoggedModelInfo info;

    public static class LoggedModelInfo {
        public String modelId;
        public String experimentId;
        public String name;
    }

    public String experimentId () {
        return info == null ? null : info.experimentId;
    }

}
