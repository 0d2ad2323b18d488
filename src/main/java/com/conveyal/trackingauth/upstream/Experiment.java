package com.conveyal.trackingauth.upstream;

/** The few fields of a tracking server experiment that authorization decisions depend on. */
public class Experiment {

    public String experimentId;

    public String name;

    public String lifecycleStage;

    /** Zero-argument constructor for deserialization. */
    public Experiment () { }

    public Experiment (String experimentId, String name) {
        this.experimentId = experimentId;
        this.name = name;
    }

}
