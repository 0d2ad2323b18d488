package com.conveyal.trackingauth.authorization;

/**
 * The two families of resources that grants can be attached to. Runs and logged models have no grants of their own,
 * they are governed by the grants on the experiment that owns them.
 */
public enum ResourceType {

    /** Keyed by the immutable experiment id. */
    EXPERIMENT ("experiment_id"),

    /** Keyed by the model name, which can change when the model is renamed. */
    REGISTERED_MODEL ("name");

    /** The name under which the key of this resource type travels in API requests and responses. */
    public final String keyField;

    ResourceType (String keyField) {
        this.keyField = keyField;
    }

}
