package com.conveyal.trackingauth.authorization;

import java.util.Objects;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/** Identifies one resource that grants can be attached to: an experiment by id or a registered model by name. */
public final class ResourceKey {

    public final ResourceType type;
    public final String key;

    public ResourceKey (ResourceType type, String key) {
        this.type = checkNotNull(type);
        checkArgument(key != null && !key.isEmpty(), "Resource key must not be empty.");
        this.key = key;
    }

    public static ResourceKey experiment (String experimentId) {
        return new ResourceKey(ResourceType.EXPERIMENT, experimentId);
    }

    public static ResourceKey registeredModel (String name) {
        return new ResourceKey(ResourceType.REGISTERED_MODEL, name);
    }

    @Override
    public boolean equals (Object o) {
        if (this == o) return true;
        if (!(o instanceof ResourceKey)) return false;
        ResourceKey other = (ResourceKey) o;
        return type == other.type && key.equals(other.key);
    }

    @Override
    public int hashCode () {
        return Objects.hash(type, key);
    }

    @Override
    public String toString () {
        return type + "[" + key + "]";
    }

}
