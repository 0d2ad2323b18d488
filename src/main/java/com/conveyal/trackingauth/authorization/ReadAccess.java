package com.conveyal.trackingauth.authorization;

import com.google.common.collect.ImmutableMap;

import java.util.Map;

/**
 * A snapshot of which resources of one type a user can read, taken once per filtered search so that every item of
 * every refill batch is judged against the same grants.
 */
public class ReadAccess {

    private final Map<String, Boolean> canReadByKey;
    private final boolean defaultCanRead;

    public ReadAccess (Map<String, Boolean> canReadByKey, boolean defaultCanRead) {
        this.canReadByKey = ImmutableMap.copyOf(canReadByKey);
        this.defaultCanRead = defaultCanRead;
    }

    public boolean canRead (String resourceKey) {
        return canReadByKey.getOrDefault(resourceKey, defaultCanRead);
    }

}
