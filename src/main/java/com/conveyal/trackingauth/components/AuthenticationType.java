package com.conveyal.trackingauth.components;

import com.conveyal.trackingauth.persistence.PermissionStore;
import com.conveyal.trackingauth.persistence.SessionStore;

import java.time.Clock;
import java.util.Arrays;
import java.util.Locale;

/**
 * The authentication methods that can be selected with the authenticator configuration value.
 */
public enum AuthenticationType {

    BASIC {
        @Override
        public Authentication create (PermissionStore store, SessionStore sessions,
                                      SessionAuthentication.Config config, Clock clock) {
            return new BasicAuthentication(store);
        }
    },

    SESSION {
        @Override
        public Authentication create (PermissionStore store, SessionStore sessions,
                                      SessionAuthentication.Config config, Clock clock) {
            return new SessionAuthentication(sessions, store, config, clock);
        }
    };

    public abstract Authentication create (
            PermissionStore store,
            SessionStore sessions,
            SessionAuthentication.Config config,
            Clock clock
    );

    /** @throws IllegalArgumentException naming the accepted values if the value matches none of them. */
    public static AuthenticationType forConfigValue (String value) {
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(String.format("Unknown authenticator '%s', expected one of %s.",
                    value, Arrays.toString(values()).toLowerCase(Locale.ROOT)));
        }
    }

}
