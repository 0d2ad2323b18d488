package com.conveyal.trackingauth.components;

import com.conveyal.trackingauth.AuthConfig;
import com.conveyal.trackingauth.persistence.InMemoryPermissionStore;
import com.conveyal.trackingauth.persistence.InMemorySessionStore;
import com.conveyal.trackingauth.upstream.RestTrackingClient;

import java.time.Duration;

/**
 * Wires up the components for running on a single machine without a database. Users, grants and sessions are kept in
 * memory and lost on restart; only the bootstrap administrator is recreated from configuration.
 */
public class LocalAuthComponents extends AuthComponents {

    public LocalAuthComponents (AuthConfig config) {
        this.config = config;
        eventBus = standardEventBus();
        permissionStore = new InMemoryPermissionStore();
        sessionStore = new InMemorySessionStore(Duration.ofSeconds(config.sessionLifetimeSeconds()));
        RestTrackingClient trackingClient = new RestTrackingClient(config);
        trackingStore = trackingClient;
        modelRegistryStore = trackingClient;
        wireAuthorization();
        httpApi = new HttpApi(authorizationFilter, eventBus, config, standardHttpControllers());
    }

}
