package com.conveyal.trackingauth.components;

import com.conveyal.trackingauth.AuthConfig;
import com.conveyal.trackingauth.persistence.AuthDB;
import com.conveyal.trackingauth.persistence.MongoPermissionStore;
import com.conveyal.trackingauth.persistence.MongoSessionStore;
import com.conveyal.trackingauth.upstream.RestTrackingClient;

/**
 * Wires up the components for a deployed server: users, grants and sessions live in MongoDB, shared by every server
 * process in front of the same tracking server. No conditional logic should be present here.
 */
public class StandardAuthComponents extends AuthComponents {

    public StandardAuthComponents (AuthConfig config) {
        this.config = config;
        eventBus = standardEventBus();
        AuthDB database = new AuthDB(config);
        permissionStore = new MongoPermissionStore(database);
        sessionStore = new MongoSessionStore(database, config);
        RestTrackingClient trackingClient = new RestTrackingClient(config);
        trackingStore = trackingClient;
        modelRegistryStore = trackingClient;
        wireAuthorization();
        // Instantiate the HttpControllers last, when all the components except the HttpApi are already created.
        httpApi = new HttpApi(authorizationFilter, eventBus, config, standardHttpControllers());
    }

}
