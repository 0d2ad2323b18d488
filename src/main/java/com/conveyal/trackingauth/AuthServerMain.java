package com.conveyal.trackingauth;

import com.conveyal.trackingauth.components.AuthComponents;
import com.conveyal.trackingauth.components.LocalAuthComponents;
import com.conveyal.trackingauth.components.StandardAuthComponents;
import com.google.common.base.Throwables;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * This is the main entry point for starting the authorization server in front of a tracking server. With the --local
 * flag users, grants and sessions are kept in memory instead of MongoDB.
 */
public abstract class AuthServerMain {

    private static final Logger LOG = LoggerFactory.getLogger(AuthServerMain.class);

    public static void main (String... args) {
        AuthConfig config = AuthConfig.fromDefaultFile();
        boolean local = Arrays.asList(args).contains("--local");
        startServer(local ? new LocalAuthComponents(config) : new StandardAuthComponents(config));
    }

    public static void startServer (AuthComponents components) {
        // The Jetty threads are not daemons and will keep the JVM alive if the main thread crashes.
        // If initialization fails, we need to catch the exception or error and force JVM shutdown.
        try {
            startServerInternal(components);
        } catch (Throwable throwable) {
            LOG.error("Exception while starting up, shutting down JVM.\n{}", Throwables.getStackTraceAsString(throwable));
            System.exit(1);
        }
    }

    static void startServerInternal (AuthComponents components) {
        LOG.info("Starting authorization server using {} authentication.", components.config.authenticationType());
        // Several processes may start at once against the same database, losing the race to create the admin is fine.
        components.permissionStore.createAdminUser(components.config.adminUsername(),
                components.config.adminPassword());
        components.httpApi.awaitInitialization();
        LOG.info("Authorization server is ready on port {}.", components.httpApi.port());
    }

}
