package com.conveyal.trackingauth;

import com.conveyal.trackingauth.authorization.Permission;
import com.conveyal.trackingauth.authorization.PermissionEvaluator;
import com.conveyal.trackingauth.components.AuthenticationType;
import com.conveyal.trackingauth.components.HttpApi;
import com.conveyal.trackingauth.components.SessionAuthentication;
import com.conveyal.trackingauth.controllers.AdminController;
import com.conveyal.trackingauth.controllers.TrackingProxyController;
import com.conveyal.trackingauth.persistence.AuthDB;
import com.conveyal.trackingauth.persistence.MongoSessionStore;
import com.conveyal.trackingauth.upstream.RestTrackingClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Properties;

/**
 * Loads config information for the authorization server and exposes it to the Components and HttpControllers.
 */
public class AuthConfig extends ConfigBase implements
        HttpApi.Config,
        AuthDB.Config,
        MongoSessionStore.Config,
        SessionAuthentication.Config,
        PermissionEvaluator.Config,
        RestTrackingClient.Config,
        AdminController.Config,
        TrackingProxyController.Config
{

    // CONSTANTS AND STATIC FIELDS

    private static final Logger LOG = LoggerFactory.getLogger(AuthConfig.class);
    public static final String AUTH_CONFIG_FILE = "auth.properties";

    // INSTANCE FIELDS

    private final int serverPort;
    private final String trackingServerUri;
    private final String databaseUri;
    private final String databaseName;
    private final Permission defaultPermission;
    private final String adminUsername;
    private final String adminPassword;
    private final AuthenticationType authenticationType;
    private final long sessionLifetimeSeconds;
    private final String sessionCookieName;

    // CONSTRUCTORS

    private AuthConfig (String filename) {
        this(propsFromFile(filename));
    }

    public AuthConfig (Properties properties) {
        super(properties);
        // We intentionally don't supply any defaults here.
        // Any 'defaults' should be shipped in an example config file.
        serverPort = intProp("server-port");
        trackingServerUri = strProp("tracking-server-uri");
        databaseUri = strProp("database-uri");
        databaseName = strProp("database-name");
        defaultPermission = permissionProp("default-permission");
        adminUsername = strProp("admin-username");
        adminPassword = strProp("admin-password");
        authenticationType = authenticationTypeProp("authenticator");
        sessionLifetimeSeconds = longProp("session-lifetime-seconds");
        sessionCookieName = strProp("session-cookie-name");
        if (sessionLifetimeSeconds < 0) {
            invalidProp("session-lifetime-seconds", "must not be negative");
        }
        exitIfErrors();
        LOG.info("Requests without a grant fall back to permission {}.", defaultPermission);
    }

    private Permission permissionProp (String key) {
        String value = strProp(key);
        if (value == null) return null;
        try {
            return Permission.fromName(value);
        } catch (AuthServerException e) {
            invalidProp(key, e.message);
            return null;
        }
    }

    private AuthenticationType authenticationTypeProp (String key) {
        String value = strProp(key);
        if (value == null) return null;
        try {
            return AuthenticationType.forConfigValue(value);
        } catch (IllegalArgumentException e) {
            invalidProp(key, e.getMessage());
            return null;
        }
    }

    // INTERFACE IMPLEMENTATIONS
    // Methods implementing Component and HttpController Config interfaces.
    // Note that one method can implement several Config interfaces at once.

    @Override public int        serverPort()             { return serverPort; }
    @Override public String     trackingServerUri()      { return trackingServerUri; }
    @Override public String     databaseUri()            { return databaseUri; }
    @Override public String     databaseName()           { return databaseName; }
    @Override public Permission defaultPermission()      { return defaultPermission; }
    @Override public String     adminUsername()          { return adminUsername; }
    @Override public long       sessionLifetimeSeconds() { return sessionLifetimeSeconds; }
    @Override public String     sessionCookieName()      { return sessionCookieName; }

    public String adminPassword () {
        return adminPassword;
    }

    public AuthenticationType authenticationType () {
        return authenticationType;
    }

    // STATIC FACTORY METHODS
    // Always use these to construct AuthConfig objects for readability.

    public static AuthConfig fromDefaultFile () {
        return new AuthConfig(AUTH_CONFIG_FILE);
    }

}
