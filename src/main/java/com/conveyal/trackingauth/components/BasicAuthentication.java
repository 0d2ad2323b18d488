package com.conveyal.trackingauth.components;

import com.conveyal.trackingauth.AuthServerException;
import com.conveyal.trackingauth.AuthenticatedUser;
import com.conveyal.trackingauth.authorization.ApiRequest;
import com.conveyal.trackingauth.models.User;
import com.conveyal.trackingauth.persistence.PermissionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * HTTP basic authentication: every request carries the username and password, which are checked against the hashed
 * password in the permission store. Nothing is remembered between requests.
 */
public class BasicAuthentication implements Authentication {

    private static final Logger LOG = LoggerFactory.getLogger(BasicAuthentication.class);

    private static final String SCHEME = "Basic ";

    static final String NOT_AUTHENTICATED_MESSAGE =
            "You are not authenticated. Please provide a valid username and password to access this resource.";

    private final PermissionStore store;

    public BasicAuthentication (PermissionStore store) {
        this.store = store;
    }

    @Override
    public AuthenticatedUser authenticate (ApiRequest request) {
        String header = request.header("Authorization");
        if (header == null || !header.regionMatches(true, 0, SCHEME, 0, SCHEME.length())) {
            throw notAuthenticated(request, "no basic credentials");
        }
        String credentials;
        try {
            byte[] decoded = Base64.getDecoder().decode(header.substring(SCHEME.length()).trim());
            credentials = new String(decoded, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw notAuthenticated(request, "credentials are not valid Base64");
        }
        // The username may not contain a colon but the password may.
        int colon = credentials.indexOf(':');
        if (colon < 0) {
            throw notAuthenticated(request, "credentials lack a colon");
        }
        String username = credentials.substring(0, colon);
        String password = credentials.substring(colon + 1);
        if (!store.authenticateUser(username, password)) {
            throw notAuthenticated(request, "wrong username or password for " + username);
        }
        User user = store.getUser(username);
        return new AuthenticatedUser(user.username, user.id, user.admin);
    }

    /** No WWW-Authenticate header is sent, so browsers do not pop up their own login dialog. */
    private static AuthServerException notAuthenticated (ApiRequest request, String reason) {
        LOG.debug("Rejecting {}: {}", request, reason);
        return AuthServerException.unauthenticated(NOT_AUTHENTICATED_MESSAGE);
    }

}
