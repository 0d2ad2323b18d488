package com.conveyal.trackingauth.components;

import com.conveyal.trackingauth.AuthServerException;
import com.conveyal.trackingauth.AuthenticatedUser;
import com.conveyal.trackingauth.authorization.ApiRequest;
import com.conveyal.trackingauth.models.Session;
import com.conveyal.trackingauth.models.User;
import com.conveyal.trackingauth.persistence.PermissionStore;
import com.conveyal.trackingauth.persistence.SessionStore;
import com.conveyal.trackingauth.util.PasswordHasher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;

/**
 * Cookie based authentication. Users log in once with a username and password, receiving a random session id in a
 * cookie. The session only establishes who the user is: the admin flag is looked up in the permission store on every
 * request, so revoking admin rights or deleting a user takes effect immediately.
 */
public class SessionAuthentication implements Authentication {

    private static final Logger LOG = LoggerFactory.getLogger(SessionAuthentication.class);

    public static final String LOGIN_PATH = "/login";

    static final String NOT_AUTHENTICATED_MESSAGE =
            "You are not authenticated. Please login at " + LOGIN_PATH + " to access this resource.";

    public interface Config {
        long sessionLifetimeSeconds ();
        String sessionCookieName ();
    }

    private final SessionStore sessions;
    private final PermissionStore store;
    private final Config config;
    private final Clock clock;
    private final Duration lifetime;

    public SessionAuthentication (SessionStore sessions, PermissionStore store, Config config, Clock clock) {
        this.sessions = sessions;
        this.store = store;
        this.config = config;
        this.clock = clock;
        this.lifetime = Duration.ofSeconds(config.sessionLifetimeSeconds());
    }

    @Override
    public AuthenticatedUser authenticate (ApiRequest request) {
        String sessionId = request.cookie(config.sessionCookieName());
        if (sessionId == null || sessionId.isEmpty()) {
            throw notAuthenticated(request, "no session cookie");
        }
        Session session = sessions.getSession(sessionId);
        if (session == null) {
            throw notAuthenticated(request, "unknown session");
        }
        if (!session.hasIdentity()) {
            sessions.deleteSession(sessionId);
            throw notAuthenticated(request, "session without identity");
        }
        if (session.isExpired(clock.instant(), lifetime)) {
            sessions.deleteSession(sessionId);
            throw notAuthenticated(request, "session of " + session.username + " expired");
        }
        User user;
        try {
            user = store.getUser(session.username);
        } catch (AuthServerException e) {
            if (!e.isNotFound()) throw e;
            sessions.deleteSession(sessionId);
            throw notAuthenticated(request, "user " + session.username + " no longer exists");
        }
        return new AuthenticatedUser(user.username, user.id, user.admin);
    }

    /**
     * Verify the password and open a new session.
     * @throws AuthServerException UNAUTHENTICATED if the username or password is wrong.
     */
    public Session login (String username, String password) {
        if (username == null || password == null || !store.authenticateUser(username, password)) {
            throw AuthServerException.unauthenticated("Incorrect username or password.");
        }
        User user = store.getUser(username);
        Session session = new Session(PasswordHasher.generateToken(), user.username, user.id, user.admin,
                clock.instant());
        sessions.createSession(session);
        LOG.info("User {} logged in.", user.username);
        return session;
    }

    public void logout (String sessionId) {
        if (sessionId != null) sessions.deleteSession(sessionId);
    }

    public String cookieName () {
        return config.sessionCookieName();
    }

    public Duration lifetime () {
        return lifetime;
    }

    /**
     * Browsers are sent to the login page, which returns them to the page they asked for if it was fetched with GET.
     * Other clients receive a bare 401.
     */
    private static AuthServerException notAuthenticated (ApiRequest request, String reason) {
        LOG.debug("Rejecting {}: {}", request, reason);
        if (request.acceptsHtml()) {
            String location = LOGIN_PATH;
            if (request.isGet()) {
                location += "?next=" + URLEncoder.encode(request.url, StandardCharsets.UTF_8);
            }
            return AuthServerException.redirectToLogin(location);
        }
        return AuthServerException.unauthenticated(NOT_AUTHENTICATED_MESSAGE);
    }

}
