package com.conveyal.trackingauth.persistence;

import com.conveyal.trackingauth.models.Session;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Sessions held in memory, for the local and test configurations. Sessions expired by the time a new one is created
 * are swept out then, so that sessions clients stopped presenting do not accumulate.
 */
public class InMemorySessionStore implements SessionStore {

    private static final Logger LOG = LoggerFactory.getLogger(InMemorySessionStore.class);

    private final Map<String, Session> sessions = new ConcurrentHashMap<>();

    private final Duration lifetime;

    public InMemorySessionStore (Duration lifetime) {
        this.lifetime = lifetime;
    }

    @Override
    public void createSession (Session session) {
        if (session.issuedAt != null) {
            int before = sessions.size();
            sessions.values().removeIf(existing -> existing.isExpired(session.issuedAt, lifetime));
            int swept = before - sessions.size();
            if (swept > 0) LOG.debug("Removed {} expired sessions.", swept);
        }
        sessions.put(session.sessionId, session);
    }

    @Override
    public Session getSession (String sessionId) {
        return sessions.get(sessionId);
    }

    @Override
    public void deleteSession (String sessionId) {
        sessions.remove(sessionId);
    }

    public int size () {
        return sessions.size();
    }

}
