package com.conveyal.trackingauth.persistence;

import com.conveyal.trackingauth.components.Component;
import com.conveyal.trackingauth.models.Session;

/** Server-side storage of login sessions, keyed by the random session id the client holds in a cookie. */
public interface SessionStore extends Component {

    void createSession (Session session);

    /** @return null if there is no such session. */
    Session getSession (String sessionId);

    void deleteSession (String sessionId);

}
