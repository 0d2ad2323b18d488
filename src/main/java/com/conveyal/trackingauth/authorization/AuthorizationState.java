package com.conveyal.trackingauth.authorization;

/**
 * The stages a request passes through before it is handled. ALLOWED and DENIED are terminal. Failed authentication
 * does not reach either: it ends the request with an exception from the AUTHENTICATING stage.
 */
public enum AuthorizationState {
    UNCHECKED,
    AUTHENTICATING,
    AUTHENTICATED,
    AUTHORIZING,
    ALLOWED,
    DENIED
}
