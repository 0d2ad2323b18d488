package com.conveyal.trackingauth.components;

import com.conveyal.trackingauth.AuthenticatedUser;
import com.conveyal.trackingauth.authorization.ApiRequest;

/**
 * An interface for determining who is issuing an HTTP request. Exactly one implementation is active, chosen at
 * startup from the authenticator configuration value.
 */
public interface Authentication extends Component {
    /**
     * Given an incoming HTTP request, determine who the user is. The admin flag of the result always reflects the
     * current state of the permission store.
     * @throws com.conveyal.trackingauth.AuthServerException of type UNAUTHENTICATED if the caller cannot be
     *         identified, carrying a redirect to the login page where the authentication method has one.
     */
    AuthenticatedUser authenticate (ApiRequest request);
}
