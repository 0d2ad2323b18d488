package com.conveyal.trackingauth.authorization;

import com.conveyal.trackingauth.AuthenticatedUser;

/**
 * Runs after a request has been handled successfully, with access to the response body. Used to grant ownership of
 * newly created resources, keep grants in step with deletions and renames, and filter search results.
 */
@FunctionalInterface
public interface AfterRequestHandler {

    /** @return the response body to send, which is either the one passed in or a rewritten one. */
    String afterRequest (ApiRequest request, AuthenticatedUser user, String responseBody);

}
