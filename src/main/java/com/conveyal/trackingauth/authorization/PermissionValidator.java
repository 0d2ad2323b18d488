package com.conveyal.trackingauth.authorization;

import com.conveyal.trackingauth.AuthenticatedUser;

/**
 * Decides whether an authenticated user may perform the operation a request asks for. Validators never see
 * administrators, who are allowed before any validator is consulted.
 */
@FunctionalInterface
public interface PermissionValidator {

    boolean validate (ApiRequest request, AuthenticatedUser user);

}
