package com.conveyal.trackingauth.authorization;

import com.conveyal.trackingauth.AuthenticatedUser;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * The outcome of authorizing one request, kept with the request until its response has been produced so the
 * after-request step knows who called and which operation was invoked.
 */
public class AuthorizationDecision {

    /** ALLOWED or DENIED. */
    public final AuthorizationState state;

    /** The request, with any path parameters captured by the route table. */
    public final ApiRequest request;

    /** Null for unprotected paths, which are allowed without authentication. */
    public final AuthenticatedUser user;

    /** Null if the request did not match a declared operation. */
    public final RouteTable.Route route;

    public final String reason;

    private AuthorizationDecision (AuthorizationState state, ApiRequest request, AuthenticatedUser user,
                                   RouteTable.Route route, String reason) {
        checkArgument(state == AuthorizationState.ALLOWED || state == AuthorizationState.DENIED);
        this.state = state;
        this.request = request;
        this.user = user;
        this.route = route;
        this.reason = reason;
    }

    public static AuthorizationDecision allowed (ApiRequest request, AuthenticatedUser user, RouteTable.Route route,
                                                 String reason) {
        return new AuthorizationDecision(AuthorizationState.ALLOWED, request, user, route, reason);
    }

    public static AuthorizationDecision denied (ApiRequest request, AuthenticatedUser user, RouteTable.Route route,
                                                String reason) {
        return new AuthorizationDecision(AuthorizationState.DENIED, request, user, route, reason);
    }

    public boolean isAllowed () {
        return state == AuthorizationState.ALLOWED;
    }

    public String operationName () {
        return route == null ? null : route.operation.name();
    }

}
