package com.conveyal.trackingauth;

import spark.Request;

import static com.conveyal.trackingauth.components.HttpApi.AUTHENTICATED_USER_ATTRIBUTE;

/**
 * The identity established for a request: who is calling and whether they are an administrator. The admin flag is
 * always read from the permission store when the request is authenticated, never carried over from a session.
 */
public class AuthenticatedUser {

    public final String username;

    public final long userId;

    public final boolean admin;

    public AuthenticatedUser (String username, long userId, boolean admin) {
        this.username = username;
        this.userId = userId;
        this.admin = admin;
    }

    /**
     * From an HTTP request object, extract the user attached to it by the authorization filter. Use this method to
     * encapsulate all calls to req.attribute(String) because those calls are not typesafe.
     * @return null for requests to unprotected paths.
     */
    public static AuthenticatedUser from (Request req) {
        return req.attribute(AUTHENTICATED_USER_ATTRIBUTE);
    }

    @Override
    public String toString () {
        return "AuthenticatedUser{username='" + username + "', admin=" + admin + '}';
    }
}
