package com.conveyal.trackingauth;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The single exception type raised by the authorization layer and its stores. The type determines the HTTP status
 * and the shape of the response body produced by the exception handlers in HttpApi.
 */
public class AuthServerException extends RuntimeException {

    private static final Logger LOG = LoggerFactory.getLogger(AuthServerException.class);

    public final int httpCode;
    public final Type type;
    public final String message;

    /**
     * Where an HTML client should be sent instead of receiving a bare 401. Only set on UNAUTHENTICATED exceptions
     * raised for browser requests.
     */
    public final String redirectLocation;

    public enum Type {
        ALREADY_EXISTS,
        FORBIDDEN,
        INTERNAL,
        INVALID_PERMISSION_LEVEL,
        INVALID_REQUEST,
        RESOURCE_NOT_FOUND,
        UNAUTHENTICATED,
        UPSTREAM;
    }

    public static AuthServerException alreadyExists (String message) {
        return new AuthServerException(Type.ALREADY_EXISTS, message, 409);
    }

    /** The message is deliberately generic so the response does not reveal whether the resource exists. */
    public static AuthServerException forbidden () {
        return new AuthServerException(Type.FORBIDDEN, "Permission denied", 403);
    }

    public static AuthServerException forbidden (String message) {
        return new AuthServerException(Type.FORBIDDEN, message, 403);
    }

    public static AuthServerException internal (String message) {
        return new AuthServerException(Type.INTERNAL, message, 500);
    }

    public static AuthServerException invalidPermissionLevel (String permission) {
        return new AuthServerException(Type.INVALID_PERMISSION_LEVEL,
                String.format("Invalid permission '%s'. Valid permissions are: READ, EDIT, MANAGE, NO_PERMISSIONS",
                        permission), 400);
    }

    public static AuthServerException invalidRequest (String message) {
        return new AuthServerException(Type.INVALID_REQUEST, message, 400);
    }

    public static AuthServerException missingParameter (String parameter) {
        return invalidRequest(String.format("Missing value for required parameter '%s'. " +
                "See the API docs for more information about request parameters.", parameter));
    }

    public static AuthServerException notFound (String message) {
        return new AuthServerException(Type.RESOURCE_NOT_FOUND, message, 404);
    }

    // Note that there is a naming mistake in the HTTP codes. 401 "unauthorized" actually means "unauthenticated".
    // 403 "forbidden" is what is usually referred to as "unauthorized" in other contexts.
    public static AuthServerException unauthenticated (String message) {
        return new AuthServerException(Type.UNAUTHENTICATED, message, 401, null);
    }

    public static AuthServerException redirectToLogin (String loginLocation) {
        return new AuthServerException(Type.UNAUTHENTICATED, "Redirecting to login.", 302, loginLocation);
    }

    public static AuthServerException upstream (Exception e, String message) {
        LOG.error("Tracking server request failed: {}", e.toString());
        return new AuthServerException(Type.UPSTREAM, message, 502);
    }

    public AuthServerException (Type type, String message, int httpCode) {
        this(type, message, httpCode, null);
    }

    private AuthServerException (Type type, String message, int httpCode, String redirectLocation) {
        this.type = type;
        this.message = message;
        this.httpCode = httpCode;
        this.redirectLocation = redirectLocation;
    }

    public boolean isNotFound () {
        return type == Type.RESOURCE_NOT_FOUND;
    }

    @Override
    public String getMessage () {
        return message;
    }
}
