package com.conveyal.trackingauth.util;

/** Status codes this server sets or interprets itself. Spark does not define constants for them. */
public abstract class HttpStatus {

    public static final int FOUND_302 = 302;
    public static final int BAD_REQUEST_400 = 400;
    public static final int NOT_FOUND_404 = 404;
    public static final int SERVER_ERROR_500 = 500;
    public static final int BAD_GATEWAY_502 = 502;

}
