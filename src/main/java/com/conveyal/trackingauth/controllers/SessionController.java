package com.conveyal.trackingauth.controllers;

import com.conveyal.trackingauth.AuthServerException;
import com.conveyal.trackingauth.authorization.ApiRequest;
import com.conveyal.trackingauth.authorization.AuthOperation;
import com.conveyal.trackingauth.components.SessionAuthentication;
import com.conveyal.trackingauth.models.Session;
import com.conveyal.trackingauth.util.HttpStatus;
import com.google.common.collect.ListMultimap;
import spark.Request;
import spark.Response;

import java.util.List;

import static com.conveyal.trackingauth.components.SessionAuthentication.LOGIN_PATH;

/**
 * Login and logout for cookie based authentication. Only registered when sessions are the configured authentication
 * method. The login path is reachable without a session; logging out requires one.
 */
public class SessionController implements HttpController {

    private final SessionAuthentication sessionAuthentication;

    public SessionController (SessionAuthentication sessionAuthentication) {
        this.sessionAuthentication = sessionAuthentication;
    }

    @Override
    public void registerEndpoints (spark.Service sparkService) {
        sparkService.get(LOGIN_PATH, this::loginHint);
        sparkService.post(LOGIN_PATH, this::login);
        sparkService.get(AuthOperation.LOGOUT.path(), this::logout);
    }

    private Object loginHint (Request req, Response res) {
        res.type("text/plain");
        return "Log in by posting username and password to " + LOGIN_PATH + ".";
    }

    /** Accepts a form or a JSON object with username, password and an optional next page. */
    private Object login (Request req, Response res) {
        ApiRequest request = ApiRequest.from(req);
        String username;
        String password;
        String next;
        if (request.isJson()) {
            username = request.optionalParam("username");
            password = request.optionalParam("password");
            next = request.optionalParam("next");
        } else {
            ListMultimap<String, String> form = ApiRequest.parseQueryString(req.body());
            username = first(form.get("username"));
            password = first(form.get("password"));
            next = first(form.get("next"));
        }
        if (next == null) {
            // The redirect to the login page carries the original target in the query string.
            next = first(ApiRequest.parseQueryString(req.queryString()).get("next"));
        }
        if (username == null || password == null) {
            throw AuthServerException.invalidRequest("Both username and password are required to log in.");
        }
        Session session = sessionAuthentication.login(username, password);
        res.cookie("/", sessionAuthentication.cookieName(), session.sessionId,
                (int) sessionAuthentication.lifetime().getSeconds(), false, true);
        return redirect(res, isLocalTarget(next) ? next : "/");
    }

    private Object logout (Request req, Response res) {
        sessionAuthentication.logout(req.cookie(sessionAuthentication.cookieName()));
        res.removeCookie("/", sessionAuthentication.cookieName());
        return redirect(res, LOGIN_PATH);
    }

    private static Object redirect (Response res, String location) {
        res.status(HttpStatus.FOUND_302);
        res.header("Location", location);
        res.type("text/plain");
        return "";
    }

    /** Only paths on this server are followed after login, never another host. */
    static boolean isLocalTarget (String next) {
        return next != null && next.startsWith("/") && !next.startsWith("//") && !next.contains("\\");
    }

    private static String first (List<String> values) {
        return values.isEmpty() ? null : values.get(0);
    }

}
