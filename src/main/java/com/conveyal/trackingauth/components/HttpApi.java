package com.conveyal.trackingauth.components;

import com.conveyal.trackingauth.AuthServerException;
import com.conveyal.trackingauth.AuthenticatedUser;
import com.conveyal.trackingauth.authorization.ApiRequest;
import com.conveyal.trackingauth.authorization.AuthorizationDecision;
import com.conveyal.trackingauth.authorization.AuthorizationFilter;
import com.conveyal.trackingauth.components.eventbus.ErrorEvent;
import com.conveyal.trackingauth.components.eventbus.EventBus;
import com.conveyal.trackingauth.components.eventbus.HttpApiEvent;
import com.conveyal.trackingauth.controllers.HttpController;
import com.conveyal.trackingauth.util.HttpStatus;
import com.conveyal.trackingauth.util.JsonUtil;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import spark.Request;
import spark.Response;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static com.conveyal.trackingauth.AuthServerException.Type.INTERNAL;
import static com.conveyal.trackingauth.AuthServerException.Type.UNAUTHENTICATED;
import static com.conveyal.trackingauth.AuthServerException.Type.UPSTREAM;

/**
 * This Component is the web server receiving every request meant for the tracking server. Each request is authorized
 * in a before-filter, then handled by one of the supplied HttpControllers (the last of which forwards it to the
 * tracking server), and finally passed through the after-request handlers of the operation it invoked.
 */
public class HttpApi implements Component {

    private static final Logger LOG = LoggerFactory.getLogger(HttpApi.class);

    // These "attributes" are attached to an incoming HTTP request with String keys, making them available in handlers
    private static final String REQUEST_START_TIME_ATTRIBUTE = "requestStartTime";
    private static final String DECISION_ATTRIBUTE = "authorizationDecision";
    public static final String AUTHENTICATED_USER_ATTRIBUTE = "authenticatedUser";

    // Clients only ever see these for internal and upstream failures. The details are logged.
    static final String INTERNAL_ERROR_MESSAGE = "Internal server error.";
    static final String UPSTREAM_ERROR_MESSAGE = "The tracking server failed to handle the request.";

    public interface Config {
        int serverPort ();
    }

    private final AuthorizationFilter authorizationFilter;
    private final EventBus eventBus;
    private final Config config;

    private final spark.Service sparkService;

    public HttpApi (
            AuthorizationFilter authorizationFilter,
            EventBus eventBus,
            Config config,
            List<HttpController> httpControllers
    ){
        this.authorizationFilter = authorizationFilter;
        this.eventBus = eventBus;
        this.config = config;

        sparkService = configureSparkService();
        for (HttpController httpController : httpControllers) {
            httpController.registerEndpoints(sparkService);
        }
    }

    private spark.Service configureSparkService () {
        LOG.info("Authorization server will listen for HTTP connections on port {}.", config.serverPort());
        spark.Service sparkService = spark.Service.ignite();
        sparkService.port(config.serverPort());

        sparkService.before((req, res) -> {
            // Record when the request started, so we can measure elapsed response time.
            req.attribute(REQUEST_START_TIME_ATTRIBUTE, Instant.now());
            // The default MIME type is JSON. Forwarded responses carry the tracking server's own type.
            res.type("application/json");
            // Throws if the caller cannot be authenticated, or if the governing resource cannot be resolved.
            AuthorizationDecision decision = authorizationFilter.beforeRequest(ApiRequest.from(req));
            req.attribute(DECISION_ATTRIBUTE, decision);
            req.attribute(AUTHENTICATED_USER_ATTRIBUTE, decision.user);
            if (!decision.isAllowed()) {
                throw AuthServerException.forbidden();
            }
        });

        // Only runs when the handler completed without an exception. Handlers returning bytes leave res.body() null.
        sparkService.after((req, res) -> {
            AuthorizationDecision decision = req.attribute(DECISION_ATTRIBUTE);
            String body = res.body();
            String rewritten = authorizationFilter.afterRequest(decision, res.status(), body);
            if (rewritten != null && !rewritten.equals(body)) {
                res.body(rewritten);
            }
        });

        // Runs for every request including rejected ones, so denials show up in the request log too.
        sparkService.afterAfter((req, res) -> {
            Instant requestStartTime = req.attribute(REQUEST_START_TIME_ATTRIBUTE);
            long elapsed = requestStartTime == null ? 0 : Duration.between(requestStartTime, Instant.now()).toMillis();
            eventBus.send(new HttpApiEvent(req.requestMethod(), res.status(), req.pathInfo(), elapsed)
                    .forUser(AuthenticatedUser.from(req)));
        });

        sparkService.get("/health", (req, res) -> {
            res.type("text/plain");
            return "OK";
        });

        sparkService.exception(AuthServerException.class, (e, request, response) -> {
            respondToException(e, request, response, e.type, e.message, e.httpCode);
        });

        sparkService.exception(Exception.class, (e, request, response) -> {
            respondToException(e, request, response, INTERNAL, INTERNAL_ERROR_MESSAGE, HttpStatus.SERVER_ERROR_500);
        });

        return sparkService;
    }

    private void respondToException (Exception e, Request request, Response response,
                                     AuthServerException.Type type, String message, int code) {
        if (type == INTERNAL || type == UPSTREAM) {
            // The message and stack trace go to the log through the ErrorLogger, never into the response.
            eventBus.send(new ErrorEvent(e, request.pathInfo()).forUser(AuthenticatedUser.from(request)));
            message = type == UPSTREAM ? UPSTREAM_ERROR_MESSAGE : INTERNAL_ERROR_MESSAGE;
        } else {
            LOG.debug("{} {} answered with {}: {}", request.requestMethod(), request.pathInfo(), type, message);
        }
        response.status(code);
        if (type == UNAUTHENTICATED) {
            // Plain text and no WWW-Authenticate header, so browsers do not show their own credentials dialog.
            AuthServerException authException = (AuthServerException) e;
            if (authException.redirectLocation != null) {
                response.header("Location", authException.redirectLocation);
            }
            response.type("text/plain");
            response.body(message);
            return;
        }
        ObjectNode body = JsonUtil.objectNode()
                .put("type", type.toString())
                .put("message", message);
        response.type("application/json");
        response.body(JsonUtil.toJsonString(body));
    }

    /** Blocks until the server is accepting connections. */
    public void awaitInitialization () {
        sparkService.awaitInitialization();
    }

    /** The port actually listened on, which differs from the configured one when that was zero. */
    public int port () {
        return sparkService.port();
    }

    public void shutDown () {
        sparkService.stop();
        sparkService.awaitStop();
    }

}
