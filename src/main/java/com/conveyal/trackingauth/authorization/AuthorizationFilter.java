package com.conveyal.trackingauth.authorization;

import com.conveyal.trackingauth.AuthServerException;
import com.conveyal.trackingauth.AuthenticatedUser;
import com.conveyal.trackingauth.components.Authentication;
import com.conveyal.trackingauth.components.eventbus.AuthorizationEvent;
import com.conveyal.trackingauth.components.eventbus.EventBus;
import com.google.common.collect.ImmutableMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;

import static com.conveyal.trackingauth.authorization.AuthorizationState.AUTHENTICATED;
import static com.conveyal.trackingauth.authorization.AuthorizationState.AUTHENTICATING;
import static com.conveyal.trackingauth.authorization.AuthorizationState.AUTHORIZING;
import static com.conveyal.trackingauth.authorization.AuthorizationState.UNCHECKED;

/**
 * Decides whether each inbound request may proceed, and afterward applies the side effects and response rewriting
 * declared for the operation it invoked. Knows nothing about Spark: the HttpApi component adapts it.
 */
public class AuthorizationFilter {

    private static final Logger LOG = LoggerFactory.getLogger(AuthorizationFilter.class);

    private final Authentication authentication;
    private final RouteTable routeTable;
    private final Validators validators;
    private final EventBus eventBus;

    public AuthorizationFilter (
            Authentication authentication,
            RouteTable routeTable,
            Validators validators,
            EventBus eventBus
    ) {
        this.authentication = authentication;
        this.routeTable = routeTable;
        this.validators = validators;
        this.eventBus = eventBus;
    }

    /** Static assets, the health check and the login and signup pages are reachable without an identity. */
    public static boolean isUnprotected (String path) {
        return path.startsWith("/static") || path.startsWith("/favicon.ico") || path.startsWith("/health")
                || path.equals("/login") || path.equals("/signup");
    }

    /**
     * @return an ALLOWED or DENIED decision.
     * @throws AuthServerException UNAUTHENTICATED if the caller cannot be identified, or any error raised while
     *         resolving the resource the request acts on (e.g. RESOURCE_NOT_FOUND for an unknown run).
     */
    public AuthorizationDecision beforeRequest (ApiRequest request) {
        AuthorizationState state = UNCHECKED;
        if (isUnprotected(request.path)) {
            return decide(AuthorizationDecision.allowed(request, null, null, "unprotected path"));
        }

        state = advance(state, AUTHENTICATING, request);
        AuthenticatedUser user = authentication.authenticate(request);
        state = advance(state, AUTHENTICATED, request);

        Optional<RouteTable.RouteMatch> match = routeTable.match(request.path, request.method);
        RouteTable.Route route = match.map(m -> m.route).orElse(null);
        ApiRequest routedRequest = match.map(m -> request.withPathParams(m.pathParams)).orElse(request);

        if (user.admin) {
            return decide(AuthorizationDecision.allowed(routedRequest, user, route, "administrator"));
        }

        state = advance(state, AUTHORIZING, request);
        if (route != null) {
            if (route.unrestricted) {
                return decide(AuthorizationDecision.allowed(routedRequest, user, route, "unrestricted operation"));
            }
            return validate(route.validator, routedRequest, user, route);
        }
        if (RouteTable.isArtifactProxyPath(request.path)) {
            String artifactPath = RouteTable.artifactPath(request.path);
            boolean isListing = artifactPath == null;
            // A listing names the directory in its query rather than in the path.
            String governingPath = isListing ? routedRequest.optionalParam("path") : artifactPath;
            Map<String, String> artifactParams = governingPath == null
                    ? ImmutableMap.of()
                    : ImmutableMap.of(ResourceResolver.ARTIFACT_PATH_PARAM, governingPath);
            ApiRequest artifactRequest = routedRequest.withPathParams(artifactParams);
            PermissionValidator validator = validators.artifactProxy(request.method, isListing);
            if (validator == null) {
                return decide(AuthorizationDecision.denied(artifactRequest, user, null,
                        "method not supported for artifacts"));
            }
            return validate(validator, artifactRequest, user, null);
        }
        if (RouteTable.isApiPath(request.path)) {
            return decide(AuthorizationDecision.denied(routedRequest, user, null, "no rule for API operation"));
        }
        return decide(AuthorizationDecision.allowed(routedRequest, user, null, "user interface path"));
    }

    /**
     * Apply the after-request handler of the invoked operation, if any. Only successful responses are handled: for
     * error statuses the tracking server did nothing that grants would have to follow.
     * @return the response body to send.
     */
    public String afterRequest (AuthorizationDecision decision, int status, String responseBody) {
        if (decision == null || !decision.isAllowed() || decision.route == null) return responseBody;
        if (status >= 400) return responseBody;
        AfterRequestHandler handler = decision.route.afterHandler;
        if (handler == null || responseBody == null) return responseBody;
        LOG.debug("Running after-request handler of {} for {}", decision.operationName(), decision.user);
        return handler.afterRequest(decision.request, decision.user, responseBody);
    }

    private AuthorizationDecision validate (PermissionValidator validator, ApiRequest request, AuthenticatedUser user,
                                            RouteTable.Route route) {
        if (validator.validate(request, user)) {
            return decide(AuthorizationDecision.allowed(request, user, route, "permission granted"));
        }
        return decide(AuthorizationDecision.denied(request, user, route, "insufficient permission"));
    }

    private AuthorizationDecision decide (AuthorizationDecision decision) {
        LOG.debug("{} -> {} ({})", decision.request, decision.state, decision.reason);
        eventBus.send(new AuthorizationEvent(decision.request.method, decision.request.path,
                decision.operationName(), decision.state, decision.reason).forUser(decision.user));
        return decision;
    }

    private static AuthorizationState advance (AuthorizationState from, AuthorizationState to, ApiRequest request) {
        LOG.trace("{}: {} -> {}", request, from, to);
        return to;
    }

}
