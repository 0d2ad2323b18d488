package com.conveyal.trackingauth.authorization;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps (path, method) pairs of inbound requests to the authorization rule of the operation they invoke. Built once at
 * startup from the enumerated operations. Plain paths are found with a hash lookup. Paths with bracketed parameters
 * are compiled to regular expressions and tried in declaration order when the hash lookup fails.
 */
public class RouteTable {

    private static final Logger LOG = LoggerFactory.getLogger(RouteTable.class);

    /** Every REST operation is served under both of these. The ajax prefix is the one the web UI uses. */
    public static final List<String> REST_PREFIXES = ImmutableList.of("/api/2.0", "/ajax-api/2.0");

    private static final String ARTIFACT_PROXY_PATH = "/mlflow-artifacts/artifacts";

    private static final Pattern PATH_PARAMETER = Pattern.compile("<(path:)?([^>]+)>");

    /** Everything known about one operation, as needed to authorize requests to it. */
    public static class Route {
        public final ApiOperation operation;
        /** Null when the operation is unrestricted. */
        public final PermissionValidator validator;
        public final boolean unrestricted;
        /** Null when nothing happens after the operation. */
        public final AfterRequestHandler afterHandler;

        private Route (ApiOperation operation, PermissionValidator validator, boolean unrestricted,
                       AfterRequestHandler afterHandler) {
            this.operation = operation;
            this.validator = validator;
            this.unrestricted = unrestricted;
            this.afterHandler = afterHandler;
        }
    }

    public static class RouteMatch {
        public final Route route;
        public final Map<String, String> pathParams;

        private RouteMatch (Route route, Map<String, String> pathParams) {
            this.route = route;
            this.pathParams = pathParams;
        }
    }

    private static class PatternRoute {
        final Pattern pattern;
        final String method;
        final List<String> parameterNames;
        final Route route;

        PatternRoute (Pattern pattern, String method, List<String> parameterNames, Route route) {
            this.pattern = pattern;
            this.method = method;
            this.parameterNames = parameterNames;
            this.route = route;
        }
    }

    private final Map<String, Route> exactRoutes;
    private final List<PatternRoute> patternRoutes;

    private RouteTable (Map<String, Route> exactRoutes, List<PatternRoute> patternRoutes) {
        this.exactRoutes = ImmutableMap.copyOf(exactRoutes);
        this.patternRoutes = ImmutableList.copyOf(patternRoutes);
    }

    /**
     * @throws IllegalStateException if any operation has neither a validator nor an explicit unrestricted rule, or if
     *         two operations claim the same path and method.
     */
    public static RouteTable build (Collection<? extends ApiOperation> operations, AuthorizationRules rules) {
        List<String> incomplete = new ArrayList<>();
        Map<String, Route> exactRoutes = new HashMap<>();
        List<PatternRoute> patternRoutes = new ArrayList<>();
        for (ApiOperation operation : operations) {
            PermissionValidator validator = rules.validatorFor(operation);
            boolean unrestricted = rules.isUnrestricted(operation);
            if (validator == null && !unrestricted) {
                incomplete.add(operation.name());
                continue;
            }
            Route route = new Route(operation, validator, unrestricted, rules.afterHandlerFor(operation));
            for (String path : concretePaths(operation)) {
                for (String method : operation.methods()) {
                    if (PATH_PARAMETER.matcher(path).find()) {
                        patternRoutes.add(compile(path, method, route));
                    } else {
                        Route previous = exactRoutes.put(key(path, method), route);
                        if (previous != null) {
                            throw new IllegalStateException(String.format("Operations %s and %s both claim %s %s.",
                                    previous.operation.name(), operation.name(), method, path));
                        }
                    }
                }
            }
        }
        if (!incomplete.isEmpty()) {
            throw new IllegalStateException(
                    "No authorization rule is declared for operations: " + String.join(", ", incomplete));
        }
        LOG.info("Route table holds {} exact and {} parameterized routes.", exactRoutes.size(), patternRoutes.size());
        return new RouteTable(exactRoutes, patternRoutes);
    }

    public Optional<RouteMatch> match (String path, String method) {
        Route exact = exactRoutes.get(key(path, method));
        if (exact != null) return Optional.of(new RouteMatch(exact, ImmutableMap.of()));
        for (PatternRoute patternRoute : patternRoutes) {
            if (!patternRoute.method.equals(method)) continue;
            Matcher matcher = patternRoute.pattern.matcher(path);
            if (matcher.matches()) {
                Map<String, String> pathParams = new HashMap<>();
                for (int i = 0; i < patternRoute.parameterNames.size(); i++) {
                    pathParams.put(patternRoute.parameterNames.get(i), matcher.group(i + 1));
                }
                return Optional.of(new RouteMatch(patternRoute.route, ImmutableMap.copyOf(pathParams)));
            }
        }
        return Optional.empty();
    }

    /** The paths an operation is served at: one per REST prefix, or its own absolute path. */
    public static List<String> concretePaths (ApiOperation operation) {
        if (!operation.restApi()) return ImmutableList.of(operation.path());
        List<String> paths = new ArrayList<>();
        for (String prefix : REST_PREFIXES) {
            paths.add(prefix + operation.path());
        }
        return paths;
    }

    /** Paths of the tracking server's programmatic interfaces, where nothing is allowed without a rule. */
    public static boolean isApiPath (String path) {
        return path.startsWith("/api/") || path.startsWith("/ajax-api/") || path.startsWith("/graphql");
    }

    public static boolean isArtifactProxyPath (String path) {
        for (String prefix : REST_PREFIXES) {
            String base = prefix + ARTIFACT_PROXY_PATH;
            if (path.equals(base) || path.startsWith(base + "/")) return true;
        }
        return false;
    }

    /**
     * @return the artifact path following the artifact proxy prefix, or null if the request is for the listing
     *         endpoint itself.
     */
    public static String artifactPath (String path) {
        for (String prefix : REST_PREFIXES) {
            String base = prefix + ARTIFACT_PROXY_PATH + "/";
            if (path.startsWith(base)) {
                String artifactPath = path.substring(base.length());
                return artifactPath.isEmpty() ? null : artifactPath;
            }
        }
        return null;
    }

    private static PatternRoute compile (String path, String method, Route route) {
        StringBuilder regex = new StringBuilder();
        List<String> parameterNames = new ArrayList<>();
        Matcher matcher = PATH_PARAMETER.matcher(path);
        int literalStart = 0;
        while (matcher.find()) {
            regex.append(Pattern.quote(path.substring(literalStart, matcher.start())));
            regex.append(matcher.group(1) != null ? "(.+)" : "([^/]+)");
            parameterNames.add(matcher.group(2));
            literalStart = matcher.end();
        }
        regex.append(Pattern.quote(path.substring(literalStart)));
        return new PatternRoute(Pattern.compile(regex.toString()), method, parameterNames, route);
    }

    private static String key (String path, String method) {
        return method + " " + path;
    }

}
