package com.conveyal.trackingauth.authorization;

import com.conveyal.trackingauth.AuthServerException;

import java.util.List;

/**
 * Builds the validators referenced by the route table. Most of them resolve the governing resource with one strategy
 * and test one capability of the caller's permission on it.
 */
public class Validators {

    private final ResourceResolver resolver;
    private final PermissionEvaluator evaluator;

    public Validators (ResourceResolver resolver, PermissionEvaluator evaluator) {
        this.resolver = resolver;
        this.evaluator = evaluator;
    }

    public PermissionValidator resource (ResolutionStrategy strategy, Capability capability) {
        return (request, user) -> {
            ResourceKey resource = resolver.resolve(strategy, request);
            return capability.isGrantedBy(evaluator.permissionFor(resource, user.username));
        };
    }

    /**
     * Requires the capability on every experiment listed in the experiment_ids argument, as a run search can span
     * several experiments at once.
     */
    public PermissionValidator allExperiments (Capability capability) {
        return (request, user) -> {
            List<String> experimentIds = request.paramList("experiment_ids");
            if (experimentIds.isEmpty()) throw AuthServerException.missingParameter("experiment_ids");
            for (String experimentId : experimentIds) {
                Permission permission = evaluator.permissionFor(ResourceKey.experiment(experimentId), user.username);
                if (!capability.isGrantedBy(permission)) return false;
            }
            return true;
        };
    }

    /**
     * Requires the capability on the experiment of every run listed in the named argument, for the metric queries the
     * web UI makes across several runs at once.
     */
    public PermissionValidator allRuns (String runIdsParam, Capability capability) {
        return (request, user) -> {
            List<String> runIds = request.paramList(runIdsParam);
            if (runIds.isEmpty()) throw AuthServerException.missingParameter(runIdsParam);
            for (String runId : runIds) {
                Permission permission = evaluator.permissionFor(resolver.experimentOfRun(runId), user.username);
                if (!capability.isGrantedBy(permission)) return false;
            }
            return true;
        };
    }

    /**
     * Like {@link #resource}, but reads the arguments from the query string whatever the HTTP method. Uploads carry
     * the file itself as their body.
     */
    public PermissionValidator resourceInQuery (ResolutionStrategy strategy, Capability capability) {
        PermissionValidator validator = resource(strategy, capability);
        return (request, user) -> validator.validate(request.withQueryArguments(), user);
    }

    /** The username argument must name the caller. */
    public static PermissionValidator usernameIsSender () {
        return (request, user) -> user.username.equals(request.param("username"));
    }

    /** Administrators are allowed before validation, so this turns everyone else away. */
    public static PermissionValidator adminOnly () {
        return (request, user) -> user.admin;
    }

    /**
     * Proxied artifact access depends on the HTTP method: listing and downloading need read access, uploading needs
     * update and deleting needs manage on the experiment at the head of the artifact path.
     * @return null for methods the artifact proxy does not serve.
     */
    public PermissionValidator artifactProxy (String method, boolean isListing) {
        if (isListing) return resource(ResolutionStrategy.ARTIFACT_PATH, Capability.READ);
        switch (method) {
            case "GET": return resource(ResolutionStrategy.ARTIFACT_PATH, Capability.READ);
            case "PUT": return resource(ResolutionStrategy.ARTIFACT_PATH, Capability.UPDATE);
            case "DELETE": return resource(ResolutionStrategy.ARTIFACT_PATH, Capability.MANAGE);
            default: return null;
        }
    }

}
