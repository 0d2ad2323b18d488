package com.conveyal.trackingauth.authorization;

import com.conveyal.trackingauth.AuthenticatedUser;
import com.conveyal.trackingauth.components.eventbus.EventBus;
import com.conveyal.trackingauth.components.eventbus.PermissionChangeEvent;
import com.conveyal.trackingauth.persistence.PermissionStore;
import com.conveyal.trackingauth.util.JsonUtil;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.conveyal.trackingauth.components.eventbus.PermissionChangeEvent.Action.GRANTED;
import static com.conveyal.trackingauth.components.eventbus.PermissionChangeEvent.Action.RENAMED;
import static com.conveyal.trackingauth.components.eventbus.PermissionChangeEvent.Action.REVOKED;

/**
 * Keeps grants in step with what happens on the tracking server: the creator of an experiment or registered model
 * becomes its manager, and grants on registered models follow them through deletion and renaming (registered models
 * are keyed by name, which can be reused or changed).
 *
 * The tracking server has already carried out the operation when these run, so a failure here cannot be reported to
 * the client as a failure of the operation. Failures are logged and the response is passed through unchanged.
 */
public class OwnershipHandlers {

    private static final Logger LOG = LoggerFactory.getLogger(OwnershipHandlers.class);

    private final PermissionStore store;
    private final EventBus eventBus;

    public OwnershipHandlers (PermissionStore store, EventBus eventBus) {
        this.store = store;
        this.eventBus = eventBus;
    }

    /** Reads the new experiment id from the response. */
    public String grantManageOnCreatedExperiment (ApiRequest request, AuthenticatedUser user, String responseBody) {
        try {
            String experimentId = requiredText(JsonUtil.parse(responseBody).path("experiment_id"), "experiment_id");
            grantManage(ResourceKey.experiment(experimentId), user);
        } catch (RuntimeException e) {
            LOG.error("Could not grant {} ownership of the experiment created by {}.", user, request, e);
        }
        return responseBody;
    }

    /** Reads the new model name from the registered_model object in the response. */
    public String grantManageOnCreatedRegisteredModel (ApiRequest request, AuthenticatedUser user, String responseBody) {
        try {
            JsonNode name = JsonUtil.parse(responseBody).path("registered_model").path("name");
            grantManage(ResourceKey.registeredModel(requiredText(name, "registered_model.name")), user);
        } catch (RuntimeException e) {
            LOG.error("Could not grant {} ownership of the registered model created by {}.", user, request, e);
        }
        return responseBody;
    }

    /**
     * The deletion response carries nothing, so the name comes from the request. All grants on the name are removed,
     * otherwise a model registered later under the same name would inherit them.
     */
    public String removeGrantsOnDeletedRegisteredModel (ApiRequest request, AuthenticatedUser user,
                                                         String responseBody) {
        try {
            ResourceKey resource = ResourceKey.registeredModel(request.param("name"));
            int removed = store.deletePermissionsForResource(resource);
            eventBus.send(new PermissionChangeEvent(REVOKED, resource.toString(), null,
                    removed + " grants removed with the registered model").forUser(user));
        } catch (RuntimeException e) {
            LOG.error("Could not remove grants on the registered model deleted by {}.", request, e);
        }
        return responseBody;
    }

    public String moveGrantsOfRenamedRegisteredModel (ApiRequest request, AuthenticatedUser user,
                                                       String responseBody) {
        try {
            String oldName = request.param("name");
            String newName = request.param("new_name");
            store.renameRegisteredModelPermissions(oldName, newName);
            eventBus.send(new PermissionChangeEvent(RENAMED, ResourceKey.registeredModel(oldName).toString(), null,
                    "now " + newName).forUser(user));
        } catch (RuntimeException e) {
            LOG.error("Could not move grants of the registered model renamed by {}.", request, e);
        }
        return responseBody;
    }

    private void grantManage (ResourceKey resource, AuthenticatedUser user) {
        store.updateOrCreatePermission(resource, user.username, Permission.MANAGE);
        eventBus.send(new PermissionChangeEvent(GRANTED, resource.toString(), user.username, "MANAGE as creator")
                .forUser(user));
    }

    private static String requiredText (JsonNode node, String field) {
        if (node == null || !node.isValueNode() || node.asText().isEmpty()) {
            throw new IllegalArgumentException("Response does not contain " + field);
        }
        return node.asText();
    }

}
