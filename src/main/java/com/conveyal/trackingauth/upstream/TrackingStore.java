package com.conveyal.trackingauth.upstream;

import com.conveyal.trackingauth.AuthServerException;
import com.conveyal.trackingauth.authorization.SearchQuery;
import com.conveyal.trackingauth.components.Component;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * The parts of the tracking server's experiment store that the authorization layer reads from. Search results are
 * kept as raw JSON objects so that filtered pages can be handed back to clients without losing any fields.
 */
public interface TrackingStore extends Component {

    /** @throws AuthServerException RESOURCE_NOT_FOUND if there is no such experiment. */
    Experiment getExperiment (String experimentId);

    /** @return null if no experiment has this name. */
    Experiment getExperimentByName (String name);

    /** @throws AuthServerException RESOURCE_NOT_FOUND if there is no such run. */
    Run getRun (String runId);

    /** @throws AuthServerException RESOURCE_NOT_FOUND if there is no such logged model. */
    LoggedModel getLoggedModel (String modelId);

    /** @throws AuthServerException RESOURCE_NOT_FOUND if there is no such trace. */
    TraceInfo getTraceInfo (String requestId);

    PagedList<ObjectNode> searchExperiments (SearchQuery query, String pageToken);

    PagedList<ObjectNode> searchLoggedModels (SearchQuery query, String pageToken);

    /** @return the id of the new experiment. */
    String createExperiment (String name);

    void deleteExperiment (String experimentId);

}
