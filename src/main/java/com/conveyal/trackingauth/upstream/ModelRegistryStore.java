package com.conveyal.trackingauth.upstream;

import com.conveyal.trackingauth.authorization.SearchQuery;
import com.conveyal.trackingauth.components.Component;
import com.fasterxml.jackson.databind.node.ObjectNode;

/** The tracking server's registered model store, which is only consulted to refill filtered search pages. */
public interface ModelRegistryStore extends Component {

    PagedList<ObjectNode> searchRegisteredModels (SearchQuery query, String pageToken);

}
