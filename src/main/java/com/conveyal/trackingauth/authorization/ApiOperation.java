package com.conveyal.trackingauth.authorization;

import java.util.Set;

/**
 * An endpoint that requests can be authorized against. Implemented by enums, so the full set of operations is known
 * when the route table is built and can be checked for completeness.
 */
public interface ApiOperation {

    String name ();

    /**
     * The path, with path parameters in angle brackets like {@code <model_id>}. A parameter written
     * {@code <path:name>} matches the rest of the path including slashes.
     */
    String path ();

    Set<String> methods ();

    /**
     * True if the path is relative to the versioned REST API and is served under each REST prefix
     * (e.g. /api/2.0 and /ajax-api/2.0). Otherwise the path is absolute.
     */
    boolean restApi ();

}
