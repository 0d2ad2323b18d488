package com.conveyal.trackingauth.components;

/**
 * These are the top-level modules of the authorization server that are instantiated and wired up to one another when
 * the application starts up. There is typically only one instance of each component, and all references to the
 * component are final. Different implementations of a component (e.g. MongoDB or in-memory stores, basic or session
 * authentication) are selected when wiring, never by conditional logic inside other components.
 *
 * This is a marker interface with no methods. All Components must be threadsafe: they are used concurrently by
 * multiple HTTP handler threads.
 */
public interface Component {

}
