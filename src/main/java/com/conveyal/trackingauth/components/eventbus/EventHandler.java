package com.conveyal.trackingauth.components.eventbus;

/** Receives events from the EventBus, such as authorization decisions, permission changes and errors. */
public interface EventHandler {

    void handleEvent (Event event);

    /** Handlers only receive the events they accept. By default that is all of them. */
    default boolean acceptEvent (Event event) {
        return true;
    }

    /**
     * True if handling never blocks and returns quickly, so it can run on the request thread. Handlers returning
     * false are run on the bus's executor instead.
     */
    boolean synchronous ();

}
