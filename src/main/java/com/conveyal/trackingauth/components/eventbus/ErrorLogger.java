package com.conveyal.trackingauth.components.eventbus;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes internal and upstream errors to the log with their stack traces, which are never sent to clients.
 */
public class ErrorLogger implements EventHandler {

    private static final Logger LOG = LoggerFactory.getLogger(ErrorLogger.class);

    @Override
    public void handleEvent (Event event) {
        LOG.error(((ErrorEvent) event).traceWithContext(true));
    }

    @Override
    public boolean acceptEvent (Event event) {
        return event instanceof ErrorEvent;
    }

    @Override
    public boolean synchronous () {
        // Logging is fast and must not be lost if the executor is saturated.
        return true;
    }

}
