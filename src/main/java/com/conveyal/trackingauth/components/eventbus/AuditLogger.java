package com.conveyal.trackingauth.components.eventbus;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes the security-relevant events to the log: every denied request and every change to users or grants. Allowed
 * requests and plain HTTP traffic are logged at debug level only.
 */
public class AuditLogger implements EventHandler {

    private static final Logger LOG = LoggerFactory.getLogger(AuditLogger.class);

    @Override
    public void handleEvent (Event event) {
        if (event instanceof AuthorizationEvent) {
            if (event.success) {
                LOG.debug("{}", event);
            } else {
                LOG.info("{}", event);
            }
        } else if (event instanceof PermissionChangeEvent) {
            LOG.info("{}", event);
        } else if (event instanceof HttpApiEvent) {
            LOG.debug("{}", event);
        }
    }

    @Override
    public boolean acceptEvent (Event event) {
        return event instanceof AuthorizationEvent
                || event instanceof PermissionChangeEvent
                || event instanceof HttpApiEvent;
    }

    @Override
    public boolean synchronous () {
        return true;
    }

}
