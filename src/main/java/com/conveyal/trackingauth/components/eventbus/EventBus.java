package com.conveyal.trackingauth.components.eventbus;

import com.conveyal.trackingauth.components.Component;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;

import static com.google.common.base.Preconditions.checkState;

/**
 * Shared listener registration across all components, so that a component can report what it did (a request was
 * denied, a grant was created) without knowing who records it.
 *
 * Handlers are either called synchronously in the thread that sent the event, or handed off to an executor.
 * Event handlers should never themselves trigger more events.
 */
public class EventBus implements Component {

    private static final Logger LOG = LoggerFactory.getLogger(EventBus.class);

    private final ExecutorService asyncExecutor;

    // Linear scan through handlers is simpler and at least as efficient as a lookup for small numbers of handlers.
    private final List<EventHandler> handlers = new ArrayList<>();

    public EventBus (ExecutorService asyncExecutor) {
        this.asyncExecutor = asyncExecutor;
    }

    /** This class is not synchronized, so you should add all handlers at once before any events are fired. */
    public void addHandlers (EventHandler... handlers) {
        checkState(this.handlers.isEmpty());
        for (EventHandler handler : handlers) {
            LOG.info("An instance of {} will receive events.", handler.getClass().getSimpleName());
            this.handlers.add(handler);
        }
    }

    public <T extends Event> void send (final T event) {
        LOG.debug("Bus received event: {}", event);
        for (EventHandler handler : handlers) {
            if (!handler.acceptEvent(event)) continue;
            if (handler.synchronous()) {
                try {
                    handler.handleEvent(event);
                } catch (Throwable t) {
                    // Do not recursively fire events on errors, there is some programming mistake.
                    LOG.error("Event handler {} failed.", handler.getClass().getSimpleName(), t);
                }
            } else {
                asyncExecutor.execute(() -> handler.handleEvent(event));
            }
        }
    }

}
