package de.bsommerfeld.canary.core.event;

import com.google.common.eventbus.EventBus;
import com.google.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A thin wrapper around Guava's EventBus. Lifecycle components post
 * {@link LifecycleEvents} as they finish units of work; the CLI subscribes to
 * print itemized progress while a batch is still running.
 */
@Singleton
public class ApplicationEventBus {

    private static final Logger LOG = LoggerFactory.getLogger(ApplicationEventBus.class);
    private final EventBus eventBus;

    public ApplicationEventBus() {
        this.eventBus = new EventBus((exception, context) -> LOG.error(
                "Subscriber {} failed on {}", context.getSubscriberMethod(), context.getEvent(), exception));
    }

    public void post(Object event) {
        LOG.debug("Posting event: {}", event);
        eventBus.post(event);
    }

    public void register(Object listener) {
        LOG.trace("Registering listener: {}", listener.getClass().getName());
        eventBus.register(listener);
    }

    public void unregister(Object listener) {
        LOG.trace("Unregistering listener: {}", listener.getClass().getName());
        eventBus.unregister(listener);
    }
}
