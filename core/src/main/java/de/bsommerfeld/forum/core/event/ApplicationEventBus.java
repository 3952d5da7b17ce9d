package de.bsommerfeld.forum.core.event;

import com.google.common.eventbus.EventBus;
import com.google.common.eventbus.SubscriberExceptionContext;
import com.google.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thin wrapper around Guava's {@link EventBus}. Decouples the forum core from
 * whoever pushes its notifications to connected clients; subscribers register
 * with {@code @Subscribe} methods.
 *
 * <p>
 * Delivery is synchronous on the posting thread. A subscriber that throws is
 * logged and does not affect the poster or other subscribers.
 */
@Singleton
public class ApplicationEventBus {

    private static final Logger LOG = LoggerFactory.getLogger(ApplicationEventBus.class);
    private final EventBus eventBus;

    public ApplicationEventBus() {
        this.eventBus = new EventBus(ApplicationEventBus::logSubscriberFailure);
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

    private static void logSubscriberFailure(Throwable e, SubscriberExceptionContext ctx) {
        LOG.warn("Subscriber {} failed on event {}", ctx.getSubscriberMethod().getName(),
                ctx.getEvent().getClass().getSimpleName(), e);
    }
}
