package de.bsommerfeld.forum.core.event;

import com.google.common.eventbus.Subscribe;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class ApplicationEventBusTest {

    @Test
    void post_shouldDeliverEventToRegisteredListener() {
        var eventBus = new ApplicationEventBus();
        var received = new AtomicReference<ForumEvents.ThreadChangedEvent>();

        Object listener = new Object() {
            @Subscribe
            public void onEvent(ForumEvents.ThreadChangedEvent event) {
                received.set(event);
            }
        };

        eventBus.register(listener);
        eventBus.post(new ForumEvents.ThreadChangedEvent(3));

        assertEquals(3, received.get().threadId());
    }

    @Test
    void unregister_shouldStopDeliveringEvents() {
        var eventBus = new ApplicationEventBus();
        var received = new AtomicReference<String>();

        Object listener = new Object() {
            @Subscribe
            public void onEvent(String event) {
                received.set(event);
            }
        };

        eventBus.register(listener);
        eventBus.post("first");
        eventBus.unregister(listener);
        eventBus.post("second");

        assertEquals("first", received.get());
    }

    @Test
    void post_shouldIsolateFailingSubscribers() {
        var eventBus = new ApplicationEventBus();
        var received = new AtomicReference<String>();

        eventBus.register(new Object() {
            @Subscribe
            public void onEvent(String event) {
                throw new IllegalStateException("boom");
            }
        });
        eventBus.register(new Object() {
            @Subscribe
            public void onEvent(String event) {
                received.set(event);
            }
        });

        assertDoesNotThrow(() -> eventBus.post("shared-event"));
        assertEquals("shared-event", received.get());
    }

    @Test
    void post_shouldNotThrowForUnhandledEvents() {
        var eventBus = new ApplicationEventBus();
        assertDoesNotThrow(() -> eventBus.post("nobody-listens"));
    }

    @Test
    void eventBusBroadcaster_shouldPostBroadcastEvent() {
        var eventBus = new ApplicationEventBus();
        var received = new AtomicReference<ForumEvents.BroadcastEvent>();
        eventBus.register(new Object() {
            @Subscribe
            public void onEvent(ForumEvents.BroadcastEvent event) {
                received.set(event);
            }
        });

        new EventBusBroadcaster(eventBus).broadcast(ForumEvents.userChannel(42),
                ForumEvents.MESSAGE_MARKED_READ, Map.of("message_ids", List.of(1L, 2L)));

        assertEquals("users:42", received.get().channel());
        assertEquals("message_marked_read", received.get().event());
        assertEquals(List.of(1L, 2L), received.get().payload().get("message_ids"));
    }
}
