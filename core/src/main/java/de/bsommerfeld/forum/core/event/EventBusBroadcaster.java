package de.bsommerfeld.forum.core.event;

import com.google.inject.Inject;
import com.google.inject.Singleton;

import java.util.Map;

/**
 * {@link Broadcaster} that posts {@link ForumEvents.BroadcastEvent}s on the
 * application event bus, where a websocket or SSE bridge picks them up.
 */
@Singleton
public class EventBusBroadcaster implements Broadcaster {

    private final ApplicationEventBus eventBus;

    @Inject
    public EventBusBroadcaster(ApplicationEventBus eventBus) {
        this.eventBus = eventBus;
    }

    @Override
    public void broadcast(String channel, String event, Map<String, Object> payload) {
        eventBus.post(new ForumEvents.BroadcastEvent(channel, event, payload));
    }
}
