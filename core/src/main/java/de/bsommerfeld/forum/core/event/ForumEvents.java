package de.bsommerfeld.forum.core.event;

import java.util.Map;

/**
 * Events the forum core posts on the {@link ApplicationEventBus}.
 */
public class ForumEvents {

    public static final String MESSAGE_MARKED_READ = "message_marked_read";
    public static final String MESSAGE_MARKED_UNREAD = "message_marked_unread";
    public static final String MESSAGE_RESCORED = "message_rescored";

    /**
     * A fire-and-forget notification for clients listening on
     * {@code channel} (e.g. {@code users:42} or {@code forum:7}).
     */
    public record BroadcastEvent(String channel, String event, Map<String, Object> payload) {
        public BroadcastEvent {
            payload = payload == null ? Map.of() : Map.copyOf(payload);
        }
    }

    /**
     * Posted after the cached state of a thread was refreshed or dropped
     * because of a write.
     */
    public record ThreadChangedEvent(long threadId) {
    }

    public static String userChannel(long userId) {
        return "users:" + userId;
    }

    public static String forumChannel(long forumId) {
        return "forum:" + forumId;
    }
}
