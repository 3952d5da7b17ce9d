package de.bsommerfeld.forum.service;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.forum.core.cache.ForumCache;
import de.bsommerfeld.forum.core.cache.UnreadCountKey;
import de.bsommerfeld.forum.core.domain.ReadMarker;
import de.bsommerfeld.forum.core.domain.UnreadCount;
import de.bsommerfeld.forum.core.event.Broadcaster;
import de.bsommerfeld.forum.core.event.ForumEvents;
import de.bsommerfeld.forum.db.RecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Per-user read markers and the unread counts derived from them.
 *
 * <p>
 * A marker's existence means "read", its absence "unread". Marking unread is
 * therefore one bulk delete. After each successful mark a notification goes
 * to {@code users:{id}}; broadcast failures are logged and never fail the
 * mark itself.
 *
 * <p>
 * Unread counts are cached per {@code (user, forum set)} and dropped for the
 * user on every change of their markers or hidden threads.
 */
@Singleton
public class ReadTrackingLedger {

    private static final Logger LOG = LoggerFactory.getLogger(ReadTrackingLedger.class);

    private final RecordStore store;
    private final ForumCache cache;
    private final Broadcaster broadcaster;

    @Inject
    public ReadTrackingLedger(RecordStore store, ForumCache cache, Broadcaster broadcaster) {
        this.store = store;
        this.cache = cache;
        this.broadcaster = broadcaster;
    }

    /**
     * Marks messages read. Already-read messages are skipped.
     *
     * @return only the markers that were newly created; empty for anonymous
     *         users
     */
    public List<ReadMarker> markRead(Long userId, Collection<Long> messageIds) {
        if (userId == null || messageIds.isEmpty()) {
            return List.of();
        }
        List<ReadMarker> inserted = store.insertReadMarkers(userId, messageIds);
        if (!inserted.isEmpty()) {
            invalidateCounts(userId);
        }

        List<Long> ids = new ArrayList<>(inserted.size());
        for (ReadMarker marker : inserted) {
            ids.add(marker.messageId());
        }
        notifyUser(userId, ForumEvents.MESSAGE_MARKED_READ, ids);
        return inserted;
    }

    /**
     * Removes the user's markers for all given messages in one bulk delete.
     *
     * @return number of removed markers
     */
    public int markUnread(Long userId, Collection<Long> messageIds) {
        if (userId == null || messageIds.isEmpty()) {
            return 0;
        }
        int removed = store.deleteReadMarkers(userId, messageIds);
        invalidateCounts(userId);
        notifyUser(userId, ForumEvents.MESSAGE_MARKED_UNREAD, List.copyOf(messageIds));
        return removed;
    }

    /**
     * Unread threads and messages of the user within {@code visibleForumIds}.
     * Anonymous users have nothing unread.
     */
    public UnreadCount countUnread(Long userId, Collection<Long> visibleForumIds) {
        if (userId == null || visibleForumIds.isEmpty()) {
            return UnreadCount.NONE;
        }
        return cache.fetch(UnreadCountKey.of(userId, visibleForumIds),
                () -> store.countUnread(userId, visibleForumIds));
    }

    /** Hides a thread from the user's unread counts. */
    public boolean hideThread(long userId, long threadId) {
        boolean changed = store.hideThread(userId, threadId);
        invalidateCounts(userId);
        return changed;
    }

    public boolean unhideThread(long userId, long threadId) {
        boolean changed = store.unhideThread(userId, threadId);
        invalidateCounts(userId);
        return changed;
    }

    private void invalidateCounts(long userId) {
        cache.invalidateIf(key -> key instanceof UnreadCountKey unread && unread.userId() == userId);
    }

    private void notifyUser(long userId, String event, List<Long> messageIds) {
        try {
            broadcaster.broadcast(ForumEvents.userChannel(userId), event, Map.of("message_ids", messageIds));
        } catch (RuntimeException e) {
            LOG.warn("Broadcast of {} to user {} failed", event, userId, e);
        }
    }
}
