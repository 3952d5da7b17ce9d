package de.bsommerfeld.forum.service;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.forum.core.cache.ForumCache;
import de.bsommerfeld.forum.core.cache.MessageKey;
import de.bsommerfeld.forum.core.cache.ThreadTreeKey;
import de.bsommerfeld.forum.core.cache.UnreadCountKey;
import de.bsommerfeld.forum.core.domain.ForumThread;
import de.bsommerfeld.forum.core.domain.Message;
import de.bsommerfeld.forum.core.domain.ThreadSnapshot;
import de.bsommerfeld.forum.core.error.NotFoundException;
import de.bsommerfeld.forum.core.event.ApplicationEventBus;
import de.bsommerfeld.forum.core.event.ForumEvents;
import de.bsommerfeld.forum.core.tree.MessageOrdering;
import de.bsommerfeld.forum.core.tree.MessageTree;
import de.bsommerfeld.forum.core.tree.TreeBuilder;
import de.bsommerfeld.forum.core.tree.VisibilityFilter;
import de.bsommerfeld.forum.db.RecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Cache-first access to threads and messages over the {@link RecordStore}.
 *
 * <p>
 * This is the single read path for thread trees. Nothing above this class
 * queries the store for thread or message snapshots directly.
 *
 * <h3>Reads</h3>
 * One {@link ThreadSnapshot} per thread is cached under
 * {@link ThreadTreeKey}. Trees are built from it on demand with the caller's
 * visibility filter and ordering, so one cache entry serves every viewer.
 *
 * <h3>Refresh after writes</h3>
 * Mutating components call {@link #refreshThread} once their store write was
 * acknowledged. The snapshot is re-read and {@code put} into the cache
 * together with the touched message snapshots. If that refresh fails, the
 * affected keys are dropped instead and the failure is logged; the write
 * itself stays committed and the next read repopulates the cache.
 */
@Singleton
public class ThreadRepository {

    private static final Logger LOG = LoggerFactory.getLogger(ThreadRepository.class);

    private final RecordStore store;
    private final ForumCache cache;
    private final ApplicationEventBus eventBus;

    @Inject
    public ThreadRepository(RecordStore store, ForumCache cache, ApplicationEventBus eventBus) {
        this.store = store;
        this.cache = cache;
        this.eventBus = eventBus;
    }

    /**
     * Preloads the snapshots of the most recently active threads.
     *
     * @return number of threads now cached
     */
    public int warmup(int limit) {
        LOG.info("Warming up thread cache...");
        int warmed = 0;
        for (ForumThread thread : store.getRecentThreads(limit)) {
            if (loadSnapshot(thread.id()) != null) {
                warmed++;
            }
        }
        LOG.info("Cache warmed with {} threads.", warmed);
        return warmed;
    }

    // -- Reads (cache-first) --

    /**
     * @return the cached or freshly loaded snapshot, {@code null} if the
     *         thread does not exist
     */
    public ThreadSnapshot loadSnapshot(long threadId) {
        return cache.fetch(new ThreadTreeKey(threadId), () -> store.getSnapshot(threadId));
    }

    public ThreadSnapshot requireSnapshot(long threadId) {
        ThreadSnapshot snapshot = loadSnapshot(threadId);
        if (snapshot == null) {
            throw NotFoundException.thread(threadId);
        }
        return snapshot;
    }

    public ForumThread requireThread(long threadId) {
        return requireSnapshot(threadId).thread();
    }

    /**
     * Builds the reply tree of a thread as seen through {@code filter}.
     *
     * @throws NotFoundException if the thread does not exist
     */
    public MessageTree buildTree(long threadId, VisibilityFilter filter, MessageOrdering ordering) {
        ThreadSnapshot snapshot = requireSnapshot(threadId);
        return TreeBuilder.build(threadId, snapshot.messages(), filter, ordering);
    }

    /** Unfiltered tree, the basis for subtree closures. */
    public MessageTree buildFullTree(long threadId) {
        return buildTree(threadId, VisibilityFilter.ALL, MessageOrdering.ASCENDING);
    }

    /** @return the message including deleted ones, {@code null} if absent */
    public Message findMessage(long messageId) {
        return cache.fetch(new MessageKey(messageId), () -> store.getMessage(messageId));
    }

    public Message requireMessage(long messageId) {
        Message message = findMessage(messageId);
        if (message == null) {
            throw NotFoundException.message(messageId);
        }
        return message;
    }

    // -- Writes --

    /**
     * Flips the archived flag of a thread. Archived threads never count as
     * unread, so every cached unread count is dropped.
     */
    public ForumThread setThreadArchived(long threadId, boolean archived) {
        ForumThread thread = store.getThread(threadId);
        if (thread == null) {
            throw NotFoundException.thread(threadId);
        }
        ForumThread updated = thread.withArchived(archived);
        store.saveThread(updated);
        LOG.debug("Thread {} archived={}", threadId, archived);

        refreshThread(threadId, List.of());
        cache.invalidateAll(UnreadCountKey.class);
        return updated;
    }

    // -- Cache maintenance --

    /**
     * Eagerly re-reads the thread snapshot and replaces the cached thread
     * entry and the entries of {@code touchedMessageIds}. Must only be called
     * after the triggering store write was acknowledged.
     */
    public void refreshThread(long threadId, Collection<Long> touchedMessageIds) {
        try {
            ThreadSnapshot snapshot = store.getSnapshot(threadId);
            cache.put(new ThreadTreeKey(threadId), snapshot);

            Map<Long, Message> byId = new HashMap<>();
            if (snapshot != null) {
                for (Message m : snapshot.messages()) {
                    byId.put(m.id(), m);
                }
            }
            for (Long id : touchedMessageIds) {
                cache.put(new MessageKey(id), byId.get(id));
            }
            LOG.debug("Refreshed thread {} ({} touched messages)", threadId, touchedMessageIds.size());
        } catch (RuntimeException e) {
            LOG.warn("Cache refresh of thread {} failed, dropping its entries instead", threadId, e);
            invalidateThread(threadId, touchedMessageIds);
        }
        eventBus.post(new ForumEvents.ThreadChangedEvent(threadId));
    }

    /** Drops the thread entry and the given message entries. */
    public void invalidateThread(long threadId, Collection<Long> messageIds) {
        cache.invalidate(new ThreadTreeKey(threadId));
        for (Long id : messageIds) {
            cache.invalidate(new MessageKey(id));
        }
    }
}
