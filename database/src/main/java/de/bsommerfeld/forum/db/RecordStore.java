package de.bsommerfeld.forum.db;

import de.bsommerfeld.forum.core.domain.ConfigOption;
import de.bsommerfeld.forum.core.domain.ConfigScope;
import de.bsommerfeld.forum.core.domain.ForumThread;
import de.bsommerfeld.forum.core.domain.Message;
import de.bsommerfeld.forum.core.domain.ReadMarker;
import de.bsommerfeld.forum.core.domain.ScopeSettings;
import de.bsommerfeld.forum.core.domain.ThreadSnapshot;
import de.bsommerfeld.forum.core.domain.UnreadCount;

import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Transactional record store behind the forum core. The store is always the
 * source of truth; everything cached is derived from it.
 *
 * <p>
 * All implementations must be thread-safe. Failures surface as
 * {@link de.bsommerfeld.forum.core.error.StoreException}; a failed multi-row
 * write leaves no partial state behind.
 *
 * <p>
 * Two implementations exist:
 * <ul>
 * <li>{@link SqlRecordStore}: production persistence via SQLite</li>
 * <li>{@link InMemoryRecordStore}: TEST mode and unit tests, no disk I/O</li>
 * </ul>
 * The binding is chosen in the Guice module by application mode.
 */
public interface RecordStore {

    // -- Threads --

    /** Returns the thread, or {@code null} if it does not exist. */
    ForumThread getThread(long threadId);

    /**
     * Upserts thread metadata. {@code latestMessageUtc} never moves
     * backwards.
     */
    void saveThread(ForumThread thread);

    /** Most recently active threads first. */
    List<ForumThread> getRecentThreads(int limit);

    /**
     * Reads thread metadata and every message of the thread (deleted and
     * drafts included) in one consistent pass.
     *
     * @return the snapshot, or {@code null} if the thread does not exist
     */
    ThreadSnapshot getSnapshot(long threadId);

    // -- Messages --

    /** Returns the message including deleted ones, or {@code null}. */
    Message getMessage(long messageId);

    /** All messages of a thread ordered by id, deleted and drafts included. */
    List<Message> getMessagesForThread(long threadId);

    /**
     * Inserts a message with its tags and advances the thread's latest
     * activity. An id of {@code 0} lets the store assign the next monotonic
     * id.
     *
     * @return the persisted message carrying its final id
     */
    Message insertMessage(Message message);

    /**
     * Rewrites subject and content of one message, leaving every other column
     * (votes, flags, deleted state, tags) as currently stored.
     *
     * @return {@code false} if the message does not exist
     */
    boolean editMessage(long messageId, String subject, String content, long updatedUtc);

    /**
     * Bulk conditional update: applies {@code patch} to every message matched
     * by {@code selector} in one atomic operation.
     *
     * @return number of matched messages
     */
    default int updateWhere(MessageSelector selector, MessagePatch patch) {
        return updateAll(List.of(new MessageUpdate(selector, patch)));
    }

    /**
     * Applies several bulk updates as one all-or-nothing unit, in order. The
     * first non-empty update anchors the unit: if its selector matches no
     * existing message, nothing is written at all.
     *
     * @return number of messages matched by the first non-empty selector
     */
    int updateAll(List<MessageUpdate> updates);

    /**
     * Moves every tag association from {@code oldName} to {@code newName}.
     * Messages already carrying {@code newName} simply lose {@code oldName}.
     *
     * @return number of associations that referenced {@code oldName}
     */
    int renameTag(String oldName, String newName);

    // -- Read tracking --

    /**
     * Inserts a read marker per message id, silently skipping existing ones.
     *
     * @return only the markers that did not exist before
     */
    List<ReadMarker> insertReadMarkers(long userId, Collection<Long> messageIds);

    /**
     * Deletes the user's markers for all given ids in one statement.
     *
     * @return number of removed markers
     */
    int deleteReadMarkers(long userId, Collection<Long> messageIds);

    /** Subset of {@code messageIds} the user has a marker for. */
    Set<Long> getReadMessageIds(long userId, Collection<Long> messageIds);

    /** @return {@code true} if the thread was not hidden before */
    boolean hideThread(long userId, long threadId);

    /** @return {@code true} if the thread was hidden before */
    boolean unhideThread(long userId, long threadId);

    /**
     * Counts unread threads and messages of the user within the given forums
     * in one read pass. Deleted and draft messages, archived threads and
     * threads the user hid never count.
     */
    UnreadCount countUnread(long userId, Collection<Long> forumIds);

    // -- Settings --

    /** All option rows of one owner; an empty instance if there are none. */
    ScopeSettings getSettings(ConfigScope scope, long ownerId);

    /** Upserts one option row. */
    void saveOption(ConfigOption option);

    /** @return {@code false} if no such row existed */
    boolean deleteOption(ConfigScope scope, long ownerId, String name);
}
