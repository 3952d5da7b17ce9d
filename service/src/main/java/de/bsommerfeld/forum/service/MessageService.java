package de.bsommerfeld.forum.service;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.forum.core.cache.ForumCache;
import de.bsommerfeld.forum.core.cache.UnreadCountKey;
import de.bsommerfeld.forum.core.domain.ForumThread;
import de.bsommerfeld.forum.core.domain.Message;
import de.bsommerfeld.forum.core.error.NotFoundException;
import de.bsommerfeld.forum.core.error.ValidationException;
import de.bsommerfeld.forum.core.event.Broadcaster;
import de.bsommerfeld.forum.core.event.ForumEvents;
import de.bsommerfeld.forum.db.MessagePatch;
import de.bsommerfeld.forum.db.MessageSelector;
import de.bsommerfeld.forum.db.RecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Single-message lifecycle: posting, editing, accepting and scoring. Every
 * write refreshes the owning thread's cache entry before returning.
 */
@Singleton
public class MessageService {

    private static final Logger LOG = LoggerFactory.getLogger(MessageService.class);

    private final RecordStore store;
    private final ThreadRepository repository;
    private final ForumCache cache;
    private final Broadcaster broadcaster;

    @Inject
    public MessageService(RecordStore store, ThreadRepository repository, ForumCache cache,
            Broadcaster broadcaster) {
        this.store = store;
        this.repository = repository;
        this.cache = cache;
        this.broadcaster = broadcaster;
    }

    /**
     * Posts a new message. The store assigns the id; the thread's latest
     * activity advances with the message's creation time.
     *
     * @throws NotFoundException   if the thread does not exist
     * @throws ValidationException if the parent is missing or belongs to
     *                             another thread, or the forum does not match
     */
    public Message createMessage(Message message) {
        ForumThread thread = store.getThread(message.threadId());
        if (thread == null) {
            throw NotFoundException.thread(message.threadId());
        }
        if (message.forumId() != thread.forumId()) {
            throw new ValidationException("forumId", "message forum " + message.forumId()
                    + " differs from thread forum " + thread.forumId());
        }
        if (message.parentId() != null) {
            Message parent = store.getMessage(message.parentId());
            if (parent == null || parent.threadId() != message.threadId()) {
                throw new ValidationException("parentId", "parent " + message.parentId()
                        + " is not part of thread " + message.threadId());
            }
        }

        Message stored = store.insertMessage(message.withId(0));
        LOG.debug("Created message {} in thread {}", stored.id(), stored.threadId());

        repository.refreshThread(stored.threadId(), List.of(stored.id()));
        long forumId = stored.forumId();
        cache.invalidateIf(key -> key instanceof UnreadCountKey unread && unread.forumIds().contains(forumId));
        return stored;
    }

    /**
     * Edits subject and content of a message.
     *
     * @return the stored message
     */
    public Message updateMessage(long messageId, String subject, String content) {
        if (!store.editMessage(messageId, subject, content, System.currentTimeMillis() / 1000)) {
            throw NotFoundException.message(messageId);
        }
        Message edited = store.getMessage(messageId);
        if (edited == null) {
            throw NotFoundException.message(messageId);
        }
        repository.refreshThread(edited.threadId(), List.of(messageId));
        return edited;
    }

    /**
     * Sets {@code accepted=yes}.
     *
     * @return {@code false} if the message was already accepted
     */
    public boolean acceptMessage(long messageId) {
        Message message = repository.requireMessage(messageId);
        if (message.isAccepted()) {
            return false;
        }
        patch(message, MessagePatch.empty().setFlag(Message.FLAG_ACCEPTED, "yes"));
        return true;
    }

    /** @return {@code false} if the message was not accepted */
    public boolean unacceptMessage(long messageId) {
        Message message = repository.requireMessage(messageId);
        if (message.flag(Message.FLAG_ACCEPTED) == null) {
            return false;
        }
        patch(message, MessagePatch.empty().removeFlag(Message.FLAG_ACCEPTED));
        return true;
    }

    /** Adds {@code by} (may be negative) to the upvotes. */
    public Message scoreUp(long messageId, int by) {
        return rescore(messageId, MessagePatch.empty().votes(by, 0));
    }

    /** Adds {@code by} (may be negative) to the downvotes. */
    public Message scoreDown(long messageId, int by) {
        return rescore(messageId, MessagePatch.empty().votes(0, by));
    }

    private Message rescore(long messageId, MessagePatch votes) {
        Message message = repository.requireMessage(messageId);
        patch(message, votes);

        Message rescored = repository.requireMessage(messageId);
        try {
            broadcaster.broadcast(ForumEvents.forumChannel(rescored.forumId()), ForumEvents.MESSAGE_RESCORED,
                    Map.of("message_id", rescored.id(),
                            "score", rescored.score(),
                            "upvotes", rescored.upvotes(),
                            "downvotes", rescored.downvotes()));
        } catch (RuntimeException e) {
            LOG.warn("Broadcast of {} for message {} failed", ForumEvents.MESSAGE_RESCORED, messageId, e);
        }
        return rescored;
    }

    private void patch(Message message, MessagePatch patch) {
        if (store.updateWhere(MessageSelector.id(message.id()), patch) == 0) {
            repository.invalidateThread(message.threadId(), List.of(message.id()));
            throw NotFoundException.message(message.id());
        }
        repository.refreshThread(message.threadId(), List.of(message.id()));
    }
}
