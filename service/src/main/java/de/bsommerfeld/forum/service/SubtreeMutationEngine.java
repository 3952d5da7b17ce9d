package de.bsommerfeld.forum.service;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.forum.core.cache.ForumCache;
import de.bsommerfeld.forum.core.cache.MessageKey;
import de.bsommerfeld.forum.core.cache.ThreadTreeKey;
import de.bsommerfeld.forum.core.cache.UnreadCountKey;
import de.bsommerfeld.forum.core.domain.Message;
import de.bsommerfeld.forum.core.error.ConflictException;
import de.bsommerfeld.forum.core.error.NotFoundException;
import de.bsommerfeld.forum.core.error.ValidationException;
import de.bsommerfeld.forum.core.tree.MessageTree;
import de.bsommerfeld.forum.db.MessagePatch;
import de.bsommerfeld.forum.db.MessageSelector;
import de.bsommerfeld.forum.db.MessageUpdate;
import de.bsommerfeld.forum.db.RecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Applies cascading state changes to an anchor message and all of its
 * transitive replies.
 *
 * <h3>Closure</h3>
 * The affected ids come from one depth-first walk of the anchor's subtree in
 * the thread's unfiltered tree, so the cost grows with the subtree, not with
 * the thread.
 *
 * <h3>Atomicity</h3>
 * Every operation, retagging included, reaches the store as a single
 * {@link RecordStore#updateAll} call: one transaction regardless of subtree
 * size, and no half-updated subtree on failure. Patches only touch the
 * columns they name, so concurrent vote changes on the same rows survive.
 *
 * <h3>Cache</h3>
 * Only after the store acknowledged the write the thread entry is refreshed
 * through {@link ThreadRepository#refreshThread}. Operations that change
 * what counts as unread also drop every cached unread count.
 *
 * <p>
 * Concurrent mutations of the same subtree are not fenced here; the store's
 * per-row atomicity is all that is guaranteed.
 */
@Singleton
public class SubtreeMutationEngine {

    private static final Logger LOG = LoggerFactory.getLogger(SubtreeMutationEngine.class);

    static final String OPTION_MIN_TAGS = "min_tags_per_message";
    static final String OPTION_MAX_TAGS = "max_tags_per_message";

    private final RecordStore store;
    private final ThreadRepository repository;
    private final ForumCache cache;
    private final ConfigResolver config;

    @Inject
    public SubtreeMutationEngine(RecordStore store, ThreadRepository repository, ForumCache cache,
            ConfigResolver config) {
        this.store = store;
        this.repository = repository;
        this.cache = cache;
        this.config = config;
    }

    // -- Named entry point --

    /**
     * String form used by collaborators, see {@link SubtreeOperation#parse}.
     */
    public MutationResult mutateSubtree(long anchorId, String operation, Map<String, String> params) {
        return mutateSubtree(anchorId, SubtreeOperation.parse(operation, params));
    }

    public MutationResult mutateSubtree(long anchorId, SubtreeOperation operation) {
        Message anchor = repository.requireMessage(anchorId);
        List<Long> closure = closureOf(anchor);
        List<Long> replies = closure.subList(1, closure.size());
        LOG.debug("Applying {} to message {} and {} replies", operation, anchorId, replies.size());

        boolean affectsUnread = false;
        if (operation instanceof SubtreeOperation.Delete delete) {
            MessagePatch anchorPatch = withReason(MessagePatch.empty().deleted(true), delete.reason());
            MessagePatch replyPatch = MessagePatch.empty().deleted(true).removeFlag(Message.FLAG_REASON);
            write(anchor, List.of(
                    new MessageUpdate(MessageSelector.id(anchorId), anchorPatch),
                    new MessageUpdate(MessageSelector.ids(replies), replyPatch)));
            affectsUnread = true;
        } else if (operation instanceof SubtreeOperation.Restore) {
            write(anchor, List.of(new MessageUpdate(MessageSelector.ids(closure),
                    MessagePatch.empty().deleted(false).removeFlag(Message.FLAG_REASON))));
            affectsUnread = true;
        } else if (operation instanceof SubtreeOperation.SetFlag flag) {
            write(anchor, List.of(new MessageUpdate(MessageSelector.ids(closure),
                    MessagePatch.empty().setFlag(flag.key(), flag.value()))));
        } else if (operation instanceof SubtreeOperation.ClearFlag flag) {
            write(anchor, List.of(new MessageUpdate(MessageSelector.ids(closure),
                    MessagePatch.empty().removeFlag(flag.key()))));
        } else if (operation instanceof SubtreeOperation.FlagNoAnswer noAnswer) {
            MessagePatch anchorPatch = withReason(MessagePatch.empty().setFlag(noAnswer.type(), "yes"),
                    noAnswer.reason());
            MessagePatch replyPatch = MessagePatch.empty().removeFlag(Message.FLAG_REASON)
                    .setFlag(noAnswer.type(), "yes");
            write(anchor, List.of(
                    new MessageUpdate(MessageSelector.id(anchorId), anchorPatch),
                    new MessageUpdate(MessageSelector.ids(replies), replyPatch)));
        } else if (operation instanceof SubtreeOperation.UnflagNoAnswer unflag) {
            MessagePatch replyPatch = MessagePatch.empty();
            for (String type : unflag.types()) {
                replyPatch = replyPatch.removeFlag(type);
            }
            write(anchor, List.of(
                    new MessageUpdate(MessageSelector.id(anchorId), replyPatch.removeFlag(Message.FLAG_REASON)),
                    new MessageUpdate(MessageSelector.ids(replies), replyPatch)));
        } else if (operation instanceof SubtreeOperation.Retag retag) {
            List<String> tags = normalizeTags(retag.tags(), anchor.forumId());
            if (!retag.cascade()) {
                closure = List.of(anchorId);
            }
            // anchor first so a vanished anchor rolls back the whole retag
            write(anchor, List.of(
                    new MessageUpdate(MessageSelector.id(anchorId), MessagePatch.empty().tags(tags)),
                    new MessageUpdate(MessageSelector.ids(closure.subList(1, closure.size())),
                            MessagePatch.empty().tags(tags))));
        } else {
            throw new ValidationException("operation", "unsupported operation: " + operation);
        }

        repository.refreshThread(anchor.threadId(), closure);
        if (affectsUnread) {
            cache.invalidateAll(UnreadCountKey.class);
        }
        return new MutationResult(anchor.threadId(), closure);
    }

    // -- Convenience --

    public MutationResult delete(long anchorId, String reason) {
        return mutateSubtree(anchorId, new SubtreeOperation.Delete(reason));
    }

    public MutationResult restore(long anchorId) {
        return mutateSubtree(anchorId, new SubtreeOperation.Restore());
    }

    public MutationResult setFlag(long anchorId, String key, String value) {
        return mutateSubtree(anchorId, new SubtreeOperation.SetFlag(key, value));
    }

    public MutationResult clearFlag(long anchorId, String key) {
        return mutateSubtree(anchorId, new SubtreeOperation.ClearFlag(key));
    }

    public MutationResult retag(long anchorId, List<String> tags, boolean cascade) {
        return mutateSubtree(anchorId, new SubtreeOperation.Retag(tags, cascade));
    }

    public MutationResult flagNoAnswer(long anchorId, String reason, String type) {
        return mutateSubtree(anchorId, new SubtreeOperation.FlagNoAnswer(reason, type));
    }

    public MutationResult unflagNoAnswer(long anchorId, Set<String> types) {
        return mutateSubtree(anchorId, new SubtreeOperation.UnflagNoAnswer(types));
    }

    /**
     * Moves every message tagged {@code oldName} to {@code newName}. Any
     * thread may be affected, so all cached trees and messages are dropped.
     *
     * @return number of tag associations that referenced {@code oldName}
     * @throws ConflictException if both names denote the same tag
     */
    public int mergeTag(String oldName, String newName) {
        String from = normalizeTag(oldName);
        String to = normalizeTag(newName);
        if (from.isEmpty() || to.isEmpty()) {
            throw new ValidationException("tag", "tag names must not be blank");
        }
        if (from.equals(to)) {
            throw new ConflictException("cannot merge tag '" + from + "' into itself");
        }

        int merged = store.renameTag(from, to);
        int dropped = cache.invalidateAll(ThreadTreeKey.class) + cache.invalidateAll(MessageKey.class);
        LOG.info("Merged tag '{}' into '{}': {} associations, {} cache entries dropped", from, to, merged, dropped);
        return merged;
    }

    // -- Internals --

    private List<Long> closureOf(Message anchor) {
        MessageTree tree = repository.buildFullTree(anchor.threadId());
        if (!tree.contains(anchor.id())) {
            // cached snapshot predates the anchor, reload once
            repository.invalidateThread(anchor.threadId(), List.of());
            tree = repository.buildFullTree(anchor.threadId());
        }
        return tree.subtreeIds(anchor.id());
    }

    private void write(Message anchor, List<MessageUpdate> updates) {
        if (store.updateAll(updates) == 0) {
            // cached anchor no longer exists in the store
            repository.invalidateThread(anchor.threadId(), List.of(anchor.id()));
            throw NotFoundException.message(anchor.id());
        }
    }

    private static MessagePatch withReason(MessagePatch patch, String reason) {
        return reason == null ? patch.removeFlag(Message.FLAG_REASON) : patch.setFlag(Message.FLAG_REASON, reason);
    }

    /**
     * Trims, lower-cases and de-duplicates, then checks the count against the
     * forum's tag bounds.
     */
    List<String> normalizeTags(List<String> tags, long forumId) {
        Set<String> normalized = new LinkedHashSet<>();
        for (String tag : tags) {
            String t = normalizeTag(tag);
            if (!t.isEmpty()) {
                normalized.add(t);
            }
        }
        int min = config.resolveInt(OPTION_MIN_TAGS, null, forumId, 1);
        int max = config.resolveInt(OPTION_MAX_TAGS, null, forumId, 3);
        if (normalized.size() < min) {
            throw new ValidationException("tags", "at least " + min + " tag(s) required");
        }
        if (normalized.size() > max) {
            throw new ValidationException("tags", "at most " + max + " tag(s) allowed");
        }
        return new ArrayList<>(normalized);
    }

    private static String normalizeTag(String tag) {
        return tag == null ? "" : tag.trim().toLowerCase(Locale.ROOT);
    }
}
