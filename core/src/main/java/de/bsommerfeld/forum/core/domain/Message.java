package de.bsommerfeld.forum.core.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable snapshot of a single forum message as persisted in the record
 * store. Messages form a tree per thread through {@code parentId}; the tree
 * itself is never stored, see {@code TreeBuilder}.
 * Timestamps are Unix epoch seconds (UTC).
 *
 * @param id         store-assigned, monotonic identifier ({@code 0} before
 *                   the message was inserted)
 * @param threadId   owning thread
 * @param forumId    forum of the owning thread, denormalized for unread
 *                   counting
 * @param parentId   direct parent message, {@code null} for the thread root
 * @param userId     registered author, {@code null} for anonymous posts
 * @param author     display name of the author
 * @param subject    subject line
 * @param content    raw message body
 * @param deleted    soft-delete marker
 * @param draft      unpublished draft marker
 * @param flags      open string-keyed flag map (e.g. {@code accepted},
 *                   {@code reason}, {@code no-answer})
 * @param tags       tag names in display order
 * @param upvotes    upvote counter
 * @param downvotes  downvote counter
 * @param createdUtc creation timestamp in epoch seconds
 * @param updatedUtc last modification timestamp in epoch seconds
 */
public record Message(
        long id,
        long threadId,
        long forumId,
        Long parentId,
        Long userId,
        String author,
        String subject,
        String content,
        boolean deleted,
        boolean draft,
        Map<String, String> flags,
        List<String> tags,
        int upvotes,
        int downvotes,
        long createdUtc,
        long updatedUtc) {

    public static final String FLAG_REASON = "reason";
    public static final String FLAG_ACCEPTED = "accepted";

    /**
     * Canonical constructor. Flags and tags are copied into unmodifiable
     * collections so cached snapshots can be shared between threads.
     */
    public Message {
        flags = flags == null || flags.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(flags));
        tags = tags == null ? Collections.emptyList() : List.copyOf(tags);
    }

    /**
     * Convenience constructor for a fresh, not yet persisted message.
     */
    public Message(long threadId, long forumId, Long parentId, Long userId, String author,
            String subject, String content, long createdUtc) {
        this(0L, threadId, forumId, parentId, userId, author, subject, content,
                false, false, Collections.emptyMap(), Collections.emptyList(),
                0, 0, createdUtc, createdUtc);
    }

    public boolean isRoot() {
        return parentId == null;
    }

    public String flag(String key) {
        return flags.get(key);
    }

    public boolean isAccepted() {
        return "yes".equals(flags.get(FLAG_ACCEPTED));
    }

    public int score() {
        return upvotes - downvotes;
    }

    public Message withId(long newId) {
        return new Message(newId, threadId, forumId, parentId, userId, author, subject, content,
                deleted, draft, flags, tags, upvotes, downvotes, createdUtc, updatedUtc);
    }

    public Message withContent(String newSubject, String newContent, long now) {
        return new Message(id, threadId, forumId, parentId, userId, author, newSubject, newContent,
                deleted, draft, flags, tags, upvotes, downvotes, createdUtc, now);
    }

    public Message withDeleted(boolean newDeleted, Map<String, String> newFlags, long now) {
        return new Message(id, threadId, forumId, parentId, userId, author, subject, content,
                newDeleted, draft, newFlags, tags, upvotes, downvotes, createdUtc, now);
    }

    public Message withFlags(Map<String, String> newFlags, long now) {
        return new Message(id, threadId, forumId, parentId, userId, author, subject, content,
                deleted, draft, newFlags, tags, upvotes, downvotes, createdUtc, now);
    }

    public Message withTags(List<String> newTags, long now) {
        return new Message(id, threadId, forumId, parentId, userId, author, subject, content,
                deleted, draft, flags, newTags, upvotes, downvotes, createdUtc, now);
    }

    public Message withVotes(int newUpvotes, int newDownvotes) {
        return new Message(id, threadId, forumId, parentId, userId, author, subject, content,
                deleted, draft, flags, tags, newUpvotes, newDownvotes, createdUtc, updatedUtc);
    }
}
