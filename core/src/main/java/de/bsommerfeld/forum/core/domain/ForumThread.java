package de.bsommerfeld.forum.core.domain;

/**
 * Persisted thread metadata. The message tree of a thread is derived state
 * and lives in {@link ThreadSnapshot} / {@code MessageTree}, never here.
 *
 * @param id               thread identifier
 * @param forumId          owning forum
 * @param slug             URL slug, informational only
 * @param archived         archived threads never count as unread
 * @param latestMessageUtc timestamp of the newest message in epoch seconds
 */
public record ForumThread(
        long id,
        long forumId,
        String slug,
        boolean archived,
        long latestMessageUtc) {

    public ForumThread withArchived(boolean newArchived) {
        return new ForumThread(id, forumId, slug, newArchived, latestMessageUtc);
    }

    public ForumThread withLatestMessageUtc(long utc) {
        return new ForumThread(id, forumId, slug, archived, Math.max(latestMessageUtc, utc));
    }
}
