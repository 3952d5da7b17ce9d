package de.bsommerfeld.forum.core.cache;

import de.bsommerfeld.forum.core.domain.UnreadCount;

import java.util.Collection;
import java.util.Set;
import java.util.TreeSet;

/**
 * {@code unread-count:{userId}:{forumIds}} → unread counts of a user over a
 * set of visible forums. Invalidated per user, whatever the forum set.
 */
public record UnreadCountKey(long userId, Set<Long> forumIds) implements CacheKey<UnreadCount> {

    public UnreadCountKey {
        forumIds = Set.copyOf(forumIds);
    }

    public static UnreadCountKey of(long userId, Collection<Long> forumIds) {
        return new UnreadCountKey(userId, Set.copyOf(forumIds));
    }

    @Override
    public String namespace() {
        return "unread-count";
    }

    @Override
    public String render() {
        return namespace() + ":" + userId + ":" + new TreeSet<>(forumIds);
    }
}
