package de.bsommerfeld.forum.core.cache;

/**
 * Closed set of cache key kinds. The type parameter binds each key kind to
 * the value type stored under it, so {@link ForumCache#fetch} needs no casts
 * at call sites and every invalidation site names a concrete kind.
 *
 * @param <V> type of the cached value
 */
public sealed interface CacheKey<V> permits ThreadTreeKey, MessageKey, UnreadCountKey, ConfigKey {

    /** Entity-kind prefix, e.g. {@code thread-tree}. */
    String namespace();

    /** Human-readable {@code namespace:id} form used in log output. */
    String render();
}
