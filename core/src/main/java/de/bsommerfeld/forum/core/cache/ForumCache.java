package de.bsommerfeld.forum.core.cache;

import com.google.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Process-wide read-through cache of derived forum state.
 *
 * <p>
 * Entries never expire. Staleness is bounded by explicit invalidation: every
 * mutating path calls {@link #put} or {@link #invalidate} for each key it can
 * affect, after its store write was acknowledged. The store stays the source
 * of truth; a missing entry only costs one extra store read.
 *
 * <h3>Concurrency</h3>
 * Backed by a {@link ConcurrentHashMap}. Concurrent misses for the same key
 * may each run their producer; this is a cache, not a single-flight lock.
 *
 * <p>
 * Every key seen by {@link #fetch} or {@link #put} carries a generation
 * counter that each write or invalidation of that key bumps. A loaded value
 * is only published if the generation did not move while its producer ran,
 * so a load that read the store before a concurrent write can never
 * overwrite the fresher entry that write installed. {@link #clear} bumps a
 * global epoch with the same effect for every key.
 *
 * <p>
 * Constructed once (Guice singleton) and injected wherever it is needed.
 */
@Singleton
public class ForumCache {

    private static final Logger LOG = LoggerFactory.getLogger(ForumCache.class);

    private final Map<CacheKey<?>, Object> entries = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<CacheKey<?>, Long> generations = new ConcurrentHashMap<>();
    private final AtomicLong epoch = new AtomicLong();
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    /**
     * Returns the cached value, or runs {@code producer}, stores its result
     * and returns it. A {@code null} result is returned but not cached, and
     * so is a result whose key was written or invalidated while the producer
     * ran.
     */
    public <V> V fetch(CacheKey<V> key, Supplier<? extends V> producer) {
        V cached = get(key);
        if (cached != null) {
            hits.incrementAndGet();
            return cached;
        }
        misses.incrementAndGet();
        LOG.debug("Cache miss for {}", key.render());
        long startEpoch = epoch.get();
        long startGeneration = generations.computeIfAbsent(key, k -> 0L);
        V produced = producer.get();
        if (produced != null) {
            generations.computeIfPresent(key, (k, generation) -> {
                if (generation == startGeneration && epoch.get() == startEpoch) {
                    entries.put(k, produced);
                } else {
                    LOG.debug("Discarded outdated load of {}", k.render());
                }
                return generation;
            });
        }
        return produced;
    }

    /** Returns the cached value without populating, {@code null} on miss. */
    @SuppressWarnings("unchecked")
    public <V> V get(CacheKey<V> key) {
        return (V) entries.get(key);
    }

    /**
     * Unconditional overwrite, used to refresh an entry eagerly after a write.
     * A {@code null} value removes the entry.
     */
    public <V> void put(CacheKey<V> key, V value) {
        generations.compute(key, (k, generation) -> {
            if (value == null) {
                entries.remove(k);
            } else {
                entries.put(k, value);
            }
            return generation == null ? 1L : generation + 1;
        });
    }

    public void invalidate(CacheKey<?> key) {
        if (evict(key)) {
            LOG.debug("Invalidated {}", key.render());
        }
    }

    /**
     * Removes every entry of the given key kind, e.g. all thread trees after
     * a tag merge.
     *
     * @return number of removed entries
     */
    public int invalidateAll(Class<? extends CacheKey<?>> kind) {
        return invalidateIf(kind::isInstance);
    }

    /**
     * Removes every entry whose key matches {@code selector}.
     *
     * @return number of removed entries
     */
    public int invalidateIf(Predicate<CacheKey<?>> selector) {
        Set<CacheKey<?>> keys = new HashSet<>(generations.keySet());
        keys.addAll(entries.keySet());
        int removed = 0;
        for (CacheKey<?> key : keys) {
            if (selector.test(key) && evict(key)) {
                removed++;
            }
        }
        if (removed > 0) {
            LOG.debug("Invalidated {} cache entries", removed);
        }
        return removed;
    }

    public void clear() {
        epoch.incrementAndGet();
        generations.clear();
        entries.clear();
        LOG.info("Forum cache cleared.");
    }

    /**
     * Drops the entry and bumps the key's generation, which also voids any
     * load of the key still in flight.
     *
     * @return whether an entry was removed
     */
    private boolean evict(CacheKey<?> key) {
        boolean[] removed = new boolean[1];
        generations.computeIfPresent(key, (k, generation) -> {
            removed[0] = entries.remove(k) != null;
            return generation + 1;
        });
        // keys without a generation have no load in flight
        return removed[0] || entries.remove(key) != null;
    }

    public boolean contains(CacheKey<?> key) {
        return entries.containsKey(key);
    }

    public int size() {
        return entries.size();
    }

    public long hitCount() {
        return hits.get();
    }

    public long missCount() {
        return misses.get();
    }
}
