package de.bsommerfeld.forum.service;

import com.google.inject.Guice;
import com.google.inject.Inject;
import com.google.inject.Injector;
import com.google.inject.Singleton;
import de.bsommerfeld.forum.core.cache.ForumCache;
import de.bsommerfeld.forum.core.config.ForumCoreConfig;
import de.bsommerfeld.forum.core.domain.ReadMarker;
import de.bsommerfeld.forum.core.domain.UnreadCount;
import de.bsommerfeld.forum.core.tree.MessageOrdering;
import de.bsommerfeld.forum.core.tree.MessageTree;
import de.bsommerfeld.forum.core.tree.VisibilityFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Entry point for web and application collaborators. Every call returns
 * cache-consistent results: a read issued after a mutation returned sees the
 * mutated state.
 *
 * <p>
 * The finer-grained services (messages, settings) are exposed for the
 * operations that are not part of the core read/mutate surface.
 */
@Singleton
public class ForumCore {

    private static final Logger LOG = LoggerFactory.getLogger(ForumCore.class);

    private final ThreadRepository threads;
    private final SubtreeMutationEngine mutations;
    private final ConfigResolver configResolver;
    private final ReadTrackingLedger ledger;
    private final MessageService messages;
    private final SettingsService settings;
    private final ForumCache cache;
    private final ForumCoreConfig config;

    @Inject
    public ForumCore(ThreadRepository threads, SubtreeMutationEngine mutations, ConfigResolver configResolver,
            ReadTrackingLedger ledger, MessageService messages, SettingsService settings, ForumCache cache,
            ForumCoreConfig config) {
        this.threads = threads;
        this.mutations = mutations;
        this.configResolver = configResolver;
        this.ledger = ledger;
        this.messages = messages;
        this.settings = settings;
        this.cache = cache;
        this.config = config;
    }

    /**
     * Creates the injector for the configured application mode and warms the
     * thread cache.
     */
    public static ForumCore start() {
        Injector injector = Guice.createInjector(new ForumModule());
        ForumCore core = injector.getInstance(ForumCore.class);
        core.warmup();
        return core;
    }

    public int warmup() {
        return threads.warmup(config.getWarmupThreads());
    }

    // -- Trees --

    public MessageTree buildTree(long threadId, VisibilityFilter filter, MessageOrdering ordering) {
        return threads.buildTree(threadId, filter, ordering);
    }

    /**
     * Tree as a given viewer sees it: sibling order from the viewer's
     * {@code sort_messages} option, deleted messages and drafts only with
     * {@code viewAll}.
     */
    public MessageTree buildTreeFor(long threadId, Long userId, boolean viewAll) {
        long forumId = threads.requireThread(threadId).forumId();
        MessageOrdering ordering = MessageOrdering.fromOption(
                configResolver.resolve("sort_messages", userId, forumId));
        return threads.buildTree(threadId, VisibilityFilter.forViewer(viewAll), ordering);
    }

    // -- Mutations --

    public MutationResult mutateSubtree(long anchorId, String operation, Map<String, String> params) {
        return mutations.mutateSubtree(anchorId, operation, params);
    }

    public MutationResult mutateSubtree(long anchorId, SubtreeOperation operation) {
        return mutations.mutateSubtree(anchorId, operation);
    }

    public int mergeTag(String oldName, String newName) {
        return mutations.mergeTag(oldName, newName);
    }

    // -- Configuration --

    public String resolveConfig(String name, Long userId, Long forumId) {
        return configResolver.resolve(name, userId, forumId);
    }

    // -- Read tracking --

    public List<ReadMarker> markRead(Long userId, Collection<Long> messageIds) {
        return ledger.markRead(userId, messageIds);
    }

    public int markUnread(Long userId, Collection<Long> messageIds) {
        return ledger.markUnread(userId, messageIds);
    }

    public UnreadCount countUnread(Long userId, Collection<Long> visibleForumIds) {
        return ledger.countUnread(userId, visibleForumIds);
    }

    // -- Services --

    public ThreadRepository threads() {
        return threads;
    }

    public SubtreeMutationEngine mutations() {
        return mutations;
    }

    public MessageService messages() {
        return messages;
    }

    public SettingsService settings() {
        return settings;
    }

    public ReadTrackingLedger ledger() {
        return ledger;
    }

    public ForumCache cache() {
        return cache;
    }

    /** Drops every cached entry; the next reads repopulate from the store. */
    public void resetCache() {
        LOG.info("Resetting forum cache ({} entries, {} hits, {} misses)",
                cache.size(), cache.hitCount(), cache.missCount());
        cache.clear();
    }
}
