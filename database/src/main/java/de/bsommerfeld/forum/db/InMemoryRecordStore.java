package de.bsommerfeld.forum.db;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.forum.core.config.ForumCoreConfig;
import de.bsommerfeld.forum.core.domain.ConfigOption;
import de.bsommerfeld.forum.core.domain.ConfigScope;
import de.bsommerfeld.forum.core.domain.ForumThread;
import de.bsommerfeld.forum.core.domain.Message;
import de.bsommerfeld.forum.core.domain.ReadMarker;
import de.bsommerfeld.forum.core.domain.ScopeSettings;
import de.bsommerfeld.forum.core.domain.ThreadSnapshot;
import de.bsommerfeld.forum.core.domain.UnreadCount;
import de.bsommerfeld.forum.core.error.StoreException;
import de.bsommerfeld.forum.core.util.ForumDataGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * In-memory {@link RecordStore} for TEST mode and unit tests. No disk I/O, no
 * SQLite, no schema.
 *
 * <h3>Startup behavior</h3>
 * The Guice constructor pre-seeds one forum with generated threads (see
 * {@link ForumDataGenerator}) so a TEST-mode process has data to serve right
 * away. The no-arg constructor starts empty and is what tests use.
 *
 * <h3>Consistency</h3>
 * Every method is {@code synchronized}, so readers never observe half of a
 * bulk update. {@link #updateAll} stages all changed rows first and publishes
 * them only when every update was applied.
 */
@Singleton
public class InMemoryRecordStore implements RecordStore {

    private static final Logger LOG = LoggerFactory.getLogger(InMemoryRecordStore.class);

    static final long SAMPLE_FORUM_ID = 1L;
    private static final long SAMPLE_SEED = 42L;

    private final Map<Long, ForumThread> threads = new TreeMap<>();
    private final Map<Long, Message> messages = new TreeMap<>();
    private final Map<Long, Set<Long>> readMarkers = new HashMap<>();
    private final Map<Long, Set<Long>> hiddenThreads = new HashMap<>();
    private final Map<ConfigScope, Map<Long, Map<String, String>>> settings = new HashMap<>();
    private long nextMessageId = 1;

    public InMemoryRecordStore() {
    }

    @Inject
    public InMemoryRecordStore(ForumCoreConfig config) {
        LOG.warn("#######################################################");
        LOG.warn("#  TEST MODE ENABLED: Database persistence is DISABLED #");
        LOG.warn("#######################################################");

        List<ThreadSnapshot> sample = new ForumDataGenerator(SAMPLE_SEED).generateForum(
                SAMPLE_FORUM_ID, 1, 1, config.getSampleThreads(), config.getSampleMessagesPerThread());
        sample.forEach(this::seed);
        LOG.info("Seeded {} sample threads with {} messages", threads.size(), messages.size());
    }

    /** Stores a generated thread as-is, ids included. */
    public synchronized void seed(ThreadSnapshot snapshot) {
        threads.put(snapshot.threadId(), snapshot.thread());
        for (Message m : snapshot.messages()) {
            messages.put(m.id(), m);
            nextMessageId = Math.max(nextMessageId, m.id() + 1);
        }
    }

    // -- Threads --

    @Override
    public synchronized ForumThread getThread(long threadId) {
        return threads.get(threadId);
    }

    @Override
    public synchronized void saveThread(ForumThread thread) {
        ForumThread existing = threads.get(thread.id());
        threads.put(thread.id(), existing == null ? thread
                : thread.withLatestMessageUtc(existing.latestMessageUtc()));
    }

    @Override
    public synchronized List<ForumThread> getRecentThreads(int limit) {
        return threads.values().stream()
                .sorted(Comparator.comparingLong(ForumThread::latestMessageUtc)
                        .thenComparingLong(ForumThread::id).reversed())
                .limit(limit)
                .toList();
    }

    @Override
    public synchronized ThreadSnapshot getSnapshot(long threadId) {
        ForumThread thread = threads.get(threadId);
        if (thread == null) {
            return null;
        }
        return new ThreadSnapshot(thread, getMessagesForThread(threadId));
    }

    // -- Messages --

    @Override
    public synchronized Message getMessage(long messageId) {
        return messages.get(messageId);
    }

    @Override
    public synchronized List<Message> getMessagesForThread(long threadId) {
        List<Message> result = new ArrayList<>();
        for (Message m : messages.values()) {
            if (m.threadId() == threadId) {
                result.add(m);
            }
        }
        return result;
    }

    @Override
    public synchronized Message insertMessage(Message message) {
        long id = message.id() > 0 ? message.id() : nextMessageId;
        if (messages.containsKey(id)) {
            throw new StoreException("Message " + id + " already exists");
        }
        nextMessageId = Math.max(nextMessageId, id + 1);

        Message stored = message.withId(id);
        messages.put(id, stored);
        ForumThread thread = threads.get(message.threadId());
        if (thread != null) {
            threads.put(thread.id(), thread.withLatestMessageUtc(message.createdUtc()));
        }
        return stored;
    }

    @Override
    public synchronized boolean editMessage(long messageId, String subject, String content, long updatedUtc) {
        Message existing = messages.get(messageId);
        if (existing == null) {
            return false;
        }
        messages.put(messageId, existing.withContent(subject, content, updatedUtc));
        return true;
    }

    @Override
    public synchronized int updateAll(List<MessageUpdate> updates) {
        long now = System.currentTimeMillis() / 1000;
        Map<Long, Message> staged = new LinkedHashMap<>();
        int matched = -1;
        for (MessageUpdate update : updates) {
            if (update.selector().isEmpty() || update.patch().isEmpty()) {
                continue;
            }
            int count = 0;
            for (Long id : update.selector().messageIds()) {
                Message current = staged.containsKey(id) ? staged.get(id) : messages.get(id);
                if (current == null) {
                    continue;
                }
                staged.put(id, update.patch().applyTo(current, now));
                count++;
            }
            if (matched < 0) {
                matched = count;
                if (matched == 0) {
                    return 0;
                }
            }
        }
        messages.putAll(staged);
        return Math.max(matched, 0);
    }

    @Override
    public synchronized int renameTag(String oldName, String newName) {
        int affected = 0;
        for (Message m : new ArrayList<>(messages.values())) {
            if (!m.tags().contains(oldName)) {
                continue;
            }
            Set<String> tags = new LinkedHashSet<>();
            for (String tag : m.tags()) {
                tags.add(tag.equals(oldName) ? newName : tag);
            }
            messages.put(m.id(), m.withTags(new ArrayList<>(tags), m.updatedUtc()));
            affected++;
        }
        return affected;
    }

    // -- Read tracking --

    @Override
    public synchronized List<ReadMarker> insertReadMarkers(long userId, Collection<Long> messageIds) {
        Set<Long> read = readMarkers.computeIfAbsent(userId, k -> new HashSet<>());
        List<ReadMarker> inserted = new ArrayList<>();
        for (Long id : new LinkedHashSet<>(messageIds)) {
            if (read.add(id)) {
                inserted.add(new ReadMarker(userId, id));
            }
        }
        return inserted;
    }

    @Override
    public synchronized int deleteReadMarkers(long userId, Collection<Long> messageIds) {
        Set<Long> read = readMarkers.get(userId);
        if (read == null) {
            return 0;
        }
        int removed = 0;
        for (Long id : new HashSet<>(messageIds)) {
            if (read.remove(id)) {
                removed++;
            }
        }
        return removed;
    }

    @Override
    public synchronized Set<Long> getReadMessageIds(long userId, Collection<Long> messageIds) {
        Set<Long> read = readMarkers.getOrDefault(userId, Set.of());
        Set<Long> result = new LinkedHashSet<>();
        for (Long id : messageIds) {
            if (read.contains(id)) {
                result.add(id);
            }
        }
        return result;
    }

    @Override
    public synchronized boolean hideThread(long userId, long threadId) {
        return hiddenThreads.computeIfAbsent(userId, k -> new HashSet<>()).add(threadId);
    }

    @Override
    public synchronized boolean unhideThread(long userId, long threadId) {
        Set<Long> hidden = hiddenThreads.get(userId);
        return hidden != null && hidden.remove(threadId);
    }

    @Override
    public synchronized UnreadCount countUnread(long userId, Collection<Long> forumIds) {
        Set<Long> forums = new HashSet<>(forumIds);
        Set<Long> read = readMarkers.getOrDefault(userId, Set.of());
        Set<Long> hidden = hiddenThreads.getOrDefault(userId, Set.of());
        Set<Long> unreadThreads = new HashSet<>();
        long unreadMessages = 0;
        for (Message m : messages.values()) {
            ForumThread thread = threads.get(m.threadId());
            if (thread == null || thread.archived() || hidden.contains(thread.id())) {
                continue;
            }
            if (m.deleted() || m.draft() || !forums.contains(m.forumId()) || read.contains(m.id())) {
                continue;
            }
            unreadThreads.add(m.threadId());
            unreadMessages++;
        }
        return new UnreadCount(unreadThreads.size(), unreadMessages);
    }

    // -- Settings --

    @Override
    public synchronized ScopeSettings getSettings(ConfigScope scope, long ownerId) {
        Map<String, String> options = settings.getOrDefault(scope, Map.of()).get(ownerId);
        return options == null ? ScopeSettings.empty(scope, ownerId) : new ScopeSettings(scope, ownerId, options);
    }

    @Override
    public synchronized void saveOption(ConfigOption option) {
        long owner = option.scope().ownerKey(option.ownerId());
        settings.computeIfAbsent(option.scope(), k -> new HashMap<>())
                .computeIfAbsent(owner, k -> new TreeMap<>())
                .put(option.name(), option.value());
    }

    @Override
    public synchronized boolean deleteOption(ConfigScope scope, long ownerId, String name) {
        Map<String, String> options = settings.getOrDefault(scope, Map.of()).get(ownerId);
        if (options == null || !options.containsKey(name)) {
            return false;
        }
        options.remove(name);
        return true;
    }
}
