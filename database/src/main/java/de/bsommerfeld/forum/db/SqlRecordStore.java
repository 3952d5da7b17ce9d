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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * SQLite-backed {@link RecordStore} for production use.
 *
 * <p>
 * All SQL lives in external {@code .sql} files loaded via {@link SqlLoader}.
 * The schema is applied from {@code schema.sql} on every start-up; every DDL
 * statement uses {@code IF NOT EXISTS} so it is safe to re-run.
 *
 * <h3>Connection strategy</h3>
 * A new {@link Connection} is opened per operation and closed right after.
 * SQLite serializes writes at the file level anyway.
 *
 * <h3>Transaction boundaries</h3>
 * Every multi-statement operation (message insert with tags, bulk patches,
 * tag renames, snapshot reads) runs in an explicit transaction with
 * rollback on failure. Bulk patches are single {@code UPDATE ... WHERE
 * message_id IN (SELECT value FROM json_each(?))} statements, one per patched
 * column, so the number of round trips does not grow with the subtree size.
 *
 * <h3>Errors</h3>
 * {@link SQLException}s are logged and rethrown as {@link StoreException};
 * nothing is masked.
 *
 * @see SqlLoader
 */
@Singleton
public class SqlRecordStore implements RecordStore {

    private static final Logger LOG = LoggerFactory.getLogger(SqlRecordStore.class);
    private static final String SQLITE_PREFIX = "jdbc:sqlite:";

    private final String dbUrl;

    @Inject
    public SqlRecordStore(ForumCoreConfig config) {
        this(config.getDatabaseUrl());
    }

    public SqlRecordStore(String dbUrl) {
        this.dbUrl = dbUrl;
        ensureParentDirectory(dbUrl);
        initialize();
    }

    Connection getConnection() throws SQLException {
        return DriverManager.getConnection(dbUrl);
    }

    private static void ensureParentDirectory(String url) {
        if (!url.startsWith(SQLITE_PREFIX) || url.contains(":memory:")) {
            return;
        }
        Path parent = Paths.get(url.substring(SQLITE_PREFIX.length())).toAbsolutePath().getParent();
        try {
            if (parent != null && !Files.exists(parent)) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new StoreException("Failed to create database directory " + parent, e);
        }
    }

    private void initialize() {
        LOG.info("Initializing database at {}", dbUrl);
        try (Connection conn = getConnection()) {
            applySchema(conn);
        } catch (SQLException e) {
            throw new StoreException("Database initialization failed", e);
        }
    }

    /**
     * Applies the DDL from {@code schema.sql}, one statement at a time, in a
     * single transaction.
     */
    private void applySchema(Connection conn) throws SQLException {
        String schemaSql;
        try (InputStream in = getClass().getClassLoader().getResourceAsStream("schema.sql")) {
            if (in == null) {
                throw new SQLException("schema.sql not found in classpath");
            }
            schemaSql = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SQLException("Failed to read schema.sql", e);
        }

        conn.setAutoCommit(false);
        try (Statement stmt = conn.createStatement()) {
            for (String sql : schemaSql.split(";\\s*(\\r?\\n|$)")) {
                if (!sql.trim().isEmpty()) {
                    stmt.execute(sql.trim());
                }
            }
            conn.commit();
            LOG.info("Database schema applied.");
        } catch (SQLException e) {
            conn.rollback();
            throw e;
        }
    }

    // =====================================================================
    // Threads
    // =====================================================================

    @Override
    public ForumThread getThread(long threadId) {
        try (Connection conn = getConnection()) {
            return selectThread(conn, threadId);
        } catch (SQLException e) {
            throw failure("Failed to load thread " + threadId, e);
        }
    }

    @Override
    public void saveThread(ForumThread thread) {
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("upsert-thread"))) {
            ps.setLong(1, thread.id());
            ps.setLong(2, thread.forumId());
            ps.setString(3, thread.slug());
            ps.setInt(4, thread.archived() ? 1 : 0);
            ps.setLong(5, thread.latestMessageUtc());
            ps.executeUpdate();
            LOG.debug("[DB] Saved thread {}", thread.id());
        } catch (SQLException e) {
            throw failure("Failed to save thread " + thread.id(), e);
        }
    }

    @Override
    public List<ForumThread> getRecentThreads(int limit) {
        List<ForumThread> result = new ArrayList<>();
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-recent-threads"))) {
            ps.setInt(1, limit);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    result.add(mapThread(rs));
                }
            }
        } catch (SQLException e) {
            throw failure("Failed to load recent threads", e);
        }
        return result;
    }

    /**
     * Thread row and message rows are read inside one transaction so the
     * snapshot never mixes two states of the thread.
     */
    @Override
    public ThreadSnapshot getSnapshot(long threadId) {
        try (Connection conn = getConnection()) {
            conn.setAutoCommit(false);
            try {
                ForumThread thread = selectThread(conn, threadId);
                if (thread == null) {
                    conn.commit();
                    return null;
                }
                List<Message> messages = selectMessagesForThread(conn, threadId);
                conn.commit();
                return new ThreadSnapshot(thread, messages);
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw failure("Failed to load snapshot of thread " + threadId, e);
        }
    }

    private ForumThread selectThread(Connection conn, long threadId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-thread"))) {
            ps.setLong(1, threadId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? mapThread(rs) : null;
            }
        }
    }

    // =====================================================================
    // Messages
    // =====================================================================

    @Override
    public Message getMessage(long messageId) {
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-message"))) {
            ps.setLong(1, messageId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return null;
                }
                return mapMessage(rs, selectTags(conn, messageId));
            }
        } catch (SQLException e) {
            throw failure("Failed to load message " + messageId, e);
        }
    }

    @Override
    public List<Message> getMessagesForThread(long threadId) {
        try (Connection conn = getConnection()) {
            return selectMessagesForThread(conn, threadId);
        } catch (SQLException e) {
            throw failure("Failed to load messages of thread " + threadId, e);
        }
    }

    private List<Message> selectMessagesForThread(Connection conn, long threadId) throws SQLException {
        Map<Long, List<String>> tags = new HashMap<>();
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-tags-for-thread"))) {
            ps.setLong(1, threadId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    tags.computeIfAbsent(rs.getLong("message_id"), k -> new ArrayList<>())
                            .add(rs.getString("tag_name"));
                }
            }
        }

        List<Message> result = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-messages-for-thread"))) {
            ps.setLong(1, threadId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    long id = rs.getLong("message_id");
                    result.add(mapMessage(rs, tags.getOrDefault(id, List.of())));
                }
            }
        }
        return result;
    }

    private List<String> selectTags(Connection conn, long messageId) throws SQLException {
        List<String> tags = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-tags-for-message"))) {
            ps.setLong(1, messageId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    tags.add(rs.getString("tag_name"));
                }
            }
        }
        return tags;
    }

    /**
     * Inserts message row, tags and the thread activity update in one
     * transaction: metadata → tags → thread.
     */
    @Override
    public Message insertMessage(Message message) {
        try (Connection conn = getConnection()) {
            conn.setAutoCommit(false);
            try {
                long id = insertMessageRow(conn, message);
                replaceTags(conn, id, message.tags());
                try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("update-thread-activity"))) {
                    ps.setLong(1, message.createdUtc());
                    ps.setLong(2, message.threadId());
                    ps.executeUpdate();
                }
                conn.commit();
                LOG.debug("[DB] Inserted message {} into thread {}", id, message.threadId());
                return message.withId(id);
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw failure("Failed to insert message into thread " + message.threadId(), e);
        }
    }

    private long insertMessageRow(Connection conn, Message m) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("insert-message"))) {
            if (m.id() > 0) {
                ps.setLong(1, m.id());
            } else {
                ps.setNull(1, Types.INTEGER);
            }
            ps.setLong(2, m.threadId());
            ps.setLong(3, m.forumId());
            setNullableLong(ps, 4, m.parentId());
            setNullableLong(ps, 5, m.userId());
            ps.setString(6, m.author());
            ps.setString(7, m.subject());
            ps.setString(8, m.content());
            ps.setInt(9, m.deleted() ? 1 : 0);
            ps.setInt(10, m.draft() ? 1 : 0);
            ps.setString(11, JsonCodec.writeFlags(m.flags()));
            ps.setInt(12, m.upvotes());
            ps.setInt(13, m.downvotes());
            ps.setLong(14, m.createdUtc());
            ps.setLong(15, m.updatedUtc());
            ps.executeUpdate();
        }
        try (Statement stmt = conn.createStatement();
                ResultSet rs = stmt.executeQuery("SELECT last_insert_rowid()")) {
            if (!rs.next()) {
                throw new SQLException("No id generated for inserted message");
            }
            return rs.getLong(1);
        }
    }

    @Override
    public boolean editMessage(long messageId, String subject, String content, long updatedUtc) {
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("edit-message"))) {
            ps.setString(1, subject);
            ps.setString(2, content);
            ps.setLong(3, updatedUtc);
            ps.setLong(4, messageId);
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw failure("Failed to edit message " + messageId, e);
        }
    }

    private void replaceTags(Connection conn, long messageId, List<String> tags) throws SQLException {
        try (PreparedStatement del = conn.prepareStatement(SqlLoader.load("delete-message-tags"))) {
            del.setLong(1, messageId);
            del.executeUpdate();
        }
        if (tags.isEmpty()) {
            return;
        }
        try (PreparedStatement ins = conn.prepareStatement(SqlLoader.load("insert-message-tag"))) {
            int position = 0;
            for (String tag : tags) {
                ins.setLong(1, messageId);
                ins.setString(2, tag);
                ins.setInt(3, position++);
                ins.addBatch();
            }
            ins.executeBatch();
        }
    }

    // =====================================================================
    // Bulk updates
    // =====================================================================

    @Override
    public int updateAll(List<MessageUpdate> updates) {
        long now = System.currentTimeMillis() / 1000;
        try (Connection conn = getConnection()) {
            conn.setAutoCommit(false);
            try {
                int matched = -1;
                for (MessageUpdate update : updates) {
                    if (update.selector().isEmpty() || update.patch().isEmpty()) {
                        continue;
                    }
                    if (matched < 0) {
                        matched = countExisting(conn, update.selector());
                        if (matched == 0) {
                            // the anchoring update hit nothing, so none of the follow-ups apply
                            conn.rollback();
                            return 0;
                        }
                    }
                    applyPatch(conn, update.selector(), update.patch(), now);
                }
                conn.commit();
                return Math.max(matched, 0);
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw failure("Bulk message update failed", e);
        }
    }

    /** Runs one statement per patched column against the whole selection. */
    private void applyPatch(Connection conn, MessageSelector selector, MessagePatch patch, long now)
            throws SQLException {
        String ids = JsonCodec.writeIds(selector.messageIds());

        if (patch.deleted() != null) {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("patch-messages-deleted"))) {
                ps.setInt(1, patch.deleted() ? 1 : 0);
                ps.setString(2, ids);
                ps.executeUpdate();
            }
        }
        for (String key : patch.removeFlags()) {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("patch-messages-remove-flag"))) {
                ps.setString(1, JsonCodec.flagPath(key));
                ps.setString(2, ids);
                ps.executeUpdate();
            }
        }
        for (Map.Entry<String, String> flag : patch.setFlags().entrySet()) {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("patch-messages-set-flag"))) {
                ps.setString(1, JsonCodec.flagPath(flag.getKey()));
                ps.setString(2, flag.getValue());
                ps.setString(3, ids);
                ps.executeUpdate();
            }
        }
        if (patch.upvoteDelta() != 0 || patch.downvoteDelta() != 0) {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("patch-messages-votes"))) {
                ps.setInt(1, patch.upvoteDelta());
                ps.setInt(2, patch.downvoteDelta());
                ps.setString(3, ids);
                ps.executeUpdate();
            }
        }
        if (patch.tags() != null) {
            replaceSelectedTags(conn, ids, patch.tags());
        }
        if (patch.touchesContent()) {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("patch-messages-touch"))) {
                ps.setLong(1, now);
                ps.setString(2, ids);
                ps.executeUpdate();
            }
        }
    }

    /** Replaces the tags of every selected message that exists, one batched insert per tag. */
    private void replaceSelectedTags(Connection conn, String ids, List<String> tags) throws SQLException {
        try (PreparedStatement del = conn.prepareStatement(SqlLoader.load("delete-messages-tags"))) {
            del.setString(1, ids);
            del.executeUpdate();
        }
        if (tags.isEmpty()) {
            return;
        }
        try (PreparedStatement ins = conn.prepareStatement(SqlLoader.load("insert-messages-tag"))) {
            int position = 0;
            for (String tag : tags) {
                ins.setString(1, tag);
                ins.setInt(2, position++);
                ins.setString(3, ids);
                ins.addBatch();
            }
            ins.executeBatch();
        }
    }

    private int countExisting(Connection conn, MessageSelector selector) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("count-messages-by-id"))) {
            ps.setString(1, JsonCodec.writeIds(selector.messageIds()));
            try (ResultSet rs = ps.executeQuery()) {
                int matched = rs.next() ? rs.getInt(1) : 0;
                LOG.debug("[DB] Patching {} message(s)", matched);
                return matched;
            }
        }
    }

    @Override
    public int renameTag(String oldName, String newName) {
        try (Connection conn = getConnection()) {
            conn.setAutoCommit(false);
            try {
                int moved;
                int dropped;
                try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("rename-tag"))) {
                    ps.setString(1, newName);
                    ps.setString(2, oldName);
                    moved = ps.executeUpdate();
                }
                try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("delete-tag"))) {
                    ps.setString(1, oldName);
                    dropped = ps.executeUpdate();
                }
                conn.commit();
                LOG.info("[DB] Renamed tag '{}' to '{}' ({} moved, {} merged)", oldName, newName, moved, dropped);
                return moved + dropped;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw failure("Failed to rename tag " + oldName, e);
        }
    }

    // =====================================================================
    // Read tracking
    // =====================================================================

    @Override
    public List<ReadMarker> insertReadMarkers(long userId, Collection<Long> messageIds) {
        List<ReadMarker> inserted = new ArrayList<>();
        if (messageIds.isEmpty()) {
            return inserted;
        }
        try (Connection conn = getConnection()) {
            conn.setAutoCommit(false);
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("insert-read-marker"))) {
                for (Long messageId : new LinkedHashSet<>(messageIds)) {
                    ps.setLong(1, userId);
                    ps.setLong(2, messageId);
                    if (ps.executeUpdate() > 0) {
                        inserted.add(new ReadMarker(userId, messageId));
                    }
                }
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw failure("Failed to mark messages read for user " + userId, e);
        }
        return inserted;
    }

    @Override
    public int deleteReadMarkers(long userId, Collection<Long> messageIds) {
        if (messageIds.isEmpty()) {
            return 0;
        }
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("delete-read-markers"))) {
            ps.setLong(1, userId);
            ps.setString(2, JsonCodec.writeIds(messageIds));
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw failure("Failed to mark messages unread for user " + userId, e);
        }
    }

    @Override
    public Set<Long> getReadMessageIds(long userId, Collection<Long> messageIds) {
        Set<Long> result = new LinkedHashSet<>();
        if (messageIds.isEmpty()) {
            return result;
        }
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-read-message-ids"))) {
            ps.setLong(1, userId);
            ps.setString(2, JsonCodec.writeIds(messageIds));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    result.add(rs.getLong(1));
                }
            }
        } catch (SQLException e) {
            throw failure("Failed to load read markers of user " + userId, e);
        }
        return result;
    }

    @Override
    public boolean hideThread(long userId, long threadId) {
        return executeUserThread("insert-invisible-thread", userId, threadId) > 0;
    }

    @Override
    public boolean unhideThread(long userId, long threadId) {
        return executeUserThread("delete-invisible-thread", userId, threadId) > 0;
    }

    private int executeUserThread(String statement, long userId, long threadId) {
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load(statement))) {
            ps.setLong(1, userId);
            ps.setLong(2, threadId);
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw failure("Failed to run " + statement + " for user " + userId, e);
        }
    }

    /**
     * Thread and message counts come from the same aggregate row, so they can
     * never disagree.
     */
    @Override
    public UnreadCount countUnread(long userId, Collection<Long> forumIds) {
        if (forumIds.isEmpty()) {
            return UnreadCount.NONE;
        }
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("count-unread"))) {
            ps.setLong(1, userId);
            ps.setLong(2, userId);
            ps.setString(3, JsonCodec.writeIds(forumIds));
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return UnreadCount.NONE;
                }
                return new UnreadCount(rs.getLong("unread_threads"), rs.getLong("unread_messages"));
            }
        } catch (SQLException e) {
            throw failure("Failed to count unread messages of user " + userId, e);
        }
    }

    // =====================================================================
    // Settings
    // =====================================================================

    @Override
    public ScopeSettings getSettings(ConfigScope scope, long ownerId) {
        Map<String, String> options = new LinkedHashMap<>();
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-settings"))) {
            ps.setString(1, scope.name());
            ps.setLong(2, ownerId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    options.put(rs.getString("name"), rs.getString("value"));
                }
            }
        } catch (SQLException e) {
            throw failure("Failed to load " + scope + " settings of " + ownerId, e);
        }
        return new ScopeSettings(scope, ownerId, options);
    }

    @Override
    public void saveOption(ConfigOption option) {
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("upsert-setting"))) {
            ps.setString(1, option.scope().name());
            ps.setLong(2, option.scope().ownerKey(option.ownerId()));
            ps.setString(3, option.name());
            ps.setString(4, option.value());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw failure("Failed to save option " + option.name(), e);
        }
    }

    @Override
    public boolean deleteOption(ConfigScope scope, long ownerId, String name) {
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("delete-setting"))) {
            ps.setString(1, scope.name());
            ps.setLong(2, ownerId);
            ps.setString(3, name);
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw failure("Failed to delete option " + name, e);
        }
    }

    // =====================================================================
    // ResultSet → Domain Mapping
    // =====================================================================

    private ForumThread mapThread(ResultSet rs) throws SQLException {
        return new ForumThread(
                rs.getLong("thread_id"), rs.getLong("forum_id"),
                rs.getString("slug"), rs.getInt("archived") != 0,
                rs.getLong("latest_message_utc"));
    }

    private Message mapMessage(ResultSet rs, List<String> tags) throws SQLException {
        return new Message(
                rs.getLong("message_id"), rs.getLong("thread_id"), rs.getLong("forum_id"),
                nullableLong(rs, "parent_id"), nullableLong(rs, "user_id"),
                rs.getString("author"), rs.getString("subject"), rs.getString("content"),
                rs.getInt("deleted") != 0, rs.getInt("draft") != 0,
                JsonCodec.readFlags(rs.getString("flags")), tags,
                rs.getInt("upvotes"), rs.getInt("downvotes"),
                rs.getLong("created_utc"), rs.getLong("updated_utc"));
    }

    private static Long nullableLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }

    private static void setNullableLong(PreparedStatement ps, int index, Long value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.INTEGER);
        } else {
            ps.setLong(index, value);
        }
    }

    private static StoreException failure(String message, SQLException e) {
        LOG.error(message, e);
        return new StoreException(message, e);
    }
}
