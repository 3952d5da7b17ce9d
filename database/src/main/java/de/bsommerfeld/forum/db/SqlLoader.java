package de.bsommerfeld.forum.db;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads SQL statements from classpath resources under {@code sql/} and keeps
 * them for the lifetime of the JVM.
 *
 * <p>
 * File names follow {@code sql/<operation>-<entity>.sql}, e.g.
 * {@code patch-messages-set-flag.sql}. Bulk statements take their id lists as
 * one JSON array parameter expanded by {@code json_each(?)}, so every file
 * holds exactly one static statement.
 *
 * @see SqlRecordStore
 */
public final class SqlLoader {

    private static final String PREFIX = "sql/";
    private static final String SUFFIX = ".sql";

    private static final ConcurrentHashMap<String, String> STATEMENTS = new ConcurrentHashMap<>();

    private SqlLoader() {
    }

    /**
     * Returns the trimmed statement from {@code sql/<name>.sql}.
     *
     * @throws IllegalStateException if the resource is missing or unreadable
     */
    public static String load(String name) {
        return STATEMENTS.computeIfAbsent(name, SqlLoader::read);
    }

    private static String read(String name) {
        String path = PREFIX + name + SUFFIX;
        try (InputStream in = SqlLoader.class.getClassLoader().getResourceAsStream(path)) {
            if (in == null) {
                throw new IllegalStateException("SQL resource not found: " + path);
            }
            String sql = new String(in.readAllBytes(), StandardCharsets.UTF_8).trim();
            if (sql.isEmpty()) {
                throw new IllegalStateException("SQL resource is empty: " + path);
            }
            return sql;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read SQL resource: " + path, e);
        }
    }
}
