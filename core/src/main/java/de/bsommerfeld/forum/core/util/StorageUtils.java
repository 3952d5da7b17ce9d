package de.bsommerfeld.forum.core.util;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

/**
 * Locates where the forum core keeps its SQLite file when no explicit
 * database URL is configured. Paths are returned absolute but are not
 * created.
 *
 * <p>
 * {@code FORUM_DATA_DIR} wins if set. Otherwise the platform convention
 * applies: {@code ~/Library/Application Support/forum-core} on macOS,
 * {@code %APPDATA%\forum-core} on Windows, {@code $XDG_DATA_HOME/forum-core}
 * (or {@code ~/.local/share/forum-core}) elsewhere.
 */
public final class StorageUtils {

    public static final String APP_NAME = "forum-core";
    public static final String DATABASE_FILE = "forum.db";

    private StorageUtils() {
    }

    public static Path getDataDir() {
        String override = System.getenv("FORUM_DATA_DIR");
        if (override != null && !override.isBlank()) {
            return Paths.get(override).toAbsolutePath();
        }

        String home = System.getProperty("user.home");
        String os = System.getProperty("os.name", "generic").toLowerCase(Locale.ENGLISH);
        if (os.contains("mac") || os.contains("darwin")) {
            return Paths.get(home, "Library", "Application Support", APP_NAME).toAbsolutePath();
        }
        if (os.contains("win")) {
            String appData = System.getenv("APPDATA");
            Path base = appData != null ? Paths.get(appData) : Paths.get(home, "AppData", "Roaming");
            return base.resolve(APP_NAME).toAbsolutePath();
        }
        String xdgData = System.getenv("XDG_DATA_HOME");
        Path base = xdgData != null && !xdgData.isEmpty() ? Paths.get(xdgData) : Paths.get(home, ".local", "share");
        return base.resolve(APP_NAME).toAbsolutePath();
    }

    public static Path getDefaultDatabaseFile() {
        return getDataDir().resolve(DATABASE_FILE);
    }
}
