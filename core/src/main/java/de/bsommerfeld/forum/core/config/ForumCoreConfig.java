package de.bsommerfeld.forum.core.config;

import de.bsommerfeld.forum.core.util.StorageUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Runtime settings of the forum core process.
 *
 * <p>
 * Loaded from the optional classpath resource {@code forum-core.properties};
 * every key can be overridden with a JVM system property of the same name.
 * Unset keys keep the defaults declared on the fields below.
 */
public class ForumCoreConfig {

    private static final Logger LOG = LoggerFactory.getLogger(ForumCoreConfig.class);

    static final String RESOURCE = "forum-core.properties";
    static final String KEY_DATABASE_URL = "forum.database.url";
    static final String KEY_SAMPLE_THREADS = "forum.sample.threads";
    static final String KEY_SAMPLE_MESSAGES = "forum.sample.messages-per-thread";
    static final String KEY_WARMUP_THREADS = "forum.cache.warmup-threads";

    /** JDBC URL of the SQLite database; blank means the OS app-data dir. */
    private String databaseUrl = "";

    /** Threads generated for the in-memory store in TEST mode. */
    private int sampleThreads = 10;

    /** Messages generated per sample thread in TEST mode. */
    private int sampleMessagesPerThread = 20;

    /** Most recently active threads preloaded into the cache on start-up. */
    private int warmupThreads = 50;

    public static ForumCoreConfig load() {
        Properties properties = new Properties();
        try (InputStream in = ForumCoreConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                properties.load(in);
                LOG.info("Loaded configuration from classpath:{}", RESOURCE);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read " + RESOURCE, e);
        }
        return from(properties);
    }

    /**
     * Builds a config from {@code properties}, letting system properties win.
     */
    public static ForumCoreConfig from(Properties properties) {
        ForumCoreConfig config = new ForumCoreConfig();
        config.databaseUrl = lookup(properties, KEY_DATABASE_URL, config.databaseUrl);
        config.sampleThreads = lookupInt(properties, KEY_SAMPLE_THREADS, config.sampleThreads);
        config.sampleMessagesPerThread = lookupInt(properties, KEY_SAMPLE_MESSAGES,
                config.sampleMessagesPerThread);
        config.warmupThreads = lookupInt(properties, KEY_WARMUP_THREADS, config.warmupThreads);
        return config;
    }

    private static String lookup(Properties properties, String key, String fallback) {
        String value = System.getProperty(key);
        if (value == null || value.isBlank()) {
            value = properties.getProperty(key);
        }
        return value == null || value.isBlank() ? fallback : value.trim();
    }

    private static int lookupInt(Properties properties, String key, int fallback) {
        String value = lookup(properties, key, null);
        if (value == null) {
            return fallback;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            LOG.warn("Ignoring non-numeric value '{}' for {}", value, key);
            return fallback;
        }
    }

    /**
     * Configured JDBC URL, or a SQLite file in the platform app-data
     * directory when none is configured.
     */
    public String getDatabaseUrl() {
        if (databaseUrl == null || databaseUrl.isBlank()) {
            return "jdbc:sqlite:" + StorageUtils.getDefaultDatabaseFile();
        }
        return databaseUrl;
    }

    public void setDatabaseUrl(String databaseUrl) {
        this.databaseUrl = databaseUrl;
    }

    public int getSampleThreads() {
        return sampleThreads;
    }

    public void setSampleThreads(int sampleThreads) {
        this.sampleThreads = sampleThreads;
    }

    public int getSampleMessagesPerThread() {
        return sampleMessagesPerThread;
    }

    public void setSampleMessagesPerThread(int sampleMessagesPerThread) {
        this.sampleMessagesPerThread = sampleMessagesPerThread;
    }

    public int getWarmupThreads() {
        return warmupThreads;
    }

    public void setWarmupThreads(int warmupThreads) {
        this.warmupThreads = warmupThreads;
    }
}
