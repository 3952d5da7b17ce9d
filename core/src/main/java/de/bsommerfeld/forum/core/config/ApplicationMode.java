package de.bsommerfeld.forum.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Running mode of the forum core. Controls which record store gets bound:
 * SQLite in {@link #PROD}, a seeded in-memory store in {@link #TEST}.
 */
public enum ApplicationMode {

    PROD,
    TEST;

    private static final Logger LOG = LoggerFactory.getLogger(ApplicationMode.class);

    /**
     * Resolves the current mode from the system property {@code forum.mode}
     * or the environment variable {@code FORUM_MODE}. Defaults to PROD if not
     * set or invalid.
     */
    public static ApplicationMode get() {
        String mode = System.getProperty("forum.mode");
        if (mode == null || mode.isEmpty()) {
            mode = System.getenv("FORUM_MODE");
        }

        if (mode == null || mode.isEmpty()) {
            return PROD;
        }

        try {
            return ApplicationMode.valueOf(mode.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            LOG.warn("Unknown application mode '{}'. Defaulting to PROD.", mode);
            return PROD;
        }
    }

    public boolean isTest() {
        return this == TEST;
    }
}
