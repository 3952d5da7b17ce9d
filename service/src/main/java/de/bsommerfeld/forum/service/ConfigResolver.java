package de.bsommerfeld.forum.service;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.forum.core.cache.ConfigKey;
import de.bsommerfeld.forum.core.cache.ForumCache;
import de.bsommerfeld.forum.core.config.ConfigDefaults;
import de.bsommerfeld.forum.core.domain.ConfigScope;
import de.bsommerfeld.forum.core.domain.ScopeSettings;
import de.bsommerfeld.forum.db.RecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Answers "effective value of option X" by cascading user → forum → global →
 * {@link ConfigDefaults}.
 *
 * <p>
 * A blank stored value counts as absent: it never shadows a non-blank value
 * of a more general scope. The resolver normalizes this in exactly one place,
 * {@link #present}, and compares raw strings only; type coercion happens in
 * {@link #resolveInt} / {@link #resolveFlag} after the cascade.
 *
 * <p>
 * Each scope owner's rows are cached as one {@link ScopeSettings} entry, so a
 * resolution costs at most three cache lookups and at most one store query
 * per scope until that scope's key is invalidated. The resolver never
 * invalidates anything itself; see {@link SettingsService}.
 */
@Singleton
public class ConfigResolver {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigResolver.class);

    private final RecordStore store;
    private final ForumCache cache;

    @Inject
    public ConfigResolver(RecordStore store, ForumCache cache) {
        this.store = store;
        this.cache = cache;
    }

    /**
     * @param name    option name
     * @param userId  user scope, {@code null} to skip
     * @param forumId forum scope, {@code null} to skip
     * @return the effective raw value, {@code null} if even the default is nil
     */
    public String resolve(String name, Long userId, Long forumId) {
        if (userId != null) {
            String value = present(settings(ConfigKey.of(ConfigScope.USER, userId)).raw(name));
            if (value != null) {
                return value;
            }
        }
        if (forumId != null) {
            String value = present(settings(ConfigKey.of(ConfigScope.FORUM, forumId)).raw(name));
            if (value != null) {
                return value;
            }
        }
        String global = present(settings(ConfigKey.global()).raw(name));
        return global != null ? global : ConfigDefaults.get(name);
    }

    /**
     * Resolves and parses an integer option. Falls back to the default when
     * the effective value does not parse.
     */
    public int resolveInt(String name, Long userId, Long forumId, int fallback) {
        String value = resolve(name, userId, forumId);
        if (value == null) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            LOG.warn("Option {} has non-numeric value '{}', using {}", name, value, fallback);
            return fallback;
        }
    }

    /** {@code yes} / {@code no} options. Anything but {@code yes} is false. */
    public boolean resolveFlag(String name, Long userId, Long forumId) {
        return "yes".equals(resolve(name, userId, forumId));
    }

    private ScopeSettings settings(ConfigKey key) {
        return cache.fetch(key, () -> store.getSettings(key.scope(), key.ownerId()));
    }

    private static String present(String raw) {
        return raw == null || raw.isEmpty() ? null : raw;
    }
}
