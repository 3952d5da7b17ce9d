package de.bsommerfeld.forum.service;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.forum.core.cache.ConfigKey;
import de.bsommerfeld.forum.core.cache.ForumCache;
import de.bsommerfeld.forum.core.domain.ConfigOption;
import de.bsommerfeld.forum.core.domain.ConfigScope;
import de.bsommerfeld.forum.core.error.ValidationException;
import de.bsommerfeld.forum.db.RecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Write side of the configuration: stores option rows and drops the cached
 * settings of the written scope owner afterwards.
 */
@Singleton
public class SettingsService {

    private static final Logger LOG = LoggerFactory.getLogger(SettingsService.class);

    private final RecordStore store;
    private final ForumCache cache;

    @Inject
    public SettingsService(RecordStore store, ForumCache cache) {
        this.store = store;
        this.cache = cache;
    }

    /**
     * Upserts an option. An empty value is stored as-is and reads as "unset".
     */
    public void setOption(ConfigScope scope, Long ownerId, String name, String value) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("name", "option name must not be blank");
        }
        ConfigKey key = ConfigKey.of(scope, ownerId);
        store.saveOption(new ConfigOption(scope, key.ownerId(), name, value == null ? "" : value));
        cache.invalidate(key);
        LOG.debug("Option {} set on {}", name, key.render());
    }

    /** Deletes the row, letting more general scopes show through again. */
    public boolean removeOption(ConfigScope scope, Long ownerId, String name) {
        ConfigKey key = ConfigKey.of(scope, ownerId);
        boolean removed = store.deleteOption(scope, key.ownerId(), name);
        cache.invalidate(key);
        return removed;
    }
}
