package de.bsommerfeld.forum.service;

import com.google.inject.AbstractModule;
import de.bsommerfeld.forum.core.config.ApplicationMode;
import de.bsommerfeld.forum.core.config.ForumCoreConfig;
import de.bsommerfeld.forum.core.event.Broadcaster;
import de.bsommerfeld.forum.core.event.EventBusBroadcaster;
import de.bsommerfeld.forum.db.InMemoryRecordStore;
import de.bsommerfeld.forum.db.RecordStore;
import de.bsommerfeld.forum.db.SqlRecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Guice module wiring the forum core.
 */
public class ForumModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(ForumModule.class);

    private final ForumCoreConfig config;
    private final ApplicationMode mode;

    public ForumModule() {
        this(ForumCoreConfig.load(), ApplicationMode.get());
    }

    public ForumModule(ForumCoreConfig config, ApplicationMode mode) {
        this.config = config;
        this.mode = mode;
    }

    @Override
    protected void configure() {
        bind(ForumCoreConfig.class).toInstance(config);

        // --- MODE SWITCHING (PROD vs TEST) ---
        LOG.info("Application Mode initialized: {}", mode);
        if (mode == ApplicationMode.TEST) {
            // TEST MODE: seeded in-memory store, nothing is persisted
            bind(RecordStore.class).to(InMemoryRecordStore.class);
        } else {
            bind(RecordStore.class).to(SqlRecordStore.class);
        }

        bind(Broadcaster.class).to(EventBusBroadcaster.class);
    }
}
