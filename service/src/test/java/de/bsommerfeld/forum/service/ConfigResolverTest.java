package de.bsommerfeld.forum.service;

import de.bsommerfeld.forum.core.cache.ConfigKey;
import de.bsommerfeld.forum.core.cache.ForumCache;
import de.bsommerfeld.forum.core.domain.ConfigScope;
import de.bsommerfeld.forum.core.domain.ScopeSettings;
import de.bsommerfeld.forum.core.error.ValidationException;
import de.bsommerfeld.forum.db.InMemoryRecordStore;
import de.bsommerfeld.forum.db.RecordStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ConfigResolverTest {

    private InMemoryRecordStore store;
    private ForumCache cache;
    private ConfigResolver resolver;
    private SettingsService settings;

    @BeforeEach
    void setUp() {
        store = new InMemoryRecordStore();
        cache = new ForumCache();
        resolver = new ConfigResolver(store, cache);
        settings = new SettingsService(store, cache);
    }

    @Test
    void resolve_shouldTreatEmptyValueAsAbsent() {
        settings.setOption(ConfigScope.GLOBAL, null, "greeting", "A");
        settings.setOption(ConfigScope.USER, 1L, "greeting", "");

        assertEquals("A", resolver.resolve("greeting", 1L, 7L));
    }

    @Test
    void resolve_shouldPreferMostSpecificScope() {
        settings.setOption(ConfigScope.GLOBAL, null, "greeting", "A");
        settings.setOption(ConfigScope.FORUM, 7L, "greeting", "B");
        settings.setOption(ConfigScope.USER, 1L, "greeting", "C");

        assertEquals("C", resolver.resolve("greeting", 1L, 7L));
        assertEquals("B", resolver.resolve("greeting", 2L, 7L));
        assertEquals("A", resolver.resolve("greeting", 3L, 8L));

        assertTrue(settings.removeOption(ConfigScope.USER, 1L, "greeting"));
        assertEquals("B", resolver.resolve("greeting", 1L, 7L));
    }

    @Test
    void resolve_shouldSkipScopesWithoutOwner() {
        settings.setOption(ConfigScope.FORUM, 7L, "autorefresh", "5");
        settings.setOption(ConfigScope.USER, 1L, "autorefresh", "9");

        assertEquals("0", resolver.resolve("autorefresh", null, null));
        assertEquals("5", resolver.resolve("autorefresh", null, 7L));
        assertEquals("9", resolver.resolve("autorefresh", 1L, null));
    }

    @Test
    void resolve_shouldFallBackToDefaults() {
        assertEquals("50", resolver.resolve("pagination", 1L, 7L));
        assertNull(resolver.resolve("signature", 1L, 7L));
        assertNull(resolver.resolve("no_such_option", 1L, 7L));
    }

    @Test
    void resolve_shouldLetEmptyGlobalFallThroughToDefault() {
        settings.setOption(ConfigScope.GLOBAL, null, "pagination", "");

        assertEquals("50", resolver.resolve("pagination", null, null));
    }

    @Test
    void resolveInt_shouldParseOrFallBack() {
        settings.setOption(ConfigScope.FORUM, 7L, "max_tags_per_message", " 5 ");
        settings.setOption(ConfigScope.FORUM, 8L, "max_tags_per_message", "many");

        assertEquals(5, resolver.resolveInt("max_tags_per_message", null, 7L, 3));
        assertEquals(3, resolver.resolveInt("max_tags_per_message", null, 8L, 3));
        assertEquals(42, resolver.resolveInt("no_such_option", null, 8L, 42));
    }

    @Test
    void resolveFlag_shouldOnlyAcceptYes() {
        settings.setOption(ConfigScope.USER, 1L, "quote_signature", "yes");
        settings.setOption(ConfigScope.USER, 2L, "quote_signature", "YES");

        assertTrue(resolver.resolveFlag("quote_signature", 1L, null));
        assertFalse(resolver.resolveFlag("quote_signature", 2L, null));
        assertTrue(resolver.resolveFlag("editing_enabled", null, null));
    }

    @Test
    void resolve_shouldQueryEachScopeOnlyOnce() {
        RecordStore mockStore = mock(RecordStore.class);
        when(mockStore.getSettings(ConfigScope.USER, 1L))
                .thenReturn(new ScopeSettings(ConfigScope.USER, 1L, Map.of("greeting", "")));
        when(mockStore.getSettings(ConfigScope.FORUM, 7L))
                .thenReturn(ScopeSettings.empty(ConfigScope.FORUM, 7L));
        when(mockStore.getSettings(ConfigScope.GLOBAL, 0L))
                .thenReturn(new ScopeSettings(ConfigScope.GLOBAL, 0L, Map.of("greeting", "hi")));
        ConfigResolver cached = new ConfigResolver(mockStore, cache);

        for (int i = 0; i < 3; i++) {
            assertEquals("hi", cached.resolve("greeting", 1L, 7L));
            assertEquals("50", cached.resolve("pagination", 1L, 7L));
        }

        verify(mockStore, times(1)).getSettings(ConfigScope.USER, 1L);
        verify(mockStore, times(1)).getSettings(ConfigScope.FORUM, 7L);
        verify(mockStore, times(1)).getSettings(ConfigScope.GLOBAL, 0L);
    }

    @Test
    void setOption_shouldInvalidateOnlyItsScope() {
        resolver.resolve("greeting", 1L, 7L);
        assertTrue(cache.contains(ConfigKey.of(ConfigScope.USER, 1L)));
        assertTrue(cache.contains(ConfigKey.of(ConfigScope.FORUM, 7L)));

        settings.setOption(ConfigScope.USER, 1L, "greeting", "hello");

        assertFalse(cache.contains(ConfigKey.of(ConfigScope.USER, 1L)));
        assertTrue(cache.contains(ConfigKey.of(ConfigScope.FORUM, 7L)));
        assertEquals("hello", resolver.resolve("greeting", 1L, 7L));
    }

    @Test
    void setOption_shouldStoreNullAsUnset() {
        settings.setOption(ConfigScope.FORUM, 7L, "greeting", "B");
        settings.setOption(ConfigScope.USER, 1L, "greeting", null);

        assertEquals("", store.getSettings(ConfigScope.USER, 1L).raw("greeting"));
        assertEquals("B", resolver.resolve("greeting", 1L, 7L));
    }

    @Test
    void setOption_shouldRejectBlankName() {
        ValidationException e = assertThrows(ValidationException.class,
                () -> settings.setOption(ConfigScope.GLOBAL, null, " ", "x"));
        assertEquals("name", e.getField());
    }

    @Test
    void removeOption_shouldReportMissingRow() {
        assertFalse(settings.removeOption(ConfigScope.FORUM, 7L, "greeting"));
    }
}
