package de.bsommerfeld.forum.service;

import de.bsommerfeld.forum.core.cache.ForumCache;
import de.bsommerfeld.forum.core.cache.UnreadCountKey;
import de.bsommerfeld.forum.core.domain.ForumThread;
import de.bsommerfeld.forum.core.domain.Message;
import de.bsommerfeld.forum.core.domain.ReadMarker;
import de.bsommerfeld.forum.core.domain.UnreadCount;
import de.bsommerfeld.forum.core.event.Broadcaster;
import de.bsommerfeld.forum.db.InMemoryRecordStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class ReadTrackingLedgerTest {

    private static final long USER = 42;
    private static final long FORUM = 7;

    @Mock
    private Broadcaster broadcaster;

    private InMemoryRecordStore store;
    private ForumCache cache;
    private ReadTrackingLedger ledger;

    @BeforeEach
    void setUp() {
        store = new InMemoryRecordStore();
        cache = new ForumCache();
        ledger = new ReadTrackingLedger(store, cache, broadcaster);

        store.saveThread(new ForumThread(1, FORUM, "one", false, 0));
        store.insertMessage(new Message(1, FORUM, null, null, "a", "s", "c", 100).withId(101));
        store.insertMessage(new Message(1, FORUM, 101L, null, "b", "s", "c", 110).withId(102));
    }

    @Test
    void countUnread_shouldExcludeReadMessages() {
        ledger.markRead(USER, List.of(102L));

        assertEquals(new UnreadCount(1, 1), ledger.countUnread(USER, List.of(FORUM)));
    }

    @Test
    void countUnread_shouldNotCacheCountReadBeforeConcurrentMarkRead() {
        InMemoryRecordStore spiedStore = spy(store);
        ReadTrackingLedger racingLedger = new ReadTrackingLedger(spiedStore, cache, broadcaster);
        AtomicBoolean interleaved = new AtomicBoolean();
        doAnswer(invocation -> {
            Object outdated = invocation.callRealMethod();
            if (interleaved.compareAndSet(false, true)) {
                racingLedger.markRead(USER, List.of(101L, 102L));
            }
            return outdated;
        }).when(spiedStore).countUnread(eq(USER), anyCollection());

        assertEquals(new UnreadCount(1, 2), racingLedger.countUnread(USER, List.of(FORUM)));

        assertFalse(cache.contains(UnreadCountKey.of(USER, List.of(FORUM))));
        assertEquals(UnreadCount.NONE, racingLedger.countUnread(USER, List.of(FORUM)));
    }

    @Test
    void countUnread_shouldBeZeroForAnonymousUsers() {
        assertEquals(UnreadCount.NONE, ledger.countUnread(null, List.of(FORUM)));
        assertEquals(UnreadCount.NONE, ledger.countUnread(USER, List.of()));
        assertEquals(0, cache.size());
    }

    @Test
    void countUnread_shouldOnlyCountVisibleForums() {
        store.saveThread(new ForumThread(2, 8, "other", false, 0));
        store.insertMessage(new Message(2, 8, null, null, "x", "s", "c", 200).withId(201));

        assertEquals(new UnreadCount(1, 2), ledger.countUnread(USER, List.of(FORUM)));
        assertEquals(new UnreadCount(2, 3), ledger.countUnread(USER, List.of(FORUM, 8L)));
    }

    @Test
    void markRead_shouldBeIdempotent() {
        List<ReadMarker> first = ledger.markRead(USER, List.of(101L, 102L));
        List<ReadMarker> second = ledger.markRead(USER, List.of(101L, 102L));

        assertEquals(List.of(new ReadMarker(USER, 101), new ReadMarker(USER, 102)), first);
        assertTrue(second.isEmpty());
        assertEquals(UnreadCount.NONE, ledger.countUnread(USER, List.of(FORUM)));
    }

    @Test
    void markRead_shouldBroadcastOnlyNewlyReadIds() {
        ledger.markRead(USER, List.of(101L));
        ledger.markRead(USER, List.of(101L, 102L));

        verify(broadcaster).broadcast("users:42", "message_marked_read", Map.of("message_ids", List.of(101L)));
        verify(broadcaster).broadcast("users:42", "message_marked_read", Map.of("message_ids", List.of(102L)));
    }

    @Test
    void markRead_shouldIgnoreAnonymousUsers() {
        assertTrue(ledger.markRead(null, List.of(101L)).isEmpty());
        assertEquals(0, ledger.markUnread(null, List.of(101L)));
        verifyNoInteractions(broadcaster);
    }

    @Test
    void markRead_shouldDropCachedCountsOfThatUserOnly() {
        ledger.countUnread(USER, List.of(FORUM));
        ledger.countUnread(43L, List.of(FORUM));

        ledger.markRead(USER, List.of(101L));

        assertFalse(cache.contains(UnreadCountKey.of(USER, List.of(FORUM))));
        assertTrue(cache.contains(UnreadCountKey.of(43L, List.of(FORUM))));
        assertEquals(new UnreadCount(1, 1), ledger.countUnread(USER, List.of(FORUM)));
    }

    @Test
    void markRead_shouldSucceedWhenBroadcastFails() {
        doThrow(new IllegalStateException("socket closed"))
                .when(broadcaster).broadcast(anyString(), anyString(), anyMap());

        List<ReadMarker> inserted = ledger.markRead(USER, List.of(101L));

        assertEquals(1, inserted.size());
        assertEquals(new UnreadCount(1, 1), ledger.countUnread(USER, List.of(FORUM)));
    }

    @Test
    void markUnread_shouldRestoreCounts() {
        ledger.markRead(USER, List.of(101L, 102L));
        assertEquals(UnreadCount.NONE, ledger.countUnread(USER, List.of(FORUM)));

        int removed = ledger.markUnread(USER, List.of(101L, 102L, 999L));

        assertEquals(2, removed);
        assertEquals(new UnreadCount(1, 2), ledger.countUnread(USER, List.of(FORUM)));
        verify(broadcaster).broadcast("users:42", "message_marked_unread",
                Map.of("message_ids", List.of(101L, 102L, 999L)));
    }

    @Test
    void hideThread_shouldRemoveThreadFromCounts() {
        ledger.countUnread(USER, List.of(FORUM));

        assertTrue(ledger.hideThread(USER, 1));
        assertEquals(UnreadCount.NONE, ledger.countUnread(USER, List.of(FORUM)));

        assertTrue(ledger.unhideThread(USER, 1));
        assertEquals(new UnreadCount(1, 2), ledger.countUnread(USER, List.of(FORUM)));
        verify(broadcaster, never()).broadcast(any(), any(), any());
    }
}
