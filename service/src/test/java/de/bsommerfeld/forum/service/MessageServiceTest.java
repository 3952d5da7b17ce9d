package de.bsommerfeld.forum.service;

import de.bsommerfeld.forum.core.cache.ForumCache;
import de.bsommerfeld.forum.core.cache.UnreadCountKey;
import de.bsommerfeld.forum.core.domain.ForumThread;
import de.bsommerfeld.forum.core.domain.Message;
import de.bsommerfeld.forum.core.domain.UnreadCount;
import de.bsommerfeld.forum.core.error.NotFoundException;
import de.bsommerfeld.forum.core.error.ValidationException;
import de.bsommerfeld.forum.core.event.ApplicationEventBus;
import de.bsommerfeld.forum.core.event.Broadcaster;
import de.bsommerfeld.forum.db.InMemoryRecordStore;
import de.bsommerfeld.forum.db.MessagePatch;
import de.bsommerfeld.forum.db.MessageSelector;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class MessageServiceTest {

    @Mock
    private Broadcaster broadcaster;

    private InMemoryRecordStore store;
    private ForumCache cache;
    private ThreadRepository repository;
    private MessageService messages;

    @BeforeEach
    void setUp() {
        store = spy(new InMemoryRecordStore());
        cache = new ForumCache();
        repository = new ThreadRepository(store, cache, new ApplicationEventBus());
        messages = new MessageService(store, repository, cache, broadcaster);

        store.saveThread(new ForumThread(1, 7, "one", false, 100));
        store.saveThread(new ForumThread(2, 7, "two", false, 100));
        store.insertMessage(new Message(1, 7, null, 5L, "alice", "s", "c", 100).withId(1));
        store.insertMessage(new Message(2, 7, null, 5L, "alice", "s", "c", 100).withId(2));
    }

    @Test
    void createMessage_shouldAssignIdAndShowUpInCachedTree() {
        repository.buildFullTree(1);

        Message created = messages.createMessage(new Message(1, 7, 1L, 6L, "bob", "re", "text", 150));

        assertEquals(3, created.id());
        assertEquals(List.of(3L), repository.buildFullTree(1).childIds(1));
        assertEquals(150, store.getThread(1).latestMessageUtc());
    }

    @Test
    void createMessage_shouldDropCountsOfThatForum() {
        cache.put(UnreadCountKey.of(42, List.of(7L)), new UnreadCount(2, 2));
        cache.put(UnreadCountKey.of(42, List.of(8L)), UnreadCount.NONE);

        messages.createMessage(new Message(1, 7, 1L, 6L, "bob", "re", "text", 150));

        assertFalse(cache.contains(UnreadCountKey.of(42, List.of(7L))));
        assertTrue(cache.contains(UnreadCountKey.of(42, List.of(8L))));
    }

    @Test
    void createMessage_shouldValidateThreadForumAndParent() {
        assertThrows(NotFoundException.class,
                () -> messages.createMessage(new Message(9, 7, null, null, "x", "s", "c", 1)));

        ValidationException forum = assertThrows(ValidationException.class,
                () -> messages.createMessage(new Message(1, 8, null, null, "x", "s", "c", 1)));
        assertEquals("forumId", forum.getField());

        ValidationException parent = assertThrows(ValidationException.class,
                () -> messages.createMessage(new Message(1, 7, 2L, null, "x", "s", "c", 1)));
        assertEquals("parentId", parent.getField());

        assertNull(store.getMessage(3));
    }

    @Test
    void updateMessage_shouldReplaceSubjectAndContent() {
        Message edited = messages.updateMessage(1, "new subject", "new content");

        assertEquals("new subject", store.getMessage(1).subject());
        assertEquals("new content", repository.findMessage(1).content());
        assertEquals(edited.createdUtc(), store.getMessage(1).createdUtc());
        assertThrows(NotFoundException.class, () -> messages.updateMessage(99, "s", "c"));
    }

    @Test
    void updateMessage_shouldKeepVotesFlagsAndDeletionWrittenConcurrently() {
        doAnswer(invocation -> {
            // a vote and a moderation flag land while the edit is in progress
            store.updateWhere(MessageSelector.id(1),
                    MessagePatch.empty().votes(1, 0).deleted(true).setFlag(Message.FLAG_REASON, "spam"));
            return invocation.callRealMethod();
        }).when(store).editMessage(eq(1L), anyString(), anyString(), anyLong());

        Message edited = messages.updateMessage(1, "new subject", "new content");

        Message stored = store.getMessage(1);
        assertEquals("new content", stored.content());
        assertEquals(1, stored.upvotes());
        assertTrue(stored.deleted());
        assertEquals("spam", stored.flag(Message.FLAG_REASON));
        assertEquals(stored, edited);
        assertEquals(1, repository.findMessage(1).upvotes());
    }

    @Test
    void acceptMessage_shouldReportNoOp() {
        assertTrue(messages.acceptMessage(1));
        assertFalse(messages.acceptMessage(1));
        assertTrue(repository.findMessage(1).isAccepted());

        assertTrue(messages.unacceptMessage(1));
        assertFalse(messages.unacceptMessage(1));
        assertFalse(store.getMessage(1).isAccepted());
    }

    @Test
    void scoreUp_shouldBroadcastNewScore() {
        messages.scoreDown(1, 1);
        Message rescored = messages.scoreUp(1, 3);

        assertEquals(2, rescored.score());
        verify(broadcaster).broadcast("forum:7", "message_rescored",
                Map.of("message_id", 1L, "score", 2, "upvotes", 3, "downvotes", 1));
    }

    @Test
    void scoreUp_shouldSucceedWhenBroadcastFails() {
        doThrow(new IllegalStateException("offline")).when(broadcaster).broadcast(anyString(), anyString(), anyMap());

        assertEquals(1, messages.scoreUp(2, 1).upvotes());
        assertEquals(1, store.getMessage(2).upvotes());
    }

    @Test
    void scoreUp_shouldFailForUnknownMessage() {
        assertThrows(NotFoundException.class, () -> messages.scoreUp(77, 1));
    }
}
