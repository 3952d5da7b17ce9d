package de.bsommerfeld.forum.core.domain;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MessageTest {

    @Test
    void convenienceConstructor_shouldCreateUnpersistedMessage() {
        Message m = new Message(3, 7, null, 42L, "author", "subject", "content", 100);

        assertEquals(0, m.id());
        assertTrue(m.isRoot());
        assertFalse(m.deleted());
        assertTrue(m.flags().isEmpty());
        assertTrue(m.tags().isEmpty());
        assertEquals(100, m.updatedUtc());
    }

    @Test
    void constructor_shouldCopyFlagsAndTags() {
        Map<String, String> flags = new HashMap<>(Map.of("reason", "spam"));
        List<String> tags = new ArrayList<>(List.of("css"));

        Message m = new Message(1, 1, 1, null, null, "a", "s", "c", false, false, flags, tags, 0, 0, 1, 1);
        flags.put("accepted", "yes");
        tags.add("html");

        assertEquals(Map.of("reason", "spam"), m.flags());
        assertEquals(List.of("css"), m.tags());
        assertThrows(UnsupportedOperationException.class, () -> m.flags().put("x", "y"));
    }

    @Test
    void isAccepted_shouldRequireYes() {
        Message base = new Message(1, 1, null, null, "a", "s", "c", 1);

        assertFalse(base.isAccepted());
        assertTrue(base.withFlags(Map.of(Message.FLAG_ACCEPTED, "yes"), 2).isAccepted());
        assertFalse(base.withFlags(Map.of(Message.FLAG_ACCEPTED, "no"), 2).isAccepted());
    }

    @Test
    void withVotes_shouldKeepTimestampAndComputeScore() {
        Message m = new Message(1, 1, null, null, "a", "s", "c", 1).withVotes(5, 2);

        assertEquals(3, m.score());
        assertEquals(1, m.updatedUtc());
    }

    @Test
    void withDeleted_shouldReplaceFlagsAndTouch() {
        Message m = new Message(1, 1, null, null, "a", "s", "c", 1)
                .withDeleted(true, Map.of(Message.FLAG_REASON, "off-topic"), 50);

        assertTrue(m.deleted());
        assertEquals("off-topic", m.flag(Message.FLAG_REASON));
        assertEquals(50, m.updatedUtc());
    }
}
