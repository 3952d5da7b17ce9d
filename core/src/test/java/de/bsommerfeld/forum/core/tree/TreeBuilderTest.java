package de.bsommerfeld.forum.core.tree;

import de.bsommerfeld.forum.core.domain.Message;
import de.bsommerfeld.forum.core.domain.ThreadSnapshot;
import de.bsommerfeld.forum.core.util.ForumDataGenerator;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TreeBuilderTest {

    // -- Structure --

    @Test
    void build_shouldRoundTripRandomForests() {
        Random random = new Random(7);
        for (int run = 0; run < 50; run++) {
            List<Message> input = randomForest(random, 1 + random.nextInt(60));

            MessageTree tree = TreeBuilder.build(1, input, MessageOrdering.ASCENDING);

            assertEquals(input.size(), tree.size());
            assertTrue(tree.promotedRootIds().isEmpty());
            Map<Long, List<Long>> expectedChildren = new HashMap<>();
            for (Message m : input) {
                assertTrue(tree.contains(m.id()));
                assertEquals(m.parentId(), tree.parentId(m.id()));
                if (m.parentId() != null)
                    expectedChildren.computeIfAbsent(m.parentId(), k -> new ArrayList<>()).add(m.id());
            }
            for (Message m : input) {
                List<Long> expected = expectedChildren.getOrDefault(m.id(), List.of());
                assertEquals(Set.copyOf(expected), Set.copyOf(tree.childIds(m.id())));
                assertEquals(expected.size(), tree.childIds(m.id()).size());
            }
        }
    }

    @Test
    void build_shouldRoundTripGeneratedThread() {
        ThreadSnapshot snapshot = new ForumDataGenerator(3).generateThread(9, 1, 100, 40);

        MessageTree tree = TreeBuilder.build(9, snapshot.messages(), MessageOrdering.ASCENDING);

        assertEquals(40, tree.size());
        assertEquals(100, tree.root().id());
        assertEquals(List.of(100L), tree.rootIds());
        assertEquals(40, tree.sortedMessages().size());
    }

    @Test
    void build_shouldBeIndependentOfInputOrder() {
        List<Message> input = randomForest(new Random(11), 30);
        List<Message> shuffled = new ArrayList<>(input);
        Collections.shuffle(shuffled, new Random(12));

        MessageTree a = TreeBuilder.build(1, input, MessageOrdering.DESCENDING);
        MessageTree b = TreeBuilder.build(1, shuffled, MessageOrdering.DESCENDING);

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertEquals(a.sortedMessages(), b.sortedMessages());
    }

    @Test
    void build_shouldIgnoreMessagesOfOtherThreads() {
        Message foreign = new Message(99, 2, 1, null, null, "x", "s", "c", false, false,
                Map.of(), List.of(), 0, 0, 1, 1);

        MessageTree tree = TreeBuilder.build(1, List.of(msg(1, null, 10), foreign), MessageOrdering.ASCENDING);

        assertEquals(1, tree.size());
        assertFalse(tree.contains(99));
    }

    @Test
    void build_shouldReturnEmptyTreeForEmptyInput() {
        MessageTree tree = TreeBuilder.build(1, List.of(), MessageOrdering.ASCENDING);

        assertTrue(tree.isEmpty());
        assertNull(tree.root());
    }

    // -- Ordering --

    @Test
    void build_shouldOrderSiblingsByCreationTime() {
        List<Message> input = List.of(msg(1, null, 10), msg(2, 1L, 30), msg(3, 1L, 20), msg(4, 1L, 40));

        assertEquals(List.of(3L, 2L, 4L),
                TreeBuilder.build(1, input, MessageOrdering.ASCENDING).childIds(1));
        assertEquals(List.of(4L, 2L, 3L),
                TreeBuilder.build(1, input, MessageOrdering.DESCENDING).childIds(1));
    }

    @Test
    void build_shouldBreakTimestampTiesById() {
        List<Message> input = List.of(msg(1, null, 10), msg(5, 1L, 20), msg(3, 1L, 20), msg(4, 1L, 20));

        assertEquals(List.of(3L, 4L, 5L),
                TreeBuilder.build(1, input, MessageOrdering.ASCENDING).childIds(1));
        assertEquals(List.of(3L, 4L, 5L),
                TreeBuilder.build(1, input, MessageOrdering.DESCENDING).childIds(1));
    }

    // -- Orphans --

    @Test
    void build_shouldPromoteOrphansToSecondaryRoots() {
        List<Message> input = List.of(msg(1, null, 10), msg(2, 1L, 20), msg(3, 99L, 5), msg(4, 3L, 30));

        MessageTree tree = TreeBuilder.build(1, input, MessageOrdering.ASCENDING);

        assertEquals(4, tree.size());
        assertEquals(List.of(1L, 3L), tree.rootIds());
        assertEquals(Set.of(3L), tree.promotedRootIds());
        assertNull(tree.parentId(3));
        assertEquals(List.of(4L), tree.childIds(3));
        assertEquals(1, tree.root().id());
    }

    @Test
    void build_shouldPromoteRepliesOfFilteredMessages() {
        Message deleted = msg(2, 1L, 20).withDeleted(true, Map.of(), 20);
        List<Message> input = List.of(msg(1, null, 10), deleted, msg(3, 2L, 30));

        MessageTree tree = TreeBuilder.build(1, input, VisibilityFilter.HIDE_DELETED, MessageOrdering.ASCENDING);

        assertFalse(tree.contains(2));
        assertTrue(tree.contains(3));
        assertEquals(Set.of(3L), tree.promotedRootIds());
    }

    @Test
    void build_shouldPromoteFirstOrphanWhenRootIsMissing() {
        MessageTree tree = TreeBuilder.build(1, List.of(msg(5, 1L, 50), msg(4, 1L, 40)),
                MessageOrdering.ASCENDING);

        assertEquals(4, tree.root().id());
        assertEquals(List.of(4L, 5L), tree.rootIds());
    }

    @Test
    void build_shouldBreakParentCycles() {
        List<Message> input = List.of(msg(1, null, 10), msg(2, 3L, 20), msg(3, 2L, 30), msg(6, 6L, 60));

        MessageTree tree = TreeBuilder.build(1, input, MessageOrdering.ASCENDING);

        assertEquals(4, tree.size());
        assertEquals(List.of(1L, 2L, 6L), tree.rootIds());
        assertEquals(Set.of(2L, 6L), tree.promotedRootIds());
        assertEquals(List.of(3L), tree.childIds(2));
        assertEquals(List.of(), tree.childIds(3));
    }

    // -- Helpers --

    static Message msg(long id, Long parentId, long createdUtc) {
        return new Message(1, 1, parentId, null, "author", "subject", "content", createdUtc).withId(id);
    }

    /** A forest whose parents always precede their children. */
    private static List<Message> randomForest(Random random, int size) {
        List<Message> result = new ArrayList<>();
        for (long id = 1; id <= size; id++) {
            Long parent = id == 1 || random.nextInt(8) == 0 ? null : 1 + (long) random.nextInt((int) id - 1);
            result.add(msg(id, parent, random.nextInt(5)));
        }
        return result;
    }
}
