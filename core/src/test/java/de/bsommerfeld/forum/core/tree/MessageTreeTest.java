package de.bsommerfeld.forum.core.tree;

import de.bsommerfeld.forum.core.error.NotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static de.bsommerfeld.forum.core.tree.TreeBuilderTest.msg;
import static org.junit.jupiter.api.Assertions.*;

class MessageTreeTest {

    /*
     * 1
     * ├── 2
     * │   ├── 4
     * │   └── 5
     * │       └── 7
     * └── 3
     *     └── 6
     */
    private MessageTree tree;

    @BeforeEach
    void setUp() {
        tree = TreeBuilder.build(1, List.of(
                msg(1, null, 1), msg(2, 1L, 2), msg(3, 1L, 3), msg(4, 2L, 4),
                msg(5, 2L, 5), msg(6, 3L, 6), msg(7, 5L, 7)), MessageOrdering.ASCENDING);
    }

    @Test
    void subtreeIds_shouldWalkDepthFirstPreOrder() {
        assertEquals(List.of(1L, 2L, 4L, 5L, 7L, 3L, 6L), tree.subtreeIds(1));
        assertEquals(List.of(2L, 4L, 5L, 7L), tree.subtreeIds(2));
        assertEquals(List.of(7L), tree.subtreeIds(7));
    }

    @Test
    void descendantIds_shouldExcludeAnchor() {
        assertEquals(List.of(4L, 5L, 7L), tree.descendantIds(2));
        assertTrue(tree.descendantIds(6).isEmpty());
    }

    @Test
    void subtreeIds_shouldFailForUnknownAnchor() {
        NotFoundException e = assertThrows(NotFoundException.class, () -> tree.subtreeIds(42));
        assertEquals("message", e.getEntity());
        assertEquals(42, e.getId());
    }

    @Test
    void depth_shouldCountAncestors() {
        assertEquals(0, tree.depth(1));
        assertEquals(1, tree.depth(3));
        assertEquals(3, tree.depth(7));
    }

    @Test
    void children_shouldFollowChildIds() {
        assertEquals(List.of(4L, 5L), tree.children(2).stream().map(m -> m.id()).toList());
        assertTrue(tree.children(4).isEmpty());
    }

    @Test
    void sortedMessages_shouldMatchDisplayOrder() {
        assertEquals(List.of(1L, 2L, 4L, 5L, 7L, 3L, 6L),
                tree.sortedMessages().stream().map(m -> m.id()).toList());
    }

    @Test
    void require_shouldReturnMessageOrThrow() {
        assertEquals(5, tree.require(5).id());
        assertNull(tree.get(99));
        assertThrows(NotFoundException.class, () -> tree.require(99));
    }
}
