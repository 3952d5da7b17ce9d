package de.bsommerfeld.forum.core.tree;

import de.bsommerfeld.forum.core.domain.Message;
import de.bsommerfeld.forum.core.error.NotFoundException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Ordered reply tree of one thread, stored as an arena: messages indexed by
 * id plus explicit child-id lists. Nodes never reference each other directly.
 *
 * <p>
 * Instances are immutable and safe to share between threads. Two trees built
 * from the same input are {@link #equals equal}.
 */
public final class MessageTree {

    private final long threadId;
    private final Map<Long, Message> messages;
    private final Map<Long, List<Long>> children;
    private final Map<Long, Long> parents;
    private final List<Long> roots;
    private final Set<Long> promotedRoots;

    MessageTree(long threadId, Map<Long, Message> messages, Map<Long, List<Long>> children,
            Map<Long, Long> parents, List<Long> roots, Set<Long> promotedRoots) {
        this.threadId = threadId;
        this.messages = Collections.unmodifiableMap(messages);
        this.children = Collections.unmodifiableMap(children);
        this.parents = Collections.unmodifiableMap(parents);
        this.roots = Collections.unmodifiableList(roots);
        this.promotedRoots = Collections.unmodifiableSet(promotedRoots);
    }

    public long threadId() {
        return threadId;
    }

    /**
     * The primary root: the first message without a parent, or the first
     * promoted root if the thread has lost its real root. {@code null} only
     * for an empty tree.
     */
    public Message root() {
        return roots.isEmpty() ? null : messages.get(roots.get(0));
    }

    /** All root ids in order, real roots before promoted orphans. */
    public List<Long> rootIds() {
        return roots;
    }

    /**
     * Ids of messages whose declared parent was missing from the input (or
     * that sat on a parent cycle) and were promoted to secondary roots.
     */
    public Set<Long> promotedRootIds() {
        return promotedRoots;
    }

    public boolean contains(long messageId) {
        return messages.containsKey(messageId);
    }

    public Message get(long messageId) {
        return messages.get(messageId);
    }

    /**
     * Like {@link #get} but fails with {@link NotFoundException} for ids that
     * are not part of this tree.
     */
    public Message require(long messageId) {
        Message message = messages.get(messageId);
        if (message == null) {
            throw NotFoundException.message(messageId);
        }
        return message;
    }

    public int size() {
        return messages.size();
    }

    public boolean isEmpty() {
        return messages.isEmpty();
    }

    public List<Long> childIds(long messageId) {
        return children.getOrDefault(messageId, List.of());
    }

    public List<Message> children(long messageId) {
        List<Long> ids = childIds(messageId);
        List<Message> result = new ArrayList<>(ids.size());
        for (Long id : ids) {
            result.add(messages.get(id));
        }
        return result;
    }

    /**
     * Parent of a node inside this tree, {@code null} for roots (including
     * promoted orphans).
     */
    public Long parentId(long messageId) {
        return parents.get(messageId);
    }

    /**
     * Anchor plus all transitive replies in depth-first pre-order. Walks only
     * the subtree, never the whole thread.
     */
    public List<Long> subtreeIds(long anchorId) {
        require(anchorId);
        List<Long> result = new ArrayList<>();
        Deque<Long> stack = new ArrayDeque<>();
        stack.push(anchorId);
        while (!stack.isEmpty()) {
            Long id = stack.pop();
            result.add(id);
            List<Long> kids = childIds(id);
            for (int i = kids.size() - 1; i >= 0; i--) {
                stack.push(kids.get(i));
            }
        }
        return result;
    }

    /** {@link #subtreeIds} without the anchor itself. */
    public List<Long> descendantIds(long anchorId) {
        List<Long> ids = subtreeIds(anchorId);
        return ids.subList(1, ids.size());
    }

    /** Every message of the tree in display order (depth-first, root by root). */
    public List<Message> sortedMessages() {
        List<Message> result = new ArrayList<>(messages.size());
        for (Long root : roots) {
            for (Long id : subtreeIds(root)) {
                result.add(messages.get(id));
            }
        }
        return result;
    }

    /** Nesting depth of a node, {@code 0} for roots. */
    public int depth(long messageId) {
        require(messageId);
        int depth = 0;
        Long current = parents.get(messageId);
        while (current != null) {
            depth++;
            current = parents.get(current);
        }
        return depth;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MessageTree other)) {
            return false;
        }
        return threadId == other.threadId
                && roots.equals(other.roots)
                && children.equals(other.children)
                && messages.equals(other.messages);
    }

    @Override
    public int hashCode() {
        return Objects.hash(threadId, roots, children, messages);
    }

    @Override
    public String toString() {
        return "MessageTree[thread=" + threadId + ", messages=" + messages.size()
                + ", roots=" + roots + "]";
    }
}
