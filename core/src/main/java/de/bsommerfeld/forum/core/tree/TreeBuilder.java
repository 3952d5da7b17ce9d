package de.bsommerfeld.forum.core.tree;

import de.bsommerfeld.forum.core.domain.Message;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Turns the flat, parent-linked message records of one thread into an
 * ordered {@link MessageTree}.
 *
 * <h3>Linking</h3>
 * Messages are grouped by {@code parentId}. Messages without a parent are the
 * thread roots. A message whose parent is missing from the input (filtered
 * out, purged, or pointing into another thread) is promoted to a secondary
 * root instead of being dropped. Members of a parent cycle are unreachable
 * from any root; the smallest id of each cycle is promoted as well.
 *
 * <h3>Determinism</h3>
 * The input is sorted by id before linking and every sibling list is sorted
 * with a total comparator, so the same input set always yields an equal tree
 * regardless of input order.
 *
 * <p>
 * Pure function, stateless and thread-safe.
 */
public final class TreeBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(TreeBuilder.class);

    private TreeBuilder() {
    }

    public static MessageTree build(long threadId, Collection<Message> input, MessageOrdering ordering) {
        return build(threadId, input, VisibilityFilter.ALL, ordering);
    }

    /**
     * Builds the tree of all messages accepted by {@code filter}.
     *
     * @param threadId thread the messages belong to; messages of other
     *                 threads are ignored
     * @param input    flat message records, any order
     * @param filter   caller visibility policy
     * @param ordering sibling ordering
     */
    public static MessageTree build(long threadId, Collection<Message> input, VisibilityFilter filter,
            MessageOrdering ordering) {
        Map<Long, Message> byId = new TreeMap<>();
        for (Message m : input) {
            if (m.threadId() == threadId && filter.test(m)) {
                byId.put(m.id(), m);
            }
        }

        Map<Long, Long> parents = new HashMap<>();
        Map<Long, List<Message>> grouped = new HashMap<>();
        List<Message> rootCandidates = new ArrayList<>();
        Set<Long> promoted = new LinkedHashSet<>();

        for (Message m : byId.values()) {
            Long parent = m.parentId();
            if (parent == null) {
                rootCandidates.add(m);
            } else if (parent == m.id() || !byId.containsKey(parent)) {
                rootCandidates.add(m);
                promoted.add(m.id());
            } else {
                parents.put(m.id(), parent);
                grouped.computeIfAbsent(parent, k -> new ArrayList<>()).add(m);
            }
        }

        Comparator<Message> siblingOrder = ordering.comparator();
        Map<Long, List<Long>> children = new HashMap<>();
        for (Map.Entry<Long, List<Message>> e : grouped.entrySet()) {
            List<Message> siblings = e.getValue();
            siblings.sort(siblingOrder);
            List<Long> ids = new ArrayList<>(siblings.size());
            for (Message s : siblings) {
                ids.add(s.id());
            }
            children.put(e.getKey(), List.copyOf(ids));
        }

        Set<Long> reachable = reachableFrom(rootCandidates, children);
        if (reachable.size() < byId.size()) {
            breakCycles(byId, reachable, parents, children, rootCandidates, promoted);
        }

        rootCandidates.sort(rootOrder(promoted, siblingOrder));
        List<Long> roots = new ArrayList<>(rootCandidates.size());
        for (Message r : rootCandidates) {
            roots.add(r.id());
        }

        if (!promoted.isEmpty()) {
            LOG.warn("Thread {} has {} orphaned message(s) promoted to secondary roots: {}",
                    threadId, promoted.size(), promoted);
        }

        return new MessageTree(threadId, new LinkedHashMap<>(byId), children, parents, roots, promoted);
    }

    private static Comparator<Message> rootOrder(Set<Long> promoted, Comparator<Message> siblingOrder) {
        Comparator<Message> realFirst = Comparator.comparing(m -> promoted.contains(m.id()));
        return realFirst.thenComparing(siblingOrder);
    }

    private static Set<Long> reachableFrom(List<Message> roots, Map<Long, List<Long>> children) {
        Set<Long> seen = new HashSet<>();
        List<Long> work = new ArrayList<>();
        for (Message r : roots) {
            work.add(r.id());
        }
        while (!work.isEmpty()) {
            Long id = work.remove(work.size() - 1);
            if (seen.add(id)) {
                work.addAll(children.getOrDefault(id, List.of()));
            }
        }
        return seen;
    }

    /**
     * Promotes the smallest unreachable id to a root (cutting its parent
     * edge) until every message is reachable.
     */
    private static void breakCycles(Map<Long, Message> byId, Set<Long> reachable, Map<Long, Long> parents,
            Map<Long, List<Long>> children, List<Message> roots, Set<Long> promoted) {
        for (Long id : byId.keySet()) {
            if (reachable.contains(id)) {
                continue;
            }
            Long parent = parents.remove(id);
            if (parent != null) {
                List<Long> siblings = new ArrayList<>(children.get(parent));
                siblings.remove(id);
                children.put(parent, List.copyOf(siblings));
            }
            Message message = byId.get(id);
            roots.add(message);
            promoted.add(id);
            reachable.addAll(reachableFrom(List.of(message), children));
        }
    }
}
