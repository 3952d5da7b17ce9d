package de.bsommerfeld.forum.core.tree;

import de.bsommerfeld.forum.core.domain.Message;

import java.util.Comparator;

/**
 * Sibling ordering policy. Siblings are ordered by creation time; equal
 * timestamps fall back to the message id so the order is total and every
 * build of the same input yields the same tree.
 */
public enum MessageOrdering {

    ASCENDING,
    DESCENDING;

    private static final Comparator<Message> BY_ID = Comparator.comparingLong(Message::id);

    public Comparator<Message> comparator() {
        Comparator<Message> byTime = Comparator.comparingLong(Message::createdUtc);
        if (this == DESCENDING) {
            byTime = byTime.reversed();
        }
        return byTime.thenComparing(BY_ID);
    }

    /**
     * Maps the {@code sort_messages} option value ({@code ascending} /
     * {@code descending}) to an ordering. Anything else is ascending.
     */
    public static MessageOrdering fromOption(String value) {
        return "descending".equalsIgnoreCase(value) ? DESCENDING : ASCENDING;
    }
}
