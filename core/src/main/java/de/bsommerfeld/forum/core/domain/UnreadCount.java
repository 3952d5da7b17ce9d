package de.bsommerfeld.forum.core.domain;

/**
 * Result of one unread-counting pass. A thread counts once if it contains at
 * least one unread message, so {@code (1, 5)} means five unread messages in a
 * single thread.
 */
public record UnreadCount(long threads, long messages) {

    public static final UnreadCount NONE = new UnreadCount(0, 0);
}
