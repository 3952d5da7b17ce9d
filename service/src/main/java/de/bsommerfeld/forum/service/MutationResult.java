package de.bsommerfeld.forum.service;

import java.util.List;

/**
 * Outcome of a committed subtree mutation.
 *
 * @param threadId   thread whose cache entry was refreshed
 * @param messageIds anchor first, then its replies in depth-first order
 */
public record MutationResult(long threadId, List<Long> messageIds) {

    public MutationResult {
        messageIds = List.copyOf(messageIds);
    }

    public long anchorId() {
        return messageIds.get(0);
    }

    public int size() {
        return messageIds.size();
    }
}
