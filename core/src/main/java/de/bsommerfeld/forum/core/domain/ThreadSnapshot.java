package de.bsommerfeld.forum.core.domain;

import java.util.List;

/**
 * Consistent point-in-time view of one thread: its metadata plus the flat,
 * unfiltered list of every message carrying its identifier. This is the value
 * cached per thread; trees are built from it on demand.
 */
public record ThreadSnapshot(ForumThread thread, List<Message> messages) {

    public ThreadSnapshot {
        messages = messages == null ? List.of() : List.copyOf(messages);
    }

    public long threadId() {
        return thread.id();
    }
}
