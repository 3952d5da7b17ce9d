package de.bsommerfeld.forum.core.cache;

import de.bsommerfeld.forum.core.domain.ThreadSnapshot;

/** {@code thread-tree:{threadId}} → snapshot the thread's trees are built from. */
public record ThreadTreeKey(long threadId) implements CacheKey<ThreadSnapshot> {

    @Override
    public String namespace() {
        return "thread-tree";
    }

    @Override
    public String render() {
        return namespace() + ":" + threadId;
    }
}
