package de.bsommerfeld.forum.core.cache;

import de.bsommerfeld.forum.core.domain.Message;

/** {@code message:{messageId}} → single message snapshot. */
public record MessageKey(long messageId) implements CacheKey<Message> {

    @Override
    public String namespace() {
        return "message";
    }

    @Override
    public String render() {
        return namespace() + ":" + messageId;
    }
}
