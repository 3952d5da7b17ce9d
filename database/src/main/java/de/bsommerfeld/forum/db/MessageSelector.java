package de.bsommerfeld.forum.db;

import de.bsommerfeld.forum.core.domain.Message;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Predicate of a bulk update: the set of message ids it applies to.
 * Duplicates are dropped, the first-seen order is kept.
 */
public record MessageSelector(List<Long> messageIds) {

    public MessageSelector {
        messageIds = List.copyOf(new LinkedHashSet<>(messageIds));
    }

    public static MessageSelector ids(Collection<Long> messageIds) {
        return new MessageSelector(List.copyOf(messageIds));
    }

    public static MessageSelector id(long messageId) {
        return new MessageSelector(List.of(messageId));
    }

    public boolean isEmpty() {
        return messageIds.isEmpty();
    }

    public boolean matches(Message message) {
        return messageIds.contains(message.id());
    }
}
