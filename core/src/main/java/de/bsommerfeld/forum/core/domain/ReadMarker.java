package de.bsommerfeld.forum.core.domain;

/**
 * Asserts that a user has read a message. Absence of a marker means unread,
 * so deleting markers in bulk marks many messages unread at once.
 */
public record ReadMarker(long userId, long messageId) {
}
