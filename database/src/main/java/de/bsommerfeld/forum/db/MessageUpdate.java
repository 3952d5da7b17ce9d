package de.bsommerfeld.forum.db;

/**
 * One {@code update_where(selector, patch)} step of an atomic multi-step
 * store write, see {@link RecordStore#updateAll}.
 */
public record MessageUpdate(MessageSelector selector, MessagePatch patch) {
}
