package de.bsommerfeld.forum.core.error;

/**
 * Thrown when the record store rejects a read or write. Never masked: a
 * failed multi-row write has been rolled back by the time this surfaces.
 */
public class StoreException extends ForumException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
