package de.bsommerfeld.forum.core.error;

/**
 * Base of every failure the forum core reports to its callers. Subclasses
 * carry enough structure for a web layer to decide between redisplaying a
 * form and answering "not found".
 */
public abstract class ForumException extends RuntimeException {

    protected ForumException(String message) {
        super(message);
    }

    protected ForumException(String message, Throwable cause) {
        super(message, cause);
    }
}
