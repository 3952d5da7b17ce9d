package de.bsommerfeld.forum.core.error;

/**
 * Thrown for degenerate self-referential operations, e.g. merging a tag into
 * itself. Always raised before anything is written.
 */
public class ConflictException extends ForumException {

    public ConflictException(String message) {
        super(message);
    }
}
