package de.bsommerfeld.forum.core.error;

/**
 * Thrown for malformed mutation input. {@link #getField()} names the offending
 * parameter so a form can be redisplayed with the error attached.
 */
public class ValidationException extends ForumException {

    private final String field;

    public ValidationException(String field, String message) {
        super(field + ": " + message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
