package de.bsommerfeld.forum.core.error;

/**
 * Thrown when an anchor message, a thread or another addressed entity does
 * not exist.
 */
public class NotFoundException extends ForumException {

    private final String entity;
    private final long id;

    public NotFoundException(String entity, long id) {
        super(entity + " " + id + " not found");
        this.entity = entity;
        this.id = id;
    }

    public static NotFoundException message(long id) {
        return new NotFoundException("message", id);
    }

    public static NotFoundException thread(long id) {
        return new NotFoundException("thread", id);
    }

    public String getEntity() {
        return entity;
    }

    public long getId() {
        return id;
    }
}
