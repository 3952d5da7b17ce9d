package de.bsommerfeld.forum.core.domain;

/**
 * Level at which a configuration option is set. Resolution walks from the
 * most specific scope ({@link #USER}) to the most general one
 * ({@link #GLOBAL}).
 */
public enum ConfigScope {

    GLOBAL,
    FORUM,
    USER;

    /**
     * Owner identifier used for rows of this scope. Global options have no
     * owner and are stored under {@code 0}.
     */
    public long ownerKey(Long ownerId) {
        if (this == GLOBAL) {
            return 0L;
        }
        if (ownerId == null) {
            throw new IllegalArgumentException(name() + " scope requires an owner id");
        }
        return ownerId;
    }
}
