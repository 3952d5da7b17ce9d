package de.bsommerfeld.forum.core.domain;

/**
 * One stored option row. At most one row exists per
 * {@code (scope, ownerId, name)}.
 *
 * @param scope   level of the option
 * @param ownerId forum or user id, ignored for {@link ConfigScope#GLOBAL}
 * @param name    option name, e.g. {@code pagination}
 * @param value   raw value; an empty string means "unset"
 */
public record ConfigOption(ConfigScope scope, Long ownerId, String name, String value) {
}
