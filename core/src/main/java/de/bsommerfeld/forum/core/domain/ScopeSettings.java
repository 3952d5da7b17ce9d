package de.bsommerfeld.forum.core.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * All option rows of one scope owner, as cached by the config resolver. A
 * scope without any rows is represented by an empty instance rather than
 * {@code null} so that the absence itself can be cached.
 */
public record ScopeSettings(ConfigScope scope, long ownerId, Map<String, String> options) {

    public ScopeSettings {
        options = options == null || options.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(options));
    }

    public static ScopeSettings empty(ConfigScope scope, long ownerId) {
        return new ScopeSettings(scope, ownerId, Collections.emptyMap());
    }

    /** Raw stored value, {@code null} if no row exists. */
    public String raw(String name) {
        return options.get(name);
    }
}
