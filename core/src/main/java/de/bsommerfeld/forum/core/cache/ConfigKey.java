package de.bsommerfeld.forum.core.cache;

import de.bsommerfeld.forum.core.domain.ConfigScope;
import de.bsommerfeld.forum.core.domain.ScopeSettings;

/** {@code config:{scope}:{ownerId}} → all option rows of one scope owner. */
public record ConfigKey(ConfigScope scope, long ownerId) implements CacheKey<ScopeSettings> {

    public static ConfigKey global() {
        return new ConfigKey(ConfigScope.GLOBAL, 0L);
    }

    public static ConfigKey of(ConfigScope scope, Long ownerId) {
        return new ConfigKey(scope, scope.ownerKey(ownerId));
    }

    @Override
    public String namespace() {
        return "config";
    }

    @Override
    public String render() {
        return namespace() + ":" + scope.name().toLowerCase() + ":" + ownerId;
    }
}
