package com.github.salilvnair.commandconsole.security;

import com.github.salilvnair.commandconsole.intent.IntentType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable role table: for each role, its scope rule and the entities permitted per intent type.
 * An entity entry of {@code *} permits every entity.
 */
public final class PermissionMatrix {

    public static final String ANY_ENTITY = "*";

    private final Map<String, RolePolicy> roles;

    public PermissionMatrix(Map<String, RolePolicy> roles) {
        this.roles = Collections.unmodifiableMap(new LinkedHashMap<>(roles));
    }

    public boolean knowsRole(String role) {
        return role != null && roles.containsKey(role);
    }

    public Optional<RolePolicy> policy(String role) {
        return Optional.ofNullable(role == null ? null : roles.get(role));
    }

    public boolean allows(String role, IntentType type, String entity) {
        return policy(role)
                .map(policy -> {
                    Set<String> entities = policy.permissions().getOrDefault(type, Set.of());
                    return entities.contains(ANY_ENTITY) || entities.contains(entity);
                })
                .orElse(false);
    }

    public Set<String> roles() {
        return roles.keySet();
    }

    public record RolePolicy(ScopeRule scope, Map<IntentType, Set<String>> permissions) {

        public RolePolicy {
            scope = scope == null ? ScopeRule.NONE : scope;
            Map<IntentType, Set<String>> copy = new EnumMap<>(IntentType.class);
            if (permissions != null) {
                permissions.forEach((type, entities) -> copy.put(type, Set.copyOf(entities)));
            }
            permissions = Collections.unmodifiableMap(copy);
        }
    }
}
