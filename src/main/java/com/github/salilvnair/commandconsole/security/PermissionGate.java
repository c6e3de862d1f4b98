package com.github.salilvnair.commandconsole.security;

import com.github.salilvnair.commandconsole.intent.FieldFilter;
import com.github.salilvnair.commandconsole.intent.FilterOperator;
import com.github.salilvnair.commandconsole.intent.Intent;
import com.github.salilvnair.commandconsole.intent.IntentType;
import com.github.salilvnair.commandconsole.registry.EntityDescriptor;
import com.github.salilvnair.commandconsole.registry.FieldType;
import com.github.salilvnair.commandconsole.registry.OwnerLink;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;

/**
 * Role table lookup followed by the scope check. Has no side effects.
 */
@Component
@RequiredArgsConstructor
public class PermissionGate {

    private final PermissionMatrix permissionMatrix;

    public PermissionDecision check(Actor actor, Intent intent, EntityDescriptor entity) {
        if (actor == null || !permissionMatrix.knowsRole(actor.role())) {
            return PermissionDecision.deny(PermissionDecision.UNKNOWN_ROLE);
        }
        if (!permissionMatrix.allows(actor.role(), intent.type(), entity.name())) {
            return PermissionDecision.deny(PermissionDecision.ROLE_RESTRICTED);
        }
        ScopeRule scope = permissionMatrix.policy(actor.role())
                .map(PermissionMatrix.RolePolicy::scope)
                .orElse(ScopeRule.NONE);
        return switch (scope) {
            case NONE -> PermissionDecision.allow(Map.of());
            case OWNER -> checkOwnerScope(actor, intent, entity);
            case DEPARTMENT -> checkDepartmentScope(actor, intent, entity, PermissionDecision.DEPARTMENT_SCOPE_RESTRICTED);
        };
    }

    private PermissionDecision checkOwnerScope(Actor actor, Intent intent, EntityDescriptor entity) {
        Optional<String> ownerField = entity.owner();
        if (ownerField.isPresent()) {
            return restrictTo(intent, entity, ownerField.get(), actor.userId(), PermissionDecision.OWNER_SCOPE_RESTRICTED);
        }
        Optional<OwnerLink> link = entity.linkedOwner();
        if (link.isPresent()) {
            return restrictThroughLink(actor, intent, link.get());
        }
        return referenceDataOnly(intent, entity, PermissionDecision.OWNER_SCOPE_RESTRICTED);
    }

    // ownership of a new row, or of the row a link is re-pointed to, is not known without a lookup
    private PermissionDecision restrictThroughLink(Actor actor, Intent intent, OwnerLink link) {
        if (actor.userId() == null || actor.userId().isBlank()) {
            return PermissionDecision.deny(PermissionDecision.SCOPE_UNRESOLVED);
        }
        if (intent.type() == IntentType.CREATE || intent.values().containsKey(link.field())) {
            return PermissionDecision.deny(PermissionDecision.OWNER_SCOPE_RESTRICTED);
        }
        return PermissionDecision.allowWhere(FieldFilter.ownedBy(link.field(), actor.userId()));
    }

    private PermissionDecision checkDepartmentScope(Actor actor, Intent intent, EntityDescriptor entity, String reason) {
        Optional<String> departmentField = entity.department();
        if (departmentField.isPresent()) {
            return restrictTo(intent, entity, departmentField.get(), actor.department(), reason);
        }
        return referenceDataOnly(intent, entity, reason);
    }

    // entities with no ownership column are shared reference data: readable, never writable
    private PermissionDecision referenceDataOnly(Intent intent, EntityDescriptor entity, String reason) {
        if (intent.type().isWrite() || entity.sensitive()) {
            return PermissionDecision.deny(reason);
        }
        return PermissionDecision.allow(Map.of());
    }

    private PermissionDecision restrictTo(Intent intent, EntityDescriptor entity, String field, String expected, String reason) {
        if (expected == null || expected.isBlank()) {
            return PermissionDecision.deny(PermissionDecision.SCOPE_UNRESOLVED);
        }
        FieldType type = entity.fieldType(field);
        for (FieldFilter filter : intent.filtersOn(field)) {
            if (!withinScope(type, field, filter, expected)) {
                return PermissionDecision.deny(reason);
            }
        }
        if (intent.values().containsKey(field) && !sameScopeValue(type, field, intent.values().get(field), expected)) {
            return PermissionDecision.deny(reason);
        }
        return PermissionDecision.allow(Map.of(field, type.coerce(field, expected)));
    }

    private boolean withinScope(FieldType type, String field, FieldFilter filter, String expected) {
        if (filter.operator() == FilterOperator.EQ) {
            return sameScopeValue(type, field, filter.value(), expected);
        }
        if (filter.operator() == FilterOperator.IN && filter.value() instanceof Collection<?> candidates) {
            return !candidates.isEmpty() && candidates.stream().allMatch(candidate -> sameScopeValue(type, field, candidate, expected));
        }
        return false;
    }

    private boolean sameScopeValue(FieldType type, String field, Object actual, String expected) {
        if (actual == null) {
            return false;
        }
        if (type == FieldType.STRING) {
            return String.valueOf(actual).trim().equalsIgnoreCase(expected.trim());
        }
        return type.sameValue(field, actual, expected);
    }
}
