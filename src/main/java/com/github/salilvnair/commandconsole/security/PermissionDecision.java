package com.github.salilvnair.commandconsole.security;

import com.github.salilvnair.commandconsole.intent.FieldFilter;
import com.github.salilvnair.commandconsole.intent.Intent;
import com.github.salilvnair.commandconsole.intent.IntentType;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of the permission gate. An allowed decision may carry scope predicates that narrow
 * the intent to the actor's own rows or department: field equalities in {@code scope}, and in
 * {@code conditions} predicates that are not plain equalities (ownership through a link).
 */
public record PermissionDecision(boolean allowed, String reason, Map<String, Object> scope, List<FieldFilter> conditions) {

    public static final String OK = "OK";
    public static final String UNKNOWN_ROLE = "UNKNOWN_ROLE";
    public static final String ROLE_RESTRICTED = "ROLE_RESTRICTED";
    public static final String OWNER_SCOPE_RESTRICTED = "OWNER_SCOPE_RESTRICTED";
    public static final String DEPARTMENT_SCOPE_RESTRICTED = "DEPARTMENT_SCOPE_RESTRICTED";
    public static final String SCOPE_UNRESOLVED = "SCOPE_UNRESOLVED";

    public PermissionDecision {
        scope = scope == null ? Map.of() : Map.copyOf(scope);
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
    }

    public static PermissionDecision allow(Map<String, Object> scope) {
        return new PermissionDecision(true, OK, scope, List.of());
    }

    public static PermissionDecision allowWhere(FieldFilter condition) {
        return new PermissionDecision(true, OK, Map.of(), List.of(condition));
    }

    public static PermissionDecision deny(String reason) {
        return new PermissionDecision(false, reason, Map.of(), List.of());
    }

    /**
     * Adds the scope predicates to the intent. CREATE gets them as values of the new row.
     */
    public Intent narrow(Intent intent) {
        if (!allowed || (scope.isEmpty() && conditions.isEmpty())) {
            return intent;
        }
        List<FieldFilter> filters = new ArrayList<>(intent.filters());
        Map<String, Object> values = new LinkedHashMap<>(intent.values());
        scope.forEach((field, value) -> {
            if (intent.type() == IntentType.CREATE) {
                values.putIfAbsent(field, value);
            }
            else if (intent.filter(field).isEmpty()) {
                filters.add(FieldFilter.eq(field, value));
            }
        });
        filters.addAll(conditions);
        return intent.withFilters(filters).withValues(values);
    }
}
