package com.github.salilvnair.commandconsole.data;

import com.github.salilvnair.commandconsole.exception.CommandConsoleErrorCode;
import com.github.salilvnair.commandconsole.exception.CommandConsoleException;
import com.github.salilvnair.commandconsole.intent.FieldFilter;
import com.github.salilvnair.commandconsole.intent.FilterOperator;
import com.github.salilvnair.commandconsole.registry.EntityDescriptor;
import com.github.salilvnair.commandconsole.registry.FieldType;
import com.github.salilvnair.commandconsole.registry.OwnerLink;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

final class SqlFilterTranslator {

    private static final Pattern IDENTIFIER_PATTERN = Pattern.compile("^[a-zA-Z_][a-zA-Z0-9_]*(\\.[a-zA-Z_][a-zA-Z0-9_]*)?$");

    private SqlFilterTranslator() {
    }

    static String identifier(String value) {
        if (value == null || !IDENTIFIER_PATTERN.matcher(value).matches()) {
            throw new IllegalArgumentException("Unsafe SQL identifier: " + value);
        }
        return value;
    }

    static String column(EntityDescriptor entity, String field) {
        if (!entity.hasField(field)) {
            throw new CommandConsoleException(
                    CommandConsoleErrorCode.INVALID_FILTER,
                    "Field '" + field + "' is not defined for entity '" + entity.name() + "'"
            );
        }
        return identifier(field);
    }

    /**
     * Renders {@code filters} as a WHERE clause (empty string for no filters) and binds
     * their coerced values into {@code params} as f0, f1, ...
     */
    static String where(EntityDescriptor entity, List<FieldFilter> filters, MapSqlParameterSource params) {
        if (filters == null || filters.isEmpty()) {
            return "";
        }
        List<String> predicates = new ArrayList<>();
        int index = 0;
        for (FieldFilter filter : filters) {
            String column = column(entity, filter.field());
            String param = "f" + index++;
            FieldType type = entity.fieldType(filter.field());
            FilterOperator operator = filter.operator() == null ? FilterOperator.EQ : filter.operator();
            switch (operator) {
                case IN -> {
                    List<Object> values = new ArrayList<>();
                    if (filter.value() instanceof Collection<?> candidates) {
                        candidates.forEach(v -> values.add(type.coerce(filter.field(), v)));
                    }
                    else {
                        values.add(type.coerce(filter.field(), filter.value()));
                    }
                    if (values.isEmpty()) {
                        predicates.add("1 = 0");
                        continue;
                    }
                    params.addValue(param, values);
                    predicates.add(column + " IN (:" + param + ")");
                }
                case OWNED_BY -> {
                    OwnerLink link = entity.linkedOwner()
                            .filter(candidate -> candidate.field().equals(filter.field()))
                            .orElseThrow(() -> new CommandConsoleException(
                                    CommandConsoleErrorCode.INVALID_FILTER,
                                    "Field '" + filter.field() + "' of '" + entity.name() + "' does not link to an owner"
                            ));
                    params.addValue(param, link.ownerType().coerce(link.ownerField(), filter.value()));
                    predicates.add(column + " IN (SELECT " + identifier(link.keyField())
                            + " FROM " + identifier(link.targetTable())
                            + " WHERE " + identifier(link.ownerField()) + " = :" + param + ")");
                }
                case LIKE -> {
                    String pattern = String.valueOf(filter.value()).toLowerCase(Locale.ROOT);
                    params.addValue(param, pattern.contains("%") ? pattern : "%" + pattern + "%");
                    predicates.add("LOWER(" + column + ") LIKE :" + param);
                }
                default -> {
                    if (filter.value() == null) {
                        predicates.add(column + (operator == FilterOperator.NE ? " IS NOT NULL" : " IS NULL"));
                        continue;
                    }
                    params.addValue(param, type.coerce(filter.field(), filter.value()));
                    predicates.add(column + " " + operator.sql() + " :" + param);
                }
            }
        }
        return " WHERE " + String.join(" AND ", predicates);
    }
}
