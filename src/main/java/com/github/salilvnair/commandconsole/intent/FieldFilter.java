package com.github.salilvnair.commandconsole.intent;

import java.util.List;

/**
 * A single predicate on an entity field. For {@link FilterOperator#IN} the value is a list.
 */
public record FieldFilter(String field, FilterOperator operator, Object value) {

    public static FieldFilter eq(String field, Object value) {
        return new FieldFilter(field, FilterOperator.EQ, value);
    }

    /** Rows whose {@code field} points at a record owned by {@code ownerId}. */
    public static FieldFilter ownedBy(String field, String ownerId) {
        return new FieldFilter(field, FilterOperator.OWNED_BY, ownerId);
    }

    public static FieldFilter in(String field, List<?> values) {
        return new FieldFilter(field, FilterOperator.IN, List.copyOf(values));
    }
}
