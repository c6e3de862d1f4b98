package com.github.salilvnair.commandconsole.intent;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

public enum FilterOperator {
    EQ("=", Set.of("eq", "=", "==", "equals", "is")),
    NE("<>", Set.of("ne", "!=", "<>", "not", "neq")),
    LT("<", Set.of("lt", "<", "below", "under", "less_than")),
    LTE("<=", Set.of("lte", "<=", "le", "at_most")),
    GT(">", Set.of("gt", ">", "above", "over", "greater_than", "more_than")),
    GTE(">=", Set.of("gte", ">=", "ge", "at_least")),
    LIKE("LIKE", Set.of("like", "contains")),
    IN("IN", Set.of("in", "any_of")),
    /** Scope predicate added by the permission gate; never read from a message. */
    OWNED_BY("IN", Set.of());

    private final String sql;
    private final Set<String> tokens;

    FilterOperator(String sql, Set<String> tokens) {
        this.sql = sql;
        this.tokens = tokens;
    }

    public String sql() {
        return sql;
    }

    public static Optional<FilterOperator> fromToken(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        String normalized = token.trim().toLowerCase(Locale.ROOT).replace(' ', '_');
        for (FilterOperator operator : values()) {
            if (operator == OWNED_BY) {
                continue;
            }
            if (operator.name().equalsIgnoreCase(normalized) || operator.tokens.contains(normalized)) {
                return Optional.of(operator);
            }
        }
        return Optional.empty();
    }
}
