package com.github.salilvnair.commandconsole.intent;

import java.util.Locale;
import java.util.Optional;

public enum AggregateFunction {
    COUNT,
    AVG,
    SUM,
    MIN,
    MAX;

    public boolean needsField() {
        return this != COUNT;
    }

    public static Optional<AggregateFunction> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        if (normalized.equals("AVERAGE") || normalized.equals("MEAN")) {
            return Optional.of(AVG);
        }
        if (normalized.equals("TOTAL")) {
            return Optional.of(SUM);
        }
        for (AggregateFunction function : values()) {
            if (function.name().equals(normalized)) {
                return Optional.of(function);
            }
        }
        return Optional.empty();
    }
}
