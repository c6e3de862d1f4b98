package com.github.salilvnair.commandconsole.intent;

import java.util.Locale;
import java.util.Optional;

public enum IntentType {
    READ,
    CREATE,
    UPDATE,
    DELETE,
    ANALYZE;

    public boolean isWrite() {
        return this == CREATE || this == UPDATE || this == DELETE;
    }

    public static Optional<IntentType> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (IntentType type : values()) {
            if (type.name().equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
