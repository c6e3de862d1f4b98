package com.github.salilvnair.commandconsole.registry;

import com.github.salilvnair.commandconsole.exception.CommandConsoleErrorCode;
import com.github.salilvnair.commandconsole.exception.CommandConsoleException;

import java.math.BigDecimal;
import java.sql.Date;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

public enum FieldType {
    STRING,
    INTEGER,
    DECIMAL,
    BOOLEAN,
    DATE,
    DATETIME;

    private static final Set<String> TRUE_TOKENS = Set.of("true", "yes", "y", "1", "active", "present");
    private static final Set<String> FALSE_TOKENS = Set.of("false", "no", "n", "0", "inactive", "absent");

    public boolean isNumeric() {
        return this == INTEGER || this == DECIMAL;
    }

    /**
     * Converts a loosely typed value (inference output, stored snapshot, user text) into the
     * Java type bound as a JDBC parameter for this field.
     */
    public Object coerce(String field, Object raw) {
        if (raw == null) {
            return null;
        }
        try {
            return switch (this) {
                case STRING -> String.valueOf(raw);
                case INTEGER -> Long.valueOf(new BigDecimal(text(raw)).longValueExact());
                case DECIMAL -> raw instanceof BigDecimal d ? d : new BigDecimal(text(raw));
                case BOOLEAN -> toBoolean(raw);
                case DATE -> toDate(raw);
                case DATETIME -> toDateTime(raw);
            };
        }
        catch (NumberFormatException | ArithmeticException | DateTimeParseException e) {
            throw new CommandConsoleException(
                    CommandConsoleErrorCode.INVALID_FILTER,
                    "Value '" + raw + "' is not a valid " + name().toLowerCase(Locale.ROOT) + " for field '" + field + "'",
                    e
            );
        }
    }

    /**
     * Normalizes a value read from the data store into a JSON friendly snapshot value.
     */
    public Object normalize(Object dbValue) {
        if (dbValue == null) {
            return null;
        }
        return switch (this) {
            case STRING -> String.valueOf(dbValue);
            case INTEGER -> dbValue instanceof Number n ? Long.valueOf(n.longValue()) : dbValue;
            case DECIMAL -> dbValue instanceof BigDecimal d ? d : dbValue instanceof Number n ? new BigDecimal(n.toString()) : dbValue;
            case BOOLEAN -> dbValue instanceof Boolean ? dbValue : toBoolean(dbValue);
            case DATE -> dbValue instanceof Date d ? d.toLocalDate().toString() : String.valueOf(dbValue);
            case DATETIME -> dbValue instanceof Timestamp t ? t.toLocalDateTime().toString() : String.valueOf(dbValue);
        };
    }

    /**
     * Compares two values after coercion, so that 5.5 and 5.50 or "2024-01-01" and a
     * LocalDate of the same day are considered equal.
     */
    public boolean sameValue(String field, Object left, Object right) {
        if (left == null || right == null) {
            return left == null && right == null;
        }
        Object l = coerce(field, left);
        Object r = coerce(field, right);
        if (l instanceof BigDecimal ld && r instanceof BigDecimal rd) {
            return ld.compareTo(rd) == 0;
        }
        return Objects.equals(l, r);
    }

    private static String text(Object raw) {
        return String.valueOf(raw).trim();
    }

    private static Boolean toBoolean(Object raw) {
        if (raw instanceof Boolean b) {
            return b;
        }
        if (raw instanceof Number n) {
            return n.intValue() != 0;
        }
        String token = text(raw).toLowerCase(Locale.ROOT);
        if (TRUE_TOKENS.contains(token)) {
            return Boolean.TRUE;
        }
        if (FALSE_TOKENS.contains(token)) {
            return Boolean.FALSE;
        }
        throw new NumberFormatException("Not a boolean: " + raw);
    }

    private static LocalDate toDate(Object raw) {
        if (raw instanceof LocalDate d) {
            return d;
        }
        if (raw instanceof Date d) {
            return d.toLocalDate();
        }
        if (raw instanceof LocalDateTime dt) {
            return dt.toLocalDate();
        }
        String value = text(raw);
        return LocalDate.parse(value.length() > 10 ? value.substring(0, 10) : value);
    }

    private static LocalDateTime toDateTime(Object raw) {
        if (raw instanceof LocalDateTime dt) {
            return dt;
        }
        if (raw instanceof Timestamp t) {
            return t.toLocalDateTime();
        }
        if (raw instanceof OffsetDateTime odt) {
            return odt.toLocalDateTime();
        }
        String value = text(raw);
        if (value.length() == 10) {
            return LocalDate.parse(value).atStartOfDay();
        }
        return LocalDateTime.parse(value.replace(' ', 'T'));
    }
}
