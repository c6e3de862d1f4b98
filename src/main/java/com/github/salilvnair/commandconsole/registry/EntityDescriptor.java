package com.github.salilvnair.commandconsole.registry;

import com.github.salilvnair.commandconsole.exception.CommandConsoleErrorCode;
import com.github.salilvnair.commandconsole.exception.CommandConsoleException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Registry entry for one data entity. Field names double as column names in {@code table}.
 *
 * @param vocabularies   per field, a phrase to canonical value map ("cse" to "CSE")
 * @param keywordFilters per keyword, the equality filters it stands for ("inactive" to is_active=false)
 */
public record EntityDescriptor(
        String name,
        String table,
        String idField,
        List<String> aliases,
        Map<String, FieldType> fields,
        Set<String> filterable,
        Set<String> writable,
        boolean sensitive,
        String ownerField,
        String departmentField,
        OwnerLink ownerLink,
        Map<String, Map<String, Object>> vocabularies,
        Map<String, Map<String, Object>> keywordFilters
) {

    public EntityDescriptor {
        aliases = aliases == null ? List.of() : List.copyOf(aliases);
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields == null ? Map.of() : fields));
        filterable = Collections.unmodifiableSet(new LinkedHashSet<>(filterable == null ? Set.of() : filterable));
        writable = Collections.unmodifiableSet(new LinkedHashSet<>(writable == null ? Set.of() : writable));
        vocabularies = copyNested(vocabularies);
        keywordFilters = copyNested(keywordFilters);
    }

    public boolean hasField(String field) {
        return field != null && fields.containsKey(field);
    }

    public boolean isFilterable(String field) {
        return field != null && (filterable.contains(field) || field.equals(idField));
    }

    public boolean isWritable(String field) {
        return field != null && writable.contains(field);
    }

    public FieldType fieldType(String field) {
        FieldType type = fields.get(field);
        if (type == null) {
            throw new CommandConsoleException(
                    CommandConsoleErrorCode.INVALID_FILTER,
                    "Field '" + field + "' is not defined for entity '" + name + "'"
            );
        }
        return type;
    }

    public Optional<String> owner() {
        return Optional.ofNullable(ownerField).filter(f -> !f.isBlank());
    }

    public Optional<String> department() {
        return Optional.ofNullable(departmentField).filter(f -> !f.isBlank());
    }

    public Optional<OwnerLink> linkedOwner() {
        return Optional.ofNullable(ownerLink);
    }

    public EntityDescriptor withOwnerLink(OwnerLink link) {
        return new EntityDescriptor(name, table, idField, aliases, fields, filterable, writable, sensitive,
                ownerField, departmentField, link, vocabularies, keywordFilters);
    }

    public Object canonicalValue(String field, Object raw) {
        if (raw == null) {
            return null;
        }
        Map<String, Object> vocabulary = vocabularies.get(field);
        if (vocabulary != null) {
            Object canonical = vocabulary.get(String.valueOf(raw).trim().toLowerCase(Locale.ROOT));
            if (canonical != null) {
                return canonical;
            }
        }
        return fieldType(field).coerce(field, raw);
    }

    private static Map<String, Map<String, Object>> copyNested(Map<String, Map<String, Object>> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        Map<String, Map<String, Object>> copy = new LinkedHashMap<>();
        source.forEach((key, value) -> copy.put(key, Collections.unmodifiableMap(new LinkedHashMap<>(value))));
        return Collections.unmodifiableMap(copy);
    }
}
