package com.github.salilvnair.commandconsole.intent;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public record Intent(
        IntentType type,
        String entity,
        List<FieldFilter> filters,
        Map<String, Object> values,
        Aggregation aggregation,
        double confidence,
        boolean ambiguous,
        String clarificationQuestion,
        IntentSource source
) {

    public Intent {
        filters = filters == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(filters));
        values = values == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(values));
        confidence = Math.max(0.0, Math.min(1.0, confidence));
    }

    public Optional<FieldFilter> filter(String field) {
        return filters.stream().filter(f -> f.field().equals(field)).findFirst();
    }

    public List<FieldFilter> filtersOn(String field) {
        return filters.stream().filter(f -> f.field().equals(field)).toList();
    }

    public Intent withFilters(List<FieldFilter> newFilters) {
        return new Intent(type, entity, newFilters, values, aggregation, confidence, ambiguous, clarificationQuestion, source);
    }

    public Intent withValues(Map<String, Object> newValues) {
        return new Intent(type, entity, filters, newValues, aggregation, confidence, ambiguous, clarificationQuestion, source);
    }
}
