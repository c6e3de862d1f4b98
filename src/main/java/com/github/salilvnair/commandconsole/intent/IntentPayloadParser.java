package com.github.salilvnair.commandconsole.intent;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.salilvnair.commandconsole.exception.CommandConsoleErrorCode;
import com.github.salilvnair.commandconsole.exception.CommandConsoleException;
import com.github.salilvnair.commandconsole.registry.EntityDescriptor;
import com.github.salilvnair.commandconsole.registry.EntityRegistry;
import com.github.salilvnair.commandconsole.util.JsonUtil;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Maps the inference service's JSON answer onto an {@link Intent}. Anything that cannot be
 * matched against the registry makes the intent ambiguous instead of failing.
 */
@Component
@RequiredArgsConstructor
public class IntentPayloadParser {

    static final double DEFAULT_CONFIDENCE = 0.6;

    private final EntityRegistry entityRegistry;

    public Intent parse(JsonNode node) {
        List<String> problems = new ArrayList<>();

        String typeText = text(node, "intent_type", text(node, "intent", null));
        IntentType type = IntentType.parse(typeText).orElse(null);
        if (typeText != null && type == null) {
            problems.add("Unsupported operation '" + typeText + "'.");
        }

        String entityText = text(node, "entity", null);
        EntityDescriptor entity = entityRegistry.resolve(entityText).orElse(null);
        if (entityText != null && entity == null) {
            problems.add("Unknown record type '" + entityText + "'.");
        }

        List<FieldFilter> filters = new ArrayList<>();
        Map<String, Object> values = new LinkedHashMap<>();
        Aggregation aggregation = null;
        if (entity != null) {
            filters = parseFilters(node.path("filters"), entity, problems);
            values = parseValues(node.path("values"), entity, problems);
            aggregation = parseAggregation(node.path("aggregation"), entity, problems);
        }
        if (type == IntentType.ANALYZE && aggregation == null) {
            aggregation = Aggregation.count();
        }

        double confidence = node.path("confidence").isNumber() ? node.path("confidence").asDouble() : DEFAULT_CONFIDENCE;
        boolean ambiguous = node.path("ambiguous").asBoolean(false);
        String question = text(node, "clarification_question", text(node, "question", null));

        if (!problems.isEmpty()) {
            ambiguous = true;
            question = String.join(" ", problems) + " Please rephrase using known records and fields.";
        }
        else {
            Optional<String> gap = IntentGaps.question(type, entity, filters, values, aggregation, entityRegistry.entityNames());
            if (gap.isPresent()) {
                ambiguous = true;
                question = question == null ? gap.get() : question;
            }
        }
        if (ambiguous && (question == null || question.isBlank())) {
            question = "Could you describe the records and the change you want in more detail?";
        }

        return new Intent(
                type,
                entity == null ? null : entity.name(),
                filters,
                values,
                aggregation,
                confidence,
                ambiguous,
                ambiguous ? question : null,
                IntentSource.INFERENCE
        );
    }

    private List<FieldFilter> parseFilters(JsonNode filtersNode, EntityDescriptor entity, List<String> problems) {
        List<FieldFilter> filters = new ArrayList<>();
        if (filtersNode.isArray()) {
            for (JsonNode item : filtersNode) {
                String field = text(item, "field", null);
                String op = text(item, "op", text(item, "operator", "eq"));
                addFilter(filters, entity, field, op, item.path("value"), problems);
            }
            return filters;
        }
        if (!filtersNode.isObject()) {
            return filters;
        }
        Iterator<Map.Entry<String, JsonNode>> it = filtersNode.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            String key = entry.getKey();
            JsonNode value = entry.getValue();
            if (!entity.hasField(key)) {
                Optional<String[]> suffixed = splitOperatorSuffix(key, entity);
                if (suffixed.isPresent()) {
                    addFilter(filters, entity, suffixed.get()[0], suffixed.get()[1], value, problems);
                    continue;
                }
            }
            if (value.isObject() && (value.has("op") || value.has("operator"))) {
                addFilter(filters, entity, key, text(value, "op", text(value, "operator", "eq")), value.path("value"), problems);
            }
            else if (value.isObject()) {
                Iterator<Map.Entry<String, JsonNode>> ops = value.fields();
                while (ops.hasNext()) {
                    Map.Entry<String, JsonNode> op = ops.next();
                    addFilter(filters, entity, key, op.getKey(), op.getValue(), problems);
                }
            }
            else if (value.isArray()) {
                addFilter(filters, entity, key, "in", value, problems);
            }
            else {
                addFilter(filters, entity, key, "eq", value, problems);
            }
        }
        return filters;
    }

    // cgpa_lt -> [cgpa, lt]
    private Optional<String[]> splitOperatorSuffix(String key, EntityDescriptor entity) {
        int idx = key.lastIndexOf('_');
        if (idx <= 0) {
            return Optional.empty();
        }
        String field = key.substring(0, idx);
        String op = key.substring(idx + 1);
        if (entity.hasField(field) && FilterOperator.fromToken(op).isPresent()) {
            return Optional.of(new String[]{field, op});
        }
        return Optional.empty();
    }

    private void addFilter(List<FieldFilter> filters,
                           EntityDescriptor entity,
                           String field,
                           String opToken,
                           JsonNode valueNode,
                           List<String> problems) {
        if (field == null || !entity.isFilterable(field)) {
            problems.add("Field '" + field + "' cannot be used to filter " + entity.name() + ".");
            return;
        }
        Optional<FilterOperator> operator = FilterOperator.fromToken(opToken);
        if (operator.isEmpty()) {
            problems.add("Unsupported comparison '" + opToken + "' on " + field + ".");
            return;
        }
        try {
            if (operator.get() == FilterOperator.IN) {
                List<Object> candidates = new ArrayList<>();
                Iterable<JsonNode> elements = valueNode.isArray() ? valueNode : List.of(valueNode);
                for (JsonNode element : elements) {
                    Object candidate = entity.canonicalValue(field, JsonUtil.toValue(element));
                    if (candidate == null) {
                        throw new CommandConsoleException(
                                CommandConsoleErrorCode.INVALID_FILTER,
                                "The list of values for " + field + " contains an empty entry"
                        );
                    }
                    candidates.add(candidate);
                }
                filters.add(FieldFilter.in(field, candidates));
                return;
            }
            Object value = JsonUtil.toValue(valueNode);
            if (value == null) {
                problems.add("Missing value for filter on " + field + ".");
                return;
            }
            Object canonical = operator.get() == FilterOperator.LIKE ? String.valueOf(value) : entity.canonicalValue(field, value);
            filters.add(new FieldFilter(field, operator.get(), canonical));
        }
        catch (CommandConsoleException e) {
            problems.add(e.getMessage() + ".");
        }
    }

    private Map<String, Object> parseValues(JsonNode valuesNode, EntityDescriptor entity, List<String> problems) {
        Map<String, Object> values = new LinkedHashMap<>();
        if (!valuesNode.isObject()) {
            return values;
        }
        Iterator<Map.Entry<String, JsonNode>> it = valuesNode.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            String field = entry.getKey();
            if (!entity.isWritable(field)) {
                problems.add("Field '" + field + "' of " + entity.name() + " is not writable.");
                continue;
            }
            try {
                values.put(field, entity.canonicalValue(field, JsonUtil.toValue(entry.getValue())));
            }
            catch (CommandConsoleException e) {
                problems.add(e.getMessage() + ".");
            }
        }
        return values;
    }

    private Aggregation parseAggregation(JsonNode node, EntityDescriptor entity, List<String> problems) {
        if (node.isMissingNode() || node.isNull()) {
            return null;
        }
        String functionText = node.isTextual() ? node.asText() : text(node, "function", null);
        Optional<AggregateFunction> function = AggregateFunction.parse(functionText);
        if (function.isEmpty()) {
            problems.add("Unsupported aggregation '" + functionText + "'.");
            return null;
        }
        String field = node.isObject() ? text(node, "field", null) : null;
        if (field != null && (!entity.hasField(field) || !entity.fieldType(field).isNumeric())) {
            problems.add("Field '" + field + "' of " + entity.name() + " cannot be aggregated.");
            return null;
        }
        return new Aggregation(function.get(), function.get().needsField() ? field : null);
    }

    private static String text(JsonNode node, String field, String defaultValue) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull()) {
            return defaultValue;
        }
        String text = value.asText();
        return text == null || text.isBlank() ? defaultValue : text.trim();
    }
}
