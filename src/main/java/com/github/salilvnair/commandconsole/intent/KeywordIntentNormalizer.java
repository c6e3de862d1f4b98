package com.github.salilvnair.commandconsole.intent;

import com.github.salilvnair.commandconsole.exception.CommandConsoleException;
import com.github.salilvnair.commandconsole.registry.EntityDescriptor;
import com.github.salilvnair.commandconsole.registry.EntityRegistry;
import com.github.salilvnair.commandconsole.registry.FieldType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Deterministic pattern matching over the message. Always answers, always with
 * {@link #KEYWORD_CONFIDENCE}, so its guesses never pass the clarification gate on their own.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class KeywordIntentNormalizer implements IntentNormalizer {

    static final double KEYWORD_CONFIDENCE = 0.5;

    private static final Pattern DELETE_VERBS = words("delete|remove|purge|erase|drop");
    private static final Pattern UPDATE_VERBS = words("update|change|modify|set|edit|rename|promote");
    private static final Pattern CREATE_VERBS = words("create|add|insert|register|enroll|enrol");
    private static final Pattern ANALYZE_VERBS = words("count|how many|average|avg|mean|sum|total|minimum|maximum|lowest|highest|analy[sz]e|statistics|stats");

    private static final Pattern AVG_WORDS = words("average|avg|mean");
    private static final Pattern SUM_WORDS = words("sum|total");
    private static final Pattern MIN_WORDS = words("minimum|min|lowest");
    private static final Pattern MAX_WORDS = words("maximum|max|highest");

    private static final String NUMBER = "(-?\\d+(?:\\.\\d+)?)";
    private static final String TOKEN = "([\\w.@-]+)";

    private static final Map<String, FilterOperator> COMPARATORS = new LinkedHashMap<>();
    static {
        COMPARATORS.put("less than or equal to", FilterOperator.LTE);
        COMPARATORS.put("greater than or equal to", FilterOperator.GTE);
        COMPARATORS.put("at most", FilterOperator.LTE);
        COMPARATORS.put("at least", FilterOperator.GTE);
        COMPARATORS.put("less than", FilterOperator.LT);
        COMPARATORS.put("lower than", FilterOperator.LT);
        COMPARATORS.put("greater than", FilterOperator.GT);
        COMPARATORS.put("more than", FilterOperator.GT);
        COMPARATORS.put("higher than", FilterOperator.GT);
        COMPARATORS.put("below", FilterOperator.LT);
        COMPARATORS.put("under", FilterOperator.LT);
        COMPARATORS.put("above", FilterOperator.GT);
        COMPARATORS.put("over", FilterOperator.GT);
        COMPARATORS.put("<=", FilterOperator.LTE);
        COMPARATORS.put(">=", FilterOperator.GTE);
        COMPARATORS.put("<", FilterOperator.LT);
        COMPARATORS.put(">", FilterOperator.GT);
    }
    private static final String COMPARATOR_ALTERNATION = COMPARATORS.keySet().stream()
            .map(Pattern::quote)
            .collect(Collectors.joining("|"));

    private static final Set<String> STOPWORDS = Set.of(
            "to", "for", "in", "with", "of", "is", "are", "the", "and", "or", "where", "whose", "who",
            "which", "that", "by", "from", "as", "at", "on", "all", "below", "under", "above", "over",
            "less", "more", "greater", "higher", "lower", "than", "equal", "between", "not"
    );

    private final EntityRegistry entityRegistry;

    @Override
    public Intent normalize(NormalizationRequest request) {
        String message = request.message() == null ? "" : request.message().trim();
        try {
            return interpret(message);
        }
        catch (RuntimeException e) {
            log.warn("Keyword intent matching failed, asking for clarification. msg={}", e.getMessage());
            return new Intent(null, null, List.of(), Map.of(), null, KEYWORD_CONFIDENCE, true,
                    "Could you rephrase the instruction with the record type and the records it applies to?",
                    IntentSource.KEYWORD);
        }
    }

    private Intent interpret(String message) {
        IntentType type = detectType(message);
        EntityDescriptor entity = detectEntity(message).orElse(null);

        List<FieldFilter> filters = new ArrayList<>();
        Map<String, Object> values = new LinkedHashMap<>();
        Aggregation aggregation = null;
        List<String> problems = new ArrayList<>();

        if (entity != null) {
            List<int[]> consumed = new ArrayList<>();
            if (type == IntentType.CREATE || type == IntentType.UPDATE) {
                collectAssignments(message, entity, values, consumed, problems);
            }
            if (type == IntentType.CREATE) {
                collectEqualities(message, entity, entity.writable(), consumed, problems)
                        .forEach(f -> values.putIfAbsent(f.field(), f.value()));
            }
            else {
                collectComparisons(message, entity, filters, consumed, problems);
                for (FieldFilter filter : collectEqualities(message, entity, entity.filterable(), consumed, problems)) {
                    addIfAbsent(filters, filter);
                }
                collectVocabulary(message, entity, filters, consumed);
                collectKeywordFilters(message, entity, filters, problems);
            }
            if (type == IntentType.ANALYZE) {
                aggregation = detectAggregation(message, entity);
            }
        }

        Optional<String> gap = problems.isEmpty()
                ? IntentGaps.question(type, entity, filters, values, aggregation, entityRegistry.entityNames())
                : Optional.of(String.join(" ", problems));

        return new Intent(
                type,
                entity == null ? null : entity.name(),
                filters,
                values,
                aggregation,
                KEYWORD_CONFIDENCE,
                gap.isPresent(),
                gap.orElse(null),
                IntentSource.KEYWORD
        );
    }

    IntentType detectType(String message) {
        if (DELETE_VERBS.matcher(message).find()) {
            return IntentType.DELETE;
        }
        if (UPDATE_VERBS.matcher(message).find()) {
            return IntentType.UPDATE;
        }
        if (CREATE_VERBS.matcher(message).find()) {
            return IntentType.CREATE;
        }
        if (ANALYZE_VERBS.matcher(message).find()) {
            return IntentType.ANALYZE;
        }
        return IntentType.READ;
    }

    // earliest mention wins, longer phrase on a tie
    Optional<EntityDescriptor> detectEntity(String message) {
        int bestStart = Integer.MAX_VALUE;
        String bestEntity = null;
        for (Map.Entry<String, String> phrase : entityRegistry.phrases()) {
            Matcher matcher = phrasePattern(phrase.getKey()).matcher(message);
            if (matcher.find() && matcher.start() < bestStart) {
                bestStart = matcher.start();
                bestEntity = phrase.getValue();
            }
        }
        return entityRegistry.resolve(bestEntity);
    }

    private void collectAssignments(String message,
                                    EntityDescriptor entity,
                                    Map<String, Object> values,
                                    List<int[]> consumed,
                                    List<String> problems) {
        for (String field : entity.writable()) {
            Pattern pattern = Pattern.compile(
                    "\\b" + label(field) + "(?:\\s*=\\s*|\\s+(?:to|as)\\s+)" + TOKEN,
                    Pattern.CASE_INSENSITIVE
            );
            Matcher matcher = pattern.matcher(message);
            if (matcher.find()) {
                try {
                    values.put(field, entity.canonicalValue(field, matcher.group(1)));
                    consumed.add(new int[]{matcher.start(), matcher.end()});
                }
                catch (CommandConsoleException e) {
                    problems.add(e.getMessage() + ".");
                }
            }
        }
    }

    private void collectComparisons(String message,
                                    EntityDescriptor entity,
                                    List<FieldFilter> filters,
                                    List<int[]> consumed,
                                    List<String> problems) {
        for (String field : entity.filterable()) {
            FieldType type = entity.fieldType(field);
            if (!type.isNumeric()) {
                continue;
            }
            Pattern pattern = Pattern.compile(
                    "\\b" + label(field) + "\\s+(?:is\\s+)?(" + COMPARATOR_ALTERNATION + ")\\s*" + NUMBER,
                    Pattern.CASE_INSENSITIVE
            );
            Matcher matcher = pattern.matcher(message);
            while (matcher.find()) {
                if (overlaps(consumed, matcher.start(), matcher.end())) {
                    continue;
                }
                FilterOperator operator = COMPARATORS.get(matcher.group(1).toLowerCase(Locale.ROOT));
                try {
                    filters.add(new FieldFilter(field, operator, type.coerce(field, matcher.group(2))));
                    consumed.add(new int[]{matcher.start(), matcher.end()});
                }
                catch (CommandConsoleException e) {
                    problems.add(e.getMessage() + ".");
                }
            }
        }
    }

    private List<FieldFilter> collectEqualities(String message,
                                                EntityDescriptor entity,
                                                Set<String> fields,
                                                List<int[]> consumed,
                                                List<String> problems) {
        List<FieldFilter> found = new ArrayList<>();
        for (String field : fields) {
            FieldType type = entity.fieldType(field);
            Pattern pattern = Pattern.compile(
                    "\\b" + label(field) + "\\b\\s*(?:=|:|\\bis\\b|\\bof\\b)?\\s*" + TOKEN,
                    Pattern.CASE_INSENSITIVE
            );
            Matcher matcher = pattern.matcher(message);
            while (matcher.find()) {
                String token = matcher.group(1);
                if (overlaps(consumed, matcher.start(), matcher.end()) || STOPWORDS.contains(token.toLowerCase(Locale.ROOT))) {
                    continue;
                }
                if (!acceptsToken(type, token)) {
                    continue;
                }
                try {
                    found.add(FieldFilter.eq(field, entity.canonicalValue(field, token)));
                    consumed.add(new int[]{matcher.start(), matcher.end()});
                }
                catch (CommandConsoleException e) {
                    problems.add(e.getMessage() + ".");
                }
                break;
            }
        }
        return found;
    }

    private void collectVocabulary(String message, EntityDescriptor entity, List<FieldFilter> filters, List<int[]> consumed) {
        entity.vocabularies().forEach((field, phrases) -> {
            if (!entity.isFilterable(field)) {
                return;
            }
            for (Map.Entry<String, Object> phrase : phrases.entrySet()) {
                Matcher matcher = phrasePattern(phrase.getKey()).matcher(message);
                while (matcher.find()) {
                    if (!overlaps(consumed, matcher.start(), matcher.end())) {
                        addIfAbsent(filters, FieldFilter.eq(field, phrase.getValue()));
                        return;
                    }
                }
            }
        });
    }

    private void collectKeywordFilters(String message, EntityDescriptor entity, List<FieldFilter> filters, List<String> problems) {
        List<String> keywords = new ArrayList<>(entity.keywordFilters().keySet());
        keywords.sort(Comparator.comparingInt(String::length).reversed());
        for (String keyword : keywords) {
            if (!phrasePattern(keyword).matcher(message).find()) {
                continue;
            }
            entity.keywordFilters().get(keyword).forEach((field, value) -> {
                try {
                    addIfAbsent(filters, FieldFilter.eq(field, entity.canonicalValue(field, value)));
                }
                catch (CommandConsoleException e) {
                    problems.add(e.getMessage() + ".");
                }
            });
        }
    }

    private Aggregation detectAggregation(String message, EntityDescriptor entity) {
        AggregateFunction function = AggregateFunction.COUNT;
        if (AVG_WORDS.matcher(message).find()) {
            function = AggregateFunction.AVG;
        }
        else if (SUM_WORDS.matcher(message).find()) {
            function = AggregateFunction.SUM;
        }
        else if (MIN_WORDS.matcher(message).find()) {
            function = AggregateFunction.MIN;
        }
        else if (MAX_WORDS.matcher(message).find()) {
            function = AggregateFunction.MAX;
        }
        if (!function.needsField()) {
            return Aggregation.count();
        }
        String field = null;
        int bestStart = Integer.MAX_VALUE;
        for (Map.Entry<String, FieldType> entry : entity.fields().entrySet()) {
            if (!entry.getValue().isNumeric() || entry.getKey().equals(entity.idField())) {
                continue;
            }
            Matcher matcher = Pattern.compile("\\b" + label(entry.getKey()) + "\\b", Pattern.CASE_INSENSITIVE).matcher(message);
            if (matcher.find() && matcher.start() < bestStart) {
                bestStart = matcher.start();
                field = entry.getKey();
            }
        }
        return new Aggregation(function, field);
    }

    private static boolean acceptsToken(FieldType type, String token) {
        try {
            type.coerce("token", token);
            return true;
        }
        catch (CommandConsoleException e) {
            return false;
        }
    }

    private static void addIfAbsent(List<FieldFilter> filters, FieldFilter filter) {
        boolean present = filters.stream().anyMatch(f -> f.field().equals(filter.field()));
        if (!present) {
            filters.add(filter);
        }
    }

    private static boolean overlaps(List<int[]> consumed, int start, int end) {
        for (int[] span : consumed) {
            if (start < span[1] && end > span[0]) {
                return true;
            }
        }
        return false;
    }

    // field names use underscores, messages use spaces
    private static String label(String field) {
        return Pattern.quote(field).replace("_", "\\E[\\s_]\\Q");
    }

    private static Pattern phrasePattern(String phrase) {
        return Pattern.compile("\\b" + label(phrase) + "\\b", Pattern.CASE_INSENSITIVE);
    }

    private static Pattern words(String alternatives) {
        return Pattern.compile("\\b(?:" + alternatives + ")\\b", Pattern.CASE_INSENSITIVE);
    }
}
