package com.github.salilvnair.commandconsole.execution;

import com.github.salilvnair.commandconsole.intent.AggregateFunction;
import com.github.salilvnair.commandconsole.intent.Aggregation;
import lombok.experimental.UtilityClass;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@UtilityClass
public final class AnalysisCalculator {

    private static final int AVG_SCALE = 4;

    public static Map<String, Object> compute(Aggregation aggregation, List<Map<String, Object>> rows) {
        Aggregation effective = aggregation == null ? Aggregation.count() : aggregation;
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("function", effective.function().name());
        result.put("field", effective.field());
        result.put("row_count", rows.size());

        if (effective.function() == AggregateFunction.COUNT || effective.field() == null) {
            result.put("value", rows.size());
            return result;
        }

        List<BigDecimal> numbers = new ArrayList<>();
        for (Map<String, Object> row : rows) {
            Object value = row.get(effective.field());
            if (value != null) {
                numbers.add(new BigDecimal(value.toString()));
            }
        }
        result.put("value", numbers.isEmpty() ? null : aggregate(effective.function(), numbers));
        return result;
    }

    private static BigDecimal aggregate(AggregateFunction function, List<BigDecimal> numbers) {
        return switch (function) {
            case SUM -> numbers.stream().reduce(BigDecimal.ZERO, BigDecimal::add);
            case AVG -> numbers.stream().reduce(BigDecimal.ZERO, BigDecimal::add)
                    .divide(BigDecimal.valueOf(numbers.size()), AVG_SCALE, RoundingMode.HALF_UP);
            case MIN -> numbers.stream().min(BigDecimal::compareTo).orElse(null);
            case MAX -> numbers.stream().max(BigDecimal::compareTo).orElse(null);
            case COUNT -> BigDecimal.valueOf(numbers.size());
        };
    }
}
