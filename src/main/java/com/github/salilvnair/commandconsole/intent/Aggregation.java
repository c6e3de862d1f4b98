package com.github.salilvnair.commandconsole.intent;

public record Aggregation(AggregateFunction function, String field) {

    public static Aggregation count() {
        return new Aggregation(AggregateFunction.COUNT, null);
    }
}
