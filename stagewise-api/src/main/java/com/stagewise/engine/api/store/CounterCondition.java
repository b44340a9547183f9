package com.stagewise.engine.api.store;

/**
 * Predicate on the current value of a counter, evaluated by the store as part
 * of the same atomic operation as the increment. Restricted to comparisons a
 * durable store can express natively.
 */
public record CounterCondition(Comparison comparison, long operand) {

    public enum Comparison {
        EQUAL_TO,
        LESS_THAN
    }

    public static CounterCondition equalTo(long expected) {
        return new CounterCondition(Comparison.EQUAL_TO, expected);
    }

    public static CounterCondition lessThan(long limit) {
        return new CounterCondition(Comparison.LESS_THAN, limit);
    }

    public boolean test(long current) {
        return switch (comparison) {
            case EQUAL_TO -> current == operand;
            case LESS_THAN -> current < operand;
        };
    }
}
