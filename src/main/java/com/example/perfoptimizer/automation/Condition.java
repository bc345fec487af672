package com.example.perfoptimizer.automation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Trigger comparison. Accepts the short spellings (gt, lt, eq) and the long ones
 * (greater_than, less_than, equals).
 */
public enum Condition {
    GREATER_THAN("greater_than", "gt"),
    LESS_THAN("less_than", "lt"),
    EQUALS("equals", "eq"),
    PATTERN("pattern", "pattern");

    static final double EQUALS_TOLERANCE = 0.01;

    private final String value;
    private final String shortValue;

    Condition(String value, String shortValue) {
        this.value = value;
        this.shortValue = shortValue;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean test(double actual, double expected) {
        return switch (this) {
            case GREATER_THAN -> actual > expected;
            case LESS_THAN -> actual < expected;
            case EQUALS -> Math.abs(actual - expected) < EQUALS_TOLERANCE;
            case PATTERN -> false;
        };
    }

    @JsonCreator
    public static Condition from(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Condition must not be null");
        }
        String normalized = text.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (Condition condition : values()) {
            if (condition.value.equals(normalized) || condition.shortValue.equals(normalized)) {
                return condition;
            }
        }
        throw new IllegalArgumentException("Unknown condition: " + text);
    }
}
