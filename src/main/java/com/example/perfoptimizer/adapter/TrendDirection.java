package com.example.perfoptimizer.adapter;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum TrendDirection {
    IMPROVING, DEGRADING, STABLE;

    @JsonValue
    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static TrendDirection fromValue(String value) {
        return value == null ? STABLE : valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
