package com.example.perfoptimizer.health;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Overall health band from the mean component score.
 */
public enum HealthBand {
    EXCELLENT(90), GOOD(75), WARNING(50), CRITICAL(0);

    private final double minScore;

    HealthBand(double minScore) {
        this.minScore = minScore;
    }

    public static HealthBand of(double score) {
        for (HealthBand band : values()) {
            if (score >= band.minScore) {
                return band;
            }
        }
        return CRITICAL;
    }

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
