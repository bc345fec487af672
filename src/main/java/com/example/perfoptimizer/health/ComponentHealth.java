package com.example.perfoptimizer.health;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Locale;

@Value
@Builder
public class ComponentHealth {

    Status status;
    double score;
    @Builder.Default
    List<String> issues = List.of();
    Instant lastCheck;

    public enum Status {
        HEALTHY, DEGRADED, CRITICAL;

        /** Default banding for components without their own status rule. */
        public static Status fromScore(double score) {
            if (score >= 80) return HEALTHY;
            if (score >= 50) return DEGRADED;
            return CRITICAL;
        }

        @JsonValue
        public String getValue() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
