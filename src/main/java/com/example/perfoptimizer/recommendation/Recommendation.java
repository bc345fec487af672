package com.example.perfoptimizer.recommendation;

import com.example.perfoptimizer.adapter.AdapterName;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * A proposed remediation. Immutable: status changes produce a new instance via {@link #withStatus}.
 * {@code automationCommand} is set exactly when {@code automated} is true.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Recommendation {

    String id;

    /** Identity of the generating rule; at most one recommendation per key per cycle. */
    String ruleKey;

    Priority priority;
    Category category;
    String title;
    String description;
    Impact impact;
    Implementation implementation;
    String expectedOutcome;

    @With
    Status status;

    boolean automated;
    String automationCommand;
    Instant createdAt;

    public boolean isAutomatable() {
        return automated && status == Status.PENDING;
    }

    public enum Priority {
        CRITICAL(1), HIGH(7), MEDIUM(14), LOW(30);

        private final int dueDays;

        Priority(int dueDays) {
            this.dueDays = dueDays;
        }

        /** Days until an action item derived from this priority is due. */
        public int getDueDays() {
            return dueDays;
        }

        @JsonValue
        public String getValue() {
            return name().toLowerCase(Locale.ROOT);
        }

        @JsonCreator
        public static Priority fromValue(String value) {
            return valueOf(value.toUpperCase(Locale.ROOT));
        }
    }

    public enum Category {
        DATABASE(AdapterName.DATABASE),
        CACHE(AdapterName.CACHE),
        INFRASTRUCTURE(AdapterName.LOAD_BALANCER),
        APPLICATION(AdapterName.PERFORMANCE),
        MONITORING(null);

        private final AdapterName targetAdapter;

        Category(AdapterName targetAdapter) {
            this.targetAdapter = targetAdapter;
        }

        /** Adapter that receives automated commands for this category, if any. */
        public Optional<AdapterName> getTargetAdapter() {
            return Optional.ofNullable(targetAdapter);
        }

        @JsonValue
        public String getValue() {
            return name().toLowerCase(Locale.ROOT);
        }

        @JsonCreator
        public static Category fromValue(String value) {
            return valueOf(value.toUpperCase(Locale.ROOT));
        }
    }

    public enum Status {
        PENDING, APPROVED, IMPLEMENTED, REJECTED;

        @JsonValue
        public String getValue() {
            return name().toLowerCase(Locale.ROOT);
        }

        @JsonCreator
        public static Status fromValue(String value) {
            return valueOf(value.toUpperCase(Locale.ROOT));
        }
    }

    /** Qualitative tags: "low", "medium", "high". */
    @Value
    @Builder
    @Jacksonized
    public static class Impact {
        String performance;
        String cost;
        String risk;
    }

    @Value
    @Builder
    @Jacksonized
    public static class Implementation {
        String effort;
        String timeline;
        @Builder.Default
        List<String> steps = List.of();
    }
}
