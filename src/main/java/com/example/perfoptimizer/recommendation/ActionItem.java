package com.example.perfoptimizer.recommendation;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.UUID;

/**
 * Human follow-up for a recommendation that cannot be automated.
 * {@code recommendationId} is a lookup key only.
 */
@Value
@Builder
@Jacksonized
public class ActionItem {

    String id;
    String recommendationId;
    String title;
    Instant dueDate;
    Status status;
    Recommendation.Priority priority;
    String assignedTo;
    String notes;

    public static ActionItem from(Recommendation recommendation, Instant now) {
        return ActionItem.builder()
                .id(UUID.randomUUID().toString())
                .recommendationId(recommendation.getId())
                .title(recommendation.getTitle())
                .dueDate(now.plus(recommendation.getPriority().getDueDays(), ChronoUnit.DAYS))
                .status(Status.OPEN)
                .priority(recommendation.getPriority())
                .notes(recommendation.getExpectedOutcome())
                .build();
    }

    public enum Status {
        OPEN, IN_PROGRESS, COMPLETED, BLOCKED;

        @JsonValue
        public String getValue() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
