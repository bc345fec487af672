package com.example.perfoptimizer.event;

import com.example.perfoptimizer.orchestrator.OptimizationReport;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Fire-and-forget notification emitted by the orchestrator. Which fields are set depends on the type:
 * alert carries message and severity, incidentCreated adds source and automated,
 * optimizationCycleCompleted carries the report.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OrchestratorEvent {

    Type type;
    Instant timestamp;
    String message;
    String severity;
    String source;
    Boolean automated;
    OptimizationReport report;

    public static OrchestratorEvent started(Instant now) {
        return OrchestratorEvent.builder().type(Type.STARTED).timestamp(now).build();
    }

    public static OrchestratorEvent stopped(Instant now) {
        return OrchestratorEvent.builder().type(Type.STOPPED).timestamp(now).build();
    }

    public static OrchestratorEvent cycleCompleted(OptimizationReport report) {
        return OrchestratorEvent.builder()
                .type(Type.OPTIMIZATION_CYCLE_COMPLETED)
                .timestamp(report.getTimestamp())
                .report(report)
                .build();
    }

    public static OrchestratorEvent alert(String message, String severity, String source, Instant now) {
        return OrchestratorEvent.builder()
                .type(Type.ALERT)
                .timestamp(now)
                .message(message)
                .severity(severity)
                .source(source)
                .build();
    }

    public static OrchestratorEvent incidentCreated(String description, String severity, boolean automated,
                                                    String source, Instant now) {
        return OrchestratorEvent.builder()
                .type(Type.INCIDENT_CREATED)
                .timestamp(now)
                .message(description)
                .severity(severity)
                .automated(automated)
                .source(source)
                .build();
    }

    public enum Type {
        STARTED("started"),
        STOPPED("stopped"),
        OPTIMIZATION_CYCLE_COMPLETED("optimizationCycleCompleted"),
        ALERT("alert"),
        INCIDENT_CREATED("incidentCreated");

        private final String value;

        Type(String value) {
            this.value = value;
        }

        @JsonValue
        public String getValue() {
            return value;
        }
    }
}
