package com.example.perfoptimizer.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Persisted record of an incidentCreated event, raised either by an automation rule
 * or by an operator.
 */
@Entity
@Table(name = "incidents")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Incident {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(nullable = false)
    private String title;

    @Column(length = 4096)
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private Severity severity;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private IncidentStatus status;

    /** Rule id or "api". */
    @Column(nullable = false)
    private String source;

    private boolean automated;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @Column(name = "resolved_at")
    private Instant resolvedAt;

    public enum Severity {
        CRITICAL, HIGH, MEDIUM, LOW, INFO;

        /** Unknown or missing severities map to MEDIUM. */
        public static Severity from(String value) {
            if (value == null) return MEDIUM;
            for (Severity severity : values()) {
                if (severity.name().equalsIgnoreCase(value.trim())) return severity;
            }
            return MEDIUM;
        }
    }

    public enum IncidentStatus {
        OPEN, ACKNOWLEDGED, RESOLVED, CLOSED
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
        updatedAt = createdAt;
        if (status == null) status = IncidentStatus.OPEN;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
}
