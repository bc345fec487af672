package com.example.perfoptimizer.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Audit trail entry for everything the optimizer changes on its own: rule firings,
 * rule actions, automated implementations, lifecycle and configuration changes.
 */
@Entity
@Table(name = "audit_logs", indexes = {
        @Index(name = "idx_audit_action", columnList = "action"),
        @Index(name = "idx_audit_target", columnList = "target"),
        @Index(name = "idx_audit_timestamp", columnList = "timestamp")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditLog {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    /** "orchestrator", "rule-engine", "implementer", "api" */
    @Column(nullable = false)
    private String actor;

    /** RULE_FIRED, RULE_ACTION, RULE_ROLLBACK, RECOMMENDATION_IMPLEMENTED, OPTIMIZER_STARTED,
     *  OPTIMIZER_STOPPED, CONFIG_CHANGED */
    @Column(nullable = false)
    private String action;

    /** Rule id, recommendation rule key, adapter name */
    private String target;

    /** JSON details */
    @Column(length = 8192)
    private String details;

    @Builder.Default
    private boolean success = true;

    @Column(nullable = false)
    private Instant timestamp;

    @PrePersist
    protected void onCreate() {
        if (timestamp == null) timestamp = Instant.now();
    }
}
