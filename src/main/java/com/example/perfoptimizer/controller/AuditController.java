package com.example.perfoptimizer.controller;

import com.example.perfoptimizer.domain.AuditLog;
import com.example.perfoptimizer.service.AuditService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read access to the audit trail of automated changes.
 */
@RestController
@RequestMapping("/api/audit")
@RequiredArgsConstructor
public class AuditController {

    private static final List<String> COUNTED_ACTIONS = List.of(
            "RULE_FIRED", "RULE_ACTION", "RULE_ROLLBACK", "RECOMMENDATION_IMPLEMENTED", "CONFIG_CHANGED");

    private final AuditService auditService;

    @GetMapping
    public ResponseEntity<List<AuditLog>> getAuditLogs(
            @RequestParam(required = false) String action,
            @RequestParam(required = false) String target,
            @RequestParam(defaultValue = "100") int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be positive");
        }
        return ResponseEntity.ok(auditService.filter(action, target, limit));
    }

    @GetMapping("/stats")
    public ResponseEntity<Map<String, Long>> getStats() {
        Map<String, Long> stats = new LinkedHashMap<>();
        for (String action : COUNTED_ACTIONS) {
            stats.put(action, auditService.countByAction(action));
        }
        return ResponseEntity.ok(stats);
    }
}
