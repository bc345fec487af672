package com.example.perfoptimizer.controller;

import com.example.perfoptimizer.adapter.AdapterName;
import com.example.perfoptimizer.health.ComponentHealth;
import com.example.perfoptimizer.health.SystemHealth;
import com.example.perfoptimizer.orchestrator.OptimizationOrchestrator;
import com.example.perfoptimizer.orchestrator.OptimizationReport;
import com.example.perfoptimizer.orchestrator.OptimizerConfig;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Control surface of the optimization orchestrator.
 */
@RestController
@RequestMapping("/api/optimizer")
@RequiredArgsConstructor
public class OptimizerController {

    private final OptimizationOrchestrator orchestrator;

    @GetMapping("/health")
    public ResponseEntity<SystemHealth> getHealth() {
        return ResponseEntity.ok(orchestrator.getSystemHealth());
    }

    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> getStatus() {
        return ResponseEntity.ok(Map.of(
                "initialized", orchestrator.isInitialized(),
                "running", orchestrator.isRunning()
        ));
    }

    /**
     * Run one optimization cycle now and return its report.
     */
    @PostMapping("/optimization-cycle")
    public ResponseEntity<OptimizationReport> triggerCycle() {
        return ResponseEntity.ok(orchestrator.triggerOptimizationCycle());
    }

    @GetMapping("/report/latest")
    public ResponseEntity<OptimizationReport> getLatestReport() {
        return orchestrator.getLastOptimizationReport()
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/report/history")
    public ResponseEntity<List<OptimizationReport>> getHistory(@RequestParam(defaultValue = "10") int limit) {
        return ResponseEntity.ok(orchestrator.getOptimizationHistory(limit));
    }

    @GetMapping("/config")
    public ResponseEntity<OptimizerConfig> getConfig() {
        return ResponseEntity.ok(orchestrator.getConfig());
    }

    @PutMapping("/config")
    public ResponseEntity<OptimizerConfig> updateConfig(@RequestBody OptimizerConfig update) {
        return ResponseEntity.ok(orchestrator.updateConfig(update));
    }

    /**
     * Initialize (re-registering adapters and reloading rules) and start the schedules.
     */
    @PostMapping("/initialize")
    public ResponseEntity<Map<String, Object>> initialize() {
        orchestrator.initialize();
        orchestrator.start();
        return ResponseEntity.ok(Map.of("status", "started", "running", orchestrator.isRunning()));
    }

    @PostMapping("/stop")
    public ResponseEntity<Map<String, Object>> stop() {
        orchestrator.stop();
        return ResponseEntity.ok(Map.of("status", "stopped", "running", orchestrator.isRunning()));
    }

    @GetMapping("/monitoring/performance-score")
    public ResponseEntity<Map<String, Object>> getPerformanceScore() {
        SystemHealth health = orchestrator.getSystemHealth();
        Map<String, Double> components = new LinkedHashMap<>();
        for (Map.Entry<AdapterName, ComponentHealth> entry : health.getComponents().entrySet()) {
            components.put(entry.getKey().getKey(), entry.getValue().getScore());
        }
        return ResponseEntity.ok(Map.of(
                "score", health.getOverallScore(),
                "overall", health.getOverall().getValue(),
                "components", components,
                "checkedAt", health.getCheckedAt().toString()
        ));
    }
}
