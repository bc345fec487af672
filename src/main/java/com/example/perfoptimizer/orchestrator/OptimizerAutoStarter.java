package com.example.perfoptimizer.orchestrator;

import com.example.perfoptimizer.config.OptimizerConfigurationException;
import com.example.perfoptimizer.config.OptimizerProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Initializes and starts the orchestrator once the application is ready, when perf-optimizer.auto-start is set.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OptimizerAutoStarter {

    private final OptimizerProperties properties;
    private final OptimizationOrchestrator orchestrator;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!properties.isAutoStart()) {
            log.info("Auto-start disabled; call POST /api/optimizer/initialize to start the optimizer");
            return;
        }
        try {
            orchestrator.initialize();
            orchestrator.start();
        } catch (OptimizerConfigurationException e) {
            log.error("Optimizer not started: {}", e.getMessage());
        }
    }
}
