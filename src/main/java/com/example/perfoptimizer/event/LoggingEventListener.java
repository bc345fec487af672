package com.example.perfoptimizer.event;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class LoggingEventListener implements OrchestratorEventListener {

    @Override
    public void onEvent(OrchestratorEvent event) {
        switch (event.getType()) {
            case STARTED -> log.info("Optimizer started");
            case STOPPED -> log.info("Optimizer stopped");
            case OPTIMIZATION_CYCLE_COMPLETED -> log.info("Optimization cycle {} completed: health {}, {} recommendations, {} implemented",
                    event.getReport().getId(),
                    event.getReport().getSummary().getOverallHealthScore(),
                    event.getReport().getSummary().getRecommendationsGenerated(),
                    event.getReport().getSummary().getOptimizationsImplemented());
            case ALERT -> log.warn("ALERT [{}] {}", event.getSeverity(), event.getMessage());
            case INCIDENT_CREATED -> log.warn("INCIDENT [{}] {} (automated={})",
                    event.getSeverity(), event.getMessage(), event.getAutomated());
        }
    }
}
