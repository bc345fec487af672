package com.example.perfoptimizer.recommendation.rules;

import com.example.perfoptimizer.analysis.CrossComponentAnalysis;
import com.example.perfoptimizer.collector.CollectedSnapshots;
import com.example.perfoptimizer.config.OptimizerProperties;
import com.example.perfoptimizer.recommendation.AbstractRecommendationRule;
import com.example.perfoptimizer.recommendation.Recommendation;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.example.perfoptimizer.recommendation.Recommendation.Category.MONITORING;
import static com.example.perfoptimizer.recommendation.Recommendation.Priority.HIGH;

/**
 * Compares response time, error rate, CPU and memory usage against perf-optimizer.alert-thresholds.
 */
@Component
@Order(90)
public class ThresholdBreachRule extends AbstractRecommendationRule {

    private final OptimizerProperties properties;

    public ThresholdBreachRule(OptimizerProperties properties) {
        super("performance.threshold-breach");
        this.properties = properties;
    }

    @Override
    public Optional<Recommendation> evaluate(CollectedSnapshots snapshots, CrossComponentAnalysis analysis) {
        OptimizerProperties.AlertThresholds thresholds = properties.getAlertThresholds();
        List<String> breaches = new ArrayList<>();
        snapshots.performance().ifPresent(perf -> {
            if (perf.getAverageResponseTime() > thresholds.getResponseTime()) {
                breaches.add(String.format("response time %.0fms > %.0fms",
                        perf.getAverageResponseTime(), thresholds.getResponseTime()));
            }
            double errorRatePercent = perf.getTotalErrorRate() * 100;
            if (errorRatePercent > thresholds.getErrorRate()) {
                breaches.add(String.format("error rate %.1f%% > %.1f%%", errorRatePercent, thresholds.getErrorRate()));
            }
        });
        snapshots.capacity().ifPresent(capacity -> {
            if (capacity.getCpuUtilization() > thresholds.getCpuUsage()) {
                breaches.add(String.format("CPU usage %.1f%% > %.1f%%", capacity.getCpuUtilization(), thresholds.getCpuUsage()));
            }
            if (capacity.getMemoryUtilization() > thresholds.getMemoryUsage()) {
                breaches.add(String.format("memory usage %.1f%% > %.1f%%",
                        capacity.getMemoryUtilization(), thresholds.getMemoryUsage()));
            }
        });
        if (breaches.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(manual(HIGH, MONITORING)
                .title("Performance Thresholds Breached")
                .description(String.join("; ", breaches))
                .impact(impact("high", "low", "medium"))
                .implementation(implementation("low", "1-3 days",
                        "Confirm alerting fires for the breached thresholds",
                        "Correlate with recent deployments",
                        "Review threshold values against SLOs"))
                .expectedOutcome("Metrics back under alert thresholds")
                .build());
    }
}
