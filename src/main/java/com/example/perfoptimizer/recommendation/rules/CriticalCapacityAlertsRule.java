package com.example.perfoptimizer.recommendation.rules;

import com.example.perfoptimizer.analysis.CrossComponentAnalysis;
import com.example.perfoptimizer.collector.CollectedSnapshots;
import com.example.perfoptimizer.recommendation.AbstractRecommendationRule;
import com.example.perfoptimizer.recommendation.Recommendation;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Optional;

import static com.example.perfoptimizer.recommendation.Recommendation.Category.INFRASTRUCTURE;
import static com.example.perfoptimizer.recommendation.Recommendation.Priority.CRITICAL;

/**
 * Critical capacity problems always go to a human.
 */
@Component
@Order(60)
public class CriticalCapacityAlertsRule extends AbstractRecommendationRule {

    public CriticalCapacityAlertsRule() {
        super("capacity.critical-alerts");
    }

    @Override
    public Optional<Recommendation> evaluate(CollectedSnapshots snapshots, CrossComponentAnalysis analysis) {
        return snapshots.capacity()
                .filter(cap -> cap.criticalAlerts() > 0)
                .map(cap -> manual(CRITICAL, INFRASTRUCTURE)
                        .title("Address Critical Capacity Alerts")
                        .description(String.format("%d critical capacity alerts require immediate attention",
                                cap.criticalAlerts()))
                        .impact(impact("critical", "high", "high"))
                        .implementation(implementation("high", "Immediate",
                                "Review critical alerts immediately",
                                "Implement emergency scaling if needed",
                                "Analyze root causes",
                                "Develop long-term capacity plan"))
                        .expectedOutcome("Prevent service degradation and outages")
                        .build());
    }
}
