package com.example.perfoptimizer.recommendation.rules;

import com.example.perfoptimizer.adapter.CapacitySnapshot;
import com.example.perfoptimizer.analysis.CrossComponentAnalysis;
import com.example.perfoptimizer.collector.CollectedSnapshots;
import com.example.perfoptimizer.recommendation.AbstractRecommendationRule;
import com.example.perfoptimizer.recommendation.Recommendation;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static com.example.perfoptimizer.recommendation.Recommendation.Category.INFRASTRUCTURE;
import static com.example.perfoptimizer.recommendation.Recommendation.Priority.HIGH;

@Component
@Order(70)
public class BottleneckRule extends AbstractRecommendationRule {

    public BottleneckRule() {
        super("capacity.bottlenecks");
    }

    @Override
    public Optional<Recommendation> evaluate(CollectedSnapshots snapshots, CrossComponentAnalysis analysis) {
        List<CapacitySnapshot.Bottleneck> severe = analysis.getBottlenecks().stream()
                .filter(b -> "high".equalsIgnoreCase(b.getSeverity()) || "critical".equalsIgnoreCase(b.getSeverity()))
                .collect(Collectors.toList());
        if (severe.isEmpty()) {
            return Optional.empty();
        }
        String resources = severe.stream().map(CapacitySnapshot.Bottleneck::getResource).collect(Collectors.joining(", "));
        return Optional.of(manual(HIGH, INFRASTRUCTURE)
                .title("Resolve Resource Bottlenecks")
                .description("Bottlenecks detected on: " + resources)
                .impact(impact("high", "medium", "medium"))
                .implementation(implementation("medium", "1-2 weeks",
                        "Confirm bottleneck with utilization history",
                        "Scale or redistribute the constrained resource",
                        "Re-run capacity forecast"))
                .expectedOutcome("Headroom restored on constrained resources")
                .build());
    }
}
