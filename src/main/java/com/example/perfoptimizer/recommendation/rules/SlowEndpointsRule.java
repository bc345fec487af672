package com.example.perfoptimizer.recommendation.rules;

import com.example.perfoptimizer.analysis.CrossComponentAnalysis;
import com.example.perfoptimizer.collector.CollectedSnapshots;
import com.example.perfoptimizer.recommendation.AbstractRecommendationRule;
import com.example.perfoptimizer.recommendation.Recommendation;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Optional;

import static com.example.perfoptimizer.recommendation.Recommendation.Category.APPLICATION;
import static com.example.perfoptimizer.recommendation.Recommendation.Priority.MEDIUM;

@Component
@Order(80)
public class SlowEndpointsRule extends AbstractRecommendationRule {

    public SlowEndpointsRule() {
        super("performance.slow-endpoints");
    }

    @Override
    public Optional<Recommendation> evaluate(CollectedSnapshots snapshots, CrossComponentAnalysis analysis) {
        return snapshots.performance()
                .filter(perf -> perf.getSlowEndpoints() > 0)
                .map(perf -> manual(MEDIUM, APPLICATION)
                        .title("Optimize Slow Endpoints")
                        .description(String.format("%d endpoints exceed their latency budget", perf.getSlowEndpoints()))
                        .impact(impact("medium", "low", "low"))
                        .implementation(implementation("medium", "1-2 weeks",
                                "Profile the slowest endpoints",
                                "Remove redundant downstream calls",
                                "Add caching where responses are reusable"))
                        .expectedOutcome("Endpoint latency back within budget")
                        .build());
    }
}
