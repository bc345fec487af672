package com.example.perfoptimizer.recommendation.rules;

import com.example.perfoptimizer.adapter.LoadBalancerSnapshot;
import com.example.perfoptimizer.analysis.CrossComponentAnalysis;
import com.example.perfoptimizer.collector.CollectedSnapshots;
import com.example.perfoptimizer.recommendation.AbstractRecommendationRule;
import com.example.perfoptimizer.recommendation.Recommendation;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.stream.Collectors;

import static com.example.perfoptimizer.recommendation.Recommendation.Category.INFRASTRUCTURE;
import static com.example.perfoptimizer.recommendation.Recommendation.Priority.HIGH;

@Component
@Order(50)
public class UnhealthyInstancesRule extends AbstractRecommendationRule {

    public UnhealthyInstancesRule() {
        super("load-balancer.unhealthy-instances");
    }

    @Override
    public Optional<Recommendation> evaluate(CollectedSnapshots snapshots, CrossComponentAnalysis analysis) {
        return snapshots.loadBalancer()
                .filter(lb -> lb.healthyInstances() < lb.getInstances().size())
                .map(lb -> {
                    String unhealthy = lb.getInstances().stream()
                            .filter(i -> !i.isHealthy())
                            .map(LoadBalancerSnapshot.InstanceStatus::getId)
                            .collect(Collectors.joining(", "));
                    return manual(HIGH, INFRASTRUCTURE)
                            .title("Investigate Unhealthy Instances")
                            .description("Instances failing health checks: " + unhealthy)
                            .impact(impact("high", "low", "medium"))
                            .implementation(implementation("medium", "1-3 days",
                                    "Inspect logs of the failing instances",
                                    "Replace or restart instances that do not recover",
                                    "Verify health check configuration"))
                            .expectedOutcome("Full serving capacity restored")
                            .build();
                });
    }
}
