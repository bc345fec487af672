package com.example.perfoptimizer.recommendation.rules;

import com.example.perfoptimizer.analysis.CrossComponentAnalysis;
import com.example.perfoptimizer.collector.CollectedSnapshots;
import com.example.perfoptimizer.recommendation.AbstractRecommendationRule;
import com.example.perfoptimizer.recommendation.Recommendation;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Optional;

import static com.example.perfoptimizer.recommendation.Recommendation.Category.INFRASTRUCTURE;
import static com.example.perfoptimizer.recommendation.Recommendation.Priority.MEDIUM;

@Component
@Order(40)
public class LoadDistributionRule extends AbstractRecommendationRule {

    static final int MIN_INSTANCES = 3;

    public LoadDistributionRule() {
        super("load-balancer.distribution");
    }

    @Override
    public Optional<Recommendation> evaluate(CollectedSnapshots snapshots, CrossComponentAnalysis analysis) {
        return snapshots.loadBalancer()
                .filter(lb -> lb.getInstances().size() > MIN_INSTANCES)
                .map(lb -> automated(MEDIUM, INFRASTRUCTURE, "rebalance")
                        .title("Optimize Load Balancing Algorithm")
                        .description(String.format("Load distribution across %d instances can be optimized",
                                lb.getInstances().size()))
                        .impact(impact("medium", "low", "low"))
                        .implementation(implementation("low", "3-5 days",
                                "Analyze current load distribution",
                                "Adjust load balancing weights",
                                "Monitor traffic patterns",
                                "Fine-tune algorithm parameters"))
                        .expectedOutcome("10-20% better load distribution")
                        .build());
    }
}
