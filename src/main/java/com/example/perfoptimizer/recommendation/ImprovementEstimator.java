package com.example.perfoptimizer.recommendation;

import com.example.perfoptimizer.config.OptimizerProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Estimates a cycle's performance gain and cost savings from the categories of the
 * recommendations it implemented. Weights come from perf-optimizer.estimation; they are
 * policy, not measurement.
 */
@Component
@RequiredArgsConstructor
public class ImprovementEstimator {

    private final OptimizerProperties properties;

    public Estimate estimate(List<Recommendation> recommendations) {
        OptimizerProperties.EstimationConfig weights = properties.getEstimation();
        double performance = 0;
        double cost = 0;
        for (Recommendation recommendation : recommendations) {
            if (recommendation.getStatus() != Recommendation.Status.IMPLEMENTED) {
                continue;
            }
            switch (recommendation.getCategory()) {
                case DATABASE -> performance += weights.getDatabasePerformanceGain();
                case CACHE -> performance += weights.getCachePerformanceGain();
                case INFRASTRUCTURE -> {
                    performance += weights.getInfrastructurePerformanceGain();
                    cost += weights.getInfrastructureCostSavings();
                }
                default -> {
                }
            }
        }
        return new Estimate(Math.min(performance, weights.getMaxPerformanceGain()),
                Math.round(cost * weights.getCostUnit()));
    }

    public record Estimate(double performanceImprovementPercent, long estimatedCostSavings) {
    }
}
