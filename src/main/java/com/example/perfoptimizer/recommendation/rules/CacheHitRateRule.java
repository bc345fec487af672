package com.example.perfoptimizer.recommendation.rules;

import com.example.perfoptimizer.analysis.CrossComponentAnalysis;
import com.example.perfoptimizer.collector.CollectedSnapshots;
import com.example.perfoptimizer.recommendation.AbstractRecommendationRule;
import com.example.perfoptimizer.recommendation.Recommendation;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Optional;

import static com.example.perfoptimizer.recommendation.Recommendation.Category.CACHE;
import static com.example.perfoptimizer.recommendation.Recommendation.Priority.HIGH;

@Component
@Order(30)
public class CacheHitRateRule extends AbstractRecommendationRule {

    static final double HIT_RATE_TARGET = 0.8;

    public CacheHitRateRule() {
        super("cache.hit-rate");
    }

    @Override
    public Optional<Recommendation> evaluate(CollectedSnapshots snapshots, CrossComponentAnalysis analysis) {
        return snapshots.cache()
                .filter(cache -> cache.getHitRate() < HIT_RATE_TARGET)
                .map(cache -> automated(HIGH, CACHE, "warm_cache")
                        .title("Improve Cache Hit Rate")
                        .description(String.format("Cache hit rate is %.1f%% - below optimal threshold",
                                cache.getHitRate() * 100))
                        .impact(impact("high", "low", "low"))
                        .implementation(implementation("medium", "1-2 weeks",
                                "Analyze cache access patterns",
                                "Adjust TTL values",
                                "Optimize cache key structure",
                                "Implement cache warming strategies"))
                        .expectedOutcome("15-25% cache hit rate improvement")
                        .build());
    }
}
