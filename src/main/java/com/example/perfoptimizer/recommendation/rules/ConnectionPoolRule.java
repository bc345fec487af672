package com.example.perfoptimizer.recommendation.rules;

import com.example.perfoptimizer.adapter.DatabaseSnapshot;
import com.example.perfoptimizer.analysis.CrossComponentAnalysis;
import com.example.perfoptimizer.collector.CollectedSnapshots;
import com.example.perfoptimizer.recommendation.AbstractRecommendationRule;
import com.example.perfoptimizer.recommendation.Recommendation;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Optional;

import static com.example.perfoptimizer.recommendation.Recommendation.Category.DATABASE;
import static com.example.perfoptimizer.recommendation.Recommendation.Priority.MEDIUM;

/**
 * Fires when the pool runs hot or the tuner suggests a different size.
 */
@Component
@Order(20)
public class ConnectionPoolRule extends AbstractRecommendationRule {

    static final double UTILIZATION_LIMIT = 0.8;

    public ConnectionPoolRule() {
        super("database.connection-pool");
    }

    @Override
    public Optional<Recommendation> evaluate(CollectedSnapshots snapshots, CrossComponentAnalysis analysis) {
        return snapshots.database()
                .map(DatabaseSnapshot::getConnectionPool)
                .filter(pool -> pool.getUtilization() >= UTILIZATION_LIMIT
                        || (pool.getRecommendedMaxConnections() > 0
                        && pool.getRecommendedMaxConnections() != pool.getMaxConnections()))
                .map(pool -> automated(MEDIUM, DATABASE, "tune_connection_pool")
                        .title("Optimize Database Connection Pool")
                        .description(String.format("Current utilization: %.1f%% (max %d, recommended %d)",
                                pool.getUtilization() * 100, pool.getMaxConnections(),
                                pool.getRecommendedMaxConnections()))
                        .impact(impact("medium", "low", "low"))
                        .implementation(implementation("low", "1 week",
                                "Update connection pool configuration",
                                "Test with current load",
                                "Monitor connection metrics",
                                "Fine-tune as needed"))
                        .expectedOutcome("20-30% connection efficiency improvement")
                        .build());
    }
}
