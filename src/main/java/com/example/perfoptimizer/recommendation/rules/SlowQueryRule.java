package com.example.perfoptimizer.recommendation.rules;

import com.example.perfoptimizer.analysis.CrossComponentAnalysis;
import com.example.perfoptimizer.collector.CollectedSnapshots;
import com.example.perfoptimizer.recommendation.AbstractRecommendationRule;
import com.example.perfoptimizer.recommendation.Recommendation;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Optional;

import static com.example.perfoptimizer.recommendation.Recommendation.Category.DATABASE;
import static com.example.perfoptimizer.recommendation.Recommendation.Priority.HIGH;

@Component
@Order(10)
public class SlowQueryRule extends AbstractRecommendationRule {

    public SlowQueryRule() {
        super("database.slow-queries");
    }

    @Override
    public Optional<Recommendation> evaluate(CollectedSnapshots snapshots, CrossComponentAnalysis analysis) {
        return snapshots.database()
                .filter(db -> !db.getSlowQueries().isEmpty())
                .map(db -> automated(HIGH, DATABASE, "optimize_queries")
                        .title("Optimize Slow Database Queries")
                        .description(String.format("Detected %d slow queries affecting performance",
                                db.getSlowQueries().size()))
                        .impact(impact("high", "medium", "low"))
                        .implementation(implementation("medium", "1-2 weeks",
                                "Analyze slow query execution plans",
                                "Create recommended indexes",
                                "Optimize query structure",
                                "Monitor performance improvement"))
                        .expectedOutcome("30-50% query performance improvement")
                        .build());
    }
}
