package com.example.perfoptimizer.recommendation.rules;

import com.example.perfoptimizer.analysis.CrossComponentAnalysis;
import com.example.perfoptimizer.analysis.PerformanceTrend;
import com.example.perfoptimizer.collector.CollectedSnapshots;
import com.example.perfoptimizer.recommendation.AbstractRecommendationRule;
import com.example.perfoptimizer.recommendation.Recommendation;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static com.example.perfoptimizer.recommendation.Recommendation.Category.MONITORING;
import static com.example.perfoptimizer.recommendation.Recommendation.Priority.MEDIUM;

@Component
@Order(100)
public class DegradingTrendsRule extends AbstractRecommendationRule {

    public static final double MIN_SIGNIFICANCE = 0.7;

    public DegradingTrendsRule() {
        super("performance.degrading-trends");
    }

    @Override
    public Optional<Recommendation> evaluate(CollectedSnapshots snapshots, CrossComponentAnalysis analysis) {
        List<PerformanceTrend> degrading = analysis.getTrends().stream()
                .filter(t -> t.isSignificantDegradation(MIN_SIGNIFICANCE))
                .collect(Collectors.toList());
        if (degrading.isEmpty()) {
            return Optional.empty();
        }
        String metrics = degrading.stream()
                .map(t -> String.format("%s (%.1f%%)", t.getMetric(), t.getChangePercent()))
                .collect(Collectors.joining(", "));
        return Optional.of(manual(MEDIUM, MONITORING)
                .title("Investigate Degrading Performance Trends")
                .description("Significant degradation in: " + metrics)
                .impact(impact("medium", "low", "low"))
                .implementation(implementation("low", "1 week",
                        "Review dashboards for the degrading metrics",
                        "Identify changes that preceded the trend",
                        "Add alerts before the trend breaches thresholds"))
                .expectedOutcome("Degradation halted before it affects users")
                .build());
    }
}
