package com.example.perfoptimizer.analysis;

import com.example.perfoptimizer.adapter.AdapterName;
import com.example.perfoptimizer.adapter.CacheSnapshot;
import com.example.perfoptimizer.adapter.CapacitySnapshot;
import com.example.perfoptimizer.adapter.DatabaseSnapshot;
import com.example.perfoptimizer.adapter.LoadBalancerSnapshot;
import com.example.perfoptimizer.adapter.PerformanceSnapshot;
import com.example.perfoptimizer.adapter.TrendDirection;
import com.example.perfoptimizer.collector.CollectedSnapshots;
import com.example.perfoptimizer.config.OptimizerProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Derives trends, correlations and bottlenecks from one set of snapshots.
 *
 * Pure aggregation: trend detection itself belongs to the performance adapter, bottlenecks
 * come straight from the capacity adapter. Same input, same output.
 */
@Component
@RequiredArgsConstructor
public class CrossComponentAnalyzer {

    static final double CACHE_HIT_RATE_TARGET = 0.8;

    private final OptimizerProperties properties;

    public CrossComponentAnalysis analyze(CollectedSnapshots snapshots) {
        List<PerformanceTrend> trends = new ArrayList<>();
        snapshots.performance().ifPresent(perf -> {
            for (PerformanceSnapshot.MetricTrend trend : perf.getTrends()) {
                trends.add(PerformanceTrend.builder()
                        .metric(trend.getMetric())
                        .direction(trend.getDirection() != null ? trend.getDirection() : TrendDirection.STABLE)
                        .changePercent(Math.abs(trend.getRate()))
                        .period("daily")
                        .significance(trend.getConfidence())
                        .build());
            }
        });

        List<CapacitySnapshot.Bottleneck> bottlenecks = snapshots.capacity()
                .map(CapacitySnapshot::getBottlenecks)
                .map(List::copyOf)
                .orElse(List.of());

        return CrossComponentAnalysis.builder()
                .trends(List.copyOf(trends))
                .correlations(findCorrelations(snapshots, trends, bottlenecks))
                .bottlenecks(bottlenecks)
                .build();
    }

    private List<Correlation> findCorrelations(CollectedSnapshots snapshots,
                                               List<PerformanceTrend> trends,
                                               List<CapacitySnapshot.Bottleneck> bottlenecks) {
        List<Correlation> correlations = new ArrayList<>();
        Optional<PerformanceSnapshot> perf = snapshots.performance();
        Optional<CacheSnapshot> cache = snapshots.cache();
        Optional<DatabaseSnapshot> database = snapshots.database();
        Optional<LoadBalancerSnapshot> loadBalancer = snapshots.loadBalancer();

        double responseTimeLimit = properties.getAlertThresholds().getResponseTime();
        if (perf.isPresent() && cache.isPresent()
                && cache.get().getHitRate() < CACHE_HIT_RATE_TARGET
                && perf.get().getAverageResponseTime() > responseTimeLimit) {
            correlations.add(Correlation.builder()
                    .primaryMetric("cache_hit_rate")
                    .secondaryMetric("response_time")
                    .components(List.of(AdapterName.CACHE, AdapterName.PERFORMANCE))
                    .description(String.format("Cache hit rate %.1f%% coincides with response time %.0fms",
                            cache.get().getHitRate() * 100, perf.get().getAverageResponseTime()))
                    .strength(clamp(1 - cache.get().getHitRate()))
                    .build());
        }

        if (database.isPresent() && !database.get().getSlowQueries().isEmpty()) {
            trends.stream()
                    .filter(t -> "response_time".equals(t.getMetric()) && t.getDirection() == TrendDirection.DEGRADING)
                    .findFirst()
                    .ifPresent(t -> correlations.add(Correlation.builder()
                            .primaryMetric("slow_query_count")
                            .secondaryMetric("response_time")
                            .components(List.of(AdapterName.DATABASE, AdapterName.PERFORMANCE))
                            .description(String.format("%d slow queries while response time degrades %.1f%%",
                                    database.get().getSlowQueries().size(), t.getChangePercent()))
                            .strength(clamp(t.getSignificance()))
                            .build()));
        }

        if (loadBalancer.isPresent()
                && loadBalancer.get().healthyInstances() < loadBalancer.get().getInstances().size()) {
            bottlenecks.stream()
                    .filter(b -> isSevere(b.getSeverity()))
                    .findFirst()
                    .ifPresent(b -> correlations.add(Correlation.builder()
                            .primaryMetric(b.getResource() + "_utilization")
                            .secondaryMetric("healthy_instance_ratio")
                            .components(List.of(AdapterName.CAPACITY, AdapterName.LOAD_BALANCER))
                            .description(String.format("%s bottleneck at %.1f%% with unhealthy instances behind the load balancer",
                                    b.getResource(), b.getUtilization()))
                            .strength(clamp(b.getUtilization() / 100))
                            .build()));
        }

        return List.copyOf(correlations);
    }

    static boolean isSevere(String severity) {
        return "critical".equalsIgnoreCase(severity) || "high".equalsIgnoreCase(severity);
    }

    private static double clamp(double value) {
        return Math.max(0, Math.min(1, value));
    }
}
