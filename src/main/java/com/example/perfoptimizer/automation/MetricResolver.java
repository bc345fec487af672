package com.example.perfoptimizer.automation;

import com.example.perfoptimizer.adapter.DatabaseSnapshot;
import com.example.perfoptimizer.collector.CollectedSnapshots;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.OptionalDouble;

/**
 * Fixed metric-name to snapshot-field map used by threshold triggers.
 * Percentages are returned as 0..100.
 */
@Component
public class MetricResolver {

    public OptionalDouble resolve(String metric, CollectedSnapshots snapshots) {
        if (metric == null) {
            return OptionalDouble.empty();
        }
        switch (metric.trim().toLowerCase(Locale.ROOT)) {
            case "response_time":
                return toOptional(snapshots.performance().map(p -> p.getAverageResponseTime()).orElse(null));
            case "error_rate":
                return toOptional(snapshots.performance().map(p -> p.getTotalErrorRate() * 100).orElse(null));
            case "cpu_usage":
                return toOptional(snapshots.capacity().map(c -> c.getCpuUtilization()).orElse(null));
            case "memory_usage":
                return toOptional(snapshots.capacity().map(c -> c.getMemoryUtilization()).orElse(null));
            case "cache_hit_rate":
                return toOptional(snapshots.cache().map(c -> c.getHitRate() * 100).orElse(null));
            case "db_connection_utilization":
                return toOptional(snapshots.database()
                        .map(DatabaseSnapshot::getConnectionPool)
                        .map(pool -> pool.getUtilization() * 100)
                        .orElse(null));
            case "slow_query_count":
                return toOptional(snapshots.database().map(d -> (double) d.getSlowQueries().size()).orElse(null));
            case "healthy_instance_ratio":
                return toOptional(snapshots.loadBalancer()
                        .filter(lb -> !lb.getInstances().isEmpty())
                        .map(lb -> lb.healthyInstances() * 100.0 / lb.getInstances().size())
                        .orElse(null));
            default:
                return OptionalDouble.empty();
        }
    }

    private static OptionalDouble toOptional(Double value) {
        return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
    }
}
