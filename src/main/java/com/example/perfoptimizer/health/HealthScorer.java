package com.example.perfoptimizer.health;

import com.example.perfoptimizer.adapter.AdapterName;
import com.example.perfoptimizer.adapter.CacheSnapshot;
import com.example.perfoptimizer.adapter.CapacitySnapshot;
import com.example.perfoptimizer.adapter.DatabaseSnapshot;
import com.example.perfoptimizer.adapter.LoadBalancerSnapshot;
import com.example.perfoptimizer.adapter.PerformanceSnapshot;
import com.example.perfoptimizer.collector.CollectedSnapshots;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Scores each available component 0..100 and rolls them up into one {@link SystemHealth}.
 *
 * Scoring:
 * - performance: 100 - 10 per slow endpoint - 5 per high-error endpoint
 * - database: 100 - 3 per slow query, penalty capped at 30
 * - cache: hit rate as a percentage
 * - load balancer: healthy / total instances as a percentage, 0 with no instances
 * - capacity: 100 - 20 per critical alert
 */
@Component
public class HealthScorer {

    public SystemHealth score(CollectedSnapshots snapshots) {
        Instant now = snapshots.getCollectedAt();
        Map<AdapterName, ComponentHealth> components = new EnumMap<>(AdapterName.class);

        snapshots.performance().ifPresent(p -> components.put(AdapterName.PERFORMANCE, performance(p, now)));
        snapshots.database().ifPresent(d -> components.put(AdapterName.DATABASE, database(d, now)));
        snapshots.cache().ifPresent(c -> components.put(AdapterName.CACHE, cache(c, now)));
        snapshots.loadBalancer().ifPresent(lb -> components.put(AdapterName.LOAD_BALANCER, loadBalancer(lb, now)));
        snapshots.capacity().ifPresent(c -> components.put(AdapterName.CAPACITY, capacity(c, now)));

        double overallScore = components.values().stream()
                .mapToDouble(ComponentHealth::getScore)
                .average()
                .orElse(0);

        return SystemHealth.builder()
                .overall(components.isEmpty() ? HealthBand.CRITICAL : HealthBand.of(overallScore))
                .overallScore(overallScore)
                .components(Collections.unmodifiableMap(components))
                .alerts(countAlerts(snapshots))
                .checkedAt(now)
                .build();
    }

    ComponentHealth performance(PerformanceSnapshot snapshot, Instant now) {
        double score = Math.max(0, 100 - snapshot.getSlowEndpoints() * 10 - snapshot.getHighErrorEndpoints() * 5);
        ComponentHealth.Status status = snapshot.getSlowEndpoints() > 5 ? ComponentHealth.Status.CRITICAL
                : snapshot.getSlowEndpoints() > 2 ? ComponentHealth.Status.DEGRADED
                : ComponentHealth.Status.HEALTHY;
        List<String> issues = new ArrayList<>();
        if (snapshot.getSlowEndpoints() > 0) issues.add(snapshot.getSlowEndpoints() + " slow endpoints");
        if (snapshot.getHighErrorEndpoints() > 0) issues.add(snapshot.getHighErrorEndpoints() + " high-error endpoints");
        return component(status, score, issues, now);
    }

    ComponentHealth database(DatabaseSnapshot snapshot, Instant now) {
        int slowQueries = snapshot.getSlowQueries().size();
        double score = Math.max(0, 100 - Math.min(30, slowQueries * 3));
        List<String> issues = new ArrayList<>();
        if (slowQueries > 0) issues.add(slowQueries + " slow queries");
        if (snapshot.getConnectionPool() != null && snapshot.getConnectionPool().getUtilization() >= 0.8) {
            issues.add(String.format("connection pool %.0f%% utilized", snapshot.getConnectionPool().getUtilization() * 100));
        }
        return component(ComponentHealth.Status.fromScore(score), score, issues, now);
    }

    ComponentHealth cache(CacheSnapshot snapshot, Instant now) {
        double score = snapshot.getHitRate() * 100;
        List<String> issues = new ArrayList<>();
        if (snapshot.getHitRate() < 0.8) issues.add(String.format("hit rate %.1f%%", score));
        return component(ComponentHealth.Status.fromScore(score), score, issues, now);
    }

    ComponentHealth loadBalancer(LoadBalancerSnapshot snapshot, Instant now) {
        int total = snapshot.getInstances().size();
        long healthy = snapshot.healthyInstances();
        double score = total == 0 ? 0 : healthy * 100.0 / total;
        List<String> issues = new ArrayList<>();
        if (total == 0) {
            issues.add("no instances registered");
        } else if (healthy < total) {
            issues.add((total - healthy) + " of " + total + " instances unhealthy");
        }
        return component(ComponentHealth.Status.fromScore(score), score, issues, now);
    }

    ComponentHealth capacity(CapacitySnapshot snapshot, Instant now) {
        long critical = snapshot.criticalAlerts();
        double score = Math.max(0, 100 - critical * 20);
        List<String> issues = new ArrayList<>();
        if (critical > 0) issues.add(critical + " critical capacity alerts");
        return component(ComponentHealth.Status.fromScore(score), score, issues, now);
    }

    private AlertCounts countAlerts(CollectedSnapshots snapshots) {
        int critical = 0;
        int warning = 0;
        int info = 0;
        for (PerformanceSnapshot.Anomaly anomaly : snapshots.performance()
                .map(PerformanceSnapshot::getAnomalies).orElse(List.of())) {
            if (!anomaly.isOpen()) continue;
            if (anomaly.isCritical()) critical++;
            else warning++;
        }
        for (CapacitySnapshot.CapacityAlert alert : snapshots.capacity()
                .map(CapacitySnapshot::getAlerts).orElse(List.of())) {
            if (alert.isCritical()) critical++;
            else if ("warning".equalsIgnoreCase(alert.getSeverity())) warning++;
            else info++;
        }
        return new AlertCounts(critical, warning, info);
    }

    private static ComponentHealth component(ComponentHealth.Status status, double score,
                                             List<String> issues, Instant now) {
        return ComponentHealth.builder()
                .status(status)
                .score(score)
                .issues(List.copyOf(issues))
                .lastCheck(now)
                .build();
    }
}
