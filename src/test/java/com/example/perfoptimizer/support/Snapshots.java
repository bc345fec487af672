package com.example.perfoptimizer.support;

import com.example.perfoptimizer.adapter.AdapterName;
import com.example.perfoptimizer.adapter.AdapterSnapshot;
import com.example.perfoptimizer.adapter.CacheSnapshot;
import com.example.perfoptimizer.adapter.CapacitySnapshot;
import com.example.perfoptimizer.adapter.DatabaseSnapshot;
import com.example.perfoptimizer.adapter.LoadBalancerSnapshot;
import com.example.perfoptimizer.adapter.PerformanceSnapshot;
import com.example.perfoptimizer.adapter.TrendDirection;
import com.example.perfoptimizer.collector.CollectedSnapshots;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Snapshot fixtures shared across tests.
 */
public final class Snapshots {

    public static final Instant NOW = Instant.parse("2024-03-06T10:15:00Z");

    private Snapshots() {
    }

    public static PerformanceSnapshot performance(int slowEndpoints, int highErrorEndpoints) {
        return PerformanceSnapshot.builder()
                .averageResponseTime(250)
                .totalErrorRate(0.01)
                .slowEndpoints(slowEndpoints)
                .highErrorEndpoints(highErrorEndpoints)
                .build();
    }

    public static PerformanceSnapshot errorRate(double fraction) {
        return PerformanceSnapshot.builder()
                .averageResponseTime(250)
                .totalErrorRate(fraction)
                .build();
    }

    public static PerformanceSnapshot withAnomaly(String type, String severity, boolean resolved) {
        return PerformanceSnapshot.builder()
                .averageResponseTime(250)
                .anomalies(List.of(PerformanceSnapshot.Anomaly.builder()
                        .id("a-1").type(type).severity(severity).description(type + " detected").resolved(resolved)
                        .build()))
                .build();
    }

    public static PerformanceSnapshot withTrend(String metric, TrendDirection direction, double rate, double confidence) {
        return PerformanceSnapshot.builder()
                .averageResponseTime(250)
                .trends(List.of(PerformanceSnapshot.MetricTrend.builder()
                        .metric(metric).direction(direction).rate(rate).confidence(confidence)
                        .build()))
                .build();
    }

    public static DatabaseSnapshot database(int slowQueries) {
        return DatabaseSnapshot.builder()
                .slowQueries(IntStream.range(0, slowQueries)
                        .mapToObj(i -> DatabaseSnapshot.SlowQuery.builder()
                                .query("SELECT * FROM orders WHERE id = " + i)
                                .averageDurationMs(1500)
                                .executions(10)
                                .build())
                        .collect(Collectors.toList()))
                .averageQueryTimeMs(40)
                .build();
    }

    public static DatabaseSnapshot pool(double utilization, int max, int recommended) {
        return DatabaseSnapshot.builder()
                .connectionPool(DatabaseSnapshot.ConnectionPoolStats.builder()
                        .active((int) (utilization * max)).idle(max - (int) (utilization * max))
                        .maxConnections(max).recommendedMaxConnections(recommended).utilization(utilization)
                        .build())
                .build();
    }

    public static CacheSnapshot cache(double hitRate) {
        return CacheSnapshot.builder().hitRate(hitRate).build();
    }

    public static LoadBalancerSnapshot loadBalancer(int healthy, int unhealthy) {
        List<LoadBalancerSnapshot.InstanceStatus> instances = IntStream.range(0, healthy + unhealthy)
                .mapToObj(i -> LoadBalancerSnapshot.InstanceStatus.builder()
                        .id("i-" + i)
                        .status(i < healthy ? "healthy" : "unhealthy")
                        .build())
                .collect(Collectors.toList());
        return LoadBalancerSnapshot.builder().instances(instances).requestsPerSecond(120).build();
    }

    public static CapacitySnapshot capacity(int criticalAlerts) {
        return CapacitySnapshot.builder()
                .alerts(IntStream.range(0, criticalAlerts)
                        .mapToObj(i -> CapacitySnapshot.CapacityAlert.builder()
                                .id("c-" + i).resourceType("cpu").severity("critical").message("CPU exhausted")
                                .build())
                        .collect(Collectors.toList()))
                .cpuUtilization(55)
                .memoryUtilization(60)
                .build();
    }

    public static CapacitySnapshot bottleneck(String resource, String severity, double utilization) {
        return CapacitySnapshot.builder()
                .bottlenecks(List.of(CapacitySnapshot.Bottleneck.builder()
                        .resource(resource).severity(severity).utilization(utilization)
                        .description(resource + " saturated")
                        .build()))
                .build();
    }

    public static CollectedSnapshots of(AdapterSnapshot... snapshots) {
        Map<AdapterName, AdapterSnapshot> map = new EnumMap<>(AdapterName.class);
        for (AdapterSnapshot snapshot : snapshots) {
            for (AdapterName name : AdapterName.values()) {
                if (name.getSnapshotType().isInstance(snapshot)) {
                    map.put(name, snapshot);
                }
            }
        }
        return new CollectedSnapshots(map, Map.of(), NOW);
    }
}
