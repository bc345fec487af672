package com.example.perfoptimizer.adapter;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Capacity planner view. Utilization values are percentages.
 */
@Value
@Builder
@Jacksonized
public class CapacitySnapshot implements AdapterSnapshot {

    @Builder.Default
    List<CapacityAlert> alerts = List.of();

    @Builder.Default
    List<Bottleneck> bottlenecks = List.of();

    double cpuUtilization;
    double memoryUtilization;

    public List<CapacityAlert> getAlerts() {
        return alerts == null ? List.of() : alerts;
    }

    public List<Bottleneck> getBottlenecks() {
        return bottlenecks == null ? List.of() : bottlenecks;
    }

    public long criticalAlerts() {
        return getAlerts().stream().filter(CapacityAlert::isCritical).count();
    }

    @Value
    @Builder
    @Jacksonized
    public static class CapacityAlert {
        String id;
        String resourceType;
        String severity;
        String message;

        public boolean isCritical() {
            return "critical".equalsIgnoreCase(severity);
        }
    }

    @Value
    @Builder
    @Jacksonized
    public static class Bottleneck {
        String resource;
        String severity;
        String description;
        double utilization;
    }
}
