package com.example.perfoptimizer.adapter;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
public class LoadBalancerSnapshot implements AdapterSnapshot {

    @Builder.Default
    List<InstanceStatus> instances = List.of();

    double requestsPerSecond;

    public List<InstanceStatus> getInstances() {
        return instances == null ? List.of() : instances;
    }

    public long healthyInstances() {
        return getInstances().stream().filter(InstanceStatus::isHealthy).count();
    }

    @Value
    @Builder
    @Jacksonized
    public static class InstanceStatus {
        String id;
        String status;
        int activeConnections;
        double responseTimeMs;

        public boolean isHealthy() {
            return "healthy".equalsIgnoreCase(status);
        }
    }
}
