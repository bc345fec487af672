package com.example.perfoptimizer.adapter;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Performance analyzer view: request latency, error rates, detected anomalies and the
 * analyzer's own trend estimates.
 */
@Value
@Builder
@Jacksonized
public class PerformanceSnapshot implements AdapterSnapshot {

    /** Milliseconds. */
    double averageResponseTime;

    /** Fraction of failed requests, 0..1. */
    double totalErrorRate;

    int slowEndpoints;
    int highErrorEndpoints;

    @Builder.Default
    List<Anomaly> anomalies = List.of();

    @Builder.Default
    List<MetricTrend> trends = List.of();

    public List<Anomaly> getAnomalies() {
        return anomalies == null ? List.of() : anomalies;
    }

    public List<MetricTrend> getTrends() {
        return trends == null ? List.of() : trends;
    }

    @Value
    @Builder
    @Jacksonized
    public static class Anomaly {
        String id;
        String type;
        String severity;
        String description;
        boolean resolved;

        public boolean isOpen() {
            return !resolved;
        }

        public boolean isCritical() {
            return "critical".equalsIgnoreCase(severity);
        }
    }

    @Value
    @Builder
    @Jacksonized
    public static class MetricTrend {
        String metric;
        TrendDirection direction;
        /** Signed rate of change in percent. */
        double rate;
        /** 0..1 */
        double confidence;
    }
}
