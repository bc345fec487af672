package com.example.perfoptimizer.adapter;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
public class DatabaseSnapshot implements AdapterSnapshot {

    @Builder.Default
    List<SlowQuery> slowQueries = List.of();

    /** Null when the tuner has no pool statistics. */
    ConnectionPoolStats connectionPool;

    double averageQueryTimeMs;

    public List<SlowQuery> getSlowQueries() {
        return slowQueries == null ? List.of() : slowQueries;
    }

    @Value
    @Builder
    @Jacksonized
    public static class SlowQuery {
        String query;
        double averageDurationMs;
        long executions;
    }

    @Value
    @Builder
    @Jacksonized
    public static class ConnectionPoolStats {
        int active;
        int idle;
        int maxConnections;
        int recommendedMaxConnections;
        /** 0..1 */
        double utilization;
    }
}
