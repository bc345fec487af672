package com.example.perfoptimizer.adapter;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The fixed set of subsystems the orchestrator can talk to. Declaration order is the
 * collection and reporting order.
 */
public enum AdapterName {
    PERFORMANCE("performance", PerformanceSnapshot.class),
    DATABASE("database", DatabaseSnapshot.class),
    CACHE("cache", CacheSnapshot.class),
    LOAD_BALANCER("loadBalancer", LoadBalancerSnapshot.class),
    CAPACITY("capacityPlanning", CapacitySnapshot.class);

    private final String key;
    private final Class<? extends AdapterSnapshot> snapshotType;

    AdapterName(String key, Class<? extends AdapterSnapshot> snapshotType) {
        this.key = key;
        this.snapshotType = snapshotType;
    }

    @JsonValue
    public String getKey() {
        return key;
    }

    public Class<? extends AdapterSnapshot> getSnapshotType() {
        return snapshotType;
    }
}
