package com.example.perfoptimizer.collector;

import com.example.perfoptimizer.adapter.AdapterName;
import com.example.perfoptimizer.adapter.AdapterSnapshot;
import com.example.perfoptimizer.adapter.CacheSnapshot;
import com.example.perfoptimizer.adapter.CapacitySnapshot;
import com.example.perfoptimizer.adapter.DatabaseSnapshot;
import com.example.perfoptimizer.adapter.LoadBalancerSnapshot;
import com.example.perfoptimizer.adapter.PerformanceSnapshot;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Result of one collection pass. An adapter that failed is absent from the snapshot map
 * and present in {@link #getFailures()}; it is never represented by a zero-valued snapshot.
 */
public final class CollectedSnapshots {

    private final Map<AdapterName, AdapterSnapshot> snapshots;
    private final Map<AdapterName, String> failures;
    private final Instant collectedAt;

    public CollectedSnapshots(Map<AdapterName, AdapterSnapshot> snapshots,
                              Map<AdapterName, String> failures,
                              Instant collectedAt) {
        this.snapshots = Collections.unmodifiableMap(copy(snapshots));
        this.failures = Collections.unmodifiableMap(copy(failures));
        this.collectedAt = collectedAt;
    }

    public static CollectedSnapshots of(Map<AdapterName, AdapterSnapshot> snapshots) {
        return new CollectedSnapshots(snapshots, Map.of(), Instant.now());
    }

    public Map<AdapterName, AdapterSnapshot> getSnapshots() {
        return snapshots;
    }

    public Map<AdapterName, String> getFailures() {
        return failures;
    }

    public Instant getCollectedAt() {
        return collectedAt;
    }

    public boolean isAvailable(AdapterName name) {
        return snapshots.containsKey(name);
    }

    public boolean isEmpty() {
        return snapshots.isEmpty();
    }

    public Optional<PerformanceSnapshot> performance() {
        return typed(AdapterName.PERFORMANCE, PerformanceSnapshot.class);
    }

    public Optional<DatabaseSnapshot> database() {
        return typed(AdapterName.DATABASE, DatabaseSnapshot.class);
    }

    public Optional<CacheSnapshot> cache() {
        return typed(AdapterName.CACHE, CacheSnapshot.class);
    }

    public Optional<LoadBalancerSnapshot> loadBalancer() {
        return typed(AdapterName.LOAD_BALANCER, LoadBalancerSnapshot.class);
    }

    public Optional<CapacitySnapshot> capacity() {
        return typed(AdapterName.CAPACITY, CapacitySnapshot.class);
    }

    private <T extends AdapterSnapshot> Optional<T> typed(AdapterName name, Class<T> type) {
        AdapterSnapshot snapshot = snapshots.get(name);
        return type.isInstance(snapshot) ? Optional.of(type.cast(snapshot)) : Optional.empty();
    }

    private static <V> Map<AdapterName, V> copy(Map<AdapterName, V> source) {
        Map<AdapterName, V> target = new EnumMap<>(AdapterName.class);
        if (source != null) {
            target.putAll(source);
        }
        return target;
    }
}
