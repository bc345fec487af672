package com.example.perfoptimizer.collector;

import com.example.perfoptimizer.adapter.AdapterName;
import com.example.perfoptimizer.adapter.AdapterRegistry;
import com.example.perfoptimizer.adapter.AdapterSnapshot;
import com.example.perfoptimizer.adapter.SubsystemAdapter;
import com.example.perfoptimizer.config.OptimizerProperties;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Pulls a snapshot from every registered adapter.
 *
 * Adapters are queried in parallel and share one deadline (perf-optimizer.adapter-timeout).
 * A throwing, slow or null-returning adapter is recorded as a failure and left out of the
 * result; the others are unaffected.
 */
@Slf4j
@Component
public class DataCollector {

    private final AdapterRegistry adapterRegistry;
    private final OptimizerProperties properties;
    private final Executor collectorExecutor;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public DataCollector(AdapterRegistry adapterRegistry,
                         OptimizerProperties properties,
                         @Qualifier("collectorExecutor") Executor collectorExecutor,
                         MeterRegistry meterRegistry,
                         Clock clock) {
        this.adapterRegistry = adapterRegistry;
        this.properties = properties;
        this.collectorExecutor = collectorExecutor;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    public CollectedSnapshots collect() {
        Map<AdapterName, CompletableFuture<AdapterSnapshot>> pending = new EnumMap<>(AdapterName.class);
        adapterRegistry.getAdapters().forEach((name, adapter) ->
                pending.put(name, CompletableFuture.supplyAsync(() -> readSnapshot(adapter), collectorExecutor)));

        Map<AdapterName, AdapterSnapshot> snapshots = new EnumMap<>(AdapterName.class);
        Map<AdapterName, String> failures = new EnumMap<>(AdapterName.class);
        long deadline = System.nanoTime() + properties.getAdapterTimeout().toNanos();

        for (Map.Entry<AdapterName, CompletableFuture<AdapterSnapshot>> entry : pending.entrySet()) {
            AdapterName name = entry.getKey();
            CompletableFuture<AdapterSnapshot> future = entry.getValue();
            try {
                long remaining = Math.max(0, deadline - System.nanoTime());
                AdapterSnapshot snapshot = future.get(remaining, TimeUnit.NANOSECONDS);
                if (snapshot == null) {
                    recordFailure(name, "adapter returned no snapshot", failures);
                } else {
                    snapshots.put(name, snapshot);
                }
            } catch (TimeoutException e) {
                future.cancel(true);
                recordFailure(name, "timed out after " + properties.getAdapterTimeout().toMillis() + "ms", failures);
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() instanceof CompletionException && e.getCause().getCause() != null
                        ? e.getCause().getCause() : e.getCause();
                recordFailure(name, cause != null ? cause.getMessage() : e.getMessage(), failures);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                future.cancel(true);
                recordFailure(name, "collection interrupted", failures);
            }
        }

        log.debug("Collected {} snapshots ({} failed)", snapshots.size(), failures.size());
        return new CollectedSnapshots(snapshots, failures, clock.instant());
    }

    private AdapterSnapshot readSnapshot(SubsystemAdapter<?> adapter) {
        try {
            return adapter.snapshot();
        } catch (Exception e) {
            throw new CompletionException(e);
        }
    }

    private void recordFailure(AdapterName name, String reason, Map<AdapterName, String> failures) {
        log.warn("Adapter {} unavailable: {}", name.getKey(), reason);
        failures.put(name, reason != null ? reason : "unknown failure");
        Counter.builder("optimizer.adapter.failures")
                .tag("adapter", name.getKey())
                .register(meterRegistry)
                .increment();
    }
}
