package com.example.perfoptimizer.adapter;

import com.example.perfoptimizer.config.OptimizerConfigurationException;
import com.example.perfoptimizer.config.OptimizerProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Name to adapter map built at initialize().
 *
 * Adapters are resolved in two steps: a Spring bean implementing {@link SubsystemAdapter}
 * for that name wins; otherwise an HTTP adapter is built from perf-optimizer.adapters.
 * The map is replaced wholesale so readers always see a consistent set.
 */
@Slf4j
@Component
public class AdapterRegistry {

    private final AdapterFactory adapterFactory;
    private final Map<AdapterName, SubsystemAdapter<?>> discoveredAdapters = new EnumMap<>(AdapterName.class);

    private volatile Map<AdapterName, SubsystemAdapter<?>> adapters = Map.of();

    public AdapterRegistry(AdapterFactory adapterFactory, List<SubsystemAdapter<?>> discovered) {
        this.adapterFactory = adapterFactory;
        for (SubsystemAdapter<?> adapter : discovered) {
            discoveredAdapters.put(adapter.getName(), adapter);
            log.info("Discovered adapter bean: {} ({})", adapter.getName().getKey(), adapter.getClass().getSimpleName());
        }
    }

    /**
     * Build the adapter set for the given names. Throws before touching the current set
     * if any adapter cannot be constructed.
     */
    public synchronized void registerAll(Set<AdapterName> required, OptimizerProperties properties) {
        Map<AdapterName, SubsystemAdapter<?>> next = new EnumMap<>(AdapterName.class);
        for (AdapterName name : required) {
            SubsystemAdapter<?> adapter = discoveredAdapters.get(name);
            if (adapter == null) {
                try {
                    adapter = adapterFactory.create(name, properties.getAdapters().get(name));
                } catch (OptimizerConfigurationException e) {
                    throw e;
                } catch (RuntimeException e) {
                    throw new OptimizerConfigurationException(
                            "Failed to construct adapter '" + name.getKey() + "': " + e.getMessage(), e);
                }
            }
            next.put(name, adapter);
        }
        adapters = Collections.unmodifiableMap(next);
        log.info("Registered {} adapters: {}", next.size(), next.keySet());
    }

    public Optional<SubsystemAdapter<?>> get(AdapterName name) {
        return Optional.ofNullable(adapters.get(name));
    }

    public boolean isRegistered(AdapterName name) {
        return adapters.containsKey(name);
    }

    /**
     * Registered adapters in collection order.
     */
    public Map<AdapterName, SubsystemAdapter<?>> getAdapters() {
        return adapters;
    }

    public int getAdapterCount() {
        return adapters.size();
    }
}
