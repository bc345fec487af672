package com.example.perfoptimizer.adapter;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

@Value
@Builder
@Jacksonized
public class CacheSnapshot implements AdapterSnapshot {

    /** Overall hit rate across all layers, 0..1. */
    double hitRate;

    @Builder.Default
    Map<String, Double> layerHitRates = Map.of();

    long evictions;
    long memoryUsageBytes;

    public Map<String, Double> getLayerHitRates() {
        return layerHitRates == null ? Map.of() : layerHitRates;
    }
}
