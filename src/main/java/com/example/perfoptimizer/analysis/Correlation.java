package com.example.perfoptimizer.analysis;

import com.example.perfoptimizer.adapter.AdapterName;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Two signals from different subsystems that are elevated at the same time.
 */
@Value
@Builder
@Jacksonized
public class Correlation {
    String primaryMetric;
    String secondaryMetric;
    List<AdapterName> components;
    String description;
    /** 0..1 */
    double strength;
}
