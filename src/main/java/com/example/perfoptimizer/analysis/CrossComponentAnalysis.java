package com.example.perfoptimizer.analysis;

import com.example.perfoptimizer.adapter.CapacitySnapshot;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class CrossComponentAnalysis {

    @Builder.Default
    List<PerformanceTrend> trends = List.of();

    @Builder.Default
    List<Correlation> correlations = List.of();

    @Builder.Default
    List<CapacitySnapshot.Bottleneck> bottlenecks = List.of();

    public static CrossComponentAnalysis empty() {
        return CrossComponentAnalysis.builder().build();
    }
}
