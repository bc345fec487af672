package com.example.perfoptimizer.analysis;

import com.example.perfoptimizer.adapter.TrendDirection;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class PerformanceTrend {
    String metric;
    TrendDirection direction;
    /** Absolute change in percent. */
    double changePercent;
    String period;
    /** Confidence of the trend, 0..1. */
    double significance;

    public boolean isSignificantDegradation(double minSignificance) {
        return direction == TrendDirection.DEGRADING && significance > minSignificance;
    }
}
