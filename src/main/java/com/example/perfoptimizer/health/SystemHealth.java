package com.example.perfoptimizer.health;

import com.example.perfoptimizer.adapter.AdapterName;
import com.example.perfoptimizer.recommendation.Recommendation;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Point-in-time rollup. Adapters that could not be read are absent from {@code components}
 * and do not count toward {@code overallScore}.
 */
@Value
@Builder(toBuilder = true)
public class SystemHealth {

    HealthBand overall;
    double overallScore;
    @Builder.Default
    Map<AdapterName, ComponentHealth> components = Map.of();
    @Builder.Default
    AlertCounts alerts = AlertCounts.none();
    /** Top recommendations of the latest report. */
    @Builder.Default
    List<Recommendation> recommendations = List.of();
    Instant checkedAt;
}
