package com.example.perfoptimizer.analysis;

import com.example.perfoptimizer.adapter.AdapterName;
import com.example.perfoptimizer.adapter.PerformanceSnapshot;
import com.example.perfoptimizer.adapter.TrendDirection;
import com.example.perfoptimizer.collector.CollectedSnapshots;
import com.example.perfoptimizer.config.OptimizerProperties;
import org.junit.jupiter.api.Test;

import static com.example.perfoptimizer.support.Snapshots.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class CrossComponentAnalyzerTest {

    private final CrossComponentAnalyzer analyzer = new CrossComponentAnalyzer(new OptimizerProperties());

    @Test
    void relabelsAdapterTrends() {
        CrossComponentAnalysis analysis = analyzer.analyze(of(withTrend("response_time", TrendDirection.DEGRADING, -12.5, 0.9)));

        assertThat(analysis.getTrends()).singleElement().satisfies(trend -> {
            assertThat(trend.getMetric()).isEqualTo("response_time");
            assertThat(trend.getDirection()).isEqualTo(TrendDirection.DEGRADING);
            assertThat(trend.getChangePercent()).isEqualTo(12.5);
            assertThat(trend.getPeriod()).isEqualTo("daily");
            assertThat(trend.getSignificance()).isEqualTo(0.9);
        });
    }

    @Test
    void passesBottlenecksThrough() {
        CrossComponentAnalysis analysis = analyzer.analyze(of(bottleneck("cpu", "high", 93)));

        assertThat(analysis.getBottlenecks()).extracting("resource").containsExactly("cpu");
    }

    @Test
    void correlatesLowHitRateWithSlowResponses() {
        PerformanceSnapshot slow = PerformanceSnapshot.builder().averageResponseTime(1800).build();

        CrossComponentAnalysis analysis = analyzer.analyze(of(slow, cache(0.55)));

        assertThat(analysis.getCorrelations()).singleElement().satisfies(c -> {
            assertThat(c.getPrimaryMetric()).isEqualTo("cache_hit_rate");
            assertThat(c.getComponents()).containsExactly(AdapterName.CACHE, AdapterName.PERFORMANCE);
            assertThat(c.getStrength()).isEqualTo(0.45, within(0.0001));
        });
    }

    @Test
    void correlatesSlowQueriesWithDegradingLatency() {
        CrossComponentAnalysis analysis = analyzer.analyze(
                of(withTrend("response_time", TrendDirection.DEGRADING, 20, 0.8), database(3)));

        assertThat(analysis.getCorrelations()).extracting(Correlation::getPrimaryMetric).containsExactly("slow_query_count");
    }

    @Test
    void correlatesBottleneckWithUnhealthyInstances() {
        CrossComponentAnalysis analysis = analyzer.analyze(of(bottleneck("memory", "critical", 97), loadBalancer(2, 1)));

        assertThat(analysis.getCorrelations()).singleElement()
                .satisfies(c -> assertThat(c.getSecondaryMetric()).isEqualTo("healthy_instance_ratio"));
    }

    @Test
    void sameInputGivesSameOutput() {
        CollectedSnapshots snapshots = of(withTrend("error_rate", TrendDirection.IMPROVING, 3, 0.5), cache(0.4), database(2));

        assertThat(analyzer.analyze(snapshots)).isEqualTo(analyzer.analyze(snapshots));
    }

    @Test
    void emptyInputGivesEmptyAnalysis() {
        CrossComponentAnalysis analysis = analyzer.analyze(of());

        assertThat(analysis.getTrends()).isEmpty();
        assertThat(analysis.getCorrelations()).isEmpty();
        assertThat(analysis.getBottlenecks()).isEmpty();
    }
}
