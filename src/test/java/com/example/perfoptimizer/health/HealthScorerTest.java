package com.example.perfoptimizer.health;

import com.example.perfoptimizer.adapter.AdapterName;
import com.example.perfoptimizer.adapter.CapacitySnapshot;
import com.example.perfoptimizer.adapter.DatabaseSnapshot;
import com.example.perfoptimizer.adapter.LoadBalancerSnapshot;
import com.example.perfoptimizer.adapter.PerformanceSnapshot;
import com.example.perfoptimizer.collector.CollectedSnapshots;
import com.example.perfoptimizer.config.AppConfig;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.example.perfoptimizer.support.Snapshots.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class HealthScorerTest {

    private final HealthScorer scorer = new HealthScorer();

    @Test
    void meanOf92IsExcellent() {
        SystemHealth health = scorer.score(of(performance(0, 0), cache(0.84)));

        assertThat(health.getOverallScore()).isCloseTo(92, within(0.001));
        assertThat(health.getOverall()).isEqualTo(HealthBand.EXCELLENT);
    }

    @Test
    void meanOf80IsGood() {
        SystemHealth health = scorer.score(of(performance(2, 0), cache(0.80)));

        assertThat(health.getOverallScore()).isCloseTo(80, within(0.001));
        assertThat(health.getOverall()).isEqualTo(HealthBand.GOOD);
    }

    @Test
    void meanOf60IsWarning() {
        SystemHealth health = scorer.score(of(loadBalancer(3, 2)));

        assertThat(health.getOverallScore()).isCloseTo(60, within(0.001));
        assertThat(health.getOverall()).isEqualTo(HealthBand.WARNING);
    }

    @Test
    void meanOf30IsCritical() {
        SystemHealth health = scorer.score(of(performance(7, 0)));

        assertThat(health.getOverallScore()).isCloseTo(30, within(0.001));
        assertThat(health.getOverall()).isEqualTo(HealthBand.CRITICAL);
    }

    @Test
    void nullCollectionsInDecodedSnapshotsDoNotSinkOtherComponents() throws Exception {
        ObjectMapper mapper = new AppConfig().objectMapper();
        DatabaseSnapshot database = mapper.readValue("{\"slowQueries\": null}", DatabaseSnapshot.class);
        LoadBalancerSnapshot loadBalancer = mapper.readValue("{\"instances\": null}", LoadBalancerSnapshot.class);
        CapacitySnapshot capacity = mapper.readValue("{\"alerts\": null, \"bottlenecks\": null}", CapacitySnapshot.class);

        SystemHealth health = scorer.score(of(database, loadBalancer, capacity, cache(0.95)));

        assertThat(health.getComponents()).containsOnlyKeys(
                AdapterName.DATABASE, AdapterName.LOAD_BALANCER, AdapterName.CAPACITY, AdapterName.CACHE);
        assertThat(health.getComponents().get(AdapterName.CACHE).getScore()).isCloseTo(95, within(0.001));
        assertThat(health.getAlerts().getCritical()).isZero();
    }

    @Test
    void absentAdaptersDoNotCountTowardTheMean() {
        SystemHealth health = scorer.score(of(performance(0, 0), database(0)));

        assertThat(health.getComponents()).containsOnlyKeys(AdapterName.PERFORMANCE, AdapterName.DATABASE);
        assertThat(health.getOverallScore()).isCloseTo(100, within(0.001));
    }

    @Test
    void noComponentsIsCriticalWithZeroScore() {
        SystemHealth health = scorer.score(of());

        assertThat(health.getOverall()).isEqualTo(HealthBand.CRITICAL);
        assertThat(health.getOverallScore()).isZero();
        assertThat(health.getComponents()).isEmpty();
    }

    @Test
    void performanceStatusFollowsSlowEndpointCount() {
        assertThat(scorer.score(of(performance(2, 0))).getComponents().get(AdapterName.PERFORMANCE).getStatus())
                .isEqualTo(ComponentHealth.Status.HEALTHY);
        assertThat(scorer.score(of(performance(3, 0))).getComponents().get(AdapterName.PERFORMANCE).getStatus())
                .isEqualTo(ComponentHealth.Status.DEGRADED);
        assertThat(scorer.score(of(performance(6, 0))).getComponents().get(AdapterName.PERFORMANCE).getStatus())
                .isEqualTo(ComponentHealth.Status.CRITICAL);
    }

    @Test
    void componentScoresUseTheirOwnFormulas() {
        CollectedSnapshots snapshots = of(performance(1, 2), database(20), cache(0.5), loadBalancer(0, 0), capacity(2));

        SystemHealth health = scorer.score(snapshots);

        assertThat(health.getComponents().get(AdapterName.PERFORMANCE).getScore()).isEqualTo(80);
        assertThat(health.getComponents().get(AdapterName.DATABASE).getScore()).isEqualTo(70);
        assertThat(health.getComponents().get(AdapterName.CACHE).getScore()).isCloseTo(50, within(0.001));
        assertThat(health.getComponents().get(AdapterName.LOAD_BALANCER).getScore()).isZero();
        assertThat(health.getComponents().get(AdapterName.CAPACITY).getScore()).isEqualTo(60);
        assertThat(health.getComponents().get(AdapterName.LOAD_BALANCER).getStatus()).isEqualTo(ComponentHealth.Status.CRITICAL);
        assertThat(health.getComponents().get(AdapterName.CAPACITY).getIssues()).containsExactly("2 critical capacity alerts");
    }

    @Test
    void countsAlertsBySeverity() {
        PerformanceSnapshot perf = PerformanceSnapshot.builder()
                .anomalies(List.of(
                        PerformanceSnapshot.Anomaly.builder().type("latency").severity("critical").build(),
                        PerformanceSnapshot.Anomaly.builder().type("errors").severity("medium").build(),
                        PerformanceSnapshot.Anomaly.builder().type("old").severity("critical").resolved(true).build()))
                .build();
        CapacitySnapshot capacity = CapacitySnapshot.builder()
                .alerts(List.of(
                        CapacitySnapshot.CapacityAlert.builder().severity("critical").build(),
                        CapacitySnapshot.CapacityAlert.builder().severity("warning").build(),
                        CapacitySnapshot.CapacityAlert.builder().severity("info").build()))
                .build();

        AlertCounts alerts = scorer.score(of(perf, capacity)).getAlerts();

        assertThat(alerts.getCritical()).isEqualTo(2);
        assertThat(alerts.getWarning()).isEqualTo(2);
        assertThat(alerts.getInfo()).isEqualTo(1);
    }
}
