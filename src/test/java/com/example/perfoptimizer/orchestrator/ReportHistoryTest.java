package com.example.perfoptimizer.orchestrator;

import com.example.perfoptimizer.config.OptimizerProperties;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReportHistoryTest {

    private ReportHistory history(int size) {
        OptimizerProperties properties = new OptimizerProperties();
        properties.setHistorySize(size);
        return new ReportHistory(properties);
    }

    @Test
    void evictsOldestBeyondCapacity() {
        ReportHistory history = history(3);
        for (int i = 1; i <= 5; i++) {
            history.append(report("r" + i));
        }

        assertThat(history.size()).isEqualTo(3);
        assertThat(history.latest(10)).extracting(OptimizationReport::getId).containsExactly("r3", "r4", "r5");
    }

    @Test
    void latestReturnsMostRecentOldestFirst() {
        ReportHistory history = history(10);
        for (int i = 1; i <= 4; i++) {
            history.append(report("r" + i));
        }

        assertThat(history.latest(2)).extracting(OptimizationReport::getId).containsExactly("r3", "r4");
        assertThat(history.latest(0)).isEmpty();
    }

    @Test
    void shrinkingDropsOldest() {
        ReportHistory history = history(5);
        for (int i = 1; i <= 5; i++) {
            history.append(report("r" + i));
        }

        history.resize(2);

        assertThat(history.getCapacity()).isEqualTo(2);
        assertThat(history.latest(5)).extracting(OptimizationReport::getId).containsExactly("r4", "r5");
        assertThatThrownBy(() -> history.resize(0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void returnedListIsACopy() {
        ReportHistory history = history(5);
        history.append(report("r1"));

        history.latest(5).clear();

        assertThat(history.size()).isEqualTo(1);
    }

    private static OptimizationReport report(String id) {
        return OptimizationReport.builder().id(id).timestamp(Instant.parse("2024-03-06T10:15:00Z")).build();
    }
}
