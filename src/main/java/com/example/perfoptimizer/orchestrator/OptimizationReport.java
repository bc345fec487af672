package com.example.perfoptimizer.orchestrator;

import com.example.perfoptimizer.adapter.AdapterName;
import com.example.perfoptimizer.adapter.AdapterSnapshot;
import com.example.perfoptimizer.analysis.Correlation;
import com.example.perfoptimizer.analysis.PerformanceTrend;
import com.example.perfoptimizer.recommendation.ActionItem;
import com.example.perfoptimizer.recommendation.Recommendation;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Output of one optimization cycle. Built once at the end of the cycle and never modified.
 */
@Value
@Builder
public class OptimizationReport {

    String id;
    Instant timestamp;
    ReportSummary summary;

    /** Snapshots of the adapters that answered; failed adapters are absent. */
    Map<AdapterName, AdapterSnapshot> componentReports;

    /** Adapter to failure reason. */
    Map<AdapterName, String> failedComponents;

    /** Top-N by priority. */
    List<Recommendation> recommendations;

    List<ActionItem> actionItems;
    List<PerformanceTrend> trends;
    List<Correlation> correlations;
    Instant nextReview;
}
