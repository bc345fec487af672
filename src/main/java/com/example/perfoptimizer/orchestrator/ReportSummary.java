package com.example.perfoptimizer.orchestrator;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ReportSummary {
    double overallHealthScore;
    /** Critical-priority recommendations plus components in critical status. */
    int criticalIssues;
    /**
     * Every recommendation generated in the cycle, counted before the max-recommendations cap.
     * Exceeds {@code OptimizationReport.getRecommendations().size()} whenever the cap applied.
     */
    int recommendationsGenerated;
    /** Automated recommendations whose command succeeded, also counted before the cap. */
    int optimizationsImplemented;
    double performanceImprovementPercent;
    long estimatedCostSavings;
}
