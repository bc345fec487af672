package com.example.perfoptimizer.recommendation;

import com.example.perfoptimizer.analysis.CrossComponentAnalysis;
import com.example.perfoptimizer.collector.CollectedSnapshots;

import java.util.Optional;

/**
 * One generation rule. Rules only read their input; the generator assigns id, status
 * and creation time.
 */
public interface RecommendationRule {

    /** Unique rule identity, e.g. "database.slow-queries". */
    String getKey();

    Optional<Recommendation> evaluate(CollectedSnapshots snapshots, CrossComponentAnalysis analysis);
}
