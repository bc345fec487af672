package com.example.perfoptimizer.recommendation;

import com.example.perfoptimizer.analysis.CrossComponentAnalysis;
import com.example.perfoptimizer.collector.CollectedSnapshots;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Runs every {@link RecommendationRule} against one cycle's input.
 *
 * Output is deduplicated by rule key and sorted critical first; ties keep rule order.
 * A rule that throws is skipped for this cycle.
 */
@Slf4j
@Component
public class RecommendationGenerator {

    private final List<RecommendationRule> rules;
    private final Clock clock;

    public RecommendationGenerator(List<RecommendationRule> rules, Clock clock) {
        this.rules = List.copyOf(rules);
        this.clock = clock;
        log.info("Loaded {} recommendation rules", this.rules.size());
    }

    public List<Recommendation> generate(CollectedSnapshots snapshots, CrossComponentAnalysis analysis) {
        Instant now = clock.instant();
        Map<String, Recommendation> byKey = new LinkedHashMap<>();

        for (RecommendationRule rule : rules) {
            if (byKey.containsKey(rule.getKey())) {
                continue;
            }
            try {
                Optional<Recommendation> result = rule.evaluate(snapshots, analysis);
                result.ifPresent(draft -> byKey.put(rule.getKey(), finish(rule, draft, now)));
            } catch (RuntimeException e) {
                log.warn("Recommendation rule {} failed: {}", rule.getKey(), e.getMessage());
            }
        }

        List<Recommendation> recommendations = new ArrayList<>(byKey.values());
        recommendations.sort(Comparator.comparing(Recommendation::getPriority));
        log.debug("Generated {} recommendations", recommendations.size());
        return recommendations;
    }

    private Recommendation finish(RecommendationRule rule, Recommendation draft, Instant now) {
        if (draft.isAutomated() != (draft.getAutomationCommand() != null)) {
            throw new IllegalStateException("Rule " + rule.getKey()
                    + " produced an automated flag without a matching automation command");
        }
        return draft.toBuilder()
                .id(UUID.randomUUID().toString())
                .ruleKey(rule.getKey())
                .status(Recommendation.Status.PENDING)
                .createdAt(now)
                .build();
    }
}
