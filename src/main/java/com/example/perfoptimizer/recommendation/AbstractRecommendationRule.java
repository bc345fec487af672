package com.example.perfoptimizer.recommendation;

import java.util.List;

/**
 * Base class for rules: pins the rule key and fills in the automation fields consistently.
 */
public abstract class AbstractRecommendationRule implements RecommendationRule {

    private final String key;

    protected AbstractRecommendationRule(String key) {
        this.key = key;
    }

    @Override
    public String getKey() {
        return key;
    }

    protected Recommendation.RecommendationBuilder manual(Recommendation.Priority priority,
                                                          Recommendation.Category category) {
        return Recommendation.builder()
                .ruleKey(key)
                .priority(priority)
                .category(category)
                .automated(false)
                .automationCommand(null);
    }

    protected Recommendation.RecommendationBuilder automated(Recommendation.Priority priority,
                                                             Recommendation.Category category,
                                                             String command) {
        return Recommendation.builder()
                .ruleKey(key)
                .priority(priority)
                .category(category)
                .automated(true)
                .automationCommand(command);
    }

    protected static Recommendation.Impact impact(String performance, String cost, String risk) {
        return Recommendation.Impact.builder().performance(performance).cost(cost).risk(risk).build();
    }

    protected static Recommendation.Implementation implementation(String effort, String timeline, String... steps) {
        return Recommendation.Implementation.builder()
                .effort(effort)
                .timeline(timeline)
                .steps(List.of(steps))
                .build();
    }
}
