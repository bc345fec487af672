package com.example.perfoptimizer.automation;

import com.example.perfoptimizer.adapter.PerformanceSnapshot;
import com.example.perfoptimizer.analysis.CrossComponentAnalysis;
import com.example.perfoptimizer.collector.CollectedSnapshots;
import com.example.perfoptimizer.recommendation.rules.DegradingTrendsRule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.List;
import java.util.Locale;
import java.util.OptionalDouble;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Decides whether a rule's trigger holds for the current snapshots.
 *
 * Keeps two pieces of per-rule state: when a duration-gated threshold started holding, and
 * the last schedule boundary a rule fired on.
 */
@Slf4j
@Component
public class TriggerEvaluator {

    static final Duration SCHEDULE_WINDOW = Duration.ofMinutes(1);

    private final MetricResolver metricResolver;
    private final Clock clock;
    private final ConcurrentMap<String, Instant> thresholdHoldingSince = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Instant> scheduleBoundaries = new ConcurrentHashMap<>();

    public TriggerEvaluator(MetricResolver metricResolver, Clock clock) {
        this.metricResolver = metricResolver;
        this.clock = clock;
    }

    public boolean matches(AutomationRule rule, CollectedSnapshots snapshots,
                           CrossComponentAnalysis analysis, Instant now) {
        AutomationTrigger trigger = rule.getTrigger();
        if (trigger == null || trigger.getType() == null) {
            return false;
        }
        return switch (trigger.getType()) {
            case THRESHOLD -> thresholdHolds(rule, trigger, snapshots, now);
            case ANOMALY -> anomalyPresent(trigger, snapshots);
            case SCHEDULE -> atNewScheduleBoundary(rule.getId(), trigger.getValue(), now);
            case PERFORMANCE_DEGRADATION -> analysis.getTrends().stream()
                    .anyMatch(t -> t.isSignificantDegradation(DegradingTrendsRule.MIN_SIGNIFICANCE));
        };
    }

    public void forget(String ruleId) {
        thresholdHoldingSince.remove(ruleId);
        scheduleBoundaries.remove(ruleId);
    }

    private boolean thresholdHolds(AutomationRule rule, AutomationTrigger trigger,
                                   CollectedSnapshots snapshots, Instant now) {
        boolean holds = compare(trigger, snapshots);
        Integer duration = trigger.getDuration();
        if (duration == null || duration <= 0) {
            return holds;
        }
        if (!holds) {
            thresholdHoldingSince.remove(rule.getId());
            return false;
        }
        Instant since = thresholdHoldingSince.computeIfAbsent(rule.getId(), id -> now);
        return !now.isBefore(since.plus(Duration.ofMinutes(duration)));
    }

    private boolean compare(AutomationTrigger trigger, CollectedSnapshots snapshots) {
        if (trigger.getCondition() == null || trigger.getCondition() == Condition.PATTERN) {
            return false;
        }
        OptionalDouble actual = metricResolver.resolve(trigger.getMetric(), snapshots);
        if (actual.isEmpty()) {
            return false;
        }
        if (trigger.getValue() == null) {
            return false;
        }
        double expected;
        try {
            expected = Double.parseDouble(trigger.getValue().trim());
        } catch (NumberFormatException e) {
            log.warn("Threshold value '{}' for metric {} is not a number", trigger.getValue(), trigger.getMetric());
            return false;
        }
        return trigger.getCondition().test(actual.getAsDouble(), expected);
    }

    private boolean anomalyPresent(AutomationTrigger trigger, CollectedSnapshots snapshots) {
        if (trigger.getMetric() == null) {
            return false;
        }
        Pattern typePattern = null;
        if (trigger.getCondition() == Condition.PATTERN) {
            try {
                typePattern = Pattern.compile(trigger.getMetric());
            } catch (PatternSyntaxException e) {
                log.warn("Invalid anomaly pattern '{}': {}", trigger.getMetric(), e.getDescription());
                return false;
            }
        }
        Pattern pattern = typePattern;
        return snapshots.performance()
                .map(PerformanceSnapshot::getAnomalies)
                .orElse(List.of())
                .stream()
                .filter(PerformanceSnapshot.Anomaly::isOpen)
                .filter(a -> a.getType() != null)
                .filter(a -> pattern != null ? pattern.matcher(a.getType()).matches() : a.getType().equals(trigger.getMetric()))
                .anyMatch(a -> a.getSeverity() != null && a.getSeverity().equalsIgnoreCase(trigger.getValue()));
    }

    /**
     * True during the first minute after an hourly, daily or weekly (Sunday) boundary, once per boundary.
     */
    private boolean atNewScheduleBoundary(String ruleId, String period, Instant now) {
        if (period == null) {
            return false;
        }
        ZonedDateTime local = now.atZone(clock.getZone());
        ZonedDateTime boundary;
        switch (period.trim().toLowerCase(Locale.ROOT)) {
            case "hourly" -> boundary = local.truncatedTo(ChronoUnit.HOURS);
            case "daily" -> boundary = local.truncatedTo(ChronoUnit.DAYS);
            case "weekly" -> boundary = local.with(TemporalAdjusters.previousOrSame(DayOfWeek.SUNDAY))
                    .truncatedTo(ChronoUnit.DAYS);
            default -> {
                log.warn("Unknown schedule '{}' on rule {}", period, ruleId);
                return false;
            }
        }
        if (Duration.between(boundary, local).compareTo(SCHEDULE_WINDOW) >= 0) {
            return false;
        }
        Instant boundaryInstant = boundary.toInstant();
        Instant previous = scheduleBoundaries.put(ruleId, boundaryInstant);
        return !boundaryInstant.equals(previous);
    }
}
