package com.example.perfoptimizer.automation;

import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Per-rule lastTriggered timestamps. {@link #tryClaim} is the only write path and is atomic per rule,
 * so two concurrent sweeps can never both fire the same rule inside one cooldown window.
 */
@Component
public class CooldownTracker {

    private final ConcurrentMap<String, Instant> lastTriggered = new ConcurrentHashMap<>();

    public boolean isArmed(String ruleId, int cooldownMinutes, Instant now) {
        Instant last = lastTriggered.get(ruleId);
        return last == null || !now.isBefore(last.plus(Duration.ofMinutes(cooldownMinutes)));
    }

    /**
     * Moves the rule from armed to cooling. Returns false if another caller got there first
     * or the rule is still cooling.
     */
    public boolean tryClaim(String ruleId, int cooldownMinutes, Instant now) {
        AtomicBoolean claimed = new AtomicBoolean(false);
        lastTriggered.compute(ruleId, (id, last) -> {
            if (last == null || !now.isBefore(last.plus(Duration.ofMinutes(cooldownMinutes)))) {
                claimed.set(true);
                return now;
            }
            return last;
        });
        return claimed.get();
    }

    public Optional<Instant> getLastTriggered(String ruleId) {
        return Optional.ofNullable(lastTriggered.get(ruleId));
    }

    /** Seeds a timestamp carried by a rule definition, keeping the later of the two. */
    public void seed(String ruleId, Instant triggeredAt) {
        if (triggeredAt != null) {
            lastTriggered.merge(ruleId, triggeredAt, (a, b) -> a.isAfter(b) ? a : b);
        }
    }

    public void forget(String ruleId) {
        lastTriggered.remove(ruleId);
    }
}
