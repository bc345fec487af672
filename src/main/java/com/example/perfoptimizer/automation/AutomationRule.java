package com.example.perfoptimizer.automation;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A standing automation policy. Bound from perf-optimizer.automation-rules, rule files or the REST API.
 * The engine keeps its own copy; {@code lastTriggered} is filled in from the cooldown tracker on read.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AutomationRule {

    private String id;
    private String name;
    private AutomationTrigger trigger;

    @Builder.Default
    private List<AutomationAction> actions = new ArrayList<>();

    @Builder.Default
    private boolean enabled = true;

    @Builder.Default
    private int cooldownMinutes = 15;

    private Instant lastTriggered;
}
