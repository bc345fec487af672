package com.example.perfoptimizer.automation;

import com.example.perfoptimizer.adapter.CommandResult;
import com.example.perfoptimizer.analysis.CrossComponentAnalysis;
import com.example.perfoptimizer.collector.CollectedSnapshots;
import com.example.perfoptimizer.service.AuditService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Evaluates automation rules against live snapshots and runs their actions.
 *
 * Each rule is armed or cooling. A sweep walks rules in insertion order; a rule that is armed and
 * whose trigger holds is claimed (lastTriggered = now) before its first action runs. Actions run in
 * order, a failed action does not stop the ones after it, and only the failed action's own rollback runs.
 */
@Slf4j
@Component
public class AutomationRuleEngine {

    private final TriggerEvaluator triggerEvaluator;
    private final CooldownTracker cooldownTracker;
    private final ActionDispatcher actionDispatcher;
    private final AuditService auditService;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    private final List<AutomationRule> rules = new CopyOnWriteArrayList<>();

    public AutomationRuleEngine(TriggerEvaluator triggerEvaluator,
                                CooldownTracker cooldownTracker,
                                ActionDispatcher actionDispatcher,
                                AuditService auditService,
                                MeterRegistry meterRegistry,
                                Clock clock) {
        this.triggerEvaluator = triggerEvaluator;
        this.cooldownTracker = cooldownTracker;
        this.actionDispatcher = actionDispatcher;
        this.auditService = auditService;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    /**
     * Replace the whole rule table. Validates everything before touching the current table.
     */
    public synchronized void replaceRules(Collection<AutomationRule> definitions) {
        Map<String, AutomationRule> next = validate(definitions);
        Set<String> retained = new HashSet<>(next.keySet());
        for (AutomationRule old : rules) {
            if (!retained.contains(old.getId())) {
                forget(old.getId());
            }
        }
        next.values().forEach(r -> cooldownTracker.seed(r.getId(), r.getLastTriggered()));
        rules.clear();
        rules.addAll(next.values());
        log.info("Loaded {} automation rules", rules.size());
    }

    /**
     * Checks a prospective rule table without installing it.
     *
     * @throws IllegalArgumentException on a rule without trigger type, a negative cooldown or a duplicate id
     */
    public Map<String, AutomationRule> validate(Collection<AutomationRule> definitions) {
        Map<String, AutomationRule> next = new LinkedHashMap<>();
        for (AutomationRule definition : definitions) {
            AutomationRule rule = copyOf(definition);
            if (next.putIfAbsent(rule.getId(), rule) != null) {
                throw new IllegalArgumentException("Duplicate automation rule id: " + rule.getId());
            }
        }
        return next;
    }

    public synchronized AutomationRule addRule(AutomationRule definition) {
        AutomationRule rule = copyOf(definition);
        if (indexOf(rule.getId()) >= 0) {
            throw new IllegalArgumentException("Automation rule already exists: " + rule.getId());
        }
        cooldownTracker.seed(rule.getId(), rule.getLastTriggered());
        rules.add(rule);
        log.info("Added automation rule {} ({})", rule.getId(), rule.getName());
        return view(rule);
    }

    public synchronized boolean removeRule(String id) {
        int index = indexOf(id);
        if (index < 0) {
            return false;
        }
        rules.remove(index);
        forget(id);
        log.info("Removed automation rule {}", id);
        return true;
    }

    public synchronized Optional<AutomationRule> setEnabled(String id, boolean enabled) {
        int index = indexOf(id);
        if (index < 0) {
            return Optional.empty();
        }
        AutomationRule updated = rules.get(index).toBuilder().enabled(enabled).build();
        rules.set(index, updated);
        log.info("Automation rule {} {}", id, enabled ? "enabled" : "disabled");
        return Optional.of(view(updated));
    }

    /**
     * Rules in evaluation order, with lastTriggered filled in.
     */
    public List<AutomationRule> getRules() {
        List<AutomationRule> result = new ArrayList<>(rules.size());
        for (AutomationRule rule : rules) {
            result.add(view(rule));
        }
        return result;
    }

    public Optional<AutomationRule> getRule(String id) {
        return rules.stream().filter(r -> r.getId().equals(id)).findFirst().map(this::view);
    }

    /**
     * One rule sweep. Returns the number of rules that fired.
     */
    public int evaluate(CollectedSnapshots snapshots, CrossComponentAnalysis analysis) {
        Instant now = clock.instant();
        int fired = 0;
        for (AutomationRule rule : rules) {
            try {
                if (!rule.isEnabled() || !cooldownTracker.isArmed(rule.getId(), rule.getCooldownMinutes(), now)) {
                    continue;
                }
                if (!triggerEvaluator.matches(rule, snapshots, analysis, now)) {
                    continue;
                }
                if (!cooldownTracker.tryClaim(rule.getId(), rule.getCooldownMinutes(), now)) {
                    continue;
                }
                fire(rule, now);
                fired++;
            } catch (Exception e) {
                log.error("Automation rule {} failed: {}", rule.getId(), e.getMessage(), e);
            }
        }
        return fired;
    }

    private void fire(AutomationRule rule, Instant now) {
        log.info("Automation rule triggered: {} ({})", rule.getName(), rule.getId());
        Counter.builder("optimizer.rule.fired")
                .tag("rule", rule.getId())
                .register(meterRegistry)
                .increment();
        auditService.log("rule-engine", "RULE_FIRED", rule.getId(),
                Map.of("name", String.valueOf(rule.getName()), "triggeredAt", now.toString()));

        int step = 0;
        for (AutomationAction action : rule.getActions()) {
            step++;
            CommandResult result = actionDispatcher.dispatch(rule, action);
            auditService.log("rule-engine", "RULE_ACTION", rule.getId(),
                    Map.of("step", step, "type", typeOf(action), "detail", String.valueOf(result.getDetail())),
                    result.isSuccess());
            if (result.isSuccess()) {
                continue;
            }
            log.warn("Rule {} action {} ({}) failed: {}", rule.getId(), step, typeOf(action), result.getDetail());
            if (action != null && action.getRollback() != null) {
                CommandResult rollback = actionDispatcher.dispatch(rule, action.getRollback());
                log.info("Rule {} rollback of action {} ({}): {}", rule.getId(), step,
                        typeOf(action.getRollback()), rollback.isSuccess() ? "ok" : rollback.getDetail());
                auditService.log("rule-engine", "RULE_ROLLBACK", rule.getId(),
                        Map.of("step", step, "type", typeOf(action.getRollback()),
                                "detail", String.valueOf(rollback.getDetail())),
                        rollback.isSuccess());
            }
        }
    }

    private AutomationRule copyOf(AutomationRule definition) {
        if (definition == null) {
            throw new IllegalArgumentException("Automation rule must not be null");
        }
        if (definition.getTrigger() == null || definition.getTrigger().getType() == null) {
            throw new IllegalArgumentException("Automation rule '" + definition.getName() + "' has no trigger type");
        }
        if (definition.getCooldownMinutes() < 0) {
            throw new IllegalArgumentException("Automation rule '" + definition.getName() + "' has a negative cooldown");
        }
        String id = definition.getId() != null && !definition.getId().isBlank()
                ? definition.getId() : UUID.randomUUID().toString();
        return deepCopy(definition).toBuilder()
                .id(id)
                .name(definition.getName() != null ? definition.getName() : id)
                .build();
    }

    private AutomationRule view(AutomationRule rule) {
        return deepCopy(rule).toBuilder()
                .lastTriggered(cooldownTracker.getLastTriggered(rule.getId()).orElse(null))
                .build();
    }

    /**
     * Rules, triggers and actions are mutable beans; nothing handed in or out may alias the table.
     */
    private static AutomationRule deepCopy(AutomationRule rule) {
        List<AutomationAction> actions = new ArrayList<>();
        if (rule.getActions() != null) {
            for (AutomationAction action : rule.getActions()) {
                actions.add(copyOf(action));
            }
        }
        return rule.toBuilder()
                .trigger(rule.getTrigger() != null ? rule.getTrigger().toBuilder().build() : null)
                .actions(Collections.unmodifiableList(actions))
                .build();
    }

    private static AutomationAction copyOf(AutomationAction action) {
        if (action == null) {
            return null;
        }
        return action.toBuilder()
                .parameters(action.getParameters() != null ? new HashMap<>(action.getParameters()) : new HashMap<>())
                .rollback(copyOf(action.getRollback()))
                .build();
    }

    private int indexOf(String id) {
        for (int i = 0; i < rules.size(); i++) {
            if (rules.get(i).getId().equals(id)) {
                return i;
            }
        }
        return -1;
    }

    private void forget(String id) {
        cooldownTracker.forget(id);
        triggerEvaluator.forget(id);
    }

    private static String typeOf(AutomationAction action) {
        return action != null && action.getType() != null ? action.getType().getValue() : "unknown";
    }
}
