package com.example.perfoptimizer.automation;

import com.example.perfoptimizer.adapter.AdapterName;
import com.example.perfoptimizer.adapter.AdapterRegistry;
import com.example.perfoptimizer.adapter.CommandResult;
import com.example.perfoptimizer.adapter.SubsystemAdapter;
import com.example.perfoptimizer.event.OrchestratorEvent;
import com.example.perfoptimizer.event.OrchestratorEventBus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;

/**
 * Routes one rule action: scaling and restarts to the load balancer, cache clears to the cache,
 * database optimization to the database, alerts and incidents to the event bus.
 * Never throws; every problem comes back as a failed {@link CommandResult}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ActionDispatcher {

    private final AdapterRegistry adapterRegistry;
    private final OrchestratorEventBus eventBus;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public CommandResult dispatch(AutomationRule rule, AutomationAction action) {
        CommandResult result;
        try {
            result = route(rule, action);
        } catch (Exception e) {
            log.error("Action {} of rule {} threw: {}", typeOf(action), rule.getId(), e.getMessage());
            result = CommandResult.failure(e.getMessage());
        }
        Counter.builder("optimizer.rule.action")
                .tag("type", typeOf(action))
                .tag("outcome", result.isSuccess() ? "success" : "failure")
                .register(meterRegistry)
                .increment();
        return result;
    }

    private CommandResult route(AutomationRule rule, AutomationAction action) {
        if (action == null || action.getType() == null) {
            return CommandResult.failure("action has no type");
        }
        Map<String, Object> parameters = action.getParameters() != null ? action.getParameters() : Map.of();
        switch (action.getType()) {
            case SEND_ALERT -> {
                eventBus.publish(OrchestratorEvent.alert(
                        stringParam(parameters, "message", "Automation rule '" + rule.getName() + "' triggered"),
                        stringParam(parameters, "severity", "warning"),
                        rule.getId(), clock.instant()));
                return CommandResult.success("alert published");
            }
            case CREATE_INCIDENT -> {
                eventBus.publish(OrchestratorEvent.incidentCreated(
                        stringParam(parameters, "description", "Automation rule '" + rule.getName() + "' triggered"),
                        stringParam(parameters, "severity", "high"),
                        true, rule.getId(), clock.instant()));
                return CommandResult.success("incident raised");
            }
            default -> {
                AdapterName adapterName = action.getType().getAdapter().orElseThrow();
                Optional<SubsystemAdapter<?>> adapter = adapterRegistry.get(adapterName);
                if (adapter.isEmpty()) {
                    return CommandResult.failure("adapter " + adapterName.getKey() + " not registered");
                }
                CommandResult result = adapter.get().command(action.getType().getValue(), action.getTarget(), parameters);
                return result != null ? result : CommandResult.failure("adapter returned no result");
            }
        }
    }

    private static String stringParam(Map<String, Object> parameters, String key, String fallback) {
        Object value = parameters.get(key);
        return value != null ? value.toString() : fallback;
    }

    private static String typeOf(AutomationAction action) {
        return action != null && action.getType() != null ? action.getType().getValue() : "unknown";
    }
}
