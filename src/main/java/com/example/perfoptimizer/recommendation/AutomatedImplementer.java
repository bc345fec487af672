package com.example.perfoptimizer.recommendation;

import com.example.perfoptimizer.adapter.AdapterName;
import com.example.perfoptimizer.adapter.AdapterRegistry;
import com.example.perfoptimizer.adapter.CommandResult;
import com.example.perfoptimizer.adapter.SubsystemAdapter;
import com.example.perfoptimizer.service.AuditService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Applies automated recommendations through the adapter that owns their category.
 *
 * A recommendation becomes IMPLEMENTED only when the adapter reports success. Failures,
 * exceptions and missing adapters leave it PENDING for the next cycle.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AutomatedImplementer {

    private final AdapterRegistry adapterRegistry;
    private final AuditService auditService;
    private final MeterRegistry meterRegistry;

    /**
     * Returns the input list in the same order with updated statuses.
     */
    public List<Recommendation> implement(List<Recommendation> recommendations) {
        List<Recommendation> result = new ArrayList<>(recommendations.size());
        for (Recommendation recommendation : recommendations) {
            if (!recommendation.isAutomatable()) {
                result.add(recommendation);
                continue;
            }
            result.add(apply(recommendation));
        }
        return result;
    }

    private Recommendation apply(Recommendation recommendation) {
        Optional<AdapterName> target = recommendation.getCategory().getTargetAdapter();
        if (target.isEmpty()) {
            log.warn("No command target for {} recommendation '{}'",
                    recommendation.getCategory().getValue(), recommendation.getTitle());
            return recommendation;
        }
        Optional<SubsystemAdapter<?>> adapter = adapterRegistry.get(target.get());
        if (adapter.isEmpty()) {
            log.warn("Adapter {} not registered, '{}' stays pending",
                    target.get().getKey(), recommendation.getTitle());
            return recommendation;
        }

        CommandResult outcome;
        try {
            outcome = adapter.get().command(recommendation.getAutomationCommand(),
                    recommendation.getRuleKey(), commandParameters(recommendation));
        } catch (Exception e) {
            log.error("Implementing '{}' failed: {}", recommendation.getTitle(), e.getMessage());
            outcome = CommandResult.failure(e.getMessage());
        }

        auditService.log("implementer", "RECOMMENDATION_IMPLEMENTED", recommendation.getRuleKey(),
                Map.of("command", recommendation.getAutomationCommand(),
                        "adapter", target.get().getKey(),
                        "detail", String.valueOf(outcome.getDetail())),
                outcome.isSuccess());

        if (!outcome.isSuccess()) {
            log.warn("Automated optimization '{}' not applied: {}", recommendation.getTitle(), outcome.getDetail());
            return recommendation;
        }
        log.info("Implemented automated optimization '{}' via {}", recommendation.getTitle(), target.get().getKey());
        Counter.builder("optimizer.recommendations.implemented")
                .tag("category", recommendation.getCategory().getValue())
                .register(meterRegistry)
                .increment();
        return recommendation.withStatus(Recommendation.Status.IMPLEMENTED);
    }

    private static Map<String, Object> commandParameters(Recommendation recommendation) {
        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("recommendationId", recommendation.getId());
        parameters.put("priority", recommendation.getPriority().getValue());
        return parameters;
    }
}
