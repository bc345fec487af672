package com.example.perfoptimizer.recommendation;

import com.example.perfoptimizer.adapter.AdapterName;
import com.example.perfoptimizer.adapter.AdapterRegistry;
import com.example.perfoptimizer.adapter.CommandResult;
import com.example.perfoptimizer.adapter.SubsystemAdapter;
import com.example.perfoptimizer.service.AuditService;
import com.example.perfoptimizer.support.StubAdapter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AutomatedImplementerTest {

    @Mock
    private AdapterRegistry adapterRegistry;

    @Mock
    private AuditService auditService;

    private SimpleMeterRegistry meterRegistry;
    private AutomatedImplementer implementer;
    private StubAdapter cacheAdapter;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        implementer = new AutomatedImplementer(adapterRegistry, auditService, meterRegistry);
        cacheAdapter = new StubAdapter(AdapterName.CACHE, null);
        lenient().when(adapterRegistry.get(any())).thenReturn(Optional.empty());
        lenient().when(adapterRegistry.get(AdapterName.CACHE))
                .thenReturn(Optional.<SubsystemAdapter<?>>of(cacheAdapter));
    }

    @Test
    void successfulCommandMarksImplemented() {
        Recommendation warm = automated("cache.hit-rate", Recommendation.Category.CACHE, "warm_cache");

        List<Recommendation> result = implementer.implement(List.of(warm));

        assertThat(result).singleElement()
                .satisfies(r -> assertThat(r.getStatus()).isEqualTo(Recommendation.Status.IMPLEMENTED));
        assertThat(cacheAdapter.getCommands()).singleElement().satisfies(command -> {
            assertThat(command.actionType()).isEqualTo("warm_cache");
            assertThat(command.target()).isEqualTo("cache.hit-rate");
            assertThat(command.parameters()).containsEntry("recommendationId", "rec-cache.hit-rate")
                    .containsEntry("priority", "high");
        });
        assertThat(meterRegistry.counter("optimizer.recommendations.implemented", "category", "cache").count())
                .isEqualTo(1.0);
        verify(auditService).log(eq("implementer"), eq("RECOMMENDATION_IMPLEMENTED"), eq("cache.hit-rate"),
                anyMap(), eq(true));
    }

    @Test
    void failedCommandStaysPending() {
        cacheAdapter.respondWith(type -> CommandResult.failure("cache cluster read-only"));

        List<Recommendation> result = implementer.implement(
                List.of(automated("cache.hit-rate", Recommendation.Category.CACHE, "warm_cache")));

        assertThat(result.get(0).getStatus()).isEqualTo(Recommendation.Status.PENDING);
        verify(auditService).log(anyString(), eq("RECOMMENDATION_IMPLEMENTED"), anyString(), anyMap(), eq(false));
    }

    @Test
    void throwingAdapterStaysPending() {
        cacheAdapter.respondWith(type -> {
            throw new IllegalStateException("connection reset");
        });

        List<Recommendation> result = implementer.implement(
                List.of(automated("cache.hit-rate", Recommendation.Category.CACHE, "warm_cache")));

        assertThat(result.get(0).getStatus()).isEqualTo(Recommendation.Status.PENDING);
    }

    @Test
    void missingAdapterStaysPending() {
        Recommendation queries = automated("database.slow-queries", Recommendation.Category.DATABASE, "optimize_queries");

        List<Recommendation> result = implementer.implement(List.of(queries));

        assertThat(result).containsExactly(queries);
        verify(auditService, never()).log(anyString(), anyString(), anyString(), anyMap(), anyBoolean());
    }

    @Test
    void manualRecommendationsPassThroughInOrder() {
        Recommendation manual = Recommendation.builder()
                .id("rec-manual").ruleKey("performance.slow-endpoints")
                .priority(Recommendation.Priority.MEDIUM).category(Recommendation.Category.APPLICATION)
                .status(Recommendation.Status.PENDING).automated(false)
                .build();
        Recommendation warm = automated("cache.hit-rate", Recommendation.Category.CACHE, "warm_cache");

        List<Recommendation> result = implementer.implement(List.of(manual, warm));

        assertThat(result).extracting(Recommendation::getRuleKey)
                .containsExactly("performance.slow-endpoints", "cache.hit-rate");
        assertThat(result.get(0)).isSameAs(manual);
        assertThat(cacheAdapter.getCommands()).hasSize(1);
    }

    @Test
    void alreadyImplementedIsNotReapplied() {
        Recommendation done = automated("cache.hit-rate", Recommendation.Category.CACHE, "warm_cache")
                .withStatus(Recommendation.Status.IMPLEMENTED);

        implementer.implement(List.of(done));

        assertThat(cacheAdapter.getCommands()).isEmpty();
    }

    private static Recommendation automated(String ruleKey, Recommendation.Category category, String command) {
        return Recommendation.builder()
                .id("rec-" + ruleKey)
                .ruleKey(ruleKey)
                .priority(Recommendation.Priority.HIGH)
                .category(category)
                .title(ruleKey)
                .status(Recommendation.Status.PENDING)
                .automated(true)
                .automationCommand(command)
                .createdAt(Instant.parse("2024-03-06T10:15:00Z"))
                .build();
    }
}
