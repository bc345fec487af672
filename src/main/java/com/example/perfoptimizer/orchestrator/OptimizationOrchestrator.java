package com.example.perfoptimizer.orchestrator;

import com.example.perfoptimizer.adapter.AdapterName;
import com.example.perfoptimizer.adapter.AdapterRegistry;
import com.example.perfoptimizer.analysis.CrossComponentAnalysis;
import com.example.perfoptimizer.analysis.CrossComponentAnalyzer;
import com.example.perfoptimizer.automation.AutomationRule;
import com.example.perfoptimizer.automation.AutomationRuleEngine;
import com.example.perfoptimizer.automation.RuleFileLoader;
import com.example.perfoptimizer.collector.CollectedSnapshots;
import com.example.perfoptimizer.collector.DataCollector;
import com.example.perfoptimizer.config.OptimizerProperties;
import com.example.perfoptimizer.event.OrchestratorEvent;
import com.example.perfoptimizer.event.OrchestratorEventBus;
import com.example.perfoptimizer.health.ComponentHealth;
import com.example.perfoptimizer.health.HealthScorer;
import com.example.perfoptimizer.health.SystemHealth;
import com.example.perfoptimizer.recommendation.ActionItem;
import com.example.perfoptimizer.recommendation.AutomatedImplementer;
import com.example.perfoptimizer.recommendation.ImprovementEstimator;
import com.example.perfoptimizer.recommendation.Recommendation;
import com.example.perfoptimizer.recommendation.RecommendationGenerator;
import com.example.perfoptimizer.service.AuditService;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Top-level control loop.
 *
 * Owns three independent schedules on the optimizer scheduler:
 * - optimization cycle: collect, analyze, recommend, implement, score, report
 * - health check: collect and score
 * - rule sweep: collect, analyze, evaluate automation rules
 *
 * Cycles are serialized by a lock. Timer ticks skip when a cycle is already running; on-demand
 * triggers wait for it. stop() cancels future ticks but lets an in-flight cycle finish and
 * append its report.
 */
@Slf4j
@Service
public class OptimizationOrchestrator {

    private static final int HEALTH_RECOMMENDATIONS = 5;

    private final OptimizerProperties properties;
    private final AdapterRegistry adapterRegistry;
    private final DataCollector dataCollector;
    private final CrossComponentAnalyzer analyzer;
    private final RecommendationGenerator recommendationGenerator;
    private final AutomatedImplementer implementer;
    private final ImprovementEstimator improvementEstimator;
    private final AutomationRuleEngine ruleEngine;
    private final RuleFileLoader ruleFileLoader;
    private final HealthScorer healthScorer;
    private final ReportHistory reportHistory;
    private final OrchestratorEventBus eventBus;
    private final AuditService auditService;
    private final TaskScheduler scheduler;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    private final ReentrantLock cycleLock = new ReentrantLock();
    private final Object lifecycleMonitor = new Object();
    private final AtomicReference<OptimizationReport> lastReport = new AtomicReference<>();
    private final AtomicReference<SystemHealth> lastHealth = new AtomicReference<>();

    private volatile boolean initialized;
    private volatile boolean running;
    private ScheduledFuture<?> cycleTask;
    private ScheduledFuture<?> healthTask;
    private ScheduledFuture<?> sweepTask;

    public OptimizationOrchestrator(OptimizerProperties properties,
                                    AdapterRegistry adapterRegistry,
                                    DataCollector dataCollector,
                                    CrossComponentAnalyzer analyzer,
                                    RecommendationGenerator recommendationGenerator,
                                    AutomatedImplementer implementer,
                                    ImprovementEstimator improvementEstimator,
                                    AutomationRuleEngine ruleEngine,
                                    RuleFileLoader ruleFileLoader,
                                    HealthScorer healthScorer,
                                    ReportHistory reportHistory,
                                    OrchestratorEventBus eventBus,
                                    AuditService auditService,
                                    @Qualifier("optimizerScheduler") TaskScheduler scheduler,
                                    MeterRegistry meterRegistry,
                                    Clock clock) {
        this.properties = properties;
        this.adapterRegistry = adapterRegistry;
        this.dataCollector = dataCollector;
        this.analyzer = analyzer;
        this.recommendationGenerator = recommendationGenerator;
        this.implementer = implementer;
        this.improvementEstimator = improvementEstimator;
        this.ruleEngine = ruleEngine;
        this.ruleFileLoader = ruleFileLoader;
        this.healthScorer = healthScorer;
        this.reportHistory = reportHistory;
        this.eventBus = eventBus;
        this.auditService = auditService;
        this.scheduler = scheduler;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    // --- Lifecycle ---

    /**
     * Register adapters for the enabled features and load automation rules.
     *
     * @throws com.example.perfoptimizer.config.OptimizerConfigurationException if a required adapter
     *         cannot be constructed
     */
    public void initialize() {
        synchronized (lifecycleMonitor) {
            List<AutomationRule> rules = new ArrayList<>(properties.getAutomationRules());
            rules.addAll(ruleFileLoader.load(properties.getRulesDirectory()));
            ruleEngine.validate(rules);

            adapterRegistry.registerAll(properties.requiredAdapters(), properties);
            ruleEngine.replaceRules(rules);
            reportHistory.resize(properties.getHistorySize());
            initialized = true;
            log.info("Optimizer initialized: {} adapters, {} automation rules",
                    adapterRegistry.getAdapterCount(), rules.size());
        }
    }

    public void start() {
        synchronized (lifecycleMonitor) {
            if (!initialized) {
                throw new IllegalStateException("Optimizer must be initialized before it is started");
            }
            if (running) {
                log.warn("Optimizer already running, ignoring start()");
                return;
            }
            running = true;
            scheduleCycle();
            healthTask = scheduler.scheduleAtFixedRate(this::scheduledHealthCheck, properties.getHealthCheckInterval());
            sweepTask = scheduler.scheduleAtFixedRate(this::scheduledRuleSweep, properties.getRuleSweepInterval());
            log.info("Optimizer started (cycle every {} min, automated optimization {})",
                    properties.getOptimizationInterval().toMinutes(),
                    properties.isEnableAutomatedOptimization() ? "on" : "off");
        }
        auditService.log("orchestrator", "OPTIMIZER_STARTED", "orchestrator", null);
        eventBus.publish(OrchestratorEvent.started(clock.instant()));
    }

    @PreDestroy
    public void stop() {
        synchronized (lifecycleMonitor) {
            if (!running) {
                log.debug("Optimizer not running, ignoring stop()");
                return;
            }
            running = false;
            cycleTask = cancel(cycleTask);
            healthTask = cancel(healthTask);
            sweepTask = cancel(sweepTask);
            log.info("Optimizer stopped");
        }
        auditService.log("orchestrator", "OPTIMIZER_STOPPED", "orchestrator", null);
        eventBus.publish(OrchestratorEvent.stopped(clock.instant()));
    }

    public boolean isRunning() {
        return running;
    }

    public boolean isInitialized() {
        return initialized;
    }

    // --- Optimization cycle ---

    /**
     * Run one cycle now, waiting for an in-flight cycle to finish first.
     */
    public OptimizationReport triggerOptimizationCycle() {
        cycleLock.lock();
        try {
            return runCycle();
        } finally {
            cycleLock.unlock();
        }
    }

    void scheduledCycle() {
        if (!running) {
            return;
        }
        if (!cycleLock.tryLock()) {
            log.info("Optimization cycle still in progress, skipping this tick");
            return;
        }
        try {
            if (running) {
                runCycle();
            }
        } catch (Exception e) {
            log.error("Optimization cycle failed: {}", e.getMessage(), e);
        } finally {
            cycleLock.unlock();
        }
    }

    private OptimizationReport runCycle() {
        log.info("Starting optimization cycle");
        Timer.Sample sample = Timer.start(meterRegistry);

        CollectedSnapshots snapshots = dataCollector.collect();
        CrossComponentAnalysis analysis = analyzer.analyze(snapshots);
        List<Recommendation> generated = recommendationGenerator.generate(snapshots, analysis);
        List<Recommendation> processed = implementer.implement(generated);
        SystemHealth health = healthScorer.score(snapshots);

        Instant now = clock.instant();
        List<Recommendation> top = List.copyOf(processed.subList(0,
                Math.min(processed.size(), Math.max(0, properties.getMaxRecommendations()))));
        List<ActionItem> actionItems = top.stream()
                .filter(r -> !r.isAutomated())
                .map(r -> ActionItem.from(r, now))
                .collect(Collectors.toList());
        int implemented = (int) processed.stream()
                .filter(r -> r.isAutomated() && r.getStatus() == Recommendation.Status.IMPLEMENTED)
                .count();
        ImprovementEstimator.Estimate estimate = improvementEstimator.estimate(processed);

        OptimizationReport report = OptimizationReport.builder()
                .id(UUID.randomUUID().toString())
                .timestamp(now)
                .summary(ReportSummary.builder()
                        .overallHealthScore(health.getOverallScore())
                        .criticalIssues(criticalIssues(processed, health))
                        .recommendationsGenerated(generated.size())
                        .optimizationsImplemented(implemented)
                        .performanceImprovementPercent(estimate.performanceImprovementPercent())
                        .estimatedCostSavings(estimate.estimatedCostSavings())
                        .build())
                .componentReports(snapshots.getSnapshots())
                .failedComponents(snapshots.getFailures())
                .recommendations(top)
                .actionItems(List.copyOf(actionItems))
                .trends(analysis.getTrends())
                .correlations(analysis.getCorrelations())
                .nextReview(now.plus(properties.getReviewInterval()))
                .build();

        reportHistory.append(report);
        lastReport.set(report);
        lastHealth.set(withTopRecommendations(health, top));

        sample.stop(Timer.builder("optimizer.cycle.duration")
                .description("Duration of one optimization cycle")
                .register(meterRegistry));
        log.info("Optimization cycle completed: health {}, {} recommendations, {} implemented, {} adapters failed",
                String.format("%.1f", health.getOverallScore()), generated.size(), implemented,
                snapshots.getFailures().size());
        eventBus.publish(OrchestratorEvent.cycleCompleted(report));
        return report;
    }

    private static int criticalIssues(List<Recommendation> recommendations, SystemHealth health) {
        long criticalRecommendations = recommendations.stream()
                .filter(r -> r.getPriority() == Recommendation.Priority.CRITICAL)
                .count();
        long criticalComponents = health.getComponents().values().stream()
                .filter(c -> c.getStatus() == ComponentHealth.Status.CRITICAL)
                .count();
        return (int) (criticalRecommendations + criticalComponents);
    }

    // --- Health check and rule sweep ---

    void scheduledHealthCheck() {
        try {
            runHealthCheck();
        } catch (Exception e) {
            log.error("Health check failed: {}", e.getMessage(), e);
        }
    }

    private SystemHealth runHealthCheck() {
        SystemHealth health = healthScorer.score(dataCollector.collect());
        OptimizationReport report = lastReport.get();
        SystemHealth published = withTopRecommendations(health, report != null ? report.getRecommendations() : List.of());
        lastHealth.set(published);
        log.debug("Health check: {} ({})", published.getOverall().getValue(),
                String.format("%.1f", published.getOverallScore()));
        return published;
    }

    void scheduledRuleSweep() {
        try {
            CollectedSnapshots snapshots = dataCollector.collect();
            int fired = ruleEngine.evaluate(snapshots, analyzer.analyze(snapshots));
            if (fired > 0) {
                log.info("Rule sweep fired {} automation rules", fired);
            }
        } catch (Exception e) {
            log.error("Automation rule sweep failed: {}", e.getMessage(), e);
        }
    }

    private static SystemHealth withTopRecommendations(SystemHealth health, List<Recommendation> recommendations) {
        return health.toBuilder()
                .recommendations(List.copyOf(recommendations.subList(0, Math.min(HEALTH_RECOMMENDATIONS, recommendations.size()))))
                .build();
    }

    // --- Queries ---

    /**
     * Latest health check; runs one synchronously if none has happened yet.
     */
    public SystemHealth getSystemHealth() {
        SystemHealth health = lastHealth.get();
        return health != null ? health : runHealthCheck();
    }

    public Optional<OptimizationReport> getLastOptimizationReport() {
        return Optional.ofNullable(lastReport.get());
    }

    /**
     * Up to {@code limit} most recent reports, oldest first.
     */
    public List<OptimizationReport> getOptimizationHistory(int limit) {
        return reportHistory.latest(limit);
    }

    public List<OptimizationReport> getOptimizationHistory() {
        return getOptimizationHistory(10);
    }

    // --- Configuration ---

    public OptimizerConfig getConfig() {
        return OptimizerConfig.from(properties, ruleEngine.getRules());
    }

    /**
     * Apply a partial configuration. Everything that can fail (adapter construction, rule validation)
     * is checked before anything changes.
     */
    public OptimizerConfig updateConfig(OptimizerConfig update) {
        Objects.requireNonNull(update, "update");
        synchronized (lifecycleMonitor) {
            if (update.getHistorySize() != null && update.getHistorySize() < 1) {
                throw new IllegalArgumentException("historySize must be positive");
            }
            if (update.getOptimizationInterval() != null && update.getOptimizationInterval() < 1) {
                throw new IllegalArgumentException("optimizationInterval must be at least one minute");
            }
            if (update.getAutomationRules() != null) {
                ruleEngine.validate(update.getAutomationRules());
            }

            Set<AdapterName> before = properties.requiredAdapters();
            boolean gateBefore = properties.isEnableAutomatedOptimization();
            Duration intervalBefore = properties.getOptimizationInterval();

            OptimizerProperties candidate = new OptimizerProperties();
            candidate.setEnableAdvancedAnalytics(pick(update.getEnableAdvancedAnalytics(), properties.isEnableAdvancedAnalytics()));
            candidate.setEnableDatabaseOptimization(pick(update.getEnableDatabaseOptimization(), properties.isEnableDatabaseOptimization()));
            candidate.setEnableMultiLayerCaching(pick(update.getEnableMultiLayerCaching(), properties.isEnableMultiLayerCaching()));
            candidate.setEnableIntelligentLoadBalancing(pick(update.getEnableIntelligentLoadBalancing(), properties.isEnableIntelligentLoadBalancing()));
            candidate.setEnableCapacityPlanning(pick(update.getEnableCapacityPlanning(), properties.isEnableCapacityPlanning()));
            Set<AdapterName> after = candidate.requiredAdapters();
            if (initialized && !after.equals(before)) {
                adapterRegistry.registerAll(after, properties);
            }

            properties.setEnableAdvancedAnalytics(candidate.isEnableAdvancedAnalytics());
            properties.setEnableDatabaseOptimization(candidate.isEnableDatabaseOptimization());
            properties.setEnableMultiLayerCaching(candidate.isEnableMultiLayerCaching());
            properties.setEnableIntelligentLoadBalancing(candidate.isEnableIntelligentLoadBalancing());
            properties.setEnableCapacityPlanning(candidate.isEnableCapacityPlanning());
            if (update.getEnableAutomatedOptimization() != null) {
                properties.setEnableAutomatedOptimization(update.getEnableAutomatedOptimization());
            }
            if (update.getOptimizationInterval() != null) {
                properties.setOptimizationInterval(Duration.ofMinutes(update.getOptimizationInterval()));
            }
            if (update.getMaxRecommendations() != null) {
                properties.setMaxRecommendations(update.getMaxRecommendations());
            }
            if (update.getHistorySize() != null) {
                properties.setHistorySize(update.getHistorySize());
                reportHistory.resize(update.getHistorySize());
            }
            applyThresholds(update.getAlertThresholds());
            if (update.getAutomationRules() != null) {
                properties.setAutomationRules(new ArrayList<>(update.getAutomationRules()));
                ruleEngine.replaceRules(update.getAutomationRules());
            }

            boolean rescheduleNeeded = properties.isEnableAutomatedOptimization() != gateBefore
                    || !properties.getOptimizationInterval().equals(intervalBefore);
            if (running && rescheduleNeeded) {
                cycleTask = cancel(cycleTask);
                scheduleCycle();
            }
        }
        log.info("Optimizer configuration updated");
        auditService.log("api", "CONFIG_CHANGED", "orchestrator", describe(update));
        return getConfig();
    }

    private void applyThresholds(OptimizerConfig.Thresholds thresholds) {
        if (thresholds == null) {
            return;
        }
        OptimizerProperties.AlertThresholds target = properties.getAlertThresholds();
        if (thresholds.getResponseTime() != null) target.setResponseTime(thresholds.getResponseTime());
        if (thresholds.getErrorRate() != null) target.setErrorRate(thresholds.getErrorRate());
        if (thresholds.getCpuUsage() != null) target.setCpuUsage(thresholds.getCpuUsage());
        if (thresholds.getMemoryUsage() != null) target.setMemoryUsage(thresholds.getMemoryUsage());
    }

    // --- Scheduling helpers ---

    private void scheduleCycle() {
        if (!properties.isEnableAutomatedOptimization()) {
            log.info("Automated optimization disabled, cycle timer not started");
            return;
        }
        Duration interval = properties.getOptimizationInterval();
        cycleTask = scheduler.scheduleAtFixedRate(this::scheduledCycle, clock.instant().plus(interval), interval);
    }

    private static ScheduledFuture<?> cancel(ScheduledFuture<?> task) {
        if (task != null) {
            task.cancel(false);
        }
        return null;
    }

    private static boolean pick(Boolean value, boolean current) {
        return value != null ? value : current;
    }

    private static Map<String, Object> describe(OptimizerConfig update) {
        Map<String, Object> details = new LinkedHashMap<>();
        if (update.getEnableAutomatedOptimization() != null) details.put("enableAutomatedOptimization", update.getEnableAutomatedOptimization());
        if (update.getOptimizationInterval() != null) details.put("optimizationInterval", update.getOptimizationInterval());
        if (update.getHistorySize() != null) details.put("historySize", update.getHistorySize());
        if (update.getMaxRecommendations() != null) details.put("maxRecommendations", update.getMaxRecommendations());
        if (update.getAutomationRules() != null) details.put("automationRules", update.getAutomationRules().size());
        return details;
    }
}
