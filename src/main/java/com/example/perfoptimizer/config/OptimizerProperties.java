package com.example.perfoptimizer.config;

import com.example.perfoptimizer.adapter.AdapterName;
import com.example.perfoptimizer.automation.AutomationRule;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Central configuration for the optimization orchestrator.
 * Maps to the 'perf-optimizer' prefix in application.yml.
 * Mutated at runtime only through {@code OptimizationOrchestrator#updateConfig}.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "perf-optimizer")
public class OptimizerProperties {

    /** Run initialize() and start() once the application is ready. */
    private boolean autoStart = false;

    private boolean enableAdvancedAnalytics = true;
    private boolean enableDatabaseOptimization = true;
    private boolean enableMultiLayerCaching = true;
    private boolean enableIntelligentLoadBalancing = true;
    private boolean enableCapacityPlanning = true;

    /** Gates whether the optimization-cycle timer is started at all. */
    private boolean enableAutomatedOptimization = true;

    @DurationUnit(ChronoUnit.MINUTES)
    private Duration optimizationInterval = Duration.ofMinutes(30);

    private Duration healthCheckInterval = Duration.ofMinutes(1);
    private Duration ruleSweepInterval = Duration.ofSeconds(30);
    private Duration adapterTimeout = Duration.ofSeconds(10);
    private Duration reviewInterval = Duration.ofDays(7);

    private int historySize = 50;
    private int maxRecommendations = 20;

    /** Optional directory of *.yml automation rule files loaded at initialize(). */
    private String rulesDirectory;

    private AlertThresholds alertThresholds = new AlertThresholds();
    private EstimationConfig estimation = new EstimationConfig();
    private Map<AdapterName, AdapterEndpoint> adapters = new EnumMap<>(AdapterName.class);
    private List<AutomationRule> automationRules = new ArrayList<>();
    private NotificationConfig notifications = new NotificationConfig();

    /**
     * Adapters that must be registered for the current enable flags.
     */
    public Set<AdapterName> requiredAdapters() {
        Set<AdapterName> required = new LinkedHashSet<>();
        if (enableAdvancedAnalytics) required.add(AdapterName.PERFORMANCE);
        if (enableDatabaseOptimization) required.add(AdapterName.DATABASE);
        if (enableMultiLayerCaching) required.add(AdapterName.CACHE);
        if (enableIntelligentLoadBalancing) required.add(AdapterName.LOAD_BALANCER);
        if (enableCapacityPlanning) required.add(AdapterName.CAPACITY);
        return required;
    }

    @Data
    public static class AlertThresholds {
        /** Average response time in milliseconds. */
        private double responseTime = 1000;
        /** Error rate in percent. */
        private double errorRate = 5;
        private double cpuUsage = 80;
        private double memoryUsage = 85;
    }

    /**
     * Weights used to estimate the summary deltas of a cycle from the categories
     * of the recommendations it implemented. Policy, not measurement.
     */
    @Data
    public static class EstimationConfig {
        private double databasePerformanceGain = 25;
        private double cachePerformanceGain = 15;
        private double infrastructurePerformanceGain = 10;
        private double infrastructureCostSavings = 5;
        private double maxPerformanceGain = 50;
        private long costUnit = 1000;
    }

    @Data
    public static class AdapterEndpoint {
        private String baseUrl;
        private Map<String, String> headers = new HashMap<>();
    }

    @Data
    public static class NotificationConfig {
        private SlackConfig slack = new SlackConfig();
        private PagerDutyConfig pagerduty = new PagerDutyConfig();

        @Data
        public static class SlackConfig {
            private boolean enabled = false;
            private String webhookUrl = "";
        }

        @Data
        public static class PagerDutyConfig {
            private boolean enabled = false;
            private String apiKey = "";
            private String eventsUrl = "https://events.pagerduty.com/v2/enqueue";
        }
    }
}
