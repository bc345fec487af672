package com.example.perfoptimizer.orchestrator;

import com.example.perfoptimizer.automation.AutomationRule;
import com.example.perfoptimizer.config.OptimizerProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Runtime-adjustable slice of the configuration. Used both as the full view returned by
 * getConfig() and as a partial update, where null fields are left unchanged.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OptimizerConfig {

    private Boolean enableAdvancedAnalytics;
    private Boolean enableDatabaseOptimization;
    private Boolean enableMultiLayerCaching;
    private Boolean enableIntelligentLoadBalancing;
    private Boolean enableCapacityPlanning;
    private Boolean enableAutomatedOptimization;

    /** Minutes. */
    private Long optimizationInterval;

    private Integer historySize;
    private Integer maxRecommendations;
    private Thresholds alertThresholds;
    private List<AutomationRule> automationRules;

    public static OptimizerConfig from(OptimizerProperties properties, List<AutomationRule> rules) {
        OptimizerProperties.AlertThresholds t = properties.getAlertThresholds();
        return OptimizerConfig.builder()
                .enableAdvancedAnalytics(properties.isEnableAdvancedAnalytics())
                .enableDatabaseOptimization(properties.isEnableDatabaseOptimization())
                .enableMultiLayerCaching(properties.isEnableMultiLayerCaching())
                .enableIntelligentLoadBalancing(properties.isEnableIntelligentLoadBalancing())
                .enableCapacityPlanning(properties.isEnableCapacityPlanning())
                .enableAutomatedOptimization(properties.isEnableAutomatedOptimization())
                .optimizationInterval(properties.getOptimizationInterval().toMinutes())
                .historySize(properties.getHistorySize())
                .maxRecommendations(properties.getMaxRecommendations())
                .alertThresholds(new Thresholds(t.getResponseTime(), t.getErrorRate(), t.getCpuUsage(), t.getMemoryUsage()))
                .automationRules(rules)
                .build();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Thresholds {
        private Double responseTime;
        private Double errorRate;
        private Double cpuUsage;
        private Double memoryUsage;
    }
}
