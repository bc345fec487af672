package com.example.perfoptimizer.controller;

import com.example.perfoptimizer.automation.AutomationRule;
import com.example.perfoptimizer.automation.AutomationRuleEngine;
import com.example.perfoptimizer.automation.Condition;
import com.example.perfoptimizer.automation.TriggerType;
import com.example.perfoptimizer.config.OptimizerConfigurationException;
import com.example.perfoptimizer.health.HealthBand;
import com.example.perfoptimizer.health.SystemHealth;
import com.example.perfoptimizer.orchestrator.OptimizationOrchestrator;
import com.example.perfoptimizer.orchestrator.OptimizationReport;
import com.example.perfoptimizer.orchestrator.OptimizerConfig;
import com.example.perfoptimizer.orchestrator.ReportSummary;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest({OptimizerController.class, AutomationRuleController.class})
class OptimizerControllerTest {

    private static final Instant NOW = Instant.parse("2024-03-06T10:15:00Z");

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private OptimizationOrchestrator orchestrator;

    @MockBean
    private AutomationRuleEngine ruleEngine;

    @Test
    void statusReportsLifecycleFlags() throws Exception {
        when(orchestrator.isInitialized()).thenReturn(true);
        when(orchestrator.isRunning()).thenReturn(false);

        mockMvc.perform(get("/api/optimizer/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.initialized").value(true))
                .andExpect(jsonPath("$.running").value(false));
    }

    @Test
    void triggeringCycleReturnsReport() throws Exception {
        when(orchestrator.triggerOptimizationCycle()).thenReturn(OptimizationReport.builder()
                .id("report-1")
                .timestamp(NOW)
                .summary(ReportSummary.builder().overallHealthScore(82.5).recommendationsGenerated(4)
                        .optimizationsImplemented(1).build())
                .recommendations(List.of())
                .build());

        mockMvc.perform(post("/api/optimizer/optimization-cycle"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value("report-1"))
                .andExpect(jsonPath("$.timestamp").value("2024-03-06T10:15:00Z"))
                .andExpect(jsonPath("$.summary.recommendationsGenerated").value(4))
                .andExpect(jsonPath("$.summary.overallHealthScore").value(82.5));
    }

    @Test
    void latestReportIsNotFoundBeforeFirstCycle() throws Exception {
        when(orchestrator.getLastOptimizationReport()).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/optimizer/report/latest"))
                .andExpect(status().isNotFound());
    }

    @Test
    void historyPassesLimitThrough() throws Exception {
        when(orchestrator.getOptimizationHistory(3)).thenReturn(List.of());

        mockMvc.perform(get("/api/optimizer/report/history").param("limit", "3"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isArray());

        verify(orchestrator).getOptimizationHistory(3);
    }

    @Test
    void healthUsesLowercaseBand() throws Exception {
        when(orchestrator.getSystemHealth()).thenReturn(SystemHealth.builder()
                .overall(HealthBand.GOOD).overallScore(80).components(Map.of()).checkedAt(NOW).build());

        mockMvc.perform(get("/api/optimizer/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.overall").value("good"))
                .andExpect(jsonPath("$.overallScore").value(80.0));
    }

    @Test
    void configUpdateIsPartial() throws Exception {
        when(orchestrator.updateConfig(any())).thenReturn(OptimizerConfig.builder().historySize(5).build());

        mockMvc.perform(put("/api/optimizer/config")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"historySize\": 5}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.historySize").value(5));

        ArgumentCaptor<OptimizerConfig> captor = ArgumentCaptor.forClass(OptimizerConfig.class);
        verify(orchestrator).updateConfig(captor.capture());
        assertThat(captor.getValue().getHistorySize()).isEqualTo(5);
        assertThat(captor.getValue().getOptimizationInterval()).isNull();
    }

    @Test
    void invalidConfigIsBadRequest() throws Exception {
        when(orchestrator.updateConfig(any())).thenThrow(new IllegalArgumentException("historySize must be positive"));

        mockMvc.perform(put("/api/optimizer/config")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"historySize\": 0}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("historySize must be positive"));
    }

    @Test
    void initializeWithMissingAdapterIsBadRequest() throws Exception {
        doThrow(new OptimizerConfigurationException("Adapter 'cache' is enabled but has no base-url configured"))
                .when(orchestrator).initialize();

        mockMvc.perform(post("/api/optimizer/initialize"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400));
    }

    @Test
    void startInWrongStateIsConflict() throws Exception {
        doThrow(new IllegalStateException("Optimizer must be initialized before it is started"))
                .when(orchestrator).start();

        mockMvc.perform(post("/api/optimizer/initialize"))
                .andExpect(status().isConflict());
    }

    @Test
    void addingRuleReturnsCreated() throws Exception {
        when(ruleEngine.addRule(any())).thenAnswer(inv -> inv.getArgument(0));

        mockMvc.perform(post("/api/automation-rules")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"id": "slow-api", "name": "Slow API",
                                 "trigger": {"type": "threshold", "metric": "response_time", "condition": "gt", "value": "1500"},
                                 "actions": [{"type": "scale_up", "target": "api"}]}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value("slow-api"))
                .andExpect(jsonPath("$.trigger.condition").value("greater_than"))
                .andExpect(jsonPath("$.actions[0].type").value("scale_up"));

        ArgumentCaptor<AutomationRule> captor = ArgumentCaptor.forClass(AutomationRule.class);
        verify(ruleEngine).addRule(captor.capture());
        assertThat(captor.getValue().getTrigger().getType()).isEqualTo(TriggerType.THRESHOLD);
        assertThat(captor.getValue().getTrigger().getCondition()).isEqualTo(Condition.GREATER_THAN);
        assertThat(captor.getValue().getCooldownMinutes()).isEqualTo(15);
    }

    @Test
    void unknownRuleIsNotFound() throws Exception {
        when(ruleEngine.removeRule("missing")).thenReturn(false);
        when(ruleEngine.setEnabled("missing", true)).thenReturn(Optional.empty());

        mockMvc.perform(delete("/api/automation-rules/missing")).andExpect(status().isNotFound());
        mockMvc.perform(post("/api/automation-rules/missing/enable")).andExpect(status().isNotFound());
    }
}
