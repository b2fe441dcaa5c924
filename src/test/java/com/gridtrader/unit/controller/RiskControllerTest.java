package com.gridtrader.unit.controller;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.gridtrader.api.controller.RiskController;
import com.gridtrader.config.ApiResponseAdvice;
import com.gridtrader.domain.model.RiskMetrics;
import com.gridtrader.domain.model.SafetyStatus;
import com.gridtrader.risk.RiskManager;
import java.math.BigDecimal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

/**
 * Standalone MockMvc tests for the RiskController.
 */
@ExtendWith(MockitoExtension.class)
class RiskControllerTest {

    private MockMvc mockMvc;

    @Mock
    private RiskManager riskManager;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new RiskController(riskManager))
                .setControllerAdvice(new ApiResponseAdvice())
                .build();
    }

    @Test
    @DisplayName("GET /api/risk/metrics returns equity, drawdown and exposure")
    void getMetricsReturnsAllFields() throws Exception {
        when(riskManager.getRiskMetrics())
                .thenReturn(RiskMetrics.builder()
                        .killSwitchActive(false)
                        .totalEquity(new BigDecimal("980"))
                        .dailyMaxEquity(new BigDecimal("1000"))
                        .exposurePct(new BigDecimal("42.50"))
                        .maxExposurePct(new BigDecimal("80"))
                        .currentDrawdownPct(new BigDecimal("2.00"))
                        .killSwitchThresholdPct(new BigDecimal("5"))
                        .withinLimits(true)
                        .build());

        mockMvc.perform(get("/api/risk/metrics"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.killSwitchActive").value(false))
                .andExpect(jsonPath("$.data.totalEquity").value(980))
                .andExpect(jsonPath("$.data.exposurePct").value(42.5))
                .andExpect(jsonPath("$.data.currentDrawdownPct").value(2.0))
                .andExpect(jsonPath("$.data.withinLimits").value(true));
    }

    @Test
    @DisplayName("GET /api/risk/safety reports the kill switch reason")
    void getSafetyReportsKillSwitch() throws Exception {
        when(riskManager.getSafetyStatus())
                .thenReturn(SafetyStatus.builder()
                        .safeToTrade(false)
                        .killSwitchActive(true)
                        .killSwitchReason("Drawdown 6.00% exceeds threshold 5%")
                        .exposureOk(true)
                        .build());

        mockMvc.perform(get("/api/risk/safety"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.safeToTrade").value(false))
                .andExpect(jsonPath("$.data.killSwitchReason").value("Drawdown 6.00% exceeds threshold 5%"));
    }

    @Test
    @DisplayName("GET /api/risk/funding returns the daily funding estimate")
    void getFundingReturnsEstimate() throws Exception {
        when(riskManager.calculateFundingImpact()).thenReturn(new BigDecimal("0.3"));

        mockMvc.perform(get("/api/risk/funding"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.dailyFundingImpact").value(0.3));
    }

    @Test
    @DisplayName("POST /api/risk/kill-switch/deactivate resets an active kill switch")
    void deactivateResetsKillSwitch() throws Exception {
        when(riskManager.deactivateKillSwitch()).thenReturn(true);

        mockMvc.perform(post("/api/risk/kill-switch/deactivate"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.message").value("Kill switch deactivated"))
                .andExpect(jsonPath("$.data.deactivated").value(true));
    }

    @Test
    @DisplayName("POST /api/risk/kill-switch/deactivate when inactive reports no change")
    void deactivateWhenInactive() throws Exception {
        when(riskManager.deactivateKillSwitch()).thenReturn(false);

        mockMvc.perform(post("/api/risk/kill-switch/deactivate"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.message").value("Kill switch was not active"))
                .andExpect(jsonPath("$.data.deactivated").value(false));
    }
}
