package com.gridtrader.api.controller;

import com.gridtrader.domain.model.RiskMetrics;
import com.gridtrader.domain.model.SafetyStatus;
import com.gridtrader.risk.RiskManager;
import java.math.BigDecimal;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for risk state and the kill switch.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>GET /api/risk/metrics -- equity, drawdown and exposure against the limits</li>
 *   <li>GET /api/risk/safety -- whether the bot may trade right now</li>
 *   <li>GET /api/risk/funding -- estimated daily funding cost of the open position</li>
 *   <li>POST /api/risk/kill-switch/deactivate -- manual reset after a kill switch</li>
 * </ul>
 *
 * <p>There is no activation endpoint; the kill switch fires from the drawdown check only.
 */
@RestController
@RequestMapping("/api/risk")
public class RiskController {

    private static final Logger log = LoggerFactory.getLogger(RiskController.class);

    private final RiskManager riskManager;

    public RiskController(RiskManager riskManager) {
        this.riskManager = riskManager;
    }

    @GetMapping("/metrics")
    public ResponseEntity<RiskMetrics> getMetrics() {
        return ResponseEntity.ok(riskManager.getRiskMetrics());
    }

    @GetMapping("/safety")
    public ResponseEntity<SafetyStatus> getSafety() {
        return ResponseEntity.ok(riskManager.getSafetyStatus());
    }

    @GetMapping("/funding")
    public ResponseEntity<Map<String, BigDecimal>> getFundingImpact() {
        return ResponseEntity.ok(Map.of("dailyFundingImpact", riskManager.calculateFundingImpact()));
    }

    @PostMapping("/kill-switch/deactivate")
    public ResponseEntity<Map<String, Object>> deactivateKillSwitch() {
        log.warn("Kill switch deactivation requested via API");
        boolean deactivated = riskManager.deactivateKillSwitch();
        String message = deactivated ? "Kill switch deactivated" : "Kill switch was not active";
        return ResponseEntity.ok(Map.of("message", message, "deactivated", deactivated));
    }
}
