package com.gridtrader.api.controller;

import com.gridtrader.api.dto.request.ProfileChangeRequest;
import com.gridtrader.core.engine.GridBotSupervisor;
import com.gridtrader.domain.model.ActiveConfig;
import com.gridtrader.domain.model.BotStatus;
import com.gridtrader.exception.ErrorCode;
import com.gridtrader.exception.ResourceNotFoundException;
import com.gridtrader.persistence.StateStore;
import jakarta.validation.Valid;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for the bot lifecycle.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>GET /api/bot/status -- run state, balance, ladder and risk</li>
 *   <li>POST /api/bot/start -- build the ladder and start the monitoring loops</li>
 *   <li>POST /api/bot/stop -- stop the loops and cancel all orders</li>
 *   <li>POST /api/bot/profile -- switch the active profile (recenters when running)</li>
 *   <li>GET /api/bot/config -- the persisted active configuration</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/bot")
public class BotController {

    private static final Logger log = LoggerFactory.getLogger(BotController.class);

    private final GridBotSupervisor gridBotSupervisor;
    private final StateStore stateStore;

    public BotController(GridBotSupervisor gridBotSupervisor, StateStore stateStore) {
        this.gridBotSupervisor = gridBotSupervisor;
        this.stateStore = stateStore;
    }

    @GetMapping("/status")
    public ResponseEntity<BotStatus> getStatus() {
        return ResponseEntity.ok(gridBotSupervisor.getStatus());
    }

    @PostMapping("/start")
    public ResponseEntity<Map<String, Object>> start() {
        log.info("Start requested via API");
        gridBotSupervisor.start();
        return ResponseEntity.ok(
                Map.of("message", "Trading started", "profile", gridBotSupervisor.getActiveProfile()));
    }

    @PostMapping("/stop")
    public ResponseEntity<Map<String, Object>> stop() {
        log.info("Stop requested via API");
        boolean stopped = gridBotSupervisor.stop();
        String message = stopped ? "Trading stopped" : "Bot was not running";
        return ResponseEntity.ok(Map.of("message", message, "stopped", stopped));
    }

    @PostMapping("/profile")
    public ResponseEntity<Map<String, Object>> changeProfile(@Valid @RequestBody ProfileChangeRequest request) {
        gridBotSupervisor.changeProfile(request.getProfile());
        return ResponseEntity.ok(
                Map.of("message", "Profile changed to " + request.getProfile(), "profile", request.getProfile()));
    }

    @GetMapping("/config")
    public ResponseEntity<ActiveConfig> getConfig() {
        return ResponseEntity.ok(stateStore.getActiveConfig()
                .orElseThrow(() -> new ResourceNotFoundException(ErrorCode.CONFIG_NOT_FOUND, "active bot config")));
    }
}
