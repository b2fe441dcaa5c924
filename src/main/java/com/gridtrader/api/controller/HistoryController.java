package com.gridtrader.api.controller;

import com.gridtrader.domain.enums.PnlPeriod;
import com.gridtrader.domain.model.BotEvent;
import com.gridtrader.domain.model.EquitySnapshot;
import com.gridtrader.domain.model.PnlSummary;
import com.gridtrader.domain.model.Trade;
import com.gridtrader.persistence.StateStore;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read-only views over the persisted history.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>GET /api/trades/recent?hours=24 -- fills, newest first</li>
 *   <li>GET /api/pnl?period=24h -- P&amp;L aggregated over 24h, 7d or 30d</li>
 *   <li>GET /api/equity?hours=24 -- equity snapshots, oldest first</li>
 *   <li>GET /api/events/recent?hours=24&amp;limit=100 -- bot events, newest first</li>
 * </ul>
 */
@RestController
@RequestMapping("/api")
public class HistoryController {

    private final StateStore stateStore;

    public HistoryController(StateStore stateStore) {
        this.stateStore = stateStore;
    }

    @GetMapping("/trades/recent")
    public ResponseEntity<List<Trade>> getRecentTrades(@RequestParam(defaultValue = "24") int hours) {
        return ResponseEntity.ok(stateStore.getRecentTrades(hours));
    }

    @GetMapping("/pnl")
    public ResponseEntity<PnlSummary> getPnl(@RequestParam(defaultValue = "24h") String period) {
        return ResponseEntity.ok(stateStore.summarizePnl(PnlPeriod.fromLabel(period)));
    }

    @GetMapping("/equity")
    public ResponseEntity<List<EquitySnapshot>> getEquity(@RequestParam(defaultValue = "24") int hours) {
        return ResponseEntity.ok(stateStore.getEquitySnapshots(hours));
    }

    @GetMapping("/events/recent")
    public ResponseEntity<List<BotEvent>> getRecentEvents(
            @RequestParam(defaultValue = "24") int hours, @RequestParam(defaultValue = "100") int limit) {
        return ResponseEntity.ok(stateStore.getRecentEvents(hours, limit));
    }
}
