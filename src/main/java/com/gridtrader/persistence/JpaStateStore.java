package com.gridtrader.persistence;

import com.gridtrader.domain.enums.BotEventType;
import com.gridtrader.domain.enums.EventSeverity;
import com.gridtrader.domain.enums.OrderStatus;
import com.gridtrader.domain.enums.PnlPeriod;
import com.gridtrader.domain.model.ActiveConfig;
import com.gridtrader.domain.model.BotEvent;
import com.gridtrader.domain.model.EquitySnapshot;
import com.gridtrader.domain.model.GridOrder;
import com.gridtrader.domain.model.GridSnapshot;
import com.gridtrader.domain.model.PnlSummary;
import com.gridtrader.domain.model.Trade;
import com.gridtrader.entity.BotConfigEntity;
import com.gridtrader.entity.GridOrderEntity;
import com.gridtrader.entity.TradeEntity;
import com.gridtrader.mapper.BotConfigMapper;
import com.gridtrader.mapper.BotEventMapper;
import com.gridtrader.mapper.EquitySnapshotMapper;
import com.gridtrader.mapper.GridHistoryMapper;
import com.gridtrader.mapper.GridOrderMapper;
import com.gridtrader.mapper.PnlSummaryMapper;
import com.gridtrader.mapper.TradeMapper;
import com.gridtrader.repository.jpa.BotConfigJpaRepository;
import com.gridtrader.repository.jpa.BotEventJpaRepository;
import com.gridtrader.repository.jpa.EquitySnapshotJpaRepository;
import com.gridtrader.repository.jpa.GridHistoryJpaRepository;
import com.gridtrader.repository.jpa.GridOrderJpaRepository;
import com.gridtrader.repository.jpa.PnlSummaryJpaRepository;
import com.gridtrader.repository.jpa.TradeJpaRepository;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * {@link StateStore} backed by Spring Data JPA (H2 file database by default).
 *
 * <p>Timestamps not supplied by the caller are stamped with the injected UTC clock.
 */
@Service
public class JpaStateStore implements StateStore {

    private static final Logger log = LoggerFactory.getLogger(JpaStateStore.class);

    private final GridOrderJpaRepository gridOrderJpaRepository;
    private final TradeJpaRepository tradeJpaRepository;
    private final GridHistoryJpaRepository gridHistoryJpaRepository;
    private final EquitySnapshotJpaRepository equitySnapshotJpaRepository;
    private final BotEventJpaRepository botEventJpaRepository;
    private final BotConfigJpaRepository botConfigJpaRepository;
    private final PnlSummaryJpaRepository pnlSummaryJpaRepository;
    private final GridOrderMapper gridOrderMapper;
    private final TradeMapper tradeMapper;
    private final GridHistoryMapper gridHistoryMapper;
    private final EquitySnapshotMapper equitySnapshotMapper;
    private final BotEventMapper botEventMapper;
    private final BotConfigMapper botConfigMapper;
    private final PnlSummaryMapper pnlSummaryMapper;
    private final Clock clock;

    public JpaStateStore(
            GridOrderJpaRepository gridOrderJpaRepository,
            TradeJpaRepository tradeJpaRepository,
            GridHistoryJpaRepository gridHistoryJpaRepository,
            EquitySnapshotJpaRepository equitySnapshotJpaRepository,
            BotEventJpaRepository botEventJpaRepository,
            BotConfigJpaRepository botConfigJpaRepository,
            PnlSummaryJpaRepository pnlSummaryJpaRepository,
            GridOrderMapper gridOrderMapper,
            TradeMapper tradeMapper,
            GridHistoryMapper gridHistoryMapper,
            EquitySnapshotMapper equitySnapshotMapper,
            BotEventMapper botEventMapper,
            BotConfigMapper botConfigMapper,
            PnlSummaryMapper pnlSummaryMapper,
            Clock clock) {
        this.gridOrderJpaRepository = gridOrderJpaRepository;
        this.tradeJpaRepository = tradeJpaRepository;
        this.gridHistoryJpaRepository = gridHistoryJpaRepository;
        this.equitySnapshotJpaRepository = equitySnapshotJpaRepository;
        this.botEventJpaRepository = botEventJpaRepository;
        this.botConfigJpaRepository = botConfigJpaRepository;
        this.pnlSummaryJpaRepository = pnlSummaryJpaRepository;
        this.gridOrderMapper = gridOrderMapper;
        this.tradeMapper = tradeMapper;
        this.gridHistoryMapper = gridHistoryMapper;
        this.equitySnapshotMapper = equitySnapshotMapper;
        this.botEventMapper = botEventMapper;
        this.botConfigMapper = botConfigMapper;
        this.pnlSummaryMapper = pnlSummaryMapper;
        this.clock = clock;
    }

    // ========================
    // ORDERS
    // ========================

    @Override
    @Transactional
    public void saveOrder(GridOrder order) {
        if (gridOrderJpaRepository.existsByOrderId(order.getOrderId())) {
            log.debug("Order {} already stored, skipping", order.getOrderId());
            return;
        }
        GridOrderEntity entity = gridOrderMapper.toEntity(order);
        if (entity.getCreatedAt() == null) {
            entity.setCreatedAt(now());
        }
        gridOrderJpaRepository.save(entity);
    }

    @Override
    @Transactional
    public void updateOrderStatus(String orderId, OrderStatus status, LocalDateTime filledAt) {
        int updated = gridOrderJpaRepository.updateStatus(orderId, status, filledAt);
        if (updated == 0) {
            log.debug("updateOrderStatus: order {} not tracked", orderId);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<GridOrder> findOrder(String orderId) {
        return gridOrderJpaRepository.findByOrderId(orderId).map(gridOrderMapper::toDomain);
    }

    // ========================
    // TRADES
    // ========================

    @Override
    @Transactional
    public boolean saveTrade(Trade trade) {
        if (tradeJpaRepository.existsByExecId(trade.getExecId())) {
            return false;
        }
        TradeEntity entity = tradeMapper.toEntity(trade);
        if (entity.getExecutedAt() == null) {
            entity.setExecutedAt(now());
        }
        tradeJpaRepository.save(entity);
        log.info("Trade saved: {} {} @ {}", trade.getSide(), trade.getQuantity(), trade.getPrice());
        return true;
    }

    @Override
    @Transactional(readOnly = true)
    public boolean tradeExists(String execId) {
        return tradeJpaRepository.existsByExecId(execId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Trade> getRecentTrades(int hours) {
        return tradeMapper.toDomainList(
                tradeJpaRepository.findByExecutedAtGreaterThanEqualOrderByExecutedAtDesc(cutoff(hours)));
    }

    @Override
    @Transactional(readOnly = true)
    public long countTrades(int hours) {
        return tradeJpaRepository.countByExecutedAtGreaterThanEqual(cutoff(hours));
    }

    // ========================
    // GRID HISTORY
    // ========================

    @Override
    @Transactional
    public void saveGridHistory(GridSnapshot snapshot) {
        if (snapshot.getCreatedAt() == null) {
            snapshot.setCreatedAt(now());
        }
        if (snapshot.getReason() == null) {
            snapshot.setReason("Initial setup");
        }
        gridHistoryJpaRepository.save(gridHistoryMapper.toEntity(snapshot));
        log.info("Grid history saved: center={}", snapshot.getCenterPrice());
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<GridSnapshot> getLatestGrid() {
        return gridHistoryJpaRepository.findFirstByOrderByCreatedAtDescIdDesc().map(gridHistoryMapper::toDomain);
    }

    // ========================
    // EQUITY
    // ========================

    @Override
    @Transactional
    public void saveEquitySnapshot(EquitySnapshot snapshot) {
        if (snapshot.getSnapshotAt() == null) {
            snapshot.setSnapshotAt(now());
        }
        equitySnapshotJpaRepository.save(equitySnapshotMapper.toEntity(snapshot));
    }

    @Override
    @Transactional(readOnly = true)
    public List<EquitySnapshot> getEquitySnapshots(int hours) {
        return equitySnapshotMapper.toDomainList(
                equitySnapshotJpaRepository.findBySnapshotAtGreaterThanEqualOrderBySnapshotAtAsc(cutoff(hours)));
    }

    // ========================
    // EVENTS
    // ========================

    @Override
    @Transactional
    public void logEvent(BotEventType type, EventSeverity severity, String message, Map<String, Object> details) {
        BotEvent event = BotEvent.builder()
                .eventType(type)
                .severity(severity)
                .message(message)
                .details(details)
                .createdAt(now())
                .build();
        botEventJpaRepository.save(botEventMapper.toEntity(event));
        log.info("Event logged: {} - {}", type, message);
    }

    @Override
    @Transactional(readOnly = true)
    public List<BotEvent> getRecentEvents(int hours, int limit) {
        return botEventMapper.toDomainList(
                botEventJpaRepository.findByCreatedAtGreaterThanEqualOrderByCreatedAtDescIdDesc(
                        cutoff(hours), PageRequest.of(0, Math.max(limit, 1))));
    }

    // ========================
    // CONFIG
    // ========================

    @Override
    @Transactional(readOnly = true)
    public Optional<ActiveConfig> getActiveConfig() {
        return botConfigJpaRepository.findFirstByActiveTrueOrderByCreatedAtDescIdDesc().map(botConfigMapper::toDomain);
    }

    @Override
    @Transactional
    public void saveConfig(ActiveConfig config) {
        botConfigJpaRepository.deactivateAll();
        BotConfigEntity entity = botConfigMapper.toEntity(config);
        entity.setId(null);
        entity.setActive(true);
        if (entity.getCreatedAt() == null) {
            entity.setCreatedAt(now());
        }
        botConfigJpaRepository.save(entity);
        log.info("Configuration saved: {}", config.getProfileName());
    }

    // ========================
    // P&L
    // ========================

    @Override
    @Transactional
    public PnlSummary calculateAndSavePnl(PnlPeriod period) {
        PnlSummary summary = summarizePnl(period);
        if (summary.getTotalTrades() > 0) {
            pnlSummaryJpaRepository.save(pnlSummaryMapper.toEntity(summary));
        }
        return summary;
    }

    @Override
    @Transactional(readOnly = true)
    public PnlSummary summarizePnl(PnlPeriod period) {
        int hours = (int) period.getWindow().toHours();
        List<Trade> trades = getRecentTrades(hours);
        List<EquitySnapshot> snapshots = getEquitySnapshots(hours);

        BigDecimal realized = BigDecimal.ZERO;
        BigDecimal fees = BigDecimal.ZERO;
        int winning = 0;
        int losing = 0;
        for (Trade trade : trades) {
            if (trade.getFee() != null) {
                fees = fees.add(trade.getFee());
            }
            BigDecimal profit = trade.getProfit();
            if (profit == null) {
                continue;
            }
            realized = realized.add(profit);
            if (profit.signum() > 0) {
                winning++;
            } else if (profit.signum() < 0) {
                losing++;
            }
        }

        BigDecimal unrealized = snapshots.isEmpty()
                ? BigDecimal.ZERO
                : snapshots.get(snapshots.size() - 1).getUnrealizedPnl();

        return PnlSummary.builder()
                .period(period)
                .realizedPnl(realized)
                .unrealizedPnl(unrealized != null ? unrealized : BigDecimal.ZERO)
                .totalTrades(trades.size())
                .winningTrades(winning)
                .losingTrades(losing)
                .totalFees(fees)
                .maxDrawdown(maxDrawdown(snapshots))
                .calculatedAt(now())
                .build();
    }

    /** Largest (peak - trough) / peak over snapshots in time order. */
    private static BigDecimal maxDrawdown(List<EquitySnapshot> snapshots) {
        BigDecimal peak = null;
        BigDecimal worst = BigDecimal.ZERO;
        for (EquitySnapshot snapshot : snapshots) {
            BigDecimal equity = snapshot.getTotalEquity();
            if (equity == null) {
                continue;
            }
            if (peak == null || equity.compareTo(peak) > 0) {
                peak = equity;
                continue;
            }
            if (peak.signum() > 0) {
                BigDecimal drawdown = peak.subtract(equity).divide(peak, 8, RoundingMode.HALF_UP);
                if (drawdown.compareTo(worst) > 0) {
                    worst = drawdown;
                }
            }
        }
        return worst;
    }

    // ========================
    // INTERNALS
    // ========================

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }

    private LocalDateTime cutoff(int hours) {
        return now().minusHours(hours);
    }
}
