package com.gridtrader.unit.persistence;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.gridtrader.domain.enums.BotEventType;
import com.gridtrader.domain.enums.EventSeverity;
import com.gridtrader.domain.enums.OrderSide;
import com.gridtrader.domain.enums.PnlPeriod;
import com.gridtrader.domain.model.ActiveConfig;
import com.gridtrader.domain.model.GridOrder;
import com.gridtrader.domain.model.PnlSummary;
import com.gridtrader.domain.model.Trade;
import com.gridtrader.entity.BotConfigEntity;
import com.gridtrader.entity.BotEventEntity;
import com.gridtrader.entity.EquitySnapshotEntity;
import com.gridtrader.entity.GridOrderEntity;
import com.gridtrader.entity.PnlSummaryEntity;
import com.gridtrader.entity.TradeEntity;
import com.gridtrader.mapper.BotConfigMapper;
import com.gridtrader.mapper.BotEventMapper;
import com.gridtrader.mapper.EquitySnapshotMapper;
import com.gridtrader.mapper.GridHistoryMapper;
import com.gridtrader.mapper.GridOrderMapper;
import com.gridtrader.mapper.PnlSummaryMapper;
import com.gridtrader.mapper.TradeMapper;
import com.gridtrader.persistence.JpaStateStore;
import com.gridtrader.repository.jpa.BotConfigJpaRepository;
import com.gridtrader.repository.jpa.BotEventJpaRepository;
import com.gridtrader.repository.jpa.EquitySnapshotJpaRepository;
import com.gridtrader.repository.jpa.GridHistoryJpaRepository;
import com.gridtrader.repository.jpa.GridOrderJpaRepository;
import com.gridtrader.repository.jpa.PnlSummaryJpaRepository;
import com.gridtrader.repository.jpa.TradeJpaRepository;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mapstruct.factory.Mappers;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.PageRequest;

/**
 * Unit tests for JpaStateStore with mocked repositories and the real MapStruct mappers.
 */
@ExtendWith(MockitoExtension.class)
class JpaStateStoreTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2025, 3, 10, 12, 0);
    private static final LocalDateTime DAY_AGO = NOW.minusHours(24);

    @Mock
    private GridOrderJpaRepository gridOrderJpaRepository;

    @Mock
    private TradeJpaRepository tradeJpaRepository;

    @Mock
    private GridHistoryJpaRepository gridHistoryJpaRepository;

    @Mock
    private EquitySnapshotJpaRepository equitySnapshotJpaRepository;

    @Mock
    private BotEventJpaRepository botEventJpaRepository;

    @Mock
    private BotConfigJpaRepository botConfigJpaRepository;

    @Mock
    private PnlSummaryJpaRepository pnlSummaryJpaRepository;

    private JpaStateStore stateStore;

    @BeforeEach
    void setUp() {
        stateStore = new JpaStateStore(
                gridOrderJpaRepository,
                tradeJpaRepository,
                gridHistoryJpaRepository,
                equitySnapshotJpaRepository,
                botEventJpaRepository,
                botConfigJpaRepository,
                pnlSummaryJpaRepository,
                Mappers.getMapper(GridOrderMapper.class),
                Mappers.getMapper(TradeMapper.class),
                Mappers.getMapper(GridHistoryMapper.class),
                Mappers.getMapper(EquitySnapshotMapper.class),
                Mappers.getMapper(BotEventMapper.class),
                Mappers.getMapper(BotConfigMapper.class),
                Mappers.getMapper(PnlSummaryMapper.class),
                Clock.fixed(Instant.parse("2025-03-10T12:00:00Z"), ZoneOffset.UTC));
    }

    private static TradeEntity trade(String execId, String profit, String fee) {
        return TradeEntity.builder()
                .execId(execId)
                .side(OrderSide.SELL)
                .price(new BigDecimal("0.56"))
                .quantity(new BigDecimal("20"))
                .fee(new BigDecimal(fee))
                .profit(profit == null ? null : new BigDecimal(profit))
                .executedAt(NOW.minusHours(1))
                .build();
    }

    private static EquitySnapshotEntity snapshot(String equity, String unrealized, int hoursAgo) {
        return EquitySnapshotEntity.builder()
                .totalEquity(new BigDecimal(equity))
                .unrealizedPnl(new BigDecimal(unrealized))
                .snapshotAt(NOW.minusHours(hoursAgo))
                .build();
    }

    // ==============================
    // ORDERS AND TRADES
    // ==============================

    @Nested
    @DisplayName("Orders and trades")
    class OrdersAndTrades {

        @Test
        @DisplayName("Trade with a known execId is not inserted again")
        void duplicateTrade_rejected() {
            when(tradeJpaRepository.existsByExecId("exec-1")).thenReturn(true);

            boolean saved = stateStore.saveTrade(Trade.builder().execId("exec-1").build());

            assertThat(saved).isFalse();
            verify(tradeJpaRepository, never()).save(any());
        }

        @Test
        @DisplayName("New trade is stamped with the clock and a zero fee when none is given")
        void newTrade_defaultsFilled() {
            boolean saved = stateStore.saveTrade(Trade.builder()
                    .execId("exec-2")
                    .side(OrderSide.BUY)
                    .price(new BigDecimal("0.54"))
                    .quantity(new BigDecimal("20"))
                    .build());

            assertThat(saved).isTrue();
            ArgumentCaptor<TradeEntity> entity = ArgumentCaptor.forClass(TradeEntity.class);
            verify(tradeJpaRepository).save(entity.capture());
            assertThat(entity.getValue().getExecId()).isEqualTo("exec-2");
            assertThat(entity.getValue().getExecutedAt()).isEqualTo(NOW);
            assertThat(entity.getValue().getFee()).isEqualByComparingTo("0");
        }

        @Test
        @DisplayName("Order id already stored is left unchanged")
        void duplicateOrder_skipped() {
            when(gridOrderJpaRepository.existsByOrderId("ord-1")).thenReturn(true);

            stateStore.saveOrder(GridOrder.builder().orderId("ord-1").build());

            verify(gridOrderJpaRepository, never()).save(any());
        }

        @Test
        @DisplayName("New order gets a creation timestamp")
        void newOrder_stamped() {
            stateStore.saveOrder(GridOrder.builder().orderId("ord-2").gridLevel(-1).build());

            ArgumentCaptor<GridOrderEntity> entity = ArgumentCaptor.forClass(GridOrderEntity.class);
            verify(gridOrderJpaRepository).save(entity.capture());
            assertThat(entity.getValue().getCreatedAt()).isEqualTo(NOW);
            assertThat(entity.getValue().getGridLevel()).isEqualTo(-1);
        }

        @Test
        @DisplayName("Recent trades query uses the window relative to the clock")
        void recentTrades_window() {
            when(tradeJpaRepository.findByExecutedAtGreaterThanEqualOrderByExecutedAtDesc(DAY_AGO))
                    .thenReturn(List.of(trade("exec-1", null, "0.01")));

            List<Trade> trades = stateStore.getRecentTrades(24);

            assertThat(trades).extracting(Trade::getExecId).containsExactly("exec-1");
        }
    }

    // ==============================
    // CONFIG AND EVENTS
    // ==============================

    @Nested
    @DisplayName("Config and events")
    class ConfigAndEvents {

        @Test
        @DisplayName("Saving a config deactivates the previous one first")
        void saveConfig_replacesActive() {
            stateStore.saveConfig(ActiveConfig.builder().id(7L).profileName("Aggressive").targetLevels(12).build());

            InOrder order = inOrder(botConfigJpaRepository);
            order.verify(botConfigJpaRepository).deactivateAll();
            ArgumentCaptor<BotConfigEntity> entity = ArgumentCaptor.forClass(BotConfigEntity.class);
            order.verify(botConfigJpaRepository).save(entity.capture());
            assertThat(entity.getValue().getId()).isNull();
            assertThat(entity.getValue().isActive()).isTrue();
            assertThat(entity.getValue().getProfileName()).isEqualTo("Aggressive");
            assertThat(entity.getValue().getCreatedAt()).isEqualTo(NOW);
        }

        @Test
        @DisplayName("Event details are stored as JSON")
        void logEvent_serializesDetails() {
            stateStore.logEvent(
                    BotEventType.PROFILE_CHANGED,
                    EventSeverity.INFO,
                    "Profile changed to Aggressive",
                    Map.of("profile", "Aggressive"));

            ArgumentCaptor<BotEventEntity> entity = ArgumentCaptor.forClass(BotEventEntity.class);
            verify(botEventJpaRepository).save(entity.capture());
            assertThat(entity.getValue().getDetails()).isEqualTo("{\"profile\":\"Aggressive\"}");
            assertThat(entity.getValue().getCreatedAt()).isEqualTo(NOW);
        }

        @Test
        @DisplayName("Non-positive limit still returns at least one event")
        void recentEvents_limitFloor() {
            when(botEventJpaRepository.findByCreatedAtGreaterThanEqualOrderByCreatedAtDescIdDesc(
                            DAY_AGO, PageRequest.of(0, 1)))
                    .thenReturn(List.of());

            assertThat(stateStore.getRecentEvents(24, 0)).isEmpty();
        }
    }

    // ==============================
    // P&L
    // ==============================

    @Nested
    @DisplayName("P&L")
    class Pnl {

        @Test
        @DisplayName("Summary aggregates profits, fees, unrealized and drawdown")
        void summarize_aggregates() {
            when(tradeJpaRepository.findByExecutedAtGreaterThanEqualOrderByExecutedAtDesc(DAY_AGO))
                    .thenReturn(List.of(
                            trade("e1", "1.50", "0.01"),
                            trade("e2", "-0.50", "0.01"),
                            trade("e3", null, "0.02"),
                            trade("e4", "0", "0.01")));
            when(equitySnapshotJpaRepository.findBySnapshotAtGreaterThanEqualOrderBySnapshotAtAsc(DAY_AGO))
                    .thenReturn(List.of(
                            snapshot("1000", "0.5", 4),
                            snapshot("1050", "1.0", 3),
                            snapshot("997.5", "-2.0", 2),
                            snapshot("1020", "2.0", 1)));

            PnlSummary summary = stateStore.summarizePnl(PnlPeriod.LAST_24H);

            assertThat(summary.getRealizedPnl()).isEqualByComparingTo("1.00");
            assertThat(summary.getTotalTrades()).isEqualTo(4);
            assertThat(summary.getWinningTrades()).isEqualTo(1);
            assertThat(summary.getLosingTrades()).isEqualTo(1);
            assertThat(summary.getTotalFees()).isEqualByComparingTo("0.05");
            assertThat(summary.getUnrealizedPnl()).isEqualByComparingTo("2.0");
            assertThat(summary.getMaxDrawdown()).isEqualByComparingTo("0.05");
            assertThat(summary.getCalculatedAt()).isEqualTo(NOW);
            verify(pnlSummaryJpaRepository, never()).save(any());
        }

        @Test
        @DisplayName("Seven-day summary queries a 168 hour window")
        void summarize_sevenDayWindow() {
            when(tradeJpaRepository.findByExecutedAtGreaterThanEqualOrderByExecutedAtDesc(NOW.minusHours(168)))
                    .thenReturn(List.of());
            when(equitySnapshotJpaRepository.findBySnapshotAtGreaterThanEqualOrderBySnapshotAtAsc(NOW.minusHours(168)))
                    .thenReturn(List.of());

            PnlSummary summary = stateStore.summarizePnl(PnlPeriod.LAST_7D);

            assertThat(summary.getPeriod()).isEqualTo(PnlPeriod.LAST_7D);
            assertThat(summary.getUnrealizedPnl()).isEqualByComparingTo("0");
            assertThat(summary.getMaxDrawdown()).isEqualByComparingTo("0");
        }

        @Test
        @DisplayName("Period without fills is not persisted")
        void calculateAndSave_noTrades_notPersisted() {
            when(tradeJpaRepository.findByExecutedAtGreaterThanEqualOrderByExecutedAtDesc(DAY_AGO))
                    .thenReturn(List.of());
            when(equitySnapshotJpaRepository.findBySnapshotAtGreaterThanEqualOrderBySnapshotAtAsc(DAY_AGO))
                    .thenReturn(List.of(snapshot("1000", "0", 1)));

            PnlSummary summary = stateStore.calculateAndSavePnl(PnlPeriod.LAST_24H);

            assertThat(summary.getTotalTrades()).isZero();
            verify(pnlSummaryJpaRepository, never()).save(any());
        }

        @Test
        @DisplayName("Period with fills is persisted")
        void calculateAndSave_withTrades_persisted() {
            when(tradeJpaRepository.findByExecutedAtGreaterThanEqualOrderByExecutedAtDesc(DAY_AGO))
                    .thenReturn(List.of(trade("e1", null, "0.01")));
            when(equitySnapshotJpaRepository.findBySnapshotAtGreaterThanEqualOrderBySnapshotAtAsc(DAY_AGO))
                    .thenReturn(List.of());

            stateStore.calculateAndSavePnl(PnlPeriod.LAST_24H);

            ArgumentCaptor<PnlSummaryEntity> entity = ArgumentCaptor.forClass(PnlSummaryEntity.class);
            verify(pnlSummaryJpaRepository).save(entity.capture());
            assertThat(entity.getValue().getPeriod()).isEqualTo(PnlPeriod.LAST_24H);
            assertThat(entity.getValue().getTotalTrades()).isEqualTo(1);
        }
    }
}
