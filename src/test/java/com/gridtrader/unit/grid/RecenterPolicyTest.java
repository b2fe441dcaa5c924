package com.gridtrader.unit.grid;

import static org.assertj.core.api.Assertions.assertThat;

import com.gridtrader.config.GridBotProperties;
import com.gridtrader.domain.enums.OrderSide;
import com.gridtrader.domain.enums.RecenterTrigger;
import com.gridtrader.domain.model.ExchangeOrder;
import com.gridtrader.grid.PriceHistory;
import com.gridtrader.grid.RecenterDecision;
import com.gridtrader.grid.RecenterPolicy;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for RecenterPolicy covering each trigger and their evaluation priority.
 */
class RecenterPolicyTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2025, 3, 10, 12, 0);
    private static final BigDecimal CENTER = new BigDecimal("100");

    private RecenterPolicy recenterPolicy;
    private PriceHistory history;
    private List<ExchangeOrder> ladder;

    @BeforeEach
    void setUp() {
        recenterPolicy = new RecenterPolicy(new GridBotProperties());
        history = new PriceHistory(720);
        ladder = List.of(
                order(OrderSide.BUY, "99"),
                order(OrderSide.BUY, "98"),
                order(OrderSide.SELL, "101"),
                order(OrderSide.SELL, "102"));
    }

    private RecenterDecision evaluate(String price, List<ExchangeOrder> orders, LocalDateTime lastRecenter) {
        return recenterPolicy.evaluate(new BigDecimal(price), orders, CENTER, lastRecenter, history, NOW);
    }

    // ==============================
    // NO ORDERS
    // ==============================

    @Test
    @DisplayName("Empty order book triggers a recenter")
    void noOrders_triggers() {
        RecenterDecision decision = evaluate("100", List.of(), NOW);

        assertThat(decision.triggered()).isTrue();
        assertThat(decision.trigger()).isEqualTo(RecenterTrigger.NO_ACTIVE_ORDERS);
        assertThat(decision.reason()).isEqualTo("No active orders found");
    }

    @Test
    @DisplayName("Price inside the band with a fresh ladder does not trigger")
    void priceInsideBand_noTrigger() {
        assertThat(evaluate("100", ladder, NOW).triggered()).isFalse();
    }

    // ==============================
    // BAND DEVIATION
    // ==============================

    @Nested
    @DisplayName("Band Deviation")
    class BandDeviation {

        @Test
        @DisplayName("Price just under highest sell + 2% does not trigger")
        void justInsideUpperBand_noTrigger() {
            // 102 * 1.02 = 104.04
            assertThat(evaluate("104", ladder, NOW).triggered()).isFalse();
        }

        @Test
        @DisplayName("Price above highest sell + 2% triggers")
        void aboveUpperBand_triggers() {
            RecenterDecision decision = evaluate("105", ladder, NOW);

            assertThat(decision.trigger()).isEqualTo(RecenterTrigger.BAND_DEVIATION);
            assertThat(decision.reason()).isEqualTo("Price 105 > highest sell 102 + 2%");
        }

        @Test
        @DisplayName("Price below lowest buy - 2% triggers")
        void belowLowerBand_triggers() {
            // 98 * 0.98 = 96.04
            RecenterDecision decision = evaluate("96", ladder, NOW);

            assertThat(decision.trigger()).isEqualTo(RecenterTrigger.BAND_DEVIATION);
            assertThat(decision.reason()).isEqualTo("Price 96 < lowest buy 98 - 2%");
        }

        @Test
        @DisplayName("One-sided book checks only the side that is present")
        void onlySellsPresent_checksUpperBandOnly() {
            List<ExchangeOrder> sellsOnly = List.of(order(OrderSide.SELL, "101"));

            assertThat(evaluate("90", sellsOnly, NOW).triggered()).isFalse();
            assertThat(evaluate("104", sellsOnly, NOW).trigger()).isEqualTo(RecenterTrigger.BAND_DEVIATION);
        }

        @Test
        @DisplayName("Band deviation wins over an elapsed recenter timer")
        void bandBeatsTime() {
            RecenterDecision decision = evaluate("105", ladder, NOW.minusHours(49));

            assertThat(decision.trigger()).isEqualTo(RecenterTrigger.BAND_DEVIATION);
        }
    }

    // ==============================
    // TIME BASED
    // ==============================

    @Nested
    @DisplayName("Time Based")
    class TimeBased {

        @Test
        @DisplayName("48 hours since the last rebuild triggers")
        void elapsed48h_triggers() {
            RecenterDecision decision = evaluate("100", ladder, NOW.minusHours(48));

            assertThat(decision.trigger()).isEqualTo(RecenterTrigger.TIME_BASED);
            assertThat(decision.reason()).isEqualTo("Time-based recenter: 48.0h >= 48h");
        }

        @Test
        @DisplayName("47 hours does not trigger")
        void elapsed47h_noTrigger() {
            assertThat(evaluate("100", ladder, NOW.minusHours(47)).triggered()).isFalse();
        }
    }

    // ==============================
    // HISTORY BASED
    // ==============================

    @Nested
    @DisplayName("History Based")
    class HistoryBased {

        @Test
        @DisplayName("Price above center for the whole window triggers one-sided")
        void alwaysAboveCenter_triggersOneSided() {
            fill(60, "101", "101");

            RecenterDecision decision = evaluate("101", ladder, NOW);

            assertThat(decision.trigger()).isEqualTo(RecenterTrigger.ONE_SIDED);
            assertThat(decision.reason()).isEqualTo("Price above center 100% of last 24h");
        }

        @Test
        @DisplayName("Price below center for the whole window triggers one-sided")
        void alwaysBelowCenter_triggersOneSided() {
            fill(60, "99", "99");

            RecenterDecision decision = evaluate("99", ladder, NOW);

            assertThat(decision.trigger()).isEqualTo(RecenterTrigger.ONE_SIDED);
            assertThat(decision.reason()).isEqualTo("Price below center 100% of last 24h");
        }

        @Test
        @DisplayName("Balanced history with a narrow range does not trigger")
        void balancedHistory_noTrigger() {
            fill(60, "99.5", "100.5");

            assertThat(evaluate("100", ladder, NOW).triggered()).isFalse();
        }

        @Test
        @DisplayName("A 6% range within the last hour triggers pump/dump")
        void wideRangeLastHour_triggersPumpDump() {
            fill(60, "97", "102.82");
            List<ExchangeOrder> wideLadder = List.of(order(OrderSide.BUY, "95"), order(OrderSide.SELL, "105"));

            RecenterDecision decision = evaluate("100", wideLadder, NOW);

            assertThat(decision.trigger()).isEqualTo(RecenterTrigger.PUMP_DUMP);
            assertThat(decision.reason()).isEqualTo("Pump/dump detected: 6.0% in 1h");
        }

        @Test
        @DisplayName("History checks are skipped below the minimum sample count")
        void tooFewSamples_noTrigger() {
            fill(30, "101", "101");

            assertThat(evaluate("101", ladder, NOW).triggered()).isFalse();
        }

        /** One sample per minute ending at NOW, alternating between the two prices. */
        private void fill(int count, String even, String odd) {
            for (int i = count - 1; i >= 0; i--) {
                history.add(new BigDecimal(i % 2 == 0 ? even : odd), NOW.minusMinutes(i));
            }
        }
    }

    private static ExchangeOrder order(OrderSide side, String price) {
        return ExchangeOrder.builder()
                .orderId(side + "-" + price)
                .symbol("XRPUSDT")
                .side(side)
                .price(new BigDecimal(price))
                .quantity(BigDecimal.ONE)
                .build();
    }
}
