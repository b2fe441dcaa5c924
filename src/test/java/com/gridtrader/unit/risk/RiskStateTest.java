package com.gridtrader.unit.risk;

import static org.assertj.core.api.Assertions.assertThat;

import com.gridtrader.risk.RiskState;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class RiskStateTest {

    private static final LocalDateTime DAY1 = LocalDateTime.of(2025, 3, 10, 10, 0);

    @Test
    @DisplayName("First observation starts a day and sets the daily max")
    void firstObservation_setsDailyMax() {
        RiskState state = new RiskState();

        assertThat(state.recordEquity(new BigDecimal("1000"), DAY1)).isTrue();
        assertThat(state.getDailyMaxEquity()).isEqualByComparingTo("1000");
        assertThat(state.getLastEquityCheck()).isEqualTo(DAY1);
    }

    @Test
    @DisplayName("Daily max only rises within a day")
    void dailyMax_onlyRises() {
        RiskState state = new RiskState();
        state.recordEquity(new BigDecimal("1000"), DAY1);
        state.recordEquity(new BigDecimal("1100"), DAY1.plusHours(1));
        state.recordEquity(new BigDecimal("1050"), DAY1.plusHours(2));

        assertThat(state.getDailyMaxEquity()).isEqualByComparingTo("1100");
        assertThat(state.getTotalEquity()).isEqualByComparingTo("1050");
    }

    @Test
    @DisplayName("A new UTC day resets the daily max to the observed equity")
    void newDay_resetsDailyMax() {
        RiskState state = new RiskState();
        state.recordEquity(new BigDecimal("1000"), DAY1);

        boolean newDay = state.recordEquity(new BigDecimal("900"), DAY1.plusDays(1).withHour(0));

        assertThat(newDay).isTrue();
        assertThat(state.getDailyMaxEquity()).isEqualByComparingTo("900");
        assertThat(state.drawdown()).isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("Drawdown is the fractional drop from the daily max")
    void drawdown_fraction() {
        RiskState state = new RiskState();
        state.recordEquity(new BigDecimal("1000"), DAY1);
        state.recordEquity(new BigDecimal("900"), DAY1.plusMinutes(1));

        assertThat(state.drawdown()).isEqualByComparingTo("0.1");
    }

    @Test
    @DisplayName("Drawdown is zero before any observation")
    void drawdown_zeroWithoutHistory() {
        assertThat(new RiskState().drawdown()).isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("resetDailyMax rebases onto the current equity")
    void resetDailyMax_rebases() {
        RiskState state = new RiskState();
        state.recordEquity(new BigDecimal("1000"), DAY1);
        state.updateTotalEquity(new BigDecimal("850"));

        state.resetDailyMax();

        assertThat(state.getDailyMaxEquity()).isEqualByComparingTo("850");
        assertThat(state.drawdown()).isEqualByComparingTo("0");
    }
}
