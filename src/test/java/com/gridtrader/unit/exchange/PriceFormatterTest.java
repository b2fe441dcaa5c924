package com.gridtrader.unit.exchange;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.gridtrader.exchange.PriceFormatter;
import java.math.BigDecimal;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class PriceFormatterTest {

    @Test
    @DisplayName("Prices floor to the tick")
    void priceFlooredToTick() {
        assertThat(PriceFormatter.formatPrice(new BigDecimal("0.56789"), new BigDecimal("0.0001")))
                .isEqualTo(new BigDecimal("0.5678"));
        assertThat(PriceFormatter.formatPrice(new BigDecimal("101.999"), new BigDecimal("0.5")))
                .isEqualByComparingTo("101.5");
    }

    @Test
    @DisplayName("Quantities floor to the step, including whole-number steps")
    void quantityFlooredToStep() {
        assertThat(PriceFormatter.formatQuantity(new BigDecimal("17.9"), BigDecimal.ONE))
                .isEqualTo(new BigDecimal("17"));
        assertThat(PriceFormatter.formatQuantity(new BigDecimal("0.0639"), new BigDecimal("0.001")))
                .isEqualTo(new BigDecimal("0.063"));
    }

    @Test
    @DisplayName("Formatting an already formatted value is a no-op")
    void idempotent() {
        BigDecimal tick = new BigDecimal("0.01");
        BigDecimal once = PriceFormatter.formatPrice(new BigDecimal("98.7654"), tick);

        assertThat(PriceFormatter.formatPrice(once, tick)).isEqualTo(once);
    }

    @Test
    @DisplayName("Non-positive step is rejected")
    void zeroStep_throws() {
        assertThatThrownBy(() -> PriceFormatter.formatPrice(BigDecimal.ONE, BigDecimal.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
