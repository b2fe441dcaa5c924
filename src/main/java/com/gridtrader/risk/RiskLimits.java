package com.gridtrader.risk;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Data;

/**
 * Account limits enforced by the risk manager. All values are fractions, not percents.
 *
 * <p>Loaded from application.yml ({@code gridbot.risk.*}) on startup by {@code RiskConfig}.
 */
@Data
@Builder
public class RiskLimits {

    /** Maximum sum of open position values relative to total equity (0.8 = 80%). */
    private BigDecimal maxExposurePct;

    /** Drop from the daily equity high that latches the kill switch (0.05 = 5%). */
    private BigDecimal killSwitchDrawdownPct;

    /** Maximum single order value relative to total equity. */
    private BigDecimal maxPositionSizePct;
}
