package com.gridtrader.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Data;

/**
 * Unified account balance. {@code totalEquity} is account-wide; {@code availableToWithdraw}
 * and {@code coinEquity} refer to the settle coin.
 */
@Data
@Builder
public class WalletBalance {

    private BigDecimal totalEquity;
    private BigDecimal totalAvailableBalance;
    private BigDecimal totalPerpUpl;
    private String coin;
    private BigDecimal coinEquity;
    private BigDecimal availableToWithdraw;
}
