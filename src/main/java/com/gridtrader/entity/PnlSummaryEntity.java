package com.gridtrader.entity;

import com.gridtrader.domain.enums.PnlPeriod;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** JPA entity for the pnl_summary table. One row per calculation run and period. */
@Entity
@Table(name = "pnl_summary")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PnlSummaryEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(columnDefinition = "varchar(10)", nullable = false)
    private PnlPeriod period;

    @Column(name = "realized_pnl", precision = 24, scale = 10, nullable = false)
    private BigDecimal realizedPnl;

    @Column(name = "unrealized_pnl", precision = 24, scale = 10, nullable = false)
    private BigDecimal unrealizedPnl;

    @Column(name = "total_trades", nullable = false)
    private int totalTrades;

    @Column(name = "winning_trades", nullable = false)
    private int winningTrades;

    @Column(name = "losing_trades", nullable = false)
    private int losingTrades;

    @Column(name = "total_fees", precision = 24, scale = 10, nullable = false)
    private BigDecimal totalFees;

    @Column(name = "max_drawdown", precision = 12, scale = 8, nullable = false)
    private BigDecimal maxDrawdown;

    @Column(name = "calculated_at", nullable = false)
    private LocalDateTime calculatedAt;
}
