package com.gridtrader.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
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

/** JPA entity for the equity_snapshots table, written by the snapshot loop. */
@Entity
@Table(name = "equity_snapshots")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EquitySnapshotEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "total_equity", precision = 24, scale = 10, nullable = false)
    private BigDecimal totalEquity;

    @Column(name = "available_balance", precision = 24, scale = 10, nullable = false)
    private BigDecimal availableBalance;

    @Column(name = "unrealized_pnl", precision = 24, scale = 10, nullable = false)
    private BigDecimal unrealizedPnl;

    @Column(name = "total_positions_value", precision = 24, scale = 10, nullable = false)
    private BigDecimal totalPositionsValue;

    @Column(name = "snapshot_at", nullable = false)
    private LocalDateTime snapshotAt;
}
