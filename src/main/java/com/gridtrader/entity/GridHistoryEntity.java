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

/**
 * JPA entity for the grid_history table.
 * One row per built ladder; the newest row seeds the center price after a restart.
 */
@Entity
@Table(name = "grid_history")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class GridHistoryEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "center_price", precision = 24, scale = 10, nullable = false)
    private BigDecimal centerPrice;

    @Column(name = "lowest_buy", precision = 24, scale = 10, nullable = false)
    private BigDecimal lowestBuy;

    @Column(name = "highest_sell", precision = 24, scale = 10, nullable = false)
    private BigDecimal highestSell;

    @Column(name = "num_buy_levels", nullable = false)
    private int buyLevelCount;

    @Column(name = "num_sell_levels", nullable = false)
    private int sellLevelCount;

    @Column(name = "grid_spacing", precision = 12, scale = 8, nullable = false)
    private BigDecimal gridSpacing;

    @Column(length = 255)
    private String reason;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;
}
