package com.gridtrader.entity;

import com.gridtrader.domain.enums.OrderSide;
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

/**
 * JPA entity for the trades table.
 * Executed fills keyed by the exchange execution id (exec_id, unique).
 */
@Entity
@Table(name = "trades")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TradeEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "exec_id", length = 64, unique = true, nullable = false)
    private String execId;

    @Column(name = "order_id", length = 64, nullable = false)
    private String orderId;

    @Column(length = 30, nullable = false)
    private String symbol;

    @Enumerated(EnumType.STRING)
    @Column(columnDefinition = "varchar(10)", nullable = false)
    private OrderSide side;

    @Column(precision = 24, scale = 10, nullable = false)
    private BigDecimal price;

    @Column(precision = 24, scale = 10, nullable = false)
    private BigDecimal quantity;

    @Column(precision = 24, scale = 10, nullable = false)
    private BigDecimal fee;

    @Column(name = "fee_currency", length = 10)
    private String feeCurrency;

    @Column(name = "is_maker", nullable = false)
    private boolean maker;

    @Column(precision = 24, scale = 10)
    private BigDecimal profit;

    @Column(name = "grid_level")
    private Integer gridLevel;

    @Column(name = "executed_at", nullable = false)
    private LocalDateTime executedAt;
}
