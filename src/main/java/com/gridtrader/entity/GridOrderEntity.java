package com.gridtrader.entity;

import com.gridtrader.domain.enums.OrderSide;
import com.gridtrader.domain.enums.OrderStatus;
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
 * JPA entity for the grid_orders table.
 * One row per order the bot placed (grid levels and take-profits). order_id is the
 * exchange-assigned id; inserting an id that already exists is skipped by the store.
 */
@Entity
@Table(name = "grid_orders")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class GridOrderEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "order_id", length = 64, unique = true, nullable = false)
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

    @Column(name = "order_type", length = 20, nullable = false)
    private String orderType;

    @Enumerated(EnumType.STRING)
    @Column(columnDefinition = "varchar(20)", nullable = false)
    private OrderStatus status;

    @Column(name = "grid_level")
    private Integer gridLevel;

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    @Column(name = "filled_at")
    private LocalDateTime filledAt;
}
