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
 * JPA entity for the bot_config table.
 * Each save inserts a new row and clears the active flag on older rows, keeping a history
 * of profile changes.
 */
@Entity
@Table(name = "bot_config")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BotConfigEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "profile_name", length = 50, nullable = false)
    private String profileName;

    @Column(length = 30, nullable = false)
    private String symbol;

    @Column(name = "grid_spacing", precision = 12, scale = 8, nullable = false)
    private BigDecimal gridSpacing;

    @Column(name = "target_levels", nullable = false)
    private int targetLevels;

    @Column(name = "profit_target", precision = 12, scale = 8, nullable = false)
    private BigDecimal profitTarget;

    @Column(name = "max_exposure_pct", precision = 12, scale = 8, nullable = false)
    private BigDecimal maxExposurePct;

    @Column(nullable = false)
    private int leverage;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;
}
