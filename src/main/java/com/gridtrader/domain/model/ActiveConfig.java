package com.gridtrader.domain.model;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Data;

/**
 * The trading configuration in effect, persisted so the selected profile survives a restart.
 */
@Data
@Builder
public class ActiveConfig {

    private Long id;
    private String profileName;
    private String symbol;
    private BigDecimal gridSpacing;
    private int targetLevels;
    private BigDecimal profitTarget;
    private BigDecimal maxExposurePct;
    private int leverage;
    private LocalDateTime createdAt;
}
