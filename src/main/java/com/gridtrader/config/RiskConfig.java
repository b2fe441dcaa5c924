package com.gridtrader.config;

import com.gridtrader.risk.RiskLimits;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the {@link RiskLimits} bean from the {@code gridbot.risk.*} section.
 */
@Configuration
public class RiskConfig {

    @Bean
    public RiskLimits riskLimits(GridBotProperties properties) {
        GridBotProperties.Risk risk = properties.getRisk();
        return RiskLimits.builder()
                .maxExposurePct(risk.getMaxExposurePct())
                .killSwitchDrawdownPct(risk.getKillSwitchDrawdownPct())
                .maxPositionSizePct(risk.getMaxPositionSizePct())
                .build();
    }
}
