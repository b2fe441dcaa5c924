package com.gridtrader.config;

import com.gridtrader.exception.InvalidProfileException;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Typed configuration for the grid bot under the {@code gridbot.*} prefix.
 *
 * <p>Every option carries a default so the bot starts with a conservative XRPUSDT setup
 * when application.yml is silent. Values are validated once at startup; a bad value
 * fails the context instead of surfacing at first use inside a polling loop.
 *
 * <p>Sections:
 * <ul>
 *   <li>{@code trading} -- symbol, category, capital, leverage, active profile</li>
 *   <li>{@code grid} -- named spacing profiles and ladder computation tuning</li>
 *   <li>{@code recenter} -- thresholds for the recenter triggers</li>
 *   <li>{@code risk} -- exposure, drawdown and order-size limits</li>
 *   <li>{@code monitoring} -- poll intervals and error backoffs of the four loops</li>
 * </ul>
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "gridbot")
public class GridBotProperties {

    /** Run the startup initialization (instrument spec, leverage, stored profile). */
    private boolean autoInitialize = true;

    @Valid
    private Trading trading = new Trading();

    @Valid
    private Grid grid = new Grid();

    @Valid
    private Recenter recenter = new Recenter();

    @Valid
    private Risk risk = new Risk();

    @Valid
    private Monitoring monitoring = new Monitoring();

    /**
     * Resolves a profile by name.
     *
     * @throws InvalidProfileException if no profile with that name is configured
     */
    public GridProfile getProfile(String name) {
        GridProfile profile = name == null ? null : grid.getProfiles().get(name);
        if (profile == null) {
            throw new InvalidProfileException(name, grid.getProfiles().keySet());
        }
        return profile;
    }

    // ========================
    // SECTIONS
    // ========================

    @Getter
    @Setter
    public static class Trading {

        @NotBlank
        private String symbol = "XRPUSDT";

        /** Bybit product category; perpetual USDT contracts are "linear". */
        @NotBlank
        private String category = "linear";

        /** Capital the ladder is sized against, in settle coin. */
        @NotNull
        @DecimalMin(value = "0", inclusive = false)
        private BigDecimal initialCapital = new BigDecimal("100");

        @Min(1)
        private int leverage = 1;

        @NotBlank
        private String settleCoin = "USDT";

        @NotBlank
        private String defaultProfile = "Normal";

        /** Place an opposite-side maker order after each fill. */
        private boolean takeProfitEnabled = false;
    }

    @Getter
    @Setter
    public static class Grid {

        @NotEmpty
        @Valid
        private Map<String, GridProfile> profiles = defaultProfiles();

        @NotNull
        @DecimalMin(value = "0", inclusive = false)
        private BigDecimal gridSpacingMax = new BigDecimal("0.02");

        /** Volatility (mean abs delta / center) above which spacing widens. */
        @NotNull
        private BigDecimal volatilityThreshold = new BigDecimal("0.005");

        @NotNull
        @DecimalMin("1")
        private BigDecimal volatilityMultiplier = new BigDecimal("1.2");

        @Min(1)
        private int volatilityPeriod = 14;

        /** Headroom over the exchange minimum notional required per level. */
        @NotNull
        @DecimalMin("1")
        private BigDecimal notionalBuffer = new BigDecimal("1.1");

        /** Price history window, 12h at one sample per minute. */
        @Min(2)
        private int maxHistoryPoints = 720;

        @NotNull
        private Duration settleDelay = Duration.ofSeconds(2);

        @NotNull
        private Duration orderSpacingDelay = Duration.ofMillis(100);

        private static Map<String, GridProfile> defaultProfiles() {
            Map<String, GridProfile> profiles = new LinkedHashMap<>();
            profiles.put("Conservative", new GridProfile(new BigDecimal("0.015"), 5, new BigDecimal("0.008")));
            profiles.put("Normal", new GridProfile(new BigDecimal("0.01"), 8, new BigDecimal("0.005")));
            profiles.put("Aggressive", new GridProfile(new BigDecimal("0.006"), 12, new BigDecimal("0.003")));
            return profiles;
        }
    }

    /** Spacing and density settings for one named grid profile. */
    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class GridProfile {

        /** Distance between consecutive levels as a fraction of center price. */
        @NotNull
        @DecimalMin(value = "0", inclusive = false)
        @DecimalMax(value = "0.5")
        private BigDecimal gridSpacing;

        /** Desired levels per side. */
        @Min(1)
        private int targetLevels;

        /** Take-profit distance from the fill price as a fraction. */
        @NotNull
        @DecimalMin(value = "0", inclusive = false)
        private BigDecimal profitTarget;
    }

    @Getter
    @Setter
    public static class Recenter {

        @NotNull
        @DecimalMin(value = "0", inclusive = false)
        private BigDecimal priceDeviationPct = new BigDecimal("0.02");

        @Min(1)
        private int timeBasedHours = 48;

        @Min(1)
        private int oneSideHours = 24;

        @NotNull
        @DecimalMin(value = "0", inclusive = false)
        private BigDecimal pumpDumpPct = new BigDecimal("0.05");

        /** History samples required before the one-sided and pump/dump checks run. */
        @Min(1)
        private int minHistorySamples = 60;

        @NotNull
        private BigDecimal oneSideUpper = new BigDecimal("0.8");

        @NotNull
        private BigDecimal oneSideLower = new BigDecimal("0.2");
    }

    @Getter
    @Setter
    public static class Risk {

        @NotNull
        @DecimalMin(value = "0", inclusive = false)
        private BigDecimal maxExposurePct = new BigDecimal("0.8");

        @NotNull
        @DecimalMin(value = "0", inclusive = false)
        @DecimalMax("1")
        private BigDecimal killSwitchDrawdownPct = new BigDecimal("0.05");

        @NotNull
        @DecimalMin(value = "0", inclusive = false)
        private BigDecimal maxPositionSizePct = new BigDecimal("0.2");
    }

    @Getter
    @Setter
    public static class Monitoring {

        @NotNull
        private Duration fillPollInterval = Duration.ofSeconds(5);

        @NotNull
        private Duration fillErrorBackoff = Duration.ofSeconds(10);

        @NotNull
        private Duration gridPollInterval = Duration.ofSeconds(60);

        @NotNull
        private Duration gridErrorBackoff = Duration.ofSeconds(60);

        /** Sleep after the grid monitor skips a cycle because exposure is over the cap. */
        @NotNull
        private Duration exposureSkipBackoff = Duration.ofSeconds(60);

        @NotNull
        private Duration riskPollInterval = Duration.ofSeconds(30);

        @NotNull
        private Duration riskErrorBackoff = Duration.ofSeconds(60);

        @NotNull
        private Duration snapshotInterval = Duration.ofMinutes(5);

        @NotNull
        private Duration snapshotErrorBackoff = Duration.ofMinutes(5);

        /** Poll interval of the risk monitor while the kill switch holds trading. */
        @NotNull
        private Duration killSwitchIdleInterval = Duration.ofSeconds(10);

        @Min(1)
        private int executionFetchLimit = 20;
    }
}
