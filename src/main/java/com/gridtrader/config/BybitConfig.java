package com.gridtrader.config;

import jakarta.annotation.PostConstruct;
import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Configuration properties and bean definitions for the Bybit v5 REST API.
 *
 * <p>Binds to the {@code bybit.*} prefix. Credentials are normally supplied through the
 * {@code BYBIT_API_KEY} / {@code BYBIT_API_SECRET} environment variables. Missing credentials
 * fail the application context at startup; the bot cannot sign a single private request
 * without them.
 */
@Configuration
@ConfigurationProperties(prefix = "bybit")
@Getter
@Setter
public class BybitConfig {

    private static final Logger log = LoggerFactory.getLogger(BybitConfig.class);

    static final String MAINNET_URL = "https://api.bybit.com";
    static final String TESTNET_URL = "https://api-testnet.bybit.com";

    private String apiKey;

    private String apiSecret;

    /** Routes requests to api-testnet.bybit.com when true. */
    private boolean testnet = true;

    /** Explicit base URL; overrides {@link #testnet} when set. */
    private String baseUrl;

    /** Milliseconds a signed request stays valid on the exchange side. */
    private long recvWindow = 5000;

    private Duration connectTimeout = Duration.ofSeconds(10);

    private Duration readTimeout = Duration.ofSeconds(10);

    @PostConstruct
    void validateCredentials() {
        if (apiKey == null || apiKey.isBlank() || apiSecret == null || apiSecret.isBlank()) {
            throw new IllegalStateException(
                    "Bybit API credentials not found. Set BYBIT_API_KEY and BYBIT_API_SECRET environment variables");
        }
        log.info(
                "Bybit client configured: {} (key {})", testnet ? "TESTNET" : "MAINNET", maskApiKey(apiKey));
    }

    /**
     * RestClient bound to the resolved Bybit base URL. Signing headers are added per request
     * by {@link com.gridtrader.exchange.BybitRestClient}.
     */
    @Bean
    public RestClient bybitHttpClient() {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) connectTimeout.toMillis());
        requestFactory.setReadTimeout((int) readTimeout.toMillis());
        return RestClient.builder()
                .baseUrl(resolveBaseUrl())
                .requestFactory(requestFactory)
                .build();
    }

    public String resolveBaseUrl() {
        if (baseUrl != null && !baseUrl.isBlank()) {
            return baseUrl;
        }
        return testnet ? TESTNET_URL : MAINNET_URL;
    }

    private String maskApiKey(String key) {
        if (key == null || key.length() < 4) {
            return "****";
        }
        return key.substring(0, 4) + "****";
    }
}
