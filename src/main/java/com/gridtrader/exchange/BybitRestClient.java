package com.gridtrader.exchange;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gridtrader.exception.ExchangeException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import io.github.resilience4j.retry.annotation.Retry;
import java.time.Clock;
import java.util.Map;
import java.util.Set;
import java.util.StringJoiner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * Internal transport for the Bybit v5 REST API. Only {@link BybitExchangeGateway} calls it.
 *
 * <p>Each method is annotated with Resilience4j decorators:
 * <ul>
 *   <li><b>Rate limiter</b> ({@code bybitApi}, {@code bybitOrders} for order submission): 10 req/sec
 *       each, Bybit's per-UID default</li>
 *   <li><b>Circuit breaker</b> ({@code bybitApi}): opens after repeated transient failures</li>
 *   <li><b>Retry</b> ({@code bybitApi}): 3 attempts with exponential backoff (1s, 2s) for
 *       failures flagged retryable by {@link TransientExchangeFailure}</li>
 * </ul>
 * {@link #submitOrder} is not retried; a duplicate placement would double the position.
 *
 * <p>Every failure surfaces as an unchecked {@link ExchangeException}. Responses with
 * {@code retCode != 0} are mapped here:
 * <ul>
 *   <li>10006 (rate limit), 10016 (server error), 10002 (request expired): retryable</li>
 *   <li>10001 (params), 110043 (leverage unchanged), 100028 (unified account restriction):
 *       soft, non-retryable, logged at WARN</li>
 *   <li>anything else: non-retryable, logged at ERROR</li>
 * </ul>
 */
@Service
public class BybitRestClient {

    private static final Logger log = LoggerFactory.getLogger(BybitRestClient.class);

    public static final int RET_OK = 0;
    public static final int RET_PARAMS_ERROR = 10001;
    public static final int RET_RATE_LIMIT = 10006;
    public static final int RET_LEVERAGE_NOT_MODIFIED = 110043;

    private static final Set<Integer> RETRYABLE_CODES = Set.of(RET_RATE_LIMIT, 10016, 10002);
    private static final Set<Integer> SOFT_CODES = Set.of(RET_PARAMS_ERROR, RET_LEVERAGE_NOT_MODIFIED, 100028);

    private final RestClient bybitHttpClient;
    private final BybitSigner signer;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public BybitRestClient(
            @Qualifier("bybitHttpClient") RestClient bybitHttpClient,
            BybitSigner signer,
            ObjectMapper objectMapper,
            Clock clock) {
        this.bybitHttpClient = bybitHttpClient;
        this.signer = signer;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    // ========================
    // PUBLIC ENDPOINTS
    // ========================

    /** Unsigned GET (market data). Returns the {@code result} node. */
    @RateLimiter(name = "bybitApi")
    @CircuitBreaker(name = "bybitApi")
    @Retry(name = "bybitApi")
    public JsonNode getPublic(String path, Map<String, String> params) {
        String query = toQueryString(params);
        return execute(path, () -> bybitHttpClient
                .get()
                .uri(withQuery(path, query))
                .retrieve()
                .body(String.class));
    }

    // ========================
    // PRIVATE ENDPOINTS
    // ========================

    /** Signed GET (account, orders, positions, executions). */
    @RateLimiter(name = "bybitApi")
    @CircuitBreaker(name = "bybitApi")
    @Retry(name = "bybitApi")
    public JsonNode getPrivate(String path, Map<String, String> params) {
        String query = toQueryString(params);
        String timestamp = String.valueOf(clock.millis());
        String sign = signer.sign(timestamp, query);
        return execute(path, () -> bybitHttpClient
                .get()
                .uri(withQuery(path, query))
                .headers(h -> {
                    h.set("X-BAPI-API-KEY", signer.getApiKey());
                    h.set("X-BAPI-TIMESTAMP", timestamp);
                    h.set("X-BAPI-RECV-WINDOW", signer.getRecvWindow());
                    h.set("X-BAPI-SIGN", sign);
                })
                .retrieve()
                .body(String.class));
    }

    /** Signed POST for requests that are safe to repeat (cancel-all, set-leverage). */
    @RateLimiter(name = "bybitApi")
    @CircuitBreaker(name = "bybitApi")
    @Retry(name = "bybitApi")
    public JsonNode postPrivate(String path, Map<String, Object> body) {
        return signedPost(path, body);
    }

    /** Signed order creation. Rate limited but never retried. */
    @RateLimiter(name = "bybitOrders")
    @CircuitBreaker(name = "bybitApi")
    public JsonNode submitOrder(Map<String, Object> body) {
        return signedPost("/v5/order/create", body);
    }

    // ========================
    // INTERNALS
    // ========================

    private JsonNode signedPost(String path, Map<String, Object> body) {
        String json;
        try {
            json = objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new ExchangeException("Cannot serialize request body for " + path, e, false);
        }
        String timestamp = String.valueOf(clock.millis());
        String sign = signer.sign(timestamp, json);
        return execute(path, () -> bybitHttpClient
                .post()
                .uri(path)
                .contentType(MediaType.APPLICATION_JSON)
                .headers(h -> {
                    h.set("X-BAPI-API-KEY", signer.getApiKey());
                    h.set("X-BAPI-TIMESTAMP", timestamp);
                    h.set("X-BAPI-RECV-WINDOW", signer.getRecvWindow());
                    h.set("X-BAPI-SIGN", sign);
                })
                .body(json)
                .retrieve()
                .body(String.class));
    }

    private JsonNode execute(String path, HttpCall call) {
        String raw;
        try {
            raw = call.perform();
        } catch (RestClientResponseException e) {
            int status = e.getStatusCode().value();
            boolean retryable = status == 429 || status >= 500;
            log.error("Bybit HTTP {} on {}: {}", status, path, e.getResponseBodyAsString());
            throw new ExchangeException("HTTP " + status + " from " + path, e, retryable);
        } catch (ResourceAccessException e) {
            log.warn("Bybit request to {} failed: {}", path, e.getMessage());
            throw new ExchangeException("I/O error calling " + path + ": " + e.getMessage(), e, true);
        } catch (RestClientException e) {
            log.error("Bybit request to {} failed", path, e);
            throw new ExchangeException("Error calling " + path + ": " + e.getMessage(), e, false);
        }
        return parseResult(path, raw);
    }

    JsonNode parseResult(String path, String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ExchangeException(-1, "Empty response from " + path, true);
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            throw new ExchangeException("Malformed response from " + path, e, true);
        }
        int retCode = root.path("retCode").asInt(-1);
        String retMsg = root.path("retMsg").asText("");
        if (retCode == RET_OK) {
            return root.path("result");
        }
        if (RETRYABLE_CODES.contains(retCode)) {
            log.warn("Bybit transient error {} on {}: {}", retCode, path, retMsg);
            throw new ExchangeException(retCode, retMsg, true);
        }
        if (SOFT_CODES.contains(retCode)) {
            log.warn("Bybit error {} on {}: {} (continuing)", retCode, path, retMsg);
        } else {
            log.error("Bybit API error {} on {}: {}", retCode, path, retMsg);
        }
        throw new ExchangeException(retCode, retMsg, false);
    }

    static String toQueryString(Map<String, String> params) {
        if (params == null || params.isEmpty()) {
            return "";
        }
        StringJoiner joiner = new StringJoiner("&");
        params.forEach((k, v) -> {
            if (v != null) {
                joiner.add(k + "=" + v);
            }
        });
        return joiner.toString();
    }

    private static String withQuery(String path, String query) {
        return query.isEmpty() ? path : path + "?" + query;
    }

    @FunctionalInterface
    private interface HttpCall {
        String perform();
    }
}
