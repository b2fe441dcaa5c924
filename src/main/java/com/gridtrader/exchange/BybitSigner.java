package com.gridtrader.exchange;

import com.gridtrader.config.BybitConfig;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import org.springframework.stereotype.Component;

/**
 * Bybit v5 request signature: hex HMAC-SHA256 of {@code timestamp + apiKey + recvWindow + payload},
 * where payload is the query string for GET and the raw JSON body for POST.
 */
@Component
public class BybitSigner {

    private static final String HMAC_SHA256 = "HmacSHA256";

    private final String apiKey;
    private final String apiSecret;
    private final String recvWindow;

    public BybitSigner(BybitConfig bybitConfig) {
        this.apiKey = bybitConfig.getApiKey();
        this.apiSecret = bybitConfig.getApiSecret();
        this.recvWindow = String.valueOf(bybitConfig.getRecvWindow());
    }

    public String sign(String timestamp, String payload) {
        String toSign = timestamp + apiKey + recvWindow + (payload != null ? payload : "");
        try {
            Mac mac = Mac.getInstance(HMAC_SHA256);
            mac.init(new SecretKeySpec(apiSecret.getBytes(StandardCharsets.UTF_8), HMAC_SHA256));
            byte[] raw = mac.doFinal(toSign.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder(raw.length * 2);
            for (byte b : raw) {
                sb.append(String.format("%02x", b));
            }
            return sb.toString();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA256 unavailable", e);
        }
    }

    public String getApiKey() {
        return apiKey;
    }

    public String getRecvWindow() {
        return recvWindow;
    }
}
