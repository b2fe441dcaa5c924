package com.gridtrader.unit.exchange;

import static org.assertj.core.api.Assertions.assertThat;

import com.gridtrader.config.BybitConfig;
import com.gridtrader.exchange.BybitSigner;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class BybitSignerTest {

    private BybitSigner signer;

    @BeforeEach
    void setUp() {
        BybitConfig config = new BybitConfig();
        config.setApiKey("test-key");
        config.setApiSecret("test-secret");
        config.setRecvWindow(5000);
        signer = new BybitSigner(config);
    }

    @Test
    @DisplayName("Signs timestamp + key + recvWindow + query as lowercase hex HMAC-SHA256")
    void signsQueryString() {
        assertThat(signer.sign("1700000000000", "category=linear&symbol=XRPUSDT"))
                .isEqualTo("61b7054adca7524b4647ca4fcdd92b12ff094ddabed8470031fb73b756cdf443");
    }

    @Test
    @DisplayName("Null payload signs as empty")
    void nullPayload_signedAsEmpty() {
        assertThat(signer.sign("1700000000000", null))
                .isEqualTo("d8d5e71d8f986368aa5c13405f059ab6adb4f41df59d2f11bb056226b63457d6")
                .isEqualTo(signer.sign("1700000000000", ""));
    }

    @Test
    @DisplayName("Exposes key and recvWindow for the request headers")
    void headerValues() {
        assertThat(signer.getApiKey()).isEqualTo("test-key");
        assertThat(signer.getRecvWindow()).isEqualTo("5000");
    }
}
