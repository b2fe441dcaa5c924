package com.gridtrader.exchange;

import com.gridtrader.domain.model.InstrumentSpec;
import com.gridtrader.exception.ExchangeException;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Loads and caches {@link InstrumentSpec} per symbol. The spec is fetched on engine
 * initialization and not refreshed afterwards unless {@link #refresh} is called.
 */
@Component
public class InstrumentSpecResolver {

    private static final Logger log = LoggerFactory.getLogger(InstrumentSpecResolver.class);

    private final ExchangeGateway exchangeGateway;
    private final Map<String, InstrumentSpec> cache = new ConcurrentHashMap<>();

    public InstrumentSpecResolver(ExchangeGateway exchangeGateway) {
        this.exchangeGateway = exchangeGateway;
    }

    /**
     * Returns the cached spec, loading it on first use.
     *
     * @throws ExchangeException if the exchange cannot supply the spec
     */
    public InstrumentSpec resolve(String symbol) {
        InstrumentSpec cached = cache.get(symbol);
        return cached != null ? cached : refresh(symbol);
    }

    /**
     * Fetches the spec from the exchange and replaces the cached copy.
     *
     * @throws ExchangeException if the exchange cannot supply the spec
     */
    public InstrumentSpec refresh(String symbol) {
        GatewayResult<InstrumentSpec> result = exchangeGateway.getInstrumentSpec(symbol);
        if (result.isFailure()) {
            GatewayError error = result.getError();
            throw new ExchangeException(
                    -1, "Failed to load instrument info for " + symbol + ": " + error.message(), error.retryable());
        }
        InstrumentSpec spec = result.getValue();
        cache.put(symbol, spec);
        log.info(
                "Instrument specs for {}: minQty={}, qtyStep={}, minNotional={}, tickSize={}",
                symbol,
                spec.getMinOrderQty(),
                spec.getQtyStep(),
                spec.getMinNotional(),
                spec.getTickSize());
        return spec;
    }

    public Optional<InstrumentSpec> getCached(String symbol) {
        return Optional.ofNullable(cache.get(symbol));
    }
}
