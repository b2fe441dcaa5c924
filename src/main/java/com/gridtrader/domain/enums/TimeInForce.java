package com.gridtrader.domain.enums;

/**
 * Order time-in-force. Grid and take-profit orders are always POST_ONLY so they rest
 * in the book as maker orders; the exchange rejects them instead of filling as taker.
 */
public enum TimeInForce {
    GTC("GTC"),
    IOC("IOC"),
    FOK("FOK"),
    POST_ONLY("PostOnly");

    private final String exchangeValue;

    TimeInForce(String exchangeValue) {
        this.exchangeValue = exchangeValue;
    }

    public String getExchangeValue() {
        return exchangeValue;
    }
}
