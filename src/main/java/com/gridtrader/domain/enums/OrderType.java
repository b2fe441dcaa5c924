package com.gridtrader.domain.enums;

public enum OrderType {
    LIMIT("Limit"),
    MARKET("Market");

    private final String exchangeValue;

    OrderType(String exchangeValue) {
        this.exchangeValue = exchangeValue;
    }

    public String getExchangeValue() {
        return exchangeValue;
    }
}
