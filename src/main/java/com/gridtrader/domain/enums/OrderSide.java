package com.gridtrader.domain.enums;

/** Buy or sell side of an order. {@link #getExchangeValue()} is the Bybit v5 wire value. */
public enum OrderSide {
    BUY("Buy"),
    SELL("Sell");

    private final String exchangeValue;

    OrderSide(String exchangeValue) {
        this.exchangeValue = exchangeValue;
    }

    public String getExchangeValue() {
        return exchangeValue;
    }

    /** Returns the opposite side: BUY -> SELL, SELL -> BUY. Used for take-profit orders. */
    public OrderSide opposite() {
        return this == BUY ? SELL : BUY;
    }

    /** Parses the exchange wire value ("Buy"/"Sell", case-insensitive). Returns null if unknown. */
    public static OrderSide fromExchange(String value) {
        if (value == null) {
            return null;
        }
        for (OrderSide side : values()) {
            if (side.exchangeValue.equalsIgnoreCase(value)) {
                return side;
            }
        }
        return null;
    }
}
