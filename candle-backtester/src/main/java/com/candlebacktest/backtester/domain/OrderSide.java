package com.candlebacktest.backtester.domain;

/**
 * Side of an order.
 */
public enum OrderSide {
    BUY,
    SELL
}
