package com.candlebacktest.backtester.domain;

/**
 * Lifecycle status of an order. FILLED and CANCELLED are terminal.
 */
public enum OrderStatus {
    OPEN,
    FILLED,
    CANCELLED
}
