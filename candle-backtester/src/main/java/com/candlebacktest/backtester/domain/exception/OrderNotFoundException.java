package com.candlebacktest.backtester.domain.exception;

import lombok.Getter;

/**
 * Thrown when an order id is unknown to the ledger.
 */
@Getter
public class OrderNotFoundException extends MarketSimulationException {

    private final String orderId;

    public OrderNotFoundException(String orderId) {
        super("Order not found: " + orderId);
        this.orderId = orderId;
    }
}
