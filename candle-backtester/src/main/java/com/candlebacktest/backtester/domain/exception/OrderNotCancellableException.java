package com.candlebacktest.backtester.domain.exception;

/**
 * Thrown when cancelling an order that is no longer open.
 */
public class OrderNotCancellableException extends MarketSimulationException {

    public OrderNotCancellableException(String message) {
        super(message);
    }
}
