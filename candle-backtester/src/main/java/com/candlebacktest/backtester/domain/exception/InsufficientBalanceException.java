package com.candlebacktest.backtester.domain.exception;

/**
 * Thrown when an order needs more than the available balance.
 */
public class InsufficientBalanceException extends MarketSimulationException {

    public InsufficientBalanceException(String message) {
        super(message);
    }
}
