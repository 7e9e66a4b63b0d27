package com.candlebacktest.backtester.domain.exception;

/**
 * Thrown when a candle series spans less than the strategy's analysis window.
 */
public class InsufficientHistoryException extends MarketSimulationException {

    public InsufficientHistoryException(String message) {
        super(message);
    }
}
