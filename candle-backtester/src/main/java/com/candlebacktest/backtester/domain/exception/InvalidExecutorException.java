package com.candlebacktest.backtester.domain.exception;

/**
 * Thrown when a backtest is attached to an execution client that does not simulate fills.
 */
public class InvalidExecutorException extends MarketSimulationException {

    public InvalidExecutorException(String message) {
        super(message);
    }
}
