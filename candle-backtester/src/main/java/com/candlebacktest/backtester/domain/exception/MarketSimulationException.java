package com.candlebacktest.backtester.domain.exception;

/**
 * Base class for failures raised by the ledger, the execution clients and the
 * backtest engine. Raised at the violating call and never retried internally.
 */
public class MarketSimulationException extends RuntimeException {

    public MarketSimulationException(String message) {
        super(message);
    }

    public MarketSimulationException(String message, Throwable cause) {
        super(message, cause);
    }
}
