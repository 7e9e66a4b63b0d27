package com.candlebacktest.backtester.service;

import lombok.Getter;

/**
 * Thrown when no backtest run is stored under the requested id.
 */
@Getter
public class BacktestRunNotFoundException extends RuntimeException {

    private final Long runId;

    public BacktestRunNotFoundException(Long runId) {
        super("Backtest run not found: " + runId);
        this.runId = runId;
    }
}
