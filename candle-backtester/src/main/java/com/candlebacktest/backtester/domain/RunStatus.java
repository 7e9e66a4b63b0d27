package com.candlebacktest.backtester.domain;

/**
 * Status enum for a recorded backtest run.
 */
public enum RunStatus {
    RUNNING,
    COMPLETED,
    FAILED
}
