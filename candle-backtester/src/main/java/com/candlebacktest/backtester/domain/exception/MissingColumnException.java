package com.candlebacktest.backtester.domain.exception;

import lombok.Getter;

/**
 * Thrown when a candle series lacks one of the time/OHLCV fields.
 */
@Getter
public class MissingColumnException extends MarketSimulationException {

    private final String column;

    public MissingColumnException(String column) {
        super("Missing column: " + column);
        this.column = column;
    }

    public MissingColumnException(String column, String detail) {
        super("Missing column: " + column + " (" + detail + ")");
        this.column = column;
    }
}
