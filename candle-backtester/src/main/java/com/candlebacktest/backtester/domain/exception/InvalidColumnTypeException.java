package com.candlebacktest.backtester.domain.exception;

import lombok.Getter;

/**
 * Thrown when a column of a candle series holds values of the wrong type or,
 * for the time column, is out of order.
 */
@Getter
public class InvalidColumnTypeException extends MarketSimulationException {

    private final String column;

    public InvalidColumnTypeException(String column, String detail) {
        super("Invalid column " + column + ": " + detail);
        this.column = column;
    }

    public InvalidColumnTypeException(String column, String detail, Throwable cause) {
        super("Invalid column " + column + ": " + detail, cause);
        this.column = column;
    }
}
