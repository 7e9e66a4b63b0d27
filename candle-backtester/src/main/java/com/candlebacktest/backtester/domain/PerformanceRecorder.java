package com.candlebacktest.backtester.domain;

import java.math.BigDecimal;
import java.math.MathContext;

/**
 * Turns a ledger and the current candle into a {@link PerformanceRow}.
 */
public final class PerformanceRecorder {

    private PerformanceRecorder() {
    }

    /**
     * Snapshot the ledger at the given candle. Values are taken at the candle's
     * open, the same price market orders fill at.
     *
     * @param candle             the candle just processed
     * @param startCandle        first candle of the simulated range
     * @param ledger             ledger to read
     * @param startValueInQuote  ledger value at the start candle's open
     */
    public static PerformanceRow snapshot(Candle candle, Candle startCandle, Ledger ledger,
                                          BigDecimal startValueInQuote) {
        BigDecimal current = ledger.totalValueInQuote(candle.getOpen());

        return PerformanceRow.builder()
                .time(candle.getTime())
                .open(candle.getOpen())
                .high(candle.getHigh())
                .low(candle.getLow())
                .close(candle.getClose())
                .volume(candle.getVolume())
                .totalBase(ledger.getTotalBase())
                .totalQuote(ledger.getTotalQuote())
                .baseAvailable(ledger.getBaseAvailable())
                .quoteAvailable(ledger.getQuoteAvailable())
                .numberOfOpenOrders(ledger.getOpenOrders().size())
                .numberOfTransactions(ledger.getNumberOfTransactions())
                .totalValueInQuote(current)
                .returnSinceStart(relativeChange(startValueInQuote, current))
                .holdReturnSinceStart(relativeChange(startCandle.getOpen(), candle.getOpen()))
                .build();
    }

    private static BigDecimal relativeChange(BigDecimal from, BigDecimal to) {
        if (from == null || from.signum() == 0) {
            return BigDecimal.ZERO;
        }
        return to.divide(from, MathContext.DECIMAL64).subtract(BigDecimal.ONE);
    }
}
