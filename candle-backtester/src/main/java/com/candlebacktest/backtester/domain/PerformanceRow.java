package com.candlebacktest.backtester.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Ledger snapshot taken after one backtest step.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PerformanceRow {

    private Instant time;
    private BigDecimal open;
    private BigDecimal high;
    private BigDecimal low;
    private BigDecimal close;
    private BigDecimal volume;

    private BigDecimal totalBase;
    private BigDecimal totalQuote;
    private BigDecimal baseAvailable;
    private BigDecimal quoteAvailable;
    private int numberOfOpenOrders;
    private int numberOfTransactions;

    private BigDecimal totalValueInQuote;
    private BigDecimal returnSinceStart;
    private BigDecimal holdReturnSinceStart;
}
