package com.candlebacktest.backtester.controller.dto;

import com.candlebacktest.backtester.domain.LedgerSnapshot;
import com.candlebacktest.backtester.domain.PerformanceRow;
import com.candlebacktest.backtester.domain.RunStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * Response DTO for a backtest run.
 * Metrics, rows and the final ledger are present once the run completed.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BacktestResponse {

    private Long runId;
    private RunStatus status;
    private String strategyName;
    private String symbol;
    private Instant startTime;
    private Instant endTime;
    private Map<String, Object> parameters;
    private String failureReason;

    private BigDecimal startValueInQuote;
    private BigDecimal finalValueInQuote;
    private BigDecimal totalReturn;
    private BigDecimal volatility;
    private BigDecimal sharpeRatio;
    private BigDecimal maxDrawdown;
    private Integer numberOfTransactions;
    private Long executionTimeMs;

    private List<PerformanceRow> rows;
    private LedgerSnapshot finalLedger;

    private LocalDateTime createdAt;
}
