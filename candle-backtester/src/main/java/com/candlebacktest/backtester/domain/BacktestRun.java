package com.candlebacktest.backtester.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDateTime;

/**
 * Entity recording one backtest run: what was asked, how it ended, the
 * summary metrics and the ledger as the run left it.
 */
@Entity
@Table(name = "backtest_runs", indexes = {
        @Index(name = "idx_run_status", columnList = "status"),
        @Index(name = "idx_run_created_at", columnList = "created_at"),
        @Index(name = "idx_run_strategy_name", columnList = "strategy_name")
})
@EntityListeners(AuditingEntityListener.class)
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BacktestRun {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "strategy_name", nullable = false, length = 255)
    private String strategyName;

    @Column(name = "symbol", nullable = false, length = 20)
    private String symbol;

    @Column(name = "start_time", nullable = false)
    private Instant startTime;

    @Column(name = "end_time", nullable = false)
    private Instant endTime;

    @Column(name = "parameters_json", columnDefinition = "TEXT")
    private String parametersJson;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private RunStatus status;

    @Column(name = "failure_reason", columnDefinition = "TEXT")
    private String failureReason;

    @Column(name = "start_value", precision = 24, scale = 8)
    private BigDecimal startValueInQuote;

    @Column(name = "final_value", precision = 24, scale = 8)
    private BigDecimal finalValueInQuote;

    @Column(name = "total_return", precision = 12, scale = 4)
    private BigDecimal totalReturn;

    @Column(name = "volatility", precision = 12, scale = 4)
    private BigDecimal volatility;

    @Column(name = "sharpe_ratio", precision = 12, scale = 4)
    private BigDecimal sharpeRatio;

    @Column(name = "max_drawdown", precision = 12, scale = 4)
    private BigDecimal maxDrawdown;

    @Column(name = "number_of_transactions")
    private Integer numberOfTransactions;

    @Column(name = "execution_time_ms")
    private Long executionTimeMs;

    @Column(name = "rows_json", columnDefinition = "TEXT")
    private String rowsJson;

    @Column(name = "ledger_json", columnDefinition = "TEXT")
    private String ledgerJson;

    @CreatedDate
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @LastModifiedDate
    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;
}
