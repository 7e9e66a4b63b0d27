package com.candlebacktest.backtester.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;

/**
 * Service for tracking backtest run metrics.
 * Exposes metrics via Spring Boot Actuator for monitoring.
 */
@Service
@Slf4j
public class BacktestMetricsService {

    private final Counter runsStartedCounter;
    private final Counter runsCompletedCounter;
    private final Counter runsFailedCounter;
    private final Counter fillsCounter;
    private final Timer executionTimer;

    public BacktestMetricsService(MeterRegistry meterRegistry) {
        this.runsStartedCounter = Counter.builder("backtest.runs.started")
                .description("Total number of backtest runs started")
                .register(meterRegistry);

        this.runsCompletedCounter = Counter.builder("backtest.runs.completed")
                .description("Total number of backtest runs completed successfully")
                .register(meterRegistry);

        this.runsFailedCounter = Counter.builder("backtest.runs.failed")
                .description("Total number of backtest runs that failed")
                .register(meterRegistry);

        this.fillsCounter = Counter.builder("backtest.orders.filled")
                .description("Total number of simulated order fills")
                .register(meterRegistry);

        this.executionTimer = Timer.builder("backtest.execution.time")
                .description("Backtest run execution time")
                .register(meterRegistry);

        log.info("BacktestMetricsService initialized with Micrometer metrics");
    }

    public void recordRunStarted() {
        runsStartedCounter.increment();
    }

    /**
     * Record a successful run with its execution time and fill count.
     */
    public void recordRunCompleted(long executionTimeMs, int fills) {
        runsCompletedCounter.increment();
        fillsCounter.increment(fills);
        executionTimer.record(executionTimeMs, TimeUnit.MILLISECONDS);
    }

    public void recordRunFailed() {
        runsFailedCounter.increment();
    }

    public String getMetricsSummary() {
        return String.format("Metrics: Started=%d, Completed=%d, Failed=%d, Fills=%d, AvgExecTime=%.2fs",
                (long) runsStartedCounter.count(),
                (long) runsCompletedCounter.count(),
                (long) runsFailedCounter.count(),
                (long) fillsCounter.count(),
                executionTimer.mean(TimeUnit.SECONDS));
    }
}
