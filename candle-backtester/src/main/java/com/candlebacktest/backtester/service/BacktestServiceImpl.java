package com.candlebacktest.backtester.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.candlebacktest.backtester.controller.dto.BacktestRequest;
import com.candlebacktest.backtester.controller.dto.BacktestResponse;
import com.candlebacktest.backtester.domain.BacktestEngine;
import com.candlebacktest.backtester.domain.BacktestRun;
import com.candlebacktest.backtester.domain.Candle;
import com.candlebacktest.backtester.domain.FeeSchedule;
import com.candlebacktest.backtester.domain.Ledger;
import com.candlebacktest.backtester.domain.PerformanceRow;
import com.candlebacktest.backtester.domain.RunStatus;
import com.candlebacktest.backtester.domain.SimulatedExecutionClient;
import com.candlebacktest.backtester.domain.Strategy;
import com.candlebacktest.backtester.repository.BacktestRunRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Implementation of BacktestService that runs backtests on the calling thread
 * and records each run.
 * <p>
 * Runs are not wrapped in a transaction so that a FAILED record, and the ledger
 * as the failing step left it, are persisted before the error propagates.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BacktestServiceImpl implements BacktestService {

    static final String MDC_RUN_ID = "runId";
    private static final int MAX_FAILURE_REASON_LENGTH = 1000;

    private final BacktestRunRepository backtestRunRepository;
    private final MarketDataService marketDataService;
    private final StrategyFactory strategyFactory;
    private final FeeSchedule feeSchedule;
    private final LedgerCodec ledgerCodec;
    private final BacktestMetricsService metricsService;
    private final ObjectMapper objectMapper;

    @Override
    public BacktestResponse runBacktest(BacktestRequest request) {
        log.info("Received backtest for strategy: {}, symbol: {}",
                request.getStrategyName(), request.getSymbol());

        BacktestRun run = backtestRunRepository.save(BacktestRun.builder()
                .strategyName(request.getStrategyName())
                .symbol(request.getSymbol())
                .startTime(request.getStartTime())
                .endTime(request.getEndTime())
                .parametersJson(writeJson(request.getParameters() == null ? Map.of() : request.getParameters()))
                .status(RunStatus.RUNNING)
                .build());
        metricsService.recordRunStarted();

        MDC.put(MDC_RUN_ID, String.valueOf(run.getId()));
        try {
            return execute(run, request);
        } finally {
            MDC.remove(MDC_RUN_ID);
        }
    }

    private BacktestResponse execute(BacktestRun run, BacktestRequest request) {
        long startTime = System.currentTimeMillis();
        log.info("Status changed to RUNNING");

        Ledger ledger = null;
        try {
            List<Candle> candles = marketDataService.loadCandles(
                    request.getSymbol(), request.getStartTime(), request.getEndTime());

            BigDecimal initialBase = request.getInitialBase() == null ? BigDecimal.ZERO : request.getInitialBase();
            ledger = new Ledger(request.getSymbol(), initialBase, request.getInitialQuote());
            SimulatedExecutionClient client = new SimulatedExecutionClient(ledger, feeSchedule);
            Strategy strategy = strategyFactory.createStrategy(
                    request.getStrategyName(), request.getParameters(), client);

            BacktestEngine.BacktestReport report = new BacktestEngine().runBacktest(strategy, candles);
            long executionTimeMs = System.currentTimeMillis() - startTime;

            run.setStatus(RunStatus.COMPLETED);
            run.setParametersJson(writeJson(report.getParameters()));
            run.setStartValueInQuote(report.getStartValueInQuote());
            run.setFinalValueInQuote(report.getFinalValueInQuote());
            run.setTotalReturn(report.getTotalReturn());
            run.setVolatility(report.getVolatility());
            run.setSharpeRatio(report.getSharpeRatio());
            run.setMaxDrawdown(report.getMaxDrawdown());
            run.setNumberOfTransactions(report.getNumberOfTransactions());
            run.setExecutionTimeMs(executionTimeMs);
            run.setRowsJson(writeJson(report.getRows()));
            run.setLedgerJson(ledgerCodec.toJson(report.getFinalLedger()));
            BacktestRun saved = backtestRunRepository.save(run);

            log.info("Status changed to COMPLETED");
            log.info("Completed in {} ms with {} transactions", executionTimeMs, report.getNumberOfTransactions());
            metricsService.recordRunCompleted(executionTimeMs, report.getNumberOfTransactions());

            BacktestResponse response = toResponse(saved);
            response.setParameters(report.getParameters());
            response.setRows(report.getRows());
            response.setFinalLedger(report.getFinalLedger());
            return response;

        } catch (RuntimeException e) {
            log.error("Backtest failed: {}", e.getMessage(), e);
            recordFailure(run, ledger, e, System.currentTimeMillis() - startTime);
            throw e;
        }
    }

    private void recordFailure(BacktestRun run, Ledger ledger, RuntimeException error, long executionTimeMs) {
        String reason = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        if (reason.length() > MAX_FAILURE_REASON_LENGTH) {
            reason = reason.substring(0, MAX_FAILURE_REASON_LENGTH - 3) + "...";
        }

        run.setStatus(RunStatus.FAILED);
        run.setFailureReason(reason);
        run.setExecutionTimeMs(executionTimeMs);
        if (ledger != null) {
            run.setLedgerJson(ledgerCodec.toJson(ledger));
            run.setNumberOfTransactions(ledger.getNumberOfTransactions());
        }

        try {
            backtestRunRepository.save(run);
            log.info("Status changed to FAILED");
        } catch (RuntimeException saveError) {
            log.error("Failed to record failure of run {}: {}", run.getId(), saveError.getMessage(), saveError);
            error.addSuppressed(saveError);
        }
        metricsService.recordRunFailed();
    }

    @Override
    public BacktestResponse getRun(Long runId) {
        BacktestRun run = backtestRunRepository.findById(runId)
                .orElseThrow(() -> new BacktestRunNotFoundException(runId));
        return toResponse(run);
    }

    private BacktestResponse toResponse(BacktestRun run) {
        return BacktestResponse.builder()
                .runId(run.getId())
                .status(run.getStatus())
                .strategyName(run.getStrategyName())
                .symbol(run.getSymbol())
                .startTime(run.getStartTime())
                .endTime(run.getEndTime())
                .parameters(readJson(run.getParametersJson(), new TypeReference<Map<String, Object>>() {
                }))
                .failureReason(run.getFailureReason())
                .startValueInQuote(run.getStartValueInQuote())
                .finalValueInQuote(run.getFinalValueInQuote())
                .totalReturn(run.getTotalReturn())
                .volatility(run.getVolatility())
                .sharpeRatio(run.getSharpeRatio())
                .maxDrawdown(run.getMaxDrawdown())
                .numberOfTransactions(run.getNumberOfTransactions())
                .executionTimeMs(run.getExecutionTimeMs())
                .rows(readJson(run.getRowsJson(), new TypeReference<List<PerformanceRow>>() {
                }))
                .finalLedger(run.getLedgerJson() == null ? null : ledgerCodec.readSnapshot(run.getLedgerJson()))
                .createdAt(run.getCreatedAt())
                .build();
    }

    private String writeJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize run data", e);
        }
    }

    private <T> T readJson(String json, TypeReference<T> type) {
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored run data is not valid JSON", e);
        }
    }
}
