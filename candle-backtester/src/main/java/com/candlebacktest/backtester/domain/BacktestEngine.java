package com.candlebacktest.backtester.domain;

import com.candlebacktest.backtester.domain.exception.InsufficientHistoryException;
import com.candlebacktest.backtester.domain.exception.InvalidColumnTypeException;
import com.candlebacktest.backtester.domain.exception.InvalidExecutorException;
import com.candlebacktest.backtester.domain.exception.MissingColumnException;
import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Core backtesting engine that replays a candle series through a strategy.
 * <p>
 * Each step sets the current candle on the simulated client, runs the strategy
 * on the trailing window ending at that candle and records a performance row.
 * The window is cut from the series by timestamp and never reaches past the
 * current candle's time.
 */
@Slf4j
public class BacktestEngine {

    /**
     * Run a backtest of the strategy over the series.
     *
     * @param strategy strategy attached to a {@link SimulatedExecutionClient}
     * @param series   candles in non-decreasing time order
     */
    public BacktestReport runBacktest(Strategy strategy, List<Candle> series) {
        List<Candle> candles = series == null ? List.of() : List.copyOf(series);
        long windowMinutes = strategy.getAnalysisWindowMinutes();
        validate(strategy, candles, windowMinutes);

        log.info("Starting backtest - Strategy: {}, Candles: {}, Window: {} min",
                strategy.getName(), candles.size(), windowMinutes);

        ExecutionClient client = strategy.getExecutionClient();
        Ledger ledger = client.getState();
        Duration window = Duration.ofMinutes(windowMinutes);

        Instant startTime = candles.get(0).getTime().plus(window);
        int startIndex = firstIndexAtOrAfter(candles, startTime, 0);
        Candle startCandle = candles.get(startIndex);
        BigDecimal startValueInQuote = ledger.totalValueInQuote(startCandle.getOpen());

        List<PerformanceRow> rows = new ArrayList<>(candles.size() - startIndex);
        int windowFrom = 0;
        int windowTo = startIndex;

        for (int i = startIndex; i < candles.size(); i++) {
            Candle candle = candles.get(i);

            windowFrom = firstIndexAtOrAfter(candles, candle.getTime().minus(window), windowFrom);
            windowTo = firstIndexAfter(candles, candle.getTime(), Math.max(windowTo, i));
            List<Candle> analysisWindow = Collections.unmodifiableList(candles.subList(windowFrom, windowTo));

            client.setCurrentCandle(candle);
            strategy.run(analysisWindow);

            rows.add(PerformanceRecorder.snapshot(candle, startCandle, ledger, startValueInQuote));
        }

        BacktestReport report = summarize(strategy, ledger, rows, startValueInQuote,
                medianInterval(candles, startIndex));

        log.info("Backtest completed - Steps: {}, Transactions: {}, Total Return: {}%, Sharpe: {}, Max DD: {}%",
                rows.size(), report.getNumberOfTransactions(), report.getTotalReturn(),
                report.getSharpeRatio(), report.getMaxDrawdown());

        return report;
    }

    private void validate(Strategy strategy, List<Candle> candles, long windowMinutes) {
        if (candles.isEmpty()) {
            throw new InsufficientHistoryException("Candle series is empty");
        }

        Instant previous = null;
        for (int i = 0; i < candles.size(); i++) {
            Instant time = candles.get(i).getTime();
            if (time == null) {
                throw new MissingColumnException("time", "record " + i + " has no timestamp");
            }
            if (previous != null && time.isBefore(previous)) {
                throw new InvalidColumnTypeException("time",
                        "record " + i + " at " + time + " is earlier than " + previous);
            }
            previous = time;
        }

        long spanMinutes = Duration.between(candles.get(0).getTime(),
                candles.get(candles.size() - 1).getTime()).toMinutes();
        if (windowMinutes > spanMinutes) {
            throw new InsufficientHistoryException("Series spans " + spanMinutes
                    + " min but the strategy needs an analysis window of " + windowMinutes + " min");
        }

        for (int i = 0; i < candles.size(); i++) {
            Candle candle = candles.get(i);
            requireField(candle.getOpen(), "open", i);
            requireField(candle.getHigh(), "high", i);
            requireField(candle.getLow(), "low", i);
            requireField(candle.getClose(), "close", i);
            requireField(candle.getVolume(), "volume", i);
        }

        if (!(strategy.getExecutionClient() instanceof SimulatedExecutionClient)) {
            throw new InvalidExecutorException("Backtests need a simulated execution client, got "
                    + strategy.getExecutionClient().getClass().getSimpleName());
        }
    }

    private static void requireField(BigDecimal value, String column, int index) {
        if (value == null) {
            throw new MissingColumnException(column, "record " + index + " has no " + column);
        }
    }

    private static int firstIndexAtOrAfter(List<Candle> candles, Instant time, int from) {
        int i = from;
        while (i < candles.size() && candles.get(i).getTime().isBefore(time)) {
            i++;
        }
        return i;
    }

    private static int firstIndexAfter(List<Candle> candles, Instant time, int from) {
        int i = from;
        while (i < candles.size() && !candles.get(i).getTime().isAfter(time)) {
            i++;
        }
        return i;
    }

    private static Duration medianInterval(List<Candle> candles, int from) {
        List<Duration> gaps = new ArrayList<>();
        for (int i = from + 1; i < candles.size(); i++) {
            Duration gap = Duration.between(candles.get(i - 1).getTime(), candles.get(i).getTime());
            if (!gap.isZero()) {
                gaps.add(gap);
            }
        }
        if (gaps.isEmpty()) {
            return Duration.ZERO;
        }
        Collections.sort(gaps);
        return gaps.get(gaps.size() / 2);
    }

    private BacktestReport summarize(Strategy strategy, Ledger ledger, List<PerformanceRow> rows,
                                     BigDecimal startValueInQuote, Duration interval) {
        List<BigDecimal> equityCurve = rows.stream()
                .map(PerformanceRow::getTotalValueInQuote)
                .toList();
        BigDecimal finalValue = equityCurve.get(equityCurve.size() - 1);

        return BacktestReport.builder()
                .strategyName(strategy.getName())
                .parameters(strategy.getParameters())
                .rows(rows)
                .startValueInQuote(startValueInQuote)
                .finalValueInQuote(finalValue)
                .totalReturn(PerformanceMetrics.calculateTotalReturn(startValueInQuote, finalValue))
                .volatility(PerformanceMetrics.calculateVolatility(equityCurve))
                .sharpeRatio(PerformanceMetrics.calculateSharpeRatio(equityCurve,
                        PerformanceMetrics.periodsPerYear(interval)))
                .maxDrawdown(PerformanceMetrics.calculateMaxDrawdown(equityCurve))
                .numberOfTransactions(ledger.getNumberOfTransactions())
                .finalLedger(ledger.toSnapshot())
                .build();
    }

    /**
     * Result of a backtest run.
     */
    @Data
    @Builder
    public static class BacktestReport {
        private String strategyName;
        private Map<String, Object> parameters;
        private List<PerformanceRow> rows;
        private BigDecimal startValueInQuote;
        private BigDecimal finalValueInQuote;
        private BigDecimal totalReturn;
        private BigDecimal volatility;
        private BigDecimal sharpeRatio;
        private BigDecimal maxDrawdown;
        private int numberOfTransactions;
        private LedgerSnapshot finalLedger;
    }
}
