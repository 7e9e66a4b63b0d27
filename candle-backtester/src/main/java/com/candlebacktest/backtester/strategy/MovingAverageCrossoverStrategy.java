package com.candlebacktest.backtester.strategy;

import com.candlebacktest.backtester.domain.AbstractStrategy;
import com.candlebacktest.backtester.domain.Candle;
import com.candlebacktest.backtester.domain.ExecutionClient;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Map;

/**
 * Moving Average Crossover Strategy.
 * Buys when the short MA crosses above the long MA, sells when it crosses
 * below. Both averages, current and previous, come from the analysis window.
 */
@Slf4j
public class MovingAverageCrossoverStrategy extends AbstractStrategy {

    private final int shortPeriod;
    private final int longPeriod;
    private final long candleIntervalMinutes;

    public MovingAverageCrossoverStrategy(ExecutionClient executionClient, int shortPeriod, int longPeriod,
                                          long candleIntervalMinutes) {
        super(executionClient);
        if (shortPeriod <= 0 || shortPeriod >= longPeriod) {
            throw new IllegalArgumentException("Short period must be positive and less than long period");
        }
        if (candleIntervalMinutes <= 0) {
            throw new IllegalArgumentException("Candle interval must be positive");
        }
        this.shortPeriod = shortPeriod;
        this.longPeriod = longPeriod;
        this.candleIntervalMinutes = candleIntervalMinutes;
    }

    @Override
    public void execute(List<Candle> analysisWindow) {
        // Wait until we have enough data for the previous long MA as well
        if (analysisWindow.size() < longPeriod + 1) {
            return;
        }

        int last = analysisWindow.size();
        BigDecimal shortMA = calculateMA(analysisWindow, last, shortPeriod);
        BigDecimal longMA = calculateMA(analysisWindow, last, longPeriod);
        BigDecimal previousShortMA = calculateMA(analysisWindow, last - 1, shortPeriod);
        BigDecimal previousLongMA = calculateMA(analysisWindow, last - 1, longPeriod);

        boolean wasBelowLong = previousShortMA.compareTo(previousLongMA) < 0;
        boolean isAboveLong = shortMA.compareTo(longMA) > 0;
        boolean wasAboveLong = previousShortMA.compareTo(previousLongMA) > 0;
        boolean isBelowLong = shortMA.compareTo(longMA) < 0;

        // Golden cross - buy signal
        if (wasBelowLong && isAboveLong) {
            BigDecimal quote = getState().getQuoteAvailable();
            if (quote.signum() > 0) {
                getExecutionClient().placeMarketBuyOrder(base(), quote);
                log.debug("MA Crossover: BUY with {} quote (Short MA: {}, Long MA: {})", quote, shortMA, longMA);
            }
        }
        // Death cross - sell signal
        else if (wasAboveLong && isBelowLong) {
            BigDecimal amount = getState().getBaseAvailable();
            if (amount.signum() > 0) {
                getExecutionClient().placeMarketSellOrder(base(), amount);
                log.debug("MA Crossover: SELL {} {} (Short MA: {}, Long MA: {})", amount, base(), shortMA, longMA);
            }
        }
    }

    @Override
    public long getAnalysisWindowMinutes() {
        return longPeriod * candleIntervalMinutes;
    }

    @Override
    public String getName() {
        return "MovingAverageCrossover(" + shortPeriod + "," + longPeriod + ")";
    }

    @Override
    public Map<String, Object> getParameters() {
        return Map.of(
                "shortPeriod", shortPeriod,
                "longPeriod", longPeriod,
                "candleIntervalMinutes", candleIntervalMinutes);
    }

    private BigDecimal calculateMA(List<Candle> candles, int endExclusive, int period) {
        BigDecimal sum = candles.subList(endExclusive - period, endExclusive).stream()
                .map(Candle::getClose)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        return sum.divide(BigDecimal.valueOf(period), 8, RoundingMode.HALF_UP);
    }
}
