package com.candlebacktest.backtester.strategy;

import com.candlebacktest.backtester.domain.AbstractStrategy;
import com.candlebacktest.backtester.domain.Candle;
import com.candlebacktest.backtester.domain.ExecutionClient;
import lombok.extern.slf4j.Slf4j;
import org.ta4j.core.BarSeries;
import org.ta4j.core.BaseBarSeries;
import org.ta4j.core.indicators.RSIIndicator;
import org.ta4j.core.indicators.helpers.ClosePriceIndicator;
import org.ta4j.core.num.Num;

import java.math.BigDecimal;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Map;

/**
 * Relative Strength Index strategy.
 * Buys with all available quote when the RSI drops below the lower threshold
 * and sells all available base when it rises above the higher threshold.
 */
@Slf4j
public class RsiStrategy extends AbstractStrategy {

    public static final long DEFAULT_ANALYSIS_WINDOW_MINUTES = 60L * 24 * 30;

    private final double lowerThreshold;
    private final double higherThreshold;
    private final int period;
    private final long analysisWindowMinutes;

    public RsiStrategy(ExecutionClient executionClient, double lowerThreshold, double higherThreshold,
                       int period, long analysisWindowMinutes) {
        super(executionClient);
        if (lowerThreshold >= higherThreshold) {
            throw new IllegalArgumentException("Lower threshold must be below higher threshold");
        }
        if (period < 2) {
            throw new IllegalArgumentException("RSI period must be at least 2");
        }
        this.lowerThreshold = lowerThreshold;
        this.higherThreshold = higherThreshold;
        this.period = period;
        this.analysisWindowMinutes = analysisWindowMinutes;
    }

    @Override
    public void execute(List<Candle> analysisWindow) {
        BarSeries series = toBarSeries(analysisWindow);
        if (series.getBarCount() < period + 1) {
            return;
        }

        RSIIndicator rsi = new RSIIndicator(new ClosePriceIndicator(series), period);
        Num current = rsi.getValue(series.getEndIndex());
        Num previous = rsi.getValue(series.getEndIndex() - 1);
        if (current.isNaN() || previous.isNaN()) {
            return;
        }

        double currentRsi = current.doubleValue();
        double previousRsi = previous.doubleValue();

        if (previousRsi > lowerThreshold && currentRsi < lowerThreshold) {
            BigDecimal quote = getState().getQuoteAvailable();
            if (quote.signum() > 0) {
                getExecutionClient().placeMarketBuyOrder(base(), quote);
                log.debug("RSI: BUY with {} quote (RSI {} -> {})", quote, previousRsi, currentRsi);
            }
        }

        if (previousRsi < higherThreshold && currentRsi > higherThreshold) {
            BigDecimal amount = getState().getBaseAvailable();
            if (amount.signum() > 0) {
                getExecutionClient().placeMarketSellOrder(base(), amount);
                log.debug("RSI: SELL {} {} (RSI {} -> {})", amount, base(), previousRsi, currentRsi);
            }
        }
    }

    @Override
    public long getAnalysisWindowMinutes() {
        return analysisWindowMinutes;
    }

    @Override
    public String getName() {
        return "RSI(" + period + "," + lowerThreshold + "," + higherThreshold + ")";
    }

    @Override
    public Map<String, Object> getParameters() {
        return Map.of(
                "lowerThreshold", lowerThreshold,
                "higherThreshold", higherThreshold,
                "period", period,
                "analysisWindowMinutes", analysisWindowMinutes);
    }

    private static BarSeries toBarSeries(List<Candle> candles) {
        BarSeries series = new BaseBarSeries("rsi");
        ZonedDateTime lastEnd = null;
        for (Candle candle : candles) {
            ZonedDateTime end = candle.getTime().atZone(ZoneOffset.UTC);
            // bars need strictly increasing end times
            if (lastEnd != null && !end.isAfter(lastEnd)) {
                continue;
            }
            series.addBar(end, candle.getOpen(), candle.getHigh(), candle.getLow(), candle.getClose(),
                    candle.getVolume());
            lastEnd = end;
        }
        return series;
    }
}
