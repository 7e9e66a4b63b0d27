package com.candlebacktest.backtester.strategy;

import com.candlebacktest.backtester.domain.AbstractStrategy;
import com.candlebacktest.backtester.domain.Candle;
import com.candlebacktest.backtester.domain.ExecutionClient;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Simple buy-and-hold strategy.
 * Spends all available quote with a market order on the first step and holds.
 */
@Slf4j
public class BuyAndHoldStrategy extends AbstractStrategy {

    private final long analysisWindowMinutes;

    public BuyAndHoldStrategy(ExecutionClient executionClient, long analysisWindowMinutes) {
        super(executionClient);
        if (analysisWindowMinutes < 0) {
            throw new IllegalArgumentException("Analysis window must not be negative");
        }
        this.analysisWindowMinutes = analysisWindowMinutes;
    }

    @Override
    public void execute(List<Candle> analysisWindow) {
        BigDecimal quote = getState().getQuoteAvailable();
        if (getState().getNumberOfTransactions() == 0 && quote.signum() > 0) {
            getExecutionClient().placeMarketBuyOrder(base(), quote);
            log.debug("Buy and Hold: spent {} quote on {}", quote, base());
        }
    }

    @Override
    public long getAnalysisWindowMinutes() {
        return analysisWindowMinutes;
    }

    @Override
    public String getName() {
        return "BuyAndHold";
    }

    @Override
    public Map<String, Object> getParameters() {
        return Map.of("analysisWindowMinutes", analysisWindowMinutes);
    }
}
