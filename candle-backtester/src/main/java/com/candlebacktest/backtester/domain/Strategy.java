package com.candlebacktest.backtester.domain;

import java.util.List;
import java.util.Map;

/**
 * Strategy interface for implementing trading strategies.
 * Strategies receive the trailing analysis window once per candle and trade
 * through their {@link ExecutionClient}.
 */
public interface Strategy {

    /**
     * Decision logic for one candle.
     *
     * @param analysisWindow candles of the trailing window, oldest first, ending at the current candle
     */
    void execute(List<Candle> analysisWindow);

    /**
     * One step: reconcile open orders, then decide.
     */
    default void run(List<Candle> analysisWindow) {
        getExecutionClient().updateState();
        execute(analysisWindow);
    }

    /**
     * Length of the trailing window the strategy needs, in minutes.
     */
    long getAnalysisWindowMinutes();

    ExecutionClient getExecutionClient();

    /**
     * The ledger the strategy trades, for readers outside the execution client.
     */
    default Ledger getState() {
        return getExecutionClient().getState();
    }

    /**
     * Get the strategy name.
     */
    String getName();

    /**
     * Parameters the strategy was built with, keyed as the factory expects them.
     */
    Map<String, Object> getParameters();
}
