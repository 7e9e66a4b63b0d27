package com.candlebacktest.backtester.service;

import com.candlebacktest.backtester.controller.dto.BacktestRequest;
import com.candlebacktest.backtester.controller.dto.BacktestResponse;

/**
 * Service interface for backtest run operations.
 */
public interface BacktestService {

    /**
     * Run a backtest synchronously and record it.
     *
     * @param request the backtest request
     * @return the report of the completed run
     */
    BacktestResponse runBacktest(BacktestRequest request);

    /**
     * Fetch a recorded run.
     *
     * @throws BacktestRunNotFoundException if no run has the id
     */
    BacktestResponse getRun(Long runId);
}
