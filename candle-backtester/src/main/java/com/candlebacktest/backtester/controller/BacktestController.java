package com.candlebacktest.backtester.controller;

import com.candlebacktest.backtester.controller.dto.BacktestRequest;
import com.candlebacktest.backtester.controller.dto.BacktestResponse;
import com.candlebacktest.backtester.service.BacktestService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST controller for backtest runs.
 */
@RestController
@RequestMapping("/backtests")
@RequiredArgsConstructor
@Slf4j
public class BacktestController {

    private final BacktestService backtestService;

    /**
     * Run a backtest and return its report.
     *
     * @param request the backtest request
     * @return the completed run with metrics, rows and final ledger
     */
    @PostMapping
    public ResponseEntity<BacktestResponse> runBacktest(@Valid @RequestBody BacktestRequest request) {

        log.info("POST /backtests - Strategy: {}, Symbol: {}",
                request.getStrategyName(), request.getSymbol());

        BacktestResponse response = backtestService.runBacktest(request);

        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    /**
     * Get a recorded backtest run.
     *
     * @param runId the run ID
     * @return the run as stored
     */
    @GetMapping("/{runId}")
    public ResponseEntity<BacktestResponse> getRun(@PathVariable Long runId) {

        log.info("GET /backtests/{} - Fetching run", runId);

        return ResponseEntity.ok(backtestService.getRun(runId));
    }
}
