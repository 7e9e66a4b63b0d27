package com.candlebacktest.backtester.repository;

import com.candlebacktest.backtester.domain.BacktestRun;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Repository for recorded backtest runs.
 */
@Repository
public interface BacktestRunRepository extends JpaRepository<BacktestRun, Long> {
}
