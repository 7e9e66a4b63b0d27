package com.candlebacktest.backtester.config;

import com.candlebacktest.backtester.domain.FeeSchedule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;

/**
 * Fee configuration for the simulated exchange.
 */
@Configuration
@Slf4j
public class ExecutionConfig {

    @Value("${backtest.fees.limit-order:0.0015}")
    private BigDecimal feeLimitOrder;

    @Value("${backtest.fees.market-order:0.0025}")
    private BigDecimal feeMarketOrder;

    @Bean
    public FeeSchedule feeSchedule() {
        FeeSchedule schedule = new FeeSchedule(feeLimitOrder, feeMarketOrder);
        log.info("Simulated exchange fees - limit: {}, market: {}", feeLimitOrder, feeMarketOrder);
        return schedule;
    }
}
