package com.candlebacktest.backtester;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the Candle Backtester service.
 * Runs strategies against a simulated, candle-driven exchange.
 */
@SpringBootApplication
public class CandleBacktesterApplication {

    public static void main(String[] args) {
        SpringApplication.run(CandleBacktesterApplication.class, args);
    }

}
