package com.candlebacktest.backtester.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.candlebacktest.backtester.domain.ExecutionClient;
import com.candlebacktest.backtester.domain.Strategy;
import com.candlebacktest.backtester.strategy.BuyAndHoldStrategy;
import com.candlebacktest.backtester.strategy.DipBuyStrategy;
import com.candlebacktest.backtester.strategy.MovingAverageCrossoverStrategy;
import com.candlebacktest.backtester.strategy.RsiStrategy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Map;

/**
 * Factory for creating strategy instances based on name and parameters.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StrategyFactory {

    private final ObjectMapper objectMapper;

    /**
     * Create a strategy bound to the given execution client.
     *
     * @throws IllegalArgumentException for an unknown name or a malformed parameter
     */
    public Strategy createStrategy(String strategyName, Map<String, Object> parameters, ExecutionClient client) {
        if (strategyName == null || strategyName.isBlank()) {
            throw new IllegalArgumentException("Strategy name is required");
        }
        log.info("Creating strategy: {} with parameters: {}", strategyName, parameters);

        JsonNode params = objectMapper.valueToTree(parameters == null ? Map.of() : parameters);

        return switch (strategyName.toLowerCase(Locale.ROOT)) {
            case "buyandhold", "buy_and_hold" -> new BuyAndHoldStrategy(client,
                    longParam(params, "analysisWindowMinutes", 0L));

            case "movingaveragecrossover", "ma_crossover" -> new MovingAverageCrossoverStrategy(client,
                    intParam(params, "shortPeriod", 10),
                    intParam(params, "longPeriod", 50),
                    longParam(params, "candleIntervalMinutes", 60L));

            case "rsi" -> new RsiStrategy(client,
                    decimalParam(params, "lowerThreshold", new BigDecimal("35")).doubleValue(),
                    decimalParam(params, "higherThreshold", new BigDecimal("65")).doubleValue(),
                    intParam(params, "period", 14),
                    longParam(params, "analysisWindowMinutes", RsiStrategy.DEFAULT_ANALYSIS_WINDOW_MINUTES));

            case "dipbuy", "dip_buy" -> new DipBuyStrategy(client,
                    decimalParam(params, "dip", new BigDecimal("0.05")),
                    decimalParam(params, "takeProfit", new BigDecimal("0.05")),
                    decimalParam(params, "orderSizeInQuote", new BigDecimal("100")),
                    longParam(params, "analysisWindowMinutes", 60L));

            default -> throw new IllegalArgumentException("Unknown strategy: " + strategyName);
        };
    }

    private static int intParam(JsonNode params, String name, int defaultValue) {
        long value = longParam(params, name, defaultValue);
        if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Parameter " + name + " is out of range: " + value);
        }
        return (int) value;
    }

    private static long longParam(JsonNode params, String name, long defaultValue) {
        JsonNode node = params.get(name);
        if (node == null || node.isNull()) {
            return defaultValue;
        }
        if (node.canConvertToLong() && node.isIntegralNumber()) {
            return node.asLong();
        }
        try {
            return Long.parseLong(node.asText().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Parameter " + name + " must be a whole number, got " + node);
        }
    }

    private static BigDecimal decimalParam(JsonNode params, String name, BigDecimal defaultValue) {
        JsonNode node = params.get(name);
        if (node == null || node.isNull()) {
            return defaultValue;
        }
        if (node.isNumber()) {
            return node.decimalValue();
        }
        try {
            return new BigDecimal(node.asText().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Parameter " + name + " must be a number, got " + node);
        }
    }
}
