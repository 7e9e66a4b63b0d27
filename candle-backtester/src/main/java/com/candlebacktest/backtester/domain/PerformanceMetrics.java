package com.candlebacktest.backtester.domain;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Calculator for backtest performance metrics over an equity curve.
 */
public class PerformanceMetrics {

    private static final double MINUTES_PER_YEAR = 365.25 * 24 * 60;

    /**
     * Calculate total return percentage.
     */
    public static BigDecimal calculateTotalReturn(BigDecimal initialValue, BigDecimal finalValue) {
        if (initialValue.compareTo(BigDecimal.ZERO) == 0) {
            return BigDecimal.ZERO;
        }

        return finalValue.subtract(initialValue)
                .divide(initialValue, 4, RoundingMode.HALF_UP)
                .multiply(BigDecimal.valueOf(100));
    }

    /**
     * Number of candle periods in a year, for annualizing per-period statistics.
     */
    public static double periodsPerYear(Duration candleInterval) {
        long minutes = candleInterval.toMinutes();
        if (minutes <= 0) {
            return 0;
        }
        return MINUTES_PER_YEAR / minutes;
    }

    /**
     * Standard deviation of per-period returns, as a percentage.
     */
    public static BigDecimal calculateVolatility(List<BigDecimal> equityCurve) {
        List<BigDecimal> returns = periodReturns(equityCurve);
        if (returns.size() < 2) {
            return BigDecimal.ZERO;
        }

        double stdDev = standardDeviation(returns, mean(returns));
        return BigDecimal.valueOf(stdDev * 100).setScale(4, RoundingMode.HALF_UP);
    }

    /**
     * Calculate Sharpe ratio (risk-free rate of 0), annualized with the given
     * number of periods per year.
     */
    public static BigDecimal calculateSharpeRatio(List<BigDecimal> equityCurve, double periodsPerYear) {
        List<BigDecimal> returns = periodReturns(equityCurve);
        if (returns.isEmpty() || periodsPerYear <= 0) {
            return BigDecimal.ZERO;
        }

        BigDecimal meanReturn = mean(returns);
        double stdDev = standardDeviation(returns, meanReturn);

        if (stdDev == 0) {
            return BigDecimal.ZERO;
        }

        double sharpe = (meanReturn.doubleValue() / stdDev) * Math.sqrt(periodsPerYear);
        return BigDecimal.valueOf(sharpe).setScale(4, RoundingMode.HALF_UP);
    }

    /**
     * Calculate maximum drawdown percentage.
     */
    public static BigDecimal calculateMaxDrawdown(List<BigDecimal> equityCurve) {
        if (equityCurve.isEmpty()) {
            return BigDecimal.ZERO;
        }

        BigDecimal maxDrawdown = BigDecimal.ZERO;
        BigDecimal peak = equityCurve.get(0);

        for (BigDecimal value : equityCurve) {
            if (value.compareTo(peak) > 0) {
                peak = value;
            }

            if (peak.compareTo(BigDecimal.ZERO) > 0) {
                BigDecimal drawdown = peak.subtract(value)
                        .divide(peak, 4, RoundingMode.HALF_UP)
                        .multiply(BigDecimal.valueOf(100));

                if (drawdown.compareTo(maxDrawdown) > 0) {
                    maxDrawdown = drawdown;
                }
            }
        }

        return maxDrawdown.negate();
    }

    private static List<BigDecimal> periodReturns(List<BigDecimal> equityCurve) {
        List<BigDecimal> returns = new ArrayList<>();
        for (int i = 1; i < equityCurve.size(); i++) {
            BigDecimal prevValue = equityCurve.get(i - 1);
            BigDecimal currentValue = equityCurve.get(i);

            if (prevValue.compareTo(BigDecimal.ZERO) > 0) {
                returns.add(currentValue.subtract(prevValue)
                        .divide(prevValue, 8, RoundingMode.HALF_UP));
            }
        }
        return returns;
    }

    private static BigDecimal mean(List<BigDecimal> values) {
        BigDecimal sum = values.stream()
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        return sum.divide(BigDecimal.valueOf(values.size()), 8, RoundingMode.HALF_UP);
    }

    private static double standardDeviation(List<BigDecimal> values, BigDecimal mean) {
        BigDecimal sumSquaredDiff = values.stream()
                .map(r -> r.subtract(mean).pow(2))
                .reduce(BigDecimal.ZERO, BigDecimal::add);

        double variance = sumSquaredDiff.divide(
                BigDecimal.valueOf(values.size()), 12, RoundingMode.HALF_UP)
                .doubleValue();
        return Math.sqrt(variance);
    }
}
