package com.candlebacktest.backtester.domain;

import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;

/**
 * Fee rates charged on fills, as fractions of the acquired asset.
 * <p>
 * A taker order pays the market-order rate and a maker order pays the
 * limit-order rate, whatever call created it.
 */
@Getter
@ToString
public class FeeSchedule {

    private final BigDecimal feeLimitOrder;
    private final BigDecimal feeMarketOrder;

    public FeeSchedule(BigDecimal feeLimitOrder, BigDecimal feeMarketOrder) {
        this.feeLimitOrder = requireRate(feeLimitOrder, "limit");
        this.feeMarketOrder = requireRate(feeMarketOrder, "market");
    }

    public static FeeSchedule of(String feeLimitOrder, String feeMarketOrder) {
        return new FeeSchedule(new BigDecimal(feeLimitOrder), new BigDecimal(feeMarketOrder));
    }

    public BigDecimal feeFor(Order order) {
        return order.isTaker() ? feeMarketOrder : feeLimitOrder;
    }

    /**
     * Amount kept after the fee for the given order is deducted.
     */
    public BigDecimal netOf(Order order, BigDecimal gross) {
        return gross.multiply(BigDecimal.ONE.subtract(feeFor(order)));
    }

    private static BigDecimal requireRate(BigDecimal rate, String kind) {
        if (rate == null || rate.signum() < 0 || rate.compareTo(BigDecimal.ONE) >= 0) {
            throw new IllegalArgumentException("Invalid " + kind + " order fee: " + rate);
        }
        return rate;
    }
}
