package com.candlebacktest.backtester.strategy;

import com.candlebacktest.backtester.domain.AbstractStrategy;
import com.candlebacktest.backtester.domain.Candle;
import com.candlebacktest.backtester.domain.ExecutionClient;
import com.candlebacktest.backtester.domain.Order;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Map;

/**
 * Limit-order strategy that keeps one buy resting below the last close and
 * offers everything it holds one take-profit step above it.
 * <p>
 * A resting buy that has fallen more than twice the dip below the price is
 * cancelled and placed again closer to the market.
 */
@Slf4j
public class DipBuyStrategy extends AbstractStrategy {

    private final BigDecimal dip;
    private final BigDecimal takeProfit;
    private final BigDecimal orderSizeInQuote;
    private final long analysisWindowMinutes;

    public DipBuyStrategy(ExecutionClient executionClient, BigDecimal dip, BigDecimal takeProfit,
                          BigDecimal orderSizeInQuote, long analysisWindowMinutes) {
        super(executionClient);
        if (dip.signum() <= 0 || dip.compareTo(BigDecimal.ONE) >= 0) {
            throw new IllegalArgumentException("Dip must be between 0 and 1");
        }
        if (takeProfit.signum() <= 0) {
            throw new IllegalArgumentException("Take profit must be positive");
        }
        if (orderSizeInQuote.signum() <= 0) {
            throw new IllegalArgumentException("Order size must be positive");
        }
        this.dip = dip;
        this.takeProfit = takeProfit;
        this.orderSizeInQuote = orderSizeInQuote;
        this.analysisWindowMinutes = analysisWindowMinutes;
    }

    @Override
    public void execute(List<Candle> analysisWindow) {
        if (analysisWindow.isEmpty()) {
            return;
        }
        BigDecimal close = analysisWindow.get(analysisWindow.size() - 1).getClose();

        BigDecimal staleBelow = close.multiply(BigDecimal.ONE.subtract(dip.multiply(BigDecimal.valueOf(2))));
        for (Order order : List.copyOf(getState().getBuyOrders())) {
            if (order.getLimitPrice().compareTo(staleBelow) < 0) {
                getExecutionClient().cancelOrder(order);
                log.debug("Dip Buy: cancelled stale buy {} at {}", order.getOrderId(), order.getLimitPrice());
            }
        }

        if (getState().getBuyOrders().isEmpty()
                && getState().getQuoteAvailable().compareTo(orderSizeInQuote) >= 0) {
            BigDecimal price = close.multiply(BigDecimal.ONE.subtract(dip)).setScale(8, RoundingMode.HALF_DOWN);
            getExecutionClient().placeLimitBuyOrder(base(), price, orderSizeInQuote);
            log.debug("Dip Buy: resting buy of {} quote at {}", orderSizeInQuote, price);
        }

        BigDecimal held = getState().getBaseAvailable();
        if (held.signum() > 0) {
            BigDecimal price = close.multiply(BigDecimal.ONE.add(takeProfit)).setScale(8, RoundingMode.HALF_UP);
            getExecutionClient().placeLimitSellOrder(base(), price, held);
            log.debug("Dip Buy: offering {} {} at {}", held, base(), price);
        }
    }

    @Override
    public long getAnalysisWindowMinutes() {
        return analysisWindowMinutes;
    }

    @Override
    public String getName() {
        return "DipBuy(" + dip + "," + takeProfit + ")";
    }

    @Override
    public Map<String, Object> getParameters() {
        return Map.of(
                "dip", dip,
                "takeProfit", takeProfit,
                "orderSizeInQuote", orderSizeInQuote,
                "analysisWindowMinutes", analysisWindowMinutes);
    }
}
