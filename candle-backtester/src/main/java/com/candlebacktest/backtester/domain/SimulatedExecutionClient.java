package com.candlebacktest.backtester.domain;

import com.candlebacktest.backtester.domain.exception.InsufficientBalanceException;
import com.candlebacktest.backtester.domain.exception.OrderNotCancellableException;
import com.candlebacktest.backtester.domain.exception.OrderNotFoundException;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Deterministic in-memory exchange that fills orders against OHLCV candles.
 * <p>
 * A limit buy fills when the candle's low reaches its limit price, a limit sell
 * when the candle's high does. Market orders fill at the candle's open. Every
 * fill is complete; there is no partial fill and no order-book depth.
 */
@Slf4j
public class SimulatedExecutionClient implements ExecutionClient {

    public static final String EXCHANGE = "backtest";

    private final Ledger ledger;
    private final FeeSchedule feeSchedule;
    private final Clock clock;

    private Candle currentCandle;

    public SimulatedExecutionClient(Ledger ledger, FeeSchedule feeSchedule) {
        this(ledger, feeSchedule, Clock.systemUTC());
    }

    public SimulatedExecutionClient(Ledger ledger, FeeSchedule feeSchedule, Clock clock) {
        if (ledger == null || feeSchedule == null || clock == null) {
            throw new IllegalArgumentException("Ledger, fee schedule and clock are required");
        }
        this.ledger = ledger;
        this.feeSchedule = feeSchedule;
        this.clock = clock;
    }

    @Override
    public Ledger getState() {
        return ledger;
    }

    public Candle getCurrentCandle() {
        return currentCandle;
    }

    @Override
    public void setCurrentCandle(Candle candle) {
        this.currentCandle = candle;
    }

    @Override
    public Order placeLimitBuyOrder(String base, BigDecimal limitPrice, BigDecimal amountInQuote) {
        return placeLimitOrder(base, OrderSide.BUY, limitPrice, amountInQuote);
    }

    @Override
    public Order placeLimitSellOrder(String base, BigDecimal limitPrice, BigDecimal amountInBase) {
        return placeLimitOrder(base, OrderSide.SELL, limitPrice, amountInBase);
    }

    @Override
    public Order placeMarketBuyOrder(String base, BigDecimal amountInQuote) {
        return placeMarketOrder(base, OrderSide.BUY, amountInQuote);
    }

    @Override
    public Order placeMarketSellOrder(String base, BigDecimal amountInBase) {
        return placeMarketOrder(base, OrderSide.SELL, amountInBase);
    }

    @Override
    public Order cancelOrder(Order order) {
        Order stored = getOrderInfo(order);
        if (!stored.isOpen()) {
            throw new OrderNotCancellableException(
                    "Order " + stored.getOrderId() + " is " + stored.getStatus() + " and cannot be cancelled");
        }

        ledger.cancel(stored);
        log.debug("Cancelled {} order {} releasing {}", stored.getSide(), stored.getOrderId(), stored.getOnHold());
        return stored;
    }

    @Override
    public Order getOrderInfo(Order order) {
        if (order == null || order.getOrderId() == null) {
            throw new IllegalArgumentException("Order id is required");
        }
        return ledger.findOrder(order.getOrderId())
                .orElseThrow(() -> new OrderNotFoundException(order.getOrderId()));
    }

    @Override
    public void updateState() {
        if (currentCandle == null) {
            log.debug("No current candle, nothing to reconcile");
            return;
        }

        List<Order> open = ledger.openOrdersByCreation();
        int fills = 0;

        for (Order order : open) {
            if (order.getSide() == OrderSide.BUY
                    && currentCandle.getLow().compareTo(order.getLimitPrice()) <= 0) {
                BigDecimal gross = order.getOnHold().divide(order.getLimitPrice(), MathContext.DECIMAL128);
                ledger.fill(order, feeSchedule.netOf(order, gross));
                fills++;
            } else if (order.getSide() == OrderSide.SELL
                    && currentCandle.getHigh().compareTo(order.getLimitPrice()) >= 0) {
                BigDecimal gross = order.getOnHold().multiply(order.getLimitPrice());
                ledger.fill(order, feeSchedule.netOf(order, gross));
                fills++;
            }
        }

        if (fills > 0) {
            log.debug("Filled {} of {} open orders at candle {}", fills, open.size(), currentCandle.getTime());
        }
    }

    private Order placeLimitOrder(String base, OrderSide side, BigDecimal limitPrice, BigDecimal amount) {
        requireBase(base);
        requirePositiveAmount(amount);
        if (limitPrice == null || limitPrice.signum() <= 0) {
            throw new InsufficientBalanceException("Limit price must be positive, got " + limitPrice);
        }

        Order order = Order.builder()
                .orderId(UUID.randomUUID().toString())
                .exchange(EXCHANGE)
                .market(base)
                .side(side)
                .limitPrice(limitPrice)
                .onHold(amount)
                .status(OrderStatus.OPEN)
                .timeCreated(now())
                .taker(false)
                .build();

        ledger.open(order);
        log.debug("Placed limit {} {} at {} holding {}", side, base, limitPrice, amount);
        return order;
    }

    private Order placeMarketOrder(String base, OrderSide side, BigDecimal amount) {
        requireBase(base);
        requirePositiveAmount(amount);
        if (currentCandle == null) {
            throw new IllegalStateException("Market orders need a current candle");
        }

        Order order = Order.builder()
                .orderId(UUID.randomUUID().toString())
                .exchange(EXCHANGE)
                .market(base)
                .side(side)
                .onHold(amount)
                .status(OrderStatus.FILLED)
                .timeCreated(now())
                .taker(true)
                .build();

        BigDecimal price = currentCandle.getOpen();
        BigDecimal gross = side == OrderSide.BUY
                ? amount.divide(price, MathContext.DECIMAL128)
                : amount.multiply(price);
        BigDecimal received = feeSchedule.netOf(order, gross);

        ledger.recordMarketFill(order, received);
        log.debug("Market {} {} of {} at {} received {}", side, base, amount, price, received);
        return order;
    }

    private Instant now() {
        return currentCandle != null && currentCandle.getTime() != null
                ? currentCandle.getTime()
                : clock.instant();
    }

    private void requireBase(String base) {
        if (!ledger.getBase().equals(base)) {
            throw new IllegalArgumentException("Ledger tracks " + ledger.getBase() + ", not " + base);
        }
    }

    private static void requirePositiveAmount(BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Order amount must be positive, got " + amount);
        }
    }
}
