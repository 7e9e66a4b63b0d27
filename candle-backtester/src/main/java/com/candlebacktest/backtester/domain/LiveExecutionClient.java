package com.candlebacktest.backtester.domain;

import com.candlebacktest.backtester.domain.exception.InsufficientBalanceException;
import com.candlebacktest.backtester.domain.exception.OrderNotCancellableException;
import com.candlebacktest.backtester.domain.exception.OrderNotFoundException;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.List;

/**
 * Execution client that forwards orders to an {@link ExchangeGateway}.
 * <p>
 * Balances are checked locally before forwarding and the ledger is changed
 * only after the gateway call returns, so a failed call leaves the ledger as
 * it was.
 */
@Slf4j
public class LiveExecutionClient implements ExecutionClient {

    private final Ledger ledger;
    private final ExchangeGateway gateway;

    public LiveExecutionClient(Ledger ledger, ExchangeGateway gateway) {
        if (ledger == null || gateway == null) {
            throw new IllegalArgumentException("Ledger and gateway are required");
        }
        this.ledger = ledger;
        this.gateway = gateway;
    }

    @Override
    public Ledger getState() {
        return ledger;
    }

    /**
     * Fills come from the exchange, so the candle is not used.
     */
    @Override
    public void setCurrentCandle(Candle candle) {
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

        ExchangeOrderReport report = gateway.cancelOrder(stored.getMarket(), stored.getOrderId());
        if (report.getStatus() == OrderStatus.FILLED) {
            // filled on the exchange before the cancel arrived
            ledger.fill(stored, report.getAmountReceived());
            throw new OrderNotCancellableException("Order " + stored.getOrderId() + " was filled before cancellation");
        }
        ledger.cancel(stored);
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
        List<Order> open = ledger.openOrdersByCreation();
        for (Order order : open) {
            ExchangeOrderReport report = gateway.getOrder(order.getMarket(), order.getOrderId());
            if (report.getStatus() == OrderStatus.FILLED) {
                ledger.fill(order, report.getAmountReceived());
                log.info("{} order {} filled on {}, received {}",
                        order.getSide(), order.getOrderId(), gateway.getExchangeName(), report.getAmountReceived());
            } else if (report.getStatus() == OrderStatus.CANCELLED) {
                ledger.cancel(order);
                log.warn("{} order {} was cancelled on {}", order.getSide(), order.getOrderId(),
                        gateway.getExchangeName());
            }
        }
    }

    private Order placeLimitOrder(String base, OrderSide side, BigDecimal limitPrice, BigDecimal amount) {
        requireBase(base);
        if (limitPrice == null || limitPrice.signum() <= 0) {
            throw new InsufficientBalanceException("Limit price must be positive, got " + limitPrice);
        }
        requireAvailable(side, amount);

        ExchangeOrderReport report = gateway.placeLimitOrder(base, side, limitPrice, amount);
        Order order = Order.builder()
                .orderId(report.getOrderId())
                .exchange(gateway.getExchangeName())
                .market(base)
                .side(side)
                .limitPrice(limitPrice)
                .onHold(amount)
                .status(OrderStatus.OPEN)
                .timeCreated(report.getTimeCreated())
                .taker(report.isTaker())
                .build();

        ledger.open(order);
        if (report.getStatus() == OrderStatus.FILLED) {
            ledger.fill(order, report.getAmountReceived());
        }
        log.info("Placed limit {} {} at {} on {} as {}", side, base, limitPrice, gateway.getExchangeName(),
                order.getOrderId());
        return order;
    }

    private Order placeMarketOrder(String base, OrderSide side, BigDecimal amount) {
        requireBase(base);
        requireAvailable(side, amount);

        ExchangeOrderReport report = gateway.placeMarketOrder(base, side, amount);
        if (report.getStatus() != OrderStatus.FILLED) {
            throw new IllegalStateException("Exchange reported market order " + report.getOrderId()
                    + " as " + report.getStatus());
        }

        Order order = Order.builder()
                .orderId(report.getOrderId())
                .exchange(gateway.getExchangeName())
                .market(base)
                .side(side)
                .onHold(amount)
                .status(OrderStatus.FILLED)
                .timeCreated(report.getTimeCreated())
                .taker(true)
                .build();

        ledger.recordMarketFill(order, report.getAmountReceived());
        log.info("Market {} {} of {} on {} received {}", side, base, amount, gateway.getExchangeName(),
                report.getAmountReceived());
        return order;
    }

    private void requireBase(String base) {
        if (!ledger.getBase().equals(base)) {
            throw new IllegalArgumentException("Ledger tracks " + ledger.getBase() + ", not " + base);
        }
    }

    private void requireAvailable(OrderSide side, BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Order amount must be positive, got " + amount);
        }
        BigDecimal available = side == OrderSide.BUY ? ledger.getQuoteAvailable() : ledger.getBaseAvailable();
        if (amount.compareTo(available) > 0) {
            throw new InsufficientBalanceException(
                    "Requested " + amount + " but only " + available + " is available");
        }
    }
}
