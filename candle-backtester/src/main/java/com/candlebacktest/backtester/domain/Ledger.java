package com.candlebacktest.backtester.domain;

import com.candlebacktest.backtester.domain.exception.InsufficientBalanceException;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Balances and order collections for one base/quote pair.
 * <p>
 * Totals include amounts held by open orders; the available balances are the
 * totals minus those holds, so {@code quoteAvailable + sum(onHold of open buys) == totalQuote}
 * and the same for base and open sells. Apart from {@link #addOrder(Order)} the
 * mutators are package-private and only the execution clients call them.
 */
public class Ledger {

    private final String base;

    private BigDecimal totalBase;

    private BigDecimal totalQuote;

    private final List<Order> buyOrders = new ArrayList<>();

    private final List<Order> sellOrders = new ArrayList<>();

    private final List<Order> filledOrders = new ArrayList<>();

    private final List<Order> cancelledOrders = new ArrayList<>();

    private final Map<String, Order> orders = new LinkedHashMap<>();

    private int numberOfTransactions;

    public Ledger(String base, BigDecimal totalBase, BigDecimal totalQuote) {
        if (base == null || base.isBlank()) {
            throw new IllegalArgumentException("Base symbol is required");
        }
        if (totalBase == null || totalBase.signum() < 0) {
            throw new IllegalArgumentException("Total base must be zero or positive");
        }
        if (totalQuote == null || totalQuote.signum() < 0) {
            throw new IllegalArgumentException("Total quote must be zero or positive");
        }
        this.base = base;
        this.totalBase = totalBase;
        this.totalQuote = totalQuote;
    }

    public String getBase() {
        return base;
    }

    public BigDecimal getTotalBase() {
        return totalBase;
    }

    public BigDecimal getTotalQuote() {
        return totalQuote;
    }

    public BigDecimal getQuoteAvailable() {
        return totalQuote.subtract(sumOnHold(buyOrders));
    }

    public BigDecimal getBaseAvailable() {
        return totalBase.subtract(sumOnHold(sellOrders));
    }

    public List<Order> getBuyOrders() {
        return Collections.unmodifiableList(buyOrders);
    }

    public List<Order> getSellOrders() {
        return Collections.unmodifiableList(sellOrders);
    }

    public List<Order> getOpenOrders() {
        List<Order> open = new ArrayList<>(buyOrders.size() + sellOrders.size());
        open.addAll(buyOrders);
        open.addAll(sellOrders);
        return Collections.unmodifiableList(open);
    }

    public List<Order> getFilledOrders() {
        return Collections.unmodifiableList(filledOrders);
    }

    public List<Order> getCancelledOrders() {
        return Collections.unmodifiableList(cancelledOrders);
    }

    /**
     * Every order ever created, in creation order.
     */
    public List<Order> getOrders() {
        return List.copyOf(orders.values());
    }

    public int getNumberOfTransactions() {
        return numberOfTransactions;
    }

    public Optional<Order> findOrder(String orderId) {
        return Optional.ofNullable(orders.get(orderId));
    }

    public BigDecimal totalValueInQuote(BigDecimal price) {
        return totalQuote.add(totalBase.multiply(price));
    }

    /**
     * Seed an already-open limit order, reserving its hold from the matching
     * available balance.
     */
    public void addOrder(Order order) {
        if (order == null) {
            throw new IllegalArgumentException("Order is required");
        }
        if (!order.isOpen()) {
            throw new IllegalArgumentException("Only open orders can be seeded: " + order.getOrderId());
        }
        if (!order.isLimitOrder()) {
            throw new IllegalArgumentException("Only limit orders can be seeded: " + order.getOrderId());
        }
        if (order.getLimitPrice().signum() <= 0) {
            throw new IllegalArgumentException("Limit price must be positive: " + order.getOrderId());
        }
        open(order);
    }

    /**
     * Open collections ordered by creation time; ties keep placement order.
     */
    List<Order> openOrdersByCreation() {
        List<Order> open = new ArrayList<>(getOpenOrders());
        open.sort(Comparator.comparing(Order::getTimeCreated,
                Comparator.nullsFirst(Comparator.naturalOrder())));
        return open;
    }

    void open(Order order) {
        requireMarket(order);
        if (orders.containsKey(order.getOrderId())) {
            throw new IllegalArgumentException("Duplicate order id: " + order.getOrderId());
        }
        requireAvailable(order.getSide(), order.getOnHold());

        sideOrders(order.getSide()).add(order);
        orders.put(order.getOrderId(), order);
    }

    void fill(Order order, BigDecimal received) {
        Order stored = requireStoredOpen(order);

        if (stored.getSide() == OrderSide.BUY) {
            totalQuote = totalQuote.subtract(stored.getOnHold());
            totalBase = totalBase.add(received);
        } else {
            totalBase = totalBase.subtract(stored.getOnHold());
            totalQuote = totalQuote.add(received);
        }
        sideOrders(stored.getSide()).remove(stored);
        stored.markFilled();
        filledOrders.add(stored);
        numberOfTransactions++;
    }

    void cancel(Order order) {
        Order stored = requireStoredOpen(order);

        sideOrders(stored.getSide()).remove(stored);
        stored.markCancelled();
        cancelledOrders.add(stored);
    }

    void recordMarketFill(Order order, BigDecimal received) {
        requireMarket(order);
        if (order.getStatus() != OrderStatus.FILLED) {
            throw new IllegalArgumentException("Market order must be recorded as filled: " + order.getOrderId());
        }
        if (orders.containsKey(order.getOrderId())) {
            throw new IllegalArgumentException("Duplicate order id: " + order.getOrderId());
        }
        requireAvailable(order.getSide(), order.getOnHold());

        if (order.getSide() == OrderSide.BUY) {
            totalQuote = totalQuote.subtract(order.getOnHold());
            totalBase = totalBase.add(received);
        } else {
            totalBase = totalBase.subtract(order.getOnHold());
            totalQuote = totalQuote.add(received);
        }
        filledOrders.add(order);
        orders.put(order.getOrderId(), order);
        numberOfTransactions++;
    }

    public LedgerSnapshot toSnapshot() {
        return LedgerSnapshot.builder()
                .base(base)
                .totalBase(totalBase)
                .totalQuote(totalQuote)
                .numberOfTransactions(numberOfTransactions)
                .orders(copyOf(orders.values()))
                .build();
    }

    /**
     * Rebuild a ledger from persisted data. The ledger gets its own copies of
     * the orders. Open orders pass the same checks as {@link #addOrder(Order)}
     * and get their holds reserved again, so a snapshot whose holds exceed its
     * totals is rejected.
     */
    public static Ledger fromSnapshot(LedgerSnapshot snapshot) {
        Ledger ledger = new Ledger(snapshot.getBase(), snapshot.getTotalBase(), snapshot.getTotalQuote());
        ledger.numberOfTransactions = snapshot.getNumberOfTransactions();

        List<Order> persisted = snapshot.getOrders() == null ? List.of() : copyOf(snapshot.getOrders());
        for (Order order : persisted) {
            if (order.getStatus() == null) {
                throw new IllegalArgumentException("Order " + order.getOrderId() + " has no status");
            }
            switch (order.getStatus()) {
                case OPEN -> ledger.addOrder(order);
                case FILLED -> ledger.restoreTerminal(order, ledger.filledOrders);
                case CANCELLED -> ledger.restoreTerminal(order, ledger.cancelledOrders);
            }
        }
        return ledger;
    }

    private static List<Order> copyOf(Collection<Order> source) {
        List<Order> copies = new ArrayList<>(source.size());
        for (Order order : source) {
            if (order == null) {
                throw new IllegalArgumentException("Snapshot contains a null order");
            }
            copies.add(order.toBuilder().build());
        }
        return copies;
    }

    private void restoreTerminal(Order order, List<Order> collection) {
        if (orders.containsKey(order.getOrderId())) {
            throw new IllegalArgumentException("Duplicate order id: " + order.getOrderId());
        }
        collection.add(order);
        orders.put(order.getOrderId(), order);
    }

    private Order requireStoredOpen(Order order) {
        Order stored = orders.get(order.getOrderId());
        if (stored == null) {
            throw new IllegalArgumentException("Order does not belong to this ledger: " + order.getOrderId());
        }
        if (!stored.isOpen()) {
            throw new IllegalStateException("Order " + stored.getOrderId() + " is " + stored.getStatus());
        }
        return stored;
    }

    private void requireMarket(Order order) {
        if (!base.equals(order.getMarket())) {
            throw new IllegalArgumentException(
                    "Ledger tracks " + base + ", order " + order.getOrderId() + " is for " + order.getMarket());
        }
    }

    private void requireAvailable(OrderSide side, BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Order amount must be positive");
        }
        BigDecimal available = side == OrderSide.BUY ? getQuoteAvailable() : getBaseAvailable();
        if (amount.compareTo(available) > 0) {
            String asset = side == OrderSide.BUY ? "quote" : base;
            throw new InsufficientBalanceException(
                    "Requested " + amount + " " + asset + " but only " + available + " is available");
        }
    }

    private List<Order> sideOrders(OrderSide side) {
        return side == OrderSide.BUY ? buyOrders : sellOrders;
    }

    private static BigDecimal sumOnHold(List<Order> open) {
        return open.stream()
                .map(Order::getOnHold)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
