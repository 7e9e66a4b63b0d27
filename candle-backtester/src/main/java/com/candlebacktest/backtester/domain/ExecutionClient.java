package com.candlebacktest.backtester.domain;

import java.math.BigDecimal;

/**
 * Order placement and reconciliation against one {@link Ledger}.
 * Strategies depend on this interface only, so the backend (simulated or
 * live) is chosen when the strategy is constructed.
 */
public interface ExecutionClient {

    /**
     * The ledger this client mutates. Callers read it; only the client writes.
     */
    Ledger getState();

    Order placeLimitBuyOrder(String base, BigDecimal limitPrice, BigDecimal amountInQuote);

    Order placeLimitSellOrder(String base, BigDecimal limitPrice, BigDecimal amountInBase);

    Order placeMarketBuyOrder(String base, BigDecimal amountInQuote);

    Order placeMarketSellOrder(String base, BigDecimal amountInBase);

    /**
     * Cancel an open order and release its hold.
     *
     * @return the stored order, now cancelled
     */
    Order cancelOrder(Order order);

    /**
     * Current stored record for the order's id.
     */
    Order getOrderInfo(Order order);

    void setCurrentCandle(Candle candle);

    /**
     * Reconcile open orders. Called once per new candle before the strategy
     * looks at the ledger.
     */
    void updateState();
}
