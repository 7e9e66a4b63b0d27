package com.candlebacktest.backtester.domain;

import java.math.BigDecimal;

/**
 * Connection to a real exchange. Implementations own authentication,
 * timeouts and retries; failures surface as runtime exceptions.
 */
public interface ExchangeGateway {

    String getExchangeName();

    ExchangeOrderReport placeLimitOrder(String market, OrderSide side, BigDecimal limitPrice, BigDecimal amount);

    ExchangeOrderReport placeMarketOrder(String market, OrderSide side, BigDecimal amount);

    ExchangeOrderReport cancelOrder(String market, String orderId);

    ExchangeOrderReport getOrder(String market, String orderId);
}
