package com.candlebacktest.backtester.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * An exchange's view of one order.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ExchangeOrderReport {

    private String orderId;
    private OrderStatus status;

    /**
     * Asset received by a filled order, net of the exchange's fee.
     */
    private BigDecimal amountReceived;

    private Instant timeCreated;
    private boolean taker;
}
