package com.candlebacktest.backtester.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * An order intent plus its lifecycle status.
 * <p>
 * Everything except {@code status} is fixed at creation. The status only moves
 * OPEN to FILLED or OPEN to CANCELLED, and only the {@link Ledger} that owns the
 * order moves it. Two orders are equal when their ids are.
 */
@Getter
@ToString
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
@Builder(toBuilder = true)
@Jacksonized
public class Order {

    @EqualsAndHashCode.Include
    private final String orderId;

    private final String exchange;

    private final String market;

    private final OrderSide side;

    /**
     * Limit price, or {@code null} for a market order.
     */
    private final BigDecimal limitPrice;

    /**
     * Quote reserved by a buy, base reserved by a sell.
     */
    private final BigDecimal onHold;

    @Builder.Default
    private OrderStatus status = OrderStatus.OPEN;

    private final Instant timeCreated;

    private final boolean taker;

    @JsonIgnore
    public boolean isLimitOrder() {
        return limitPrice != null;
    }

    @JsonIgnore
    public boolean isOpen() {
        return status == OrderStatus.OPEN;
    }

    void markFilled() {
        transitionTo(OrderStatus.FILLED);
    }

    void markCancelled() {
        transitionTo(OrderStatus.CANCELLED);
    }

    private void transitionTo(OrderStatus target) {
        if (status != OrderStatus.OPEN) {
            throw new IllegalStateException(
                    "Order " + orderId + " is " + status + " and cannot become " + target);
        }
        status = target;
    }
}
