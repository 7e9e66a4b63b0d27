package com.candlebacktest.backtester.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Persistable form of a {@link Ledger}: balances and orders only.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LedgerSnapshot {

    private String base;
    private BigDecimal totalBase;
    private BigDecimal totalQuote;
    private int numberOfTransactions;

    @Builder.Default
    private List<Order> orders = new ArrayList<>();
}
