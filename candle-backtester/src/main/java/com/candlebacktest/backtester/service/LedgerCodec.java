package com.candlebacktest.backtester.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.candlebacktest.backtester.domain.Ledger;
import com.candlebacktest.backtester.domain.LedgerSnapshot;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Writes and reads ledgers as JSON. Only balances and orders are stored;
 * execution clients are rebuilt around a restored ledger.
 */
@Component
@RequiredArgsConstructor
public class LedgerCodec {

    private final ObjectMapper objectMapper;

    public String toJson(Ledger ledger) {
        return toJson(ledger.toSnapshot());
    }

    public String toJson(LedgerSnapshot snapshot) {
        try {
            return objectMapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize ledger", e);
        }
    }

    public LedgerSnapshot readSnapshot(String json) {
        try {
            return objectMapper.readValue(json, LedgerSnapshot.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed ledger JSON: " + e.getOriginalMessage(), e);
        }
    }

    public Ledger fromJson(String json) {
        return Ledger.fromSnapshot(readSnapshot(json));
    }
}
