package com.candlebacktest.backtester.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Entity representing a stored candle.
 * This is the persistent version of {@link Candle}.
 */
@Entity
@Table(name = "historical_candles", uniqueConstraints = {
        @UniqueConstraint(name = "uk_symbol_time", columnNames = { "symbol", "candle_time" })
}, indexes = {
        @Index(name = "idx_symbol_time", columnList = "symbol, candle_time"),
        @Index(name = "idx_symbol", columnList = "symbol")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class HistoricalCandle {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "symbol", nullable = false, length = 20)
    private String symbol;

    @Column(name = "candle_time", nullable = false)
    private Instant time;

    @Column(name = "open_price", nullable = false, precision = 24, scale = 8)
    private BigDecimal open;

    @Column(name = "high_price", nullable = false, precision = 24, scale = 8)
    private BigDecimal high;

    @Column(name = "low_price", nullable = false, precision = 24, scale = 8)
    private BigDecimal low;

    @Column(name = "close_price", nullable = false, precision = 24, scale = 8)
    private BigDecimal close;

    @Column(name = "volume", nullable = false, precision = 24, scale = 8)
    private BigDecimal volume;

    /**
     * Convert entity to domain Candle object.
     */
    public Candle toCandle() {
        return Candle.builder()
                .time(this.time)
                .open(this.open)
                .high(this.high)
                .low(this.low)
                .close(this.close)
                .volume(this.volume)
                .build();
    }

    /**
     * Create entity from domain Candle object.
     */
    public static HistoricalCandle fromCandle(String symbol, Candle candle) {
        return HistoricalCandle.builder()
                .symbol(symbol)
                .time(candle.getTime())
                .open(candle.getOpen())
                .high(candle.getHigh())
                .low(candle.getLow())
                .close(candle.getClose())
                .volume(candle.getVolume())
                .build();
    }
}
