package com.candlebacktest.backtester.repository;

import com.candlebacktest.backtester.config.JpaConfig;
import com.candlebacktest.backtester.domain.HistoricalCandle;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.dao.DataIntegrityViolationException;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for candle storage queries and constraints on H2.
 */
@DataJpaTest
@Import(JpaConfig.class)
class HistoricalCandleRepositoryTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    @Autowired
    private HistoricalCandleRepository repository;

    @Test
    void testFindBySymbolAndTimeRange_OrderedAndInclusive() {
        // Arrange
        repository.save(candle("BTC", 3));
        repository.save(candle("BTC", 0));
        repository.save(candle("BTC", 2));
        repository.save(candle("BTC", 1));
        repository.save(candle("ETH", 1));

        // Act
        List<HistoricalCandle> result = repository.findBySymbolAndTimeRange(
                "BTC", T0.plus(Duration.ofHours(1)), T0.plus(Duration.ofHours(3)));

        // Assert
        assertEquals(3, result.size());
        assertEquals(T0.plus(Duration.ofHours(1)), result.get(0).getTime());
        assertEquals(T0.plus(Duration.ofHours(2)), result.get(1).getTime());
        assertEquals(T0.plus(Duration.ofHours(3)), result.get(2).getTime());
        assertTrue(result.stream().allMatch(c -> "BTC".equals(c.getSymbol())));
    }

    @Test
    void testExistsBySymbolAndTime() {
        repository.save(candle("BTC", 0));

        assertTrue(repository.existsBySymbolAndTime("BTC", T0));
        assertFalse(repository.existsBySymbolAndTime("ETH", T0));
        assertFalse(repository.existsBySymbolAndTime("BTC", T0.plus(Duration.ofHours(1))));
    }

    @Test
    void testCountBySymbol() {
        repository.save(candle("BTC", 0));
        repository.save(candle("BTC", 1));
        repository.save(candle("ETH", 0));

        assertEquals(2, repository.countBySymbol("BTC"));
        assertEquals(0, repository.countBySymbol("SOL"));
    }

    @Test
    void testDuplicateSymbolAndTime_Rejected() {
        // Arrange
        repository.saveAndFlush(candle("BTC", 0));

        // Act & Assert
        assertThrows(DataIntegrityViolationException.class,
                () -> repository.saveAndFlush(candle("BTC", 0)),
                "Two candles for the same symbol and time should be rejected");
    }

    @Test
    void testToCandle_KeepsPrices() {
        HistoricalCandle saved = repository.saveAndFlush(candle("BTC", 0));

        HistoricalCandle loaded = repository.findById(saved.getId()).orElseThrow();

        assertEquals(0, new BigDecimal("100.5").compareTo(loaded.toCandle().getClose()));
        assertEquals(T0, loaded.toCandle().getTime());
    }

    private static HistoricalCandle candle(String symbol, int hour) {
        return HistoricalCandle.builder()
                .symbol(symbol)
                .time(T0.plus(Duration.ofHours(hour)))
                .open(new BigDecimal("100"))
                .high(new BigDecimal("101"))
                .low(new BigDecimal("99"))
                .close(new BigDecimal("100.5"))
                .volume(new BigDecimal("12.25"))
                .build();
    }
}
