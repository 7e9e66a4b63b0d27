package com.candlebacktest.backtester.repository;

import com.candlebacktest.backtester.domain.HistoricalCandle;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

/**
 * Repository for accessing stored candles.
 */
@Repository
public interface HistoricalCandleRepository extends JpaRepository<HistoricalCandle, Long> {

    /**
     * Find candles for a symbol within a time range, ordered by time.
     */
    @Query("SELECT h FROM HistoricalCandle h WHERE h.symbol = :symbol " +
            "AND h.time >= :startTime AND h.time <= :endTime ORDER BY h.time ASC")
    List<HistoricalCandle> findBySymbolAndTimeRange(
            @Param("symbol") String symbol,
            @Param("startTime") Instant startTime,
            @Param("endTime") Instant endTime);

    /**
     * Check if a candle exists for a symbol and time.
     */
    boolean existsBySymbolAndTime(String symbol, Instant time);

    long countBySymbol(String symbol);
}
