package com.candlebacktest.backtester.service;

import com.candlebacktest.backtester.domain.Candle;
import com.candlebacktest.backtester.domain.HistoricalCandle;
import com.candlebacktest.backtester.repository.HistoricalCandleRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Service for loading candle series.
 * Loads from the database and falls back to synthetic data if no stored
 * candles exist for the range.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MarketDataService {

    static final int MAX_SYNTHETIC_CANDLES = 200_000;

    private final HistoricalCandleRepository historicalCandleRepository;

    @Value("${backtest.market-data.synthetic-interval-minutes:60}")
    private long syntheticIntervalMinutes = 60;

    /**
     * Load candles for the symbol between the two instants, inclusive, in
     * ascending time order.
     */
    public List<Candle> loadCandles(String symbol, Instant startTime, Instant endTime) {
        if (endTime.isBefore(startTime)) {
            throw new IllegalArgumentException("End time " + endTime + " is before start time " + startTime);
        }
        log.info("Loading candles for {} from {} to {}", symbol, startTime, endTime);

        List<HistoricalCandle> stored = historicalCandleRepository
                .findBySymbolAndTimeRange(symbol, startTime, endTime);

        if (!stored.isEmpty()) {
            log.info("Loaded {} stored candles for {}", stored.size(), symbol);
            return stored.stream()
                    .map(HistoricalCandle::toCandle)
                    .toList();
        }

        log.warn("No stored candles found for {}. Generating synthetic data.", symbol);
        List<Candle> synthetic = generateSyntheticCandles(startTime, endTime);
        log.info("Generated {} synthetic candles for {}", synthetic.size(), symbol);
        return synthetic;
    }

    /**
     * Random walk with a slight upward drift. The fixed seed makes runs over
     * the same range reproducible.
     */
    private List<Candle> generateSyntheticCandles(Instant startTime, Instant endTime) {
        if (syntheticIntervalMinutes <= 0) {
            throw new IllegalStateException("Synthetic candle interval must be positive");
        }
        Duration interval = Duration.ofMinutes(syntheticIntervalMinutes);
        long count = Duration.between(startTime, endTime).toMinutes() / syntheticIntervalMinutes + 1;
        if (count > MAX_SYNTHETIC_CANDLES) {
            throw new IllegalArgumentException("Range would need " + count
                    + " synthetic candles, more than " + MAX_SYNTHETIC_CANDLES);
        }

        List<Candle> candles = new ArrayList<>((int) count);
        Random random = new Random(42);

        BigDecimal price = new BigDecimal("100.00");
        Instant time = startTime;

        while (!time.isAfter(endTime)) {
            BigDecimal open = price;
            double changePercent = (random.nextGaussian() * 0.01) + 0.0001;
            BigDecimal close = open.multiply(BigDecimal.valueOf(1 + changePercent));
            if (close.compareTo(BigDecimal.ONE) < 0) {
                close = BigDecimal.ONE;
            }

            BigDecimal high = open.max(close)
                    .multiply(BigDecimal.valueOf(1 + Math.abs(random.nextGaussian()) * 0.005));
            BigDecimal low = open.min(close)
                    .multiply(BigDecimal.valueOf(1 - Math.abs(random.nextGaussian()) * 0.005));

            candles.add(Candle.builder()
                    .time(time)
                    .open(open.setScale(2, RoundingMode.HALF_UP))
                    .high(high.setScale(2, RoundingMode.HALF_UP))
                    .low(low.setScale(2, RoundingMode.HALF_UP))
                    .close(close.setScale(2, RoundingMode.HALF_UP))
                    .volume(BigDecimal.valueOf(1000 + random.nextInt(500)))
                    .build());

            price = close.setScale(2, RoundingMode.HALF_UP);
            time = time.plus(interval);
        }

        return candles;
    }
}
