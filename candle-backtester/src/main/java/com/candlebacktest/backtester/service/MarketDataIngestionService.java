package com.candlebacktest.backtester.service;

import com.candlebacktest.backtester.domain.Candle;
import com.candlebacktest.backtester.domain.HistoricalCandle;
import com.candlebacktest.backtester.repository.HistoricalCandleRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.IOException;
import java.io.InputStream;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Service for ingesting CSV candle data into the database.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MarketDataIngestionService {

    static final int BATCH_SIZE = 1000;

    private final HistoricalCandleRepository historicalCandleRepository;
    private final CandleCsvReader candleCsvReader;

    /**
     * Ingest CSV data from an input stream. Candles whose time is already
     * stored for the symbol are skipped, as are repeated times within the file.
     *
     * @param symbol      the market symbol
     * @param inputStream the CSV input stream
     * @return number of candles inserted
     */
    @Transactional
    public int ingestCsv(String symbol, InputStream inputStream) throws IOException {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("Symbol is required");
        }
        log.info("Starting CSV ingestion for symbol: {}", symbol);

        List<Candle> candles = candleCsvReader.read(inputStream);

        List<HistoricalCandle> batch = new ArrayList<>();
        Set<Instant> seen = new HashSet<>();
        int inserted = 0;
        int skipped = 0;

        for (Candle candle : candles) {
            if (!seen.add(candle.getTime())
                    || historicalCandleRepository.existsBySymbolAndTime(symbol, candle.getTime())) {
                skipped++;
                continue;
            }
            batch.add(HistoricalCandle.fromCandle(symbol, candle));

            if (batch.size() >= BATCH_SIZE) {
                historicalCandleRepository.saveAll(batch);
                inserted += batch.size();
                log.info("Batch inserted {} candles for {}", batch.size(), symbol);
                batch.clear();
            }
        }

        if (!batch.isEmpty()) {
            historicalCandleRepository.saveAll(batch);
            inserted += batch.size();
            log.info("Inserted final batch of {} candles for {}", batch.size(), symbol);
        }

        log.info("CSV ingestion completed for {}. Inserted: {}, skipped: {}, total stored: {}",
                symbol, inserted, skipped, historicalCandleRepository.countBySymbol(symbol));
        return inserted;
    }
}
