package com.candlebacktest.backtester.controller;

import com.candlebacktest.backtester.controller.dto.IngestionResponse;
import com.candlebacktest.backtester.service.MarketDataIngestionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * REST controller for loading candle data.
 */
@RestController
@RequestMapping("/market-data")
@RequiredArgsConstructor
@Slf4j
public class MarketDataController {

    private final MarketDataIngestionService ingestionService;

    /**
     * Ingest a headered candle CSV for the symbol.
     */
    @PostMapping(value = "/{symbol}", consumes = { "text/csv", "text/plain" })
    public ResponseEntity<IngestionResponse> ingest(@PathVariable String symbol, @RequestBody String csv)
            throws IOException {

        log.info("POST /market-data/{} - {} bytes", symbol, csv.length());

        int inserted = ingestionService.ingestCsv(symbol,
                new ByteArrayInputStream(csv.getBytes(StandardCharsets.UTF_8)));

        return ResponseEntity.status(HttpStatus.CREATED).body(new IngestionResponse(symbol, inserted));
    }
}
