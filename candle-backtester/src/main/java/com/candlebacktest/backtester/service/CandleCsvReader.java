package com.candlebacktest.backtester.service;

import com.candlebacktest.backtester.domain.Candle;
import com.candlebacktest.backtester.domain.exception.InvalidColumnTypeException;
import com.candlebacktest.backtester.domain.exception.MissingColumnException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Parses headered candle CSV files.
 * <p>
 * The header must name a time column ({@code time}, {@code timestamp} or
 * {@code date}) and the {@code open}, {@code high}, {@code low}, {@code close}
 * and {@code volume} columns, in any order. Time values may be ISO instants,
 * ISO local date-times (read as UTC), ISO dates or epoch seconds/milliseconds.
 */
@Component
@Slf4j
public class CandleCsvReader {

    private static final String[] TIME_COLUMNS = { "time", "timestamp", "date" };
    private static final String[] PRICE_COLUMNS = { "open", "high", "low", "close", "volume" };

    // Epoch values above this are read as milliseconds.
    private static final long EPOCH_MILLIS_THRESHOLD = 100_000_000_000L;

    public List<Candle> read(InputStream inputStream) throws IOException {
        List<Candle> candles = new ArrayList<>();

        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(inputStream, StandardCharsets.UTF_8))) {
            String header = nextNonBlankLine(reader);
            if (header == null) {
                throw new MissingColumnException("time", "CSV has no header row");
            }
            Map<String, Integer> columns = indexHeader(header);
            int timeIndex = resolveTimeColumn(columns);

            String line;
            int lineNumber = 1;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                candles.add(parseLine(line.split(",", -1), columns, timeIndex, lineNumber));
            }
        }

        log.debug("Parsed {} candles from CSV", candles.size());
        return candles;
    }

    private static String nextNonBlankLine(BufferedReader reader) throws IOException {
        String line;
        while ((line = reader.readLine()) != null) {
            if (!line.isBlank()) {
                return line;
            }
        }
        return null;
    }

    private static Map<String, Integer> indexHeader(String header) {
        Map<String, Integer> columns = new HashMap<>();
        String[] names = header.split(",", -1);
        for (int i = 0; i < names.length; i++) {
            String name = names[i].trim().toLowerCase(Locale.ROOT);
            // strip a UTF-8 byte order mark
            if (i == 0 && name.startsWith("\uFEFF")) {
                name = name.substring(1);
            }
            columns.putIfAbsent(name, i);
        }
        for (String column : PRICE_COLUMNS) {
            if (!columns.containsKey(column)) {
                throw new MissingColumnException(column, "not in CSV header");
            }
        }
        return columns;
    }

    private static int resolveTimeColumn(Map<String, Integer> columns) {
        for (String candidate : TIME_COLUMNS) {
            Integer index = columns.get(candidate);
            if (index != null) {
                return index;
            }
        }
        throw new MissingColumnException("time", "CSV header has none of time, timestamp, date");
    }

    private static Candle parseLine(String[] fields, Map<String, Integer> columns, int timeIndex, int lineNumber) {
        return Candle.builder()
                .time(parseTime(field(fields, timeIndex, "time", lineNumber), lineNumber))
                .open(parseDecimal(fields, columns.get("open"), "open", lineNumber))
                .high(parseDecimal(fields, columns.get("high"), "high", lineNumber))
                .low(parseDecimal(fields, columns.get("low"), "low", lineNumber))
                .close(parseDecimal(fields, columns.get("close"), "close", lineNumber))
                .volume(parseDecimal(fields, columns.get("volume"), "volume", lineNumber))
                .build();
    }

    private static String field(String[] fields, int index, String column, int lineNumber) {
        if (index >= fields.length || fields[index].isBlank()) {
            throw new MissingColumnException(column, "line " + lineNumber + " has no value");
        }
        return fields[index].trim();
    }

    private static BigDecimal parseDecimal(String[] fields, int index, String column, int lineNumber) {
        String value = field(fields, index, column, lineNumber);
        try {
            return new BigDecimal(value);
        } catch (NumberFormatException e) {
            throw new InvalidColumnTypeException(column,
                    "line " + lineNumber + ": '" + value + "' is not a number", e);
        }
    }

    static Instant parseTime(String value, int lineNumber) {
        if (value.chars().allMatch(Character::isDigit)) {
            try {
                long epoch = Long.parseLong(value);
                return epoch >= EPOCH_MILLIS_THRESHOLD
                        ? Instant.ofEpochMilli(epoch)
                        : Instant.ofEpochSecond(epoch);
            } catch (NumberFormatException e) {
                throw new InvalidColumnTypeException("time",
                        "line " + lineNumber + ": '" + value + "' is out of range", e);
            }
        }

        String iso = value.replace(' ', 'T');
        try {
            return Instant.parse(iso);
        } catch (DateTimeParseException ignored) {
            // not an instant
        }
        try {
            return LocalDateTime.parse(iso).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException ignored) {
            // not a local date-time
        }
        try {
            return LocalDate.parse(iso).atStartOfDay(ZoneOffset.UTC).toInstant();
        } catch (DateTimeParseException e) {
            throw new InvalidColumnTypeException("time",
                    "line " + lineNumber + ": '" + value + "' is not a timestamp", e);
        }
    }
}
