package com.candlebacktest.backtester.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.candlebacktest.backtester.controller.dto.BacktestRequest;
import com.candlebacktest.backtester.controller.dto.BacktestResponse;
import com.candlebacktest.backtester.domain.BacktestRun;
import com.candlebacktest.backtester.domain.Candle;
import com.candlebacktest.backtester.domain.FeeSchedule;
import com.candlebacktest.backtester.domain.Ledger;
import com.candlebacktest.backtester.domain.RunStatus;
import com.candlebacktest.backtester.domain.exception.InsufficientHistoryException;
import com.candlebacktest.backtester.repository.BacktestRunRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for BacktestServiceImpl run lifecycle and recording.
 */
@ExtendWith(MockitoExtension.class)
class BacktestServiceImplTest {

    private static final Instant START = Instant.parse("2024-01-01T00:00:00Z");

    @Mock
    private BacktestRunRepository backtestRunRepository;

    @Mock
    private MarketDataService marketDataService;

    @Mock
    private BacktestMetricsService metricsService;

    private BacktestServiceImpl backtestService;
    private LedgerCodec ledgerCodec;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = new ObjectMapper();
        objectMapper.findAndRegisterModules();
        ledgerCodec = new LedgerCodec(objectMapper);
        backtestService = new BacktestServiceImpl(
                backtestRunRepository,
                marketDataService,
                new StrategyFactory(objectMapper),
                FeeSchedule.of("0.0015", "0.0025"),
                ledgerCodec,
                metricsService,
                objectMapper);

        lenient().when(backtestRunRepository.save(any())).thenAnswer(invocation -> {
            BacktestRun run = invocation.getArgument(0);
            if (run.getId() == null) {
                run.setId(7L);
            }
            return run;
        });
    }

    @Test
    void testRunBacktest_CompletesAndRecordsRun() {
        // Arrange
        BacktestRequest request = createValidRequest("buy_and_hold");
        when(marketDataService.loadCandles("BTC", request.getStartTime(), request.getEndTime()))
                .thenReturn(risingSeries(24));

        // Act
        BacktestResponse response = backtestService.runBacktest(request);

        // Assert
        assertEquals(7L, response.getRunId());
        assertEquals(RunStatus.COMPLETED, response.getStatus());
        assertEquals(24, response.getRows().size());
        assertEquals(1, response.getNumberOfTransactions());
        assertTrue(response.getTotalReturn().compareTo(BigDecimal.ZERO) > 0);
        assertEquals(1, response.getFinalLedger().getOrders().size());
        assertEquals(0L, ((Number) response.getParameters().get("analysisWindowMinutes")).longValue());

        ArgumentCaptor<BacktestRun> captor = ArgumentCaptor.forClass(BacktestRun.class);
        verify(backtestRunRepository, times(2)).save(captor.capture());
        BacktestRun saved = captor.getValue();
        assertEquals(RunStatus.COMPLETED, saved.getStatus());
        assertNotNull(saved.getRowsJson());
        assertEquals(1, ledgerCodec.fromJson(saved.getLedgerJson()).getNumberOfTransactions());
        assertNull(saved.getFailureReason());

        verify(metricsService).recordRunStarted();
        verify(metricsService).recordRunCompleted(anyLong(), eq(1));
        verify(metricsService, never()).recordRunFailed();
        assertNull(MDC.get("runId"));
    }

    @Test
    void testRunBacktest_UnknownStrategyRecordsFailure() {
        // Arrange
        BacktestRequest request = createValidRequest("momentum");
        when(marketDataService.loadCandles(any(), any(), any())).thenReturn(risingSeries(24));

        // Act
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> backtestService.runBacktest(request));

        // Assert
        assertTrue(ex.getMessage().contains("momentum"));
        ArgumentCaptor<BacktestRun> captor = ArgumentCaptor.forClass(BacktestRun.class);
        verify(backtestRunRepository, times(2)).save(captor.capture());
        BacktestRun saved = captor.getValue();
        assertEquals(RunStatus.FAILED, saved.getStatus());
        assertEquals("Unknown strategy: momentum", saved.getFailureReason());
        Ledger ledger = ledgerCodec.fromJson(saved.getLedgerJson());
        assertEquals(0, new BigDecimal("10000").compareTo(ledger.getTotalQuote()));

        verify(metricsService).recordRunFailed();
        verify(metricsService, never()).recordRunCompleted(anyLong(), anyInt());
        assertNull(MDC.get("runId"));
    }

    @Test
    void testRunBacktest_InsufficientHistoryRecordsFailure() {
        // Arrange
        BacktestRequest request = createValidRequest("rsi");
        when(marketDataService.loadCandles(any(), any(), any())).thenReturn(risingSeries(24));

        // Act & Assert
        assertThrows(InsufficientHistoryException.class, () -> backtestService.runBacktest(request));

        ArgumentCaptor<BacktestRun> captor = ArgumentCaptor.forClass(BacktestRun.class);
        verify(backtestRunRepository, times(2)).save(captor.capture());
        assertEquals(RunStatus.FAILED, captor.getValue().getStatus());
        assertTrue(captor.getValue().getFailureReason().contains("analysis window"));
    }

    @Test
    void testRunBacktest_MarketDataFailureHasNoLedger() {
        BacktestRequest request = createValidRequest("buy_and_hold");
        when(marketDataService.loadCandles(any(), any(), any()))
                .thenThrow(new IllegalArgumentException("Range would need too many synthetic candles"));

        assertThrows(IllegalArgumentException.class, () -> backtestService.runBacktest(request));

        ArgumentCaptor<BacktestRun> captor = ArgumentCaptor.forClass(BacktestRun.class);
        verify(backtestRunRepository, times(2)).save(captor.capture());
        assertEquals(RunStatus.FAILED, captor.getValue().getStatus());
        assertNull(captor.getValue().getLedgerJson());
    }

    @Test
    void testGetRun_DecodesStoredData() {
        // Arrange
        BacktestRun run = BacktestRun.builder()
                .id(3L)
                .strategyName("rsi")
                .symbol("BTC")
                .startTime(START)
                .endTime(START.plus(Duration.ofDays(1)))
                .status(RunStatus.FAILED)
                .failureReason("boom")
                .parametersJson("{\"period\":14}")
                .ledgerJson(ledgerCodec.toJson(new Ledger("BTC", BigDecimal.ONE, BigDecimal.TEN)))
                .build();
        when(backtestRunRepository.findById(3L)).thenReturn(Optional.of(run));

        // Act
        BacktestResponse response = backtestService.getRun(3L);

        // Assert
        assertEquals(3L, response.getRunId());
        assertEquals(RunStatus.FAILED, response.getStatus());
        assertEquals("boom", response.getFailureReason());
        assertEquals(14, response.getParameters().get("period"));
        assertNull(response.getRows());
        assertEquals(0, BigDecimal.TEN.compareTo(response.getFinalLedger().getTotalQuote()));
    }

    @Test
    void testGetRun_NotFound() {
        when(backtestRunRepository.findById(99L)).thenReturn(Optional.empty());

        BacktestRunNotFoundException ex = assertThrows(BacktestRunNotFoundException.class,
                () -> backtestService.getRun(99L));
        assertEquals(99L, ex.getRunId());
    }

    private BacktestRequest createValidRequest(String strategyName) {
        Map<String, Object> parameters = new HashMap<>();
        return BacktestRequest.builder()
                .strategyName(strategyName)
                .symbol("BTC")
                .startTime(START)
                .endTime(START.plus(Duration.ofHours(23)))
                .parameters(parameters)
                .initialQuote(new BigDecimal("10000"))
                .initialBase(BigDecimal.ZERO)
                .build();
    }

    private static List<Candle> risingSeries(int hours) {
        List<Candle> candles = new ArrayList<>();
        for (int i = 0; i < hours; i++) {
            BigDecimal price = BigDecimal.valueOf(100 + i);
            candles.add(Candle.builder()
                    .time(START.plus(Duration.ofHours(i)))
                    .open(price)
                    .high(price.add(BigDecimal.ONE))
                    .low(price.subtract(BigDecimal.ONE))
                    .close(price)
                    .volume(BigDecimal.TEN)
                    .build());
        }
        return candles;
    }
}
