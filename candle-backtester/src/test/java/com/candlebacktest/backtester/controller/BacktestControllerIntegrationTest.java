package com.candlebacktest.backtester.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.candlebacktest.backtester.controller.dto.BacktestRequest;
import com.candlebacktest.backtester.controller.dto.BacktestResponse;
import com.candlebacktest.backtester.domain.RunStatus;
import com.candlebacktest.backtester.domain.exception.InsufficientHistoryException;
import com.candlebacktest.backtester.service.BacktestRunNotFoundException;
import com.candlebacktest.backtester.service.BacktestService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Integration tests for BacktestController REST endpoints.
 */
@WebMvcTest(BacktestController.class)
class BacktestControllerIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private BacktestService backtestService;

    @Test
    void testRunBacktest_Success() throws Exception {
        // Arrange
        BacktestRequest request = createValidRequest();
        BacktestResponse mockResponse = BacktestResponse.builder()
                .runId(1L)
                .status(RunStatus.COMPLETED)
                .strategyName("rsi")
                .symbol("BTC")
                .totalReturn(new BigDecimal("15.5"))
                .sharpeRatio(new BigDecimal("1.25"))
                .numberOfTransactions(4)
                .build();

        when(backtestService.runBacktest(any())).thenReturn(mockResponse);

        // Act & Assert
        mockMvc.perform(post("/backtests")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.runId").value(1))
                .andExpect(jsonPath("$.status").value("COMPLETED"))
                .andExpect(jsonPath("$.totalReturn").value(15.5))
                .andExpect(jsonPath("$.sharpeRatio").value(1.25))
                .andExpect(jsonPath("$.numberOfTransactions").value(4));
    }

    @Test
    void testRunBacktest_MissingStrategyName() throws Exception {
        // Arrange
        BacktestRequest request = createValidRequest();
        request.setStrategyName(null);

        // Act & Assert
        mockMvc.perform(post("/backtests")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.reason").value("validation_error"))
                .andExpect(jsonPath("$.fields.strategyName").value("Strategy name is required"));

        verify(backtestService, never()).runBacktest(any());
    }

    @Test
    void testRunBacktest_BlankSymbol() throws Exception {
        BacktestRequest request = createValidRequest();
        request.setSymbol("");

        mockMvc.perform(post("/backtests")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.fields.symbol").exists());
    }

    @Test
    void testRunBacktest_EndBeforeStart() throws Exception {
        // Arrange
        BacktestRequest request = createValidRequest();
        request.setEndTime(request.getStartTime().minusSeconds(60));

        // Act & Assert
        mockMvc.perform(post("/backtests")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.fields.timeRangeValid").value("End time must not be before start time"));
    }

    @Test
    void testRunBacktest_NegativeInitialQuote() throws Exception {
        BacktestRequest request = createValidRequest();
        request.setInitialQuote(new BigDecimal("-1"));

        mockMvc.perform(post("/backtests")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.fields.initialQuote").exists());
    }

    @Test
    void testRunBacktest_MalformedBody() throws Exception {
        mockMvc.perform(post("/backtests")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"strategyName\": "))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("malformed_request_body"));
    }

    @Test
    void testRunBacktest_InsufficientHistory() throws Exception {
        // Arrange
        when(backtestService.runBacktest(any()))
                .thenThrow(new InsufficientHistoryException("Series spans 60 min but the strategy needs more"));

        // Act & Assert
        mockMvc.perform(post("/backtests")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(createValidRequest())))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.status").value("error"))
                .andExpect(jsonPath("$.reason").value("simulation_error"));
    }

    @Test
    void testRunBacktest_UnknownStrategy() throws Exception {
        when(backtestService.runBacktest(any()))
                .thenThrow(new IllegalArgumentException("Unknown strategy: momentum"));

        mockMvc.perform(post("/backtests")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(createValidRequest())))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.reason").value("bad_request"))
                .andExpect(jsonPath("$.message").value("Unknown strategy: momentum"));
    }

    @Test
    void testGetRun_Found() throws Exception {
        // Arrange
        BacktestResponse mockResponse = BacktestResponse.builder()
                .runId(5L)
                .status(RunStatus.FAILED)
                .failureReason("Candle series is empty")
                .build();
        when(backtestService.getRun(5L)).thenReturn(mockResponse);

        // Act & Assert
        mockMvc.perform(get("/backtests/5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.runId").value(5))
                .andExpect(jsonPath("$.status").value("FAILED"))
                .andExpect(jsonPath("$.failureReason").value("Candle series is empty"));
    }

    @Test
    void testGetRun_NotFound() throws Exception {
        when(backtestService.getRun(42L)).thenThrow(new BacktestRunNotFoundException(42L));

        mockMvc.perform(get("/backtests/42"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.reason").value("not_found"))
                .andExpect(jsonPath("$.message").value("Backtest run not found: 42"));
    }

    private BacktestRequest createValidRequest() {
        Map<String, Object> params = new HashMap<>();
        params.put("period", 14);

        return BacktestRequest.builder()
                .strategyName("rsi")
                .symbol("BTC")
                .startTime(Instant.parse("2024-01-01T00:00:00Z"))
                .endTime(Instant.parse("2024-03-01T00:00:00Z"))
                .parameters(params)
                .initialQuote(new BigDecimal("10000.00"))
                .build();
    }
}
