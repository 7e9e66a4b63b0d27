package com.candlebacktest.backtester.controller.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Request DTO for running a backtest.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BacktestRequest {

    @NotBlank(message = "Strategy name is required")
    private String strategyName;

    @NotBlank(message = "Symbol is required")
    @Size(max = 20, message = "Symbol must be at most 20 characters")
    private String symbol;

    @NotNull(message = "Start time is required")
    private Instant startTime;

    @NotNull(message = "End time is required")
    private Instant endTime;

    @Builder.Default
    private Map<String, Object> parameters = new HashMap<>();

    @NotNull(message = "Initial quote balance is required")
    @PositiveOrZero(message = "Initial quote balance must not be negative")
    private BigDecimal initialQuote;

    @Builder.Default
    @PositiveOrZero(message = "Initial base balance must not be negative")
    private BigDecimal initialBase = BigDecimal.ZERO;

    @JsonIgnore
    @AssertTrue(message = "End time must not be before start time")
    public boolean isTimeRangeValid() {
        return startTime == null || endTime == null || !endTime.isBefore(startTime);
    }
}
