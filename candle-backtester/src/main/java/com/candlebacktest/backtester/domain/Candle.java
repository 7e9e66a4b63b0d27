package com.candlebacktest.backtester.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One OHLCV aggregate for a fixed time interval.
 */
@Value
@Builder(toBuilder = true)
public class Candle {

    Instant time;
    BigDecimal open;
    BigDecimal high;
    BigDecimal low;
    BigDecimal close;
    BigDecimal volume;
}
