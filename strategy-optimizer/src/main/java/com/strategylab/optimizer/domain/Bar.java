package com.strategylab.optimizer.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A single OHLCV sample. A {@code null} price marks a gap in the feed.
 */
@Value
@Builder
public class Bar {

    Instant timestamp;
    BigDecimal open;
    BigDecimal high;
    BigDecimal low;
    BigDecimal close;
    BigDecimal volume;

    public boolean hasClose() {
        return close != null;
    }
}
