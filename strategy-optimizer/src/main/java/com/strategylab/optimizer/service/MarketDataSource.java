package com.strategylab.optimizer.service;

import com.strategylab.optimizer.domain.BarInterval;
import com.strategylab.optimizer.domain.PriceSeries;

import java.time.Instant;

/**
 * Supplier of historical bars. Implementations live outside this service; when none is
 * registered, callers pass bars inline.
 */
public interface MarketDataSource {

    /**
     * @return bars of {@code symbol} with timestamps in {@code [start, end]}, ordered by time
     */
    PriceSeries getSeries(String symbol, BarInterval interval, Instant start, Instant end);
}
