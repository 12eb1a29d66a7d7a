package com.strategylab.optimizer.domain;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Outcome of one backtest run: the report plus the ledger and equity curve it was derived from.
 */
@Value
@Builder
public class BacktestResult {

    String strategyName;
    String symbol;
    PerformanceReport report;
    List<Trade> trades;
    List<EquityPoint> equityCurve;

    /** Index of the first traded bar; earlier bars only warmed up indicators. */
    int tradingStart;

    long executionTimeMs;
}
