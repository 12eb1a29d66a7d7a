package com.strategylab.optimizer.domain;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * Several strategies run on one series, each measured against a buy-and-hold benchmark over the
 * same bars and settings.
 */
@Value
@Builder
public class StrategyComparison {

    String symbol;
    BacktestResult benchmark;

    /** In the order the strategies were requested. */
    List<StrategyComparisonEntry> entries;

    /**
     * The entry with the highest total return; the earlier entry wins a tie.
     */
    public Optional<StrategyComparisonEntry> best() {
        return entries.stream()
                .reduce((a, b) -> b.getResult().getReport().getTotalReturnPct()
                        .compareTo(a.getResult().getReport().getTotalReturnPct()) > 0 ? b : a);
    }
}
