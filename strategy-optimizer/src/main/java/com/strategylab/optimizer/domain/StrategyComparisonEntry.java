package com.strategylab.optimizer.domain;

import com.strategylab.optimizer.domain.strategy.StrategyType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class StrategyComparisonEntry {

    StrategyType strategyType;
    BacktestResult result;

    /** Total return minus the benchmark's, in percentage points. */
    BigDecimal excessReturnPct;

    public boolean beatsBenchmark() {
        return excessReturnPct.signum() > 0;
    }
}
