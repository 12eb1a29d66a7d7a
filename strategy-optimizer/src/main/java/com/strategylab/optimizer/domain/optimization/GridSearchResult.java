package com.strategylab.optimizer.domain.optimization;

import com.strategylab.optimizer.domain.strategy.StrategyType;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * Ranked outcome of one sweep.
 */
@Value
@Builder
public class GridSearchResult {

    String sweepId;
    StrategyType strategyType;
    OptimizationObjective objective;

    /** Sorted best first, see {@link OptimizationResult#ranking(OptimizationObjective)}. */
    List<OptimizationResult> results;

    long totalCombinations;
    int evaluated;
    int failed;

    /** True when a deadline or stop request skipped combinations. */
    boolean cancelled;

    public Optional<OptimizationResult> best() {
        return results.stream().filter(OptimizationResult::isCompleted).findFirst();
    }
}
