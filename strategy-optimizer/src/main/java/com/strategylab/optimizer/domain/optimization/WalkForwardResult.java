package com.strategylab.optimizer.domain.optimization;

import com.strategylab.optimizer.domain.strategy.StrategyType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Out-of-sample estimate from a walk-forward run.
 */
@Value
@Builder
public class WalkForwardResult {

    String sweepId;
    StrategyType strategyType;
    OptimizationObjective objective;
    List<WalkForwardWindowResult> windows;

    /** Test objective value per window that produced one. */
    List<BigDecimal> testScores;

    /** Mean of {@link #testScores}. */
    BigDecimal aggregateScore;

    BigDecimal meanTestSharpe;
    BigDecimal meanTestReturnPct;
    BigDecimal testReturnStdDev;

    /** Share of evaluated windows with a positive test return, in percent. */
    BigDecimal consistencyPct;

    /** Parameters picked on the most recent train window, carrying every test score. */
    OptimizationResult finalSelection;

    boolean cancelled;
}
