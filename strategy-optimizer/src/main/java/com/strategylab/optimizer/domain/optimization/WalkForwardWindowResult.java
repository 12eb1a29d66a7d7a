package com.strategylab.optimizer.domain.optimization;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
@Builder
public class WalkForwardWindowResult {

    WalkForwardWindow window;
    Instant testPeriodStart;
    Instant testPeriodEnd;

    /** Best completed combination on the train range. */
    OptimizationResult trainBest;

    /** The same parameters evaluated on the test range only. */
    OptimizationResult testResult;

    BigDecimal testScore;
}
