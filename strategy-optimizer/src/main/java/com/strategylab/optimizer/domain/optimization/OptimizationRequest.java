package com.strategylab.optimizer.domain.optimization;

import com.strategylab.optimizer.domain.BacktestSettings;
import com.strategylab.optimizer.domain.InvalidParameterException;
import lombok.Builder;
import lombok.Value;

/**
 * Everything a sweep needs besides the series, strategy type and grid.
 */
@Value
@Builder(toBuilder = true)
public class OptimizationRequest {

    @Builder.Default
    BacktestSettings settings = BacktestSettings.defaults();

    @Builder.Default
    OptimizationObjective objective = OptimizationObjective.SHARPE_RATIO;

    /** Evaluate a random subset of this many combinations instead of the full grid. */
    Integer sampleSize;

    /** Seed for the sample; the same seed picks the same subset. */
    Long seed;

    @Builder.Default
    SweepControl control = SweepControl.none();

    public void validate() {
        if (settings == null || objective == null || control == null) {
            throw new InvalidParameterException("Settings, objective and sweep control are required");
        }
        settings.validate();
        if (sampleSize != null && sampleSize <= 0) {
            throw new InvalidParameterException("Sample size must be positive: " + sampleSize);
        }
    }
}
