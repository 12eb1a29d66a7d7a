package com.strategylab.optimizer.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Immutable run configuration handed to the engine and the optimizer.
 * Two runs with equal settings on the same series and strategy produce the same ledger.
 */
@Value
@Builder(toBuilder = true)
public class BacktestSettings {

    public static final BigDecimal DEFAULT_INITIAL_CAPITAL = new BigDecimal("10000");
    public static final BigDecimal DEFAULT_FEE_RATE = new BigDecimal("0.001");

    @Builder.Default
    BigDecimal initialCapital = DEFAULT_INITIAL_CAPITAL;

    @Builder.Default
    BigDecimal feeRate = DEFAULT_FEE_RATE;

    @Builder.Default
    PositionSizing positionSizing = PositionSizing.WHOLE_UNITS;

    /** Share of available cash committed on each entry, in (0, 1]. */
    @Builder.Default
    BigDecimal positionFraction = BigDecimal.ONE;

    @Builder.Default
    ExecutionTiming executionTiming = ExecutionTiming.CLOSE;

    /**
     * Interval of series built or fetched for a run. Metrics annualize from the interval the
     * series itself carries.
     */
    @Builder.Default
    BarInterval barInterval = BarInterval.H1;

    /** Optional protective exit, as a fraction of the entry price (0.02 = 2%). */
    BigDecimal stopLossPct;

    /** Optional profit target, as a fraction of the entry price. */
    BigDecimal takeProfitPct;

    /** Fail runs whose series is shorter than the strategy warm-up instead of returning zero trades. */
    @Builder.Default
    boolean requireFullWarmup = false;

    public static BacktestSettings defaults() {
        return BacktestSettings.builder().build();
    }

    /**
     * @throws InvalidParameterException if any value is out of range
     */
    public void validate() {
        if (initialCapital == null || initialCapital.signum() <= 0) {
            throw new InvalidParameterException("Initial capital must be positive: " + initialCapital);
        }
        if (feeRate == null || feeRate.signum() < 0 || feeRate.compareTo(BigDecimal.ONE) >= 0) {
            throw new InvalidParameterException("Fee rate must be in [0, 1): " + feeRate);
        }
        if (positionFraction == null || positionFraction.signum() <= 0
                || positionFraction.compareTo(BigDecimal.ONE) > 0) {
            throw new InvalidParameterException("Position fraction must be in (0, 1]: " + positionFraction);
        }
        if (positionSizing == null || executionTiming == null || barInterval == null) {
            throw new InvalidParameterException("Position sizing, execution timing and bar interval are required");
        }
        if (stopLossPct != null && stopLossPct.signum() <= 0) {
            throw new InvalidParameterException("Stop loss must be positive: " + stopLossPct);
        }
        if (takeProfitPct != null && takeProfitPct.signum() <= 0) {
            throw new InvalidParameterException("Take profit must be positive: " + takeProfitPct);
        }
    }
}
