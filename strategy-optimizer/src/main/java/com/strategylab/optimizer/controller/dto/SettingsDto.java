package com.strategylab.optimizer.controller.dto;

import com.strategylab.optimizer.domain.BacktestSettings;
import com.strategylab.optimizer.domain.BarInterval;
import com.strategylab.optimizer.domain.ExecutionTiming;
import com.strategylab.optimizer.domain.PositionSizing;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Per-request overrides of the configured run settings. Null fields keep the configured value.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SettingsDto {

    @Positive(message = "Initial capital must be positive")
    private BigDecimal initialCapital;

    @DecimalMin(value = "0", message = "Fee rate must not be negative")
    @DecimalMax(value = "1", inclusive = false, message = "Fee rate must be below 1")
    private BigDecimal feeRate;

    private PositionSizing positionSizing;

    @DecimalMin(value = "0", inclusive = false, message = "Position fraction must be positive")
    @DecimalMax(value = "1", message = "Position fraction must not exceed 1")
    private BigDecimal positionFraction;

    private ExecutionTiming executionTiming;

    private String barInterval;

    @Positive(message = "Stop loss must be positive")
    private BigDecimal stopLossPct;

    @Positive(message = "Take profit must be positive")
    private BigDecimal takeProfitPct;

    private Boolean requireFullWarmup;

    public BacktestSettings applyTo(BacktestSettings base) {
        BacktestSettings.BacktestSettingsBuilder builder = base.toBuilder();
        if (initialCapital != null) {
            builder.initialCapital(initialCapital);
        }
        if (feeRate != null) {
            builder.feeRate(feeRate);
        }
        if (positionSizing != null) {
            builder.positionSizing(positionSizing);
        }
        if (positionFraction != null) {
            builder.positionFraction(positionFraction);
        }
        if (executionTiming != null) {
            builder.executionTiming(executionTiming);
        }
        if (barInterval != null) {
            builder.barInterval(BarInterval.fromCode(barInterval));
        }
        if (stopLossPct != null) {
            builder.stopLossPct(stopLossPct);
        }
        if (takeProfitPct != null) {
            builder.takeProfitPct(takeProfitPct);
        }
        if (requireFullWarmup != null) {
            builder.requireFullWarmup(requireFullWarmup);
        }
        return builder.build();
    }
}
