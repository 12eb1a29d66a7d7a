package com.strategylab.optimizer.controller.dto;

import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

/**
 * Request DTO for walk-forward validation. Window sizes left null use the configured defaults.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@NoArgsConstructor
public class WalkForwardRequestDto extends OptimizationRequestDto {

    @Positive(message = "Train window must be positive")
    private Integer trainBars;

    @Positive(message = "Test window must be positive")
    private Integer testBars;

    @Positive(message = "Step must be positive")
    private Integer stepBars;

    @PositiveOrZero(message = "Max windows must not be negative")
    private Integer maxWindows;
}
