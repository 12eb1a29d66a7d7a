package com.strategylab.optimizer.controller.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.List;

/**
 * Request DTO for a grid or sampled parameter search on inline bars.
 */
@Data
@NoArgsConstructor
public class OptimizationRequestDto {

    @NotBlank(message = "Symbol is required")
    private String symbol;

    @NotBlank(message = "Strategy type is required")
    private String strategyType;

    /** Parameter name to candidate values, in enumeration order. */
    @NotEmpty(message = "Parameter grid is required")
    private LinkedHashMap<String, List<Object>> parameterGrid;

    private String objective; // "SHARPE_RATIO", "TOTAL_RETURN", "MAX_DRAWDOWN", etc.

    @Positive(message = "Sample size must be positive")
    private Integer sampleSize;

    private Long seed;

    @Positive(message = "Timeout must be positive")
    private Long timeoutSeconds;

    @NotEmpty(message = "At least one bar is required")
    private List<@Valid BarDto> bars;

    @Valid
    private SettingsDto settings;
}
