package com.strategylab.optimizer.controller.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Request DTO for running a single backtest on inline bars.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BacktestRunRequest {

    @NotBlank(message = "Symbol is required")
    private String symbol;

    @NotBlank(message = "Strategy type is required")
    private String strategyType;

    private Map<String, Object> parameters;

    @NotEmpty(message = "At least one bar is required")
    private List<@Valid BarDto> bars;

    @Valid
    private SettingsDto settings;
}
