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
 * Request DTO for comparing strategies against buy-and-hold on inline bars.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ComparisonRequest {

    @NotBlank(message = "Symbol is required")
    private String symbol;

    /** Strategy name to parameters; omit to compare every strategy with its defaults. */
    private Map<String, Map<String, Object>> strategies;

    @NotEmpty(message = "At least one bar is required")
    private List<@Valid BarDto> bars;

    @Valid
    private SettingsDto settings;
}
