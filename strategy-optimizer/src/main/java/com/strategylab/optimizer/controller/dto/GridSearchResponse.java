package com.strategylab.optimizer.controller.dto;

import com.strategylab.optimizer.domain.optimization.GridSearchResult;
import com.strategylab.optimizer.domain.optimization.OptimizationObjective;
import com.strategylab.optimizer.domain.optimization.OptimizationResult;
import com.strategylab.optimizer.domain.strategy.StrategyType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Response DTO for a parameter search, results ranked best first.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class GridSearchResponse {

    private String sweepId;
    private StrategyType strategyType;
    private OptimizationObjective objective;
    private Long totalCombinations;
    private Integer evaluated;
    private Integer failed;
    private Boolean cancelled;
    private OptimizationResult best;
    private List<OptimizationResult> results;

    public static GridSearchResponse from(GridSearchResult result) {
        return GridSearchResponse.builder()
                .sweepId(result.getSweepId())
                .strategyType(result.getStrategyType())
                .objective(result.getObjective())
                .totalCombinations(result.getTotalCombinations())
                .evaluated(result.getEvaluated())
                .failed(result.getFailed())
                .cancelled(result.isCancelled())
                .best(result.best().orElse(null))
                .results(result.getResults())
                .build();
    }
}
