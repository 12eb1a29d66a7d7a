package com.strategylab.optimizer.controller.dto;

import com.strategylab.optimizer.domain.BacktestResult;
import com.strategylab.optimizer.domain.PerformanceReport;
import com.strategylab.optimizer.domain.StrategyComparison;
import com.strategylab.optimizer.domain.StrategyComparisonEntry;
import com.strategylab.optimizer.domain.strategy.StrategyType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

/**
 * Response DTO for a strategy comparison: one report per strategy next to the benchmark report.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ComparisonResponse {

    private String symbol;
    private StrategyReport benchmark;
    private List<StrategyReport> strategies;
    private String bestStrategy;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class StrategyReport {
        private StrategyType strategyType;
        private String strategyName;
        private PerformanceReport report;
        private BigDecimal excessReturnPct;
        private Boolean beatsBenchmark;
    }

    public static ComparisonResponse from(StrategyComparison comparison) {
        BacktestResult benchmark = comparison.getBenchmark();
        return ComparisonResponse.builder()
                .symbol(comparison.getSymbol())
                .benchmark(StrategyReport.builder()
                        .strategyType(StrategyType.BUY_AND_HOLD)
                        .strategyName(benchmark.getStrategyName())
                        .report(benchmark.getReport())
                        .build())
                .strategies(comparison.getEntries().stream().map(ComparisonResponse::report).toList())
                .bestStrategy(comparison.best().map(e -> e.getResult().getStrategyName()).orElse(null))
                .build();
    }

    private static StrategyReport report(StrategyComparisonEntry entry) {
        return StrategyReport.builder()
                .strategyType(entry.getStrategyType())
                .strategyName(entry.getResult().getStrategyName())
                .report(entry.getResult().getReport())
                .excessReturnPct(entry.getExcessReturnPct())
                .beatsBenchmark(entry.beatsBenchmark())
                .build();
    }
}
