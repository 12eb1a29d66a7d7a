package com.strategylab.optimizer.controller.dto;

import com.strategylab.optimizer.domain.BacktestResult;
import com.strategylab.optimizer.domain.EquityPoint;
import com.strategylab.optimizer.domain.PerformanceReport;
import com.strategylab.optimizer.domain.Trade;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Response DTO for a single backtest: report, trade ledger and equity curve.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BacktestRunResponse {

    private String strategyName;
    private String symbol;
    private PerformanceReport report;
    private List<Trade> trades;
    private List<EquityPoint> equityCurve;
    private Long executionTimeMs;

    public static BacktestRunResponse from(BacktestResult result) {
        return BacktestRunResponse.builder()
                .strategyName(result.getStrategyName())
                .symbol(result.getSymbol())
                .report(result.getReport())
                .trades(result.getTrades())
                .equityCurve(result.getEquityCurve())
                .executionTimeMs(result.getExecutionTimeMs())
                .build();
    }
}
