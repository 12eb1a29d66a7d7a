package com.strategylab.optimizer.domain.optimization;

import com.strategylab.optimizer.domain.InvalidParameterException;
import com.strategylab.optimizer.domain.PerformanceReport;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.function.Function;

/**
 * Report metric a sweep ranks by. All objectives rank higher-is-better except
 * {@link #MAX_DRAWDOWN}.
 * {@link #COMPOSITE} blends return and risk as {@code totalReturnPct + 10 * sharpeRatio}.
 */
public enum OptimizationObjective {

    SHARPE_RATIO(PerformanceReport::getSharpeRatio, false),
    TOTAL_RETURN(PerformanceReport::getTotalReturnPct, false),
    PROFIT_FACTOR(PerformanceReport::getProfitFactor, false),
    WIN_RATE(PerformanceReport::getWinRate, false),
    MAX_DRAWDOWN(PerformanceReport::getMaxDrawdownPct, true),
    CALMAR_RATIO(PerformanceReport::getCalmarRatio, false),
    SORTINO_RATIO(PerformanceReport::getSortinoRatio, false),
    COMPOSITE(OptimizationObjective::composite, false);

    private static final BigDecimal SHARPE_WEIGHT = BigDecimal.TEN;

    private final Function<PerformanceReport, BigDecimal> metric;
    private final boolean lowerIsBetter;

    OptimizationObjective(Function<PerformanceReport, BigDecimal> metric, boolean lowerIsBetter) {
        this.metric = metric;
        this.lowerIsBetter = lowerIsBetter;
    }

    public BigDecimal score(PerformanceReport report) {
        return metric.apply(report);
    }

    public boolean isLowerBetter() {
        return lowerIsBetter;
    }

    private static BigDecimal composite(PerformanceReport report) {
        return report.getTotalReturnPct().add(report.getSharpeRatio().multiply(SHARPE_WEIGHT));
    }

    /**
     * Accepts the enum name or the short forms "sharpe", "return", "calmar" and the like.
     */
    public static OptimizationObjective fromName(String name) {
        if (name == null || name.isBlank()) {
            return SHARPE_RATIO;
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        return switch (normalized) {
            case "SHARPE", "SHARPERATIO" -> SHARPE_RATIO;
            case "RETURN", "TOTALRETURN", "TOTAL_RETURN_PCT" -> TOTAL_RETURN;
            case "PROFITFACTOR" -> PROFIT_FACTOR;
            case "WINRATE" -> WIN_RATE;
            case "DRAWDOWN", "MAXDRAWDOWN" -> MAX_DRAWDOWN;
            case "CALMAR", "CALMARRATIO" -> CALMAR_RATIO;
            case "SORTINO", "SORTINORATIO" -> SORTINO_RATIO;
            case "SCORE", "RETURN_SHARPE" -> COMPOSITE;
            default -> {
                try {
                    yield valueOf(normalized);
                } catch (IllegalArgumentException e) {
                    throw new InvalidParameterException("Unknown optimization objective: " + name, e);
                }
            }
        };
    }
}
