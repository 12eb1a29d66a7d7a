package com.strategylab.optimizer.domain.optimization;

import com.strategylab.optimizer.domain.PerformanceReport;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * One evaluated parameter combination of a sweep.
 */
@Value
@Builder(toBuilder = true)
public class OptimizationResult {

    Map<String, Object> parameters;
    ResultStatus status;

    /** Null when the combination failed. */
    PerformanceReport report;

    /** Objective value the sweep ranked by, null when failed. */
    BigDecimal score;

    FailureKind failureKind;
    String failureMessage;

    /** Out-of-sample objective values, set on a walk-forward final selection. */
    List<BigDecimal> walkForwardScores;

    public static OptimizationResult completed(Map<String, Object> parameters, PerformanceReport report,
                                               OptimizationObjective objective) {
        return OptimizationResult.builder()
                .parameters(parameters)
                .status(ResultStatus.COMPLETED)
                .report(report)
                .score(objective.score(report))
                .build();
    }

    public static OptimizationResult failed(Map<String, Object> parameters, Throwable error) {
        return OptimizationResult.builder()
                .parameters(parameters)
                .status(ResultStatus.FAILED)
                .failureKind(FailureKind.of(error))
                .failureMessage(error.getMessage())
                .build();
    }

    public boolean isCompleted() {
        return status == ResultStatus.COMPLETED;
    }

    /**
     * Parameters sorted by name, used as the final tie-break and for logging.
     */
    public String canonicalParameters() {
        return new TreeMap<>(parameters).toString();
    }

    /**
     * Completed before failed, then best objective value, then higher total return, then
     * canonical parameter string.
     */
    public static Comparator<OptimizationResult> ranking(OptimizationObjective objective) {
        Comparator<BigDecimal> byScore = objective.isLowerBetter()
                ? Comparator.naturalOrder()
                : Comparator.reverseOrder();

        return Comparator.comparing(OptimizationResult::isCompleted, Comparator.reverseOrder())
                .thenComparing(OptimizationResult::getScore, Comparator.nullsLast(byScore))
                .thenComparing(OptimizationResult::totalReturnOrNull,
                        Comparator.nullsLast(Comparator.<BigDecimal>reverseOrder()))
                .thenComparing(OptimizationResult::canonicalParameters);
    }

    private BigDecimal totalReturnOrNull() {
        return report != null ? report.getTotalReturnPct() : null;
    }
}
