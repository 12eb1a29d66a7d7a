package com.strategylab.optimizer.service;

import com.strategylab.optimizer.domain.BacktestEngine;
import com.strategylab.optimizer.domain.BacktestResult;
import com.strategylab.optimizer.domain.InvalidParameterException;
import com.strategylab.optimizer.domain.PriceSeries;
import com.strategylab.optimizer.domain.optimization.GridSearchResult;
import com.strategylab.optimizer.domain.optimization.OptimizationObjective;
import com.strategylab.optimizer.domain.optimization.OptimizationRequest;
import com.strategylab.optimizer.domain.optimization.OptimizationResult;
import com.strategylab.optimizer.domain.optimization.ParameterGrid;
import com.strategylab.optimizer.domain.optimization.WalkForwardConfig;
import com.strategylab.optimizer.domain.optimization.WalkForwardResult;
import com.strategylab.optimizer.domain.optimization.WalkForwardWindow;
import com.strategylab.optimizer.domain.optimization.WalkForwardWindowResult;
import com.strategylab.optimizer.domain.strategy.Strategy;
import com.strategylab.optimizer.domain.strategy.StrategyType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.function.Function;

/**
 * Searches strategy parameter space by treating the backtest engine as a black-box objective.
 * Combinations run in parallel on the optimizer pool; each gets its own strategy instance,
 * indicators and portfolio, so results do not depend on the pool size.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OptimizerService {

    static final String SWEEP_ID = "sweepId";
    private static final int SCALE = 4;

    private final BacktestEngine backtestEngine;
    private final StrategyFactory strategyFactory;
    private final BacktestMetricsService metricsService;
    private final ExecutorService optimizerExecutor;

    /**
     * Evaluate every combination of the grid (or a seeded sample of it) and rank the results.
     *
     * @throws InvalidParameterException if the request is invalid
     */
    public GridSearchResult gridSearch(PriceSeries series, StrategyType type, ParameterGrid grid,
                                       OptimizationRequest request) {
        validate(type, grid, request);
        String sweepId = newSweepId();
        MDC.put(SWEEP_ID, sweepId);

        try {
            log.info("Starting grid search - Strategy: {}, Grid: {}, Objective: {}, Sample: {}",
                    type, grid, request.getObjective(), request.getSampleSize());

            GridSearchResult result = search(sweepId, series, type, grid, request);
            recordSweep(result.isCancelled());

            log.info("Grid search completed - {} of {} combinations evaluated, {} failed, cancelled: {}, best: {}",
                    result.getEvaluated(), result.getTotalCombinations(), result.getFailed(), result.isCancelled(),
                    result.best().map(OptimizationResult::canonicalParameters).orElse("none"));
            return result;
        } finally {
            MDC.remove(SWEEP_ID);
        }
    }

    /**
     * Select parameters on each train window and score them on the following test window.
     * Test bars never take part in the selection made for their own window.
     *
     * @throws InvalidParameterException if the configuration yields no window for this series
     */
    public WalkForwardResult walkForward(PriceSeries series, StrategyType type, ParameterGrid grid,
                                         OptimizationRequest request, WalkForwardConfig config) {
        validate(type, grid, request);
        if (config == null) {
            throw new InvalidParameterException("Walk-forward configuration is required");
        }
        List<WalkForwardWindow> windows = config.plan(series.size());
        if (windows.isEmpty()) {
            throw new InvalidParameterException("Series of " + series.size() + " bars is too short for a "
                    + config.getTrainBars() + "-bar train window followed by a test window");
        }

        String sweepId = newSweepId();
        MDC.put(SWEEP_ID, sweepId);

        try {
            log.info("Starting walk-forward - Strategy: {}, Windows: {}, Train: {}, Test: {}, Step: {}",
                    type, windows.size(), config.getTrainBars(), config.getTestBars(), config.effectiveStep());

            OptimizationObjective objective = request.getObjective();
            List<WalkForwardWindowResult> windowResults = new ArrayList<>();
            boolean cancelled = false;

            for (WalkForwardWindow window : windows) {
                if (request.getControl().shouldStop()) {
                    cancelled = true;
                    break;
                }

                PriceSeries train = series.slice(window.getTrainStart(), window.trainEnd());
                GridSearchResult trainSearch = search(sweepId, train, type, grid, request);
                cancelled |= trainSearch.isCancelled();

                WalkForwardWindowResult.WalkForwardWindowResultBuilder windowResult = WalkForwardWindowResult.builder()
                        .window(window)
                        .testPeriodStart(series.get(window.getTestStart()).getTimestamp())
                        .testPeriodEnd(series.get(window.getTestEnd() - 1).getTimestamp());

                OptimizationResult trainBest = trainSearch.best().orElse(null);
                if (trainBest == null) {
                    log.warn("Window {}: no combination completed on the train range", window.getIndex());
                    windowResults.add(windowResult.build());
                    continue;
                }

                PriceSeries withWarmup = series.slice(window.getTrainStart(), window.getTestEnd());
                OptimizationResult testResult = evaluate(withWarmup, window.getTestStart() - window.getTrainStart(),
                        type, trainBest.getParameters(), request);

                log.info("Window {}: train best {} ({} {}), test {} {}", window.getIndex(),
                        trainBest.canonicalParameters(), objective, trainBest.getScore(),
                        objective, testResult.getScore());

                windowResults.add(windowResult
                        .trainBest(trainBest)
                        .testResult(testResult)
                        .testScore(testResult.getScore())
                        .build());
            }

            WalkForwardResult result = summarize(sweepId, type, objective, windowResults, cancelled);
            recordSweep(cancelled);

            log.info("Walk-forward completed - aggregate {}: {}, mean test return: {}%, consistency: {}%",
                    objective, result.getAggregateScore(), result.getMeanTestReturnPct(), result.getConsistencyPct());
            return result;
        } finally {
            MDC.remove(SWEEP_ID);
        }
    }

    private GridSearchResult search(String sweepId, PriceSeries series, StrategyType type, ParameterGrid grid,
                                    OptimizationRequest request) {
        List<Map<String, Object>> combinations = request.getSampleSize() != null
                ? grid.sample(request.getSampleSize(), sampleRandom(request))
                : grid.combinations();

        List<CompletableFuture<OptimizationResult>> futures = new ArrayList<>(combinations.size());
        for (Map<String, Object> parameters : combinations) {
            futures.add(CompletableFuture.supplyAsync(() -> evaluateInWorker(sweepId, series, type, parameters, request),
                    optimizerExecutor));
        }

        List<OptimizationResult> results = new ArrayList<>();
        boolean interrupted = false;
        for (int i = 0; i < futures.size(); i++) {
            CompletableFuture<OptimizationResult> future = futures.get(i);
            OptimizationResult result;
            if (interrupted) {
                result = future.isDone() && !future.isCompletedExceptionally() ? future.join() : null;
            } else {
                try {
                    result = future.get();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    request.getControl().requestStop();
                    log.warn("Sweep interrupted, stopping remaining combinations");
                    interrupted = true;
                    result = future.isDone() && !future.isCompletedExceptionally() ? future.join() : null;
                } catch (ExecutionException e) {
                    result = OptimizationResult.failed(combinations.get(i), e.getCause());
                }
            }
            if (result != null) {
                results.add(result);
            }
        }

        results.sort(OptimizationResult.ranking(request.getObjective()));
        int failed = (int) results.stream().filter(r -> !r.isCompleted()).count();

        return GridSearchResult.builder()
                .sweepId(sweepId)
                .strategyType(type)
                .objective(request.getObjective())
                .results(List.copyOf(results))
                .totalCombinations(combinations.size())
                .evaluated(results.size())
                .failed(failed)
                .cancelled(interrupted || results.size() < combinations.size())
                .build();
    }

    private OptimizationResult evaluateInWorker(String sweepId, PriceSeries series, StrategyType type,
                                                Map<String, Object> parameters, OptimizationRequest request) {
        MDC.put(SWEEP_ID, sweepId);
        try {
            if (request.getControl().shouldStop()) {
                log.debug("Skipping {} after stop request", parameters);
                return null;
            }
            return evaluate(series, 0, type, parameters, request);
        } finally {
            MDC.remove(SWEEP_ID);
        }
    }

    /**
     * Run one combination, converting rejections and failures into a FAILED result.
     */
    private OptimizationResult evaluate(PriceSeries series, int tradingStart, StrategyType type,
                                        Map<String, Object> parameters, OptimizationRequest request) {
        try {
            Strategy strategy = strategyFactory.createStrategy(type, parameters);
            BacktestResult run = backtestEngine.run(series, strategy, request.getSettings(), tradingStart);
            metricsService.recordRunCompleted(run.getExecutionTimeMs());
            return OptimizationResult.completed(parameters, run.getReport(), request.getObjective());
        } catch (RuntimeException e) {
            metricsService.recordRunFailed();
            log.warn("Combination {} failed: {}", parameters, e.getMessage());
            return OptimizationResult.failed(parameters, e);
        }
    }

    private WalkForwardResult summarize(String sweepId, StrategyType type, OptimizationObjective objective,
                                        List<WalkForwardWindowResult> windows, boolean cancelled) {
        List<OptimizationResult> tests = windows.stream()
                .map(WalkForwardWindowResult::getTestResult)
                .filter(r -> r != null && r.isCompleted())
                .toList();
        List<BigDecimal> scores = tests.stream().map(OptimizationResult::getScore).toList();
        List<BigDecimal> returns = tests.stream().map(r -> r.getReport().getTotalReturnPct()).toList();
        long positive = returns.stream().filter(r -> r.signum() > 0).count();

        OptimizationResult finalSelection = null;
        for (int i = windows.size() - 1; i >= 0 && finalSelection == null; i--) {
            OptimizationResult trainBest = windows.get(i).getTrainBest();
            if (trainBest != null) {
                finalSelection = trainBest.toBuilder().walkForwardScores(scores).build();
            }
        }

        return WalkForwardResult.builder()
                .sweepId(sweepId)
                .strategyType(type)
                .objective(objective)
                .windows(List.copyOf(windows))
                .testScores(scores)
                .aggregateScore(mean(scores))
                .meanTestSharpe(mean(tests, r -> r.getReport().getSharpeRatio()))
                .meanTestReturnPct(mean(returns))
                .testReturnStdDev(populationStdDev(returns))
                .consistencyPct(returns.isEmpty()
                        ? BigDecimal.ZERO.setScale(SCALE)
                        : BigDecimal.valueOf(positive * 100).divide(BigDecimal.valueOf(returns.size()), SCALE,
                        RoundingMode.HALF_UP))
                .finalSelection(finalSelection)
                .cancelled(cancelled)
                .build();
    }

    private void validate(StrategyType type, ParameterGrid grid, OptimizationRequest request) {
        if (type == null) {
            throw new InvalidParameterException("Strategy type is required");
        }
        if (grid == null) {
            throw new InvalidParameterException("Parameter grid is required");
        }
        if (request == null) {
            throw new InvalidParameterException("Optimization request is required");
        }
        request.validate();
    }

    private void recordSweep(boolean cancelled) {
        if (cancelled) {
            metricsService.recordSweepCancelled();
        } else {
            metricsService.recordSweepCompleted();
        }
        log.info(metricsService.getMetricsSummary());
    }

    private Random sampleRandom(OptimizationRequest request) {
        long seed = request.getSeed() != null ? request.getSeed() : System.nanoTime();
        if (request.getSeed() == null) {
            log.info("No sample seed given, using {}", seed);
        }
        return new Random(seed);
    }

    private static String newSweepId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    private static BigDecimal mean(List<OptimizationResult> results, Function<OptimizationResult, BigDecimal> metric) {
        return mean(results.stream().map(metric).toList());
    }

    private static BigDecimal mean(List<BigDecimal> values) {
        if (values.isEmpty()) {
            return BigDecimal.ZERO.setScale(SCALE);
        }
        BigDecimal sum = values.stream().reduce(BigDecimal.ZERO, BigDecimal::add);
        return sum.divide(BigDecimal.valueOf(values.size()), SCALE, RoundingMode.HALF_UP);
    }

    private static BigDecimal populationStdDev(List<BigDecimal> values) {
        if (values.isEmpty()) {
            return BigDecimal.ZERO.setScale(SCALE);
        }
        double mean = values.stream().mapToDouble(BigDecimal::doubleValue).average().orElse(0);
        double variance = values.stream()
                .mapToDouble(v -> (v.doubleValue() - mean) * (v.doubleValue() - mean))
                .average()
                .orElse(0);
        return BigDecimal.valueOf(Math.sqrt(variance)).setScale(SCALE, RoundingMode.HALF_UP);
    }
}
