package com.strategylab.optimizer.controller;

import com.strategylab.optimizer.config.BacktestProperties;
import com.strategylab.optimizer.controller.dto.BacktestRunRequest;
import com.strategylab.optimizer.controller.dto.BacktestRunResponse;
import com.strategylab.optimizer.controller.dto.BarDto;
import com.strategylab.optimizer.controller.dto.ComparisonRequest;
import com.strategylab.optimizer.controller.dto.ComparisonResponse;
import com.strategylab.optimizer.controller.dto.GridSearchResponse;
import com.strategylab.optimizer.controller.dto.OptimizationRequestDto;
import com.strategylab.optimizer.controller.dto.SettingsDto;
import com.strategylab.optimizer.controller.dto.SignalResponse;
import com.strategylab.optimizer.controller.dto.WalkForwardRequestDto;
import com.strategylab.optimizer.domain.BacktestResult;
import com.strategylab.optimizer.domain.BacktestSettings;
import com.strategylab.optimizer.domain.InvalidParameterException;
import com.strategylab.optimizer.domain.PriceSeries;
import com.strategylab.optimizer.domain.Signal;
import com.strategylab.optimizer.domain.StrategyComparison;
import com.strategylab.optimizer.domain.optimization.GridSearchResult;
import com.strategylab.optimizer.domain.optimization.OptimizationObjective;
import com.strategylab.optimizer.domain.optimization.OptimizationRequest;
import com.strategylab.optimizer.domain.optimization.ParameterGrid;
import com.strategylab.optimizer.domain.optimization.SweepControl;
import com.strategylab.optimizer.domain.optimization.WalkForwardConfig;
import com.strategylab.optimizer.domain.optimization.WalkForwardResult;
import com.strategylab.optimizer.domain.strategy.Strategy;
import com.strategylab.optimizer.domain.strategy.StrategyType;
import com.strategylab.optimizer.service.BacktestService;
import com.strategylab.optimizer.service.OptimizerService;
import com.strategylab.optimizer.service.StrategyFactory;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller for backtests, parameter searches and walk-forward validation on inline bars.
 */
@RestController
@RequestMapping("/backtests")
@RequiredArgsConstructor
@Slf4j
public class BacktestController {

    private final BacktestService backtestService;
    private final OptimizerService optimizerService;
    private final StrategyFactory strategyFactory;
    private final BacktestProperties properties;

    /**
     * Run one backtest.
     *
     * @param request strategy, parameters and bars
     * @return the report, trade ledger and equity curve
     */
    @PostMapping
    public ResponseEntity<BacktestRunResponse> runBacktest(@Valid @RequestBody BacktestRunRequest request) {

        log.info("POST /backtests - Strategy: {}, Symbol: {}, Bars: {}",
                request.getStrategyType(), request.getSymbol(), request.getBars().size());

        BacktestSettings settings = settings(request.getSettings());
        PriceSeries series = series(request.getSymbol(), request.getBars(), settings);
        BacktestResult result = backtestService.runBacktest(series, StrategyType.fromName(request.getStrategyType()),
                request.getParameters(), settings);

        return ResponseEntity.ok(BacktestRunResponse.from(result));
    }

    /**
     * Evaluate a strategy on the latest bar, as a live feed would.
     */
    @PostMapping("/signals")
    public ResponseEntity<SignalResponse> latestSignal(@Valid @RequestBody BacktestRunRequest request) {

        log.info("POST /backtests/signals - Strategy: {}, Symbol: {}",
                request.getStrategyType(), request.getSymbol());

        BacktestSettings settings = settings(request.getSettings());
        PriceSeries series = series(request.getSymbol(), request.getBars(), settings);
        Strategy strategy = strategyFactory.createStrategy(request.getStrategyType(), request.getParameters());
        Signal signal = backtestService.latestSignal(series, strategy);

        return ResponseEntity.ok(SignalResponse.builder()
                .symbol(series.getSymbol())
                .strategyName(strategy.getName())
                .timestamp(series.get(series.size() - 1).getTimestamp())
                .signal(signal)
                .build());
    }

    /**
     * Run several strategies on the same bars and compare each with buy-and-hold.
     */
    @PostMapping("/comparisons")
    public ResponseEntity<ComparisonResponse> compare(@Valid @RequestBody ComparisonRequest request) {

        log.info("POST /backtests/comparisons - Strategies: {}, Symbol: {}, Bars: {}",
                request.getStrategies() != null ? request.getStrategies().keySet() : "all",
                request.getSymbol(), request.getBars().size());

        BacktestSettings settings = settings(request.getSettings());
        StrategyComparison comparison = backtestService.compareStrategies(
                series(request.getSymbol(), request.getBars(), settings),
                strategies(request.getStrategies()),
                settings);

        return ResponseEntity.ok(ComparisonResponse.from(comparison));
    }

    /**
     * Search a parameter grid, or a seeded sample of it.
     *
     * @return ranked results, best first
     */
    @PostMapping("/optimizations")
    public ResponseEntity<GridSearchResponse> optimize(@Valid @RequestBody OptimizationRequestDto request) {

        log.info("POST /backtests/optimizations - Strategy: {}, Grid: {}",
                request.getStrategyType(), request.getParameterGrid());

        BacktestSettings settings = settings(request.getSettings());
        GridSearchResult result = optimizerService.gridSearch(
                series(request.getSymbol(), request.getBars(), settings),
                StrategyType.fromName(request.getStrategyType()),
                ParameterGrid.of(request.getParameterGrid()),
                optimizationRequest(request, settings));

        return ResponseEntity.ok(GridSearchResponse.from(result));
    }

    /**
     * Walk-forward validation: select on each train window, score on the following test window.
     */
    @PostMapping("/walk-forward")
    public ResponseEntity<WalkForwardResult> walkForward(@Valid @RequestBody WalkForwardRequestDto request) {

        log.info("POST /backtests/walk-forward - Strategy: {}, Train: {}, Test: {}",
                request.getStrategyType(), request.getTrainBars(), request.getTestBars());

        BacktestSettings settings = settings(request.getSettings());
        WalkForwardConfig defaults = properties.toWalkForwardConfig();
        WalkForwardConfig config = defaults.toBuilder()
                .trainBars(request.getTrainBars() != null ? request.getTrainBars() : defaults.getTrainBars())
                .testBars(request.getTestBars() != null ? request.getTestBars() : defaults.getTestBars())
                .stepBars(request.getStepBars() != null ? request.getStepBars() : defaults.getStepBars())
                .maxWindows(request.getMaxWindows() != null ? request.getMaxWindows() : defaults.getMaxWindows())
                .build();

        WalkForwardResult result = optimizerService.walkForward(
                series(request.getSymbol(), request.getBars(), settings),
                StrategyType.fromName(request.getStrategyType()),
                ParameterGrid.of(request.getParameterGrid()),
                optimizationRequest(request, settings),
                config);

        return ResponseEntity.ok(result);
    }

    private BacktestSettings settings(SettingsDto overrides) {
        BacktestSettings base = properties.toSettings();
        return overrides != null ? overrides.applyTo(base) : base;
    }

    private PriceSeries series(String symbol, List<BarDto> bars, BacktestSettings settings) {
        return PriceSeries.of(symbol, settings.getBarInterval(), bars.stream().map(BarDto::toBar).toList());
    }

    private static Map<StrategyType, Map<String, Object>> strategies(Map<String, Map<String, Object>> byName) {
        Map<StrategyType, Map<String, Object>> strategies = new LinkedHashMap<>();
        if (byName == null) {
            return strategies;
        }
        byName.forEach((name, parameters) -> {
            StrategyType type = StrategyType.fromName(name);
            if (strategies.put(type, parameters != null ? parameters : Map.of()) != null) {
                throw new InvalidParameterException("Strategy " + type + " is listed more than once");
            }
        });
        return strategies;
    }

    private OptimizationRequest optimizationRequest(OptimizationRequestDto request, BacktestSettings settings) {
        OptimizationObjective objective = request.getObjective() != null
                ? OptimizationObjective.fromName(request.getObjective())
                : properties.getOptimizer().getObjective();

        return OptimizationRequest.builder()
                .settings(settings)
                .objective(objective)
                .sampleSize(request.getSampleSize())
                .seed(request.getSeed())
                .control(request.getTimeoutSeconds() != null
                        ? SweepControl.withTimeout(Duration.ofSeconds(request.getTimeoutSeconds()))
                        : SweepControl.none())
                .build();
    }
}
