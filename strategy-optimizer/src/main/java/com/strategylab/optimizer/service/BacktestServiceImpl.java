package com.strategylab.optimizer.service;

import com.strategylab.optimizer.domain.BacktestEngine;
import com.strategylab.optimizer.domain.BacktestResult;
import com.strategylab.optimizer.domain.BacktestSettings;
import com.strategylab.optimizer.domain.PriceSeries;
import com.strategylab.optimizer.domain.Signal;
import com.strategylab.optimizer.domain.StrategyComparison;
import com.strategylab.optimizer.domain.StrategyComparisonEntry;
import com.strategylab.optimizer.domain.strategy.Strategy;
import com.strategylab.optimizer.domain.strategy.StrategyType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Implementation of BacktestService running backtests synchronously on the calling thread.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BacktestServiceImpl implements BacktestService {

    private final BacktestEngine backtestEngine;
    private final StrategyFactory strategyFactory;
    private final BacktestMetricsService metricsService;
    private final Optional<MarketDataSource> marketDataSource;

    @Override
    public BacktestResult runBacktest(PriceSeries series, StrategyType type, Map<String, ?> parameters,
                                      BacktestSettings settings) {
        log.info("Received backtest for strategy: {}, symbol: {}, parameters: {}",
                type, series != null ? series.getSymbol() : null, parameters);

        try {
            Strategy strategy = strategyFactory.createStrategy(type, parameters);
            BacktestResult result = backtestEngine.run(series, strategy, settings);
            metricsService.recordRunCompleted(result.getExecutionTimeMs());
            return result;
        } catch (RuntimeException e) {
            metricsService.recordRunFailed();
            log.warn("Backtest of {} rejected: {}", type, e.getMessage());
            throw e;
        }
    }

    @Override
    public BacktestResult runBacktest(String symbol, Instant start, Instant end, StrategyType type,
                                      Map<String, ?> parameters, BacktestSettings settings) {
        MarketDataSource source = marketDataSource.orElseThrow(() ->
                new IllegalStateException("No market data source configured; pass bars inline"));

        PriceSeries series = source.getSeries(symbol, settings.getBarInterval(), start, end);
        log.info("Loaded {} bars of {} between {} and {}", series.size(), symbol, start, end);
        return runBacktest(series, type, parameters, settings);
    }

    @Override
    public StrategyComparison compareStrategies(PriceSeries series,
                                                Map<StrategyType, ? extends Map<String, ?>> strategies,
                                                BacktestSettings settings) {
        Map<StrategyType, ? extends Map<String, ?>> contenders =
                strategies == null || strategies.isEmpty() ? defaultContenders() : strategies;
        log.info("Comparing {} against buy-and-hold on {}", contenders.keySet(),
                series != null ? series.getSymbol() : null);

        BacktestResult benchmark = runBacktest(series, StrategyType.BUY_AND_HOLD, Map.of(), settings);
        BigDecimal benchmarkReturn = benchmark.getReport().getTotalReturnPct();

        List<StrategyComparisonEntry> entries = new ArrayList<>();
        for (Map.Entry<StrategyType, ? extends Map<String, ?>> contender : contenders.entrySet()) {
            if (contender.getKey() == StrategyType.BUY_AND_HOLD) {
                log.debug("Buy-and-hold is already the benchmark, skipping it as a contender");
                continue;
            }
            BacktestResult result = runBacktest(series, contender.getKey(), contender.getValue(), settings);
            entries.add(StrategyComparisonEntry.builder()
                    .strategyType(contender.getKey())
                    .result(result)
                    .excessReturnPct(result.getReport().getTotalReturnPct().subtract(benchmarkReturn))
                    .build());
        }

        StrategyComparison comparison = StrategyComparison.builder()
                .symbol(series.getSymbol())
                .benchmark(benchmark)
                .entries(List.copyOf(entries))
                .build();

        comparison.best().ifPresent(best -> log.info("Best strategy: {} with {}% ({} vs buy-and-hold)",
                best.getResult().getStrategyName(), best.getResult().getReport().getTotalReturnPct(),
                best.getExcessReturnPct()));
        return comparison;
    }

    private static Map<StrategyType, Map<String, ?>> defaultContenders() {
        Map<StrategyType, Map<String, ?>> contenders = new EnumMap<>(StrategyType.class);
        for (StrategyType type : StrategyType.values()) {
            if (type != StrategyType.BUY_AND_HOLD) {
                contenders.put(type, Map.of());
            }
        }
        return contenders;
    }

    @Override
    public Signal latestSignal(PriceSeries series, Strategy strategy) {
        Signal signal = backtestEngine.latestSignal(series, strategy);
        log.info("Latest signal for {} on {}: {}", strategy.getName(), series.getSymbol(), signal);
        return signal;
    }
}
