package com.strategylab.optimizer.service;

import com.strategylab.optimizer.domain.BacktestResult;
import com.strategylab.optimizer.domain.BacktestSettings;
import com.strategylab.optimizer.domain.PriceSeries;
import com.strategylab.optimizer.domain.Signal;
import com.strategylab.optimizer.domain.StrategyComparison;
import com.strategylab.optimizer.domain.strategy.Strategy;
import com.strategylab.optimizer.domain.strategy.StrategyType;

import java.time.Instant;
import java.util.Map;

/**
 * Service interface for single backtest runs and live signal evaluation.
 */
public interface BacktestService {

    /**
     * Run one backtest of the given strategy over the series.
     *
     * @throws com.strategylab.optimizer.domain.InvalidParameterException for invalid parameters or settings
     * @throws com.strategylab.optimizer.domain.EmptySeriesException      for an empty series
     */
    BacktestResult runBacktest(PriceSeries series, StrategyType type, Map<String, ?> parameters,
                               BacktestSettings settings);

    /**
     * Load bars from the configured {@link MarketDataSource} and run one backtest over them.
     */
    BacktestResult runBacktest(String symbol, Instant start, Instant end, StrategyType type,
                               Map<String, ?> parameters, BacktestSettings settings);

    /**
     * Run each strategy on the series and measure it against a buy-and-hold benchmark.
     *
     * @param strategies strategy type to parameters, in report order; null or empty compares every
     *                   non-benchmark type with default parameters
     * @throws com.strategylab.optimizer.domain.InvalidParameterException if any strategy is rejected
     */
    StrategyComparison compareStrategies(PriceSeries series, Map<StrategyType, ? extends Map<String, ?>> strategies,
                                         BacktestSettings settings);

    /**
     * Decision of {@code strategy} on the most recent bar, for live execution.
     */
    Signal latestSignal(PriceSeries series, Strategy strategy);
}
