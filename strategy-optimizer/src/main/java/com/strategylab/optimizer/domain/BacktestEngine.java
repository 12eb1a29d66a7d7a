package com.strategylab.optimizer.domain;

import com.strategylab.optimizer.domain.strategy.Strategy;
import com.strategylab.optimizer.domain.strategy.StrategyContext;
import com.strategylab.optimizer.indicator.IndicatorCalculator;
import com.strategylab.optimizer.indicator.IndicatorSeries;
import com.strategylab.optimizer.indicator.IndicatorSpec;
import com.strategylab.optimizer.indicator.TechnicalIndicatorCalculator;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.HashMap;
import java.util.Map;

/**
 * Core backtesting engine that replays a price series through a strategy.
 * Each run owns a fresh {@link Portfolio}; the engine itself holds no run state and is safe to
 * share between threads.
 */
@Slf4j
public class BacktestEngine {

    private static final int FRACTIONAL_SCALE = 8;

    private final IndicatorCalculator indicatorCalculator;

    public BacktestEngine() {
        this(new TechnicalIndicatorCalculator());
    }

    public BacktestEngine(IndicatorCalculator indicatorCalculator) {
        this.indicatorCalculator = indicatorCalculator;
    }

    /**
     * Run a backtest over the whole series.
     */
    public BacktestResult run(PriceSeries series, Strategy strategy, BacktestSettings settings) {
        return run(series, strategy, settings, 0);
    }

    /**
     * Run a backtest where bars before {@code tradingStart} only warm up indicators. Trading and
     * the equity curve begin at {@code tradingStart}.
     *
     * @throws InvalidParameterException if the settings or the start index are invalid
     * @throws EmptySeriesException if there is nothing to trade, or the series is shorter than the
     *                              strategy warm-up while {@code requireFullWarmup} is set
     */
    public BacktestResult run(PriceSeries series, Strategy strategy, BacktestSettings settings, int tradingStart) {
        settings.validate();
        if (series == null || series.isEmpty()) {
            throw new EmptySeriesException("Cannot backtest an empty price series");
        }
        if (tradingStart < 0) {
            throw new InvalidParameterException("Trading start must not be negative: " + tradingStart);
        }
        if (tradingStart >= series.size()) {
            throw new EmptySeriesException("Trading window is empty: start " + tradingStart
                    + " with " + series.size() + " bars");
        }
        if (settings.isRequireFullWarmup() && series.size() < strategy.minimumBars()) {
            throw new EmptySeriesException("Series of " + series.size() + " bars is shorter than the "
                    + strategy.minimumBars() + " bars " + strategy.getName() + " needs");
        }

        long startTime = System.currentTimeMillis();
        log.info("Starting backtest - Strategy: {}, Symbol: {}, Bars: {}, Trading from: {}",
                strategy.getName(), series.getSymbol(), series.size(), tradingStart);

        Map<IndicatorSpec, IndicatorSeries> indicators = computeIndicators(series, strategy);
        Portfolio portfolio = new Portfolio(settings.getInitialCapital());
        BigDecimal lastValidClose = null;
        Signal pending = Signal.HOLD;
        int lastIndex = series.size() - 1;

        // Process each bar in chronological order
        for (int i = tradingStart; i <= lastIndex; i++) {
            Bar bar = series.get(i);

            if (pending != Signal.HOLD) {
                execute(portfolio, pending, bar, bar.getOpen(), settings);
                pending = Signal.HOLD;
            }

            BigDecimal close = bar.getClose();
            if (close != null) {
                lastValidClose = close;
            } else {
                log.debug("Gap at bar {} ({}), holding", i, bar.getTimestamp());
            }

            if (!strategy.allowsRiskExits() || !applyRiskExit(portfolio, bar, settings)) {
                Signal signal = close != null
                        ? strategy.generateSignal(new StrategyContext(series, indicators, i))
                        : Signal.HOLD;

                if (settings.getExecutionTiming() == ExecutionTiming.CLOSE) {
                    execute(portfolio, signal, bar, close, settings);
                } else if (i < lastIndex) {
                    pending = signal;
                } else if (signal != Signal.HOLD) {
                    log.debug("Dropping {} on the final bar, no next open to fill at", signal);
                }
            }

            if (i == lastIndex && portfolio.isLong()) {
                Trade forced = portfolio.sell(bar.getTimestamp(), lastValidClose, settings.getFeeRate(),
                        ExitReason.END_OF_DATA);
                log.debug("Forced close at end of data: {}", forced);
            }

            portfolio.recordEquity(bar.getTimestamp(), lastValidClose);
        }

        PerformanceReport report = PerformanceMetrics.report(settings.getInitialCapital(),
                portfolio.getEquityCurve(), portfolio.getTrades(), series.getInterval());
        long executionTime = System.currentTimeMillis() - startTime;

        log.info("Backtest completed - Strategy: {}, Total Return: {}%, Sharpe: {}, Max DD: {}%, "
                        + "Trades: {}, Win Rate: {}, Time: {}ms",
                strategy.getName(), report.getTotalReturnPct(), report.getSharpeRatio(),
                report.getMaxDrawdownPct(), report.getNumTrades(), report.getWinRate(), executionTime);

        return BacktestResult.builder()
                .strategyName(strategy.getName())
                .symbol(series.getSymbol())
                .report(report)
                .trades(portfolio.getTrades())
                .equityCurve(portfolio.getEquityCurve())
                .tradingStart(tradingStart)
                .executionTimeMs(executionTime)
                .build();
    }

    /**
     * Evaluate the strategy on the most recent bar of {@code series}, as a live feed would.
     */
    public Signal latestSignal(PriceSeries series, Strategy strategy) {
        if (series == null || series.isEmpty()) {
            throw new EmptySeriesException("Cannot evaluate a signal on an empty price series");
        }
        int lastIndex = series.size() - 1;
        if (series.get(lastIndex).getClose() == null) {
            return Signal.HOLD;
        }
        return strategy.generateSignal(new StrategyContext(series, computeIndicators(series, strategy), lastIndex));
    }

    private Map<IndicatorSpec, IndicatorSeries> computeIndicators(PriceSeries series, Strategy strategy) {
        Map<IndicatorSpec, IndicatorSeries> indicators = new HashMap<>();
        for (IndicatorSpec spec : strategy.requiredIndicators()) {
            indicators.computeIfAbsent(spec, s -> indicatorCalculator.compute(series, s));
        }
        return indicators;
    }

    /**
     * Close a long position whose close breached the stop-loss or take-profit level.
     *
     * @return true when the position was closed, in which case the bar's signal is ignored
     */
    private boolean applyRiskExit(Portfolio portfolio, Bar bar, BacktestSettings settings) {
        BigDecimal close = bar.getClose();
        if (!portfolio.isLong() || close == null
                || (settings.getStopLossPct() == null && settings.getTakeProfitPct() == null)) {
            return false;
        }

        BigDecimal entry = portfolio.getPosition().getEntryPrice();
        BigDecimal change = close.subtract(entry).divide(entry, MathContext.DECIMAL64);

        ExitReason reason = null;
        if (settings.getStopLossPct() != null && change.compareTo(settings.getStopLossPct().negate()) <= 0) {
            reason = ExitReason.STOP_LOSS;
        } else if (settings.getTakeProfitPct() != null && change.compareTo(settings.getTakeProfitPct()) >= 0) {
            reason = ExitReason.TAKE_PROFIT;
        }
        if (reason == null) {
            return false;
        }

        Trade trade = portfolio.sell(bar.getTimestamp(), close, settings.getFeeRate(), reason);
        log.debug("{} at {}: {}", reason, bar.getTimestamp(), trade);
        return true;
    }

    private void execute(Portfolio portfolio, Signal signal, Bar bar, BigDecimal price, BacktestSettings settings) {
        if (signal == Signal.HOLD) {
            return;
        }
        if (price == null) {
            log.debug("No price at {}, {} left unfilled", bar.getTimestamp(), signal);
            return;
        }

        if (signal == Signal.BUY && !portfolio.isLong()) {
            BigDecimal quantity = quantity(portfolio.getCash(), price, settings);
            if (quantity.signum() <= 0) {
                log.debug("Insufficient capital to buy at {} on {} (cash {})", price, bar.getTimestamp(),
                        portfolio.getCash());
                return;
            }
            if (portfolio.buy(bar.getTimestamp(), price, quantity, settings.getFeeRate())) {
                log.debug("BUY {} at {} on {}", quantity, price, bar.getTimestamp());
            }
        } else if (signal == Signal.SELL && portfolio.isLong()) {
            Trade trade = portfolio.sell(bar.getTimestamp(), price, settings.getFeeRate(), ExitReason.SIGNAL);
            log.debug("SELL {} at {} on {}, net P&L {}", trade.getQuantity(), price, bar.getTimestamp(),
                    trade.getNetPnl());
        }
    }

    /**
     * Units affordable with the configured share of cash, so that notional plus entry fee never
     * exceeds cash.
     */
    static BigDecimal quantity(BigDecimal cash, BigDecimal price, BacktestSettings settings) {
        if (price.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        BigDecimal allocated = cash.multiply(settings.getPositionFraction());
        BigDecimal unitCost = price.multiply(BigDecimal.ONE.add(settings.getFeeRate()));
        int scale = settings.getPositionSizing() == PositionSizing.WHOLE_UNITS ? 0 : FRACTIONAL_SCALE;
        return allocated.divide(unitCost, scale, RoundingMode.DOWN);
    }
}
