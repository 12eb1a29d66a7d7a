package com.strategylab.optimizer.domain;

import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * Calculator for backtest performance metrics. Every method is a pure function of the equity
 * curve and trade ledger.
 */
@Slf4j
public final class PerformanceMetrics {

    /** Reported as profit factor when no trade lost money. */
    public static final BigDecimal PROFIT_FACTOR_NO_LOSSES = new BigDecimal("1000000").setScale(4);

    private static final int SCALE = 4;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private PerformanceMetrics() {
    }

    /**
     * Reduce a finished run into its report.
     */
    public static PerformanceReport report(BigDecimal initialCapital, List<EquityPoint> equityCurve,
                                           List<Trade> trades, BarInterval interval) {
        List<BigDecimal> equity = equityCurve.stream().map(EquityPoint::getEquity).toList();
        BigDecimal finalEquity = equity.isEmpty() ? initialCapital : equity.get(equity.size() - 1);

        BigDecimal totalReturn = calculateTotalReturn(initialCapital, finalEquity);
        BigDecimal maxDrawdown = calculateMaxDrawdown(equity);
        int periodsPerYear = interval.getPeriodsPerYear();

        List<Trade> winners = trades.stream().filter(Trade::isWin).toList();
        List<Trade> losers = trades.stream().filter(Trade::isLoss).toList();

        PerformanceReport report = PerformanceReport.builder()
                .initialCapital(initialCapital.setScale(SCALE, RoundingMode.HALF_UP))
                .finalEquity(finalEquity.setScale(SCALE, RoundingMode.HALF_UP))
                .totalReturnPct(totalReturn)
                .winRate(calculateWinRate(trades))
                .sharpeRatio(calculateSharpeRatio(equity, periodsPerYear))
                .sortinoRatio(calculateSortinoRatio(equity, periodsPerYear))
                .volatilityPct(calculateVolatility(equity, periodsPerYear))
                .maxDrawdownPct(maxDrawdown)
                .calmarRatio(calculateCalmarRatio(totalReturn, maxDrawdown))
                .profitFactor(calculateProfitFactor(trades))
                .numTrades(trades.size())
                .winningTrades(winners.size())
                .losingTrades(losers.size())
                .averageWin(average(winners))
                .averageLoss(average(losers))
                .largestWin(winners.stream().map(Trade::getNetPnl).reduce(BigDecimal::max)
                        .orElse(BigDecimal.ZERO).setScale(SCALE, RoundingMode.HALF_UP))
                .largestLoss(losers.stream().map(Trade::getNetPnl).reduce(BigDecimal::min)
                        .orElse(BigDecimal.ZERO).setScale(SCALE, RoundingMode.HALF_UP))
                .build();

        log.debug("Report - return {}%, sharpe {}, max DD {}%, trades {}, win rate {}, profit factor {}",
                report.getTotalReturnPct(), report.getSharpeRatio(), report.getMaxDrawdownPct(),
                report.getNumTrades(), report.getWinRate(), report.getProfitFactor());
        return report;
    }

    /**
     * Calculate total return percentage: {@code (final / initial - 1) * 100}.
     */
    public static BigDecimal calculateTotalReturn(BigDecimal initialCapital, BigDecimal finalValue) {
        if (initialCapital.signum() == 0) {
            return BigDecimal.ZERO.setScale(SCALE);
        }

        return finalValue.subtract(initialCapital)
                .multiply(HUNDRED)
                .divide(initialCapital, SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Calculate the annualised Sharpe ratio with a zero risk-free rate, using the population
     * standard deviation of per-bar returns.
     */
    public static BigDecimal calculateSharpeRatio(List<BigDecimal> equity, int periodsPerYear) {
        double[] returns = returns(equity);
        if (returns.length == 0) {
            return BigDecimal.ZERO.setScale(SCALE);
        }

        double mean = mean(returns);
        double stdDev = Math.sqrt(populationVariance(returns, mean));
        if (stdDev == 0 || !Double.isFinite(stdDev)) {
            return BigDecimal.ZERO.setScale(SCALE);
        }

        return toScaled(mean / stdDev * Math.sqrt(periodsPerYear));
    }

    /**
     * Like Sharpe, but only returns below zero count towards the deviation.
     */
    public static BigDecimal calculateSortinoRatio(List<BigDecimal> equity, int periodsPerYear) {
        double[] returns = returns(equity);
        if (returns.length == 0) {
            return BigDecimal.ZERO.setScale(SCALE);
        }

        double downsideSquares = 0;
        for (double r : returns) {
            if (r < 0) {
                downsideSquares += r * r;
            }
        }
        double downsideDeviation = Math.sqrt(downsideSquares / returns.length);
        if (downsideDeviation == 0) {
            return BigDecimal.ZERO.setScale(SCALE);
        }

        return toScaled(mean(returns) / downsideDeviation * Math.sqrt(periodsPerYear));
    }

    /**
     * Annualised volatility of per-bar returns, in percent.
     */
    public static BigDecimal calculateVolatility(List<BigDecimal> equity, int periodsPerYear) {
        double[] returns = returns(equity);
        if (returns.length == 0) {
            return BigDecimal.ZERO.setScale(SCALE);
        }

        double stdDev = Math.sqrt(populationVariance(returns, mean(returns)));
        return toScaled(stdDev * Math.sqrt(periodsPerYear) * 100);
    }

    /**
     * Calculate maximum drawdown percentage, reported as a positive number in [0, 100].
     */
    public static BigDecimal calculateMaxDrawdown(List<BigDecimal> equity) {
        BigDecimal maxDrawdown = BigDecimal.ZERO;
        if (equity.isEmpty()) {
            return maxDrawdown.setScale(SCALE);
        }

        BigDecimal peak = equity.get(0);
        for (BigDecimal value : equity) {
            if (value.compareTo(peak) > 0) {
                peak = value;
            }

            if (peak.signum() > 0) {
                BigDecimal drawdown = peak.subtract(value)
                        .multiply(HUNDRED)
                        .divide(peak, MathContext.DECIMAL64);

                if (drawdown.compareTo(maxDrawdown) > 0) {
                    maxDrawdown = drawdown;
                }
            }
        }

        return maxDrawdown.setScale(SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Calculate win rate: share of trades with a positive net P&L, as a fraction.
     */
    public static BigDecimal calculateWinRate(List<Trade> trades) {
        if (trades.isEmpty()) {
            return BigDecimal.ZERO.setScale(SCALE);
        }

        long winningTrades = trades.stream().filter(Trade::isWin).count();
        return BigDecimal.valueOf(winningTrades)
                .divide(BigDecimal.valueOf(trades.size()), SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Gross winning P&L over the magnitude of gross losing P&L.
     *
     * @return {@link #PROFIT_FACTOR_NO_LOSSES} when nothing lost money, zero when only losers exist
     */
    public static BigDecimal calculateProfitFactor(List<Trade> trades) {
        BigDecimal grossProfit = BigDecimal.ZERO;
        BigDecimal grossLoss = BigDecimal.ZERO;
        for (Trade trade : trades) {
            if (trade.isWin()) {
                grossProfit = grossProfit.add(trade.getNetPnl());
            } else if (trade.isLoss()) {
                grossLoss = grossLoss.add(trade.getNetPnl().abs());
            }
        }

        if (grossLoss.signum() == 0) {
            return PROFIT_FACTOR_NO_LOSSES;
        }
        return grossProfit.divide(grossLoss, SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Total return over maximum drawdown; zero when the curve never fell.
     */
    public static BigDecimal calculateCalmarRatio(BigDecimal totalReturnPct, BigDecimal maxDrawdownPct) {
        if (maxDrawdownPct.signum() == 0) {
            return BigDecimal.ZERO.setScale(SCALE);
        }
        return totalReturnPct.divide(maxDrawdownPct, SCALE, RoundingMode.HALF_UP);
    }

    private static BigDecimal average(List<Trade> trades) {
        if (trades.isEmpty()) {
            return BigDecimal.ZERO.setScale(SCALE);
        }
        BigDecimal sum = trades.stream().map(Trade::getNetPnl).reduce(BigDecimal.ZERO, BigDecimal::add);
        return sum.divide(BigDecimal.valueOf(trades.size()), SCALE, RoundingMode.HALF_UP);
    }

    // Per-bar simple returns between consecutive equity points with a positive base.
    private static double[] returns(List<BigDecimal> equity) {
        if (equity.size() < 2) {
            return new double[0];
        }

        List<Double> returns = new ArrayList<>();
        for (int i = 1; i < equity.size(); i++) {
            BigDecimal previous = equity.get(i - 1);
            if (previous.signum() > 0) {
                returns.add(equity.get(i).subtract(previous)
                        .divide(previous, MathContext.DECIMAL64)
                        .doubleValue());
            }
        }
        return returns.stream().mapToDouble(Double::doubleValue).toArray();
    }

    private static double mean(double[] values) {
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    private static double populationVariance(double[] values, double mean) {
        double sumSquaredDiff = 0;
        for (double v : values) {
            sumSquaredDiff += (v - mean) * (v - mean);
        }
        return sumSquaredDiff / values.length;
    }

    private static BigDecimal toScaled(double value) {
        if (!Double.isFinite(value)) {
            return BigDecimal.ZERO.setScale(SCALE);
        }
        return BigDecimal.valueOf(value).setScale(SCALE, RoundingMode.HALF_UP);
    }
}
