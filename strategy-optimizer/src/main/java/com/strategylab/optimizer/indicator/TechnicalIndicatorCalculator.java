package com.strategylab.optimizer.indicator;

import com.strategylab.optimizer.domain.InvalidParameterException;
import com.strategylab.optimizer.domain.PriceSeries;
import lombok.extern.slf4j.Slf4j;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * In-process indicator implementations over close prices.
 * A window containing a missing close yields {@code NaN} at that index.
 */
@Slf4j
public class TechnicalIndicatorCalculator implements IndicatorCalculator {

    @Override
    public IndicatorSeries compute(PriceSeries series, IndicatorSpec spec) {
        double[] closes = series.closes();
        log.debug("Computing {} over {} bars", spec, closes.length);

        return switch (spec.getKind()) {
            case SMA -> IndicatorSeries.single(spec, sma(closes, period(spec, 0, 1)));
            case EMA -> IndicatorSeries.single(spec, ema(closes, period(spec, 0, 1)));
            case RSI -> IndicatorSeries.single(spec, rsi(closes, period(spec, 0, 1)));
            case MACD -> macd(spec, closes);
            case BOLLINGER -> bollinger(spec, closes);
        };
    }

    /**
     * Arithmetic mean of the last {@code period} values, defined from index {@code period - 1}.
     */
    static double[] sma(double[] values, int period) {
        double[] out = nanArray(values.length);
        for (int i = period - 1; i < values.length; i++) {
            double sum = 0;
            boolean complete = true;
            for (int j = i - period + 1; j <= i; j++) {
                if (Double.isNaN(values[j])) {
                    complete = false;
                    break;
                }
                sum += values[j];
            }
            if (complete) {
                out[i] = sum / period;
            }
        }
        return out;
    }

    /**
     * Exponential moving average seeded with the first complete simple average.
     * A missing input yields {@code NaN} and leaves the running average untouched.
     */
    static double[] ema(double[] values, int period) {
        double[] out = nanArray(values.length);
        double[] seed = sma(values, period);
        double multiplier = 2.0 / (period + 1);
        double value = 0;
        boolean initialized = false;

        for (int i = 0; i < values.length; i++) {
            if (!initialized) {
                if (!Double.isNaN(seed[i])) {
                    value = seed[i];
                    initialized = true;
                    out[i] = value;
                }
            } else if (!Double.isNaN(values[i])) {
                value = (values[i] - value) * multiplier + value;
                out[i] = value;
            }
        }
        return out;
    }

    /**
     * Relative strength index from simple means of the last {@code period} close-to-close deltas.
     */
    static double[] rsi(double[] closes, int period) {
        double[] out = nanArray(closes.length);
        for (int i = period; i < closes.length; i++) {
            double gains = 0;
            double losses = 0;
            boolean complete = true;
            for (int j = i - period + 1; j <= i; j++) {
                double delta = closes[j] - closes[j - 1];
                if (Double.isNaN(delta)) {
                    complete = false;
                    break;
                }
                if (delta > 0) {
                    gains += delta;
                } else {
                    losses -= delta;
                }
            }
            if (!complete || (gains == 0 && losses == 0)) {
                continue;
            }
            if (losses == 0) {
                out[i] = 100.0;
            } else {
                double rs = (gains / period) / (losses / period);
                out[i] = 100.0 - 100.0 / (1.0 + rs);
            }
        }
        return out;
    }

    private IndicatorSeries macd(IndicatorSpec spec, double[] closes) {
        int fast = period(spec, 0, 1);
        int slow = period(spec, 1, 1);
        int signal = period(spec, 2, 1);
        if (fast >= slow) {
            throw new InvalidParameterException("MACD fast period must be below slow period: " + spec);
        }

        double[] fastEma = ema(closes, fast);
        double[] slowEma = ema(closes, slow);
        double[] macdLine = new double[closes.length];
        for (int i = 0; i < closes.length; i++) {
            macdLine[i] = fastEma[i] - slowEma[i];
        }
        double[] signalLine = ema(macdLine, signal);
        double[] histogram = new double[closes.length];
        for (int i = 0; i < closes.length; i++) {
            histogram[i] = macdLine[i] - signalLine[i];
        }

        Map<String, double[]> components = new LinkedHashMap<>();
        components.put(IndicatorSeries.MACD_LINE, macdLine);
        components.put(IndicatorSeries.SIGNAL_LINE, signalLine);
        components.put(IndicatorSeries.HISTOGRAM, histogram);
        return IndicatorSeries.of(spec, components);
    }

    private IndicatorSeries bollinger(IndicatorSpec spec, double[] closes) {
        int period = period(spec, 0, 2);
        double numStd = spec.doubleParameter(1);
        if (!(numStd > 0)) {
            throw new InvalidParameterException("Bollinger band width must be positive: " + spec);
        }

        double[] middle = sma(closes, period);
        double[] upper = nanArray(closes.length);
        double[] lower = nanArray(closes.length);
        for (int i = period - 1; i < closes.length; i++) {
            if (Double.isNaN(middle[i])) {
                continue;
            }
            double sumSquaredDiff = 0;
            for (int j = i - period + 1; j <= i; j++) {
                sumSquaredDiff += (closes[j] - middle[i]) * (closes[j] - middle[i]);
            }
            double stdDev = Math.sqrt(sumSquaredDiff / (period - 1));
            upper[i] = middle[i] + numStd * stdDev;
            lower[i] = middle[i] - numStd * stdDev;
        }

        Map<String, double[]> components = new LinkedHashMap<>();
        components.put(IndicatorSeries.UPPER, upper);
        components.put(IndicatorSeries.MIDDLE, middle);
        components.put(IndicatorSeries.LOWER, lower);
        return IndicatorSeries.of(spec, components);
    }

    private static int period(IndicatorSpec spec, int position, int minimum) {
        if (spec.getParameters().size() <= position) {
            throw new InvalidParameterException("Missing parameter " + position + " for " + spec);
        }
        int period = spec.intParameter(position);
        if (period < minimum) {
            throw new InvalidParameterException("Period must be at least " + minimum + ": " + spec);
        }
        return period;
    }

    private static double[] nanArray(int length) {
        double[] values = new double[length];
        Arrays.fill(values, Double.NaN);
        return values;
    }
}
