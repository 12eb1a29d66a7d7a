package com.strategylab.optimizer.indicator;

import lombok.Value;

import java.util.List;

/**
 * Identifies one indicator computation: its kind plus positional parameters.
 * Equal specs are computed once per run.
 */
@Value
public class IndicatorSpec {

    IndicatorKind kind;
    List<Double> parameters;

    public static IndicatorSpec sma(int period) {
        return new IndicatorSpec(IndicatorKind.SMA, List.of((double) period));
    }

    public static IndicatorSpec ema(int period) {
        return new IndicatorSpec(IndicatorKind.EMA, List.of((double) period));
    }

    public static IndicatorSpec rsi(int period) {
        return new IndicatorSpec(IndicatorKind.RSI, List.of((double) period));
    }

    public static IndicatorSpec macd(int fast, int slow, int signal) {
        return new IndicatorSpec(IndicatorKind.MACD, List.of((double) fast, (double) slow, (double) signal));
    }

    public static IndicatorSpec bollinger(int period, double numStd) {
        return new IndicatorSpec(IndicatorKind.BOLLINGER, List.of((double) period, numStd));
    }

    public int intParameter(int position) {
        return (int) Math.round(parameters.get(position));
    }

    public double doubleParameter(int position) {
        return parameters.get(position);
    }

    @Override
    public String toString() {
        return kind + parameters.toString();
    }
}
