package com.portfolio.riskengine.domain.service.metrics;

import com.portfolio.riskengine.domain.model.ReturnSeries;
import com.portfolio.riskengine.domain.model.RollingSeries;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.DoubleBinaryOperator;

/**
 * Trailing-window volatility and Sharpe ratio for several window sizes. All
 * windows share the dates on which the first window is defined.
 */
@Component
public class RollingStatistics {

    public RollingSeries rollingVolatility(ReturnSeries returns, List<Integer> windows, int annDays) {
        return rolling(returns, windows, "vol",
                (mean, std) -> std * Math.sqrt(annDays));
    }

    public RollingSeries rollingSharpe(ReturnSeries returns, List<Integer> windows, double rfDaily, int annDays) {
        return rolling(returns, windows, "sharpe",
                (mean, std) -> (mean - rfDaily) * annDays / (std * Math.sqrt(annDays)));
    }

    private RollingSeries rolling(ReturnSeries returns, List<Integer> windows, String prefix,
                                  DoubleBinaryOperator statistic) {
        double[] values = returns.values();
        List<LocalDate> allDates = returns.dates();
        Map<String, List<Double>> series = new LinkedHashMap<>();
        if (windows.isEmpty()) {
            return new RollingSeries(List.of(), series);
        }

        List<Integer> reference = new ArrayList<>();
        Double[] first = windowValues(values, windows.get(0), statistic);
        for (int i = 0; i < first.length; i++) {
            if (first[i] != null) {
                reference.add(i);
            }
        }

        List<LocalDate> dates = new ArrayList<>(reference.size());
        for (int i : reference) {
            dates.add(allDates.get(i));
        }

        for (int window : windows) {
            Double[] computed = windowValues(values, window, statistic);
            List<Double> aligned = new ArrayList<>(reference.size());
            for (int i : reference) {
                aligned.add(computed[i]);
            }
            series.put(prefix + "_" + window, aligned);
        }
        return new RollingSeries(dates, series);
    }

    /**
     * Statistic per position over the trailing {@code window} observations; {@code null}
     * until the window is full or where the statistic is not finite.
     */
    private Double[] windowValues(double[] values, int window, DoubleBinaryOperator statistic) {
        Double[] out = new Double[values.length];
        if (window < 2) {
            return out;
        }
        DescriptiveStatistics stats = new DescriptiveStatistics(window);
        for (int i = 0; i < values.length; i++) {
            stats.addValue(values[i]);
            if (stats.getN() == window) {
                double v = statistic.applyAsDouble(stats.getMean(), stats.getStandardDeviation());
                out[i] = Double.isFinite(v) ? v : null;
            }
        }
        return out;
    }
}
