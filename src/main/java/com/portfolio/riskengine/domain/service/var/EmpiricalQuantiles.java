package com.portfolio.riskengine.domain.service.var;

import com.portfolio.riskengine.shared.exception.InsufficientDataException;
import com.portfolio.riskengine.shared.exception.InvalidParameterException;

import java.util.Arrays;
import java.util.Comparator;
import java.util.OptionalDouble;
import java.util.stream.IntStream;

/**
 * Empirical quantile and tail-mean estimators over optionally weighted samples.
 *
 * <p>The quantile interpolates linearly between sorted values placed at knots
 * {@code x_i = C_(i-1) / (S - w_last)}, where {@code C_(i-1)} is the weight sorted
 * strictly below value {@code i}, {@code S} the total weight and {@code w_last} the
 * weight of the largest value. Equal weights give knots {@code i/(n-1)}, the usual
 * linear-interpolation quantile. Negative weights count as zero; a non-positive
 * total falls back to equal weights.
 */
public final class EmpiricalQuantiles {

    private EmpiricalQuantiles() {
    }

    public static double quantile(double[] values, double q) {
        return quantile(values, null, q);
    }

    public static double quantile(double[] values, double[] weights, double q) {
        if (values == null || values.length == 0) {
            throw new InsufficientDataException("Cannot compute quantile on empty sample");
        }
        if (!(q >= 0.0 && q <= 1.0)) {
            throw new InvalidParameterException("Quantile must be in [0, 1]: " + q);
        }
        int n = values.length;
        if (n == 1) {
            return values[0];
        }
        if (weights == null) {
            double[] sorted = values.clone();
            Arrays.sort(sorted);
            double h = (n - 1) * q;
            int lo = (int) Math.floor(h);
            if (lo >= n - 1) {
                return sorted[n - 1];
            }
            return sorted[lo] + (h - lo) * (sorted[lo + 1] - sorted[lo]);
        }

        double[] w = effectiveWeights(values, weights);
        Integer[] order = IntStream.range(0, n).boxed().toArray(Integer[]::new);
        Arrays.sort(order, Comparator.comparingDouble(i -> values[i]));

        double total = 0.0;
        for (double v : w) {
            total += v;
        }
        double denominator = total - w[order[n - 1]];
        if (denominator <= 0.0) {
            return values[order[n - 1]];
        }

        double[] knots = new double[n];
        double cumulative = 0.0;
        for (int k = 0; k < n; k++) {
            knots[k] = cumulative / denominator;
            cumulative += w[order[k]];
        }

        if (q <= knots[0]) {
            return values[order[0]];
        }
        for (int k = 0; k < n - 1; k++) {
            if (q >= knots[k] && q < knots[k + 1]) {
                double t = (q - knots[k]) / (knots[k + 1] - knots[k]);
                double lo = values[order[k]];
                double hi = values[order[k + 1]];
                return lo + t * (hi - lo);
            }
        }
        return values[order[n - 1]];
    }

    /**
     * Weighted mean of the observations at or below {@code threshold}; empty when
     * no observation (or no positive weight) falls in the tail.
     */
    public static OptionalDouble tailMean(double[] values, double[] weights, double threshold) {
        double[] w = weights != null ? effectiveWeights(values, weights) : null;
        double sum = 0.0;
        double weightSum = 0.0;
        for (int i = 0; i < values.length; i++) {
            if (values[i] <= threshold) {
                double wi = w != null ? w[i] : 1.0;
                sum += wi * values[i];
                weightSum += wi;
            }
        }
        if (weightSum <= 0.0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(sum / weightSum);
    }

    /**
     * Exponentially decaying observation weights, oldest first. The most recent
     * observation gets {@code (1-lambda)}, the one before {@code (1-lambda)*lambda},
     * and so on; the result is normalized to sum to one.
     */
    public static double[] ewmaWeights(int n, double lambda) {
        double[] weights = new double[n];
        double sum = 0.0;
        double decay = 1.0 - lambda;
        for (int age = 0; age < n; age++) {
            weights[n - 1 - age] = decay;
            sum += decay;
            decay *= lambda;
        }
        if (sum > 0.0) {
            for (int i = 0; i < n; i++) {
                weights[i] /= sum;
            }
        }
        return weights;
    }

    private static double[] effectiveWeights(double[] values, double[] weights) {
        double[] w = new double[values.length];
        if (weights == null || weights.length != values.length) {
            Arrays.fill(w, 1.0);
            return w;
        }
        double sum = 0.0;
        for (int i = 0; i < w.length; i++) {
            w[i] = Double.isFinite(weights[i]) ? Math.max(weights[i], 0.0) : 0.0;
            sum += w[i];
        }
        if (sum <= 0.0) {
            Arrays.fill(w, 1.0);
        }
        return w;
    }
}
