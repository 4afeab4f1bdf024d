package com.portfolio.riskengine.domain.service.var;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Moment-based tail diagnostics of a return sample.
 */
@Slf4j
@Component
public class TailEstimator {

    static final double NU_FLOOR = 3.0;
    static final double NU_CEILING = 30.0;
    static final int MIN_OBSERVATIONS = 30;

    /**
     * Method-of-moments Student-t degrees of freedom from excess kurtosis,
     * {@code nu = 6/kurtosis + 4}, clamped to [3, 30]. Short or thin-tailed
     * samples get the ceiling.
     */
    public double estimateDegreesOfFreedom(double[] returns) {
        if (returns.length < MIN_OBSERVATIONS) {
            log.debug("[TailEstimator] short sample: n={}, fallback nu={}", returns.length, NU_CEILING);
            return NU_CEILING;
        }

        double kurtosis = excessKurtosis(returns);
        double nu = kurtosis <= 0 ? NU_CEILING : 6.0 / kurtosis + 4.0;
        nu = Math.max(NU_FLOOR, Math.min(NU_CEILING, nu));

        log.debug("[TailEstimator] n={}, kurtosis={}, nu={}", returns.length, kurtosis, nu);
        return nu;
    }

    /** Biased (population) excess kurtosis; 0 for a constant sample. */
    public double excessKurtosis(double[] data) {
        int n = data.length;
        if (n == 0) return Double.NaN;
        double mean = mean(data);

        double m2 = 0, m4 = 0;
        for (double v : data) {
            double d = v - mean;
            double d2 = d * d;
            m2 += d2;
            m4 += d2 * d2;
        }
        m2 /= n;
        m4 /= n;

        if (m2 == 0) return 0;
        return (m4 / (m2 * m2)) - 3.0;
    }

    /** Biased (population) skewness; 0 for a constant sample. */
    public double skewness(double[] data) {
        int n = data.length;
        if (n == 0) return Double.NaN;
        double mean = mean(data);

        double m2 = 0, m3 = 0;
        for (double v : data) {
            double d = v - mean;
            m2 += d * d;
            m3 += d * d * d;
        }
        m2 /= n;
        m3 /= n;

        if (m2 == 0) return 0;
        return m3 / Math.pow(m2, 1.5);
    }

    private double mean(double[] data) {
        double sum = 0;
        for (double v : data) sum += v;
        return sum / data.length;
    }
}
