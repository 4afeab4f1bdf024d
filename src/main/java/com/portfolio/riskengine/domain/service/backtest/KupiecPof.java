package com.portfolio.riskengine.domain.service.backtest;

import lombok.RequiredArgsConstructor;
import org.apache.commons.math3.distribution.ChiSquaredDistribution;
import org.springframework.stereotype.Component;

/**
 * Kupiec proportion-of-failures test of an observed breach count against the rate
 * implied by the VaR confidence. Rates are clamped to [eps, 1 - eps].
 */
@Component
@RequiredArgsConstructor
public class KupiecPof {

    private static final ChiSquaredDistribution CHI_SQUARED_1 = new ChiSquaredDistribution(null, 1.0);

    private final BacktestProperties properties;

    public KupiecResult test(int observations, int exceptions, double confidence) {
        if (observations <= 0) {
            return KupiecResult.UNDEFINED;
        }
        double eps = properties.getKupiecEpsilon();
        double expected = clamp(1.0 - confidence, eps);
        double observed = clamp((double) exceptions / observations, eps);
        int x = exceptions;
        int n = observations;

        double lr = -2.0 * (x * Math.log(expected) + (n - x) * Math.log(1.0 - expected)
                - x * Math.log(observed) - (n - x) * Math.log(1.0 - observed));
        if (!Double.isFinite(lr)) {
            return KupiecResult.UNDEFINED;
        }
        double pValue = 1.0 - CHI_SQUARED_1.cumulativeProbability(Math.max(lr, 0.0));
        return new KupiecResult(lr, pValue);
    }

    private static double clamp(double rate, double eps) {
        return Math.max(eps, Math.min(1.0 - eps, rate));
    }
}
