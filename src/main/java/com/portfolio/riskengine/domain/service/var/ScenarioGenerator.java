package com.portfolio.riskengine.domain.service.var;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.linear.EigenDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.springframework.stereotype.Component;

import java.util.SplittableRandom;

/**
 * Seeded multivariate-normal scenario draws projected onto a portfolio weight vector.
 */
@Slf4j
@Component
public class ScenarioGenerator {

    public double[] generatePortfolioReturns(double[] mean, double[][] covariance, double[] weights,
                                             int simulations, long seed) {
        validate(mean, covariance, weights, simulations);

        double[] loadings = projectedRoot(covariance, weights);
        double drift = 0.0;
        for (int j = 0; j < mean.length; j++) {
            drift += weights[j] * mean[j];
        }

        int factors = loadings.length;
        double[] draws = new double[simulations];
        SplittableRandom rng = new SplittableRandom(seed);
        long startNano = System.nanoTime();

        for (int i = 0; i < simulations; i++) {
            double shock = 0.0;
            for (int k = 0; k < factors; k++) {
                shock += loadings[k] * rng.nextGaussian();
            }
            draws[i] = drift + shock;
        }

        long elapsedMs = (System.nanoTime() - startNano) / 1_000_000;
        log.debug("[MC] scenarios generated: sims={}, assets={}, seed={}, elapsed={}ms",
                simulations, mean.length, seed, elapsedMs);
        return draws;
    }

    /**
     * {@code L^T w} for a covariance root {@code L = V sqrt(D)} from the eigen
     * decomposition. Negative eigenvalues from rounding are clamped to zero.
     */
    double[] projectedRoot(double[][] covariance, double[] weights) {
        RealMatrix cov = MatrixUtils.createRealMatrix(covariance);
        EigenDecomposition eigen = new EigenDecomposition(cov);
        double[] eigenvalues = eigen.getRealEigenvalues();
        RealMatrix v = eigen.getV();

        double[] loadings = new double[eigenvalues.length];
        for (int k = 0; k < eigenvalues.length; k++) {
            double root = Math.sqrt(Math.max(eigenvalues[k], 0.0));
            double dot = 0.0;
            for (int j = 0; j < weights.length; j++) {
                dot += v.getEntry(j, k) * weights[j];
            }
            loadings[k] = root * dot;
        }
        return loadings;
    }

    private void validate(double[] mean, double[][] covariance, double[] weights, int simulations) {
        if (simulations <= 0) {
            throw new IllegalArgumentException("simulations must be positive: " + simulations);
        }
        if (covariance.length != mean.length || weights.length != mean.length) {
            throw new IllegalArgumentException("mean, covariance and weights differ in dimension");
        }
    }
}
