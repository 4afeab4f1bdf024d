package com.portfolio.riskengine.domain.service.var;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.exception.TooManyEvaluationsException;
import org.apache.commons.math3.optim.InitialGuess;
import org.apache.commons.math3.optim.MaxEval;
import org.apache.commons.math3.optim.PointValuePair;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.apache.commons.math3.optim.nonlinear.scalar.ObjectiveFunction;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.NelderMeadSimplex;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.SimplexOptimizer;
import org.apache.commons.math3.special.Gamma;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.springframework.stereotype.Component;

/**
 * Maximum-likelihood fit of a location/scale Student-t distribution. The search runs
 * over (loc, ln scale, ln df) with a Nelder-Mead simplex and starts from the sample
 * mean, standard deviation and the kurtosis-implied degrees of freedom.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StudentTFitter {

    static final double DF_MIN = 0.2;
    static final double DF_MAX = 1000.0;
    static final int MAX_EVALUATIONS = 20_000;

    private final TailEstimator tailEstimator;

    public StudentTFit fit(double[] returns) {
        double mean = new Mean().evaluate(returns);
        double sd = new StandardDeviation().evaluate(returns);
        double df0 = tailEstimator.estimateDegreesOfFreedom(returns);
        double scale0 = sd * Math.sqrt((df0 - 2.0) / df0);

        if (!(scale0 > 0)) {
            return new StudentTFit(df0, mean, 0.0, false);
        }

        SimplexOptimizer optimizer = new SimplexOptimizer(1e-10, 1e-12);
        try {
            PointValuePair optimum = optimizer.optimize(
                    new MaxEval(MAX_EVALUATIONS),
                    new ObjectiveFunction(p -> negativeLogLikelihood(returns, p[0], Math.exp(p[1]), Math.exp(p[2]))),
                    GoalType.MINIMIZE,
                    new InitialGuess(new double[]{mean, Math.log(scale0), Math.log(df0)}),
                    new NelderMeadSimplex(new double[]{0.1 * sd, 0.1, 0.25}));

            double[] p = optimum.getPoint();
            StudentTFit fit = new StudentTFit(Math.exp(p[2]), p[0], Math.exp(p[1]), true);
            log.debug("[StudentT] fitted: n={}, df={}, loc={}, scale={}, evaluations={}",
                    returns.length, fit.df(), fit.loc(), fit.scale(), optimizer.getEvaluations());
            return fit;
        } catch (TooManyEvaluationsException e) {
            log.warn("[StudentT] fit did not converge after {} evaluations, using moments: df={}",
                    MAX_EVALUATIONS, df0);
            return new StudentTFit(df0, mean, scale0, false);
        }
    }

    static double negativeLogLikelihood(double[] x, double loc, double scale, double df) {
        if (!(df >= DF_MIN && df <= DF_MAX) || !(scale > 0) || !Double.isFinite(loc)) {
            return Double.POSITIVE_INFINITY;
        }
        double constant = Gamma.logGamma((df + 1.0) / 2.0) - Gamma.logGamma(df / 2.0)
                - 0.5 * Math.log(df * Math.PI) - Math.log(scale);
        double sum = 0.0;
        for (double v : x) {
            double z = (v - loc) / scale;
            sum += constant - (df + 1.0) / 2.0 * Math.log1p(z * z / df);
        }
        return -sum;
    }
}
