package com.portfolio.riskengine.domain.service.var;

import com.portfolio.riskengine.domain.model.DriftMode;
import com.portfolio.riskengine.domain.model.ParametricDistribution;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.distribution.TDistribution;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.springframework.stereotype.Component;

/**
 * Closed-form VaR and expected shortfall under a fitted Normal or Student-t law.
 * The sample is taken to be already at the target horizon.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ParametricVarModel {

    static final String ZERO_VOLATILITY = "Return volatility is zero; VaR set to 0.";
    static final String UNSTABLE_DF = "Student-t degrees of freedom <= 2; ES may be unstable.";
    static final String FIT_FALLBACK = "Student-t fit did not converge; method-of-moments estimate used.";

    private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution(null, 0.0, 1.0);

    private final StudentTFitter studentTFitter;

    public VarEstimate estimate(double[] returns, double confidence, ParametricSpec spec) {
        double alpha = 1.0 - confidence;
        double mu = spec.drift() == DriftMode.INCLUDE ? new Mean().evaluate(returns) : 0.0;
        double sigma = returns.length > 1 ? new StandardDeviation().evaluate(returns) : 0.0;

        if (!(sigma > 0)) {
            log.warn("[VaR] parametric: zero volatility, n={}", returns.length);
            return VarEstimate.builder()
                    .var(0.0)
                    .cvar(0.0)
                    .mu(mu)
                    .sigma(sigma)
                    .warning(ZERO_VOLATILITY)
                    .build();
        }

        if (spec.distribution() == ParametricDistribution.STUDENT_T) {
            return studentT(returns, alpha);
        }

        double z = STANDARD_NORMAL.inverseCumulativeProbability(alpha);
        double var = -(mu + sigma * z);
        double cvar = -(mu - sigma * STANDARD_NORMAL.density(z) / alpha);
        return VarEstimate.builder()
                .var(var)
                .cvar(cvar)
                .mu(mu)
                .sigma(sigma)
                .build();
    }

    private VarEstimate studentT(double[] returns, double alpha) {
        StudentTFit fit = studentTFitter.fit(returns);
        double df = fit.df();
        TDistribution t = new TDistribution(null, df);
        double z = t.inverseCumulativeProbability(alpha);

        VarEstimate.VarEstimateBuilder builder = VarEstimate.builder()
                .var(-(fit.loc() + fit.scale() * z))
                .cvar(-(fit.loc() - fit.scale() * expectedShortfallMultiplier(t, df, z, alpha)))
                .df(df)
                .loc(fit.loc())
                .scale(fit.scale());

        if (!fit.converged()) {
            builder.warning(FIT_FALLBACK);
        }
        if (df <= 2.0) {
            log.warn("[VaR] student-t: df={} gives unstable expected shortfall", df);
            builder.warning(UNSTABLE_DF);
        }
        return builder.build();
    }

    static double expectedShortfallMultiplier(TDistribution t, double df, double z, double alpha) {
        return t.density(z) * (df + z * z) / ((df - 1.0) * alpha);
    }
}
