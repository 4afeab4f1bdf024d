package com.portfolio.riskengine.domain.service.metrics;

import com.portfolio.riskengine.domain.model.ReturnType;
import org.apache.commons.math3.stat.StatUtils;
import org.springframework.stereotype.Component;

/**
 * Annualized return and risk-adjusted ratios of a daily return sample.
 */
@Component
public class PerformanceRatios {

    public double dailyRiskFree(double annualRate, ReturnType returnType, int annDays) {
        if (returnType == ReturnType.LOG) {
            return annualRate / annDays;
        }
        return Math.pow(1.0 + annualRate, 1.0 / annDays) - 1.0;
    }

    /**
     * Log returns: arithmetic mean times {@code annDays}. Simple returns: compound
     * annual growth, floored at -1 when cumulative growth is non-positive.
     */
    public double annualizedReturn(double[] returns, ReturnType returnType, int annDays) {
        int n = returns.length;
        if (n == 0) {
            return 0.0;
        }
        if (returnType == ReturnType.LOG) {
            return StatUtils.mean(returns) * annDays;
        }
        double total = 1.0;
        for (double r : returns) {
            total *= 1.0 + r;
        }
        if (total <= 0) {
            return -1.0;
        }
        return Math.pow(total, (double) annDays / n) - 1.0;
    }

    public double annualizedVolatility(double[] returns, int annDays) {
        return sampleStd(returns) * Math.sqrt(annDays);
    }

    public double sharpe(double[] returns, double rfDaily, int annDays) {
        double std = sampleStd(returns);
        if (returns.length == 0 || std == 0) {
            return 0.0;
        }
        double excessAnn = (StatUtils.mean(returns) - rfDaily) * annDays;
        double volAnn = std * Math.sqrt(annDays);
        return volAnn > 0 ? excessAnn / volAnn : 0.0;
    }

    /**
     * Excess return over downside deviation. A zero downside deviation yields
     * positive infinity when the excess return is positive, else 0.
     */
    public double sortino(double[] returns, double rfDaily, int annDays) {
        if (returns.length == 0) {
            return 0.0;
        }
        double excessAnn = (StatUtils.mean(returns) - rfDaily) * annDays;
        double downsideAnn = downsideDeviation(returns, rfDaily, annDays);
        if (downsideAnn == 0) {
            return excessAnn > 0 ? Double.POSITIVE_INFINITY : 0.0;
        }
        return excessAnn / downsideAnn;
    }

    /** Sample std of excess returns clipped at zero from above, annualized. */
    public double downsideDeviation(double[] returns, double rfDaily, int annDays) {
        double[] downside = new double[returns.length];
        for (int i = 0; i < returns.length; i++) {
            downside[i] = Math.min(returns[i] - rfDaily, 0.0);
        }
        return sampleStd(downside) * Math.sqrt(annDays);
    }

    /** Bias-corrected standard deviation; NaN below two observations. */
    public static double sampleStd(double[] values) {
        if (values.length < 2) {
            return Double.NaN;
        }
        return Math.sqrt(StatUtils.variance(values));
    }
}
