package com.portfolio.riskengine.domain.service.metrics;

import com.portfolio.riskengine.domain.model.ReturnType;
import org.springframework.stereotype.Component;

@Component
public class DrawdownCalculator {

    /** Growth of one unit; log returns are converted to simple growth first. */
    public double[] cumulative(double[] returns, ReturnType returnType) {
        double[] out = new double[returns.length];
        double growth = 1.0;
        for (int i = 0; i < returns.length; i++) {
            double simple = returnType == ReturnType.LOG ? Math.exp(returns[i]) - 1.0 : returns[i];
            growth *= 1.0 + simple;
            out[i] = growth;
        }
        return out;
    }

    /** {@code cum / running_max - 1}; non-positive. */
    public double[] drawdown(double[] returns, ReturnType returnType) {
        double[] cum = cumulative(returns, returnType);
        double[] out = new double[cum.length];
        double peak = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < cum.length; i++) {
            peak = Math.max(peak, cum[i]);
            out[i] = cum[i] / peak - 1.0;
        }
        return out;
    }

    public double maxDrawdown(double[] drawdown) {
        double min = 0.0;
        for (double d : drawdown) {
            min = Math.min(min, d);
        }
        return Math.abs(min);
    }

    /** Longest run of consecutive observations spent below a prior peak. */
    public int duration(double[] drawdown) {
        int longest = 0;
        int current = 0;
        for (double d : drawdown) {
            if (Math.abs(d) > 0) {
                current++;
                longest = Math.max(longest, current);
            } else {
                current = 0;
            }
        }
        return longest;
    }
}
