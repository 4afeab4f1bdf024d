package com.portfolio.riskengine.domain.service.metrics;

import com.portfolio.riskengine.domain.model.AssetReturnMatrix;
import com.portfolio.riskengine.domain.model.CorrelationMatrix;
import com.portfolio.riskengine.domain.model.RiskContribution;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Correlation and volatility decomposition over a complete (gap-free) asset sample.
 */
@Component
public class RiskContributionCalculator {

    public CorrelationMatrix correlation(AssetReturnMatrix clean) {
        int assets = clean.columnCount();
        if (assets == 0) {
            return new CorrelationMatrix(clean.symbols(), List.of());
        }
        if (assets == 1) {
            return new CorrelationMatrix(clean.symbols(), List.of(List.of(1.0)));
        }

        List<List<Double>> rows = new ArrayList<>(assets);
        if (clean.rowCount() < 2) {
            for (int i = 0; i < assets; i++) {
                List<Double> row = new ArrayList<>(assets);
                for (int j = 0; j < assets; j++) {
                    row.add(null);
                }
                rows.add(row);
            }
            return new CorrelationMatrix(clean.symbols(), rows);
        }

        RealMatrix corr = new PearsonsCorrelation(clean.toArray()).getCorrelationMatrix();
        for (int i = 0; i < assets; i++) {
            List<Double> row = new ArrayList<>(assets);
            for (int j = 0; j < assets; j++) {
                double v = corr.getEntry(i, j);
                row.add(Double.isFinite(v) ? v : null);
            }
            rows.add(row);
        }
        return new CorrelationMatrix(clean.symbols(), rows);
    }

    /**
     * Marginal, component and percentage contribution to annualized volatility.
     * All contributions are zero when the portfolio variance is not positive.
     */
    public List<RiskContribution> contributions(AssetReturnMatrix clean, Map<String, Double> weights, int annDays) {
        int assets = clean.columnCount();
        double[] w = clean.weightVector(weights);
        double[] sigmaW = new double[assets];
        double variance = 0.0;

        if (clean.rowCount() >= 2 && assets > 0) {
            double[][] cov = clean.sampleCovariance();
            for (int i = 0; i < assets; i++) {
                for (int k = 0; k < assets; k++) {
                    sigmaW[i] += cov[i][k] * annDays * w[k];
                }
                variance += w[i] * sigmaW[i];
            }
        }

        double vol = variance > 0 ? Math.sqrt(variance) : 0.0;
        List<RiskContribution> out = new ArrayList<>(assets);
        for (int i = 0; i < assets; i++) {
            String symbol = clean.symbols().get(i);
            if (vol > 0) {
                double mctr = sigmaW[i] / vol;
                double cctr = w[i] * mctr;
                out.add(new RiskContribution(symbol, w[i], mctr, cctr, cctr / vol));
            } else {
                out.add(new RiskContribution(symbol, w[i], 0.0, 0.0, 0.0));
            }
        }
        return out;
    }
}
