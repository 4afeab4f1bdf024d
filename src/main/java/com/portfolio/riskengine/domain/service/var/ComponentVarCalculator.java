package com.portfolio.riskengine.domain.service.var;

import com.portfolio.riskengine.domain.model.AssetReturnMatrix;
import com.portfolio.riskengine.domain.model.ComponentVar;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Euler decomposition of parametric-normal VaR into per-asset contributions.
 * Components add up to {@code z * sqrt(w' S w)}.
 */
@Slf4j
@Component
public class ComponentVarCalculator {

    private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution(null, 0.0, 1.0);

    public Optional<List<ComponentVar>> decompose(AssetReturnMatrix assetReturns, Map<String, Double> weights,
                                                  double confidence, int horizonDays) {
        AssetReturnMatrix complete = assetReturns.completeRows();
        if (complete.rowCount() < 2 || complete.columnCount() == 0) {
            return Optional.empty();
        }

        int assets = complete.columnCount();
        double[] w = complete.weightVector(weights);
        double[][] cov = complete.sampleCovariance();

        double[] sigmaW = new double[assets];
        double variance = 0.0;
        for (int i = 0; i < assets; i++) {
            for (int k = 0; k < assets; k++) {
                sigmaW[i] += cov[i][k] * horizonDays * w[k];
            }
            variance += w[i] * sigmaW[i];
        }
        if (!(variance > 0)) {
            log.debug("[VaR] component VaR skipped: portfolio variance={}", variance);
            return Optional.empty();
        }

        double sigmaP = Math.sqrt(variance);
        double z = -STANDARD_NORMAL.inverseCumulativeProbability(1.0 - confidence);
        List<ComponentVar> components = new ArrayList<>(assets);
        for (int i = 0; i < assets; i++) {
            double marginal = z * sigmaW[i] / sigmaP;
            components.add(new ComponentVar(complete.symbols().get(i), w[i], marginal, w[i] * marginal));
        }
        return Optional.of(components);
    }
}
