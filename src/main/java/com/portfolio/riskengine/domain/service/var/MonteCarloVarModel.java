package com.portfolio.riskengine.domain.service.var;

import com.portfolio.riskengine.domain.model.AssetReturnMatrix;
import com.portfolio.riskengine.domain.model.DriftMode;
import com.portfolio.riskengine.shared.exception.InsufficientDataException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Multivariate-normal Monte Carlo VaR. Mean and covariance are fitted to the asset
 * return rows and scaled linearly by the horizon.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MonteCarloVarModel {

    static final String HORIZON_MODEL = "mvn_scaled";

    private final ScenarioGenerator scenarioGenerator;
    private final MonteCarloProperties properties;

    public VarEstimate estimate(AssetReturnMatrix assetReturns, Map<String, Double> weights,
                                double confidence, int horizonDays, MonteCarloSpec spec) {
        AssetReturnMatrix complete = assetReturns.completeRows();
        if (complete.rowCount() < 2 || complete.columnCount() == 0) {
            throw new InsufficientDataException("Monte Carlo requires at least 2 complete asset return rows",
                    Map.of("available", complete.rowCount()));
        }

        int simulations = properties.cappedSimulations(spec.simulations());
        double[][] rows = complete.toArray();
        int assets = complete.columnCount();

        double[] mean = new double[assets];
        if (spec.drift() == DriftMode.INCLUDE) {
            for (double[] row : rows) {
                for (int j = 0; j < assets; j++) {
                    mean[j] += row[j];
                }
            }
            for (int j = 0; j < assets; j++) {
                mean[j] = mean[j] / rows.length * horizonDays;
            }
        }

        double[][] cov = complete.sampleCovariance();
        for (double[] row : cov) {
            for (int k = 0; k < assets; k++) {
                row[k] *= horizonDays;
            }
        }

        double[] simulated = scenarioGenerator.generatePortfolioReturns(
                mean, cov, complete.weightVector(weights), simulations, spec.seed());

        double alpha = 1.0 - confidence;
        double q = EmpiricalQuantiles.quantile(simulated, alpha);
        double var = -q;
        double cvar = -EmpiricalQuantiles.tailMean(simulated, null, q).orElse(q);

        log.debug("[MC] VaR estimated: sims={}, assets={}, rows={}, horizon={}, var={}",
                simulations, assets, rows.length, horizonDays, var);
        return VarEstimate.builder()
                .var(var)
                .cvar(cvar)
                .simulated(simulated)
                .simulations(simulations)
                .build();
    }
}
