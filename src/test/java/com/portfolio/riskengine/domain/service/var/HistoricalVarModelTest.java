package com.portfolio.riskengine.domain.service.var;

import com.portfolio.riskengine.domain.model.HsWeighting;
import com.portfolio.riskengine.shared.exception.InvalidParameterException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class HistoricalVarModelTest {

    private final HistoricalVarModel model = new HistoricalVarModel();

    @Test
    void varIsNegatedQuantileAndCvarIsTailMean() {
        double[] returns = new double[100];
        for (int i = 0; i < returns.length; i++) {
            returns[i] = (i - 50) / 1000.0;
        }

        VarEstimate estimate = model.estimate(returns, 0.95, HistoricalSpec.unweighted());

        double q = EmpiricalQuantiles.quantile(returns, 0.05);
        assertThat(estimate.getVar()).isCloseTo(-q, within(1e-12));
        assertThat(estimate.getCvar()).isGreaterThanOrEqualTo(estimate.getVar());
    }

    @Test
    void ewmaWeightingReactsToRecentLosses() {
        double[] returns = new double[200];
        for (int i = 0; i < returns.length; i++) {
            returns[i] = i % 2 == 0 ? 0.001 : -0.001;
        }
        for (int i = 190; i < returns.length; i++) {
            returns[i] = -0.05;
        }

        VarEstimate plain = model.estimate(returns, 0.95, HistoricalSpec.unweighted());
        VarEstimate weighted = model.estimate(returns, 0.95, new HistoricalSpec(HsWeighting.EWMA, 0.94));

        assertThat(weighted.getVar()).isGreaterThan(plain.getVar());
    }

    @Test
    void rejectsLambdaOutsideUnitInterval() {
        assertThatThrownBy(() -> new HistoricalSpec(HsWeighting.EWMA, 1.0))
                .isInstanceOf(InvalidParameterException.class);
    }
}
