package com.portfolio.riskengine.domain.service.var;

import com.portfolio.riskengine.shared.exception.InsufficientDataException;
import com.portfolio.riskengine.shared.exception.InvalidParameterException;
import com.portfolio.riskengine.util.TestReturnsFactory;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class EmpiricalQuantilesTest {

    @Test
    void weightedMedianMatchesReferenceValue() {
        double q = EmpiricalQuantiles.quantile(new double[]{1, 2, 3, 4}, new double[]{0.1, 0.2, 0.3, 0.4}, 0.5);

        assertThat(q).isCloseTo(3.0, within(1e-12));
    }

    @Test
    void weightedQuantileIgnoresInputOrder() {
        double q = EmpiricalQuantiles.quantile(new double[]{4, 2, 3, 1}, new double[]{0.4, 0.2, 0.3, 0.1}, 0.5);

        assertThat(q).isCloseTo(3.0, within(1e-12));
    }

    @Test
    void equalWeightsReduceToLinearInterpolation() {
        double[] sample = TestReturnsFactory.gaussian(257, 0.0, 0.02, 7L);
        double[] equal = new double[sample.length];
        Arrays.fill(equal, 1.0);

        for (double q : new double[]{0.0, 0.01, 0.05, 0.5, 0.95, 1.0}) {
            assertThat(EmpiricalQuantiles.quantile(sample, equal, q))
                    .isCloseTo(EmpiricalQuantiles.quantile(sample, q), within(1e-12));
        }
    }

    @Test
    void unweightedQuantileInterpolatesBetweenOrderStatistics() {
        double[] sample = {5, 1, 4, 2, 3};

        assertThat(EmpiricalQuantiles.quantile(sample, 0.5)).isEqualTo(3.0);
        assertThat(EmpiricalQuantiles.quantile(sample, 0.1)).isCloseTo(1.4, within(1e-12));
        assertThat(EmpiricalQuantiles.quantile(sample, 0.0)).isEqualTo(1.0);
        assertThat(EmpiricalQuantiles.quantile(sample, 1.0)).isEqualTo(5.0);
    }

    @Test
    void rejectsEmptySampleAndOutOfRangeQuantile() {
        assertThatThrownBy(() -> EmpiricalQuantiles.quantile(new double[0], 0.5))
                .isInstanceOf(InsufficientDataException.class);
        assertThatThrownBy(() -> EmpiricalQuantiles.quantile(new double[]{1, 2}, 1.5))
                .isInstanceOf(InvalidParameterException.class);
    }

    @Test
    void tailMeanAveragesObservationsAtOrBelowThreshold() {
        double[] sample = {-0.05, -0.03, 0.01, 0.02};

        assertThat(EmpiricalQuantiles.tailMean(sample, null, -0.03).getAsDouble()).isCloseTo(-0.04, within(1e-12));
        assertThat(EmpiricalQuantiles.tailMean(sample, null, -0.10)).isEmpty();
    }

    @Test
    void ewmaWeightsFavourRecentObservationsAndSumToOne() {
        double[] weights = EmpiricalQuantiles.ewmaWeights(5, 0.9);

        assertThat(Arrays.stream(weights).sum()).isCloseTo(1.0, within(1e-12));
        assertThat(weights[4] / weights[3]).isCloseTo(1.0 / 0.9, within(1e-12));
        for (int i = 1; i < weights.length; i++) {
            assertThat(weights[i]).isGreaterThan(weights[i - 1]);
        }
    }
}
