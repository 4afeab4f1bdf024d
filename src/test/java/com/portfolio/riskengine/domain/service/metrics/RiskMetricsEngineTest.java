package com.portfolio.riskengine.domain.service.metrics;

import com.portfolio.riskengine.domain.model.AssetReturnMatrix;
import com.portfolio.riskengine.domain.model.ReturnSeries;
import com.portfolio.riskengine.domain.model.ReturnType;
import com.portfolio.riskengine.domain.model.RiskContribution;
import com.portfolio.riskengine.domain.model.RiskMetricsResult;
import com.portfolio.riskengine.domain.service.returns.ReturnsEngine;
import com.portfolio.riskengine.shared.exception.InsufficientDataException;
import com.portfolio.riskengine.util.TestEngines;
import com.portfolio.riskengine.util.TestReturnsFactory;
import org.apache.commons.math3.stat.StatUtils;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class RiskMetricsEngineTest {

    private static final Map<String, Double> WEIGHTS = Map.of("BTCUSDT", 0.6, "ETHUSDT", 0.4);

    private final BenchmarkReturnsProvider benchmarkProvider = mock(BenchmarkReturnsProvider.class);
    private final RiskMetricsEngine engine = TestEngines.riskMetricsEngine(benchmarkProvider);

    @Test
    void rollingSharpeMatchesDirectRecomputation() {
        double[] values = TestReturnsFactory.gaussian(120, 0.0005, 0.02, 17L);
        double rfDaily = 0.03 / 252;

        RiskMetricsResult result = engine.computeRiskMetrics(RiskMetricsRequest.builder()
                .portfolioReturns(TestReturnsFactory.series(values))
                .rollingWindows(List.of(30))
                .riskFreeRate(0.03)
                .includeBenchmark(false)
                .build());

        List<Double> sharpe = result.getRollingSharpe().series("sharpe_30");
        assertThat(sharpe).hasSize(91);
        assertThat(result.getRollingSharpe().dates().get(0)).isEqualTo(TestReturnsFactory.START.plusDays(29));
        for (int k = 0; k < sharpe.size(); k++) {
            double[] window = Arrays.copyOfRange(values, k, k + 30);
            double expected = (StatUtils.mean(window) - rfDaily) * 252
                    / (Math.sqrt(StatUtils.variance(window)) * Math.sqrt(252));
            assertThat(sharpe.get(k)).isCloseTo(expected, within(1e-9));
        }
    }

    @Test
    void longerWindowsArePaddedOnTheSharedDateAxis() {
        RiskMetricsResult result = engine.computeRiskMetrics(RiskMetricsRequest.builder()
                .portfolioReturns(TestReturnsFactory.series(TestReturnsFactory.gaussian(100, 0.0, 0.01, 3L)))
                .rollingWindows(List.of(20, 60))
                .includeBenchmark(false)
                .build());

        List<Double> vol60 = result.getRollingVol().series("vol_60");
        assertThat(result.getRollingVol().dates()).hasSize(81);
        assertThat(vol60).hasSize(81);
        assertThat(vol60.get(39)).isNull();
        assertThat(vol60.get(40)).isNotNull();
    }

    @Test
    void sortinoWithoutDownsideIsReportedAsMissing() {
        double[] gains = new double[20];
        for (int i = 0; i < gains.length; i++) {
            gains[i] = 0.001 * (i + 1);
        }

        RiskMetricsResult result = engine.computeRiskMetrics(RiskMetricsRequest.builder()
                .portfolioReturns(TestReturnsFactory.series(gains))
                .rollingWindows(List.of(5))
                .build());

        assertThat(result.getSummary().getSortinoRatio()).isNull();
        assertThat(result.getSummary().getMaxDrawdown()).isZero();
        assertThat(result.getStats().getCalmarRatio()).isNull();
        assertThat(result.getWarnings()).contains("Effective sample size (20) < 50; results may be unstable.");
    }

    @Test
    void drawdownTracksPeakToTrough() {
        RiskMetricsResult result = engine.computeRiskMetrics(RiskMetricsRequest.builder()
                .portfolioReturns(TestReturnsFactory.series(new double[]{0.10, -0.20, 0.05}))
                .returnType(ReturnType.SIMPLE)
                .rollingWindows(List.of(2))
                .build());

        assertThat(result.getSummary().getMaxDrawdown()).isCloseTo(0.20, within(1e-12));
        assertThat(result.getSummary().getDdDurationDays()).isEqualTo(2);
        assertThat(result.getCumulativeReturns().portfolio().get(2)).isCloseTo(1.1 * 0.8 * 1.05, within(1e-12));
        assertThat(result.getStats().getWorstDay()).isEqualTo(-0.20);
        assertThat(result.getStats().getHitRatio()).isCloseTo(2.0 / 3.0, within(1e-12));
    }

    @Test
    void percentageContributionsSumToOne() {
        AssetReturnMatrix assets = TestReturnsFactory.twoAssets(300, 23L);
        ReturnSeries portfolio = new ReturnsEngine().portfolioReturns(assets, WEIGHTS);

        RiskMetricsResult result = engine.computeRiskMetrics(RiskMetricsRequest.builder()
                .portfolioReturns(portfolio)
                .assetReturns(assets)
                .weights(WEIGHTS)
                .build());

        double pct = result.getContributions().stream().mapToDouble(RiskContribution::pctCctr).sum();
        double cctr = result.getContributions().stream().mapToDouble(RiskContribution::cctr).sum();
        assertThat(pct).isCloseTo(1.0, within(1e-9));
        assertThat(cctr).isCloseTo(result.getSummary().getAnnVol(), within(1e-9));
        assertThat(result.getCorrelation().matrix().get(0).get(0)).isCloseTo(1.0, within(1e-12));
        assertThat(result.getCorrelation().symbols()).containsExactly("BTCUSDT", "ETHUSDT");
    }

    @Test
    void zeroVarianceAssetsGiveZeroContributions() {
        double[][] flat = new double[60][2];
        for (double[] row : flat) {
            Arrays.fill(row, 0.0078125);
        }
        AssetReturnMatrix assets = AssetReturnMatrix.of(TestReturnsFactory.dates(60), List.of("BTCUSDT", "ETHUSDT"), flat);

        RiskMetricsResult result = engine.computeRiskMetrics(RiskMetricsRequest.builder()
                .portfolioReturns(new ReturnsEngine().portfolioReturns(assets, WEIGHTS))
                .assetReturns(assets)
                .weights(WEIGHTS)
                .build());

        assertThat(result.getContributions())
                .allSatisfy(c -> {
                    assertThat(c.mctr()).isZero();
                    assertThat(c.cctr()).isZero();
                    assertThat(c.pctCctr()).isZero();
                });
        assertThat(result.getCorrelation().matrix().get(0).get(1)).isNull();
    }

    @Test
    void sparseAssetIsDroppedFromCovariance() {
        Double[][] values = new Double[100][2];
        for (int i = 0; i < 100; i++) {
            values[i][0] = 0.001 * ((i % 7) - 3);
            values[i][1] = i % 3 == 0 ? 0.002 : null;
        }
        AssetReturnMatrix assets = AssetReturnMatrix.of(TestReturnsFactory.dates(100), List.of("BTCUSDT", "ETHUSDT"), values);

        RiskMetricsResult result = engine.computeRiskMetrics(RiskMetricsRequest.builder()
                .portfolioReturns(assets.column("BTCUSDT"))
                .assetReturns(assets)
                .weights(Map.of("BTCUSDT", 1.0))
                .build());

        assertThat(result.getCorrelation().symbols()).containsExactly("BTCUSDT");
        assertThat(result.getWarnings())
                .contains("Asset ETHUSDT has >20% missing returns after alignment; dropped from covariance.");
    }

    @Test
    void benchmarkRegressionRecoversBeta() {
        double[] bench = TestReturnsFactory.gaussian(200, 0.0, 0.01, 31L);
        double[] port = new double[bench.length];
        for (int i = 0; i < bench.length; i++) {
            port[i] = 1.5 * bench[i];
        }
        when(benchmarkProvider.fetchReturns(eq("BTCUSDT"), any(), any(), eq(ReturnType.LOG)))
                .thenReturn(Optional.of(TestReturnsFactory.series(bench)));

        RiskMetricsResult result = engine.computeRiskMetrics(RiskMetricsRequest.builder()
                .portfolioReturns(TestReturnsFactory.series(port))
                .benchmarkSymbol("BTCUSDT")
                .build());

        assertThat(result.getBenchmark().getBeta()).isCloseTo(1.5, within(1e-9));
        assertThat(result.getBenchmark().getR2()).isCloseTo(1.0, within(1e-9));
        assertThat(result.getBenchmark().getCorr()).isCloseTo(1.0, within(1e-9));
        assertThat(result.getBenchmark().getTrackingErrorAnn()).isPositive();
        assertThat(result.getBenchmark().getObservations()).isEqualTo(200);
        assertThat(result.getSummary().getBeta()).isCloseTo(1.5, within(1e-9));
        assertThat(result.getCumulativeReturns().benchmark()).hasSize(200);
    }

    @Test
    void unavailableBenchmarkOnlyAddsWarning() {
        when(benchmarkProvider.fetchReturns(any(), any(), any(), any())).thenReturn(Optional.empty());

        RiskMetricsResult result = engine.computeRiskMetrics(RiskMetricsRequest.builder()
                .portfolioReturns(TestReturnsFactory.series(TestReturnsFactory.gaussian(100, 0.0, 0.01, 2L)))
                .benchmarkSymbol("SPY")
                .build());

        assertThat(result.getBenchmark()).isNull();
        assertThat(result.getSummary().getBeta()).isNull();
        assertThat(result.getWarnings()).contains("Benchmark SPY has insufficient overlap with portfolio.");
    }

    @Test
    void benchmarkIsSkippedWhenExcluded() {
        engine.computeRiskMetrics(RiskMetricsRequest.builder()
                .portfolioReturns(TestReturnsFactory.series(TestReturnsFactory.gaussian(100, 0.0, 0.01, 2L)))
                .benchmarkSymbol("BTCUSDT")
                .includeBenchmark(false)
                .build());

        verifyNoInteractions(benchmarkProvider);
    }

    @Test
    void emptyPortfolioIsInsufficientData() {
        assertThatThrownBy(() -> engine.computeRiskMetrics(RiskMetricsRequest.builder()
                .portfolioReturns(ReturnSeries.empty())
                .build()))
                .isInstanceOf(InsufficientDataException.class);
    }
}
