package com.portfolio.riskengine.domain.service.backtest;

import com.portfolio.riskengine.domain.model.AssetReturnMatrix;
import com.portfolio.riskengine.domain.model.BacktestObservation;
import com.portfolio.riskengine.domain.model.BacktestResult;
import com.portfolio.riskengine.domain.model.ReturnSeries;
import com.portfolio.riskengine.domain.model.VarMethod;
import com.portfolio.riskengine.domain.service.returns.ReturnsEngine;
import com.portfolio.riskengine.shared.exception.InsufficientDataException;
import com.portfolio.riskengine.shared.exception.MissingInputException;
import com.portfolio.riskengine.util.TestEngines;
import com.portfolio.riskengine.util.TestReturnsFactory;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class BacktestEngineTest {

    private final BacktestEngine engine = TestEngines.backtestEngine();

    @Test
    void thresholdOnOutlierDateDoesNotSeeTheOutlier() {
        int outlierIndex = 180;
        double[] calm = TestReturnsFactory.gaussian(200, 0.0, 0.01, 21L);
        double[] shocked = calm.clone();
        shocked[outlierIndex] = -0.5;

        for (VarMethod method : new VarMethod[]{VarMethod.HISTORICAL, VarMethod.PARAMETRIC}) {
            BacktestResult base = engine.backtest(request(TestReturnsFactory.series(calm), method));
            BacktestResult withOutlier = engine.backtest(request(TestReturnsFactory.series(shocked), method));
            LocalDate outlierDate = TestReturnsFactory.START.plusDays(outlierIndex);

            BacktestObservation before = observationAt(base, outlierDate);
            BacktestObservation after = observationAt(withOutlier, outlierDate);
            assertThat(after.varThreshold()).isEqualTo(before.varThreshold());
            assertThat(after.exception()).isTrue();
            assertThat(withOutlier.getExceptionsTable())
                    .anySatisfy(breach -> assertThat(breach.date()).isEqualTo(outlierDate));
        }
    }

    @Test
    void reportsCountsRateAndKupiecStatistic() {
        BacktestResult result = engine.backtest(request(
                TestReturnsFactory.series(TestReturnsFactory.gaussian(400, 0.0, 0.01, 5L)), VarMethod.HISTORICAL));

        assertThat(result.getSeries()).hasSize(100);
        assertThat(result.getAvailableDays()).isEqualTo(400);
        assertThat(result.getExceptionsTable()).hasSize(result.getExceptionsCount());
        assertThat(result.getExceptionsRate()).isCloseTo(result.getExceptionsCount() / 100.0, within(1e-12));
        assertThat(result.getKupiecLr()).isNotNull();
        assertThat(result.getKupiecPvalue()).isBetween(0.0, 1.0);
        assertThat(result.getSeries()).allSatisfy(o -> assertThat(o.varThreshold()).isLessThanOrEqualTo(0.0));
    }

    @Test
    void backtestWindowIsClippedToAvailableHistory() {
        BacktestResult result = engine.backtest(BacktestRequest.builder()
                .portfolioReturns(TestReturnsFactory.series(TestReturnsFactory.gaussian(60, 0.0, 0.01, 2L)))
                .method(VarMethod.HISTORICAL)
                .lookback(250)
                .backtestDays(250)
                .build());

        assertThat(result.getSeries()).isNotEmpty();
        assertThat(result.getSeries().size()).isLessThan(60);
    }

    @Test
    void emptyHistoryIsInsufficientData() {
        assertThatThrownBy(() -> engine.backtest(request(ReturnSeries.empty(), VarMethod.HISTORICAL)))
                .isInstanceOf(InsufficientDataException.class);
    }

    @Test
    void historyTooShortForAnyEstimationWindowIsInsufficientData() {
        ReturnSeries tiny = TestReturnsFactory.series(new double[]{0.01, -0.02, 0.005});

        assertThatThrownBy(() -> engine.backtest(request(tiny, VarMethod.HISTORICAL)))
                .isInstanceOf(InsufficientDataException.class)
                .hasMessageContaining("No valid backtest observations");
    }

    @Test
    void monteCarloBacktestRequiresAssetInputs() {
        ReturnSeries sample = TestReturnsFactory.series(TestReturnsFactory.gaussian(100, 0.0, 0.01, 1L));

        assertThatThrownBy(() -> engine.backtest(request(sample, VarMethod.MONTE_CARLO)))
                .isInstanceOf(MissingInputException.class);
    }

    @Test
    void monteCarloBacktestIsReproducibleForSameSeed() {
        Map<String, Double> weights = Map.of("BTCUSDT", 0.5, "ETHUSDT", 0.5);
        AssetReturnMatrix assets = TestReturnsFactory.twoAssets(80, 13L);
        BacktestRequest request = BacktestRequest.builder()
                .portfolioReturns(new ReturnsEngine().portfolioReturns(assets, weights))
                .assetReturns(assets)
                .weights(weights)
                .method(VarMethod.MONTE_CARLO)
                .lookback(30)
                .backtestDays(10)
                .simulations(2_000)
                .seed(99L)
                .build();

        BacktestResult first = engine.backtest(request);
        BacktestResult second = engine.backtest(request);

        assertThat(first.getSeries()).hasSize(10);
        assertThat(first.getSeries()).isEqualTo(second.getSeries());
    }

    private static BacktestRequest request(ReturnSeries returns, VarMethod method) {
        return BacktestRequest.builder()
                .portfolioReturns(returns)
                .method(method)
                .lookback(100)
                .backtestDays(100)
                .build();
    }

    private static BacktestObservation observationAt(BacktestResult result, LocalDate date) {
        return result.getSeries().stream()
                .filter(o -> o.date().equals(date))
                .findFirst()
                .orElseThrow();
    }
}
