package com.portfolio.riskengine.domain.service.metrics;

import com.portfolio.riskengine.domain.model.AssetReturnMatrix;
import com.portfolio.riskengine.domain.model.BenchmarkAnalytics;
import com.portfolio.riskengine.domain.model.CorrelationMatrix;
import com.portfolio.riskengine.domain.model.PerformanceSeries;
import com.portfolio.riskengine.domain.model.ReturnSeries;
import com.portfolio.riskengine.domain.model.ReturnType;
import com.portfolio.riskengine.domain.model.RiskContribution;
import com.portfolio.riskengine.domain.model.RiskMetricsMetadata;
import com.portfolio.riskengine.domain.model.RiskMetricsResult;
import com.portfolio.riskengine.domain.model.RiskSummary;
import com.portfolio.riskengine.domain.model.TailStatistics;
import com.portfolio.riskengine.domain.service.var.TailEstimator;
import com.portfolio.riskengine.shared.exception.InsufficientDataException;
import com.portfolio.riskengine.shared.exception.InvalidParameterException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class RiskMetricsEngine {

    static final String NO_ASSET_DATA = "No aligned asset return data available.";
    static final String ZERO_TRACKING_ERROR = "Tracking error is zero; information ratio undefined";

    private final PerformanceRatios ratios;
    private final DrawdownCalculator drawdowns;
    private final RollingStatistics rollingStatistics;
    private final BenchmarkAnalyzer benchmarkAnalyzer;
    private final RiskContributionCalculator contributionCalculator;
    private final TailEstimator tailEstimator;
    private final BenchmarkReturnsProvider benchmarkProvider;
    private final RiskMetricsProperties properties;

    public RiskMetricsResult computeRiskMetrics(RiskMetricsRequest request) {
        int annDays = request.getAnnualizationDays() != null
                ? request.getAnnualizationDays()
                : properties.getAnnualizationDays();
        if (annDays < 1) {
            throw new InvalidParameterException("annualization_days must be >= 1: " + annDays);
        }
        List<Integer> windows = request.getRollingWindows() != null
                ? request.getRollingWindows()
                : properties.getRollingWindows();
        ReturnType returnType = request.getReturnType();

        ReturnSeries portfolio = request.getPortfolioReturns() != null
                ? request.getPortfolioReturns().dropMissing()
                : ReturnSeries.empty();
        if (portfolio.isEmpty()) {
            throw new InsufficientDataException("Insufficient portfolio return data for risk metrics");
        }

        RiskMetricsResult.RiskMetricsResultBuilder result = RiskMetricsResult.builder();
        List<String> warnings = new ArrayList<>();
        double[] returns = portfolio.values();
        int effectiveDays = returns.length;
        if (effectiveDays < properties.getMinEffectiveSample()) {
            warnings.add(String.format("Effective sample size (%d) < %d; results may be unstable.",
                    effectiveDays, properties.getMinEffectiveSample()));
        }

        double rfDaily = ratios.dailyRiskFree(request.getRiskFreeRate(), returnType, annDays);
        double annReturn = ratios.annualizedReturn(returns, returnType, annDays);
        double sortino = ratios.sortino(returns, rfDaily, annDays);

        double[] cumulative = drawdowns.cumulative(returns, returnType);
        double[] drawdown = drawdowns.drawdown(returns, returnType);
        double maxDrawdown = drawdowns.maxDrawdown(drawdown);

        result.stats(TailStatistics.builder()
                .skew(tailEstimator.skewness(returns))
                .kurtosis(tailEstimator.excessKurtosis(returns))
                .bestDay(max(returns))
                .worstDay(min(returns))
                .hitRatio(hitRatio(returns))
                .downsideDevAnn(ratios.downsideDeviation(returns, rfDaily, annDays))
                .calmarRatio(maxDrawdown > 0 ? annReturn / maxDrawdown : null)
                .build());

        String benchmarkSymbol = request.isIncludeBenchmark() ? request.getBenchmarkSymbol() : null;
        Double beta = null;
        List<Double> benchCumulative = null;
        List<Double> benchDrawdown = null;

        if (benchmarkSymbol != null && !benchmarkSymbol.isBlank()) {
            Optional<ReturnSeries> fetched = benchmarkProvider.fetchReturns(
                    benchmarkSymbol, portfolio.firstDate(), portfolio.lastDate(), returnType);
            ReturnSeries bench = fetched.map(ReturnSeries::dropMissing).orElse(ReturnSeries.empty());

            if (bench.size() > properties.getMinBenchmarkReturns()) {
                int overlap = benchmarkAnalyzer.align(portfolio, bench)[0].length;
                if (overlap < properties.getMinEffectiveSample()) {
                    warnings.add("Benchmark overlap < 50 days; TE/IR may be unstable.");
                }

                Optional<BenchmarkAnalytics> analytics = benchmarkAnalyzer.analyze(
                        portfolio, bench, annDays, properties.getMinRegressionObservations());
                if (analytics.isPresent()) {
                    BenchmarkAnalytics block = analytics.get();
                    beta = block.getBeta();
                    if (block.getTrackingErrorAnn() == 0) {
                        warnings.add(ZERO_TRACKING_ERROR);
                    }
                    result.benchmark(block);
                }

                double[] benchValues = bench.values();
                benchCumulative = alignTo(portfolio.dates(), bench.dates(), drawdowns.cumulative(benchValues, returnType));
                benchDrawdown = alignTo(portfolio.dates(), bench.dates(), drawdowns.drawdown(benchValues, returnType));
            } else {
                log.warn("[RiskMetrics] benchmark unavailable or too short: symbol={}, returns={}",
                        benchmarkSymbol, bench.size());
                warnings.add("Benchmark " + benchmarkSymbol + " has insufficient overlap with portfolio.");
            }
        }

        AssetReturnMatrix clean = cleanAssets(request.getAssetReturns(), portfolio, warnings);
        CorrelationMatrix correlation = contributionCalculator.correlation(clean);
        List<RiskContribution> contributions = request.getWeights() != null
                ? contributionCalculator.contributions(clean, request.getWeights(), annDays)
                : contributionCalculator.contributions(clean, Map.of(), annDays);

        result.summary(RiskSummary.builder()
                        .annVol(ratios.annualizedVolatility(returns, annDays))
                        .maxDrawdown(maxDrawdown)
                        .beta(beta)
                        .ddDurationDays(drawdowns.duration(drawdown))
                        .sharpeRatio(ratios.sharpe(returns, rfDaily, annDays))
                        .sortinoRatio(Double.isFinite(sortino) ? sortino : null)
                        .annReturn(annReturn)
                        .build())
                .rollingVol(rollingStatistics.rollingVolatility(portfolio, windows, annDays))
                .rollingSharpe(rollingStatistics.rollingSharpe(portfolio, windows, rfDaily, annDays))
                .correlation(correlation)
                .contributions(contributions)
                .cumulativeReturns(new PerformanceSeries(portfolio.dates(), toList(cumulative), benchCumulative))
                .drawdownSeries(new PerformanceSeries(portfolio.dates(), toList(drawdown), benchDrawdown))
                .metadata(RiskMetricsMetadata.builder()
                        .annualizationDays(annDays)
                        .returnType(returnType)
                        .effectiveDays(effectiveDays)
                        .symbols(correlation.symbols())
                        .benchmarkSymbol(benchmarkSymbol)
                        .riskFreeRate(request.getRiskFreeRate())
                        .build())
                .warnings(warnings);

        log.info("[RiskMetrics] computed: days={}, assets={}, benchmark={}, warnings={}",
                effectiveDays, clean.columnCount(), benchmarkSymbol, warnings.size());
        return result.build();
    }

    private AssetReturnMatrix cleanAssets(AssetReturnMatrix assets, ReturnSeries portfolio, List<String> warnings) {
        AssetReturnMatrix aligned = assets != null
                ? assets.restrictTo(portfolio.dates()).dropEmptyRows()
                : AssetReturnMatrix.empty();
        if (aligned.rowCount() == 0) {
            warnings.add(NO_ASSET_DATA);
            return AssetReturnMatrix.empty();
        }

        List<String> dropped = new ArrayList<>();
        for (String symbol : aligned.symbols()) {
            if (aligned.missingFraction(symbol) > properties.getMaxMissingFraction()) {
                dropped.add(symbol);
                warnings.add(String.format("Asset %s has >%d%% missing returns after alignment; dropped from covariance.",
                        symbol, Math.round(properties.getMaxMissingFraction() * 100)));
            }
        }
        if (!dropped.isEmpty()) {
            log.warn("[RiskMetrics] assets dropped for missing data: {}", dropped);
        }

        AssetReturnMatrix clean = aligned.withoutSymbols(dropped).completeRows();
        if (clean.rowCount() < properties.getMinEffectiveSample()) {
            warnings.add("Clean aligned asset return sample < 50 rows; correlations/contributions may be unstable.");
        }
        return clean;
    }

    private static List<Double> alignTo(List<LocalDate> target, List<LocalDate> source, double[] values) {
        Map<LocalDate, Double> byDate = new HashMap<>(source.size() * 2);
        for (int i = 0; i < source.size(); i++) {
            byDate.put(source.get(i), values[i]);
        }
        List<Double> out = new ArrayList<>(target.size());
        for (LocalDate d : target) {
            out.add(byDate.get(d));
        }
        return out;
    }

    private static double hitRatio(double[] returns) {
        int positive = 0;
        for (double r : returns) {
            if (r > 0) positive++;
        }
        return (double) positive / returns.length;
    }

    private static double max(double[] values) {
        double m = Double.NEGATIVE_INFINITY;
        for (double v : values) m = Math.max(m, v);
        return m;
    }

    private static double min(double[] values) {
        double m = Double.POSITIVE_INFINITY;
        for (double v : values) m = Math.min(m, v);
        return m;
    }

    private static List<Double> toList(double[] values) {
        List<Double> list = new ArrayList<>(values.length);
        for (double v : values) {
            list.add(v);
        }
        return list;
    }
}
