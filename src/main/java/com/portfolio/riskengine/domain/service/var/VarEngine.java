package com.portfolio.riskengine.domain.service.var;

import com.portfolio.riskengine.domain.model.AssetReturnMatrix;
import com.portfolio.riskengine.domain.model.ComponentVar;
import com.portfolio.riskengine.domain.model.DriftMode;
import com.portfolio.riskengine.domain.model.HistogramData;
import com.portfolio.riskengine.domain.model.HsWeighting;
import com.portfolio.riskengine.domain.model.ParametricDistribution;
import com.portfolio.riskengine.domain.model.ReturnSeries;
import com.portfolio.riskengine.domain.model.RollingVar;
import com.portfolio.riskengine.domain.model.VarMetadata;
import com.portfolio.riskengine.domain.model.VarMethod;
import com.portfolio.riskengine.domain.model.VarResult;
import com.portfolio.riskengine.domain.service.returns.ReturnsEngine;
import com.portfolio.riskengine.shared.exception.InsufficientDataException;
import com.portfolio.riskengine.shared.exception.InvalidParameterException;
import com.portfolio.riskengine.shared.exception.MissingInputException;
import com.portfolio.riskengine.shared.exception.RiskEngineException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class VarEngine {

    static final String SMALL_SAMPLE = "Effective sample size < 50; results may be unstable.";
    static final String HORIZON_NOTE = "Horizon scaling uses rolling aggregation and sqrt(h) approximations.";
    static final String MC_NOISY = "Monte Carlo simulations are below 5,000; results may be noisy.";
    static final int MIN_ROLLING_WINDOW = 5;

    private final ReturnsEngine returnsEngine;
    private final HistoricalVarModel historicalModel;
    private final ParametricVarModel parametricModel;
    private final MonteCarloVarModel monteCarloModel;
    private final ComponentVarCalculator componentVarCalculator;
    private final VarProperties varProperties;
    private final MonteCarloProperties monteCarloProperties;

    public VarResult computeVar(VarRequest request) {
        validate(request);
        VarModelSpec spec = request.getModel();
        int horizon = request.getHorizonDays();

        ReturnSeries base = trailing(request.getPortfolioReturns(), request.getLookback()).dropMissing();
        AssetReturnMatrix baseAssets = request.getAssetReturns() != null
                ? trailing(request.getAssetReturns(), request.getLookback()).completeRows()
                : null;

        ReturnSeries aggregated = returnsEngine.aggregateToHorizon(base, request.getReturnType(), horizon);
        if (aggregated.isEmpty()) {
            throw new InsufficientDataException("Insufficient return data for VaR calculation");
        }
        double[] sample = aggregated.values();
        HistogramData histogramRealized = HistogramData.of(sample, varProperties.getHistogramBins());

        List<String> warnings = new ArrayList<>();
        if (sample.length < varProperties.getMinEffectiveSample()) {
            warnings.add(SMALL_SAMPLE);
        }
        if (horizon > 1) {
            warnings.add(HORIZON_NOTE);
        }

        VarMetadata.VarMetadataBuilder metadata = baseMetadata(request, sample.length);
        HistogramData histogramSimulated = null;
        List<ComponentVar> contributions = null;
        VarEstimate estimate;

        switch (spec.method()) {
            case HISTORICAL -> estimate = historicalModel.estimate(sample, request.getConfidence(), (HistoricalSpec) spec);
            case PARAMETRIC -> {
                estimate = parametricModel.estimate(sample, request.getConfidence(), (ParametricSpec) spec);
                metadata.mu(estimate.getMu())
                        .sigma(estimate.getSigma())
                        .df(estimate.getDf())
                        .loc(estimate.getLoc())
                        .scale(estimate.getScale());
                ParametricSpec parametric = (ParametricSpec) spec;
                if (parametric.distribution() == ParametricDistribution.NORMAL
                        && baseAssets != null && request.getWeights() != null && !request.getWeights().isEmpty()) {
                    contributions = componentVarCalculator
                            .decompose(baseAssets, request.getWeights(), request.getConfidence(), horizon)
                            .orElse(null);
                }
            }
            case MONTE_CARLO -> {
                if (baseAssets == null || !request.hasAssetInputs()) {
                    throw new MissingInputException("Monte Carlo requires asset_returns and weights");
                }
                MonteCarloSpec mc = (MonteCarloSpec) spec;
                estimate = monteCarloModel.estimate(baseAssets, request.getWeights(),
                        request.getConfidence(), horizon, mc);
                metadata.simulations(estimate.getSimulations())
                        .horizonModel(MonteCarloVarModel.HORIZON_MODEL);
                histogramSimulated = HistogramData.of(estimate.getSimulated(), varProperties.getHistogramBins());

                if (mc.simulations() > monteCarloProperties.getSimulationCap()) {
                    warnings.add(String.format(Locale.US, "Monte Carlo sims capped to %,d.",
                            monteCarloProperties.getSimulationCap()));
                }
                if (mc.simulations() < monteCarloProperties.getMinRecommendedSimulations()) {
                    warnings.add(MC_NOISY);
                }
            }
            default -> throw new InvalidParameterException("Unknown VaR method: " + spec.method());
        }
        warnings.addAll(estimate.getWarnings());

        RollingVar rolling = spec.method() != VarMethod.MONTE_CARLO
                ? rollingSeries(request, base, aggregated)
                : null;

        Double portfolioValue = request.getPortfolioValue();
        VarResult result = VarResult.builder()
                .method(spec.method())
                .confidence(request.getConfidence())
                .var(estimate.getVar())
                .cvar(estimate.getCvar())
                .varAmount(portfolioValue != null ? estimate.getVar() * portfolioValue : null)
                .cvarAmount(portfolioValue != null ? estimate.getCvar() * portfolioValue : null)
                .histogram(histogramSimulated != null ? histogramSimulated : histogramRealized)
                .histogramRealized(histogramRealized)
                .histogramSimulated(histogramSimulated)
                .rolling(rolling)
                .returns(toList(sample))
                .warnings(warnings)
                .metadata(metadata.build())
                .contributionsVar(contributions)
                .build();

        log.info("[VaR] computed: method={}, confidence={}, horizon={}, n={}, var={}, cvar={}, warnings={}",
                spec.method().code(), request.getConfidence(), horizon, sample.length,
                result.getVar(), result.getCvar(), warnings.size());
        return result;
    }

    /**
     * Point estimate of VaR/CVaR on an already prepared one-period sample. Used by
     * the rolling series and the backtest loop.
     */
    public VarEstimate estimate(double[] sample, double confidence, VarModelSpec spec) {
        if (sample.length == 0) {
            throw new InsufficientDataException("Insufficient return data for VaR calculation");
        }
        return switch (spec.method()) {
            case HISTORICAL -> historicalModel.estimate(sample, confidence, (HistoricalSpec) spec);
            case PARAMETRIC -> parametricModel.estimate(sample, confidence, (ParametricSpec) spec);
            case MONTE_CARLO -> throw new InvalidParameterException("Monte Carlo estimates require asset returns");
        };
    }

    public VarEstimate estimateMonteCarlo(AssetReturnMatrix assetReturns, Map<String, Double> weights,
                                          double confidence, MonteCarloSpec spec) {
        return monteCarloModel.estimate(assetReturns, weights, confidence, 1, spec);
    }

    /**
     * Rolling VaR over trailing windows of the aggregated sample. Each point is dated
     * at the realized observation it is compared with, the first one after its window,
     * not at the last date inside the window.
     */
    private RollingVar rollingSeries(VarRequest request, ReturnSeries base, ReturnSeries aggregated) {
        int rollingWindow = request.getRollingWindow() != null
                ? request.getRollingWindow()
                : varProperties.getDefaultRollingWindow();
        if (rollingWindow <= 0 || base.size() <= request.getHorizonDays() || aggregated.size() <= 2) {
            return null;
        }

        int n = aggregated.size();
        int window = Math.max(MIN_ROLLING_WINDOW, Math.min(rollingWindow, Math.max(2, n / 2)));
        double[] values = aggregated.values();
        List<LocalDate> dates = new ArrayList<>();
        List<Double> varSeries = new ArrayList<>();
        List<Double> realized = new ArrayList<>();

        for (int i = window; i < n; i++) {
            double[] slice = new double[window];
            System.arraycopy(values, i - window, slice, 0, window);
            try {
                VarEstimate rolled = estimate(slice, request.getConfidence(), request.getModel());
                dates.add(aggregated.get(i).date());
                varSeries.add(rolled.getVar());
                realized.add(values[i]);
            } catch (RiskEngineException | IllegalArgumentException e) {
                log.debug("[VaR] rolling window skipped: end={}, reason={}", aggregated.get(i).date(), e.getMessage());
            }
        }

        if (dates.isEmpty()) {
            return null;
        }
        log.debug("[VaR] rolling series: window={}, points={}", window, dates.size());
        return new RollingVar(dates, varSeries, realized);
    }

    private VarMetadata.VarMetadataBuilder baseMetadata(VarRequest request, int effectiveN) {
        VarModelSpec spec = request.getModel();
        DriftMode drift = DriftMode.IGNORE;
        HsWeighting weighting = HsWeighting.NONE;
        double lambda = varProperties.getDefaultEwmaLambda();
        ParametricDistribution distribution = ParametricDistribution.NORMAL;
        long seed = monteCarloProperties.getDefaultSeed();
        int simulations = monteCarloProperties.getDefaultSimulations();

        if (spec instanceof HistoricalSpec hs) {
            weighting = hs.weighting();
            lambda = hs.lambda();
        } else if (spec instanceof ParametricSpec ps) {
            drift = ps.drift();
            distribution = ps.distribution();
        } else if (spec instanceof MonteCarloSpec mc) {
            drift = mc.drift();
            seed = mc.seed();
            simulations = mc.simulations();
        }

        return VarMetadata.builder()
                .effectiveN(effectiveN)
                .horizonDays(request.getHorizonDays())
                .returnType(request.getReturnType())
                .drift(drift)
                .hsWeighting(weighting)
                .hsLambda(lambda)
                .parametricDist(distribution)
                .seed(seed)
                .mcSims(monteCarloProperties.cappedSimulations(simulations))
                .covarianceMethod("sample")
                .varUnits("fraction")
                .returnUnits(request.getReturnType())
                .horizonModel("aggregation");
    }

    private void validate(VarRequest request) {
        if (request.getModel() == null) {
            throw new InvalidParameterException("VaR method is required");
        }
        double confidence = request.getConfidence();
        if (!(confidence > 0.0 && confidence < 1.0)) {
            throw new InvalidParameterException("confidence must be in (0, 1): " + confidence);
        }
        if (request.getHorizonDays() < 1) {
            throw new InvalidParameterException("horizon_days must be >= 1: " + request.getHorizonDays());
        }
        if (request.getPortfolioReturns() == null) {
            throw new InsufficientDataException("Insufficient return data for VaR calculation");
        }
    }

    private static ReturnSeries trailing(ReturnSeries series, Integer lookback) {
        return lookback != null && lookback > 0 ? series.tail(lookback) : series;
    }

    private static AssetReturnMatrix trailing(AssetReturnMatrix matrix, Integer lookback) {
        return lookback != null && lookback > 0 ? matrix.tail(lookback) : matrix;
    }

    private static List<Double> toList(double[] values) {
        List<Double> list = new ArrayList<>(values.length);
        for (double v : values) {
            list.add(v);
        }
        return list;
    }
}
