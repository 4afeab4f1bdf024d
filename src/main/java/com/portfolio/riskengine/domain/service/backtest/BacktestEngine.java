package com.portfolio.riskengine.domain.service.backtest;

import com.portfolio.riskengine.domain.model.AssetReturnMatrix;
import com.portfolio.riskengine.domain.model.BacktestBreach;
import com.portfolio.riskengine.domain.model.BacktestObservation;
import com.portfolio.riskengine.domain.model.BacktestResult;
import com.portfolio.riskengine.domain.model.DriftMode;
import com.portfolio.riskengine.domain.model.ReturnSeries;
import com.portfolio.riskengine.domain.model.VarMethod;
import com.portfolio.riskengine.domain.service.var.HistoricalSpec;
import com.portfolio.riskengine.domain.service.var.MonteCarloProperties;
import com.portfolio.riskengine.domain.service.var.MonteCarloSpec;
import com.portfolio.riskengine.domain.service.var.ParametricSpec;
import com.portfolio.riskengine.domain.service.var.VarEngine;
import com.portfolio.riskengine.shared.exception.InsufficientDataException;
import com.portfolio.riskengine.shared.exception.InvalidParameterException;
import com.portfolio.riskengine.shared.exception.MissingInputException;
import com.portfolio.riskengine.shared.exception.RiskEngineException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.Map;

/**
 * Out-of-sample VaR backtest. For every date in the test period the model is
 * re-estimated on the observations strictly before that date and the realized
 * return is compared with the resulting threshold.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BacktestEngine {

    private final VarEngine varEngine;
    private final KupiecPof kupiecPof;
    private final BacktestProperties properties;
    private final MonteCarloProperties monteCarloProperties;

    public BacktestResult backtest(BacktestRequest request) {
        VarMethod method = request.getMethod();
        double confidence = request.getConfidence();
        int lookback = request.getLookback() != null ? request.getLookback() : properties.getDefaultLookback();
        int backtestDays = request.getBacktestDays() != null ? request.getBacktestDays() : properties.getDefaultDays();
        validate(request, lookback, backtestDays);

        ReturnSeries clean = request.getPortfolioReturns().dropMissing();
        int available = clean.size();
        int effectiveLookback = Math.min(lookback, available - 1);
        int maxBacktest = available - effectiveLookback;
        if (maxBacktest <= 0 || available == 0) {
            throw new InsufficientDataException(String.format(
                    "Insufficient data: available=%d, requested_lookback=%d, requested_backtest=%d",
                    available, lookback, backtestDays),
                    Map.of("available", available, "lookback", lookback, "backtestDays", backtestDays));
        }

        int testDays = Math.min(backtestDays, maxBacktest);
        int start = available - testDays;
        double[] values = clean.values();
        MonteCarloSpec mcSpec = method == VarMethod.MONTE_CARLO ? monteCarloSpec(request) : null;

        log.info("[Backtest] start: method={}, confidence={}, lookback={}, days={}, available={}",
                method.code(), confidence, lookback, testDays, available);

        BacktestResult.BacktestResultBuilder result = BacktestResult.builder();
        int evaluated = 0;
        int exceptions = 0;

        for (int i = 0; i < testDays; i++) {
            int t = start + i;
            int from = Math.max(0, t - lookback);
            if (t - from < properties.getMinEstimationObservations()) {
                continue;
            }

            LocalDate date = clean.get(t).date();
            try {
                double varLoss = Math.abs(estimateVar(request, clean, values, from, t, mcSpec, i));
                double threshold = -varLoss;
                double realized = values[t];
                boolean exception = realized < threshold;

                result.observation(new BacktestObservation(date, realized, threshold, exception));
                if (exception) {
                    result.breach(new BacktestBreach(date, realized, threshold));
                    exceptions++;
                }
                evaluated++;
            } catch (RiskEngineException | IllegalArgumentException | IllegalStateException e) {
                log.warn("[Backtest] estimation failed, date skipped: date={}, index={}, reason={}",
                        date, i, e.getMessage());
            }
        }

        if (evaluated == 0) {
            throw new InsufficientDataException("No valid backtest observations");
        }

        KupiecResult kupiec = kupiecPof.test(evaluated, exceptions, confidence);
        log.info("[Backtest] done: method={}, observations={}, exceptions={}, lr={}, pValue={}",
                method.code(), evaluated, exceptions, kupiec.lr(), kupiec.pValue());

        return result
                .method(method)
                .confidence(confidence)
                .exceptionsCount(exceptions)
                .exceptionsRate((double) exceptions / evaluated)
                .kupiecLr(kupiec.lr())
                .kupiecPvalue(kupiec.pValue())
                .availableDays(available)
                .build();
    }

    private double estimateVar(BacktestRequest request, ReturnSeries clean, double[] values,
                               int from, int to, MonteCarloSpec mcSpec, int index) {
        double[] window = new double[to - from];
        System.arraycopy(values, from, window, 0, window.length);

        return switch (request.getMethod()) {
            case HISTORICAL -> varEngine.estimate(window, request.getConfidence(), HistoricalSpec.unweighted()).getVar();
            case PARAMETRIC -> varEngine.estimate(window, request.getConfidence(), ParametricSpec.normalWithoutDrift()).getVar();
            case MONTE_CARLO -> {
                AssetReturnMatrix estimationAssets = request.getAssetReturns()
                        .restrictTo(clean.slice(from, to).dates())
                        .completeRows();
                yield varEngine.estimateMonteCarlo(estimationAssets, request.getWeights(),
                        request.getConfidence(), mcSpec.withSeed(mcSpec.seed() + index)).getVar();
            }
        };
    }

    private MonteCarloSpec monteCarloSpec(BacktestRequest request) {
        int simulations = request.getSimulations() != null
                ? request.getSimulations()
                : monteCarloProperties.getDefaultSimulations();
        long seed = request.getSeed() != null ? request.getSeed() : monteCarloProperties.getDefaultSeed();
        return new MonteCarloSpec(simulations, seed, DriftMode.IGNORE);
    }

    private void validate(BacktestRequest request, int lookback, int backtestDays) {
        if (request.getMethod() == null) {
            throw new InvalidParameterException("VaR method is required");
        }
        double confidence = request.getConfidence();
        if (!(confidence > 0.0 && confidence < 1.0)) {
            throw new InvalidParameterException("confidence must be in (0, 1): " + confidence);
        }
        if (lookback < 1 || backtestDays < 1) {
            throw new InvalidParameterException("lookback and backtest_days must be positive");
        }
        if (request.getPortfolioReturns() == null) {
            throw new InsufficientDataException("No portfolio returns supplied for backtest");
        }
        if (request.getMethod() == VarMethod.MONTE_CARLO) {
            boolean hasAssets = request.getAssetReturns() != null && !request.getAssetReturns().isEmpty();
            boolean hasWeights = request.getWeights() != null && !request.getWeights().isEmpty();
            if (!hasAssets || !hasWeights) {
                throw new MissingInputException("Monte Carlo requires asset_returns and weights");
            }
        }
    }
}
