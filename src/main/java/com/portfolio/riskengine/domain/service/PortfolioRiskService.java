package com.portfolio.riskengine.domain.service;

import com.portfolio.riskengine.domain.model.AssetReturnMatrix;
import com.portfolio.riskengine.domain.model.BacktestResult;
import com.portfolio.riskengine.domain.model.PriceTable;
import com.portfolio.riskengine.domain.model.ReturnSeries;
import com.portfolio.riskengine.domain.model.ReturnType;
import com.portfolio.riskengine.domain.model.RiskMetricsResult;
import com.portfolio.riskengine.domain.model.VarMethod;
import com.portfolio.riskengine.domain.model.VarResult;
import com.portfolio.riskengine.domain.service.backtest.BacktestEngine;
import com.portfolio.riskengine.domain.service.backtest.BacktestRequest;
import com.portfolio.riskengine.domain.service.metrics.RiskMetricsEngine;
import com.portfolio.riskengine.domain.service.metrics.RiskMetricsRequest;
import com.portfolio.riskengine.domain.service.returns.ReturnsEngine;
import com.portfolio.riskengine.domain.service.var.VarEngine;
import com.portfolio.riskengine.domain.service.var.VarRequest;
import com.portfolio.riskengine.shared.exception.InsufficientDataException;
import com.portfolio.riskengine.shared.exception.InvalidParameterException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.Map;

/**
 * Entry point from the boundary layer: turns aligned prices into asset and portfolio
 * returns, then runs the requested engine under a timer.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PortfolioRiskService {

    private final ReturnsEngine returnsEngine;
    private final VarEngine varEngine;
    private final RiskMetricsEngine riskMetricsEngine;
    private final BacktestEngine backtestEngine;
    private final MeterRegistry meterRegistry;

    private final Map<VarMethod, Timer> varTimers = new EnumMap<>(VarMethod.class);
    private Timer metricsTimer;
    private Timer backtestTimer;
    private Counter backtestExceptionCounter;

    @PostConstruct
    void initMetrics() {
        for (VarMethod method : VarMethod.values()) {
            varTimers.put(method, Timer.builder("risk.var.duration")
                    .description("VaR computation time")
                    .tag("method", method.code())
                    .register(meterRegistry));
        }
        metricsTimer = Timer.builder("risk.metrics.duration")
                .description("Risk metrics computation time")
                .register(meterRegistry);
        backtestTimer = Timer.builder("risk.backtest.duration")
                .description("VaR backtest computation time")
                .register(meterRegistry);
        backtestExceptionCounter = Counter.builder("risk.backtest.exceptions")
                .description("VaR breaches found by backtests")
                .register(meterRegistry);
    }

    public PortfolioReturns prepareReturns(PriceTable prices, Map<String, Double> weights, ReturnType returnType) {
        if (weights == null || weights.isEmpty()) {
            throw new InvalidParameterException("Portfolio weights are required");
        }
        PriceTable selected = prices.select(weights.keySet());
        if (selected.isEmpty()) {
            throw new InsufficientDataException("No price data available for portfolio symbols");
        }

        AssetReturnMatrix assetReturns = returnsEngine.computeReturns(selected, returnType);
        ReturnSeries portfolio = returnsEngine.portfolioReturns(assetReturns, weights);
        if (portfolio.dropMissing().isEmpty()) {
            throw new InsufficientDataException("Insufficient price data to compute portfolio returns");
        }
        log.debug("[Portfolio] returns prepared: symbols={}, rows={}, missing={}",
                selected.symbols(), portfolio.size(), portfolio.missingCount());
        return new PortfolioReturns(assetReturns, portfolio);
    }

    public VarResult computeVar(PriceTable prices, Map<String, Double> weights, VarRequest request) {
        PortfolioReturns returns = prepareReturns(prices, weights, request.getReturnType());
        VarRequest full = request.toBuilder()
                .portfolioReturns(returns.portfolio())
                .assetReturns(returns.assetReturns())
                .weights(weights)
                .build();
        return varTimers.get(request.getModel().method()).record(() -> varEngine.computeVar(full));
    }

    public RiskMetricsResult computeRiskMetrics(PriceTable prices, Map<String, Double> weights,
                                                RiskMetricsRequest request) {
        PortfolioReturns returns = prepareReturns(prices, weights, request.getReturnType());
        RiskMetricsRequest full = request.toBuilder()
                .portfolioReturns(returns.portfolio())
                .assetReturns(returns.assetReturns())
                .weights(weights)
                .build();
        return metricsTimer.record(() -> riskMetricsEngine.computeRiskMetrics(full));
    }

    public BacktestResult backtest(PriceTable prices, Map<String, Double> weights, ReturnType returnType,
                                   BacktestRequest request) {
        PortfolioReturns returns = prepareReturns(prices, weights, returnType);
        boolean monteCarlo = request.getMethod() == VarMethod.MONTE_CARLO;
        BacktestRequest full = request.toBuilder()
                .portfolioReturns(returns.portfolio())
                .assetReturns(monteCarlo ? returns.assetReturns() : null)
                .weights(monteCarlo ? weights : null)
                .build();

        BacktestResult result = backtestTimer.record(() -> backtestEngine.backtest(full));
        backtestExceptionCounter.increment(result.getExceptionsCount());
        return result;
    }
}
