package com.portfolio.riskengine.domain.service.backtest;

import com.portfolio.riskengine.domain.model.AssetReturnMatrix;
import com.portfolio.riskengine.domain.model.ReturnSeries;
import com.portfolio.riskengine.domain.model.VarMethod;
import lombok.Builder;
import lombok.Getter;

import java.util.Map;

@Getter
@Builder(toBuilder = true)
public class BacktestRequest {

    private final ReturnSeries portfolioReturns;
    private final AssetReturnMatrix assetReturns;
    private final Map<String, Double> weights;

    private final VarMethod method;
    @Builder.Default
    private final double confidence = 0.95;
    private final Integer lookback;
    private final Integer backtestDays;
    private final Integer simulations;
    private final Long seed;
}
