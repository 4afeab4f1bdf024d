package com.portfolio.riskengine.domain.service.metrics;

import com.portfolio.riskengine.domain.model.AssetReturnMatrix;
import com.portfolio.riskengine.domain.model.ReturnSeries;
import com.portfolio.riskengine.domain.model.ReturnType;
import lombok.Builder;
import lombok.Getter;

import java.util.List;
import java.util.Map;

@Getter
@Builder(toBuilder = true)
public class RiskMetricsRequest {

    private final ReturnSeries portfolioReturns;
    private final AssetReturnMatrix assetReturns;
    private final Map<String, Double> weights;

    private final String benchmarkSymbol;
    @Builder.Default
    private final boolean includeBenchmark = true;
    private final List<Integer> rollingWindows;
    @Builder.Default
    private final double riskFreeRate = 0.0;
    private final Integer annualizationDays;
    @Builder.Default
    private final ReturnType returnType = ReturnType.LOG;
}
