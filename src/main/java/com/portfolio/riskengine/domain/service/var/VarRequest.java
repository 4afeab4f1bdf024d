package com.portfolio.riskengine.domain.service.var;

import com.portfolio.riskengine.domain.model.AssetReturnMatrix;
import com.portfolio.riskengine.domain.model.ReturnSeries;
import com.portfolio.riskengine.domain.model.ReturnType;
import lombok.Builder;
import lombok.Getter;

import java.util.Map;

@Getter
@Builder(toBuilder = true)
public class VarRequest {

    private final ReturnSeries portfolioReturns;
    private final AssetReturnMatrix assetReturns;
    private final Map<String, Double> weights;

    private final VarModelSpec model;
    @Builder.Default
    private final double confidence = 0.95;
    private final Integer lookback;
    @Builder.Default
    private final ReturnType returnType = ReturnType.SIMPLE;
    @Builder.Default
    private final int horizonDays = 1;
    private final Double portfolioValue;
    private final Integer rollingWindow;

    public boolean hasAssetInputs() {
        return assetReturns != null && !assetReturns.isEmpty() && weights != null && !weights.isEmpty();
    }
}
