package com.portfolio.riskengine.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.portfolio.riskengine.domain.model.DriftMode;
import com.portfolio.riskengine.domain.model.HsWeighting;
import com.portfolio.riskengine.domain.model.ParametricDistribution;
import com.portfolio.riskengine.domain.model.ReturnType;
import com.portfolio.riskengine.domain.model.VarMethod;
import com.portfolio.riskengine.domain.service.var.HistoricalSpec;
import com.portfolio.riskengine.domain.service.var.MonteCarloSpec;
import com.portfolio.riskengine.domain.service.var.ParametricSpec;
import com.portfolio.riskengine.domain.service.var.VarModelSpec;
import com.portfolio.riskengine.domain.service.var.VarRequest;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@JsonIgnoreProperties(ignoreUnknown = true)
public class VarRequestDto extends PortfolioRequestDto {

    private String method = "historical";
    private double confidence = 0.95;
    private Integer lookback;
    private int mcSims = 10_000;
    private long seed = 42L;
    private int horizonDays = 1;
    private String drift = "ignore";
    private String parametricDist = "normal";
    private String hsWeighting = "none";
    private double hsLambda = 0.94;
    private int rollingWindow = 250;
    private Double portfolioValue;

    public VarRequest toVarRequest() {
        return VarRequest.builder()
                .model(toModelSpec())
                .confidence(confidence)
                .lookback(lookback)
                .returnType(resolveReturnType(ReturnType.SIMPLE))
                .horizonDays(horizonDays)
                .rollingWindow(rollingWindow)
                .portfolioValue(portfolioValue)
                .build();
    }

    VarModelSpec toModelSpec() {
        return switch (VarMethod.fromCode(method)) {
            case HISTORICAL -> new HistoricalSpec(HsWeighting.fromCode(hsWeighting), hsLambda);
            case PARAMETRIC -> new ParametricSpec(ParametricDistribution.fromCode(parametricDist), DriftMode.fromCode(drift));
            case MONTE_CARLO -> new MonteCarloSpec(mcSims, seed, DriftMode.fromCode(drift));
        };
    }
}
