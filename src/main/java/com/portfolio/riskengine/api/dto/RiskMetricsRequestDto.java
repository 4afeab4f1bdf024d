package com.portfolio.riskengine.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.portfolio.riskengine.domain.model.ReturnType;
import com.portfolio.riskengine.domain.service.metrics.RiskMetricsRequest;
import com.portfolio.riskengine.shared.exception.InvalidParameterException;
import lombok.Getter;
import lombok.Setter;

import java.util.List;

@Getter
@Setter
@JsonIgnoreProperties(ignoreUnknown = true)
public class RiskMetricsRequestDto extends PortfolioRequestDto {

    private String benchmark;
    private List<Integer> rollingWindows;
    private double riskFreeRate = 0.0;
    private Integer annualizationDays;
    private boolean includeBenchmark = true;

    public RiskMetricsRequest toRiskMetricsRequest() {
        if (riskFreeRate < 0 || riskFreeRate > 1) {
            throw new InvalidParameterException("risk_free_rate must be in [0, 1]: " + riskFreeRate);
        }
        return RiskMetricsRequest.builder()
                .benchmarkSymbol(benchmark)
                .includeBenchmark(includeBenchmark)
                .rollingWindows(rollingWindows)
                .riskFreeRate(riskFreeRate)
                .annualizationDays(annualizationDays)
                .returnType(resolveReturnType(ReturnType.LOG))
                .build();
    }
}
