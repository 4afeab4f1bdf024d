package com.portfolio.riskengine.domain.model;

import lombok.Builder;
import lombok.Getter;

import java.util.List;

@Getter
@Builder
public class RiskMetricsMetadata {

    private final int annualizationDays;
    private final ReturnType returnType;
    private final int effectiveDays;
    private final List<String> symbols;
    private final String benchmarkSymbol;
    private final double riskFreeRate;
}
