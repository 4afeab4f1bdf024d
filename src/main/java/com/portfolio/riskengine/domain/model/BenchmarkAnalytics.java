package com.portfolio.riskengine.domain.model;

import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class BenchmarkAnalytics {

    private final double beta;
    private final double alphaAnn;
    private final double r2;
    private final double corr;
    private final double trackingErrorAnn;
    private final Double informationRatio;
    private final int observations;
}
