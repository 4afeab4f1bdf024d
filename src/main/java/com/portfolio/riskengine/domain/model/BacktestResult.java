package com.portfolio.riskengine.domain.model;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.util.List;

@Getter
@Builder
public class BacktestResult {

    private final VarMethod method;
    private final double confidence;
    private final int exceptionsCount;
    private final double exceptionsRate;
    private final Double kupiecLr;
    private final Double kupiecPvalue;
    private final int availableDays;
    @Singular("observation")
    private final List<BacktestObservation> series;
    @Singular("breach")
    private final List<BacktestBreach> exceptionsTable;
}
