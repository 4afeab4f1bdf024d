package com.portfolio.riskengine.domain.model;

import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class RiskSummary {

    private final double annVol;
    private final double maxDrawdown;
    private final Double beta;
    private final int ddDurationDays;
    private final double sharpeRatio;
    private final Double sortinoRatio;
    private final double annReturn;
}
