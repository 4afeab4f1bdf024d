package com.portfolio.riskengine.domain.model;

import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class TailStatistics {

    private final double skew;
    private final double kurtosis;
    private final double bestDay;
    private final double worstDay;
    private final double hitRatio;
    private final double downsideDevAnn;
    private final Double calmarRatio;
}
