package com.portfolio.riskengine.domain.model;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.util.List;

@Getter
@Builder
public class VarResult {

    private final VarMethod method;
    private final double confidence;
    private final double var;
    private final double cvar;
    private final Double varAmount;
    private final Double cvarAmount;

    private final HistogramData histogram;
    private final HistogramData histogramRealized;
    private final HistogramData histogramSimulated;
    private final RollingVar rolling;

    @Singular("returnValue")
    private final List<Double> returns;
    @Singular
    private final List<String> warnings;
    private final VarMetadata metadata;

    private final List<ComponentVar> contributionsVar;
}
