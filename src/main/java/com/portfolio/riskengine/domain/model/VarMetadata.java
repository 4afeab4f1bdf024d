package com.portfolio.riskengine.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class VarMetadata {

    private final int effectiveN;
    private final int horizonDays;
    private final ReturnType returnType;
    private final DriftMode drift;
    private final HsWeighting hsWeighting;
    private final double hsLambda;
    private final ParametricDistribution parametricDist;
    private final long seed;
    private final int mcSims;
    private final String covarianceMethod;
    private final String varUnits;
    private final ReturnType returnUnits;
    private final String horizonModel;

    private final Integer simulations;
    private final Double mu;
    private final Double sigma;
    private final Double df;
    private final Double loc;
    private final Double scale;
}
