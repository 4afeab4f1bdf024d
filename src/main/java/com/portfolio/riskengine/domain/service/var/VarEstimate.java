package com.portfolio.riskengine.domain.service.var;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.util.List;

/**
 * Output of a single VaR model run. Losses are positive fractions of portfolio value.
 */
@Getter
@Builder
public class VarEstimate {

    private final double var;
    private final double cvar;
    @Singular
    private final List<String> warnings;

    private final Double mu;
    private final Double sigma;
    private final Double df;
    private final Double loc;
    private final Double scale;

    private final double[] simulated;
    private final Integer simulations;
}
