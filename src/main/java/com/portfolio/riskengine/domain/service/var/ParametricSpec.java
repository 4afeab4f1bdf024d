package com.portfolio.riskengine.domain.service.var;

import com.portfolio.riskengine.domain.model.DriftMode;
import com.portfolio.riskengine.domain.model.ParametricDistribution;
import com.portfolio.riskengine.domain.model.VarMethod;

public record ParametricSpec(ParametricDistribution distribution, DriftMode drift) implements VarModelSpec {

    public ParametricSpec {
        if (distribution == null) {
            distribution = ParametricDistribution.NORMAL;
        }
        if (drift == null) {
            drift = DriftMode.IGNORE;
        }
    }

    public static ParametricSpec normalWithoutDrift() {
        return new ParametricSpec(ParametricDistribution.NORMAL, DriftMode.IGNORE);
    }

    @Override
    public VarMethod method() {
        return VarMethod.PARAMETRIC;
    }
}
