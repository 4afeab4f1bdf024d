package com.portfolio.riskengine.domain.service.var;

import com.portfolio.riskengine.domain.model.DriftMode;
import com.portfolio.riskengine.domain.model.VarMethod;
import com.portfolio.riskengine.shared.exception.InvalidParameterException;

public record MonteCarloSpec(int simulations, long seed, DriftMode drift) implements VarModelSpec {

    public MonteCarloSpec {
        if (simulations <= 0) {
            throw new InvalidParameterException("mc_sims must be positive: " + simulations);
        }
        if (drift == null) {
            drift = DriftMode.IGNORE;
        }
    }

    public MonteCarloSpec withSeed(long newSeed) {
        return new MonteCarloSpec(simulations, newSeed, drift);
    }

    @Override
    public VarMethod method() {
        return VarMethod.MONTE_CARLO;
    }
}
