package com.portfolio.riskengine.domain.service.var;

import com.portfolio.riskengine.domain.model.HsWeighting;
import com.portfolio.riskengine.domain.model.VarMethod;
import com.portfolio.riskengine.shared.exception.InvalidParameterException;

public record HistoricalSpec(HsWeighting weighting, double lambda) implements VarModelSpec {

    public static final double DEFAULT_LAMBDA = 0.94;

    public HistoricalSpec {
        if (weighting == null) {
            weighting = HsWeighting.NONE;
        }
        if (!(lambda > 0.0 && lambda < 1.0)) {
            throw new InvalidParameterException("hs_lambda must be in (0, 1): " + lambda);
        }
    }

    public static HistoricalSpec unweighted() {
        return new HistoricalSpec(HsWeighting.NONE, DEFAULT_LAMBDA);
    }

    @Override
    public VarMethod method() {
        return VarMethod.HISTORICAL;
    }
}
