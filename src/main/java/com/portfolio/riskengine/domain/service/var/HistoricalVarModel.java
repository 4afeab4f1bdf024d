package com.portfolio.riskengine.domain.service.var;

import com.portfolio.riskengine.domain.model.HsWeighting;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class HistoricalVarModel {

    public VarEstimate estimate(double[] returns, double confidence, HistoricalSpec spec) {
        double alpha = 1.0 - confidence;
        double[] weights = spec.weighting() == HsWeighting.EWMA
                ? EmpiricalQuantiles.ewmaWeights(returns.length, spec.lambda())
                : null;

        double q = EmpiricalQuantiles.quantile(returns, weights, alpha);
        double cvar = -EmpiricalQuantiles.tailMean(returns, weights, q).orElse(q);

        log.debug("[VaR] historical: n={}, weighting={}, quantile={}", returns.length, spec.weighting().code(), q);
        return VarEstimate.builder()
                .var(-q)
                .cvar(cvar)
                .build();
    }
}
