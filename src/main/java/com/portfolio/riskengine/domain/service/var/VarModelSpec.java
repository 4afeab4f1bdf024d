package com.portfolio.riskengine.domain.service.var;

import com.portfolio.riskengine.domain.model.VarMethod;

/**
 * Method-specific configuration of a VaR estimate. One implementation per {@link VarMethod}.
 */
public interface VarModelSpec {

    VarMethod method();
}
