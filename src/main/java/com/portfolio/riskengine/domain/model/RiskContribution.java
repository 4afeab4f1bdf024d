package com.portfolio.riskengine.domain.model;

/**
 * Volatility decomposition for one asset: marginal (mctr), component (cctr) and
 * percentage (pct_cctr) contribution to annualized portfolio volatility.
 */
public record RiskContribution(String symbol, double weight, double mctr, double cctr, double pctCctr) {
}
