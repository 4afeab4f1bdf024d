package com.portfolio.riskengine.domain.service.backtest;

/**
 * Kupiec likelihood-ratio statistic and its p-value; both {@code null} when the test
 * is undefined.
 */
public record KupiecResult(Double lr, Double pValue) {

    static final KupiecResult UNDEFINED = new KupiecResult(null, null);
}
