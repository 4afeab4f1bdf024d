package com.portfolio.riskengine.domain.model;

import java.time.LocalDate;
import java.util.List;

/**
 * Out-of-window VaR path: each estimate uses only the observations before the paired
 * realized return.
 */
public record RollingVar(List<LocalDate> dates, List<Double> varSeries, List<Double> realized) {

    public RollingVar {
        dates = List.copyOf(dates);
        varSeries = List.copyOf(varSeries);
        realized = List.copyOf(realized);
    }
}
