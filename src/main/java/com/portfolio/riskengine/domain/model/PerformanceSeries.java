package com.portfolio.riskengine.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.LocalDate;
import java.util.Collections;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record PerformanceSeries(List<LocalDate> dates, List<Double> portfolio, List<Double> benchmark) {

    public PerformanceSeries {
        dates = List.copyOf(dates);
        portfolio = List.copyOf(portfolio);
        benchmark = benchmark != null ? Collections.unmodifiableList(benchmark) : null;
    }
}
