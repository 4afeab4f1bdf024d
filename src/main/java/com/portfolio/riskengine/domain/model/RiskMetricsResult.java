package com.portfolio.riskengine.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.util.List;

@Getter
@Builder
public class RiskMetricsResult {

    private final RiskSummary summary;
    private final RollingSeries rollingVol;
    private final RollingSeries rollingSharpe;
    private final CorrelationMatrix correlation;
    @Singular
    private final List<RiskContribution> contributions;
    private final PerformanceSeries cumulativeReturns;
    private final PerformanceSeries drawdownSeries;
    private final TailStatistics stats;
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private final BenchmarkAnalytics benchmark;
    private final RiskMetricsMetadata metadata;
    @Singular
    private final List<String> warnings;
}
