package com.portfolio.riskengine.domain.service.metrics;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.List;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "risk.metrics")
public class RiskMetricsProperties {

    private int annualizationDays = 252;
    private List<Integer> rollingWindows = List.of(30, 90, 252);
    private int minEffectiveSample = 50;
    private double maxMissingFraction = 0.20;
    private int minRegressionObservations = 10;
    private int minBenchmarkReturns = 10;
}
