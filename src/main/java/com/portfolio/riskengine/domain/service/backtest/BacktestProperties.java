package com.portfolio.riskengine.domain.service.backtest;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "backtest")
public class BacktestProperties {

    private int defaultLookback = 250;
    private int defaultDays = 250;
    private int minEstimationObservations = 10;
    private double kupiecEpsilon = 1e-6;
}
