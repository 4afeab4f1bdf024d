package com.portfolio.riskengine.domain.service.var;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "montecarlo")
public class MonteCarloProperties {

    private int simulationCap = 200_000;
    private int minRecommendedSimulations = 5_000;
    private int defaultSimulations = 10_000;
    private long defaultSeed = 42L;

    public int cappedSimulations(int requested) {
        return Math.min(requested, simulationCap);
    }
}
