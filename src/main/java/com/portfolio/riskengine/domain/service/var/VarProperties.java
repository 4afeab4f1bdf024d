package com.portfolio.riskengine.domain.service.var;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "var")
public class VarProperties {

    private int histogramBins = 50;
    private int minEffectiveSample = 50;
    private double defaultEwmaLambda = 0.94;
    private int defaultRollingWindow = 250;
}
