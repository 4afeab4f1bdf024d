package com.portfolio.riskengine.infra.binance.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "binance")
public class BinanceProperties {

    private String restBaseUrl = "https://api.binance.com";

    private String klineInterval = "1d";

    private int klineLimit = 1000;

    private int maxPages = 20;

    private long connectTimeoutSeconds = 10;

    private long readTimeoutSeconds = 30;
}
