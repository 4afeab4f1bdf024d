package com.portfolio.riskengine.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.portfolio.riskengine.domain.model.VarMethod;
import com.portfolio.riskengine.domain.service.backtest.BacktestRequest;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@JsonIgnoreProperties(ignoreUnknown = true)
public class BacktestRequestDto extends PortfolioRequestDto {

    private String method = "historical";
    private double confidence = 0.95;
    private Integer lookback;
    private Integer backtestDays;
    private Integer mcSims;
    private Long seed;

    public BacktestRequest toBacktestRequest() {
        return BacktestRequest.builder()
                .method(VarMethod.fromCode(method))
                .confidence(confidence)
                .lookback(lookback)
                .backtestDays(backtestDays)
                .simulations(mcSims)
                .seed(seed)
                .build();
    }
}
