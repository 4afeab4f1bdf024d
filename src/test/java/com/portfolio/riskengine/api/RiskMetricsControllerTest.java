package com.portfolio.riskengine.api;

import com.portfolio.riskengine.domain.model.PriceTable;
import com.portfolio.riskengine.domain.model.ReturnType;
import com.portfolio.riskengine.domain.model.RiskMetricsResult;
import com.portfolio.riskengine.domain.model.RiskSummary;
import com.portfolio.riskengine.domain.service.PortfolioRiskService;
import com.portfolio.riskengine.domain.service.metrics.RiskMetricsRequest;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(RiskMetricsController.class)
class RiskMetricsControllerTest {

    private static final String PRICES = """
            "dates": ["2024-01-01", "2024-01-02", "2024-01-03"],
            "closes": {"BTCUSDT": [42000.0, 43000.0, 41500.0]},
            "weights": {"BTCUSDT": 1.0}
            """;

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private PortfolioRiskService portfolioRiskService;

    @Test
    void passesBenchmarkAndWindowsThrough() throws Exception {
        when(portfolioRiskService.computeRiskMetrics(any(PriceTable.class), anyMap(), any(RiskMetricsRequest.class)))
                .thenReturn(RiskMetricsResult.builder()
                        .summary(RiskSummary.builder().annVol(0.45).sharpeRatio(1.2).build())
                        .build());

        mockMvc.perform(post("/api/risk/metrics")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{" + PRICES + ", \"benchmark\": \"ETHUSDT\", \"rolling_windows\": [10, 20],"
                                + " \"risk_free_rate\": 0.04, \"return_type\": \"simple\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.summary.ann_vol").value(0.45))
                .andExpect(jsonPath("$.summary.sharpe_ratio").value(1.2));

        ArgumentCaptor<RiskMetricsRequest> request = ArgumentCaptor.forClass(RiskMetricsRequest.class);
        verify(portfolioRiskService).computeRiskMetrics(any(PriceTable.class), anyMap(), request.capture());
        assertThat(request.getValue().getBenchmarkSymbol()).isEqualTo("ETHUSDT");
        assertThat(request.getValue().getRollingWindows()).containsExactly(10, 20);
        assertThat(request.getValue().getRiskFreeRate()).isEqualTo(0.04);
        assertThat(request.getValue().getReturnType()).isEqualTo(ReturnType.SIMPLE);
    }

    @Test
    void defaultsToLogReturns() throws Exception {
        when(portfolioRiskService.computeRiskMetrics(any(PriceTable.class), anyMap(), any(RiskMetricsRequest.class)))
                .thenReturn(RiskMetricsResult.builder().build());

        mockMvc.perform(post("/api/risk/metrics")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{" + PRICES + "}"))
                .andExpect(status().isOk());

        ArgumentCaptor<RiskMetricsRequest> request = ArgumentCaptor.forClass(RiskMetricsRequest.class);
        verify(portfolioRiskService).computeRiskMetrics(any(PriceTable.class), anyMap(), request.capture());
        assertThat(request.getValue().getReturnType()).isEqualTo(ReturnType.LOG);
        assertThat(request.getValue().isIncludeBenchmark()).isTrue();
    }

    @Test
    void riskFreeRateAboveOneIsRejected() throws Exception {
        mockMvc.perform(post("/api/risk/metrics")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{" + PRICES + ", \"risk_free_rate\": 4.0}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.data.errorCode").value("INVALID_PARAMETER"));

        verifyNoInteractions(portfolioRiskService);
    }

    @Test
    void missingPricesAreRejected() throws Exception {
        mockMvc.perform(post("/api/risk/metrics")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"weights\": {\"BTCUSDT\": 1.0}}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(portfolioRiskService);
    }
}
