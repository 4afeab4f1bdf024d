package com.portfolio.riskengine.api;

import com.portfolio.riskengine.domain.model.HsWeighting;
import com.portfolio.riskengine.domain.model.PriceTable;
import com.portfolio.riskengine.domain.model.VarMethod;
import com.portfolio.riskengine.domain.model.VarResult;
import com.portfolio.riskengine.domain.service.PortfolioRiskService;
import com.portfolio.riskengine.domain.service.var.HistoricalSpec;
import com.portfolio.riskengine.domain.service.var.MonteCarloSpec;
import com.portfolio.riskengine.domain.service.var.VarRequest;
import com.portfolio.riskengine.shared.exception.InsufficientDataException;
import com.portfolio.riskengine.shared.exception.InvalidParameterException;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(VarController.class)
class VarControllerTest {

    private static final String PRICES = """
            "dates": ["2024-01-01", "2024-01-02", "2024-01-03"],
            "closes": {"BTCUSDT": [42000.0, 43000.0, 41500.0], "ETHUSDT": [2200.0, 2250.0, 2180.0]},
            "weights": {"BTCUSDT": 0.6, "ETHUSDT": 0.4}
            """;

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private PortfolioRiskService portfolioRiskService;

    @Test
    void mapsRequestFieldsOntoHistoricalModel() throws Exception {
        when(portfolioRiskService.computeVar(any(PriceTable.class), anyMap(), any(VarRequest.class)))
                .thenReturn(VarResult.builder()
                        .method(VarMethod.HISTORICAL)
                        .confidence(0.99)
                        .var(0.031)
                        .cvar(0.045)
                        .warning("Effective sample size < 50; results may be unstable.")
                        .build());

        mockMvc.perform(post("/api/risk/var")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{" + PRICES + ", \"method\": \"historical\", \"confidence\": 0.99,"
                                + " \"hs_weighting\": \"ewma\", \"hs_lambda\": 0.97, \"horizon_days\": 1}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.method").value("historical"))
                .andExpect(jsonPath("$.var").value(0.031))
                .andExpect(jsonPath("$.warnings[0]").value("Effective sample size < 50; results may be unstable."));

        ArgumentCaptor<PriceTable> prices = ArgumentCaptor.forClass(PriceTable.class);
        ArgumentCaptor<VarRequest> request = ArgumentCaptor.forClass(VarRequest.class);
        verify(portfolioRiskService).computeVar(prices.capture(), anyMap(), request.capture());
        assertThat(prices.getValue().symbols()).containsExactly("BTCUSDT", "ETHUSDT");
        assertThat(request.getValue().getConfidence()).isEqualTo(0.99);
        assertThat(request.getValue().getModel()).isEqualTo(new HistoricalSpec(HsWeighting.EWMA, 0.97));
    }

    @Test
    void monteCarloDefaultsSimulationsAndSeed() throws Exception {
        when(portfolioRiskService.computeVar(any(PriceTable.class), anyMap(), any(VarRequest.class)))
                .thenReturn(VarResult.builder().method(VarMethod.MONTE_CARLO).confidence(0.95).build());

        mockMvc.perform(post("/api/risk/var")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{" + PRICES + ", \"method\": \"monte_carlo\"}"))
                .andExpect(status().isOk());

        ArgumentCaptor<VarRequest> request = ArgumentCaptor.forClass(VarRequest.class);
        verify(portfolioRiskService).computeVar(any(PriceTable.class), anyMap(), request.capture());
        MonteCarloSpec spec = (MonteCarloSpec) request.getValue().getModel();
        assertThat(spec.simulations()).isEqualTo(10_000);
        assertThat(spec.seed()).isEqualTo(42L);
    }

    @Test
    void unknownMethodIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/risk/var")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{" + PRICES + ", \"method\": \"garch\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value("ERROR"))
                .andExpect(jsonPath("$.data.errorCode").value("INVALID_PARAMETER"));

        verifyNoInteractions(portfolioRiskService);
    }

    @Test
    void insufficientDataIsUnprocessable() throws Exception {
        when(portfolioRiskService.computeVar(any(PriceTable.class), anyMap(), any(VarRequest.class)))
                .thenThrow(new InsufficientDataException("Insufficient return data for VaR calculation",
                        Map.of("available", 0)));

        mockMvc.perform(post("/api/risk/var")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{" + PRICES + "}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.message").value("Insufficient return data for VaR calculation"))
                .andExpect(jsonPath("$.data.errorCode").value("INSUFFICIENT_DATA"))
                .andExpect(jsonPath("$.data.details.available").value(0));
    }

    @Test
    void nullWeightsReachServiceValidation() throws Exception {
        when(portfolioRiskService.computeVar(any(PriceTable.class), isNull(), any(VarRequest.class)))
                .thenThrow(new InvalidParameterException("Portfolio weights are required"));

        mockMvc.perform(post("/api/risk/var")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"dates\": [\"2024-01-01\", \"2024-01-02\"],"
                                + " \"closes\": {\"BTCUSDT\": [42000.0, 43000.0]}, \"weights\": null}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Portfolio weights are required"))
                .andExpect(jsonPath("$.data.errorCode").value("INVALID_PARAMETER"));
    }

    @Test
    void malformedJsonIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/risk/var")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"dates\": ["))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.data.errorCode").value("VALIDATION_ERROR"));
    }
}
