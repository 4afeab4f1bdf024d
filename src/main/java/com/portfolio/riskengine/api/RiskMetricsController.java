package com.portfolio.riskengine.api;

import com.portfolio.riskengine.api.dto.RiskMetricsRequestDto;
import com.portfolio.riskengine.domain.model.RiskMetricsResult;
import com.portfolio.riskengine.domain.service.PortfolioRiskService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequestMapping("/api/risk")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class RiskMetricsController {

    private final PortfolioRiskService portfolioRiskService;

    @PostMapping("/metrics")
    public ResponseEntity<RiskMetricsResult> computeRiskMetrics(@RequestBody RiskMetricsRequestDto body) {
        log.info("[Risk API] metrics request: symbols={}, benchmark={}",
                body.getWeights() != null ? body.getWeights().keySet() : null, body.getBenchmark());
        return ResponseEntity.ok(portfolioRiskService.computeRiskMetrics(
                body.toPriceTable(), body.getWeights(), body.toRiskMetricsRequest()));
    }
}
