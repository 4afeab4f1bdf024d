package com.portfolio.riskengine.api;

import com.portfolio.riskengine.api.dto.VarRequestDto;
import com.portfolio.riskengine.domain.model.VarResult;
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
public class VarController {

    private final PortfolioRiskService portfolioRiskService;

    @PostMapping("/var")
    public ResponseEntity<VarResult> computeVar(@RequestBody VarRequestDto body) {
        log.info("[VaR API] request: method={}, confidence={}, horizon={}, symbols={}",
                body.getMethod(), body.getConfidence(), body.getHorizonDays(),
                body.getWeights() != null ? body.getWeights().keySet() : null);
        return ResponseEntity.ok(portfolioRiskService.computeVar(
                body.toPriceTable(), body.getWeights(), body.toVarRequest()));
    }
}
