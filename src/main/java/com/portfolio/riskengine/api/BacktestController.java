package com.portfolio.riskengine.api;

import com.portfolio.riskengine.api.dto.BacktestRequestDto;
import com.portfolio.riskengine.domain.model.BacktestResult;
import com.portfolio.riskengine.domain.model.ReturnType;
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
@RequestMapping("/api/backtest")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class BacktestController {

    private final PortfolioRiskService portfolioRiskService;

    @PostMapping("/var")
    public ResponseEntity<BacktestResult> backtestVar(@RequestBody BacktestRequestDto body) {
        log.info("[Backtest API] request: method={}, confidence={}, lookback={}, days={}",
                body.getMethod(), body.getConfidence(), body.getLookback(), body.getBacktestDays());
        return ResponseEntity.ok(portfolioRiskService.backtest(
                body.toPriceTable(), body.getWeights(), body.resolveReturnType(ReturnType.LOG),
                body.toBacktestRequest()));
    }
}
