package com.portfolio.riskengine.infra.binance;

import com.portfolio.riskengine.domain.model.PriceTable;
import com.portfolio.riskengine.domain.model.ReturnSeries;
import com.portfolio.riskengine.domain.model.ReturnType;
import com.portfolio.riskengine.domain.service.metrics.BenchmarkReturnsProvider;
import com.portfolio.riskengine.domain.service.returns.ReturnsEngine;
import com.portfolio.riskengine.infra.binance.client.BinanceKlineClient;
import com.portfolio.riskengine.infra.binance.dto.Kline;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Benchmark returns from daily close prices of a Binance spot symbol.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BinanceBenchmarkReturnsProvider implements BenchmarkReturnsProvider {

    private final BinanceKlineClient klineClient;
    private final ReturnsEngine returnsEngine;

    @Override
    public Optional<ReturnSeries> fetchReturns(String symbol, LocalDate start, LocalDate end, ReturnType returnType) {
        Optional<List<Kline>> klines = klineClient.getKlines(symbol, start, end);
        if (klines.isEmpty() || klines.get().size() < 2) {
            log.warn("[Benchmark] no usable prices: symbol={}, start={}, end={}", symbol, start, end);
            return Optional.empty();
        }

        List<LocalDate> dates = new ArrayList<>();
        List<Double> closes = new ArrayList<>();
        for (Kline k : klines.get()) {
            LocalDate date = k.openDate();
            if (!dates.isEmpty() && !date.isAfter(dates.get(dates.size() - 1))) {
                continue;
            }
            dates.add(date);
            closes.add(k.close());
        }

        PriceTable prices = PriceTable.of(dates, Map.of(symbol, closes));
        ReturnSeries returns = returnsEngine.computeReturns(prices, returnType).column(symbol);
        log.debug("[Benchmark] returns built: symbol={}, count={}", symbol, returns.size());
        return returns.isEmpty() ? Optional.empty() : Optional.of(returns);
    }
}
