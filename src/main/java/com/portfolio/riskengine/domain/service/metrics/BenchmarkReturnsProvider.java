package com.portfolio.riskengine.domain.service.metrics;

import com.portfolio.riskengine.domain.model.ReturnSeries;
import com.portfolio.riskengine.domain.model.ReturnType;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Source of benchmark returns. An empty result signals that the benchmark could not
 * be fetched; implementations do not throw for remote failures.
 */
public interface BenchmarkReturnsProvider {

    Optional<ReturnSeries> fetchReturns(String symbol, LocalDate start, LocalDate end, ReturnType returnType);
}
