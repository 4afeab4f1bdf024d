package com.portfolio.riskengine.domain.service.metrics;

import com.portfolio.riskengine.domain.model.BenchmarkAnalytics;
import com.portfolio.riskengine.domain.model.ReturnObservation;
import com.portfolio.riskengine.domain.model.ReturnSeries;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;
import org.apache.commons.math3.stat.regression.SimpleRegression;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Regression of portfolio on benchmark returns over their common dates.
 */
@Slf4j
@Component
public class BenchmarkAnalyzer {

    public double[][] align(ReturnSeries portfolio, ReturnSeries benchmark) {
        Map<LocalDate, Double> bench = benchmark.toMap();
        List<double[]> pairs = new ArrayList<>();
        for (ReturnObservation o : portfolio.observations()) {
            Double b = bench.get(o.date());
            if (!o.isMissing() && b != null) {
                pairs.add(new double[]{o.value(), b});
            }
        }
        double[][] out = new double[2][pairs.size()];
        for (int i = 0; i < pairs.size(); i++) {
            out[0][i] = pairs.get(i)[0];
            out[1][i] = pairs.get(i)[1];
        }
        return out;
    }

    public Optional<BenchmarkAnalytics> analyze(ReturnSeries portfolio, ReturnSeries benchmark,
                                                int annDays, int minObservations) {
        double[][] aligned = align(portfolio, benchmark);
        double[] p = aligned[0];
        double[] b = aligned[1];
        if (p.length < minObservations) {
            log.debug("[RiskMetrics] benchmark regression skipped: aligned={}", p.length);
            return Optional.empty();
        }

        SimpleRegression regression = new SimpleRegression(true);
        for (int i = 0; i < p.length; i++) {
            regression.addData(b[i], p[i]);
        }

        double[] active = new double[p.length];
        for (int i = 0; i < p.length; i++) {
            active[i] = p[i] - b[i];
        }
        double trackingError = PerformanceRatios.sampleStd(active) * Math.sqrt(annDays);
        double activeMeanAnn = StatUtils.mean(active) * annDays;

        return Optional.of(BenchmarkAnalytics.builder()
                .beta(regression.getSlope())
                .alphaAnn(regression.getIntercept() * annDays)
                .r2(regression.getRSquare())
                .corr(new PearsonsCorrelation().correlation(p, b))
                .trackingErrorAnn(trackingError)
                .informationRatio(trackingError > 0 ? activeMeanAnn / trackingError : null)
                .observations(p.length)
                .build());
    }
}
