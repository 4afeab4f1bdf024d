package com.portfolio.riskengine.domain.service.returns;

import com.portfolio.riskengine.domain.model.AssetReturnMatrix;
import com.portfolio.riskengine.domain.model.PriceTable;
import com.portfolio.riskengine.domain.model.ReturnObservation;
import com.portfolio.riskengine.domain.model.ReturnSeries;
import com.portfolio.riskengine.domain.model.ReturnType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Slf4j
@Component
public class ReturnsEngine {

    static final int MIN_PRICES_PER_ASSET = 2;

    public AssetReturnMatrix computeReturns(PriceTable prices, ReturnType returnType) {
        if (prices == null || prices.isEmpty() || prices.rowCount() < MIN_PRICES_PER_ASSET) {
            return AssetReturnMatrix.empty();
        }
        for (int j = 0; j < prices.symbols().size(); j++) {
            if (prices.observationCount(j) < MIN_PRICES_PER_ASSET) {
                log.warn("[Returns] fewer than {} prices, no returns produced: symbol={}",
                        MIN_PRICES_PER_ASSET, prices.symbols().get(j));
                return AssetReturnMatrix.empty();
            }
        }

        int columns = prices.symbols().size();
        List<LocalDate> dates = new ArrayList<>(prices.rowCount() - 1);
        List<Double[]> rows = new ArrayList<>(prices.rowCount() - 1);

        for (int i = 1; i < prices.rowCount(); i++) {
            Double[] row = new Double[columns];
            boolean any = false;
            for (int j = 0; j < columns; j++) {
                row[j] = periodReturn(prices.price(i - 1, j), prices.price(i, j), returnType);
                any |= row[j] != null;
            }
            if (any) {
                dates.add(prices.dates().get(i));
                rows.add(row);
            }
        }

        log.debug("[Returns] computed {} returns: rows={}, symbols={}", returnType.code(), rows.size(), columns);
        return AssetReturnMatrix.of(dates, prices.symbols(), rows.toArray(new Double[0][]));
    }

    public ReturnSeries portfolioReturns(AssetReturnMatrix assetReturns, Map<String, Double> weights) {
        if (assetReturns == null || assetReturns.isEmpty()) {
            return ReturnSeries.empty();
        }

        List<Integer> weighted = new ArrayList<>();
        for (int j = 0; j < assetReturns.columnCount(); j++) {
            if (weights.containsKey(assetReturns.symbols().get(j))) {
                weighted.add(j);
            }
        }
        double[] w = assetReturns.weightVector(weights);

        List<ReturnObservation> out = new ArrayList<>(assetReturns.rowCount());
        int missing = 0;
        for (int i = 0; i < assetReturns.rowCount(); i++) {
            double sum = 0.0;
            boolean complete = true;
            for (int j : weighted) {
                Double r = assetReturns.value(i, j);
                if (r == null) {
                    complete = false;
                    break;
                }
                sum += w[j] * r;
            }
            if (!complete) {
                missing++;
            }
            out.add(new ReturnObservation(assetReturns.dates().get(i), complete ? sum : null));
        }

        if (missing > 0) {
            log.warn("[Returns] portfolio returns contain {} missing values ({}%)",
                    missing, String.format("%.1f", 100.0 * missing / out.size()));
        }
        return ReturnSeries.of(out);
    }

    /**
     * Aggregates one-period returns to {@code horizonDays}-period returns over
     * contiguous windows. Log returns are summed; simple returns are compounded.
     * Windows shorter than the horizon are dropped; missing values are dropped first.
     */
    public ReturnSeries aggregateToHorizon(ReturnSeries returns, ReturnType returnType, int horizonDays) {
        ReturnSeries clean = returns.dropMissing();
        if (horizonDays <= 1 || clean.size() < horizonDays) {
            return horizonDays <= 1 ? clean : ReturnSeries.empty();
        }

        double[] values = clean.values();
        List<LocalDate> dates = clean.dates();
        List<ReturnObservation> out = new ArrayList<>(values.length - horizonDays + 1);

        for (int end = horizonDays - 1; end < values.length; end++) {
            double aggregated;
            if (returnType == ReturnType.LOG) {
                aggregated = 0.0;
                for (int k = end - horizonDays + 1; k <= end; k++) {
                    aggregated += values[k];
                }
            } else {
                double growth = 1.0;
                for (int k = end - horizonDays + 1; k <= end; k++) {
                    growth *= 1.0 + values[k];
                }
                aggregated = growth - 1.0;
            }
            out.add(new ReturnObservation(dates.get(end), aggregated));
        }
        return ReturnSeries.of(out);
    }

    private Double periodReturn(Double previous, Double current, ReturnType returnType) {
        if (previous == null || current == null || previous <= 0) {
            return null;
        }
        if (returnType == ReturnType.LOG) {
            return current > 0 ? Math.log(current / previous) : null;
        }
        return current / previous - 1.0;
    }
}
