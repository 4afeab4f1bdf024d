package com.portfolio.riskengine.domain.model;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Aligned price history: one row per date, one column per symbol.
 * A {@code null} price marks a missing quote.
 */
public final class PriceTable {

    private final List<LocalDate> dates;
    private final List<String> symbols;
    private final Double[][] prices;

    private PriceTable(List<LocalDate> dates, List<String> symbols, Double[][] prices) {
        this.dates = dates;
        this.symbols = symbols;
        this.prices = prices;
    }

    public static PriceTable of(List<LocalDate> dates, Map<String, List<Double>> closesBySymbol) {
        List<String> symbols = new ArrayList<>(closesBySymbol.keySet());
        Double[][] prices = new Double[dates.size()][symbols.size()];
        for (int j = 0; j < symbols.size(); j++) {
            List<Double> closes = closesBySymbol.get(symbols.get(j));
            if (closes == null || closes.size() != dates.size()) {
                throw new IllegalArgumentException("price column " + symbols.get(j)
                        + " does not match the date index (" + dates.size() + " rows)");
            }
            for (int i = 0; i < dates.size(); i++) {
                prices[i][j] = closes.get(i);
            }
        }
        return new PriceTable(checkedDates(dates), Collections.unmodifiableList(symbols), prices);
    }

    private static List<LocalDate> checkedDates(List<LocalDate> dates) {
        for (int i = 1; i < dates.size(); i++) {
            if (!dates.get(i).isAfter(dates.get(i - 1))) {
                throw new IllegalArgumentException("dates must be strictly increasing at index " + i);
            }
        }
        return List.copyOf(dates);
    }

    public List<LocalDate> dates() {
        return dates;
    }

    public List<String> symbols() {
        return symbols;
    }

    public int rowCount() {
        return dates.size();
    }

    public boolean isEmpty() {
        return dates.isEmpty() || symbols.isEmpty();
    }

    public Double price(int row, int column) {
        return prices[row][column];
    }

    /** Columns for the given symbols, in table order; unknown symbols are ignored. */
    public PriceTable select(Collection<String> keep) {
        List<String> kept = new ArrayList<>();
        List<Integer> columns = new ArrayList<>();
        for (int j = 0; j < symbols.size(); j++) {
            if (keep.contains(symbols.get(j))) {
                kept.add(symbols.get(j));
                columns.add(j);
            }
        }
        if (kept.size() == symbols.size()) {
            return this;
        }
        Double[][] out = new Double[prices.length][kept.size()];
        for (int i = 0; i < prices.length; i++) {
            for (int k = 0; k < columns.size(); k++) {
                out[i][k] = prices[i][columns.get(k)];
            }
        }
        return new PriceTable(dates, Collections.unmodifiableList(kept), out);
    }

    public long observationCount(int column) {
        long count = 0;
        for (Double[] row : prices) {
            if (row[column] != null) {
                count++;
            }
        }
        return count;
    }
}
