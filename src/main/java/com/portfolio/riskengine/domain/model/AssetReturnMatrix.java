package com.portfolio.riskengine.domain.model;

import org.apache.commons.math3.stat.correlation.Covariance;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Per-asset returns aligned on a common date index. Rows are dates, columns are
 * symbols, {@code null} cells are missing observations. Immutable.
 */
public final class AssetReturnMatrix {

    private static final AssetReturnMatrix EMPTY =
            new AssetReturnMatrix(List.of(), List.of(), new Double[0][0]);

    private final List<LocalDate> dates;
    private final List<String> symbols;
    private final Double[][] values;

    private AssetReturnMatrix(List<LocalDate> dates, List<String> symbols, Double[][] values) {
        this.dates = dates;
        this.symbols = symbols;
        this.values = values;
    }

    public static AssetReturnMatrix empty() {
        return EMPTY;
    }

    public static AssetReturnMatrix of(List<LocalDate> dates, List<String> symbols, Double[][] values) {
        if (values.length != dates.size()) {
            throw new IllegalArgumentException("row count " + values.length
                    + " does not match date count " + dates.size());
        }
        Double[][] copy = new Double[values.length][];
        for (int i = 0; i < values.length; i++) {
            if (values[i].length != symbols.size()) {
                throw new IllegalArgumentException("row " + i + " has " + values[i].length
                        + " columns, expected " + symbols.size());
            }
            copy[i] = new Double[values[i].length];
            for (int j = 0; j < values[i].length; j++) {
                Double v = values[i][j];
                copy[i][j] = v != null && Double.isFinite(v) ? v : null;
            }
        }
        return new AssetReturnMatrix(List.copyOf(dates),
                Collections.unmodifiableList(new ArrayList<>(symbols)), copy);
    }

    public static AssetReturnMatrix of(List<LocalDate> dates, List<String> symbols, double[][] values) {
        Double[][] boxed = new Double[values.length][];
        for (int i = 0; i < values.length; i++) {
            boxed[i] = new Double[values[i].length];
            for (int j = 0; j < values[i].length; j++) {
                boxed[i][j] = values[i][j];
            }
        }
        return of(dates, symbols, boxed);
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

    public int columnCount() {
        return symbols.size();
    }

    public boolean isEmpty() {
        return dates.isEmpty() || symbols.isEmpty();
    }

    public Double value(int row, int column) {
        return values[row][column];
    }

    public ReturnSeries column(String symbol) {
        int j = symbols.indexOf(symbol);
        if (j < 0) {
            return ReturnSeries.empty();
        }
        List<ReturnObservation> list = new ArrayList<>(dates.size());
        for (int i = 0; i < dates.size(); i++) {
            list.add(new ReturnObservation(dates.get(i), values[i][j]));
        }
        return ReturnSeries.of(list);
    }

    public AssetReturnMatrix tail(int count) {
        if (count >= dates.size()) {
            return this;
        }
        int from = dates.size() - Math.max(count, 0);
        return selectRows(rangeIndices(from, dates.size()));
    }

    public AssetReturnMatrix restrictTo(Collection<LocalDate> keep) {
        Set<LocalDate> set = new HashSet<>(keep);
        List<Integer> rows = new ArrayList<>();
        for (int i = 0; i < dates.size(); i++) {
            if (set.contains(dates.get(i))) {
                rows.add(i);
            }
        }
        return selectRows(rows);
    }

    /** Drops rows where every asset is missing. */
    public AssetReturnMatrix dropEmptyRows() {
        List<Integer> rows = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            for (Double v : values[i]) {
                if (v != null) {
                    rows.add(i);
                    break;
                }
            }
        }
        return selectRows(rows);
    }

    /** Keeps only rows without any missing value. */
    public AssetReturnMatrix completeRows() {
        List<Integer> rows = new ArrayList<>();
        outer:
        for (int i = 0; i < values.length; i++) {
            for (Double v : values[i]) {
                if (v == null) {
                    continue outer;
                }
            }
            rows.add(i);
        }
        return selectRows(rows);
    }

    public double missingFraction(String symbol) {
        int j = symbols.indexOf(symbol);
        if (j < 0 || values.length == 0) {
            return 0.0;
        }
        int missing = 0;
        for (Double[] row : values) {
            if (row[j] == null) {
                missing++;
            }
        }
        return (double) missing / values.length;
    }

    public AssetReturnMatrix withoutSymbols(Collection<String> drop) {
        if (drop.isEmpty()) {
            return this;
        }
        List<String> kept = new ArrayList<>();
        List<Integer> columns = new ArrayList<>();
        for (int j = 0; j < symbols.size(); j++) {
            if (!drop.contains(symbols.get(j))) {
                kept.add(symbols.get(j));
                columns.add(j);
            }
        }
        Double[][] out = new Double[values.length][columns.size()];
        for (int i = 0; i < values.length; i++) {
            for (int k = 0; k < columns.size(); k++) {
                out[i][k] = values[i][columns.get(k)];
            }
        }
        return of(dates, kept, out);
    }

    /**
     * Dense copy of the matrix. Fails on missing cells; use {@link #completeRows()} first.
     */
    public double[][] toArray() {
        double[][] out = new double[values.length][symbols.size()];
        for (int i = 0; i < values.length; i++) {
            for (int j = 0; j < symbols.size(); j++) {
                Double v = values[i][j];
                if (v == null) {
                    throw new IllegalStateException("missing value at " + dates.get(i) + "/" + symbols.get(j));
                }
                out[i][j] = v;
            }
        }
        return out;
    }

    /**
     * Bias-corrected sample covariance of the columns. Requires at least two rows and
     * no missing cells.
     */
    public double[][] sampleCovariance() {
        if (values.length < 2) {
            throw new IllegalStateException("covariance needs at least 2 rows, got " + values.length);
        }
        return new Covariance(toArray()).getCovarianceMatrix().getData();
    }

    /** Weight per column; symbols without a weight entry get zero exposure. */
    public double[] weightVector(Map<String, Double> weights) {
        double[] w = new double[symbols.size()];
        for (int j = 0; j < symbols.size(); j++) {
            Double weight = weights.get(symbols.get(j));
            w[j] = weight != null ? weight : 0.0;
        }
        return w;
    }

    private AssetReturnMatrix selectRows(List<Integer> rows) {
        if (rows.size() == values.length) {
            return this;
        }
        List<LocalDate> keptDates = new ArrayList<>(rows.size());
        Double[][] out = new Double[rows.size()][];
        for (int k = 0; k < rows.size(); k++) {
            int i = rows.get(k);
            keptDates.add(dates.get(i));
            out[k] = values[i].clone();
        }
        return new AssetReturnMatrix(List.copyOf(keptDates), symbols, out);
    }

    private static List<Integer> rangeIndices(int from, int to) {
        List<Integer> list = new ArrayList<>(to - from);
        for (int i = from; i < to; i++) {
            list.add(i);
        }
        return list;
    }
}
