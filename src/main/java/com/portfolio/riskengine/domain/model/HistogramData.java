package com.portfolio.riskengine.domain.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Equal-width histogram of a return distribution: {@code bins} holds the n+1 edges,
 * {@code counts} the n bin populations. The last bin is closed on the right.
 */
public record HistogramData(List<Double> bins, List<Integer> counts) {

    public HistogramData {
        bins = List.copyOf(bins);
        counts = List.copyOf(counts);
    }

    public static HistogramData of(double[] values, int binCount) {
        if (binCount <= 0) {
            throw new IllegalArgumentException("binCount must be positive: " + binCount);
        }
        double lo;
        double hi;
        if (values.length == 0) {
            lo = 0.0;
            hi = 1.0;
        } else {
            lo = Double.POSITIVE_INFINITY;
            hi = Double.NEGATIVE_INFINITY;
            for (double v : values) {
                lo = Math.min(lo, v);
                hi = Math.max(hi, v);
            }
            if (lo == hi) {
                lo -= 0.5;
                hi += 0.5;
            }
        }

        double width = (hi - lo) / binCount;
        List<Double> edges = new ArrayList<>(binCount + 1);
        for (int i = 0; i <= binCount; i++) {
            edges.add(i == binCount ? hi : lo + i * width);
        }

        int[] counts = new int[binCount];
        for (double v : values) {
            int idx = (int) Math.floor((v - lo) / (hi - lo) * binCount);
            if (idx >= binCount) {
                idx = binCount - 1;
            } else if (idx < 0) {
                idx = 0;
            }
            counts[idx]++;
        }

        List<Integer> countList = new ArrayList<>(binCount);
        for (int c : counts) {
            countList.add(c);
        }
        return new HistogramData(edges, countList);
    }

    public int total() {
        return counts.stream().mapToInt(Integer::intValue).sum();
    }
}
