package com.portfolio.riskengine.domain.model;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ordered, immutable series of dated returns with strictly increasing dates.
 * Missing values are kept as explicit gaps; callers choose a policy through
 * {@link #dropMissing()} or {@link #values()}.
 */
public final class ReturnSeries {

    private static final ReturnSeries EMPTY = new ReturnSeries(List.of());

    private final List<ReturnObservation> observations;

    private ReturnSeries(List<ReturnObservation> observations) {
        this.observations = observations;
    }

    public static ReturnSeries empty() {
        return EMPTY;
    }

    public static ReturnSeries of(List<ReturnObservation> observations) {
        if (observations == null || observations.isEmpty()) {
            return EMPTY;
        }
        LocalDate previous = null;
        for (ReturnObservation o : observations) {
            if (previous != null && !o.date().isAfter(previous)) {
                throw new IllegalArgumentException(
                        "dates must be strictly increasing: " + previous + " -> " + o.date());
            }
            previous = o.date();
        }
        return new ReturnSeries(Collections.unmodifiableList(new ArrayList<>(observations)));
    }

    public static ReturnSeries of(List<LocalDate> dates, double[] values) {
        if (dates.size() != values.length) {
            throw new IllegalArgumentException(
                    "dates and values differ in length: " + dates.size() + " vs " + values.length);
        }
        List<ReturnObservation> list = new ArrayList<>(values.length);
        for (int i = 0; i < values.length; i++) {
            list.add(new ReturnObservation(dates.get(i), values[i]));
        }
        return of(list);
    }

    public List<ReturnObservation> observations() {
        return observations;
    }

    public int size() {
        return observations.size();
    }

    public boolean isEmpty() {
        return observations.isEmpty();
    }

    public long missingCount() {
        return observations.stream().filter(ReturnObservation::isMissing).count();
    }

    public ReturnSeries dropMissing() {
        if (missingCount() == 0) {
            return this;
        }
        return of(observations.stream().filter(o -> !o.isMissing()).toList());
    }

    public ReturnSeries tail(int count) {
        if (count >= observations.size()) {
            return this;
        }
        return of(observations.subList(observations.size() - Math.max(count, 0), observations.size()));
    }

    public ReturnSeries slice(int fromInclusive, int toExclusive) {
        return of(observations.subList(fromInclusive, toExclusive));
    }

    public List<LocalDate> dates() {
        return observations.stream().map(ReturnObservation::date).toList();
    }

    /**
     * Values as a primitive array. Fails when any observation is missing; call
     * {@link #dropMissing()} first when gaps are acceptable.
     */
    public double[] values() {
        double[] out = new double[observations.size()];
        for (int i = 0; i < out.length; i++) {
            Double v = observations.get(i).value();
            if (v == null) {
                throw new IllegalStateException("missing value at " + observations.get(i).date());
            }
            out[i] = v;
        }
        return out;
    }

    public LocalDate firstDate() {
        return observations.get(0).date();
    }

    public LocalDate lastDate() {
        return observations.get(observations.size() - 1).date();
    }

    public ReturnObservation get(int index) {
        return observations.get(index);
    }

    public Map<LocalDate, Double> toMap() {
        Map<LocalDate, Double> map = new HashMap<>(observations.size() * 2);
        for (ReturnObservation o : observations) {
            if (!o.isMissing()) {
                map.put(o.date(), o.value());
            }
        }
        return map;
    }

    public Optional<Double> valueAt(LocalDate date) {
        return observations.stream()
                .filter(o -> o.date().equals(date))
                .findFirst()
                .map(ReturnObservation::value);
    }
}
