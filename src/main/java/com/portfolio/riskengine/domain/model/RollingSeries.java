package com.portfolio.riskengine.domain.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rolling statistics for several window sizes sharing one date axis. Values are
 * keyed by {@code <prefix>_<window>}; a {@code null} entry means the window was not
 * yet full (or the statistic was undefined) on that date.
 */
public record RollingSeries(List<LocalDate> dates, @JsonIgnore Map<String, List<Double>> values) {

    public RollingSeries {
        dates = List.copyOf(dates);
        Map<String, List<Double>> copy = new LinkedHashMap<>();
        values.forEach((key, series) -> copy.put(key, Collections.unmodifiableList(series)));
        values = Collections.unmodifiableMap(copy);
    }

    public List<Double> series(String key) {
        return values.get(key);
    }

    @JsonAnyGetter
    public Map<String, List<Double>> columns() {
        return values;
    }
}
