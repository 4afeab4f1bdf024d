package com.portfolio.riskengine.domain.model;

import java.util.Collections;
import java.util.List;

public record CorrelationMatrix(List<String> symbols, List<List<Double>> matrix) {

    public CorrelationMatrix {
        symbols = List.copyOf(symbols);
        matrix = matrix.stream().map(Collections::unmodifiableList).toList();
    }

    public static CorrelationMatrix empty() {
        return new CorrelationMatrix(List.of(), List.of());
    }
}
