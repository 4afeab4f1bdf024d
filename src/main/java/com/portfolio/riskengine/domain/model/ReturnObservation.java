package com.portfolio.riskengine.domain.model;

import java.time.LocalDate;

/**
 * One dated return. A {@code null} value marks a missing observation.
 */
public record ReturnObservation(LocalDate date, Double value) {

    public ReturnObservation {
        if (date == null) {
            throw new IllegalArgumentException("date must not be null");
        }
        if (value != null && !Double.isFinite(value)) {
            value = null;
        }
    }

    public boolean isMissing() {
        return value == null;
    }
}
