package com.portfolio.riskengine.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.portfolio.riskengine.domain.model.PriceTable;
import com.portfolio.riskengine.domain.model.ReturnType;
import com.portfolio.riskengine.shared.exception.InvalidParameterException;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aligned close prices and portfolio weights shared by every risk request.
 */
@Getter
@Setter
@JsonIgnoreProperties(ignoreUnknown = true)
public class PortfolioRequestDto {

    private List<LocalDate> dates;
    private Map<String, List<Double>> closes = new LinkedHashMap<>();
    private Map<String, Double> weights = new LinkedHashMap<>();
    private String returnType;

    public PriceTable toPriceTable() {
        if (dates == null || dates.isEmpty() || closes == null || closes.isEmpty()) {
            throw new InvalidParameterException("dates and closes are required");
        }
        return PriceTable.of(dates, closes);
    }

    public ReturnType resolveReturnType(ReturnType fallback) {
        return returnType == null || returnType.isBlank() ? fallback : ReturnType.fromCode(returnType);
    }
}
