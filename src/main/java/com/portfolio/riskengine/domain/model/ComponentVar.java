package com.portfolio.riskengine.domain.model;

public record ComponentVar(String symbol, double weight, double marginalVar, double componentVar) {
}
