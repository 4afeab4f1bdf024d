package com.portfolio.riskengine.domain.service.var;

public record StudentTFit(double df, double loc, double scale, boolean converged) {
}
