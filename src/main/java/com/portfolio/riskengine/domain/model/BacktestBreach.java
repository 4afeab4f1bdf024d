package com.portfolio.riskengine.domain.model;

import java.time.LocalDate;

/** Row of the exceptions table: a date whose realized return breached the VaR threshold. */
public record BacktestBreach(LocalDate date, double realized, double varThreshold) {
}
