package com.portfolio.riskengine.domain.model;

import java.time.LocalDate;

public record BacktestObservation(LocalDate date, double realized, double varThreshold, boolean exception) {
}
