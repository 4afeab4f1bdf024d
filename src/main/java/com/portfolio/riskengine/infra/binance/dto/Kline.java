package com.portfolio.riskengine.infra.binance.dto;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * One candle of {@code GET /api/v3/klines}. The endpoint returns positional arrays:
 * open time at index 0 and close price at index 4.
 */
public record Kline(long openTime, double close) {

    public static Kline fromArray(JsonNode node) {
        if (!node.isArray() || node.size() < 5) {
            throw new IllegalArgumentException("unexpected kline payload: " + node);
        }
        return new Kline(node.get(0).asLong(), Double.parseDouble(node.get(4).asText()));
    }

    public LocalDate openDate() {
        return Instant.ofEpochMilli(openTime).atZone(ZoneOffset.UTC).toLocalDate();
    }
}
