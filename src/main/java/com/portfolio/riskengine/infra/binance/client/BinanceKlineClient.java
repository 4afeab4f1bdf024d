package com.portfolio.riskengine.infra.binance.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.portfolio.riskengine.infra.binance.config.BinanceProperties;
import com.portfolio.riskengine.infra.binance.dto.Kline;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Slf4j
@Component
@RequiredArgsConstructor
public class BinanceKlineClient {

    private final OkHttpClient okHttpClient;
    private final BinanceProperties properties;
    private final ObjectMapper objectMapper;

    /**
     * Daily candles with open time in [start, end], oldest first. Pages through the
     * endpoint limit; empty when any page fails.
     */
    public Optional<List<Kline>> getKlines(String symbol, LocalDate start, LocalDate end) {
        long startMs = start.atStartOfDay(ZoneOffset.UTC).toInstant().toEpochMilli();
        long endMs = end.plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant().toEpochMilli() - 1;
        String key = symbol.toUpperCase();

        List<Kline> klines = new ArrayList<>();
        long cursor = startMs;
        for (int page = 0; page < properties.getMaxPages() && cursor <= endMs; page++) {
            Optional<List<Kline>> batch = fetchPage(key, cursor, endMs);
            if (batch.isEmpty()) {
                return Optional.empty();
            }
            List<Kline> rows = batch.get();
            klines.addAll(rows);
            if (rows.size() < properties.getKlineLimit()) {
                break;
            }
            cursor = rows.get(rows.size() - 1).openTime() + 1;
        }

        log.debug("[Binance REST] klines received: symbol={}, count={}, start={}, end={}",
                key, klines.size(), start, end);
        return Optional.of(klines);
    }

    private Optional<List<Kline>> fetchPage(String symbol, long startMs, long endMs) {
        HttpUrl url = HttpUrl.get(properties.getRestBaseUrl()).newBuilder()
                .addPathSegments("api/v3/klines")
                .addQueryParameter("symbol", symbol)
                .addQueryParameter("interval", properties.getKlineInterval())
                .addQueryParameter("startTime", String.valueOf(startMs))
                .addQueryParameter("endTime", String.valueOf(endMs))
                .addQueryParameter("limit", String.valueOf(properties.getKlineLimit()))
                .build();

        Request request = new Request.Builder().url(url).get().build();

        try (Response response = okHttpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                log.warn("[Binance REST] klines request failed: symbol={}, code={}", symbol, response.code());
                return Optional.empty();
            }

            ResponseBody body = response.body();
            if (body == null) return Optional.empty();

            JsonNode root = objectMapper.readTree(body.string());
            if (!root.isArray()) {
                log.warn("[Binance REST] unexpected klines payload: symbol={}", symbol);
                return Optional.empty();
            }

            List<Kline> rows = new ArrayList<>(root.size());
            for (JsonNode node : root) {
                rows.add(Kline.fromArray(node));
            }
            return Optional.of(rows);

        } catch (IOException | IllegalArgumentException e) {
            log.error("[Binance REST] klines request error: symbol={}", symbol, e);
            return Optional.empty();
        }
    }
}
