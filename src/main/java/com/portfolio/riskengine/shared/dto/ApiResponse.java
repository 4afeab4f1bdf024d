package com.portfolio.riskengine.shared.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Getter;

import java.time.Instant;

@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {

    private final String status;
    private final int statusCode;
    private final String message;
    private final T data;
    private final Instant timestamp;
    private final String path;
    private final String traceId;
}
