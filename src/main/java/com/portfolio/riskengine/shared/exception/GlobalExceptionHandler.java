package com.portfolio.riskengine.shared.exception;

import com.portfolio.riskengine.shared.dto.ApiResponse;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.lang.Nullable;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    static final String TRACE_ID = "traceId";

    @ExceptionHandler(RiskEngineException.class)
    public ResponseEntity<ApiResponse<Object>> handleRiskEngineException(
            RiskEngineException ex,
            HttpServletRequest request
    ) {
        ErrorCode errorCode = ex.getErrorCode();

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("errorCode", errorCode.name());
        if (ex.getDetails() != null && !ex.getDetails().isEmpty()) {
            data.put("details", ex.getDetails());
        }

        return buildErrorResponse(errorCode.getHttpStatus(), errorCode, ex.getMessage(), data, request, ex);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiResponse<Object>> handleIllegalArgument(
            IllegalArgumentException ex,
            HttpServletRequest request
    ) {
        return buildErrorResponse(
                ErrorCode.VALIDATION_ERROR.getHttpStatus(),
                ErrorCode.VALIDATION_ERROR,
                ex.getMessage(),
                Map.of("errorCode", ErrorCode.VALIDATION_ERROR.name()),
                request,
                ex
        );
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiResponse<Object>> handleHttpMessageNotReadable(
            HttpMessageNotReadableException ex,
            HttpServletRequest request
    ) {
        return buildErrorResponse(
                ErrorCode.VALIDATION_ERROR.getHttpStatus(),
                ErrorCode.VALIDATION_ERROR,
                "Malformed JSON request",
                Map.of("errorCode", ErrorCode.VALIDATION_ERROR.name()),
                request,
                ex
        );
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ApiResponse<Object>> handleMethodNotSupported(
            HttpRequestMethodNotSupportedException ex,
            HttpServletRequest request
    ) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("errorCode", ErrorCode.VALIDATION_ERROR.name());
        data.put("details", Map.of("method", ex.getMethod()));

        return buildErrorResponse(
                HttpStatus.METHOD_NOT_ALLOWED,
                ErrorCode.VALIDATION_ERROR,
                "HTTP method not supported",
                data,
                request,
                ex
        );
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Object>> handleGenericException(
            Exception ex,
            HttpServletRequest request
    ) {
        return buildErrorResponse(
                ErrorCode.INTERNAL_ERROR.getHttpStatus(),
                ErrorCode.INTERNAL_ERROR,
                ErrorCode.INTERNAL_ERROR.getDefaultMessage(),
                Map.of("errorCode", ErrorCode.INTERNAL_ERROR.name()),
                request,
                ex
        );
    }

    private ResponseEntity<ApiResponse<Object>> buildErrorResponse(
            HttpStatus status,
            ErrorCode errorCode,
            @Nullable String message,
            @Nullable Map<String, Object> data,
            HttpServletRequest request,
            Throwable ex
    ) {
        String existing = MDC.get(TRACE_ID);
        boolean generated = existing == null || existing.isBlank();
        String traceId = generated ? UUID.randomUUID().toString() : existing;
        String path = request.getRequestURI();

        // a generated id only lives for this handler's log lines
        try (MDC.MDCCloseable ignored = generated ? MDC.putCloseable(TRACE_ID, traceId) : null) {
            if (status.is5xxServerError()) {
                log.error("Handling exception [{}] - code={} path={} message={}",
                        traceId, errorCode.name(), path, ex.getMessage(), ex);
            } else {
                log.warn("Handling exception [{}] - code={} path={} message={}",
                        traceId, errorCode.name(), path, ex.getMessage());
            }
        }

        ApiResponse<Object> body = ApiResponse.<Object>builder()
                .status("ERROR")
                .statusCode(status.value())
                .message(message != null ? message : errorCode.getDefaultMessage())
                .data(data == null || data.isEmpty() ? null : data)
                .timestamp(Instant.now())
                .path(path)
                .traceId(traceId)
                .build();

        return ResponseEntity.status(status).body(body);
    }
}
