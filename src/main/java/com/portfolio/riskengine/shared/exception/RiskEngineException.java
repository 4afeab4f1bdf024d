package com.portfolio.riskengine.shared.exception;

import lombok.Getter;
import org.springframework.lang.Nullable;

import java.util.Collections;
import java.util.Map;

/**
 * Base exception of the engine. Unchecked so that pure computation code does not
 * need throws clauses; the boundary layer maps the {@link ErrorCode} to a status.
 */
@Getter
public class RiskEngineException extends RuntimeException {

    private final ErrorCode errorCode;

    @Nullable
    private final Map<String, Object> details;

    public RiskEngineException(ErrorCode errorCode) {
        this(errorCode, null, null, null);
    }

    public RiskEngineException(ErrorCode errorCode, String message) {
        this(errorCode, message, null, null);
    }

    public RiskEngineException(ErrorCode errorCode, String message, Throwable cause) {
        this(errorCode, message, cause, null);
    }

    public RiskEngineException(ErrorCode errorCode, String message, Map<String, Object> details) {
        this(errorCode, message, null, details);
    }

    public RiskEngineException(ErrorCode errorCode,
                               String message,
                               Throwable cause,
                               Map<String, Object> details) {
        super(message != null ? message : errorCode.getDefaultMessage(), cause);
        this.errorCode = errorCode;
        this.details = details != null ? Collections.unmodifiableMap(details) : null;
    }
}
