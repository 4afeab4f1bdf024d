package com.portfolio.riskengine.shared.exception;

import java.util.Map;

public class InsufficientDataException extends RiskEngineException {

    public InsufficientDataException(String message) {
        super(ErrorCode.INSUFFICIENT_DATA, message);
    }

    public InsufficientDataException(String message, Map<String, Object> details) {
        super(ErrorCode.INSUFFICIENT_DATA, message, details);
    }
}
