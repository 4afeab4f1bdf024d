package com.portfolio.riskengine.shared.exception;

import java.util.Map;

public class InvalidParameterException extends RiskEngineException {

    public InvalidParameterException(String message) {
        super(ErrorCode.INVALID_PARAMETER, message);
    }

    public InvalidParameterException(String message, Map<String, Object> details) {
        super(ErrorCode.INVALID_PARAMETER, message, details);
    }
}
