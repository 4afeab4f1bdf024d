package com.portfolio.riskengine.shared.exception;

public class MissingInputException extends RiskEngineException {

    public MissingInputException(String message) {
        super(ErrorCode.MISSING_INPUT, message);
    }
}
