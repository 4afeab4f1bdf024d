package com.portfolio.riskengine.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.portfolio.riskengine.shared.exception.InvalidParameterException;

public enum ReturnType {

    SIMPLE("simple"),
    LOG("log");

    private final String code;

    ReturnType(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static ReturnType fromCode(String code) {
        if (code == null) {
            throw new InvalidParameterException("return_type is required");
        }
        for (ReturnType type : values()) {
            if (type.code.equalsIgnoreCase(code.trim())) {
                return type;
            }
        }
        throw new InvalidParameterException("Unknown return type: " + code);
    }
}
