package com.portfolio.riskengine.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.portfolio.riskengine.shared.exception.InvalidParameterException;

public enum DriftMode {

    IGNORE("ignore"),
    INCLUDE("include");

    private final String code;

    DriftMode(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static DriftMode fromCode(String code) {
        if (code != null) {
            for (DriftMode value : values()) {
                if (value.code.equalsIgnoreCase(code.trim())) {
                    return value;
                }
            }
        }
        throw new InvalidParameterException("Unknown drift mode: " + code);
    }
}
