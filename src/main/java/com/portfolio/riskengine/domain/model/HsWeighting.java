package com.portfolio.riskengine.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.portfolio.riskengine.shared.exception.InvalidParameterException;

public enum HsWeighting {

    NONE("none"),
    EWMA("ewma");

    private final String code;

    HsWeighting(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static HsWeighting fromCode(String code) {
        if (code != null) {
            for (HsWeighting value : values()) {
                if (value.code.equalsIgnoreCase(code.trim())) {
                    return value;
                }
            }
        }
        throw new InvalidParameterException("Unknown historical weighting: " + code);
    }
}
