package com.portfolio.riskengine.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.portfolio.riskengine.shared.exception.InvalidParameterException;

public enum VarMethod {

    HISTORICAL("historical"),
    PARAMETRIC("parametric"),
    MONTE_CARLO("monte_carlo");

    private final String code;

    VarMethod(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static VarMethod fromCode(String code) {
        if (code != null) {
            for (VarMethod value : values()) {
                if (value.code.equalsIgnoreCase(code.trim())) {
                    return value;
                }
            }
        }
        throw new InvalidParameterException("Unknown VaR method: " + code);
    }
}
