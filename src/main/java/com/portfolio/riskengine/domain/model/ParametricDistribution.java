package com.portfolio.riskengine.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.portfolio.riskengine.shared.exception.InvalidParameterException;

public enum ParametricDistribution {

    NORMAL("normal"),
    STUDENT_T("student_t");

    private final String code;

    ParametricDistribution(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static ParametricDistribution fromCode(String code) {
        if (code != null) {
            for (ParametricDistribution value : values()) {
                if (value.code.equalsIgnoreCase(code.trim())) {
                    return value;
                }
            }
        }
        throw new InvalidParameterException("Unknown parametric distribution: " + code);
    }
}
