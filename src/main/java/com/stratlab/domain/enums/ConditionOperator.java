package com.stratlab.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 条件比较运算符
 */
public enum ConditionOperator {
    GREATER_THAN("greater_than"),
    LESS_THAN("less_than"),
    EQUALS("equals"),
    RANGE("range"),
    CROSSES_ABOVE("crosses_above"),
    CROSSES_BELOW("crosses_below");

    private final String code;

    ConditionOperator(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public boolean isCrossing() {
        return this == CROSSES_ABOVE || this == CROSSES_BELOW;
    }

    @JsonCreator
    public static ConditionOperator fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (ConditionOperator operator : values()) {
            if (operator.code.equalsIgnoreCase(code.trim()) || operator.name().equalsIgnoreCase(code.trim())) {
                return operator;
            }
        }
        throw new IllegalArgumentException("不支持的条件运算符: " + code);
    }
}
