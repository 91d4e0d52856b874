package com.stratlab.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 止损价计算方式
 */
public enum StopLossType {
    /** 与入场价相差固定价格 */
    FIXED("fixed"),
    /** 与入场价相差固定百分比 */
    PERCENTAGE("percentage");

    private final String code;

    StopLossType(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static StopLossType fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (StopLossType type : values()) {
            if (type.code.equalsIgnoreCase(code.trim())) {
                return type;
            }
        }
        throw new IllegalArgumentException("不支持的止损方式: " + code);
    }
}
