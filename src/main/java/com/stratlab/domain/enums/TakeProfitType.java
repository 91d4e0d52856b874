package com.stratlab.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 止盈价计算方式
 */
public enum TakeProfitType {
    FIXED("fixed"),
    PERCENTAGE("percentage"),
    /** 止损距离的倍数 */
    RISK_MULTIPLE("risk_multiple");

    private final String code;

    TakeProfitType(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static TakeProfitType fromCode(String code) {
        if (code == null) {
            return null;
        }
        String normalized = code.trim().toLowerCase();
        if ("risk_ratio".equals(normalized)) {
            return RISK_MULTIPLE;
        }
        for (TakeProfitType type : values()) {
            if (type.code.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("不支持的止盈方式: " + code);
    }
}
