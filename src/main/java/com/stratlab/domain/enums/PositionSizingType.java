package com.stratlab.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 仓位计算方式
 */
public enum PositionSizingType {
    /** 固定金额 */
    FIXED("fixed"),
    /** 当前权益的百分比 */
    PERCENTAGE("percentage"),
    /** 波动率仓位，目前按权益的2%占位 */
    VOLATILITY("volatility"),
    /** 凯利公式仓位，目前按权益的2%占位 */
    KELLY("kelly");

    private final String code;

    PositionSizingType(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static PositionSizingType fromCode(String code) {
        if (code == null) {
            return null;
        }
        String normalized = code.trim().toLowerCase();
        if ("percentage_of_equity".equals(normalized)) {
            return PERCENTAGE;
        }
        for (PositionSizingType type : values()) {
            if (type.code.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("不支持的仓位计算方式: " + code);
    }
}
