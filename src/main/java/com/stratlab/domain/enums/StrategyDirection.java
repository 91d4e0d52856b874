package com.stratlab.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 策略允许的交易方向
 */
public enum StrategyDirection {
    LONG("long"),
    SHORT("short"),
    BOTH("both");

    private final String code;

    StrategyDirection(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static StrategyDirection fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (StrategyDirection direction : values()) {
            if (direction.code.equalsIgnoreCase(code.trim())) {
                return direction;
            }
        }
        throw new IllegalArgumentException("不支持的交易方向: " + code);
    }
}
