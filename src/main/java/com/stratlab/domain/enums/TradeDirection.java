package com.stratlab.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 持仓方向
 */
public enum TradeDirection {
    LONG("long"),
    SHORT("short");

    private final String code;

    TradeDirection(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
