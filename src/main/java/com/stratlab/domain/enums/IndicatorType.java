package com.stratlab.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 技术指标类型
 * <p>
 * 只有 PRICE/SMA/EMA/RSI/MACD/BOLLINGER 会被真正计算，其余类型沿用策略编辑器中的标签，
 * 计算时一律回退为收盘价。无法识别的标签反序列化为 {@link #UNKNOWN}。
 * </p>
 */
public enum IndicatorType {
    PRICE("price"),
    SMA("sma"),
    EMA("ema"),
    RSI("rsi"),
    MACD("macd"),
    BOLLINGER("bollinger"),
    STOCHASTIC("stochastic"),
    ATR("atr"),
    ADX("adx"),
    OBV("obv"),
    FIBONACCI("fibonacci"),
    ICHIMOKU("ichimoku"),
    PARABOLIC_SAR("parabolic_sar"),
    UNKNOWN("unknown");

    private final String code;

    IndicatorType(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static IndicatorType fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (IndicatorType type : values()) {
            if (type.code.equalsIgnoreCase(code.trim()) || type.name().equalsIgnoreCase(code.trim())) {
                return type;
            }
        }
        return UNKNOWN;
    }
}
