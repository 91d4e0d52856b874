package com.stratlab.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Duration;

/**
 * K线周期
 */
public enum TimeFrame {
    M1("1m", Duration.ofMinutes(1)),
    M5("5m", Duration.ofMinutes(5)),
    M15("15m", Duration.ofMinutes(15)),
    M30("30m", Duration.ofMinutes(30)),
    H1("1h", Duration.ofHours(1)),
    H4("4h", Duration.ofHours(4)),
    DAILY("daily", Duration.ofDays(1)),
    WEEKLY("weekly", Duration.ofDays(7)),
    MONTHLY("monthly", Duration.ofDays(30));

    private final String code;
    private final Duration step;

    TimeFrame(String code, Duration step) {
        this.code = code;
        this.step = step;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * 相邻两根K线之间的时间间隔
     */
    public Duration getStep() {
        return step;
    }

    @JsonCreator
    public static TimeFrame fromCode(String code) {
        if (code == null) {
            return null;
        }
        String normalized = code.trim().toLowerCase();
        if ("1d".equals(normalized)) {
            return DAILY;
        }
        for (TimeFrame timeFrame : values()) {
            if (timeFrame.code.equals(normalized)) {
                return timeFrame;
            }
        }
        throw new IllegalArgumentException("不支持的K线周期: " + code);
    }
}
