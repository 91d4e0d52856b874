package com.stratlab.common.utils;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * 报告输出用的数值舍入工具
 */
public final class NumberFormatUtils {

    private static final int DEFAULT_SCALE = 2;
    private static final RoundingMode DEFAULT_ROUNDING_MODE = RoundingMode.HALF_UP;

    private NumberFormatUtils() {}

    /**
     * 保留两位小数
     */
    public static BigDecimal scale(double value) {
        return scale(value, DEFAULT_SCALE);
    }

    /**
     * 按指定精度四舍五入；非有限数值返回0
     */
    public static BigDecimal scale(double value, int scale) {
        if (!Double.isFinite(value)) {
            return BigDecimal.ZERO.setScale(scale, DEFAULT_ROUNDING_MODE);
        }
        return BigDecimal.valueOf(value).setScale(scale, DEFAULT_ROUNDING_MODE);
    }

    /**
     * 格式化为百分比文本，value 已经是百分数（例如 12.345 → "12.35%"）
     */
    public static String percent(double value) {
        return scale(value).toPlainString() + "%";
    }
}
