package com.stratlab.domain.model;

import com.stratlab.domain.enums.IndicatorType;

/**
 * 指标引用：指标类型加最多三个参数
 *
 * @param type   指标类型
 * @param param1 参数1，例如均线周期
 * @param param2 参数2，例如MACD慢线周期
 * @param param3 参数3，例如MACD信号线周期（当前未使用）
 */
public record IndicatorRef(IndicatorType type, Integer param1, Integer param2, Integer param3) {

    public static IndicatorRef of(IndicatorType type, Integer param1) {
        return new IndicatorRef(type, param1, null, null);
    }

    public String describe() {
        StringBuilder sb = new StringBuilder(type != null ? type.getCode() : "null");
        if (param1 != null) {
            sb.append('(').append(param1);
            if (param2 != null) {
                sb.append(',').append(param2);
            }
            if (param3 != null) {
                sb.append(',').append(param3);
            }
            sb.append(')');
        }
        return sb.toString();
    }
}
