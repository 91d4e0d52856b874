package com.stratlab.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.stratlab.domain.enums.ConditionOperator;
import com.stratlab.domain.enums.IndicatorType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Objects;

/**
 * 策略条件
 * <p>
 * 左侧指标与固定值（value / valueRange）或右侧指标比较。交叉类运算符只在两个指标之间定义。
 * JSON结构与策略编辑器保持一致（扁平字段）。
 * </p>
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Condition {

    private String id;

    private IndicatorType indicatorType;

    private Integer parameter1;

    private Integer parameter2;

    private Integer parameter3;

    private ConditionOperator operator;

    /**
     * 固定比较值
     */
    private Double value;

    /**
     * range运算符使用的闭区间 [下限, 上限]
     */
    private List<Double> valueRange;

    private IndicatorType indicatorTypeRight;

    private Integer parameter1Right;

    private Integer parameter2Right;

    private Integer parameter3Right;

    @JsonIgnore
    public IndicatorRef getLeft() {
        return new IndicatorRef(indicatorType, parameter1, parameter2, parameter3);
    }

    @JsonIgnore
    public IndicatorRef getRight() {
        if (indicatorTypeRight == null) {
            return null;
        }
        return new IndicatorRef(indicatorTypeRight, parameter1Right, parameter2Right, parameter3Right);
    }

    @JsonIgnore
    public boolean hasRightIndicator() {
        return indicatorTypeRight != null;
    }

    /**
     * 校验条件结构
     */
    public void validate() {
        if (indicatorType == null) {
            throw new IllegalArgumentException("条件缺少指标类型: " + id);
        }
        if (operator == null) {
            throw new IllegalArgumentException("条件缺少运算符: " + id);
        }
        requireNonNegative(parameter1, "parameter1");
        requireNonNegative(parameter2, "parameter2");
        requireNonNegative(parameter3, "parameter3");
        requireNonNegative(parameter1Right, "parameter1Right");
        requireNonNegative(parameter2Right, "parameter2Right");
        requireNonNegative(parameter3Right, "parameter3Right");
        if (valueRange != null && (valueRange.size() != 2 || valueRange.stream().anyMatch(Objects::isNull))) {
            throw new IllegalArgumentException("条件 " + id + " 的valueRange必须包含上下限两个数值");
        }
    }

    /**
     * 条件的可读描述，例如 {@code rsi(14) less_than 30.0}
     */
    public String describe() {
        StringBuilder sb = new StringBuilder(getLeft().describe())
                .append(' ')
                .append(operator != null ? operator.getCode() : "null")
                .append(' ');
        if (hasRightIndicator()) {
            sb.append(getRight().describe());
        } else if (operator == ConditionOperator.RANGE && valueRange != null) {
            sb.append(valueRange);
        } else {
            sb.append(value);
        }
        return sb.toString();
    }

    private void requireNonNegative(Integer parameter, String name) {
        if (parameter != null && parameter < 0) {
            throw new IllegalArgumentException(
                    String.format("条件 %s 的参数 %s 不能为负数: %d", id, name, parameter));
        }
    }
}
