package com.stratlab.strategy;

import com.stratlab.domain.enums.ConditionOperator;
import com.stratlab.domain.model.Condition;
import com.stratlab.domain.model.IndicatorRef;
import com.stratlab.indicator.IndicatorEngine;

import java.util.List;

/**
 * 策略条件求值器
 * <p>
 * 给定K线下标，判断单个条件或一组AND条件是否成立。本身无状态，
 * 指标值全部来自绑定的 {@link IndicatorEngine}。
 * </p>
 */
public class ConditionEvaluator {

    /**
     * equals 运算符的浮点容差
     */
    public static final double EQUALS_EPSILON = 0.0001;

    private final IndicatorEngine indicatorEngine;

    public ConditionEvaluator(IndicatorEngine indicatorEngine) {
        this.indicatorEngine = indicatorEngine;
    }

    public IndicatorEngine getIndicatorEngine() {
        return indicatorEngine;
    }

    /**
     * 所有条件是否在同一根K线上同时成立。空列表视为不成立。
     */
    public boolean allMatch(List<Condition> conditions, int index) {
        if (conditions == null || conditions.isEmpty()) {
            return false;
        }
        for (Condition condition : conditions) {
            if (!evaluate(condition, index)) {
                return false;
            }
        }
        return true;
    }

    public boolean evaluate(Condition condition, int index) {
        ConditionOperator operator = condition.getOperator();
        if (operator == null) {
            return false;
        }
        double current = indicatorEngine.value(condition.getLeft(), index);

        if (!condition.hasRightIndicator()) {
            return compareWithFixedValue(condition, operator, current);
        }

        IndicatorRef right = condition.getRight();
        double currentCompare = indicatorEngine.value(right, index);

        if (operator.isCrossing()) {
            if (index <= 0) {
                return false;
            }
            double previous = indicatorEngine.value(condition.getLeft(), index - 1);
            double previousCompare = indicatorEngine.value(right, index - 1);
            return hasCrossed(operator, previous, previousCompare, current, currentCompare);
        }

        switch (operator) {
            case GREATER_THAN:
                return current > currentCompare;
            case LESS_THAN:
                return current < currentCompare;
            case EQUALS:
                return Math.abs(current - currentCompare) < EQUALS_EPSILON;
            default:
                return false;
        }
    }

    private boolean compareWithFixedValue(Condition condition, ConditionOperator operator, double current) {
        if (operator == ConditionOperator.RANGE) {
            List<Double> range = condition.getValueRange();
            if (range == null || range.size() != 2 || range.get(0) == null || range.get(1) == null) {
                return false;
            }
            return current >= range.get(0) && current <= range.get(1);
        }
        Double value = condition.getValue();
        if (value == null) {
            return false;
        }
        switch (operator) {
            case GREATER_THAN:
                return current > value;
            case LESS_THAN:
                return current < value;
            case EQUALS:
                return Math.abs(current - value) < EQUALS_EPSILON;
            default:
                // 交叉只在两个指标之间定义
                return false;
        }
    }

    static boolean hasCrossed(ConditionOperator operator,
                              double previous, double previousCompare,
                              double current, double currentCompare) {
        if (operator == ConditionOperator.CROSSES_ABOVE) {
            return previous < previousCompare && current >= currentCompare;
        }
        return previous > previousCompare && current <= currentCompare;
    }
}
