package com.stratlab.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.stratlab.domain.enums.StrategyDirection;
import com.stratlab.domain.enums.TimeFrame;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 交易策略定义
 * <p>
 * 由入场条件、出场条件（均为AND组合）、仓位管理和风险管理组成，是一次回测的不可变输入。
 * </p>
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TradingStrategy {

    private String id;

    private String name;

    private String description;

    @Builder.Default
    private List<String> symbols = new ArrayList<>();

    @Builder.Default
    private TimeFrame timeframe = TimeFrame.DAILY;

    @Builder.Default
    private List<Condition> entryConditions = new ArrayList<>();

    @Builder.Default
    private List<Condition> exitConditions = new ArrayList<>();

    private PositionSizing positionSizing;

    private RiskManagement riskManagement;

    private StrategyDirection direction;

    /**
     * 验证策略结构的有效性
     */
    public void validate() {
        if (symbols == null || symbols.isEmpty()) {
            throw new IllegalArgumentException("策略至少需要一个交易标的");
        }
        for (String symbol : symbols) {
            if (symbol == null || symbol.trim().isEmpty()) {
                throw new IllegalArgumentException("交易标的不能为空");
            }
        }
        if (direction == null) {
            throw new IllegalArgumentException("策略缺少交易方向");
        }
        if (positionSizing == null) {
            throw new IllegalArgumentException("策略缺少仓位管理配置");
        }
        positionSizing.validate();
        if (riskManagement != null) {
            riskManagement.validate();
        }
        if (entryConditions != null) {
            entryConditions.forEach(TradingStrategy::validateCondition);
        }
        if (exitConditions != null) {
            exitConditions.forEach(TradingStrategy::validateCondition);
        }
    }

    @JsonIgnore
    public String getDisplayName() {
        return name != null && !name.isBlank() ? name : (id != null ? id : "未命名策略");
    }

    /**
     * 深拷贝策略，修改副本不会影响原策略
     */
    public TradingStrategy copy() {
        return toBuilder()
                .symbols(symbols != null ? new ArrayList<>(symbols) : null)
                .entryConditions(copyConditions(entryConditions))
                .exitConditions(copyConditions(exitConditions))
                .positionSizing(positionSizing != null ? positionSizing.toBuilder().build() : null)
                .riskManagement(riskManagement != null ? riskManagement.toBuilder().build() : null)
                .build();
    }

    private static List<Condition> copyConditions(List<Condition> conditions) {
        if (conditions == null) {
            return null;
        }
        List<Condition> copies = new ArrayList<>(conditions.size());
        for (Condition condition : conditions) {
            if (condition == null) {
                copies.add(null);
                continue;
            }
            copies.add(condition.toBuilder()
                    .valueRange(condition.getValueRange() != null ? new ArrayList<>(condition.getValueRange()) : null)
                    .build());
        }
        return copies;
    }

    private static void validateCondition(Condition condition) {
        if (condition == null) {
            throw new IllegalArgumentException("条件列表中存在空条件");
        }
        condition.validate();
    }
}
