package com.stratlab.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.stratlab.domain.enums.StopLossType;
import com.stratlab.domain.enums.TakeProfitType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 风险管理配置
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RiskManagement {

    private StopLossType stopLossType;

    private double stopLossValue;

    private TakeProfitType takeProfitType;

    private double takeProfitValue;

    /**
     * 是否启用移动止损
     */
    private Boolean trailingStop;

    /**
     * 移动止损距离（百分比）
     */
    private Double trailingStopValue;

    /**
     * 最大回撤保护（百分比），权益回撤达到该值后不再开新仓
     */
    private Double maxDrawdown;

    @JsonIgnore
    public boolean isTrailingStopEnabled() {
        return Boolean.TRUE.equals(trailingStop) && trailingStopValue != null && trailingStopValue > 0;
    }

    @JsonIgnore
    public boolean isDrawdownGuardEnabled() {
        return maxDrawdown != null && maxDrawdown > 0;
    }

    public void validate() {
        if (stopLossValue < 0) {
            throw new IllegalArgumentException("止损数值不能为负数: " + stopLossValue);
        }
        if (takeProfitValue < 0) {
            throw new IllegalArgumentException("止盈数值不能为负数: " + takeProfitValue);
        }
        if (trailingStopValue != null && trailingStopValue < 0) {
            throw new IllegalArgumentException("移动止损数值不能为负数: " + trailingStopValue);
        }
        if (maxDrawdown != null && maxDrawdown < 0) {
            throw new IllegalArgumentException("最大回撤保护不能为负数: " + maxDrawdown);
        }
    }
}
