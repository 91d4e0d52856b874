package com.stratlab.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.stratlab.domain.enums.PositionSizingType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 仓位管理配置
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PositionSizing {

    private PositionSizingType type;

    /**
     * 固定金额，或百分比数值（5表示5%）
     */
    private double value;

    /**
     * 单笔仓位上限
     */
    private Double maxPositionSize;

    /**
     * 同时持仓数上限。每个标的最多一个持仓且标的依次回测，因此目前只做记录
     */
    private Integer maxPositionsOpen;

    public void validate() {
        if (type == null) {
            throw new IllegalArgumentException("仓位管理缺少计算方式");
        }
        if (value < 0) {
            throw new IllegalArgumentException("仓位数值不能为负数: " + value);
        }
        if (maxPositionSize != null && maxPositionSize < 0) {
            throw new IllegalArgumentException("单笔仓位上限不能为负数: " + maxPositionSize);
        }
    }
}
