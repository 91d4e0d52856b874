package com.stratlab.backtest;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.stratlab.config.BacktestProperties;
import com.stratlab.domain.model.TradingStrategy;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 回测请求参数
 * 封装一次回测所需的全部输入；未填写的字段由 {@link #withDefaults} 补齐
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class BacktestRequest {

    /**
     * 交易策略
     */
    private TradingStrategy strategy;

    /**
     * 回测开始时间
     */
    @JsonFormat(pattern = "yyyy-MM-dd HH:mm:ss")
    private LocalDateTime startDate;

    /**
     * 回测结束时间
     */
    @JsonFormat(pattern = "yyyy-MM-dd HH:mm:ss")
    private LocalDateTime endDate;

    /**
     * 初始资金
     */
    private Double initialCapital;

    /**
     * 滑点百分比（0.1 表示 0.1%）
     */
    private Double slippagePercent;

    /**
     * 佣金百分比（0.05 表示 0.05%）
     */
    private Double commissionPercent;

    /**
     * 用配置中的默认值补齐缺省字段，返回新的请求对象
     *
     * @param defaults 默认参数
     * @param now      当前时间，用于推算默认的回测区间
     */
    public BacktestRequest withDefaults(BacktestProperties.Defaults defaults, LocalDateTime now) {
        LocalDateTime resolvedEnd = endDate != null ? endDate : now;
        LocalDateTime resolvedStart = startDate != null ? startDate : now.minusDays(defaults.getLookbackDays());
        return toBuilder()
                .startDate(resolvedStart)
                .endDate(resolvedEnd)
                .initialCapital(initialCapital != null ? initialCapital : defaults.getInitialCapital())
                .slippagePercent(slippagePercent != null ? slippagePercent : defaults.getSlippagePercent())
                .commissionPercent(commissionPercent != null ? commissionPercent : defaults.getCommissionPercent())
                .build();
    }

    /**
     * 验证请求参数的有效性
     */
    public void validate() {
        if (strategy == null) {
            throw new IllegalArgumentException("交易策略不能为空");
        }
        strategy.validate();
        if (startDate == null) {
            throw new IllegalArgumentException("开始时间不能为空");
        }
        if (endDate == null) {
            throw new IllegalArgumentException("结束时间不能为空");
        }
        if (startDate.isAfter(endDate)) {
            throw new IllegalArgumentException("开始时间不能晚于结束时间");
        }
        if (initialCapital == null || !(initialCapital > 0) || initialCapital.isInfinite()) {
            throw new IllegalArgumentException("初始资金必须大于0");
        }
        if (slippagePercent == null || slippagePercent < 0 || slippagePercent.isNaN()) {
            throw new IllegalArgumentException("滑点不能为负数");
        }
        if (commissionPercent == null || commissionPercent < 0 || commissionPercent.isNaN()) {
            throw new IllegalArgumentException("佣金费率不能为负数");
        }
    }

    @JsonIgnore
    public double getSlippageRate() {
        return slippagePercent / 100.0;
    }

    @JsonIgnore
    public double getCommissionRate() {
        return commissionPercent / 100.0;
    }
}
