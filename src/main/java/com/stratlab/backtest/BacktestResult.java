package com.stratlab.backtest;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.stratlab.domain.model.EquityPoint;
import com.stratlab.domain.model.MonthlyReturn;
import com.stratlab.domain.model.Trade;
import com.stratlab.domain.model.TradingStrategy;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * 回测结果
 * 包含所有回测性能指标和详细数据，创建后不可变，持有的是策略的副本。
 * 结果只依赖输入，同一策略在相同K线上运行两次得到相同结果。
 */
@Value
@Builder(toBuilder = true)
public class BacktestResult {

    // === 基本信息 ===

    private TradingStrategy strategy;

    @JsonFormat(pattern = "yyyy-MM-dd HH:mm:ss")
    private LocalDateTime startDate;

    @JsonFormat(pattern = "yyyy-MM-dd HH:mm:ss")
    private LocalDateTime endDate;

    private double initialCapital;

    private double finalEquity;

    // === 交易统计 ===

    private int totalTrades;

    private int winningTrades;

    private int losingTrades;

    /**
     * 胜率，0~1
     */
    private double winRate;

    /**
     * 盈利交易平均收益百分比
     */
    private double averageWin;

    /**
     * 亏损交易平均亏损百分比（绝对值）
     */
    private double averageLoss;

    private double profitFactor;

    // === 收益与风险 ===

    private double netProfit;

    private double netProfitPercent;

    private double maxDrawdown;

    private double maxDrawdownPercent;

    private double sharpeRatio;

    /**
     * 年化收益率（小数形式）
     */
    private double annualizedReturn;

    // === 详细数据 ===

    @Builder.Default
    private List<Trade> trades = new ArrayList<>();

    @Builder.Default
    private List<EquityPoint> equityCurve = new ArrayList<>();

    @Builder.Default
    private List<MonthlyReturn> monthlyReturns = new ArrayList<>();

    /**
     * 由引擎输出和性能指标组装结果
     */
    public static BacktestResult of(BacktestRequest request,
                                    double finalEquity,
                                    List<Trade> trades,
                                    List<EquityPoint> equityCurve,
                                    PerformanceAnalyticsService.PerformanceMetrics metrics) {
        return BacktestResult.builder()
                .strategy(request.getStrategy().copy())
                .startDate(request.getStartDate())
                .endDate(request.getEndDate())
                .initialCapital(request.getInitialCapital())
                .finalEquity(finalEquity)
                .totalTrades(metrics.totalTrades())
                .winningTrades(metrics.winningTrades())
                .losingTrades(metrics.losingTrades())
                .winRate(metrics.winRate())
                .averageWin(metrics.averageWin())
                .averageLoss(metrics.averageLoss())
                .profitFactor(metrics.profitFactor())
                .netProfit(metrics.netProfit())
                .netProfitPercent(metrics.netProfitPercent())
                .maxDrawdown(metrics.maxDrawdown())
                .maxDrawdownPercent(metrics.maxDrawdownPercent())
                .sharpeRatio(metrics.sharpeRatio())
                .annualizedReturn(metrics.annualizedReturn())
                .trades(List.copyOf(trades))
                .equityCurve(List.copyOf(equityCurve))
                .monthlyReturns(List.copyOf(metrics.monthlyReturns()))
                .build();
    }

    /**
     * 获取回测期间（天数）
     */
    @JsonIgnore
    public long getBacktestDays() {
        if (startDate == null || endDate == null) {
            return 0;
        }
        return ChronoUnit.DAYS.between(startDate.toLocalDate(), endDate.toLocalDate());
    }

    /**
     * 获取中文摘要信息
     */
    @JsonIgnore
    public String getChineseSummary() {
        StringBuilder summary = new StringBuilder();
        summary.append("=== 回测摘要 ===\n");
        summary.append(String.format("策略: %s\n", strategy != null ? strategy.getDisplayName() : "-"));
        if (strategy != null) {
            summary.append(String.format("标的: %s\n", String.join(", ", strategy.getSymbols())));
        }
        if (startDate != null && endDate != null) {
            summary.append(String.format("期间: %s 至 %s (%d天)\n",
                    startDate.toLocalDate(), endDate.toLocalDate(), getBacktestDays()));
        }
        summary.append(String.format("初始资金: ¥%,.2f\n", initialCapital));
        summary.append(String.format("最终权益: ¥%,.2f\n", finalEquity));
        summary.append(String.format("净利润: ¥%,.2f (%.2f%%)\n", netProfit, netProfitPercent));
        summary.append(String.format("年化收益率: %.2f%%\n", annualizedReturn * 100));
        summary.append(String.format("最大回撤: ¥%,.2f (%.2f%%)\n", maxDrawdown, maxDrawdownPercent));
        summary.append(String.format("夏普比率: %.2f\n", sharpeRatio));
        summary.append(String.format("总交易次数: %d (盈利 %d / 亏损 %d)\n", totalTrades, winningTrades, losingTrades));
        summary.append(String.format("胜率: %.1f%%\n", winRate * 100));
        summary.append(String.format("平均盈利: %.2f%%  平均亏损: %.2f%%\n", averageWin, averageLoss));
        summary.append(String.format("盈亏因子: %.2f\n", profitFactor));
        return summary.toString();
    }
}
