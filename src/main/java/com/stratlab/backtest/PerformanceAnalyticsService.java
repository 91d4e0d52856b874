package com.stratlab.backtest;

import com.stratlab.domain.model.EquityPoint;
import com.stratlab.domain.model.MonthlyReturn;
import com.stratlab.domain.model.Trade;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 性能分析服务
 * <p>
 * 接收交易记录和权益曲线作为输入，计算胜率、盈亏因子、最大回撤、夏普比率、
 * 年化收益率以及按月汇总的收益。所有输出都保证是有限数值，分母为0的情形统一返回0。
 * </p>
 */
@Slf4j
@Service
public class PerformanceAnalyticsService {

    private static final int TRADING_DAYS_PER_YEAR = 252;
    private static final double DAYS_PER_YEAR = 365.0;
    private static final double MILLIS_PER_DAY = 24 * 60 * 60 * 1000.0;

    /**
     * 性能指标结果的封装类
     *
     * @param totalTrades        总交易次数
     * @param winningTrades      盈利交易次数（pnl &gt; 0）
     * @param losingTrades       亏损交易次数（pnl &lt;= 0）
     * @param winRate            胜率，0~1
     * @param averageWin         盈利交易的平均收益百分比
     * @param averageLoss        亏损交易的平均亏损百分比（取绝对值）
     * @param profitFactor       盈亏因子
     * @param netProfit          净利润
     * @param netProfitPercent   净利润百分比
     * @param maxDrawdown        最大回撤金额
     * @param maxDrawdownPercent 最大回撤百分比
     * @param sharpeRatio        夏普比率
     * @param annualizedReturn   年化收益率（小数形式）
     * @param monthlyReturns     月度收益
     */
    public record PerformanceMetrics(
            int totalTrades,
            int winningTrades,
            int losingTrades,
            double winRate,
            double averageWin,
            double averageLoss,
            double profitFactor,
            double netProfit,
            double netProfitPercent,
            double maxDrawdown,
            double maxDrawdownPercent,
            double sharpeRatio,
            double annualizedReturn,
            List<MonthlyReturn> monthlyReturns
    ) {
    }

    /**
     * 计算并返回所有性能指标
     *
     * @param trades         已平仓交易，按平仓顺序
     * @param equityCurve    权益曲线，首点为初始资金
     * @param initialCapital 初始资金
     * @param finalEquity    最终权益
     * @param startDate      回测开始时间
     * @param endDate        回测结束时间
     * @return PerformanceMetrics 包含所有计算出的指标
     */
    public PerformanceMetrics calculatePerformance(List<Trade> trades,
                                                   List<EquityPoint> equityCurve,
                                                   double initialCapital,
                                                   double finalEquity,
                                                   LocalDateTime startDate,
                                                   LocalDateTime endDate) {
        List<Trade> safeTrades = trades != null ? trades : Collections.emptyList();
        List<EquityPoint> safeCurve = equityCurve != null ? equityCurve : Collections.emptyList();

        // 交易分析
        int totalTrades = safeTrades.size();
        int winningTrades = 0;
        double winPercentSum = 0;
        double lossPercentSum = 0;
        for (Trade trade : safeTrades) {
            if (trade.isWinning()) {
                winningTrades++;
                winPercentSum += trade.getPnlPercent();
            } else {
                lossPercentSum += Math.abs(trade.getPnlPercent());
            }
        }
        int losingTrades = totalTrades - winningTrades;

        double winRate = totalTrades == 0 ? 0 : (double) winningTrades / totalTrades;
        double averageWin = winningTrades == 0 ? 0 : winPercentSum / winningTrades;
        double averageLoss = losingTrades == 0 ? 0 : lossPercentSum / losingTrades;
        double profitFactor = calculateProfitFactor(winRate, averageWin, averageLoss);

        double netProfit = finalEquity - initialCapital;
        double netProfitPercent = initialCapital == 0 ? 0 : netProfit / initialCapital * 100;

        double[] drawdown = calculateMaxDrawdown(safeCurve, initialCapital);
        double sharpeRatio = calculateSharpeRatio(safeCurve);
        double annualizedReturn = calculateAnnualizedReturn(initialCapital, finalEquity, startDate, endDate);
        List<MonthlyReturn> monthlyReturns = calculateMonthlyReturns(safeTrades, safeCurve, initialCapital);

        return new PerformanceMetrics(
                totalTrades, winningTrades, losingTrades,
                winRate, averageWin, averageLoss, profitFactor,
                netProfit, netProfitPercent,
                drawdown[0], drawdown[1],
                sharpeRatio, annualizedReturn, monthlyReturns
        );
    }

    /**
     * 盈亏因子按期望形式计算：(胜率 × 平均盈利) / ((1 - 胜率) × 平均亏损)
     */
    double calculateProfitFactor(double winRate, double averageWin, double averageLoss) {
        double denominator = (1 - winRate) * averageLoss;
        if (averageLoss == 0 || denominator == 0) {
            return 0;
        }
        return winRate * averageWin / denominator;
    }

    /**
     * @return [最大回撤金额, 最大回撤百分比]；百分比以出现最大回撤时的峰值为基准
     */
    double[] calculateMaxDrawdown(List<EquityPoint> equityCurve, double initialCapital) {
        double peak = initialCapital;
        double maxDrawdown = 0;
        double peakAtMaxDrawdown = initialCapital;
        for (EquityPoint point : equityCurve) {
            if (point.equity() > peak) {
                peak = point.equity();
            }
            double drawdown = peak - point.equity();
            if (drawdown > maxDrawdown) {
                maxDrawdown = drawdown;
                peakAtMaxDrawdown = peak;
            }
        }
        double maxDrawdownPercent = peakAtMaxDrawdown > 0 ? maxDrawdown / peakAtMaxDrawdown * 100 : 0;
        return new double[]{maxDrawdown, maxDrawdownPercent};
    }

    /**
     * 基于权益曲线相邻点的收益率计算夏普比率，使用总体标准差，年化因子为 sqrt(252 / 收益率个数)
     */
    double calculateSharpeRatio(List<EquityPoint> equityCurve) {
        List<Double> returns = calculatePointReturns(equityCurve);
        if (returns.isEmpty()) {
            return 0;
        }
        double mean = returns.stream().mapToDouble(Double::doubleValue).sum() / returns.size();
        double variance = returns.stream()
                .mapToDouble(r -> (r - mean) * (r - mean))
                .sum() / returns.size();
        double stdDev = Math.sqrt(variance);
        if (stdDev == 0) {
            return 0;
        }
        return mean / stdDev * Math.sqrt((double) TRADING_DAYS_PER_YEAR / returns.size());
    }

    private List<Double> calculatePointReturns(List<EquityPoint> equityCurve) {
        List<Double> returns = new ArrayList<>();
        for (int i = 1; i < equityCurve.size(); i++) {
            double previousEquity = equityCurve.get(i - 1).equity();
            if (previousEquity != 0) {
                returns.add((equityCurve.get(i).equity() - previousEquity) / previousEquity);
            }
        }
        return returns;
    }

    /**
     * 年化收益率：(最终权益 / 初始资金)^(365 / 回测天数) - 1
     */
    double calculateAnnualizedReturn(double initialCapital, double finalEquity,
                                     LocalDateTime startDate, LocalDateTime endDate) {
        if (startDate == null || endDate == null || initialCapital <= 0) {
            return 0;
        }
        double totalDays = Duration.between(startDate, endDate).toMillis() / MILLIS_PER_DAY;
        if (totalDays <= 0) {
            return 0;
        }
        double growth = finalEquity / initialCapital;
        if (growth <= 0) {
            // 权益归零或为负时幂运算无意义，按全部亏损计
            return -1;
        }
        double annualized = Math.pow(growth, DAYS_PER_YEAR / totalDays) - 1;
        if (!Double.isFinite(annualized)) {
            log.warn("年化收益率溢出，回测区间过短: totalDays={}, growth={}", totalDays, growth);
            return 0;
        }
        return annualized;
    }

    /**
     * 按权益曲线中出现的自然月（yyyy-MM）分组；月初权益取该月第一个点之前的权益，
     * 当月利润为平仓时间落在该月的交易盈亏之和
     */
    List<MonthlyReturn> calculateMonthlyReturns(List<Trade> trades, List<EquityPoint> equityCurve,
                                                double initialCapital) {
        Map<String, Double> startEquityByMonth = new LinkedHashMap<>();
        for (int i = 0; i < equityCurve.size(); i++) {
            String month = monthKey(equityCurve.get(i).date());
            if (!startEquityByMonth.containsKey(month)) {
                double startEquity = i > 0 ? equityCurve.get(i - 1).equity() : initialCapital;
                startEquityByMonth.put(month, startEquity);
            }
        }

        Map<String, Double> profitByMonth = new LinkedHashMap<>();
        for (Trade trade : trades) {
            if (trade.getExitDate() == null) {
                continue;
            }
            String month = monthKey(trade.getExitDate());
            if (startEquityByMonth.containsKey(month)) {
                profitByMonth.merge(month, trade.getPnl(), Double::sum);
            }
        }

        List<MonthlyReturn> monthlyReturns = new ArrayList<>();
        for (Map.Entry<String, Double> entry : startEquityByMonth.entrySet()) {
            double profit = profitByMonth.getOrDefault(entry.getKey(), 0.0);
            double startEquity = entry.getValue();
            double profitPercent = startEquity != 0 ? profit / startEquity * 100 : 0;
            monthlyReturns.add(new MonthlyReturn(entry.getKey(), profit, profitPercent));
        }
        return monthlyReturns;
    }

    private static String monthKey(LocalDateTime dateTime) {
        return YearMonth.from(dateTime).toString();
    }
}
