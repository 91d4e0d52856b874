package com.stratlab.domain.model;

/**
 * 月度收益
 *
 * @param month         月份，格式 yyyy-MM
 * @param profit        当月平仓盈亏合计
 * @param profitPercent 相对月初权益的收益百分比
 */
public record MonthlyReturn(String month, double profit, double profitPercent) {
}
