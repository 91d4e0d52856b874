package com.stratlab.marketdata;

import com.stratlab.domain.enums.TimeFrame;
import com.stratlab.domain.model.Bar;

import java.time.LocalDateTime;
import java.util.List;

/**
 * K线数据源
 */
public interface BarProvider {

    /**
     * 获取指定区间内的K线，按时间严格递增排列，不含周末
     *
     * @param symbol    交易标的
     * @param start     开始时间（含）
     * @param end       结束时间（含）
     * @param timeFrame K线周期
     * @return K线列表，区间内无数据时返回空列表
     * @throws MarketDataException 数据源不可用或数据格式错误
     */
    List<Bar> getBars(String symbol, LocalDateTime start, LocalDateTime end, TimeFrame timeFrame);

    /**
     * 数据源名称，用于日志
     */
    String getName();
}
