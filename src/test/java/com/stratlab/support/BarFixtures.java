package com.stratlab.support;

import com.stratlab.domain.model.Bar;

import java.time.DayOfWeek;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 测试用K线构造工具
 */
public final class BarFixtures {

    public static final LocalDateTime START = LocalDateTime.of(2024, 1, 1, 0, 0);

    private BarFixtures() {}

    /**
     * 按收盘价生成工作日K线，开盘价等于收盘价，高低点为收盘价±0.5
     */
    public static List<Bar> fromCloses(double... closes) {
        return fromCloses(START, closes);
    }

    public static List<Bar> fromCloses(LocalDateTime start, double... closes) {
        List<Bar> bars = new ArrayList<>();
        List<LocalDateTime> dates = weekdays(start, closes.length);
        for (int i = 0; i < closes.length; i++) {
            bars.add(bar(dates.get(i), closes[i], closes[i] + 0.5, closes[i] - 0.5, closes[i]));
        }
        return bars;
    }

    public static Bar bar(LocalDateTime timestamp, double open, double high, double low, double close) {
        return Bar.builder()
                .timestamp(timestamp)
                .open(open)
                .high(high)
                .low(low)
                .close(close)
                .volume(100_000)
                .build();
    }

    public static List<LocalDateTime> weekdays(LocalDateTime start, int count) {
        List<LocalDateTime> dates = new ArrayList<>();
        LocalDateTime current = start;
        while (dates.size() < count) {
            DayOfWeek day = current.getDayOfWeek();
            if (day != DayOfWeek.SATURDAY && day != DayOfWeek.SUNDAY) {
                dates.add(current);
            }
            current = current.plusDays(1);
        }
        return dates;
    }

    /**
     * 第 index 根工作日K线的时间
     */
    public static LocalDateTime weekday(int index) {
        return weekdays(START, index + 1).get(index);
    }
}
