package com.stratlab.marketdata;

import com.stratlab.domain.enums.TimeFrame;
import com.stratlab.domain.model.Bar;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * 合成行情数据源
 * <p>
 * 以标的代码各字符之和为种子生成随机游走K线：起始价 100 + seed%900，单根波动 (2 + seed%5)%，
 * 振幅为价格的1%~3%，跳过周末。同一标的、同一区间每次生成的数据完全相同。
 * </p>
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "backtest.data", name = "provider", havingValue = "synthetic", matchIfMissing = true)
public class SyntheticBarProvider implements BarProvider {

    private static final double MIN_RANGE_RATIO = 0.01;
    private static final double RANGE_SPREAD_RATIO = 0.02;
    private static final long MIN_VOLUME = 50_000;
    private static final long VOLUME_SPREAD = 1_000_000;

    @Override
    public List<Bar> getBars(String symbol, LocalDateTime start, LocalDateTime end, TimeFrame timeFrame) {
        int symbolSeed = symbolSeed(symbol);
        double price = 100 + (symbolSeed % 900);
        double volatility = 2 + (symbolSeed % 5);
        Random random = new Random(symbolSeed * 31L + start.toLocalDate().toEpochDay());
        Duration step = (timeFrame != null ? timeFrame : TimeFrame.DAILY).getStep();

        List<Bar> bars = new ArrayList<>();
        LocalDateTime current = start;
        while (!current.isAfter(end)) {
            if (!isWeekend(current.getDayOfWeek())) {
                double changePercent = (random.nextDouble() - 0.5) * volatility / 100;
                double open = price;
                double range = price * (MIN_RANGE_RATIO + random.nextDouble() * RANGE_SPREAD_RATIO);
                double close = price * (1 + changePercent);
                double high = Math.max(open, close) + random.nextDouble() * range;
                double low = Math.min(open, close) - random.nextDouble() * range;
                long volume = MIN_VOLUME + (long) (random.nextDouble() * VOLUME_SPREAD);

                bars.add(Bar.builder()
                        .timestamp(current)
                        .open(open)
                        .high(high)
                        .low(low)
                        .close(close)
                        .volume(volume)
                        .build());
                price = close;
            }
            current = current.plus(step);
        }
        log.debug("生成合成K线: symbol={}, timeframe={}, bars={}", symbol, timeFrame, bars.size());
        return bars;
    }

    @Override
    public String getName() {
        return "synthetic";
    }

    static int symbolSeed(String symbol) {
        return symbol.chars().sum();
    }

    static boolean isWeekend(DayOfWeek dayOfWeek) {
        return dayOfWeek == DayOfWeek.SATURDAY || dayOfWeek == DayOfWeek.SUNDAY;
    }
}
