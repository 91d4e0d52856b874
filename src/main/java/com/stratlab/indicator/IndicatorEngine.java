package com.stratlab.indicator;

import com.stratlab.domain.enums.IndicatorType;
import com.stratlab.domain.model.Bar;
import com.stratlab.domain.model.IndicatorRef;
import lombok.extern.slf4j.Slf4j;
import org.ta4j.core.BarSeries;
import org.ta4j.core.BaseBarSeriesBuilder;
import org.ta4j.core.indicators.SMAIndicator;
import org.ta4j.core.indicators.bollinger.BollingerBandsMiddleIndicator;
import org.ta4j.core.indicators.helpers.ClosePriceIndicator;
import org.ta4j.core.num.DoubleNum;

import java.time.ZoneOffset;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 单个标的的指标计算引擎
 * <p>
 * 所有指标只使用 index 及其之前的K线（因果计算），历史不足时返回约定的默认值而不是抛异常。
 * SMA和布林带中轨基于ta4j的 {@link BarSeries} 计算；EMA与RSI的定义和ta4j不同
 * （EMA以前N根收盘价的均值为种子，RSI使用简单平均），因此按周期一次性正向计算整条序列并缓存。
 * </p>
 * 实例由一次回测中的单个标的独占，不是线程安全的。
 */
@Slf4j
public class IndicatorEngine {

    public static final int DEFAULT_PERIOD = 14;
    public static final int DEFAULT_MACD_FAST_PERIOD = 12;
    public static final int DEFAULT_MACD_SLOW_PERIOD = 26;
    public static final int DEFAULT_BOLLINGER_PERIOD = 20;

    private static final double RSI_NEUTRAL = 50.0;
    private static final double RSI_MAX = 100.0;

    private final String symbol;
    private final List<Bar> bars;
    private final double[] closes;
    private final BarSeries series;
    private final ClosePriceIndicator closePrice;

    private final Map<Integer, SMAIndicator> smaIndicators = new HashMap<>();
    private final Map<Integer, BollingerBandsMiddleIndicator> bollingerMiddles = new HashMap<>();
    private final Map<Integer, double[]> emaSeries = new HashMap<>();
    private final Map<Integer, double[]> rsiSeries = new HashMap<>();

    public IndicatorEngine(String symbol, List<Bar> bars) {
        this.symbol = symbol;
        this.bars = bars != null ? Collections.unmodifiableList(bars) : Collections.emptyList();
        this.closes = new double[this.bars.size()];
        for (int i = 0; i < this.bars.size(); i++) {
            closes[i] = this.bars.get(i).getClose();
        }
        this.series = buildBarSeries(symbol, this.bars);
        this.closePrice = new ClosePriceIndicator(series);
        log.debug("指标引擎已初始化: symbol={}, bars={}", symbol, closes.length);
    }

    public String getSymbol() {
        return symbol;
    }

    public int size() {
        return closes.length;
    }

    public Bar getBar(int index) {
        return bars.get(index);
    }

    public List<Bar> getBars() {
        return bars;
    }

    public double value(IndicatorRef ref, int index) {
        return value(ref.type(), ref.param1(), ref.param2(), ref.param3(), index);
    }

    /**
     * 计算指标在 index 处的值
     *
     * @param type  指标类型，null 与未实现的类型都回退为收盘价
     * @param p1    参数1，null或0时使用默认值
     * @param p2    参数2
     * @param p3    参数3（保留）
     * @param index K线下标
     * @return 指标值
     */
    public double value(IndicatorType type, Integer p1, Integer p2, Integer p3, int index) {
        IndicatorType resolved = type != null ? type : IndicatorType.UNKNOWN;
        switch (resolved) {
            case PRICE:
                return closes[index];
            case SMA:
                return sma(periodOrDefault(p1, DEFAULT_PERIOD), index);
            case EMA:
                return ema(periodOrDefault(p1, DEFAULT_PERIOD), index);
            case RSI:
                return rsi(periodOrDefault(p1, DEFAULT_PERIOD), index);
            case MACD:
                return macd(periodOrDefault(p1, DEFAULT_MACD_FAST_PERIOD),
                        periodOrDefault(p2, DEFAULT_MACD_SLOW_PERIOD), index);
            case BOLLINGER:
                return bollingerMiddle(periodOrDefault(p1, DEFAULT_BOLLINGER_PERIOD), index);
            default:
                return closes[index];
        }
    }

    /**
     * 简单移动平均；index &lt; period-1 时直接返回当根收盘价
     */
    public double sma(int period, int index) {
        if (index < period - 1) {
            return closes[index];
        }
        return smaIndicator(period).getValue(index).doubleValue();
    }

    /**
     * 指数移动平均，序列按周期缓存
     */
    public double ema(int period, int index) {
        return emaSeries.computeIfAbsent(period, this::computeEmaSeries)[index];
    }

    /**
     * 相对强弱指数；index &lt; period 时返回50，平均跌幅为0时返回100
     */
    public double rsi(int period, int index) {
        return rsiSeries.computeIfAbsent(period, this::computeRsiSeries)[index];
    }

    public double macd(int fastPeriod, int slowPeriod, int index) {
        return ema(fastPeriod, index) - ema(slowPeriod, index);
    }

    /**
     * 布林带中轨。上下轨不对外暴露。
     */
    public double bollingerMiddle(int period, int index) {
        if (index < period - 1) {
            return closes[index];
        }
        return bollingerMiddles
                .computeIfAbsent(period, p -> new BollingerBandsMiddleIndicator(smaIndicator(p)))
                .getValue(index)
                .doubleValue();
    }

    private SMAIndicator smaIndicator(int period) {
        return smaIndicators.computeIfAbsent(period, p -> new SMAIndicator(closePrice, p));
    }

    private double[] computeEmaSeries(int period) {
        double[] ema = new double[closes.length];
        double multiplier = 2.0 / (period + 1);
        for (int i = 0; i < closes.length; i++) {
            if (i < period - 1) {
                ema[i] = closes[i];
                continue;
            }
            double previous;
            if (i == period - 1) {
                double sum = 0;
                for (int j = 0; j < period; j++) {
                    sum += closes[j];
                }
                previous = sum / period;
            } else {
                previous = ema[i - 1];
            }
            ema[i] = (closes[i] - previous) * multiplier + previous;
        }
        return ema;
    }

    private double[] computeRsiSeries(int period) {
        double[] rsi = new double[closes.length];
        for (int index = 0; index < closes.length; index++) {
            if (index < period) {
                rsi[index] = RSI_NEUTRAL;
                continue;
            }
            double gains = 0;
            double losses = 0;
            for (int i = index - period + 1; i <= index; i++) {
                double change = closes[i] - closes[i - 1];
                if (change >= 0) {
                    gains += change;
                } else {
                    losses -= change;
                }
            }
            double avgGain = gains / period;
            double avgLoss = losses / period;
            if (avgLoss == 0) {
                rsi[index] = RSI_MAX;
                continue;
            }
            double rs = avgGain / avgLoss;
            rsi[index] = 100 - (100 / (1 + rs));
        }
        return rsi;
    }

    private static int periodOrDefault(Integer period, int defaultPeriod) {
        return period == null || period <= 0 ? defaultPeriod : period;
    }

    private static BarSeries buildBarSeries(String symbol, List<Bar> bars) {
        BarSeries series = new BaseBarSeriesBuilder()
                .withName(symbol)
                .withNumTypeOf(DoubleNum.class)
                .build();
        for (Bar bar : bars) {
            series.addBar(bar.getTimestamp().atZone(ZoneOffset.UTC),
                    bar.getOpen(), bar.getHigh(), bar.getLow(), bar.getClose(), bar.getVolume());
        }
        return series;
    }
}
