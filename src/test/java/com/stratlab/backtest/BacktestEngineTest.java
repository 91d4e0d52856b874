package com.stratlab.backtest;

import com.stratlab.config.BacktestProperties;
import com.stratlab.domain.enums.ConditionOperator;
import com.stratlab.domain.enums.ExitReason;
import com.stratlab.domain.enums.IndicatorType;
import com.stratlab.domain.enums.PositionSizingType;
import com.stratlab.domain.enums.StopLossType;
import com.stratlab.domain.enums.StrategyDirection;
import com.stratlab.domain.enums.TakeProfitType;
import com.stratlab.domain.enums.TimeFrame;
import com.stratlab.domain.model.Bar;
import com.stratlab.domain.model.Condition;
import com.stratlab.domain.model.EquityPoint;
import com.stratlab.domain.model.PositionSizing;
import com.stratlab.domain.model.RiskManagement;
import com.stratlab.domain.model.Trade;
import com.stratlab.domain.model.TradingStrategy;
import com.stratlab.marketdata.BarProvider;
import com.stratlab.marketdata.MarketDataException;
import com.stratlab.support.BarFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("BacktestEngine单元测试")
class BacktestEngineTest {

    private static final double EPS = 1e-6;
    private static final LocalDateTime START = BarFixtures.START;
    private static final LocalDateTime END = START.plusDays(60);

    private static final Condition ALWAYS = Condition.builder()
            .indicatorType(IndicatorType.PRICE)
            .operator(ConditionOperator.GREATER_THAN)
            .value(0.0)
            .build();

    @Mock
    private BarProvider barProvider;

    private BacktestEngine backtestEngine;

    @BeforeEach
    void setUp() {
        backtestEngine = new BacktestEngine(barProvider, new PerformanceAnalyticsService(), new BacktestProperties());
    }

    /**
     * 前20根收盘价100，第20根跌到90，之后每根上涨2
     */
    private static List<Bar> dipAndRecovery() {
        double[] closes = new double[30];
        for (int i = 0; i < closes.length; i++) {
            if (i < 20) {
                closes[i] = 100;
            } else {
                closes[i] = 90 + 2 * (i - 20);
            }
        }
        return BarFixtures.fromCloses(closes);
    }

    private static TradingStrategy rsiReversal() {
        return TradingStrategy.builder()
                .id("rsi_reversal")
                .name("RSI超卖反转")
                .symbols(List.of("TEST"))
                .direction(StrategyDirection.LONG)
                .entryConditions(List.of(Condition.builder()
                        .indicatorType(IndicatorType.RSI)
                        .parameter1(14)
                        .operator(ConditionOperator.LESS_THAN)
                        .value(30.0)
                        .build()))
                .positionSizing(PositionSizing.builder().type(PositionSizingType.FIXED).value(1000).build())
                .riskManagement(RiskManagement.builder()
                        .stopLossType(StopLossType.PERCENTAGE)
                        .stopLossValue(2)
                        .takeProfitType(TakeProfitType.PERCENTAGE)
                        .takeProfitValue(6)
                        .build())
                .build();
    }

    private static BacktestRequest request(TradingStrategy strategy) {
        return BacktestRequest.builder()
                .strategy(strategy)
                .startDate(START)
                .endDate(END)
                .initialCapital(100000.0)
                .build();
    }

    private void givenBars(String symbol, List<Bar> bars) {
        when(barProvider.getBars(eq(symbol), any(LocalDateTime.class), any(LocalDateTime.class), eq(TimeFrame.DAILY)))
                .thenReturn(bars);
    }

    @Test
    @DisplayName("RSI超卖入场，按默认滑点成交，触及6%目标价止盈")
    void testRsiReversalHitsTarget() {
        givenBars("TEST", dipAndRecovery());

        BacktestResult result = backtestEngine.runBacktest(request(rsiReversal()));

        assertThat(result.getTrades()).hasSize(1);
        Trade trade = result.getTrades().get(0);
        double entryPrice = 90 * 1.001;
        double targetPrice = entryPrice * 1.06;
        double expectedPnl = 1000 * (targetPrice / entryPrice - 1) - 1000 * 0.0005;

        assertThat(trade.getEntryDate()).isEqualTo(BarFixtures.weekday(20));
        assertThat(trade.getEntryPrice()).isCloseTo(entryPrice, within(EPS));
        assertThat(trade.getStopLossPrice()).isCloseTo(entryPrice * 0.98, within(EPS));
        assertThat(trade.getExitDate()).isEqualTo(BarFixtures.weekday(23));
        assertThat(trade.getExitReason()).isEqualTo(ExitReason.TAKE_PROFIT);
        assertThat(trade.getExitPrice()).isCloseTo(targetPrice, within(EPS));
        assertThat(trade.getPnl()).isCloseTo(expectedPnl, within(EPS));

        assertThat(result.getFinalEquity()).isCloseTo(100000 + expectedPnl, within(EPS));
        assertThat(result.getNetProfit()).isCloseTo(expectedPnl, within(EPS));
        assertThat(result.getWinningTrades()).isEqualTo(1);
        assertThat(result.getWinRate()).isEqualTo(1.0);
        assertThat(result.getMaxDrawdown()).isZero();
    }

    @Test
    @DisplayName("权益曲线以初始资金开头，每笔平仓追加一个点")
    void testEquityCurve() {
        givenBars("TEST", dipAndRecovery());

        BacktestResult result = backtestEngine.runBacktest(request(rsiReversal()));

        List<EquityPoint> curve = result.getEquityCurve();
        assertThat(curve).hasSize(result.getTrades().size() + 1);
        assertThat(curve.get(0)).isEqualTo(new EquityPoint(START, 100000));
        assertThat(curve.get(1).date()).isEqualTo(result.getTrades().get(0).getExitDate());
        assertThat(curve.get(curve.size() - 1).equity()).isEqualTo(result.getFinalEquity());
    }

    @Test
    @DisplayName("相同输入运行两次得到相同结果")
    void testDeterministic() {
        givenBars("TEST", dipAndRecovery());
        BacktestRequest request = request(rsiReversal());

        BacktestResult first = backtestEngine.runBacktest(request);
        BacktestResult second = backtestEngine.runBacktest(request);

        assertThat(second).isEqualTo(first);
    }

    @Test
    @DisplayName("标的依次回测，后一个标的按前一个标的平仓后的权益计算仓位")
    void testSequentialEquityAcrossSymbols() {
        List<Bar> bars = BarFixtures.fromCloses(100, 100, 110);
        givenBars("AAA", bars);
        givenBars("BBB", bars);
        TradingStrategy strategy = TradingStrategy.builder()
                .id("always_in")
                .symbols(List.of("AAA", "BBB"))
                .direction(StrategyDirection.LONG)
                .entryConditions(List.of(ALWAYS))
                .positionSizing(PositionSizing.builder().type(PositionSizingType.PERCENTAGE).value(10).build())
                .build();

        BacktestResult result = backtestEngine.runBacktest(request(strategy).toBuilder()
                .slippagePercent(0.0)
                .commissionPercent(0.0)
                .build());

        assertThat(result.getTrades()).extracting(Trade::getSymbol).containsExactly("AAA", "BBB");
        Trade first = result.getTrades().get(0);
        Trade second = result.getTrades().get(1);
        assertThat(first.getExitReason()).isEqualTo(ExitReason.END_OF_DATA);
        assertThat(first.getPositionSize()).isCloseTo(10000, within(EPS));
        assertThat(first.getPnl()).isCloseTo(1000, within(EPS));
        assertThat(second.getPositionSize()).isCloseTo(0.1 * (100000 + first.getPnl()), within(EPS));
        assertThat(result.getFinalEquity()).isCloseTo(100000 + first.getPnl() + second.getPnl(), within(EPS));
        assertThat(result.getEquityCurve()).hasSize(3);
    }

    @Test
    @DisplayName("回撤达到上限后不再开新仓")
    void testDrawdownGuardBlocksEntries() {
        List<Bar> bars = new ArrayList<>();
        bars.add(BarFixtures.bar(BarFixtures.weekday(0), 100, 100, 100, 100));
        bars.add(BarFixtures.bar(BarFixtures.weekday(1), 100, 100, 100, 100));
        bars.add(BarFixtures.bar(BarFixtures.weekday(2), 100, 100, 90, 92));
        bars.add(BarFixtures.bar(BarFixtures.weekday(3), 100, 100, 100, 100));
        bars.add(BarFixtures.bar(BarFixtures.weekday(4), 100, 100, 100, 100));
        givenBars("TEST", bars);
        RiskManagement risk = RiskManagement.builder()
                .stopLossType(StopLossType.PERCENTAGE)
                .stopLossValue(5)
                .maxDrawdown(1.0)
                .build();
        TradingStrategy strategy = TradingStrategy.builder()
                .id("guarded")
                .symbols(List.of("TEST"))
                .direction(StrategyDirection.LONG)
                .entryConditions(List.of(ALWAYS))
                .positionSizing(PositionSizing.builder().type(PositionSizingType.FIXED).value(50000).build())
                .riskManagement(risk)
                .build();
        BacktestRequest request = request(strategy).toBuilder()
                .slippagePercent(0.0)
                .commissionPercent(0.0)
                .build();

        BacktestResult guarded = backtestEngine.runBacktest(request);

        assertThat(guarded.getTrades()).hasSize(1);
        assertThat(guarded.getTrades().get(0).getExitReason()).isEqualTo(ExitReason.STOP_LOSS);
        assertThat(guarded.getTrades().get(0).getPnl()).isCloseTo(-2500, within(EPS));

        risk.setMaxDrawdown(null);
        BacktestResult unguarded = backtestEngine.runBacktest(request);

        assertThat(unguarded.getTrades()).hasSize(2);
        // 之前的结果持有策略副本，不受后续修改影响
        assertThat(guarded.getStrategy().getRiskManagement().getMaxDrawdown()).isEqualTo(1.0);
        assertThat(guarded.getStrategy()).isNotSameAs(request.getStrategy());
    }

    @Test
    @DisplayName("没有K线的标的被跳过，结果为零交易")
    void testEmptyBarsSkipped() {
        givenBars("TEST", List.of());

        BacktestResult result = backtestEngine.runBacktest(request(rsiReversal()));

        assertThat(result.getTotalTrades()).isZero();
        assertThat(result.getFinalEquity()).isEqualTo(100000);
        assertThat(result.getEquityCurve()).containsExactly(new EquityPoint(START, 100000));
        assertThat(result.getSharpeRatio()).isZero();
    }

    @Test
    @DisplayName("未填写的参数使用配置默认值")
    void testDefaultsApplied() {
        givenBars("TEST", List.of());
        BacktestRequest request = BacktestRequest.builder()
                .strategy(rsiReversal())
                .startDate(START)
                .endDate(END)
                .build();

        BacktestResult result = backtestEngine.runBacktest(request);

        assertThat(result.getInitialCapital()).isEqualTo(100000);
    }

    @Test
    @DisplayName("无效请求抛出IllegalArgumentException")
    void testInvalidRequest() {
        assertThatThrownBy(() -> backtestEngine.runBacktest(null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> backtestEngine.runBacktest(request(rsiReversal()).toBuilder()
                .startDate(END)
                .endDate(START)
                .build()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("开始时间");
        assertThatThrownBy(() -> backtestEngine.runBacktest(request(rsiReversal()).toBuilder()
                .initialCapital(-1.0)
                .build()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> backtestEngine.runBacktest(request(rsiReversal().toBuilder()
                .symbols(List.of())
                .build())))
                .isInstanceOf(IllegalArgumentException.class);

        verify(barProvider, never()).getBars(anyString(), any(), any(), any());
    }

    @Test
    @DisplayName("行情获取失败时异常向上传播")
    void testMarketDataFailurePropagates() {
        when(barProvider.getBars(anyString(), any(), any(), any()))
                .thenThrow(new MarketDataException("数据源不可用"));

        assertThatThrownBy(() -> backtestEngine.runBacktest(request(rsiReversal())))
                .isInstanceOf(MarketDataException.class)
                .hasMessageContaining("数据源不可用");
    }

    @Test
    @DisplayName("取消检查返回true时终止回测")
    void testCancellation() {
        assertThatThrownBy(() -> backtestEngine.runBacktest(request(rsiReversal()), () -> true))
                .isInstanceOf(BacktestCancelledException.class);

        verify(barProvider, never()).getBars(anyString(), any(), any(), any());
    }

    @Test
    @DisplayName("异步回测正常完成")
    void testRunBacktestAsync() throws Exception {
        givenBars("TEST", dipAndRecovery());

        BacktestResult result = backtestEngine.runBacktestAsync(request(rsiReversal())).get(10, TimeUnit.SECONDS);

        assertThat(result.getTotalTrades()).isEqualTo(1);
    }

    @Test
    @DisplayName("异步回测中抛出Error时future以异常完成")
    void testRunBacktestAsyncCompletesExceptionallyOnError() {
        when(barProvider.getBars(anyString(), any(), any(), any()))
                .thenThrow(new AssertionError("行情组件内部错误"));

        CompletableFuture<BacktestResult> future = backtestEngine.runBacktestAsync(request(rsiReversal()));

        assertThatThrownBy(() -> future.get(10, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(AssertionError.class)
                .hasMessageContaining("行情组件内部错误");
        assertThat(future.isCompletedExceptionally()).isTrue();
    }
}
