package com.stratlab.backtest;

import com.stratlab.config.BacktestProperties;
import com.stratlab.domain.model.Bar;
import com.stratlab.domain.model.EquityPoint;
import com.stratlab.domain.model.RiskManagement;
import com.stratlab.domain.model.Trade;
import com.stratlab.domain.model.TradingStrategy;
import com.stratlab.indicator.IndicatorEngine;
import com.stratlab.marketdata.BarProvider;
import com.stratlab.strategy.ConditionEvaluator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.BooleanSupplier;

/**
 * 回测引擎
 * <p>
 * 按策略中标的的顺序逐个回测：每个标的独立获取K线、构建指标引擎和持仓状态机，
 * 从第1根K线开始逐根推进，平仓交易按发生顺序累加到同一个账户权益上。
 * 标的之间不按日期交错，权益曲线按标的顺序拼接。
 * </p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BacktestEngine {

    private static final BooleanSupplier NEVER_CANCELLED = () -> false;

    private final BarProvider barProvider;
    private final PerformanceAnalyticsService performanceAnalyticsService;
    private final BacktestProperties backtestProperties;

    public BacktestResult runBacktest(BacktestRequest request) {
        return runBacktest(request, NEVER_CANCELLED);
    }

    /**
     * 执行一次回测
     *
     * @param request               回测请求，缺省字段使用配置默认值
     * @param cancellationRequested 取消检查，在每个标的和每根K线之前调用
     * @return 回测结果
     * @throws IllegalArgumentException   请求或策略结构无效
     * @throws BacktestCancelledException 回测被取消
     */
    public BacktestResult runBacktest(BacktestRequest request, BooleanSupplier cancellationRequested) {
        if (request == null) {
            throw new IllegalArgumentException("回测请求不能为空");
        }
        BacktestRequest resolved = request.withDefaults(backtestProperties.getDefaults(), LocalDateTime.now());
        resolved.validate();

        TradingStrategy strategy = resolved.getStrategy();
        long startedAt = System.currentTimeMillis();
        log.info("开始回测: strategy={}, symbols={}, period={} to {}, capital={}, provider={}",
                strategy.getDisplayName(), strategy.getSymbols(), resolved.getStartDate(), resolved.getEndDate(),
                resolved.getInitialCapital(), barProvider.getName());

        EquityLedger ledger = new EquityLedger(resolved.getInitialCapital(), resolved.getStartDate());
        for (String symbol : strategy.getSymbols()) {
            checkCancellation(cancellationRequested, symbol);
            runSymbol(symbol, resolved, ledger, cancellationRequested);
        }

        PerformanceAnalyticsService.PerformanceMetrics metrics = performanceAnalyticsService.calculatePerformance(
                ledger.trades, ledger.equityCurve, resolved.getInitialCapital(), ledger.equity,
                resolved.getStartDate(), resolved.getEndDate());
        BacktestResult result = BacktestResult.of(resolved, ledger.equity, ledger.trades, ledger.equityCurve, metrics);

        log.info("回测完成: strategy={}, trades={}, finalEquity={}, netProfitPercent={}, 耗时{}ms",
                strategy.getDisplayName(), result.getTotalTrades(), result.getFinalEquity(),
                result.getNetProfitPercent(), System.currentTimeMillis() - startedAt);
        return result;
    }

    /**
     * 异步执行回测；取消返回的 future 会在下一个标的或K线边界处终止回测
     */
    public CompletableFuture<BacktestResult> runBacktestAsync(BacktestRequest request) {
        CompletableFuture<BacktestResult> future = new CompletableFuture<>();
        CompletableFuture.runAsync(() -> {
            try {
                future.complete(runBacktest(request, future::isCancelled));
            } catch (BacktestCancelledException e) {
                log.info("异步回测已取消: {}", e.getMessage());
            } catch (Throwable e) {
                log.error("异步回测失败", e);
                future.completeExceptionally(e);
            }
        });
        return future;
    }

    private void runSymbol(String symbol, BacktestRequest request, EquityLedger ledger,
                           BooleanSupplier cancellationRequested) {
        TradingStrategy strategy = request.getStrategy();
        List<Bar> bars = barProvider.getBars(symbol, request.getStartDate(), request.getEndDate(),
                strategy.getTimeframe());
        if (bars == null || bars.isEmpty()) {
            log.warn("标的在回测区间内没有K线数据，跳过: symbol={}", symbol);
            return;
        }

        IndicatorEngine indicatorEngine = new IndicatorEngine(symbol, bars);
        PositionTracker tracker = new PositionTracker(symbol, strategy, new ConditionEvaluator(indicatorEngine),
                request.getSlippageRate(), request.getCommissionRate());

        int tradesBefore = ledger.trades.size();
        RiskManagement risk = strategy.getRiskManagement();
        for (int i = 1; i < bars.size(); i++) {
            checkCancellation(cancellationRequested, symbol);
            Trade trade = tracker.onBar(i, ledger.equity, ledger.entriesAllowed(risk));
            if (trade != null) {
                ledger.apply(trade);
            }
        }
        Trade finalTrade = tracker.closeAtEnd();
        if (finalTrade != null) {
            ledger.apply(finalTrade);
        }

        log.info("标的回测完成: symbol={}, bars={}, trades={}, equity={}",
                symbol, bars.size(), ledger.trades.size() - tradesBefore, ledger.equity);
    }

    private static void checkCancellation(BooleanSupplier cancellationRequested, String symbol) {
        if (cancellationRequested.getAsBoolean()) {
            throw new BacktestCancelledException("回测已取消: symbol=" + symbol);
        }
    }

    /**
     * 一次回测中唯一的共享可变状态：运行权益、峰值、交易和权益曲线，按标的顺序更新
     */
    private static final class EquityLedger {

        private double equity;
        private double peakEquity;
        private final List<Trade> trades = new ArrayList<>();
        private final List<EquityPoint> equityCurve = new ArrayList<>();

        private EquityLedger(double initialCapital, LocalDateTime startDate) {
            this.equity = initialCapital;
            this.peakEquity = initialCapital;
            equityCurve.add(new EquityPoint(startDate, initialCapital));
        }

        private void apply(Trade trade) {
            equity += trade.getPnl();
            peakEquity = Math.max(peakEquity, equity);
            trades.add(trade);
            equityCurve.add(new EquityPoint(trade.getExitDate(), equity));
        }

        /**
         * 权益自峰值回撤达到上限时暂停开新仓
         */
        private boolean entriesAllowed(RiskManagement risk) {
            if (risk == null || !risk.isDrawdownGuardEnabled() || peakEquity <= 0) {
                return true;
            }
            double drawdownPercent = (peakEquity - equity) / peakEquity * 100;
            return drawdownPercent < risk.getMaxDrawdown();
        }
    }
}
