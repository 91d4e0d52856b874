package com.stratlab.backtest;

import com.stratlab.domain.enums.ExitReason;
import com.stratlab.domain.enums.StrategyDirection;
import com.stratlab.domain.enums.TradeDirection;
import com.stratlab.domain.model.Bar;
import com.stratlab.domain.model.Position;
import com.stratlab.domain.model.PositionSizing;
import com.stratlab.domain.model.RiskManagement;
import com.stratlab.domain.model.Trade;
import com.stratlab.domain.model.TradingStrategy;
import com.stratlab.indicator.IndicatorEngine;
import com.stratlab.strategy.ConditionEvaluator;
import lombok.extern.slf4j.Slf4j;

/**
 * 单个标的的持仓状态机
 * <p>
 * 状态流转：空仓 → 持仓 → 平仓（生成 {@link Trade}，持仓对象随即丢弃）。任意时刻最多一个持仓。
 * 持仓期间每根K线按以下优先级检查出场，先命中者生效：止损 → 止盈 → 出场条件。
 * 平仓的那根K线上不再评估入场。
 * </p>
 */
@Slf4j
public class PositionTracker {

    static final int DIRECTION_RSI_PERIOD = 14;
    static final double DIRECTION_RSI_THRESHOLD = 50.0;
    static final double PLACEHOLDER_EQUITY_RATIO = 0.02;

    private final String symbol;
    private final TradingStrategy strategy;
    private final ConditionEvaluator evaluator;
    private final IndicatorEngine indicatorEngine;
    private final double slippageRate;
    private final double commissionRate;

    private Position position;

    /**
     * @param symbol         交易标的
     * @param strategy       策略定义
     * @param evaluator      绑定该标的指标引擎的条件求值器
     * @param slippageRate   滑点比例（0.001 表示 0.1%）
     * @param commissionRate 佣金比例（0.0005 表示 0.05%）
     */
    public PositionTracker(String symbol, TradingStrategy strategy, ConditionEvaluator evaluator,
                           double slippageRate, double commissionRate) {
        this.symbol = symbol;
        this.strategy = strategy;
        this.evaluator = evaluator;
        this.indicatorEngine = evaluator.getIndicatorEngine();
        this.slippageRate = slippageRate;
        this.commissionRate = commissionRate;
    }

    public boolean isOpen() {
        return position != null;
    }

    public Position getPosition() {
        return position;
    }

    /**
     * 处理一根K线
     *
     * @param index          K线下标
     * @param equity         当前账户权益，用于按比例计算仓位
     * @param entriesAllowed 是否允许开新仓（回撤保护触发时为 false）
     * @return 本根K线平仓产生的交易；未平仓时返回 null
     */
    public Trade onBar(int index, double equity, boolean entriesAllowed) {
        if (position != null) {
            Trade closed = checkExit(index);
            if (closed == null) {
                updateTrailingStop(indicatorEngine.getBar(index));
            }
            return closed;
        }
        if (entriesAllowed) {
            tryEnter(index, equity);
        }
        return null;
    }

    /**
     * 回测结束时按最后一根K线收盘价平掉剩余持仓，不计滑点和佣金
     *
     * @return 平仓交易；没有持仓时返回 null
     */
    public Trade closeAtEnd() {
        if (position == null || indicatorEngine.size() == 0) {
            return null;
        }
        Bar lastBar = indicatorEngine.getBar(indicatorEngine.size() - 1);
        return closePosition(lastBar, lastBar.getClose(), ExitReason.END_OF_DATA, false);
    }

    private Trade checkExit(int index) {
        Bar bar = indicatorEngine.getBar(index);
        boolean isLong = position.isLong();

        Double stopPrice = position.getStopPrice();
        if (stopPrice != null) {
            boolean stopHit = isLong ? bar.getLow() <= stopPrice : bar.getHigh() >= stopPrice;
            if (stopHit) {
                return closePosition(bar, stopPrice, ExitReason.STOP_LOSS, true);
            }
        }

        Double targetPrice = position.getTargetPrice();
        if (targetPrice != null) {
            boolean targetHit = isLong ? bar.getHigh() >= targetPrice : bar.getLow() <= targetPrice;
            if (targetHit) {
                return closePosition(bar, targetPrice, ExitReason.TAKE_PROFIT, true);
            }
        }

        if (evaluator.allMatch(strategy.getExitConditions(), index)) {
            double exitPrice = isLong
                    ? bar.getClose() * (1 - slippageRate)
                    : bar.getClose() * (1 + slippageRate);
            return closePosition(bar, exitPrice, ExitReason.EXIT_SIGNAL, true);
        }
        return null;
    }

    private void tryEnter(int index, double equity) {
        if (!evaluator.allMatch(strategy.getEntryConditions(), index)) {
            return;
        }
        Bar bar = indicatorEngine.getBar(index);
        TradeDirection direction = resolveDirection(index);
        double size = computePositionSize(equity);
        if (!(size > 0)) {
            log.debug("入场条件满足但仓位不为正，跳过: symbol={}, time={}, size={}", symbol, bar.getTimestamp(), size);
            return;
        }

        double entryPrice = direction == TradeDirection.LONG
                ? bar.getClose() * (1 + slippageRate)
                : bar.getClose() * (1 - slippageRate);
        Double stopPrice = computeStopPrice(direction, entryPrice);
        Double targetPrice = computeTargetPrice(direction, entryPrice, stopPrice);

        position = Position.builder()
                .symbol(symbol)
                .entryTime(bar.getTimestamp())
                .entryPrice(entryPrice)
                .direction(direction)
                .size(size)
                .stopPrice(stopPrice)
                .targetPrice(targetPrice)
                .build();
        log.debug("开仓: symbol={}, time={}, direction={}, price={}, size={}, stop={}, target={}",
                symbol, bar.getTimestamp(), direction, entryPrice, size, stopPrice, targetPrice);
    }

    /**
     * 双向策略按RSI(14)是否低于50决定做多还是做空
     */
    TradeDirection resolveDirection(int index) {
        StrategyDirection direction = strategy.getDirection();
        if (direction == StrategyDirection.LONG) {
            return TradeDirection.LONG;
        }
        if (direction == StrategyDirection.SHORT) {
            return TradeDirection.SHORT;
        }
        return indicatorEngine.rsi(DIRECTION_RSI_PERIOD, index) < DIRECTION_RSI_THRESHOLD
                ? TradeDirection.LONG
                : TradeDirection.SHORT;
    }

    double computePositionSize(double equity) {
        PositionSizing sizing = strategy.getPositionSizing();
        double size;
        switch (sizing.getType()) {
            case FIXED:
                size = sizing.getValue();
                break;
            case PERCENTAGE:
                size = equity * (sizing.getValue() / 100);
                break;
            case VOLATILITY:
            case KELLY:
                size = equity * PLACEHOLDER_EQUITY_RATIO;
                break;
            default:
                size = 0;
        }
        Double maxPositionSize = sizing.getMaxPositionSize();
        if (maxPositionSize != null && maxPositionSize > 0 && size > maxPositionSize) {
            size = maxPositionSize;
        }
        return size;
    }

    private Double computeStopPrice(TradeDirection direction, double entryPrice) {
        RiskManagement risk = strategy.getRiskManagement();
        if (risk == null || risk.getStopLossType() == null) {
            return null;
        }
        boolean isLong = direction == TradeDirection.LONG;
        double value = risk.getStopLossValue();
        switch (risk.getStopLossType()) {
            case FIXED:
                return isLong ? entryPrice - value : entryPrice + value;
            case PERCENTAGE:
                return isLong ? entryPrice * (1 - value / 100) : entryPrice * (1 + value / 100);
            default:
                return null;
        }
    }

    private Double computeTargetPrice(TradeDirection direction, double entryPrice, Double stopPrice) {
        RiskManagement risk = strategy.getRiskManagement();
        if (risk == null || risk.getTakeProfitType() == null) {
            return null;
        }
        boolean isLong = direction == TradeDirection.LONG;
        double value = risk.getTakeProfitValue();
        switch (risk.getTakeProfitType()) {
            case FIXED:
                return isLong ? entryPrice + value : entryPrice - value;
            case PERCENTAGE:
                return isLong ? entryPrice * (1 + value / 100) : entryPrice * (1 - value / 100);
            case RISK_MULTIPLE:
                if (stopPrice == null) {
                    return null;
                }
                double riskAmount = Math.abs(entryPrice - stopPrice);
                return isLong ? entryPrice + riskAmount * value : entryPrice - riskAmount * value;
            default:
                return null;
        }
    }

    private void updateTrailingStop(Bar bar) {
        RiskManagement risk = strategy.getRiskManagement();
        if (risk == null || !risk.isTrailingStopEnabled()) {
            return;
        }
        double distance = risk.getTrailingStopValue() / 100;
        Double currentStop = position.getStopPrice();
        if (position.isLong()) {
            double candidate = bar.getHigh() * (1 - distance);
            position.setStopPrice(currentStop == null ? candidate : Math.max(currentStop, candidate));
        } else {
            double candidate = bar.getLow() * (1 + distance);
            position.setStopPrice(currentStop == null ? candidate : Math.min(currentStop, candidate));
        }
    }

    private Trade closePosition(Bar bar, double exitPrice, ExitReason reason, boolean chargeCommission) {
        double size = position.getSize();
        double entryPrice = position.getEntryPrice();
        double commission = chargeCommission ? size * commissionRate : 0;
        double pnl = position.isLong()
                ? size * (exitPrice / entryPrice - 1) - commission
                : size * (1 - exitPrice / entryPrice) - commission;

        Trade trade = Trade.builder()
                .symbol(symbol)
                .entryDate(position.getEntryTime())
                .entryPrice(entryPrice)
                .direction(position.getDirection())
                .positionSize(size)
                .stopLossPrice(position.getStopPrice())
                .takeProfitPrice(position.getTargetPrice())
                .exitDate(bar.getTimestamp())
                .exitPrice(exitPrice)
                .pnl(pnl)
                .pnlPercent(pnl / size * 100)
                .exitReason(reason)
                .build();
        log.debug("平仓: symbol={}, time={}, reason={}, price={}, pnl={}",
                symbol, bar.getTimestamp(), reason.getDescription(), exitPrice, pnl);
        position = null;
        return trade;
    }
}
