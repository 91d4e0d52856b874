package com.stratlab.domain.model;

import com.stratlab.domain.enums.TradeDirection;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 持仓
 * 仅在入场到出场之间存在，由单个标的的 PositionTracker 独占；平仓时转换为 {@link Trade}。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Position {

    private String symbol;

    private LocalDateTime entryTime;

    private double entryPrice;

    private TradeDirection direction;

    private double size;

    private Double stopPrice;

    private Double targetPrice;

    public boolean isLong() {
        return direction == TradeDirection.LONG;
    }
}
