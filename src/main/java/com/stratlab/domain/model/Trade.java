package com.stratlab.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.stratlab.domain.enums.ExitReason;
import com.stratlab.domain.enums.TradeDirection;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * 已平仓交易，创建后不可变
 */
@Value
@Builder
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Trade {

    String symbol;

    LocalDateTime entryDate;

    double entryPrice;

    TradeDirection direction;

    double positionSize;

    Double stopLossPrice;

    Double takeProfitPrice;

    LocalDateTime exitDate;

    double exitPrice;

    double pnl;

    double pnlPercent;

    ExitReason exitReason;

    @JsonIgnore
    public boolean isWinning() {
        return pnl > 0;
    }
}
