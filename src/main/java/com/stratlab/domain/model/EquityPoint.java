package com.stratlab.domain.model;

import java.time.LocalDateTime;

/**
 * 权益曲线上的一个点
 *
 * @param date   时间
 * @param equity 平仓后的账户权益
 */
public record EquityPoint(LocalDateTime date, double equity) {
}
