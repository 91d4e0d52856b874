package com.stratlab.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * K线（OHLCV）
 * 一个周期内某个标的的开高低收和成交量，生成后不可变。
 */
@Value
@Builder
@AllArgsConstructor
public class Bar {

    LocalDateTime timestamp;

    double open;

    double high;

    double low;

    double close;

    long volume;
}
