package com.stratlab.domain.model;

import com.stratlab.domain.enums.ConditionOperator;
import com.stratlab.domain.enums.IndicatorType;
import com.stratlab.domain.enums.PositionSizingType;
import com.stratlab.domain.enums.StopLossType;
import com.stratlab.domain.enums.StrategyDirection;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("策略结构校验测试")
class TradingStrategyTest {

    private static TradingStrategy.TradingStrategyBuilder valid() {
        return TradingStrategy.builder()
                .id("test")
                .symbols(List.of("AAPL"))
                .direction(StrategyDirection.BOTH)
                .entryConditions(List.of(Condition.builder()
                        .indicatorType(IndicatorType.RSI)
                        .parameter1(14)
                        .operator(ConditionOperator.LESS_THAN)
                        .value(30.0)
                        .build()))
                .positionSizing(PositionSizing.builder().type(PositionSizingType.PERCENTAGE).value(10).build());
    }

    @Test
    @DisplayName("完整的策略通过校验，名称缺失时显示ID")
    void testValidStrategy() {
        TradingStrategy strategy = valid().build();

        assertThatCode(strategy::validate).doesNotThrowAnyException();
        assertThat(strategy.getDisplayName()).isEqualTo("test");
    }

    @Test
    @DisplayName("缺少仓位、空标的、负参数、valueRange不完整都无法通过校验")
    void testInvalidStrategies() {
        assertThatThrownBy(() -> valid().positionSizing(null).build().validate())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("仓位");
        assertThatThrownBy(() -> valid().symbols(List.of(" ")).build().validate())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> valid().entryConditions(List.of(Condition.builder()
                        .id("neg")
                        .indicatorType(IndicatorType.SMA)
                        .parameter1(-5)
                        .operator(ConditionOperator.GREATER_THAN)
                        .value(1.0)
                        .build())).build().validate())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("parameter1");
        assertThatThrownBy(() -> valid().exitConditions(List.of(Condition.builder()
                        .indicatorType(IndicatorType.RSI)
                        .operator(ConditionOperator.RANGE)
                        .valueRange(Arrays.asList(30.0, null))
                        .build())).build().validate())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("valueRange");
        assertThatThrownBy(() -> valid().riskManagement(RiskManagement.builder()
                        .stopLossType(StopLossType.PERCENTAGE)
                        .stopLossValue(-1)
                        .build()).build().validate())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("止损");
    }

    @Test
    @DisplayName("条件描述包含指标、参数和比较对象")
    void testDescribe() {
        Condition crossing = Condition.builder()
                .indicatorType(IndicatorType.SMA)
                .parameter1(10)
                .operator(ConditionOperator.CROSSES_ABOVE)
                .indicatorTypeRight(IndicatorType.SMA)
                .parameter1Right(30)
                .build();

        assertThat(crossing.describe()).isEqualTo("sma(10) crosses_above sma(30)");
        assertThat(valid().build().getEntryConditions().get(0).describe()).isEqualTo("rsi(14) less_than 30.0");
    }
}
