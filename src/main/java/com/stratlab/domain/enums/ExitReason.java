package com.stratlab.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 平仓原因
 */
public enum ExitReason {
    STOP_LOSS("stop_loss", "止损"),
    TAKE_PROFIT("take_profit", "止盈"),
    EXIT_SIGNAL("exit_signal", "出场条件"),
    END_OF_DATA("end_of_data", "回测结束强制平仓");

    private final String code;
    private final String description;

    ExitReason(String code, String description) {
        this.code = code;
        this.description = description;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public String getDescription() {
        return description;
    }
}
