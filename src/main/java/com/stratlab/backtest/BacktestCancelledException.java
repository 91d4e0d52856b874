package com.stratlab.backtest;

/**
 * 回测在执行过程中被取消
 */
public class BacktestCancelledException extends RuntimeException {

    public BacktestCancelledException(String message) {
        super(message);
    }
}
