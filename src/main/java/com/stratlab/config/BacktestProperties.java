package com.stratlab.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "backtest")
public class BacktestProperties {

    private Defaults defaults = new Defaults();

    private MarketData data = new MarketData();

    private Report report = new Report();

    /**
     * 回测请求未指定时使用的参数
     */
    @Data
    public static class Defaults {
        private double initialCapital = 100000;
        private double slippagePercent = 0.1;
        private double commissionPercent = 0.05;
        /**
         * 未指定开始时间时向前回溯的天数
         */
        private int lookbackDays = 365;
    }

    @Data
    public static class MarketData {
        /**
         * synthetic 或 csv
         */
        private String provider = "synthetic";
        private String csvDirectory = "./data";
    }

    @Data
    public static class Report {
        private String outputDirectory = "./backtest-output";
    }
}
