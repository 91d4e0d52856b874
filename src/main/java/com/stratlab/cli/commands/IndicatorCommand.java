package com.stratlab.cli.commands;

import com.stratlab.cli.AbstractCommand;
import com.stratlab.cli.CommandException;
import com.stratlab.config.BacktestProperties;
import com.stratlab.domain.enums.IndicatorType;
import com.stratlab.domain.enums.TimeFrame;
import com.stratlab.domain.model.Bar;
import com.stratlab.domain.model.IndicatorRef;
import com.stratlab.indicator.IndicatorEngine;
import com.stratlab.marketdata.BarProvider;
import com.stratlab.marketdata.MarketDataException;
import lombok.RequiredArgsConstructor;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.Options;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * 计算并打印单个标的某个指标的最近取值
 */
@Component
@RequiredArgsConstructor
public class IndicatorCommand extends AbstractCommand {

    private static final DateTimeFormatter DATETIME_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    private final BarProvider barProvider;
    private final BacktestProperties backtestProperties;

    @Override
    public String getName() {
        return "indicator";
    }

    @Override
    public String getDescription() {
        return "计算指标并显示最近N根K线的取值";
    }

    @Override
    public List<String> getAliases() {
        return List.of("ind");
    }

    @Override
    public List<String> getExamples() {
        return List.of(
                "indicator --symbol AAPL --type rsi --period 14",
                "ind --symbol AAPL --type macd --period 12 --param2 26 --last 20");
    }

    @Override
    protected Options buildOptions() {
        Options options = new Options();
        options.addOption(createOption("y", "symbol", "交易标的（必需）", true));
        options.addOption(createOption("i", "type", "指标类型: price/sma/ema/rsi/macd/bollinger，默认 rsi", true));
        options.addOption(createOption("p", "period", "参数1（周期）", true));
        options.addOption(createOption(null, "param2", "参数2（例如MACD慢线周期）", true));
        options.addOption(createOption("f", "from", "开始日期 yyyy-MM-dd，默认一年前", true));
        options.addOption(createOption("t", "to", "结束日期 yyyy-MM-dd，默认今天", true));
        options.addOption(createOption(null, "timeframe", "K线周期，默认 daily", true));
        options.addOption(createOption("n", "last", "显示最近的K线数量，默认 10", true));
        return options;
    }

    @Override
    public void execute(String[] args) throws CommandException {
        CommandLine cmd = parseArgs(args);
        if (shouldShowHelp(cmd)) {
            printUsage();
            return;
        }
        validateRequired(cmd, "symbol");

        String symbol = cmd.getOptionValue("symbol").trim();
        IndicatorType type = IndicatorType.fromCode(cmd.getOptionValue("type", "rsi"));
        if (type == IndicatorType.UNKNOWN) {
            printWarning("未实现的指标类型，按收盘价计算: " + cmd.getOptionValue("type"));
        }
        Integer period = cmd.hasOption("period") ? getIntOptionValue(cmd, "period", 0) : null;
        Integer param2 = cmd.hasOption("param2") ? getIntOptionValue(cmd, "param2", 0) : null;
        int last = getIntOptionValue(cmd, "last", 10);
        if (last <= 0) {
            throw CommandException.invalidArgument(getName(), "--last 必须大于0");
        }

        TimeFrame timeFrame;
        try {
            timeFrame = TimeFrame.fromCode(cmd.getOptionValue("timeframe", TimeFrame.DAILY.getCode()));
        } catch (IllegalArgumentException e) {
            throw CommandException.invalidArgument(getName(), e.getMessage());
        }

        LocalDateTime now = LocalDateTime.now();
        LocalDateTime end = cmd.hasOption("to") ? getDateOptionValue(cmd, "to") : now;
        LocalDateTime start = cmd.hasOption("from")
                ? getDateOptionValue(cmd, "from")
                : end.minusDays(backtestProperties.getDefaults().getLookbackDays());
        if (start.isAfter(end)) {
            throw CommandException.invalidArgument(getName(), "开始时间不能晚于结束时间");
        }

        List<Bar> bars;
        try {
            bars = barProvider.getBars(symbol, start, end, timeFrame);
        } catch (MarketDataException e) {
            throw CommandException.executionFailed(getName(), e.getMessage(), e);
        }
        if (bars.isEmpty()) {
            printWarning("区间内没有K线数据: " + symbol);
            return;
        }

        IndicatorEngine engine = new IndicatorEngine(symbol, bars);
        IndicatorRef ref = new IndicatorRef(type, period, param2, null);
        printTableHeader(symbol + " " + ref.describe());
        System.out.printf("%-18s %12s %14s%n", "时间", "收盘价", "指标值");
        for (int i = Math.max(0, bars.size() - last); i < bars.size(); i++) {
            Bar bar = engine.getBar(i);
            System.out.printf("%-18s %12.4f %14.4f%n",
                    bar.getTimestamp().format(DATETIME_FORMATTER), bar.getClose(), engine.value(ref, i));
        }
    }
}
