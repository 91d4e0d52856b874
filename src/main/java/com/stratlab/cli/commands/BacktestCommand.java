package com.stratlab.cli.commands;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.stratlab.backtest.BacktestCancelledException;
import com.stratlab.backtest.BacktestEngine;
import com.stratlab.backtest.BacktestReportGenerator;
import com.stratlab.backtest.BacktestRequest;
import com.stratlab.backtest.BacktestResult;
import com.stratlab.cli.AbstractCommand;
import com.stratlab.cli.CommandException;
import com.stratlab.config.BacktestProperties;
import com.stratlab.domain.model.Trade;
import com.stratlab.domain.model.TradingStrategy;
import com.stratlab.marketdata.MarketDataException;
import com.stratlab.strategy.StrategyLoader;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.springframework.stereotype.Component;

import java.nio.file.Paths;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 从策略JSON文件执行回测
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BacktestCommand extends AbstractCommand {

    private static final DateTimeFormatter DATE_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd");
    private static final int MAX_PRINTED_TRADES = 20;

    private final BacktestEngine backtestEngine;
    private final BacktestReportGenerator reportGenerator;
    private final StrategyLoader strategyLoader;
    private final BacktestProperties backtestProperties;
    private final ObjectMapper objectMapper;

    @Override
    public String getName() {
        return "backtest";
    }

    @Override
    public String getDescription() {
        return "按策略文件执行回测并输出绩效统计";
    }

    @Override
    public List<String> getAliases() {
        return List.of("bt");
    }

    @Override
    public List<String> getExamples() {
        return List.of(
                "backtest --strategy strategies/rsi_reversal.json --from 2024-01-01 --to 2024-12-31",
                "backtest -s strategies/rsi_reversal.json --symbols AAPL,MSFT --capital 50000 --output",
                "bt -s strategies/rsi_reversal.json --json");
    }

    @Override
    protected Options buildOptions() {
        Options options = new Options();
        options.addOption(createOption("s", "strategy", "策略JSON文件路径（必需）", true));
        options.addOption(createOption("f", "from", "开始日期 yyyy-MM-dd，默认一年前", true));
        options.addOption(createOption("t", "to", "结束日期 yyyy-MM-dd，默认今天", true));
        options.addOption(createOption("c", "capital", "初始资金，默认 100000", true));
        options.addOption(createOption(null, "slippage", "滑点百分比，默认 0.1", true));
        options.addOption(createOption(null, "commission", "佣金百分比，默认 0.05", true));
        options.addOption(createOption(null, "symbols", "覆盖策略中的标的，逗号分隔", true));
        options.addOption(createOption("j", "json", "以JSON格式输出完整回测结果", false));
        options.addOption(Option.builder("o")
                .longOpt("output")
                .desc("生成报告文件，可指定目录，默认使用配置的报告目录")
                .hasArg()
                .optionalArg(true)
                .build());
        return options;
    }

    @Override
    protected String getUsageLine() {
        return "backtest --strategy <文件> [--from 日期] [--to 日期] [选项]";
    }

    @Override
    public void execute(String[] args) throws CommandException {
        CommandLine cmd = parseArgs(args);
        if (shouldShowHelp(cmd)) {
            printUsage();
            return;
        }
        validateRequired(cmd, "strategy");

        BacktestRequest request = BacktestRequest.builder()
                .startDate(getDateOptionValue(cmd, "from"))
                .endDate(getDateOptionValue(cmd, "to"))
                .initialCapital(getDoubleOptionValue(cmd, "capital"))
                .slippagePercent(getDoubleOptionValue(cmd, "slippage"))
                .commissionPercent(getDoubleOptionValue(cmd, "commission"))
                .build();

        try {
            TradingStrategy strategy = strategyLoader.load(Paths.get(cmd.getOptionValue("strategy")));
            if (cmd.hasOption("symbols")) {
                strategy = strategy.toBuilder().symbols(parseSymbols(cmd.getOptionValue("symbols"))).build();
            }
            request.setStrategy(strategy);

            BacktestResult result = backtestEngine.runBacktest(request);

            if (cmd.hasOption("json")) {
                System.out.println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(result));
            } else {
                printResult(result);
            }

            if (cmd.hasOption("output")) {
                String directory = cmd.getOptionValue("output", backtestProperties.getReport().getOutputDirectory());
                BacktestReportGenerator.ReportGenerationResult report =
                        reportGenerator.generateReportPackage(Paths.get(directory), result);
                if (!report.isSuccessful()) {
                    throw CommandException.executionFailed(getName(), report.getError(), null);
                }
                if (!cmd.hasOption("json")) {
                    printSuccess("报告已生成: " + report.getOutputDirectory().toAbsolutePath());
                }
            }
        } catch (IllegalArgumentException | MarketDataException | BacktestCancelledException e) {
            throw CommandException.executionFailed(getName(), e.getMessage(), e);
        } catch (JsonProcessingException e) {
            throw CommandException.executionFailed(getName(), "结果序列化失败: " + e.getOriginalMessage(), e);
        }
    }

    static List<String> parseSymbols(String value) {
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    private void printResult(BacktestResult result) {
        System.out.println();
        System.out.print(result.getChineseSummary());

        List<Trade> trades = result.getTrades();
        if (trades.isEmpty()) {
            printWarning("回测期间没有产生交易");
            return;
        }
        printTableHeader("交易明细");
        System.out.printf("%-10s %-6s %-12s %12s %-12s %12s %12s %-8s%n",
                "标的", "方向", "开仓日期", "开仓价", "平仓日期", "平仓价", "盈亏", "原因");
        trades.stream().limit(MAX_PRINTED_TRADES).forEach(trade ->
                System.out.printf("%-10s %-6s %-12s %12.4f %-12s %12.4f %12.2f %-8s%n",
                        trade.getSymbol(),
                        trade.getDirection().getCode(),
                        trade.getEntryDate().format(DATE_FORMATTER),
                        trade.getEntryPrice(),
                        trade.getExitDate().format(DATE_FORMATTER),
                        trade.getExitPrice(),
                        trade.getPnl(),
                        trade.getExitReason().getDescription()));
        if (trades.size() > MAX_PRINTED_TRADES) {
            System.out.printf("... 共 %d 笔交易，仅显示前 %d 笔%n", trades.size(), MAX_PRINTED_TRADES);
        }
    }
}
