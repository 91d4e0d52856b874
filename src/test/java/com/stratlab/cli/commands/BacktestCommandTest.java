package com.stratlab.cli.commands;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.stratlab.backtest.BacktestEngine;
import com.stratlab.backtest.BacktestReportGenerator;
import com.stratlab.backtest.PerformanceAnalyticsService;
import com.stratlab.cli.CommandException;
import com.stratlab.config.AppConfig;
import com.stratlab.config.BacktestProperties;
import com.stratlab.marketdata.SyntheticBarProvider;
import com.stratlab.strategy.StrategyLoader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("BacktestCommand测试")
class BacktestCommandTest {

    @TempDir
    Path tempDir;

    private BacktestCommand command;
    private String strategyPath;

    @BeforeEach
    void setUp() throws Exception {
        ObjectMapper objectMapper = AppConfig.createObjectMapper();
        BacktestProperties properties = new BacktestProperties();
        properties.getReport().setOutputDirectory(tempDir.resolve("default-output").toString());
        BacktestEngine engine = new BacktestEngine(new SyntheticBarProvider(), new PerformanceAnalyticsService(), properties);
        command = new BacktestCommand(engine, new BacktestReportGenerator(objectMapper),
                new StrategyLoader(objectMapper), properties, objectMapper);
        strategyPath = Paths.get(getClass().getResource("/strategies/rsi_reversal.json").toURI()).toString();
    }

    @Test
    @DisplayName("执行回测并在指定目录生成报告")
    void testBacktestWithReport() throws IOException {
        Path output = tempDir.resolve("reports");

        command.execute(new String[]{"-s", strategyPath, "--from", "2024-01-01", "--to", "2024-06-30",
                "--symbols", "SPY", "--output", output.toString()});

        List<Path> reportDirs;
        try (Stream<Path> stream = Files.list(output)) {
            reportDirs = stream.collect(Collectors.toList());
        }
        assertThat(reportDirs).hasSize(1);
        assertThat(reportDirs.get(0).getFileName().toString()).startsWith("rsi_reversal_");
        assertThat(reportDirs.get(0).resolve("summary.json")).exists();
        assertThat(reportDirs.get(0).resolve("trades.csv")).exists();
    }

    @Test
    @DisplayName("--output 不带目录时使用配置的报告目录")
    void testDefaultOutputDirectory() {
        command.execute(new String[]{"-s", strategyPath, "-f", "2024-01-01", "-t", "2024-03-31", "--json", "-o"});

        assertThat(tempDir.resolve("default-output")).isDirectory();
    }

    @Test
    @DisplayName("参数错误时抛出CommandException")
    void testInvalidArguments() {
        assertThatThrownBy(() -> command.execute(new String[]{"--from", "2024-01-01"}))
                .isInstanceOf(CommandException.class)
                .hasMessageContaining("--strategy");
        assertThatThrownBy(() -> command.execute(new String[]{"-s", strategyPath, "--capital", "abc"}))
                .isInstanceOf(CommandException.class)
                .hasMessageContaining("capital");
        assertThatThrownBy(() -> command.execute(new String[]{"-s", strategyPath, "--from", "01/01/2024"}))
                .isInstanceOf(CommandException.class);
        assertThatThrownBy(() -> command.execute(new String[]{"-s", strategyPath,
                "--from", "2024-06-01", "--to", "2024-01-01"}))
                .isInstanceOf(CommandException.class)
                .hasCauseInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> command.execute(new String[]{"-s", tempDir.resolve("missing.json").toString()}))
                .isInstanceOf(CommandException.class)
                .hasMessageContaining("不存在");
    }

    @Test
    @DisplayName("解析逗号分隔的标的列表")
    void testParseSymbols() {
        assertThat(BacktestCommand.parseSymbols(" AAPL, MSFT,,SPY ")).containsExactly("AAPL", "MSFT", "SPY");
    }
}
