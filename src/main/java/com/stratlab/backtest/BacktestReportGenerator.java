package com.stratlab.backtest;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.stratlab.common.utils.NumberFormatUtils;
import com.stratlab.domain.model.EquityPoint;
import com.stratlab.domain.model.MonthlyReturn;
import com.stratlab.domain.model.Trade;
import lombok.Builder;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.PrintWriter;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

/**
 * 回测报告生成器
 * <p>
 * 在输出目录下创建 {@code <策略名>_<时间戳>} 子目录，写入：
 * summary.json、trades.csv、equity_curve.csv、monthly_returns.csv、strategy.json 和 summary.txt（中文摘要）。
 * 目录名和文件名只使用ASCII字符。
 * </p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BacktestReportGenerator {

    static final String SUMMARY_JSON = "summary.json";
    static final String TRADES_CSV = "trades.csv";
    static final String EQUITY_CURVE_CSV = "equity_curve.csv";
    static final String MONTHLY_RETURNS_CSV = "monthly_returns.csv";
    static final String STRATEGY_JSON = "strategy.json";
    static final String SUMMARY_TXT = "summary.txt";

    private static final DateTimeFormatter DIR_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final DateTimeFormatter DATETIME_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final ObjectMapper objectMapper;

    /**
     * 生成完整的回测报告包
     *
     * @param baseDirectory 报告根目录
     * @param result        回测结果
     * @return 生成结果；失败时 successful 为 false 并带有错误信息
     */
    public ReportGenerationResult generateReportPackage(Path baseDirectory, BacktestResult result) {
        long startTime = System.currentTimeMillis();
        try {
            Path outputDir = baseDirectory.resolve(createOutputDirectoryName(result));
            Files.createDirectories(outputDir);
            log.info("开始生成回测报告包: {}", outputDir);

            generateSummaryJson(result, outputDir.resolve(SUMMARY_JSON));
            generateTradesCsv(result.getTrades(), outputDir.resolve(TRADES_CSV));
            generateEquityCurveCsv(result, outputDir.resolve(EQUITY_CURVE_CSV));
            generateMonthlyReturnsCsv(result.getMonthlyReturns(), outputDir.resolve(MONTHLY_RETURNS_CSV));
            objectMapper.writerWithDefaultPrettyPrinter()
                    .writeValue(outputDir.resolve(STRATEGY_JSON).toFile(), result.getStrategy());
            generateSummaryTxt(result, outputDir.resolve(SUMMARY_TXT));

            long executionTime = System.currentTimeMillis() - startTime;
            log.info("回测报告生成完成: {} ({}ms)", outputDir, executionTime);
            return ReportGenerationResult.builder()
                    .successful(true)
                    .outputDirectory(outputDir)
                    .generationTimeMs(executionTime)
                    .build();
        } catch (IOException | RuntimeException e) {
            log.error("回测报告生成失败", e);
            return ReportGenerationResult.builder()
                    .successful(false)
                    .error("报告生成失败: " + e.getMessage())
                    .generationTimeMs(System.currentTimeMillis() - startTime)
                    .build();
        }
    }

    String createOutputDirectoryName(BacktestResult result) {
        String strategyName = result.getStrategy() != null ? result.getStrategy().getDisplayName() : "strategy";
        String slug = strategyName.trim().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "_")
                .replaceAll("^_+|_+$", "");
        if (slug.isEmpty()) {
            slug = "strategy";
        }
        return slug + "_" + LocalDateTime.now().format(DIR_TIMESTAMP);
    }

    private void generateSummaryJson(BacktestResult result, Path outputPath) throws IOException {
        SummaryReport summary = SummaryReport.builder()
                .strategyName(result.getStrategy() != null ? result.getStrategy().getDisplayName() : null)
                .symbols(result.getStrategy() != null ? result.getStrategy().getSymbols() : List.of())
                .backtestPeriod(result.getStartDate() != null && result.getEndDate() != null
                        ? String.format("%s 至 %s", result.getStartDate().toLocalDate(), result.getEndDate().toLocalDate())
                        : null)
                .backtestDays(result.getBacktestDays())
                .initialCapital(NumberFormatUtils.scale(result.getInitialCapital()))
                .finalEquity(NumberFormatUtils.scale(result.getFinalEquity()))
                .netProfit(NumberFormatUtils.scale(result.getNetProfit()))
                .netProfitPercent(NumberFormatUtils.percent(result.getNetProfitPercent()))
                .annualizedReturn(NumberFormatUtils.percent(result.getAnnualizedReturn() * 100))
                .maxDrawdown(NumberFormatUtils.scale(result.getMaxDrawdown()))
                .maxDrawdownPercent(NumberFormatUtils.percent(result.getMaxDrawdownPercent()))
                .sharpeRatio(NumberFormatUtils.scale(result.getSharpeRatio(), 4))
                .totalTrades(result.getTotalTrades())
                .winningTrades(result.getWinningTrades())
                .losingTrades(result.getLosingTrades())
                .winRate(NumberFormatUtils.percent(result.getWinRate() * 100))
                .averageWin(NumberFormatUtils.percent(result.getAverageWin()))
                .averageLoss(NumberFormatUtils.percent(result.getAverageLoss()))
                .profitFactor(NumberFormatUtils.scale(result.getProfitFactor(), 4))
                .build();
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(outputPath.toFile(), summary);
        log.debug("已生成摘要文件: {}", outputPath);
    }

    private void generateTradesCsv(List<Trade> trades, Path outputPath) throws IOException {
        try (PrintWriter writer = new PrintWriter(Files.newBufferedWriter(outputPath, StandardCharsets.UTF_8))) {
            writer.println("symbol,direction,entry_date,entry_price,exit_date,exit_price,position_size,"
                    + "stop_loss,take_profit,pnl,pnl_percent,exit_reason");
            for (Trade trade : trades) {
                writer.printf(Locale.ROOT, "%s,%s,%s,%.4f,%s,%.4f,%.2f,%s,%s,%.2f,%.4f,%s%n",
                        trade.getSymbol(),
                        trade.getDirection().getCode(),
                        trade.getEntryDate().format(DATETIME_FORMATTER),
                        trade.getEntryPrice(),
                        trade.getExitDate().format(DATETIME_FORMATTER),
                        trade.getExitPrice(),
                        trade.getPositionSize(),
                        formatOptional(trade.getStopLossPrice()),
                        formatOptional(trade.getTakeProfitPrice()),
                        trade.getPnl(),
                        trade.getPnlPercent(),
                        trade.getExitReason().getCode());
            }
        }
        log.debug("已生成交易记录文件: {} ({} 条记录)", outputPath, trades.size());
    }

    private void generateEquityCurveCsv(BacktestResult result, Path outputPath) throws IOException {
        try (PrintWriter writer = new PrintWriter(Files.newBufferedWriter(outputPath, StandardCharsets.UTF_8))) {
            writer.println("date,equity,cumulative_return_percent,drawdown_percent");
            double peak = result.getInitialCapital();
            for (EquityPoint point : result.getEquityCurve()) {
                peak = Math.max(peak, point.equity());
                double cumulative = (point.equity() - result.getInitialCapital()) / result.getInitialCapital() * 100;
                double drawdown = peak > 0 ? (peak - point.equity()) / peak * 100 : 0;
                writer.printf(Locale.ROOT, "%s,%.2f,%.4f,%.4f%n",
                        point.date().format(DATETIME_FORMATTER), point.equity(), cumulative, drawdown);
            }
        }
        log.debug("已生成权益曲线文件: {} ({} 个数据点)", outputPath, result.getEquityCurve().size());
    }

    private void generateMonthlyReturnsCsv(List<MonthlyReturn> monthlyReturns, Path outputPath) throws IOException {
        try (PrintWriter writer = new PrintWriter(Files.newBufferedWriter(outputPath, StandardCharsets.UTF_8))) {
            writer.println("month,profit,profit_percent");
            for (MonthlyReturn monthly : monthlyReturns) {
                writer.printf(Locale.ROOT, "%s,%.2f,%.4f%n", monthly.month(), monthly.profit(), monthly.profitPercent());
            }
        }
    }

    private void generateSummaryTxt(BacktestResult result, Path outputPath) throws IOException {
        try (PrintWriter writer = new PrintWriter(Files.newBufferedWriter(outputPath, StandardCharsets.UTF_8))) {
            writer.println("===============================");
            writer.println("策略回测报告");
            writer.println("===============================");
            writer.println();
            writer.println(result.getChineseSummary());
            writer.println("===============================");
            writer.printf("报告生成时间: %s%n", LocalDateTime.now().format(DATETIME_FORMATTER));
        }
    }

    private static String formatOptional(Double value) {
        return value != null ? String.format(Locale.ROOT, "%.4f", value) : "";
    }

    @Data
    @Builder
    public static class ReportGenerationResult {
        private boolean successful;
        private Path outputDirectory;
        private String error;
        private long generationTimeMs;
    }

    @Data
    @Builder
    private static class SummaryReport {
        private String strategyName;
        private List<String> symbols;
        private String backtestPeriod;
        private long backtestDays;
        private BigDecimal initialCapital;
        private BigDecimal finalEquity;
        private BigDecimal netProfit;
        private String netProfitPercent;
        private String annualizedReturn;
        private BigDecimal maxDrawdown;
        private String maxDrawdownPercent;
        private BigDecimal sharpeRatio;
        private int totalTrades;
        private int winningTrades;
        private int losingTrades;
        private String winRate;
        private String averageWin;
        private String averageLoss;
        private BigDecimal profitFactor;
    }
}
