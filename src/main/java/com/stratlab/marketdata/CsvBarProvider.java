package com.stratlab.marketdata;

import com.stratlab.config.BacktestProperties;
import com.stratlab.domain.enums.TimeFrame;
import com.stratlab.domain.model.Bar;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * CSV文件行情数据源
 * <p>
 * 每个标的一个文件 {@code <目录>/<SYMBOL>.csv}，首行为表头 {@code date,open,high,low,close,volume}。
 * date 支持 {@code yyyy-MM-dd} 和 ISO 日期时间两种格式。文件内时间必须严格递增。
 * </p>
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "backtest.data", name = "provider", havingValue = "csv")
public class CsvBarProvider implements BarProvider {

    static final String EXPECTED_HEADER = "date,open,high,low,close,volume";
    private static final int COLUMN_COUNT = 6;

    private final Path directory;

    @Autowired
    public CsvBarProvider(BacktestProperties properties) {
        this(Paths.get(properties.getData().getCsvDirectory()));
    }

    public CsvBarProvider(Path directory) {
        this.directory = directory;
    }

    @Override
    public List<Bar> getBars(String symbol, LocalDateTime start, LocalDateTime end, TimeFrame timeFrame) {
        if (symbol == null || symbol.isBlank() || symbol.contains("/") || symbol.contains("\\")
                || symbol.contains("..")) {
            throw new MarketDataException("非法的标的代码: " + symbol);
        }
        Path file = directory.resolve(symbol + ".csv");
        if (!Files.isRegularFile(file)) {
            throw new MarketDataException("找不到行情文件: " + file);
        }

        List<Bar> bars = new ArrayList<>();
        int lineNumber = 0;
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String header = reader.readLine();
            lineNumber++;
            if (header == null || !EXPECTED_HEADER.equalsIgnoreCase(header.trim())) {
                throw new MarketDataException("行情文件表头不正确: " + file + "，应为 " + EXPECTED_HEADER);
            }
            String line;
            LocalDateTime previous = null;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                Bar bar = parseLine(line);
                if (previous != null && !bar.getTimestamp().isAfter(previous)) {
                    throw new MarketDataException(String.format("行情文件时间未严格递增: %s 第%d行", file, lineNumber));
                }
                previous = bar.getTimestamp();
                if (bar.getTimestamp().isBefore(start) || bar.getTimestamp().isAfter(end)
                        || SyntheticBarProvider.isWeekend(bar.getTimestamp().getDayOfWeek())) {
                    continue;
                }
                bars.add(bar);
            }
        } catch (IOException e) {
            throw new MarketDataException("读取行情文件失败: " + file, e);
        } catch (NumberFormatException | DateTimeParseException e) {
            throw new MarketDataException(String.format("行情文件格式错误: %s 第%d行", file, lineNumber), e);
        }

        log.debug("读取CSV行情: symbol={}, file={}, timeframe={}, bars={}", symbol, file, timeFrame, bars.size());
        return bars;
    }

    @Override
    public String getName() {
        return "csv:" + directory;
    }

    private static Bar parseLine(String line) {
        String[] columns = line.split(",");
        if (columns.length != COLUMN_COUNT) {
            throw new NumberFormatException("列数应为" + COLUMN_COUNT + "，实际为" + columns.length);
        }
        return Bar.builder()
                .timestamp(parseTimestamp(columns[0].trim()))
                .open(Double.parseDouble(columns[1].trim()))
                .high(Double.parseDouble(columns[2].trim()))
                .low(Double.parseDouble(columns[3].trim()))
                .close(Double.parseDouble(columns[4].trim()))
                .volume((long) Double.parseDouble(columns[5].trim()))
                .build();
    }

    private static LocalDateTime parseTimestamp(String value) {
        if (value.length() == 10) {
            return LocalDate.parse(value).atStartOfDay();
        }
        return LocalDateTime.parse(value);
    }
}
