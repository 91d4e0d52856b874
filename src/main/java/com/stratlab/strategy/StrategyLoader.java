package com.stratlab.strategy;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.stratlab.domain.model.TradingStrategy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 从JSON文件或字符串读取策略定义并校验
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StrategyLoader {

    private final ObjectMapper objectMapper;

    /**
     * @throws IllegalArgumentException 文件不存在、JSON无法解析或策略结构无效
     */
    public TradingStrategy load(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new IllegalArgumentException("策略文件不存在: " + file);
        }
        try {
            TradingStrategy strategy = objectMapper.readValue(file.toFile(), TradingStrategy.class);
            strategy.validate();
            log.debug("已加载策略: file={}, name={}, symbols={}", file, strategy.getDisplayName(), strategy.getSymbols());
            return strategy;
        } catch (IOException e) {
            throw new IllegalArgumentException("策略文件解析失败: " + file + " - " + rootMessage(e), e);
        }
    }

    public TradingStrategy parse(String json) {
        try {
            TradingStrategy strategy = objectMapper.readValue(json, TradingStrategy.class);
            strategy.validate();
            return strategy;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("策略JSON解析失败: " + rootMessage(e), e);
        }
    }

    public String toJson(TradingStrategy strategy) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(strategy);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("策略序列化失败", e);
        }
    }

    private static String rootMessage(Throwable e) {
        Throwable cause = e;
        while (cause.getCause() != null && cause.getCause() != cause) {
            cause = cause.getCause();
        }
        return cause.getMessage();
    }
}
