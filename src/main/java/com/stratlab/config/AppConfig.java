package com.stratlab.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 应用全局配置类
 */
@Configuration
public class AppConfig {

    /**
     * 全局共享的 ObjectMapper，用于读取策略文件和输出回测结果。
     * <ul>
     *   <li>注册了 {@link JavaTimeModule} 以支持 LocalDateTime 等日期类型。</li>
     *   <li>日期输出为 ISO 字符串而不是时间戳。</li>
     *   <li>忽略策略文件中多余的字段。</li>
     * </ul>
     *
     * @return 一个配置好的 ObjectMapper 实例
     */
    @Bean
    public ObjectMapper objectMapper() {
        return createObjectMapper();
    }

    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }
}
