package com.example.menuparser.config;

import com.example.menuparser.util.menu.dto.PipelineConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 流水线配置 Bean
 *
 * menu.parser.config-path 为空时使用内置默认值，否则从该 JSON 文件部分覆盖。
 */
@Slf4j
@Configuration
public class PipelineConfiguration {

    @Value("${menu.parser.config-path:}")
    private String configPath;

    @Bean
    public PipelineConfig pipelineConfig() {
        if (configPath == null || configPath.trim().isEmpty()) {
            log.info("使用默认流水线配置");
            return PipelineConfig.loadDefault();
        }
        return PipelineConfig.loadFromJson(configPath.trim());
    }
}
