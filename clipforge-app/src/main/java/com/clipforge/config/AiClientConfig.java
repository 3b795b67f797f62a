package com.clipforge.config;

import org.springframework.ai.chat.client.ChatClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Spring AI 与基础组件配置：分析、人设、脚本网关共用一个 ChatClient。
 *
 * @author clipforge
 * @since 2026-03-02
 */
@Configuration
public class AiClientConfig {

    @Bean
    @ConditionalOnMissingBean
    public ChatClient chatClient(ChatClient.Builder chatClientBuilder) {
        return chatClientBuilder.build();
    }

    /**
     * 全局 UTC 时钟，日/月预算边界按 UTC 计算。
     */
    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
