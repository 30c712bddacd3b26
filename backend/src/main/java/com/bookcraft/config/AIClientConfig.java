package com.bookcraft.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * 文本生成服务连接配置
 */
@Configuration
public class AIClientConfig {

    @Value("${ai.base-url:https://api.openai.com}")
    private String baseUrl;

    @Value("${ai.api-key:}")
    private String apiKey;

    @Value("${ai.default-model:gpt-4o-mini}")
    private String defaultModel;

    @Value("${ai.connect-timeout-ms:15000}")
    private long connectTimeoutMs;

    @Value("${ai.read-timeout-ms:120000}")
    private long readTimeoutMs;

    /**
     * 生成服务专用的RestTemplate（超时与主业务隔离）
     */
    @Bean
    public RestTemplate generationRestTemplate(RestTemplateBuilder builder) {
        return builder
                .setConnectTimeout(Duration.ofMillis(connectTimeoutMs))
                .setReadTimeout(Duration.ofMillis(readTimeoutMs))
                .build();
    }

    public String getBaseUrl() { return baseUrl; }
    public String getApiKey() { return apiKey; }
    public String getDefaultModel() { return defaultModel; }

    /**
     * 获取完整的对话补全接口地址
     * baseUrl已包含/v1时只追加/chat/completions
     */
    public String getApiUrl() {
        String base = baseUrl == null ? "https://api.openai.com" : baseUrl.trim();
        if (base.endsWith("/v1")) {
            return base + "/chat/completions";
        } else if (base.endsWith("/")) {
            return base + "v1/chat/completions";
        }
        return base + "/v1/chat/completions";
    }
}
