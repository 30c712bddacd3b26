package com.bookcraft.config;

import com.bookcraft.generation.retry.RetryPolicies;
import com.bookcraft.generation.retry.RetryPolicy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 生成核心的共享组件
 */
@Configuration
public class GenerationConfig {

    /**
     * 生成调用、结构化抽取与失败队列回放共用的退避策略
     */
    @Bean
    public RetryPolicy generationRetryPolicy(GenerationProperties properties) {
        GenerationProperties.Retry retry = properties.getRetry();
        return new RetryPolicy(retry.getMaxAttempts(), retry.getBaseDelay(), retry.getMaxDelay(), RetryPolicies.TRANSIENT);
    }
}
