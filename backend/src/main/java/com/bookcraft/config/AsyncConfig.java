package com.bookcraft.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * 异步线程池配置
 *
 * bookGenerationExecutor 承载整本书的流水线（每本书一个任务），
 * unitGenerationExecutor 承载章节内按批次扇出的单元生成任务。
 */
@Configuration
public class AsyncConfig {

    private static final Logger logger = LoggerFactory.getLogger(AsyncConfig.class);

    @Bean(name = "bookGenerationExecutor")
    public ThreadPoolTaskExecutor bookGenerationExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(20);
        executor.setThreadNamePrefix("book-gen-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.initialize();
        logger.info("📚 书籍生成线程池已初始化: core={}, max={}", 2, 4);
        return executor;
    }

    @Bean(name = "unitGenerationExecutor")
    public ThreadPoolTaskExecutor unitGenerationExecutor(GenerationProperties properties) {
        int size = Math.max(2, properties.getMaxConcurrentUnits() * 2);
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(size);
        executor.setMaxPoolSize(size * 2);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("unit-gen-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();
        logger.info("✍️ 单元生成线程池已初始化: core={}, max={}", size, size * 2);
        return executor;
    }

    /**
     * 单次外部调用专用线程池，调用方在这里等待超时，与单元任务线程分开避免互相占满
     */
    @Bean(name = "generationCallExecutor")
    public ThreadPoolTaskExecutor generationCallExecutor(GenerationProperties properties) {
        int size = Math.max(4, properties.getMaxConcurrentUnits() * 4);
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(size);
        executor.setMaxPoolSize(size * 2);
        executor.setQueueCapacity(200);
        executor.setThreadNamePrefix("ai-call-");
        executor.initialize();
        return executor;
    }
}
