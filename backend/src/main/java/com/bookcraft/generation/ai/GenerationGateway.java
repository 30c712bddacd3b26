package com.bookcraft.generation.ai;

import com.bookcraft.config.GenerationProperties;
import com.bookcraft.generation.exception.GenerationCancelledException;
import com.bookcraft.generation.ratelimit.RateLimitPermit;
import com.bookcraft.generation.ratelimit.RequestPriority;
import com.bookcraft.generation.ratelimit.TokenBudgetRateLimiter;
import com.bookcraft.generation.retry.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 所有外部生成调用的统一入口：限流许可 → 带超时的调用 → 用量对账，整体包在重试策略里
 */
@Component
public class GenerationGateway {

    private static final Logger logger = LoggerFactory.getLogger(GenerationGateway.class);

    private final TextGenerationClient client;
    private final TokenBudgetRateLimiter rateLimiter;
    private final RetryPolicy retryPolicy;
    private final AsyncTaskExecutor callExecutor;
    private final Duration callTimeout;

    public GenerationGateway(TextGenerationClient client,
                             TokenBudgetRateLimiter rateLimiter,
                             @Qualifier("generationRetryPolicy") RetryPolicy retryPolicy,
                             @Qualifier("generationCallExecutor") AsyncTaskExecutor callExecutor,
                             GenerationProperties properties) {
        this.client = client;
        this.rateLimiter = rateLimiter;
        this.retryPolicy = retryPolicy;
        this.callExecutor = callExecutor;
        this.callTimeout = properties.getCallTimeout();
    }

    /**
     * @throws TextGenerationException 重试耗尽或遇到致命错误
     * @throws GenerationCancelledException 等待期间被中断或限流队列被清空
     */
    public GenerationResult generate(String context, String prompt, GenerationOptions options, RequestPriority priority) {
        try {
            return retryPolicy.execute(context, () -> callOnce(context, prompt, options, priority));
        } catch (TextGenerationException | GenerationCancelledException e) {
            throw e;
        } catch (Exception e) {
            throw new TextGenerationException(context + " 调用失败: " + e.getMessage(), false, e);
        }
    }

    private GenerationResult callOnce(String context, String prompt, GenerationOptions options,
                                      RequestPriority priority) throws InterruptedException {
        long estimate = TokenBudgetRateLimiter.estimateRequestTokens(prompt, options.getMaxTokens());
        RateLimitPermit permit;
        try {
            permit = rateLimiter.requestPermission(options.getModel(), estimate, priority);
        } catch (CancellationException e) {
            throw new GenerationCancelledException(context + " 限流排队被取消", e);
        }

        Future<GenerationResult> future = callExecutor.submit(() -> client.generate(prompt, options));
        try {
            GenerationResult result = future.get(callTimeout.toMillis(), TimeUnit.MILLISECONDS);
            rateLimiter.recordUsage(permit, result.getTokenUsage());
            return result;
        } catch (TimeoutException e) {
            future.cancel(true);
            logger.warn("⏰ {} 生成调用超时（{}s）", context, callTimeout.getSeconds());
            throw TextGenerationException.timeout(context + " 调用超时", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof TextGenerationException) {
                throw (TextGenerationException) cause;
            }
            throw new TextGenerationException(context + " 调用异常: " + cause.getMessage(), false, cause);
        }
    }
}
