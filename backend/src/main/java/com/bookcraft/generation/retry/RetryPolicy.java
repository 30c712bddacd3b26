package com.bookcraft.generation.retry;

import com.bookcraft.generation.exception.GenerationCancelledException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.function.Predicate;

/**
 * 指数退避重试策略
 *
 * 生成调用、结构化抽取与失败队列回放共用同一个策略对象：
 * 第 n 次重试前等待 min(maxDelay, baseDelay * 2^(n-1))，分类器判定为致命的异常立即抛出。
 */
public class RetryPolicy {

    private static final Logger logger = LoggerFactory.getLogger(RetryPolicy.class);

    private final int maxAttempts;
    private final Duration baseDelay;
    private final Duration maxDelay;
    private final Predicate<Throwable> retryable;
    private final Sleeper sleeper;

    public RetryPolicy(int maxAttempts, Duration baseDelay, Duration maxDelay, Predicate<Throwable> retryable) {
        this(maxAttempts, baseDelay, maxDelay, retryable, Thread::sleep);
    }

    public RetryPolicy(int maxAttempts, Duration baseDelay, Duration maxDelay,
                       Predicate<Throwable> retryable, Sleeper sleeper) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        this.maxAttempts = maxAttempts;
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
        this.retryable = retryable;
        this.sleeper = sleeper;
    }

    /**
     * 执行任务，可重试异常在上限内退避重试，最后一次失败原样抛出
     */
    public <T> T execute(String context, Callable<T> task) throws Exception {
        Exception last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return task.call();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new GenerationCancelledException(context + " 被中断", e);
            } catch (GenerationCancelledException e) {
                throw e;
            } catch (Exception e) {
                last = e;
                if (!retryable.test(e) || attempt == maxAttempts) {
                    throw e;
                }
                long delay = delayForAttempt(attempt).toMillis();
                logger.warn("🔄 {} 第{}次失败，{}ms 后重试: {}", context, attempt, delay, e.getMessage());
                pause(context, delay);
            }
        }
        throw last;
    }

    /**
     * 第 attempt 次失败后的等待时长
     */
    public Duration delayForAttempt(int attempt) {
        int exponent = Math.max(0, Math.min(attempt - 1, 30));
        long millis = baseDelay.toMillis() * (1L << exponent);
        if (millis < 0 || millis > maxDelay.toMillis()) {
            millis = maxDelay.toMillis();
        }
        return Duration.ofMillis(millis);
    }

    /**
     * 在两次独立操作之间应用退避（失败队列逐个回放时使用）
     */
    public void backoff(String context, int attempt) {
        pause(context, delayForAttempt(attempt).toMillis());
    }

    private void pause(String context, long millis) {
        if (millis <= 0) {
            return;
        }
        try {
            sleeper.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GenerationCancelledException(context + " 等待重试时被中断", e);
        }
    }

    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }
}
