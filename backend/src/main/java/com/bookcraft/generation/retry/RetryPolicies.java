package com.bookcraft.generation.retry;

import com.bookcraft.generation.ai.TextGenerationException;

import java.util.concurrent.TimeoutException;
import java.util.function.Predicate;

/**
 * 常用的异常分类器
 */
public final class RetryPolicies {

    private RetryPolicies() {
    }

    /**
     * 仅限流、超时、5xx、网络错误等瞬时故障可重试
     */
    public static final Predicate<Throwable> TRANSIENT = error -> {
        Throwable current = error;
        while (current != null) {
            if (current instanceof TextGenerationException) {
                return ((TextGenerationException) current).isTransient();
            }
            if (current instanceof TimeoutException) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    };
}
