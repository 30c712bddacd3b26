package com.bookcraft.generation.ratelimit;

import com.bookcraft.config.RateLimitProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TokenBudgetRateLimiterTest {

    private static final String MODEL = "test-model";

    private RateLimitProperties properties;
    private TokenBudgetRateLimiter limiter;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        properties = new RateLimitProperties();
        properties.setWindow(Duration.ofMillis(300));
        properties.getModels().put(MODEL, new RateLimitProperties.ModelLimit(2, 1000));
        limiter = new TokenBudgetRateLimiter(properties);
        executor = Executors.newFixedThreadPool(4);
    }

    @AfterEach
    void tearDown() {
        limiter.clearQueue();
        executor.shutdownNow();
    }

    private void awaitQueued(int expected) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (limiter.getStatus(MODEL).getQueuedRequests() < expected) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("queue never reached " + expected);
            }
            Thread.sleep(5);
        }
    }

    @Test
    @DisplayName("requests within budget are admitted immediately and counted")
    void should_AdmitImmediately_When_WithinBudget() throws Exception {
        RateLimitPermit permit = limiter.requestPermission(MODEL, 400, RequestPriority.NORMAL);

        RateLimitStatus status = limiter.getStatus(MODEL);
        assertThat(permit.getModelClass()).isEqualTo(MODEL);
        assertThat(permit.getEstimatedTokens()).isEqualTo(400);
        assertThat(status.getRequestsInWindow()).isEqualTo(1);
        assertThat(status.getTokensInWindow()).isEqualTo(400);
        assertThat(status.getRequestLimit()).isEqualTo(2);
        assertThat(status.getTokenLimit()).isEqualTo(1000);
    }

    @Test
    @DisplayName("actual usage replaces the reserved estimate")
    void should_ReconcileReservation_When_UsageRecorded() throws Exception {
        RateLimitPermit permit = limiter.requestPermission(MODEL, 900, RequestPriority.NORMAL);

        limiter.recordUsage(permit, 150);

        RateLimitStatus status = limiter.getStatus(MODEL);
        assertThat(status.getTokensInWindow()).isEqualTo(150);
        assertThat(status.getTotalTokens()).isEqualTo(150);
        RateLimitPermit second = limiter.requestPermission(MODEL, 800, RequestPriority.NORMAL);
        assertThat(second).isNotNull();
    }

    @Test
    @DisplayName("usage recorded by model reconciles the oldest open reservation and is appended once none is left")
    void should_ReconcileOldestThenAppend_When_UsageRecordedByModel() throws Exception {
        properties.setWindow(Duration.ofSeconds(5));
        limiter.requestPermission(MODEL, 400, RequestPriority.NORMAL);
        limiter.requestPermission(MODEL, 300, RequestPriority.NORMAL);

        limiter.recordUsage(MODEL, 100);
        assertThat(limiter.getStatus(MODEL).getTokensInWindow()).isEqualTo(400);

        limiter.recordUsage(MODEL, 50);
        assertThat(limiter.getStatus(MODEL).getTokensInWindow()).isEqualTo(150);

        limiter.recordUsage(MODEL, 70);
        RateLimitStatus status = limiter.getStatus(MODEL);
        assertThat(status.getTokensInWindow()).isEqualTo(220);
        assertThat(status.getRequestsInWindow()).isEqualTo(2);
        assertThat(status.getTotalRequests()).isEqualTo(2);
        assertThat(status.getTotalTokens()).isEqualTo(220);
    }

    @Test
    @DisplayName("a request larger than the whole budget is admitted into an empty window")
    void should_AdmitOversizeRequest_When_WindowIsEmpty() throws Exception {
        RateLimitPermit big = limiter.requestPermission(MODEL, 5000, RequestPriority.NORMAL);
        assertThat(big.getEstimatedTokens()).isEqualTo(5000);

        long start = System.nanoTime();
        limiter.requestPermission(MODEL, 10, RequestPriority.NORMAL);
        long waitedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertThat(waitedMillis).isGreaterThanOrEqualTo(250);
    }

    @Test
    @DisplayName("higher priority waiters are admitted first")
    void should_AdmitHighPriorityFirst_When_BothAreWaiting() throws Exception {
        properties.setWindow(Duration.ofSeconds(1));
        limiter = new TokenBudgetRateLimiter(properties);
        limiter.requestPermission(MODEL, 600, RequestPriority.NORMAL);
        limiter.requestPermission(MODEL, 300, RequestPriority.NORMAL);
        List<RequestPriority> order = Collections.synchronizedList(new ArrayList<>());

        Future<?> low = executor.submit(() -> {
            limiter.requestPermission(MODEL, 600, RequestPriority.LOW);
            order.add(RequestPriority.LOW);
            return null;
        });
        awaitQueued(1);
        Future<?> high = executor.submit(() -> {
            limiter.requestPermission(MODEL, 600, RequestPriority.HIGH);
            order.add(RequestPriority.HIGH);
            return null;
        });
        awaitQueued(2);

        high.get(5, TimeUnit.SECONDS);
        low.get(5, TimeUnit.SECONDS);
        assertThat(order).containsExactly(RequestPriority.HIGH, RequestPriority.LOW);
    }

    @Test
    @DisplayName("clearing the queue rejects waiters")
    void should_RejectWaiters_When_QueueCleared() throws Exception {
        properties.setWindow(Duration.ofSeconds(30));
        limiter = new TokenBudgetRateLimiter(properties);
        limiter.requestPermission(MODEL, 1000, RequestPriority.NORMAL);

        Future<RateLimitPermit> waiting = executor.submit(() -> limiter.requestPermission(MODEL, 10, RequestPriority.NORMAL));
        awaitQueued(1);

        assertThat(limiter.clearQueue()).isEqualTo(1);
        assertThatThrownBy(() -> waiting.get(5, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(CancellationException.class);
        assertThat(limiter.getStatus(MODEL).getQueuedRequests()).isZero();
    }

    @Test
    @DisplayName("unknown model classes use the default limit")
    void should_UseDefaultLimit_When_ModelNotConfigured() {
        RateLimitStatus status = limiter.getStatus("some-other-model");

        assertThat(status.getRequestLimit()).isEqualTo(60);
        assertThat(status.getTokenLimit()).isEqualTo(30000);
    }

    @Test
    @DisplayName("token estimates are a quarter of the characters plus output and overhead")
    void should_EstimateTokens_When_GivenPrompt() {
        assertThat(TokenBudgetRateLimiter.estimateTokens("abcdefgh")).isEqualTo(2);
        assertThat(TokenBudgetRateLimiter.estimateTokens("abcdefghi")).isEqualTo(3);
        assertThat(TokenBudgetRateLimiter.estimateTokens(null)).isZero();
        assertThat(TokenBudgetRateLimiter.estimateRequestTokens("abcd", 4000)).isEqualTo(1 + 4000 + 100);
    }
}
