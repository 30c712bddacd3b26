package com.bookcraft.generation.retry;

import com.bookcraft.generation.ai.TextGenerationException;
import com.bookcraft.generation.exception.GenerationCancelledException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryPolicyTest {

    private final List<Long> sleeps = new ArrayList<>();

    private RetryPolicy policy(int maxAttempts) {
        return new RetryPolicy(maxAttempts, Duration.ofSeconds(1), Duration.ofSeconds(5), RetryPolicies.TRANSIENT,
                sleeps::add);
    }

    @Test
    @DisplayName("delays double per attempt up to the maximum")
    void should_DoubleDelayUpToMax_When_AttemptsGrow() {
        RetryPolicy policy = policy(5);

        assertThat(policy.delayForAttempt(1)).isEqualTo(Duration.ofSeconds(1));
        assertThat(policy.delayForAttempt(2)).isEqualTo(Duration.ofSeconds(2));
        assertThat(policy.delayForAttempt(3)).isEqualTo(Duration.ofSeconds(4));
        assertThat(policy.delayForAttempt(4)).isEqualTo(Duration.ofSeconds(5));
        assertThat(policy.delayForAttempt(60)).isEqualTo(Duration.ofSeconds(5));
    }

    @Test
    @DisplayName("transient failures are retried until success")
    void should_RetryTransientFailure_When_LaterAttemptSucceeds() throws Exception {
        AtomicInteger calls = new AtomicInteger();

        String result = policy(3).execute("测试", () -> {
            if (calls.incrementAndGet() < 3) {
                throw new TextGenerationException("429 Too Many Requests", true);
            }
            return "ok";
        });

        assertThat(result).isEqualTo("ok");
        assertThat(calls.get()).isEqualTo(3);
        assertThat(sleeps).containsExactly(1000L, 2000L);
    }

    @Test
    @DisplayName("the last transient failure is rethrown once attempts run out")
    void should_RethrowLastFailure_When_AttemptsExhausted() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> policy(2).execute("测试", () -> {
            calls.incrementAndGet();
            throw TextGenerationException.timeout("调用超时", new TimeoutException());
        })).isInstanceOf(TextGenerationException.class).hasMessage("调用超时");
        assertThat(calls.get()).isEqualTo(2);
    }

    @Test
    @DisplayName("fatal failures are not retried")
    void should_FailImmediately_When_FailureIsFatal() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> policy(3).execute("测试", () -> {
            calls.incrementAndGet();
            throw TextGenerationException.fatal("401 Unauthorized");
        })).isInstanceOf(TextGenerationException.class);
        assertThat(calls.get()).isEqualTo(1);
        assertThat(sleeps).isEmpty();
    }

    @Test
    @DisplayName("the classifier looks through wrapping exceptions")
    void should_ClassifyByCause_When_FailureIsWrapped() {
        assertThat(RetryPolicies.TRANSIENT.test(new RuntimeException(new TimeoutException()))).isTrue();
        assertThat(RetryPolicies.TRANSIENT.test(new RuntimeException(new TextGenerationException("503", true)))).isTrue();
        assertThat(RetryPolicies.TRANSIENT.test(new IllegalArgumentException("bad"))).isFalse();
    }

    @Test
    @DisplayName("interruption during backoff becomes cancellation")
    void should_Cancel_When_InterruptedWhileWaiting() {
        RetryPolicy policy = new RetryPolicy(3, Duration.ofSeconds(1), Duration.ofSeconds(5), RetryPolicies.TRANSIENT,
                millis -> {
                    throw new InterruptedException();
                });

        try {
            assertThatThrownBy(() -> policy.execute("测试", () -> {
                throw new TextGenerationException("502", true);
            })).isInstanceOf(GenerationCancelledException.class);
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
    }
}
