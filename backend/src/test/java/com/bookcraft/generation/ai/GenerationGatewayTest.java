package com.bookcraft.generation.ai;

import com.bookcraft.config.GenerationProperties;
import com.bookcraft.config.RateLimitProperties;
import com.bookcraft.generation.ratelimit.RateLimitStatus;
import com.bookcraft.generation.ratelimit.RequestPriority;
import com.bookcraft.generation.ratelimit.TokenBudgetRateLimiter;
import com.bookcraft.generation.retry.RetryPolicies;
import com.bookcraft.generation.retry.RetryPolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.SimpleAsyncTaskExecutor;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class GenerationGatewayTest {

    private static final String MODEL = "gpt-4o";

    @Mock
    private TextGenerationClient client;

    private final List<Long> sleeps = new ArrayList<>();
    private GenerationProperties properties;
    private TokenBudgetRateLimiter rateLimiter;
    private GenerationGateway gateway;

    @BeforeEach
    void setUp() {
        properties = new GenerationProperties();
        properties.setCallTimeout(Duration.ofMillis(150));
        rateLimiter = new TokenBudgetRateLimiter(new RateLimitProperties());
        RetryPolicy retryPolicy = new RetryPolicy(3, Duration.ofMillis(10), Duration.ofMillis(50),
                RetryPolicies.TRANSIENT, sleeps::add);
        gateway = new GenerationGateway(client, rateLimiter, retryPolicy, new SimpleAsyncTaskExecutor("test-call-"),
                properties);
    }

    private GenerationOptions options() {
        return GenerationOptions.builder().model(MODEL).maxTokens(1000).build();
    }

    @Test
    @DisplayName("a successful call reconciles the reservation with the reported usage")
    void should_RecordActualUsage_When_CallSucceeds() {
        when(client.generate(anyString(), any(GenerationOptions.class)))
                .thenReturn(new GenerationResult("潮水退去。", 420));

        GenerationResult result = gateway.generate("第1章第1节", "写第一节", options(), RequestPriority.NORMAL);

        assertThat(result.getText()).isEqualTo("潮水退去。");
        RateLimitStatus status = rateLimiter.getStatus(MODEL);
        assertThat(status.getRequestsInWindow()).isEqualTo(1);
        assertThat(status.getTokensInWindow()).isEqualTo(420L);
    }

    @Test
    @DisplayName("a transient failure is retried with backoff")
    void should_Retry_When_FailureIsTransient() {
        when(client.generate(anyString(), any(GenerationOptions.class)))
                .thenThrow(new TextGenerationException("AI服务返回 HTTP 503", true))
                .thenReturn(new GenerationResult("潮水退去。", 300));

        GenerationResult result = gateway.generate("第1章第1节", "写第一节", options(), RequestPriority.NORMAL);

        assertThat(result.getText()).isEqualTo("潮水退去。");
        assertThat(sleeps).hasSize(1);
        verify(client, times(2)).generate(anyString(), any(GenerationOptions.class));
    }

    @Test
    @DisplayName("a fatal failure is thrown without retrying")
    void should_NotRetry_When_FailureIsFatal() {
        when(client.generate(anyString(), any(GenerationOptions.class)))
                .thenThrow(TextGenerationException.fatal("AI配置无效：未设置 api-key"));

        assertThatThrownBy(() -> gateway.generate("第1章第1节", "写第一节", options(), RequestPriority.NORMAL))
                .isInstanceOfSatisfying(TextGenerationException.class, e -> assertThat(e.isTransient()).isFalse());
        verify(client, times(1)).generate(anyString(), any(GenerationOptions.class));
        assertThat(sleeps).isEmpty();
    }

    @Test
    @DisplayName("a call that outlives the timeout is retried and finally reported as a timeout")
    void should_ReportTimeout_When_CallsHang() {
        when(client.generate(anyString(), any(GenerationOptions.class))).thenAnswer(inv -> {
            Thread.sleep(5000);
            return new GenerationResult("太迟了", 10);
        });

        assertThatThrownBy(() -> gateway.generate("第1章第1节", "写第一节", options(), RequestPriority.NORMAL))
                .isInstanceOfSatisfying(TextGenerationException.class, e -> assertThat(e.isTimeout()).isTrue());
        assertThat(sleeps).hasSize(2);
    }
}
