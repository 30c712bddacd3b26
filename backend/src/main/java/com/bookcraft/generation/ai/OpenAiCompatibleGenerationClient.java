package com.bookcraft.generation.ai;

import com.bookcraft.config.AIClientConfig;
import com.bookcraft.generation.ratelimit.TokenBudgetRateLimiter;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * OpenAI 兼容的 /v1/chat/completions 客户端（非流式）
 */
@Component
public class OpenAiCompatibleGenerationClient implements TextGenerationClient {

    private static final Logger logger = LoggerFactory.getLogger(OpenAiCompatibleGenerationClient.class);

    private final RestTemplate restTemplate;
    private final AIClientConfig aiConfig;

    public OpenAiCompatibleGenerationClient(@Qualifier("generationRestTemplate") RestTemplate restTemplate,
                                            AIClientConfig aiConfig) {
        this.restTemplate = restTemplate;
        this.aiConfig = aiConfig;
    }

    @Override
    @SuppressWarnings("unchecked")
    public GenerationResult generate(String prompt, GenerationOptions options) {
        if (StringUtils.isBlank(aiConfig.getApiKey())) {
            throw TextGenerationException.fatal("AI配置无效：未设置 api-key");
        }
        String model = StringUtils.defaultIfBlank(options.getModel(), aiConfig.getDefaultModel());

        Map<String, Object> requestBody = new HashMap<>();
        requestBody.put("model", model);
        requestBody.put("max_tokens", options.getMaxTokens());
        requestBody.put("temperature", options.getTemperature());
        requestBody.put("stream", false);

        List<Map<String, String>> messages = new ArrayList<>();
        if (StringUtils.isNotBlank(options.getSystemPrompt())) {
            messages.add(message("system", options.getSystemPrompt()));
        }
        messages.add(message("user", prompt));
        requestBody.put("messages", messages);

        String url = aiConfig.getApiUrl();
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setBearerAuth(aiConfig.getApiKey());
        HttpEntity<Map<String, Object>> requestEntity = new HttpEntity<>(requestBody, headers);

        try {
            logger.debug("🌐 调用AI接口: url={}, model={}", url, model);
            ResponseEntity<Map> response = restTemplate.postForEntity(url, requestEntity, Map.class);
            Map<String, Object> responseBody = response.getBody();
            if (responseBody == null) {
                throw new TextGenerationException("AI返回内容为空", true);
            }
            String content = extractContent(responseBody);
            if (StringUtils.isBlank(content)) {
                throw new TextGenerationException("AI返回内容为空", true);
            }
            long usage = extractUsage(responseBody, prompt, content);
            logger.debug("✅ AI调用成功: model={}, 长度={}, tokens={}", model, content.length(), usage);
            return new GenerationResult(content, usage);
        } catch (HttpStatusCodeException e) {
            int status = e.getRawStatusCode();
            boolean transientFailure = status == 429 || status >= 500;
            throw new TextGenerationException("AI服务返回 HTTP " + status + ": " + e.getStatusText(), transientFailure, e);
        } catch (ResourceAccessException e) {
            throw new TextGenerationException("AI服务网络错误: " + e.getMessage(), true, e);
        } catch (RestClientException e) {
            throw new TextGenerationException("AI服务调用失败: " + e.getMessage(), false, e);
        }
    }

    @SuppressWarnings("unchecked")
    private String extractContent(Map<String, Object> responseBody) {
        Object choicesObj = responseBody.get("choices");
        if (choicesObj instanceof List) {
            List<Object> choices = (List<Object>) choicesObj;
            if (!choices.isEmpty() && choices.get(0) instanceof Map) {
                Map<String, Object> firstChoice = (Map<String, Object>) choices.get(0);
                Object messageObj = firstChoice.get("message");
                if (messageObj instanceof Map) {
                    Object content = ((Map<String, Object>) messageObj).get("content");
                    return content != null ? content.toString() : null;
                }
            }
        }
        return null;
    }

    @SuppressWarnings("unchecked")
    private long extractUsage(Map<String, Object> responseBody, String prompt, String content) {
        Object usageObj = responseBody.get("usage");
        if (usageObj instanceof Map) {
            Object total = ((Map<String, Object>) usageObj).get("total_tokens");
            if (total instanceof Number) {
                return ((Number) total).longValue();
            }
        }
        return TokenBudgetRateLimiter.estimateTokens(prompt) + TokenBudgetRateLimiter.estimateTokens(content);
    }

    private static Map<String, String> message(String role, String content) {
        Map<String, String> message = new HashMap<>();
        message.put("role", role);
        message.put("content", content);
        return message;
    }
}
