package com.bookcraft.generation.ai;

import com.bookcraft.generation.ratelimit.RequestPriority;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.validation.ConstraintViolation;
import javax.validation.Validator;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * 结构化输出抽取
 *
 * 解析阶梯：严格解析 → 结构清洗后解析 → 追加"仅以纯JSON重复回答"的提示重新生成。
 * 每一步都要通过 javax.validation 校验，校验不过等同于解析失败。
 * 调用本身失败（超时、限流、网络）不属于解析失败，异常原样抛给调用方。
 */
@Component
public class StructuredOutputExtractor {

    private static final Logger logger = LoggerFactory.getLogger(StructuredOutputExtractor.class);

    private final GenerationGateway gateway;
    private final ObjectMapper objectMapper;
    private final Validator validator;

    public StructuredOutputExtractor(GenerationGateway gateway, ObjectMapper objectMapper, Validator validator) {
        this.gateway = gateway;
        this.objectMapper = objectMapper.copy().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.validator = validator;
    }

    /**
     * 生成并抽取结构化结果
     *
     * @param maxReprompts 首次失败后追加提示的最多次数
     * @throws TextGenerationException 网关重试耗尽或遇到致命错误
     */
    public <T> ExtractionResult<T> extract(String context, String prompt, GenerationOptions options,
                                           Class<T> type, int maxReprompts) {
        List<String> errors = new ArrayList<>();
        String currentPrompt = prompt;
        int attempts = 0;
        for (int round = 0; round <= maxReprompts; round++) {
            attempts++;
            String raw;
            try {
                raw = gateway.generate(context, currentPrompt, options, RequestPriority.NORMAL).getText();
            } catch (TextGenerationException e) {
                logger.warn("⚠️ {} 第{}次生成调用失败: {}", context, attempts, e.getMessage());
                throw e;
            }
            ExtractionResult<T> decoded = decode(raw, type);
            if (decoded.isUsable()) {
                if (round > 0) {
                    logger.info("✅ {} 第{}次追加提示后解析成功", context, round);
                }
                return decoded.withAttempts(attempts, errors);
            }
            errors.addAll(decoded.getErrors());
            logger.warn("⚠️ {} 第{}次输出无法解析: {}", context, attempts, decoded.getErrors());
            currentPrompt = strictRepeatPrompt(prompt, raw, decoded.getErrors());
        }
        logger.error("❌ {} 结构化抽取失败，共尝试 {} 次", context, attempts);
        return ExtractionResult.<T>failed(Collections.emptyList()).withAttempts(attempts, errors);
    }

    /**
     * 只解析不调用模型
     */
    public <T> ExtractionResult<T> decode(String raw, Class<T> type) {
        if (StringUtils.isBlank(raw)) {
            return ExtractionResult.failed(Collections.singletonList("输出为空"));
        }
        List<String> errors = new ArrayList<>();
        T strict = parseAndValidate(raw.trim(), type, errors);
        if (strict != null) {
            return ExtractionResult.success(strict);
        }
        String cleaned = extractJsonBody(raw);
        if (cleaned != null && !cleaned.equals(raw.trim())) {
            List<String> lenientErrors = new ArrayList<>();
            T lenient = parseAndValidate(cleaned, type, lenientErrors);
            if (lenient != null) {
                return ExtractionResult.partial(lenient, Collections.singletonList("已清洗非JSON内容后解析"));
            }
            errors.addAll(lenientErrors);
        }
        return ExtractionResult.failed(errors);
    }

    private <T> T parseAndValidate(String json, Class<T> type, List<String> errors) {
        T value;
        try {
            value = objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            errors.add("JSON解析失败: " + e.getOriginalMessage());
            return null;
        }
        if (value == null) {
            errors.add("JSON为空");
            return null;
        }
        Set<ConstraintViolation<T>> violations = validator.validate(value);
        if (!violations.isEmpty()) {
            for (ConstraintViolation<T> violation : violations) {
                errors.add("校验失败: " + violation.getPropertyPath() + " " + violation.getMessage());
            }
            return null;
        }
        return value;
    }

    /**
     * 去掉 markdown 代码块，截取第一个 '{' 到最后一个 '}' 之间的内容
     */
    static String extractJsonBody(String raw) {
        String text = raw.trim();
        if (text.startsWith("```")) {
            int firstNewline = text.indexOf('\n');
            text = firstNewline >= 0 ? text.substring(firstNewline + 1) : text.substring(3);
            int fence = text.lastIndexOf("```");
            if (fence >= 0) {
                text = text.substring(0, fence);
            }
        }
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (start < 0 || end <= start) {
            return null;
        }
        return text.substring(start, end + 1).trim();
    }

    private static String strictRepeatPrompt(String originalPrompt, String previousOutput, List<String> errors) {
        StringBuilder prompt = new StringBuilder(originalPrompt);
        prompt.append("\n\n【上一次输出无法解析】\n");
        prompt.append(StringUtils.abbreviate(StringUtils.defaultString(previousOutput), 2000)).append("\n");
        prompt.append("错误：").append(String.join("；", errors)).append("\n");
        prompt.append("请只输出一个合法的JSON对象，不要使用代码块，不要输出任何解释文字，字段名与要求完全一致。");
        return prompt.toString();
    }
}
