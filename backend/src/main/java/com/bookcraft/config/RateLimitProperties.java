package com.bookcraft.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 按模型类别的滚动窗口配额
 */
@Data
@ConfigurationProperties(prefix = "bookcraft.rate-limit")
public class RateLimitProperties {

    private Duration window = Duration.ofSeconds(60);

    private ModelLimit defaultLimit = new ModelLimit(60, 30000);

    private Map<String, ModelLimit> models = defaultModels();

    public ModelLimit limitFor(String modelClass) {
        ModelLimit limit = models == null ? null : models.get(modelClass);
        return limit != null ? limit : defaultLimit;
    }

    private static Map<String, ModelLimit> defaultModels() {
        Map<String, ModelLimit> defaults = new LinkedHashMap<>();
        defaults.put("gpt-4o", new ModelLimit(60, 30000));
        defaults.put("gpt-4o-mini", new ModelLimit(100, 60000));
        defaults.put("gpt-3.5-turbo", new ModelLimit(120, 90000));
        return defaults;
    }

    @Data
    public static class ModelLimit {

        private int requestsPerWindow;

        private long tokensPerWindow;

        public ModelLimit() {
        }

        public ModelLimit(int requestsPerWindow, long tokensPerWindow) {
            this.requestsPerWindow = requestsPerWindow;
            this.tokensPerWindow = tokensPerWindow;
        }
    }
}
