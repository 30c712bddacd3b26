package com.bookcraft.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 书籍生成编排参数
 *
 * 单元（小节）切分、并发扇出、质量门槛与重试上限都在这里集中配置。
 */
@Data
@ConfigurationProperties(prefix = "bookcraft.generation")
public class GenerationProperties {

    /** 理想单元字数，章节目标字数除以它得到单元数 */
    private int idealUnitWords = 1000;

    /** 单元字数下限 */
    private int minUnitWords = 800;

    /** 单元字数上限 */
    private int maxUnitWords = 1200;

    private int minUnitsPerChapter = 1;

    private int maxUnitsPerChapter = 5;

    /** 章节内单元生成的最大并发数（按批次派发） */
    private int maxConcurrentUnits = 3;

    /** 单次外部生成调用超时 */
    private Duration callTimeout = Duration.ofSeconds(180);

    /** 失败单元自动重试上限，达到后转为人工修订 */
    private int maxUnitRetries = 3;

    private String writingModel = "gpt-4o";

    private String analysisModel = "gpt-4o-mini";

    private double writingTemperature = 0.7;

    private int maxTokensPerUnit = 4000;

    /** 综合分低于该值进入失败队列 */
    private double lowQualityThreshold = 60;

    /** 综合分达到该值时先润色再接收 */
    private double polishThreshold = 80;

    /** 审校结果无法解析时使用的中性分 */
    private double supervisionFallbackScore = 70;

    private Retry retry = new Retry();

    @Data
    public static class Retry {

        /** 含首次调用在内的最大尝试次数 */
        private int maxAttempts = 3;

        private Duration baseDelay = Duration.ofSeconds(1);

        private Duration maxDelay = Duration.ofSeconds(30);
    }
}
