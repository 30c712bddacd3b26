package com.bookcraft.generation.quality;

import com.bookcraft.config.GenerationProperties;
import com.bookcraft.generation.ai.ExtractionResult;
import com.bookcraft.generation.ai.GenerationOptions;
import com.bookcraft.generation.ai.StructuredOutputExtractor;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * 基于模型的审校评分，解析失败时给出中性兜底分
 *
 * 调用失败不走兜底分，TextGenerationException 由调用方处理。
 */
@Component
public class AiSupervisionReviewer implements SupervisionReviewer {

    private static final Logger logger = LoggerFactory.getLogger(AiSupervisionReviewer.class);

    private static final int REVIEW_REPROMPTS = 2;

    private final StructuredOutputExtractor extractor;
    private final GenerationProperties properties;

    public AiSupervisionReviewer(StructuredOutputExtractor extractor, GenerationProperties properties) {
        this.extractor = extractor;
        this.properties = properties;
    }

    @Override
    public SupervisionResult review(int chapterNumber, int unitNumber, String content, String summary) {
        String target = unitNumber > 0 ? "第" + chapterNumber + "章第" + unitNumber + "节" : "第" + chapterNumber + "章";
        StringBuilder prompt = new StringBuilder();
        prompt.append("你是资深小说编辑，请为").append(target).append("打分（0-100）。\n");
        prompt.append("评分维度：情节推进、人物塑造、文笔流畅度、节奏、与章节目标的契合度。\n\n");
        if (StringUtils.isNotBlank(summary)) {
            prompt.append("【章节目标】\n").append(summary).append("\n\n");
        }
        prompt.append("【正文】\n").append(content).append("\n\n");
        prompt.append("请严格按以下JSON格式输出，不要输出其他内容：\n");
        prompt.append("{\"score\": 0-100的数字, \"strengths\": [\"亮点\"], \"suggestions\": [\"具体修改建议\"]}");

        GenerationOptions options = GenerationOptions.builder()
                .model(properties.getAnalysisModel())
                .temperature(0.2)
                .maxTokens(1500)
                .build();
        ExtractionResult<SupervisionResult> result = extractor.extract(target + "审校", prompt.toString(), options,
                SupervisionResult.class, REVIEW_REPROMPTS);
        if (result.isUsable()) {
            SupervisionResult review = result.getValue();
            review.setFallback(false);
            return review;
        }
        logger.warn("⚠️ {}审校结果无法解析，使用兜底分 {}", target, properties.getSupervisionFallbackScore());
        return SupervisionResult.fallback(properties.getSupervisionFallbackScore());
    }
}
