package com.bookcraft.generation.scene;

import com.bookcraft.config.GenerationProperties;
import com.bookcraft.generation.ai.GenerationGateway;
import com.bookcraft.generation.ai.GenerationOptions;
import com.bookcraft.generation.model.StoryBible;
import com.bookcraft.generation.model.UnitPlan;
import com.bookcraft.generation.ratelimit.RequestPriority;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

/**
 * 单元正文写作
 */
@Component
public class UnitWriter {

    private static final String SYSTEM_PROMPT = "你是一位经验丰富的小说作者，擅长控制节奏与人物塑造，只输出正文。";

    private final GenerationGateway gateway;
    private final GenerationProperties properties;

    public UnitWriter(GenerationGateway gateway, GenerationProperties properties) {
        this.gateway = gateway;
        this.properties = properties;
    }

    /**
     * @param priority 首次生成 NORMAL，失败队列回放 HIGH
     */
    public String write(UnitWritingRequest request, RequestPriority priority) {
        UnitPlan plan = request.getPlan();
        GenerationOptions options = GenerationOptions.builder()
                .model(properties.getWritingModel())
                .temperature(request.getScene() != null ? request.getScene().getTemperature() : properties.getWritingTemperature())
                .maxTokens(properties.getMaxTokensPerUnit())
                .systemPrompt(SYSTEM_PROMPT)
                .build();
        String context = "第" + plan.getChapterNumber() + "章第" + plan.getUnitNumber() + "节写作";
        return gateway.generate(context, buildPrompt(request), options, priority).getText();
    }

    String buildPrompt(UnitWritingRequest request) {
        StoryBible.ChapterOutline chapter = request.getChapter();
        UnitPlan plan = request.getPlan();
        StringBuilder prompt = new StringBuilder();
        prompt.append("【作品】").append(StringUtils.defaultString(request.getBookTitle())).append("\n");
        if (StringUtils.isNotBlank(request.getPremise())) {
            prompt.append("【故事前提】\n").append(request.getPremise()).append("\n\n");
        }
        prompt.append("【第").append(plan.getChapterNumber()).append("章 ").append(chapter.getTitle()).append("】\n");
        prompt.append(chapter.getSummary()).append("\n\n");
        prompt.append("本章共").append(plan.getTotalUnits()).append("节，现在写第").append(plan.getUnitNumber())
              .append("节，目标约").append(plan.getTargetWords()).append("字。\n");
        if (plan.isFirst()) {
            prompt.append("这是本章开篇，需要迅速建立场景与悬念。\n");
        } else if (plan.isLast()) {
            prompt.append("这是本章结尾，收束本章冲突并留下推动下一章的钩子。\n");
        }
        prompt.append("\n");
        if (request.getScene() != null) {
            request.getScene().appendScenePrompt(prompt);
            prompt.append("\n");
        }
        if (!request.getCharacterNotes().isEmpty()) {
            prompt.append("【角色当前状态】\n");
            request.getCharacterNotes().forEach(note -> prompt.append("- ").append(note).append("\n"));
            prompt.append("\n");
        }
        if (chapter.getResearchFocus() != null && !chapter.getResearchFocus().isEmpty()) {
            prompt.append("【需要准确体现的资料】\n");
            chapter.getResearchFocus().forEach(fact -> prompt.append("- ").append(fact).append("\n"));
            prompt.append("\n");
        }
        if (StringUtils.isNotBlank(request.getPreviousExcerpt())) {
            prompt.append("【上一节结尾】\n").append(request.getPreviousExcerpt()).append("\n\n");
        }
        prompt.append("直接输出本节正文，不要标题，不要任何解释。");
        return prompt.toString();
    }
}
