package com.bookcraft.generation.orchestrator;

import com.bookcraft.config.ContinuityProperties;
import com.bookcraft.config.GenerationProperties;
import com.bookcraft.domain.entity.Book;
import com.bookcraft.generation.ai.ExtractionResult;
import com.bookcraft.generation.ai.GenerationGateway;
import com.bookcraft.generation.ai.GenerationOptions;
import com.bookcraft.generation.ai.StructuredOutputExtractor;
import com.bookcraft.generation.exception.GenerationException;
import com.bookcraft.generation.model.StoryBible;
import com.bookcraft.generation.ratelimit.RequestPriority;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Comparator;

/**
 * 前提与故事圣经（PREMISE / OUTLINE 阶段）
 */
@Component
public class StoryPlanner {

    private static final Logger logger = LoggerFactory.getLogger(StoryPlanner.class);

    private final GenerationGateway gateway;
    private final StructuredOutputExtractor extractor;
    private final GenerationProperties generationProperties;
    private final ContinuityProperties continuityProperties;

    public StoryPlanner(GenerationGateway gateway,
                        StructuredOutputExtractor extractor,
                        GenerationProperties generationProperties,
                        ContinuityProperties continuityProperties) {
        this.gateway = gateway;
        this.extractor = extractor;
        this.generationProperties = generationProperties;
        this.continuityProperties = continuityProperties;
    }

    public String generatePremise(Book book) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("请根据以下创作需求，写一段300字以内的故事前提（封底文案），交代主角、核心冲突与悬念。\n\n");
        prompt.append("【书名】").append(StringUtils.defaultString(book.getTitle())).append("\n");
        if (StringUtils.isNotBlank(book.getGenre())) {
            prompt.append("【类型】").append(book.getGenre()).append("\n");
        }
        prompt.append("【创作需求】\n").append(StringUtils.defaultString(book.getPrompt())).append("\n\n");
        prompt.append("直接输出前提正文。");

        GenerationOptions options = GenerationOptions.builder()
                .model(generationProperties.getWritingModel())
                .temperature(generationProperties.getWritingTemperature())
                .maxTokens(1000)
                .build();
        String premise = gateway.generate("书籍" + book.getId() + "前提", prompt.toString(), options,
                RequestPriority.HIGH).getText();
        logger.info("📝 前提已生成: bookId={}, 长度={}", book.getId(), premise.length());
        return premise.trim();
    }

    /**
     * @throws GenerationException 结构化输出失败或章节数与书籍设置不符
     */
    public StoryBible generateStoryBible(Book book, String premise) {
        int chapterCount = book.getChapterCount();
        StringBuilder prompt = new StringBuilder();
        prompt.append("你是一名长篇小说策划。请为下面的故事制定故事圣经，共").append(chapterCount).append("章。\n\n");
        prompt.append("【书名】").append(StringUtils.defaultString(book.getTitle())).append("\n");
        if (StringUtils.isNotBlank(book.getGenre())) {
            prompt.append("【类型】").append(book.getGenre()).append("\n");
        }
        prompt.append("【故事前提】\n").append(premise).append("\n\n");
        prompt.append("要求：主要角色3-8名；每章给出标题、概要、地点、冲突、基调、视角人物、出场角色、")
              .append("场景类型（action/dialogue/atmospheric/emotional 之一）与需要准确体现的资料；")
              .append("另给出5-10条全书通用的资料事实。\n\n");
        prompt.append("请严格按以下JSON格式输出，不要输出其他内容：\n");
        prompt.append("{\"title\": \"书名\",\n")
              .append(" \"characters\": [{\"name\": \"角色名\", \"role\": \"主角/反派/配角\", \"description\": \"简介\"}],\n")
              .append(" \"chapters\": [{\"chapterNumber\": 1, \"title\": \"章标题\", \"summary\": \"概要\", \"setting\": \"地点\",\n")
              .append("               \"conflict\": \"冲突\", \"mood\": \"基调\", \"focalCharacter\": \"视角人物\",\n")
              .append("               \"characters\": [\"出场角色\"], \"sceneType\": \"action\", \"researchFocus\": [\"资料\"]}],\n")
              .append(" \"researchFacts\": [\"资料事实\"]}");

        GenerationOptions options = GenerationOptions.builder()
                .model(generationProperties.getWritingModel())
                .temperature(0.5)
                .maxTokens(Math.max(4000, chapterCount * 300))
                .build();
        ExtractionResult<StoryBible> result = extractor.extract("书籍" + book.getId() + "故事圣经", prompt.toString(),
                options, StoryBible.class, continuityProperties.getParsingRetries());
        if (!result.isUsable()) {
            throw new GenerationException(book.getId(), "故事圣经生成失败: " + String.join("；", result.getErrors()), null);
        }
        StoryBible bible = result.getValue();
        bible.getChapters().sort(Comparator.comparing(StoryBible.ChapterOutline::getChapterNumber));
        for (int chapter = 1; chapter <= chapterCount; chapter++) {
            if (bible.findChapter(chapter) == null) {
                throw new GenerationException(book.getId(), "故事圣经缺少第" + chapter + "章大纲", null);
            }
        }
        logger.info("📚 故事圣经已生成: bookId={}, 角色={}, 章节={}", book.getId(), bible.getCharacters().size(),
                bible.getChapters().size());
        return bible;
    }
}
