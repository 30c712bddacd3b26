package com.bookcraft.generation.continuity;

import com.bookcraft.config.ContinuityProperties;
import com.bookcraft.generation.ai.ExtractionResult;
import com.bookcraft.generation.ai.GenerationOptions;
import com.bookcraft.generation.ai.StructuredOutputExtractor;
import com.bookcraft.generation.ai.TextGenerationException;
import com.bookcraft.generation.exception.ContinuityCheckException;
import com.bookcraft.generation.model.CharacterState;
import com.bookcraft.generation.model.ConsistencyIssue;
import com.bookcraft.generation.model.ConsistencyIssuesResponse;
import com.bookcraft.generation.model.ConsistencyReport;
import com.bookcraft.generation.model.IssueType;
import com.bookcraft.generation.model.NarrativeState;
import com.bookcraft.generation.model.StoryBible;
import com.bookcraft.generation.model.TrackerUpdates;
import com.bookcraft.generation.session.GenerationSession;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * 叙事连贯性追踪
 *
 * 每个单元先抽取状态增量并合并，再按类别做一致性检查并打分。
 * 同一会话的调用在会话锁内串行执行。
 */
@Service
public class ContinuityTracker {

    private static final Logger logger = LoggerFactory.getLogger(ContinuityTracker.class);

    private static final String SYSTEM_PROMPT = "你是专业的长篇小说连贯性审校，只输出JSON。";

    private final StructuredOutputExtractor extractor;
    private final ContinuityPromptBuilder prompts;
    private final NarrativeStateUpdater updater;
    private final ConsistencyScorer scorer;
    private final ContinuityProperties properties;

    public ContinuityTracker(StructuredOutputExtractor extractor,
                             ContinuityPromptBuilder prompts,
                             NarrativeStateUpdater updater,
                             ConsistencyScorer scorer,
                             ContinuityProperties properties) {
        this.extractor = extractor;
        this.prompts = prompts;
        this.updater = updater;
        this.scorer = scorer;
        this.properties = properties;
    }

    /**
     * 用故事圣经初始化会话的叙事状态
     */
    public void initialize(GenerationSession session, List<StoryBible.CharacterSeed> characters,
                           StoryBible outline, List<String> researchFacts) {
        session.getLock().lock();
        try {
            NarrativeState state = session.getNarrativeState();
            updater.seed(state, characters, researchFacts);
            if (outline != null) {
                for (StoryBible.ChapterOutline chapter : outline.getChapters()) {
                    if (StringUtils.isNotBlank(chapter.getSetting())) {
                        state.registerWorldElement(chapter.getSetting().trim(), "location", null);
                    }
                }
            }
            logger.info("🚀 连贯性追踪已初始化: bookId={}, 角色={}, 资料={}", session.getBookId(),
                    state.getCharacters().size(), state.getResearchReferences().size());
        } finally {
            session.getLock().unlock();
        }
    }

    /**
     * 检查一个单元：先更新叙事状态，再做各类别检查
     *
     * @throws ContinuityCheckException 关键类别无法得到结构化结果
     * @throws TextGenerationException 检查调用本身失败，本单元未完成检查
     */
    public ConsistencyReport checkUnit(GenerationSession session, int chapterNumber, String content,
                                       String summary, List<String> referencedFacts) {
        List<String> facts = referencedFacts != null ? referencedFacts : Collections.emptyList();
        session.getLock().lock();
        try {
            NarrativeState state = session.getNarrativeState();
            List<String> parseErrors = new ArrayList<>();
            List<String> successfulElements = new ArrayList<>();
            List<ConsistencyIssue> issues = new ArrayList<>();

            updateTracker(state, chapterNumber, content, summary, facts, parseErrors);

            String lowerContent = content.toLowerCase(Locale.ROOT);
            for (CharacterState character : new ArrayList<>(state.getCharacters().values())) {
                if (lowerContent.contains(character.getName().toLowerCase(Locale.ROOT))) {
                    runCheck(IssueType.CHARACTER, "第" + chapterNumber + "章角色检查[" + character.getName() + "]",
                            prompts.characterPrompt(character, chapterNumber, content),
                            issues, successfulElements, parseErrors);
                }
            }
            runCheck(IssueType.TIMELINE, "第" + chapterNumber + "章时间线检查",
                    prompts.timelinePrompt(state.getRecentTimeline(properties.getRecentTimelineEntries()), chapterNumber, content),
                    issues, successfulElements, parseErrors);
            runCheck(IssueType.WORLDBUILDING, "第" + chapterNumber + "章世界观检查",
                    prompts.worldBuildingPrompt(state.getWorldBuilding().values(), chapterNumber, content),
                    issues, successfulElements, parseErrors);
            if (!facts.isEmpty()) {
                runCheck(IssueType.RESEARCH, "第" + chapterNumber + "章资料检查",
                        prompts.researchPrompt(facts, state.getEstablishedFacts(), chapterNumber, content),
                        issues, successfulElements, parseErrors);
            }

            successfulElements.addAll(scorer.successfulElements(state, chapterNumber));
            ConsistencyReport report = ConsistencyReport.builder()
                    .chapterNumber(chapterNumber)
                    .overallScore(scorer.overallScore(issues, content.length()))
                    .categoryScores(scorer.categoryScores(issues))
                    .issues(issues)
                    .recommendations(scorer.recommendations(issues))
                    .successfulElements(successfulElements)
                    .parseErrors(parseErrors)
                    .build();
            logger.info("✅ 第{}章连贯性检查完成: 分数={}, 问题={}, 降级={}", chapterNumber,
                    String.format("%.1f", report.getOverallScore()), issues.size(), parseErrors.size());
            return report;
        } finally {
            session.getLock().unlock();
        }
    }

    private void updateTracker(NarrativeState state, int chapterNumber, String content, String summary,
                               List<String> facts, List<String> parseErrors) {
        ExtractionResult<TrackerUpdates> result = extractor.extract("第" + chapterNumber + "章状态更新",
                prompts.trackerUpdatePrompt(chapterNumber, content, summary, facts),
                options(), TrackerUpdates.class, properties.getParsingRetries());
        if (result.isUsable()) {
            updater.apply(state, result.getValue(), chapterNumber);
            if (result.getStatus() == ExtractionResult.Status.PARTIAL) {
                parseErrors.addAll(result.getErrors());
            }
            return;
        }
        String message = "第" + chapterNumber + "章状态更新抽取失败: " + String.join("；", result.getErrors());
        if (properties.isTrackerExtractionCritical()) {
            throw new ContinuityCheckException(null, message);
        }
        logger.warn("⚠️ {}，本单元不更新叙事状态", message);
        parseErrors.add(message);
    }

    private void runCheck(IssueType category, String context, String prompt, List<ConsistencyIssue> issues,
                          List<String> successfulElements, List<String> parseErrors) {
        ExtractionResult<ConsistencyIssuesResponse> result = extractor.extract(context, prompt, options(),
                ConsistencyIssuesResponse.class, properties.getParsingRetries());
        if (result.isUsable()) {
            ConsistencyIssuesResponse response = result.getValue();
            issues.addAll(response.getIssues());
            if (response.getSuccessfulElements() != null) {
                successfulElements.addAll(response.getSuccessfulElements());
            }
            if (result.getStatus() == ExtractionResult.Status.PARTIAL) {
                parseErrors.addAll(result.getErrors());
            }
            logger.debug("🔍 {} 完成，发现 {} 个问题", context, response.getIssues().size());
            return;
        }
        String message = context + " 无法解析: " + String.join("；", result.getErrors());
        if (properties.isCritical(category)) {
            logger.error("❌ {}（关键类别）", message);
            throw new ContinuityCheckException(category, message);
        }
        logger.warn("⚠️ {}，按零问题处理", message);
        parseErrors.add(message);
    }

    private GenerationOptions options() {
        return GenerationOptions.builder()
                .model(properties.getModel())
                .temperature(properties.getTemperature())
                .maxTokens(properties.getMaxTokens())
                .systemPrompt(SYSTEM_PROMPT)
                .build();
    }
}
