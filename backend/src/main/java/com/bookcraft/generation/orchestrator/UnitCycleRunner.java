package com.bookcraft.generation.orchestrator;

import com.bookcraft.domain.entity.GenerationUnit;
import com.bookcraft.generation.ai.TextGenerationException;
import com.bookcraft.generation.continuity.ContinuityTracker;
import com.bookcraft.generation.exception.ContinuityCheckException;
import com.bookcraft.generation.model.ConsistencyReport;
import com.bookcraft.generation.model.FailureDiagnostics;
import com.bookcraft.generation.model.FailureReason;
import com.bookcraft.generation.model.StoryBible;
import com.bookcraft.generation.model.UnitPlan;
import com.bookcraft.generation.quality.GateResult;
import com.bookcraft.generation.quality.QualityDecision;
import com.bookcraft.generation.quality.QualityGate;
import com.bookcraft.generation.quality.SupervisionResult;
import com.bookcraft.generation.quality.SupervisionReviewer;
import com.bookcraft.generation.ratelimit.RequestPriority;
import com.bookcraft.generation.scene.UnitWriter;
import com.bookcraft.generation.scene.UnitWritingRequest;
import com.bookcraft.generation.session.GenerationSession;
import com.bookcraft.generation.store.BookStore;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 单元生成周期：写作 → 连贯性更新与检查 → 审校 → 质量门 → 通过则落库
 *
 * 写作可以并发（draft），之后的步骤必须按单元顺序串行执行（evaluate）。
 * 未通过的单元只返回失败结果，由调用方决定入队或计入重试。
 */
@Component
public class UnitCycleRunner {

    private static final Logger logger = LoggerFactory.getLogger(UnitCycleRunner.class);

    private final UnitWriter writer;
    private final ContinuityTracker tracker;
    private final SupervisionReviewer reviewer;
    private final QualityGate qualityGate;
    private final BookStore store;

    public UnitCycleRunner(UnitWriter writer,
                           ContinuityTracker tracker,
                           SupervisionReviewer reviewer,
                           QualityGate qualityGate,
                           BookStore store) {
        this.writer = writer;
        this.tracker = tracker;
        this.reviewer = reviewer;
        this.qualityGate = qualityGate;
        this.store = store;
    }

    public UnitDraft draft(UnitWritingRequest request, RequestPriority priority) {
        try {
            String content = writer.write(request, priority);
            if (StringUtils.isBlank(content)) {
                return UnitDraft.failed(request, new TextGenerationException("生成内容为空", true));
            }
            return UnitDraft.of(request, content.trim());
        } catch (TextGenerationException e) {
            UnitPlan plan = request.getPlan();
            logger.warn("⚠️ 第{}章第{}节生成失败: {}", plan.getChapterNumber(), plan.getUnitNumber(), e.getMessage());
            return UnitDraft.failed(request, e);
        }
    }

    public UnitOutcome evaluate(GenerationSession session, UnitDraft draft) {
        UnitWritingRequest request = draft.getRequest();
        UnitPlan plan = request.getPlan();
        int chapter = plan.getChapterNumber();
        int unit = plan.getUnitNumber();
        if (draft.isFailed()) {
            return generationFailure(chapter, unit, draft.getFailure());
        }

        String content = draft.getContent();
        StoryBible.ChapterOutline outline = request.getChapter();
        ConsistencyReport report;
        SupervisionResult supervision;
        try {
            report = tracker.checkUnit(session, chapter, content, outline.getSummary(), outline.getResearchFocus());
            supervision = reviewer.review(chapter, unit, content, outline.getSummary());
        } catch (ContinuityCheckException e) {
            return UnitOutcome.failed(chapter, unit, null, FailureReason.CONSISTENCY_CHECK_ERROR, e.getMessage(),
                    FailureDiagnostics.ofError(e.getMessage()));
        } catch (TextGenerationException e) {
            logger.warn("⚠️ 第{}章第{}节检查调用失败，单元不落库: {}", chapter, unit, e.getMessage());
            return generationFailure(chapter, unit, e);
        }

        List<String> suggestions = new ArrayList<>(report.getRecommendations());
        if (supervision.getSuggestions() != null) {
            suggestions.addAll(supervision.getSuggestions());
        }
        GateResult gate = qualityGate.evaluate(chapter, unit, content, report.getOverallScore(),
                supervision.getScore(), suggestions);
        FailureDiagnostics scores = FailureDiagnostics.ofScores(gate.getConsistencyScore(), gate.getSupervisionScore(),
                gate.getCombinedScore());
        if (gate.getDecision() == QualityDecision.REJECT) {
            return UnitOutcome.failed(chapter, unit, QualityDecision.REJECT, FailureReason.QUALITY_BELOW_THRESHOLD,
                    "综合分 " + String.format("%.1f", gate.getCombinedScore()) + " 低于门槛", scores);
        }

        GenerationUnit entity = new GenerationUnit();
        entity.setBookId(session.getBookId());
        entity.setChapterNumber(chapter);
        entity.setUnitNumber(unit);
        entity.setTargetWords(plan.getTargetWords());
        entity.setSceneType(request.getScene() != null ? request.getScene().getType().getCode() : null);
        entity.setStatus(GenerationUnit.UnitStatus.COMPLETE);
        entity.setContent(gate.getContent());
        entity.setWordCount(countWords(gate.getContent()));
        entity.setConsistencyScore(gate.getConsistencyScore());
        entity.setSupervisionScore(gate.getSupervisionScore());
        entity.setCombinedScore(gate.getCombinedScore());
        store.saveUnit(entity);
        session.markUnitComplete(chapter, unit);
        logger.info("✅ 第{}章第{}节完成: 综合分={}, 决策={}, 字数={}", chapter, unit,
                String.format("%.1f", gate.getCombinedScore()), gate.getDecision(), entity.getWordCount());
        return UnitOutcome.persisted(chapter, unit, gate.getDecision(), scores);
    }

    private static UnitOutcome generationFailure(int chapter, int unit, TextGenerationException failure) {
        FailureReason reason = failure.isTimeout() ? FailureReason.TIMEOUT : FailureReason.GENERATION_ERROR;
        return UnitOutcome.failed(chapter, unit, null, reason, failure.getMessage(),
                FailureDiagnostics.ofError(failure.getMessage()));
    }

    /**
     * 中文按字计数，连续的字母数字按一个词计数
     */
    public static int countWords(String text) {
        if (text == null) {
            return 0;
        }
        int count = 0;
        boolean inWord = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (Character.UnicodeScript.of(c) == Character.UnicodeScript.HAN) {
                count++;
                inWord = false;
            } else if (Character.isLetterOrDigit(c)) {
                if (!inWord) {
                    count++;
                    inWord = true;
                }
            } else {
                inWord = false;
            }
        }
        return count;
    }
}
