package com.bookcraft.generation.quality;

import com.bookcraft.config.GenerationProperties;
import com.bookcraft.generation.exception.GenerationCancelledException;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 质量门：综合分 = 连贯性分与审校分的算术平均
 *
 * 低于 low-quality-threshold 拒绝，达到 polish-threshold 先润色再接收，其余直接接收。
 */
@Component
public class QualityGate {

    private static final Logger logger = LoggerFactory.getLogger(QualityGate.class);

    private final GenerationProperties properties;
    private final ContentPolisher polisher;

    public QualityGate(GenerationProperties properties, ContentPolisher polisher) {
        this.properties = properties;
        this.polisher = polisher;
    }

    public static double combinedScore(double consistencyScore, double supervisionScore) {
        return (consistencyScore + supervisionScore) / 2.0;
    }

    public QualityDecision decide(double consistencyScore, double supervisionScore) {
        double combined = combinedScore(consistencyScore, supervisionScore);
        if (combined < properties.getLowQualityThreshold()) {
            return QualityDecision.REJECT;
        }
        if (combined >= properties.getPolishThreshold()) {
            return QualityDecision.POLISH;
        }
        return QualityDecision.ACCEPT;
    }

    public GateResult evaluate(int chapterNumber, int unitNumber, String content,
                               double consistencyScore, double supervisionScore, List<String> suggestions) {
        double combined = combinedScore(consistencyScore, supervisionScore);
        QualityDecision decision = decide(consistencyScore, supervisionScore);
        if (decision != QualityDecision.POLISH) {
            if (decision == QualityDecision.REJECT) {
                logger.warn("🚫 第{}章第{}节未通过质量门: 综合分={} (连贯性={}, 审校={})", chapterNumber, unitNumber,
                        combined, consistencyScore, supervisionScore);
            }
            return new GateResult(decision, consistencyScore, supervisionScore, combined, content, false);
        }
        try {
            String polished = polisher.polish(chapterNumber, unitNumber, content, suggestions);
            if (StringUtils.isNotBlank(polished)) {
                logger.info("✨ 第{}章第{}节已润色: 综合分={}", chapterNumber, unitNumber, combined);
                return new GateResult(decision, consistencyScore, supervisionScore, combined, polished, true);
            }
            logger.warn("⚠️ 第{}章第{}节润色结果为空，保留原文", chapterNumber, unitNumber);
        } catch (GenerationCancelledException e) {
            throw e;
        } catch (RuntimeException e) {
            logger.warn("⚠️ 第{}章第{}节润色失败，保留原文: {}", chapterNumber, unitNumber, e.getMessage());
        }
        return new GateResult(decision, consistencyScore, supervisionScore, combined, content, false);
    }
}
