package com.bookcraft.generation.continuity;

import com.bookcraft.generation.model.ConsistencyIssue;
import com.bookcraft.generation.model.IssueSeverity;
import com.bookcraft.generation.model.IssueType;
import com.bookcraft.generation.model.NarrativeState;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 连贯性评分
 *
 * 每个问题扣分 = 类别权重 × 严重程度点数。
 * 总分按正文长度归一：扣分总和 / max(1, 长度/5000)，因此同样的问题出现在更长的正文里扣分更少。
 */
@Component
public class ConsistencyScorer {

    static final double LENGTH_NORMALIZATION_CHARS = 5000.0;

    public double overallScore(List<ConsistencyIssue> issues, int contentLength) {
        double deduction = 0;
        for (ConsistencyIssue issue : issues) {
            deduction += deductionOf(issue);
        }
        double normalization = Math.max(1.0, contentLength / LENGTH_NORMALIZATION_CHARS);
        return clamp(100 - deduction / normalization);
    }

    /**
     * 六个类别都会给出分数，没有问题的类别为 100
     */
    public Map<IssueType, Double> categoryScores(List<ConsistencyIssue> issues) {
        Map<IssueType, Double> scores = new EnumMap<>(IssueType.class);
        for (IssueType type : IssueType.values()) {
            double score = 100;
            for (ConsistencyIssue issue : issues) {
                if (issue.getType() == type) {
                    score -= deductionOf(issue);
                }
            }
            scores.put(type, clamp(score));
        }
        return scores;
    }

    public List<String> recommendations(List<ConsistencyIssue> issues) {
        List<String> recommendations = new ArrayList<>();
        if (issues.isEmpty()) {
            recommendations.add("本单元与既有故事要素保持一致");
            return recommendations;
        }
        long critical = countBySeverity(issues, IssueSeverity.CRITICAL);
        long major = countBySeverity(issues, IssueSeverity.MAJOR);
        long minor = countBySeverity(issues, IssueSeverity.MINOR);
        if (critical > 0) {
            recommendations.add("❌ 继续之前先处理 " + critical + " 个严重连贯性问题");
            recommendations.add("严重问题会破坏读者的沉浸感与信任");
        }
        if (major > 0) {
            recommendations.add("⚠️ 复核并修正 " + major + " 个主要连贯性问题");
        }
        if (minor > 0) {
            recommendations.add("📝 润色时可顺带处理 " + minor + " 个次要问题");
        }
        if (hasType(issues, IssueType.TIMELINE)) {
            recommendations.add("🕐 重点关注时间推进与角色所在位置");
        }
        if (hasType(issues, IssueType.CHARACTER)) {
            recommendations.add("👥 确保角色的行为与已知信息前后一致");
        }
        if (hasType(issues, IssueType.WORLDBUILDING)) {
            recommendations.add("🌍 核对已确立的世界规则与设定");
        }
        if (hasType(issues, IssueType.RESEARCH)) {
            recommendations.add("📚 复查资料事实与技术细节");
        }
        recommendations.add("后续章节继续保持连贯性监控");
        return recommendations;
    }

    /**
     * 根据本章在叙事状态中留下的记录给出正向反馈
     */
    public List<String> successfulElements(NarrativeState state, int chapterNumber) {
        List<String> elements = new ArrayList<>();
        long activeCharacters = state.getCharacters().values().stream()
                .filter(c -> c.getLastSeenChapter() != null && c.getLastSeenChapter() == chapterNumber)
                .count();
        if (activeCharacters > 0) {
            elements.add("成功追踪 " + activeCharacters + " 个角色");
        }
        if (state.getTimeline().stream().anyMatch(t -> t.getChapter() == chapterNumber)) {
            elements.add("时间推进已记录");
        }
        if (state.getPlotPoints().stream().anyMatch(p -> p.getChapter() == chapterNumber)) {
            elements.add("情节发展已记录");
        }
        if (state.getWorldBuilding().values().stream().anyMatch(w -> w.getChapters().contains(chapterNumber))) {
            elements.add("世界观元素保持一致");
        }
        if (elements.isEmpty()) {
            elements.add("基本故事结构保持完整");
        }
        return elements;
    }

    static double deductionOf(ConsistencyIssue issue) {
        double weight = issue.getType() != null ? issue.getType().getWeight() : 1.0;
        int points = issue.getSeverity() != null ? issue.getSeverity().getPoints() : IssueSeverity.MINOR.getPoints();
        return weight * points;
    }

    private static long countBySeverity(List<ConsistencyIssue> issues, IssueSeverity severity) {
        return issues.stream().filter(i -> i.getSeverity() == severity).count();
    }

    private static boolean hasType(List<ConsistencyIssue> issues, IssueType type) {
        return issues.stream().anyMatch(i -> i.getType() == type);
    }

    private static double clamp(double score) {
        return Math.max(0, Math.min(100, score));
    }
}
