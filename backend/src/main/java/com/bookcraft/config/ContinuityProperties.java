package com.bookcraft.config;

import com.bookcraft.generation.model.IssueType;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.EnumSet;
import java.util.Set;

/**
 * 连贯性追踪参数
 *
 * criticalCategories 显式声明哪些检查类别是"安全关键"的：
 * 这些类别在结构化解析全部失败时直接让单元检查失败，其余类别降级为零问题。
 */
@Data
@ConfigurationProperties(prefix = "bookcraft.continuity")
public class ContinuityProperties {

    private String model = "gpt-4o";

    private double temperature = 0.0;

    private int maxTokens = 4000;

    /** 解析失败后"以纯JSON重复输出"的追加提示次数 */
    private int parsingRetries = 4;

    /** 送入检查提示词的正文最大长度 */
    private int maxContentLength = 8000;

    private int recentTimelineEntries = 5;

    private Set<IssueType> criticalCategories = EnumSet.of(IssueType.CHARACTER);

    /** 状态更新抽取失败是否视为关键失败 */
    private boolean trackerExtractionCritical = false;

    public boolean isCritical(IssueType category) {
        return criticalCategories != null && criticalCategories.contains(category);
    }
}
