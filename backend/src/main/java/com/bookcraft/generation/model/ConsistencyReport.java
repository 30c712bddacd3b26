package com.bookcraft.generation.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 单元连贯性检查报告
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConsistencyReport {

    private int chapterNumber;

    /** 0-100 */
    private double overallScore;

    @Builder.Default
    private Map<IssueType, Double> categoryScores = new EnumMap<>(IssueType.class);

    @Builder.Default
    private List<ConsistencyIssue> issues = new ArrayList<>();

    @Builder.Default
    private List<String> recommendations = new ArrayList<>();

    @Builder.Default
    private List<String> successfulElements = new ArrayList<>();

    /** 降级处理过的解析失败记录 */
    @Builder.Default
    private List<String> parseErrors = new ArrayList<>();
}
