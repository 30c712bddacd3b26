package com.bookcraft.generation.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 连贯性问题类别及其评分权重
 */
public enum IssueType {

    CHARACTER("character", 1.3),
    TIMELINE("timeline", 1.5),
    PLOT("plot", 1.2),
    RESEARCH("research", 1.0),
    WORLDBUILDING("worldbuilding", 0.8),
    RELATIONSHIP("relationship", 0.6);

    private final String code;
    private final double weight;

    IssueType(String code, double weight) {
        this.code = code;
        this.weight = weight;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public double getWeight() {
        return weight;
    }

    /**
     * 模型输出大小写不一，"world_building"、"Timeline" 都要能识别；无法识别返回 null 交给校验层处理
     */
    @JsonCreator
    public static IssueType fromCode(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase().replace("_", "").replace("-", "").replace(" ", "");
        for (IssueType type : values()) {
            if (type.code.equals(normalized)) {
                return type;
            }
        }
        if ("world".equals(normalized) || "setting".equals(normalized)) {
            return WORLDBUILDING;
        }
        return null;
    }
}
