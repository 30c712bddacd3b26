package com.bookcraft.generation.exception;

import com.bookcraft.generation.model.IssueType;

/**
 * 关键类别的连贯性检查无法得到结构化结果
 */
public class ContinuityCheckException extends RuntimeException {

    private final IssueType category;

    public ContinuityCheckException(IssueType category, String message) {
        super(message);
        this.category = category;
    }

    public ContinuityCheckException(IssueType category, String message, Throwable cause) {
        super(message, cause);
        this.category = category;
    }

    /** 为 null 表示状态更新抽取失败 */
    public IssueType getCategory() {
        return category;
    }
}
