package com.bookcraft.domain.entity;

import com.baomidou.mybatisplus.annotation.*;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 生成单元（章节内的小节）
 * 对应表：generation_units
 */
@Data
@TableName("generation_units")
public class GenerationUnit {

    @TableId(type = IdType.AUTO)
    private Long id;

    @TableField("book_id")
    private Long bookId;

    @TableField("chapter_number")
    private Integer chapterNumber;

    @TableField("unit_number")
    private Integer unitNumber;

    @TableField("target_words")
    private Integer targetWords;

    /**
     * action / dialogue / atmospheric / emotional
     */
    @TableField("scene_type")
    private String sceneType;

    private UnitStatus status = UnitStatus.PLANNED;

    private String content;

    @TableField("word_count")
    private Integer wordCount;

    @TableField("consistency_score")
    private Double consistencyScore;

    @TableField("supervision_score")
    private Double supervisionScore;

    @TableField("combined_score")
    private Double combinedScore;

    @TableField(value = "created_at", fill = FieldFill.INSERT)
    private LocalDateTime createdAt;

    @TableField(value = "updated_at", fill = FieldFill.INSERT_UPDATE)
    private LocalDateTime updatedAt;

    public enum UnitStatus {
        PLANNED,
        GENERATING,
        COMPLETE,
        NEEDS_REVISION
    }
}
