package com.bookcraft.domain.entity;

import com.baomidou.mybatisplus.annotation.*;
import com.bookcraft.generation.model.GenerationStep;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 书籍实体
 * 对应表：books
 */
@Data
@TableName("books")
public class Book {

    @TableId(type = IdType.AUTO)
    private Long id;

    private String title;

    /**
     * 用户的创作需求
     */
    private String prompt;

    private String genre;

    /**
     * 前提/封底文案（PREMISE 阶段产出）
     */
    private String premise;

    @TableField("target_word_count")
    private Integer targetWordCount;

    @TableField("chapter_count")
    private Integer chapterCount;

    private BookStatus status = BookStatus.DRAFT;

    @TableField("generation_step")
    private GenerationStep generationStep;

    /**
     * 故事圣经JSON（OUTLINE 阶段产出）
     */
    @TableField("story_bible")
    private String storyBible;

    @TableField("last_error")
    private String lastError;

    @TableField(value = "created_at", fill = FieldFill.INSERT)
    private LocalDateTime createdAt;

    @TableField(value = "updated_at", fill = FieldFill.INSERT_UPDATE)
    private LocalDateTime updatedAt;

    public enum BookStatus {
        DRAFT("草稿"),
        GENERATING("生成中"),
        NEEDS_REVISION("待修订"),
        PAUSED("已暂停"),
        COMPLETE("已完成");

        private final String description;

        BookStatus(String description) {
            this.description = description;
        }

        public String getDescription() {
            return description;
        }
    }
}
