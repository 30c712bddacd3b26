package com.bookcraft.domain.entity;

import com.baomidou.mybatisplus.annotation.*;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 章节实体
 * 对应表：chapters
 */
@Data
@TableName("chapters")
public class Chapter {

    @TableId(type = IdType.AUTO)
    private Long id;

    @TableField("book_id")
    private Long bookId;

    @TableField("chapter_number")
    private Integer chapterNumber;

    private String title;

    private String summary;

    /**
     * 按位置系数分配后的目标字数
     */
    @TableField("word_target")
    private Integer wordTarget;

    private ChapterStatus status = ChapterStatus.PLANNED;

    /**
     * 全书审校阶段给出的章节分
     */
    @TableField("supervision_score")
    private Double supervisionScore;

    @TableField(value = "created_at", fill = FieldFill.INSERT)
    private LocalDateTime createdAt;

    @TableField(value = "updated_at", fill = FieldFill.INSERT_UPDATE)
    private LocalDateTime updatedAt;

    public enum ChapterStatus {
        PLANNED,
        GENERATING,
        COMPLETE,
        NEEDS_REVISION
    }
}
