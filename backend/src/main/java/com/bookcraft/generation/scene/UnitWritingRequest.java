package com.bookcraft.generation.scene;

import com.bookcraft.generation.model.StoryBible;
import com.bookcraft.generation.model.UnitPlan;
import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 写一个单元所需的全部上下文
 */
@Data
@Builder
public class UnitWritingRequest {

    private Long bookId;

    private String bookTitle;

    private String premise;

    private StoryBible.ChapterOutline chapter;

    private UnitPlan plan;

    private SceneContext scene;

    /** 角色当前状态摘要 */
    @Builder.Default
    private List<String> characterNotes = new ArrayList<>();

    /** 前一单元结尾，用于衔接 */
    private String previousExcerpt;
}
