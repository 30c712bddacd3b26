package com.bookcraft.generation.model;

import lombok.Data;

import javax.validation.Valid;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotEmpty;
import javax.validation.constraints.NotNull;
import java.util.ArrayList;
import java.util.List;

/**
 * 大纲阶段产出的故事圣经：角色、分章大纲与资料事实
 */
@Data
public class StoryBible {

    private String title;

    private List<@NotNull @Valid CharacterSeed> characters = new ArrayList<>();

    @NotEmpty
    private List<@NotNull @Valid ChapterOutline> chapters = new ArrayList<>();

    private List<String> researchFacts = new ArrayList<>();

    public ChapterOutline findChapter(int chapterNumber) {
        for (ChapterOutline chapter : chapters) {
            if (chapter.getChapterNumber() != null && chapter.getChapterNumber() == chapterNumber) {
                return chapter;
            }
        }
        return null;
    }

    @Data
    public static class CharacterSeed {

        @NotBlank
        private String name;

        private String role;

        private String description;
    }

    @Data
    public static class ChapterOutline {

        @NotNull
        @Min(1)
        private Integer chapterNumber;

        @NotBlank
        private String title;

        @NotBlank
        private String summary;

        private String setting;

        private String conflict;

        private String mood;

        private String focalCharacter;

        /** action / dialogue / atmospheric / emotional */
        private String sceneType;

        private List<String> characters = new ArrayList<>();

        private List<String> researchFocus = new ArrayList<>();
    }
}
