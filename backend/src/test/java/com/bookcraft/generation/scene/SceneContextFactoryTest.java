package com.bookcraft.generation.scene;

import com.bookcraft.generation.model.StoryBible;
import com.bookcraft.generation.model.UnitPlan;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SceneContextFactoryTest {

    private final SceneContextFactory factory = new SceneContextFactory();

    private StoryBible.ChapterOutline outline(String sceneType, String conflict) {
        StoryBible.ChapterOutline outline = new StoryBible.ChapterOutline();
        outline.setChapterNumber(4);
        outline.setTitle("风暴前夜");
        outline.setSummary("林默与老周在灯塔里对峙");
        outline.setSetting("灯塔顶层");
        outline.setMood("紧绷");
        outline.setSceneType(sceneType);
        outline.setConflict(conflict);
        outline.setCharacters(new ArrayList<>(Arrays.asList("林默", "老周")));
        return outline;
    }

    @Test
    @DisplayName("multi-unit chapters open atmospheric and close emotional")
    void should_UsePositionalTypes_When_ChapterHasSeveralUnits() {
        StoryBible.ChapterOutline outline = outline("action", "谁写了那封信");

        assertThat(factory.forUnit(outline, new UnitPlan(4, 1, 3, 1000)).getType())
                .isEqualTo(SceneContext.SceneType.ATMOSPHERIC);
        assertThat(factory.forUnit(outline, new UnitPlan(4, 2, 3, 1000)).getType())
                .isEqualTo(SceneContext.SceneType.ACTION);
        SceneContext last = factory.forUnit(outline, new UnitPlan(4, 3, 3, 1000));
        assertThat(last.getType()).isEqualTo(SceneContext.SceneType.EMOTIONAL);
        assertThat(((SceneContext.EmotionalScene) last).getFocalCharacter()).isEqualTo("林默");
    }

    @Test
    @DisplayName("without a hint a conflict produces action and its absence produces dialogue")
    void should_FollowConflict_When_NoSceneHint() {
        assertThat(factory.forUnit(outline(null, "谁写了那封信"), new UnitPlan(4, 1, 1, 1000)).getType())
                .isEqualTo(SceneContext.SceneType.ACTION);
        SceneContext dialogue = factory.forUnit(outline(null, null), new UnitPlan(4, 1, 1, 1000));
        assertThat(dialogue.getType()).isEqualTo(SceneContext.SceneType.DIALOGUE);
        assertThat(((SceneContext.DialogueScene) dialogue).getSpeakers()).containsExactly("林默", "老周");
    }

    @Test
    @DisplayName("a hinted type whose required fields are missing falls back to atmospheric")
    void should_FallBackToAtmospheric_When_RequiredFieldsMissing() {
        StoryBible.ChapterOutline outline = outline("dialogue", null);
        outline.setCharacters(Collections.emptyList());

        SceneContext scene = factory.forUnit(outline, new UnitPlan(4, 1, 1, 1000));

        assertThat(scene.getType()).isEqualTo(SceneContext.SceneType.ATMOSPHERIC);
        assertThat(scene.getSetting()).isEqualTo("灯塔顶层");
    }

    @Test
    @DisplayName("scene prompts carry the type specific requirements")
    void should_AppendRequirements_When_BuildingPrompt() {
        StringBuilder prompt = new StringBuilder();
        SceneContext.action(null, null, "抢夺钥匙", null).appendScenePrompt(prompt);

        assertThat(prompt.toString())
                .contains("【场景】action")
                .contains("延续上一场景")
                .contains("冲突：抢夺钥匙");
    }

    @Test
    @DisplayName("variants reject missing required fields")
    void should_Reject_When_RequiredFieldMissing() {
        assertThatThrownBy(() -> SceneContext.action("码头", "阴沉", " ", null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SceneContext.dialogue("码头", "阴沉", Collections.emptyList(), null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SceneContext.emotional("码头", "阴沉", null, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(SceneContext.SceneType.fromCode(" Dialogue ")).isEqualTo(SceneContext.SceneType.DIALOGUE);
        assertThat(SceneContext.SceneType.fromCode("montage")).isNull();
    }
}
