package com.bookcraft.generation.continuity;

import com.bookcraft.generation.model.CharacterState;
import com.bookcraft.generation.model.NarrativeState;
import com.bookcraft.generation.model.StoryBible;
import com.bookcraft.generation.model.TimelineEntry;
import com.bookcraft.generation.model.TrackerUpdates;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class NarrativeStateUpdaterTest {

    private NarrativeStateUpdater updater;
    private NarrativeState state;

    @BeforeEach
    void setUp() {
        updater = new NarrativeStateUpdater();
        state = new NarrativeState();
        StoryBible.CharacterSeed alice = new StoryBible.CharacterSeed();
        alice.setName("Alice");
        alice.setRole("主角");
        alice.setDescription("厨师");
        updater.seed(state, Collections.singletonList(alice), Collections.singletonList("猎户座在冬季可见"));
    }

    private static TrackerUpdates.CharacterUpdate character(String name, String location) {
        TrackerUpdates.CharacterUpdate update = new TrackerUpdates.CharacterUpdate();
        update.setName(name);
        update.setLocation(location);
        return update;
    }

    private static TrackerUpdates.WorldBuildingUpdate world(String name) {
        TrackerUpdates.WorldBuildingUpdate update = new TrackerUpdates.WorldBuildingUpdate();
        update.setName(name);
        update.setCategory("location");
        return update;
    }

    private static TrackerUpdates.TimeReference time(String event) {
        TrackerUpdates.TimeReference reference = new TrackerUpdates.TimeReference();
        reference.setEvent(event);
        return reference;
    }

    @Test
    @DisplayName("seeding registers characters, facts and the opening timeline entry")
    void should_SeedInitialState_When_StoryBibleProvided() {
        CharacterState alice = state.findCharacter("Alice");

        assertThat(alice).isNotNull();
        assertThat(alice.getLastSeenChapter()).isEqualTo(0);
        assertThat(state.getEstablishedFacts()).containsExactly("猎户座在冬季可见");
        assertThat(state.getResearchReferences()).hasSize(1);
        assertThat(state.getResearchReferences().get(0).getSource()).isEqualTo(NarrativeStateUpdater.INITIAL_RESEARCH_SOURCE);
        assertThat(state.getTimeline()).extracting(TimelineEntry::getEvent).containsExactly("故事开始");
    }

    @Test
    @DisplayName("a location stays when a later update does not report it")
    void should_KeepLocation_When_LaterUpdateOmitsIt() {
        TrackerUpdates first = new TrackerUpdates();
        first.getCharacters().add(character("Alice", "Kitchen"));
        updater.apply(state, first, 1);

        TrackerUpdates second = new TrackerUpdates();
        TrackerUpdates.CharacterUpdate mood = character("Alice", null);
        mood.setEmotionalState("焦虑");
        second.getCharacters().add(mood);
        updater.apply(state, second, 2);

        CharacterState alice = state.findCharacter("Alice");
        assertThat(alice.getLocation()).isEqualTo("Kitchen");
        assertThat(alice.getEmotionalState()).isEqualTo("焦虑");
        assertThat(alice.getDescription()).isEqualTo("厨师");
        assertThat(alice.getLastSeenChapter()).isEqualTo(2);
    }

    @Test
    @DisplayName("character and world element keys only grow")
    void should_OnlyGrowKeySets_When_ApplyingUpdates() {
        Set<String> characterKeys = new HashSet<>(state.getCharacters().keySet());
        Set<String> worldKeys = new HashSet<>(state.getWorldBuilding().keySet());

        for (int chapter = 1; chapter <= 4; chapter++) {
            TrackerUpdates updates = new TrackerUpdates();
            if (chapter % 2 == 0) {
                updates.getCharacters().add(character("Bob" + chapter, "码头"));
                updates.getWorldBuilding().add(world("港口" + chapter));
            }
            updater.apply(state, updates, chapter);

            assertThat(state.getCharacters().keySet()).containsAll(characterKeys);
            assertThat(state.getWorldBuilding().keySet()).containsAll(worldKeys);
            characterKeys = new HashSet<>(state.getCharacters().keySet());
            worldKeys = new HashSet<>(state.getWorldBuilding().keySet());
        }
        assertThat(state.getCharacters()).containsKeys("Alice", "Bob2", "Bob4");
        assertThat(state.getCharacters().get("Bob4").getFirstAppearance()).isEqualTo(4);
    }

    @Test
    @DisplayName("mentioning a known world element extends its chapter set")
    void should_ExtendChapters_When_WorldElementMentionedAgain() {
        TrackerUpdates first = new TrackerUpdates();
        first.getWorldBuilding().add(world("灯塔"));
        updater.apply(state, first, 2);
        TrackerUpdates second = new TrackerUpdates();
        second.getWorldBuilding().add(world("灯塔"));
        updater.apply(state, second, 5);

        assertThat(state.getWorldBuilding()).hasSize(1);
        assertThat(state.getWorldBuilding().get("灯塔").getChapters()).containsExactly(2, 5);
    }

    @Test
    @DisplayName("a retried earlier chapter is inserted in order and does not rewind current state")
    void should_InsertInOrderWithoutRewinding_When_EarlierChapterAppliedLate() {
        TrackerUpdates chapterThree = new TrackerUpdates();
        chapterThree.getCharacters().add(character("Alice", "Lighthouse"));
        chapterThree.getTimeReferences().add(time("风暴来临"));
        updater.apply(state, chapterThree, 3);

        TrackerUpdates chapterTwo = new TrackerUpdates();
        chapterTwo.getCharacters().add(character("Alice", "Kitchen"));
        chapterTwo.getTimeReferences().add(time("晚餐"));
        updater.apply(state, chapterTwo, 2);

        assertThat(state.getTimeline()).extracting(TimelineEntry::getChapter).containsExactly(1, 2, 3);
        assertThat(state.getTimeline()).extracting(TimelineEntry::getEvent).containsExactly("故事开始", "晚餐", "风暴来临");
        CharacterState alice = state.findCharacter("Alice");
        assertThat(alice.getLocation()).isEqualTo("Lighthouse");
        assertThat(alice.getLastSeenChapter()).isEqualTo(3);
        assertThat(alice.getFirstAppearance()).isEqualTo(2);
    }

    @Test
    @DisplayName("knowledge is deduplicated and relationships merge")
    void should_MergeKnowledgeAndRelationships_When_Reported() {
        TrackerUpdates updates = new TrackerUpdates();
        TrackerUpdates.CharacterUpdate alice = character("Alice", null);
        alice.setNewKnowledge(Arrays.asList("钥匙在地窖", "钥匙在地窖"));
        alice.getRelationships().put("Bob", "盟友");
        updates.getCharacters().add(alice);
        updater.apply(state, updates, 1);

        CharacterState stored = state.findCharacter("Alice");
        assertThat(stored.getKnowledge()).containsExactly("钥匙在地窖");
        assertThat(stored.getRelationships()).containsEntry("Bob", "盟友");
    }
}
