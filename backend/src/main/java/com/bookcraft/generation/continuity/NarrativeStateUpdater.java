package com.bookcraft.generation.continuity;

import com.bookcraft.generation.model.CharacterState;
import com.bookcraft.generation.model.NarrativeState;
import com.bookcraft.generation.model.PlotPoint;
import com.bookcraft.generation.model.ResearchReference;
import com.bookcraft.generation.model.StoryBible;
import com.bookcraft.generation.model.TimelineEntry;
import com.bookcraft.generation.model.TrackerUpdates;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 把抽取出的增量合并进叙事状态
 *
 * 合并规则：只报告了的字段才覆盖，未报告的字段保留原值；角色与世界观按名称合并，集合只增不减。
 */
@Component
public class NarrativeStateUpdater {

    static final String INITIAL_RESEARCH_SOURCE = "初始资料";

    /**
     * 用故事圣经初始化叙事状态
     */
    public void seed(NarrativeState state, List<StoryBible.CharacterSeed> characters, List<String> researchFacts) {
        for (StoryBible.CharacterSeed seed : nullSafe(characters)) {
            if (StringUtils.isBlank(seed.getName())) {
                continue;
            }
            CharacterState character = state.getOrCreateCharacter(seed.getName().trim());
            if (seed.getRole() != null) {
                character.setRole(seed.getRole());
            }
            if (seed.getDescription() != null) {
                character.setDescription(seed.getDescription());
            }
            if (character.getLastSeenChapter() == null) {
                character.setLastSeenChapter(0);
            }
        }
        for (String fact : nullSafe(researchFacts)) {
            if (StringUtils.isBlank(fact)) {
                continue;
            }
            state.addEstablishedFact(fact);
            state.addResearchReference(new ResearchReference(fact, INITIAL_RESEARCH_SOURCE, 0));
        }
        if (state.getTimeline().isEmpty()) {
            state.addTimelineEntry(new TimelineEntry(1, "故事开始", "开篇"));
        }
    }

    public void apply(NarrativeState state, TrackerUpdates updates, int chapterNumber) {
        if (updates == null) {
            return;
        }
        for (TrackerUpdates.CharacterUpdate update : nullSafe(updates.getCharacters())) {
            applyCharacter(state, update, chapterNumber);
        }
        for (TrackerUpdates.PlotPointUpdate update : nullSafe(updates.getPlotPoints())) {
            state.addPlotPoint(new PlotPoint(chapterNumber, update.getDescription(), update.getSignificance(),
                    new ArrayList<>(nullSafe(update.getInvolvedCharacters()))));
        }
        for (TrackerUpdates.TimeReference reference : nullSafe(updates.getTimeReferences())) {
            state.addTimelineEntry(new TimelineEntry(chapterNumber, reference.getEvent(), reference.getTimeReference()));
        }
        for (TrackerUpdates.WorldBuildingUpdate update : nullSafe(updates.getWorldBuilding())) {
            state.mentionWorldElement(update.getName().trim(), update.getCategory(), update.getDescription(), chapterNumber);
        }
        for (String fact : nullSafe(updates.getEstablishedFacts())) {
            if (StringUtils.isNotBlank(fact)) {
                state.addEstablishedFact(fact);
            }
        }
    }

    private void applyCharacter(NarrativeState state, TrackerUpdates.CharacterUpdate update, int chapterNumber) {
        CharacterState character = state.getOrCreateCharacter(update.getName().trim());
        if (character.getFirstAppearance() == null || character.getFirstAppearance() > chapterNumber) {
            character.setFirstAppearance(chapterNumber);
        }
        Integer lastSeen = character.getLastSeenChapter();
        // 补写更早章节时不回退角色的当前状态
        boolean current = lastSeen == null || chapterNumber >= lastSeen;
        if (current && update.getLocation() != null) {
            character.setLocation(update.getLocation());
        }
        if (current && update.getEmotionalState() != null) {
            character.setEmotionalState(update.getEmotionalState());
        }
        if (current && update.getPhysicalState() != null) {
            character.setPhysicalState(update.getPhysicalState());
        }
        if (update.getDescription() != null && character.getDescription() == null) {
            character.setDescription(update.getDescription());
        }
        for (String item : nullSafe(update.getNewKnowledge())) {
            if (StringUtils.isNotBlank(item) && !character.getKnowledge().contains(item)) {
                character.getKnowledge().add(item);
            }
        }
        if (update.getRelationships() != null) {
            character.getRelationships().putAll(update.getRelationships());
        }
        character.setLastSeenChapter(lastSeen == null ? chapterNumber : Math.max(lastSeen, chapterNumber));
    }

    private static <T> List<T> nullSafe(List<T> list) {
        return list != null ? list : Collections.emptyList();
    }
}
