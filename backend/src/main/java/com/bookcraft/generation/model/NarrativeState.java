package com.bookcraft.generation.model;

import lombok.Data;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.ToIntFunction;

/**
 * 整本书的累积叙事状态
 *
 * 角色与世界观元素按名称唯一，只增不删；情节点与时间线按章节号有序，
 * 同章节内保持插入顺序，重试补写的早期章节数据会插到对应位置。
 */
@Data
public class NarrativeState {

    private Map<String, CharacterState> characters = new LinkedHashMap<>();

    private List<PlotPoint> plotPoints = new ArrayList<>();

    private List<TimelineEntry> timeline = new ArrayList<>();

    private List<String> establishedFacts = new ArrayList<>();

    private List<ResearchReference> researchReferences = new ArrayList<>();

    private Map<String, WorldBuildingElement> worldBuilding = new LinkedHashMap<>();

    public CharacterState getOrCreateCharacter(String name) {
        return characters.computeIfAbsent(name, CharacterState::new);
    }

    public CharacterState findCharacter(String name) {
        return characters.get(name);
    }

    public void addPlotPoint(PlotPoint plotPoint) {
        plotPoints.add(insertionIndex(plotPoints, plotPoint.getChapter(), PlotPoint::getChapter), plotPoint);
    }

    public void addTimelineEntry(TimelineEntry entry) {
        timeline.add(insertionIndex(timeline, entry.getChapter(), TimelineEntry::getChapter), entry);
    }

    public boolean addEstablishedFact(String fact) {
        if (fact == null || establishedFacts.contains(fact)) {
            return false;
        }
        establishedFacts.add(fact);
        return true;
    }

    public void addResearchReference(ResearchReference reference) {
        for (ResearchReference existing : researchReferences) {
            if (existing.getFact().equals(reference.getFact())) {
                return;
            }
        }
        researchReferences.add(reference);
    }

    /**
     * 合并世界观元素：已存在则只扩展章节集合，描述为空时补齐
     */
    public WorldBuildingElement mentionWorldElement(String name, String category, String description, int chapter) {
        WorldBuildingElement element = worldBuilding.get(name);
        if (element == null) {
            element = new WorldBuildingElement(name, category, description);
            worldBuilding.put(name, element);
        } else {
            if (element.getDescription() == null && description != null) {
                element.setDescription(description);
            }
            if (element.getCategory() == null && category != null) {
                element.setCategory(category);
            }
        }
        element.getChapters().add(chapter);
        return element;
    }

    /**
     * 登记大纲中规划的设定，不计入任何章节
     */
    public void registerWorldElement(String name, String category, String description) {
        worldBuilding.putIfAbsent(name, new WorldBuildingElement(name, category, description));
    }

    /**
     * 最近 n 条时间线记录（按章节序的尾部）
     */
    public List<TimelineEntry> getRecentTimeline(int n) {
        if (n <= 0 || timeline.isEmpty()) {
            return Collections.emptyList();
        }
        int from = Math.max(0, timeline.size() - n);
        return Collections.unmodifiableList(new ArrayList<>(timeline.subList(from, timeline.size())));
    }

    public NarrativeState deepCopy() {
        NarrativeState copy = new NarrativeState();
        characters.forEach((name, state) -> copy.characters.put(name, state.copy()));
        plotPoints.forEach(p -> copy.plotPoints.add(p.copy()));
        timeline.forEach(t -> copy.timeline.add(t.copy()));
        copy.establishedFacts.addAll(establishedFacts);
        researchReferences.forEach(r -> copy.researchReferences.add(r.copy()));
        worldBuilding.forEach((name, element) -> copy.worldBuilding.put(name, element.copy()));
        return copy;
    }

    private static <T> int insertionIndex(List<T> entries, int chapter, ToIntFunction<T> chapterOf) {
        int index = entries.size();
        while (index > 0 && chapterOf.applyAsInt(entries.get(index - 1)) > chapter) {
            index--;
        }
        return index;
    }
}
