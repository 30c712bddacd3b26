package com.bookcraft.generation.continuity;

import com.bookcraft.config.ContinuityProperties;
import com.bookcraft.generation.model.CharacterState;
import com.bookcraft.generation.model.TimelineEntry;
import com.bookcraft.generation.model.WorldBuildingElement;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * 连贯性检查提示词
 */
@Component
public class ContinuityPromptBuilder {

    private static final String ISSUES_SCHEMA =
            "{\n" +
            "  \"issues\": [\n" +
            "    {\"type\": \"character|timeline|plot|research|worldbuilding|relationship\",\n" +
            "     \"severity\": \"critical|major|minor\",\n" +
            "     \"description\": \"问题描述\",\n" +
            "     \"location\": \"正文中的相关片段\",\n" +
            "     \"suggestion\": \"修改建议\"}\n" +
            "  ],\n" +
            "  \"successfulElements\": [\"处理得当的要素\"]\n" +
            "}";

    private static final String TRACKER_SCHEMA =
            "{\n" +
            "  \"characters\": [{\"name\": \"角色名\", \"location\": \"当前位置\", \"emotionalState\": \"情绪\",\n" +
            "                  \"physicalState\": \"身体状态\", \"description\": \"新角色简介\",\n" +
            "                  \"newKnowledge\": [\"本段新获知的信息\"], \"relationships\": {\"其他角色\": \"关系变化\"}}],\n" +
            "  \"plotPoints\": [{\"description\": \"情节事件\", \"significance\": \"major|minor\", \"involvedCharacters\": [\"角色名\"]}],\n" +
            "  \"timeReferences\": [{\"event\": \"事件\", \"timeReference\": \"时间表述\"}],\n" +
            "  \"worldBuilding\": [{\"name\": \"地点/组织/规则名\", \"category\": \"location|organization|rule|object\", \"description\": \"说明\"}],\n" +
            "  \"establishedFacts\": [\"新确立的事实\"]\n" +
            "}";

    private final ContinuityProperties properties;

    public ContinuityPromptBuilder(ContinuityProperties properties) {
        this.properties = properties;
    }

    public String trackerUpdatePrompt(int chapterNumber, String content, String summary, List<String> referencedFacts) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("你是一名严谨的小说连贯性记录员。请阅读第").append(chapterNumber).append("章的以下正文，")
              .append("提取叙事状态的变化。只记录正文中明确出现的信息，没有变化的字段不要输出。\n\n");
        if (StringUtils.isNotBlank(summary)) {
            prompt.append("【本章概要】\n").append(summary).append("\n\n");
        }
        if (referencedFacts != null && !referencedFacts.isEmpty()) {
            prompt.append("【本章引用的资料】\n");
            referencedFacts.forEach(fact -> prompt.append("- ").append(fact).append("\n"));
            prompt.append("\n");
        }
        prompt.append("【正文】\n").append(truncateContent(content)).append("\n\n");
        prompt.append("请严格按以下JSON格式输出，不要输出其他内容：\n").append(TRACKER_SCHEMA);
        return prompt.toString();
    }

    public String characterPrompt(CharacterState character, int chapterNumber, String content) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("检查第").append(chapterNumber).append("章正文中角色「").append(character.getName())
              .append("」的表现是否与已知状态一致。\n\n");
        prompt.append("【已知状态】\n");
        appendField(prompt, "定位", character.getRole());
        appendField(prompt, "简介", character.getDescription());
        appendField(prompt, "所在位置", character.getLocation());
        appendField(prompt, "情绪", character.getEmotionalState());
        appendField(prompt, "身体状态", character.getPhysicalState());
        if (!character.getKnowledge().isEmpty()) {
            prompt.append("- 已知信息：").append(String.join("；", character.getKnowledge())).append("\n");
        }
        for (Map.Entry<String, String> relation : character.getRelationships().entrySet()) {
            prompt.append("- 与").append(relation.getKey()).append("的关系：").append(relation.getValue()).append("\n");
        }
        if (character.getLastSeenChapter() != null && character.getLastSeenChapter() > 0) {
            prompt.append("- 上次出场：第").append(character.getLastSeenChapter()).append("章\n");
        }
        prompt.append("\n重点检查：角色是否知道了不该知道的事、位置是否无故跳变、性格与动机是否前后矛盾、关系是否与记录冲突。\n\n");
        appendContentAndSchema(prompt, content);
        return prompt.toString();
    }

    public String timelinePrompt(List<TimelineEntry> recentTimeline, int chapterNumber, String content) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("检查第").append(chapterNumber).append("章正文的时间线是否与此前记录一致。\n\n");
        prompt.append("【最近的时间线】\n");
        if (recentTimeline.isEmpty()) {
            prompt.append("（暂无记录）\n");
        }
        for (TimelineEntry entry : recentTimeline) {
            prompt.append("- 第").append(entry.getChapter()).append("章：").append(entry.getEvent());
            if (StringUtils.isNotBlank(entry.getTimeReference())) {
                prompt.append("（").append(entry.getTimeReference()).append("）");
            }
            prompt.append("\n");
        }
        prompt.append("\n重点检查：时间倒流、季节或昼夜矛盾、事件间隔不合理、与已发生事件的先后顺序冲突。\n\n");
        appendContentAndSchema(prompt, content);
        return prompt.toString();
    }

    public String worldBuildingPrompt(Collection<WorldBuildingElement> elements, int chapterNumber, String content) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("检查第").append(chapterNumber).append("章正文是否违背已确立的世界观设定。\n\n");
        prompt.append("【已确立的设定】\n");
        if (elements.isEmpty()) {
            prompt.append("（暂无记录）\n");
        }
        for (WorldBuildingElement element : elements) {
            prompt.append("- ").append(element.getName());
            if (StringUtils.isNotBlank(element.getCategory())) {
                prompt.append("[").append(element.getCategory()).append("]");
            }
            if (StringUtils.isNotBlank(element.getDescription())) {
                prompt.append("：").append(element.getDescription());
            }
            prompt.append("\n");
        }
        prompt.append("\n重点检查：地理与空间关系、组织与规则、物品与能力的设定是否前后一致。\n\n");
        appendContentAndSchema(prompt, content);
        return prompt.toString();
    }

    public String researchPrompt(List<String> referencedFacts, List<String> establishedFacts, int chapterNumber,
                                 String content) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("检查第").append(chapterNumber).append("章正文对资料事实的使用是否准确。\n\n");
        prompt.append("【本章引用的资料】\n");
        referencedFacts.forEach(fact -> prompt.append("- ").append(fact).append("\n"));
        if (!establishedFacts.isEmpty()) {
            prompt.append("\n【此前确立的事实】\n");
            establishedFacts.forEach(fact -> prompt.append("- ").append(fact).append("\n"));
        }
        prompt.append("\n重点检查：事实错误、技术细节失真、与此前确立事实的矛盾。\n\n");
        appendContentAndSchema(prompt, content);
        return prompt.toString();
    }

    /**
     * 超长正文保留开头，截断处标注
     */
    public String truncateContent(String content) {
        if (content == null) {
            return "";
        }
        int max = properties.getMaxContentLength();
        if (content.length() <= max) {
            return content;
        }
        return content.substring(0, max) + "\n……（正文过长，已截断）";
    }

    private void appendContentAndSchema(StringBuilder prompt, String content) {
        prompt.append("【正文】\n").append(truncateContent(content)).append("\n\n");
        prompt.append("没有问题时 issues 输出空数组。请严格按以下JSON格式输出，不要输出其他内容：\n").append(ISSUES_SCHEMA);
    }

    private static void appendField(StringBuilder prompt, String label, String value) {
        if (StringUtils.isNotBlank(value)) {
            prompt.append("- ").append(label).append("：").append(value).append("\n");
        }
    }
}
