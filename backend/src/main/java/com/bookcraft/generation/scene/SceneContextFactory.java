package com.bookcraft.generation.scene;

import com.bookcraft.generation.model.StoryBible;
import com.bookcraft.generation.model.UnitPlan;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;

/**
 * 根据章纲与单元位置选择场景类型
 *
 * 多单元章节开头铺氛围、结尾落情感；其余单元优先用章纲指定的类型，否则有冲突写动作、没有写对话。
 * 必需字段缺失时退回氛围场景。
 */
@Component
public class SceneContextFactory {

    public SceneContext forUnit(StoryBible.ChapterOutline outline, UnitPlan plan) {
        SceneContext.SceneType hinted = SceneContext.SceneType.fromCode(outline.getSceneType());
        return build(positionalType(outline, plan, hinted), outline);
    }

    private SceneContext.SceneType positionalType(StoryBible.ChapterOutline outline, UnitPlan plan,
                                                   SceneContext.SceneType hinted) {
        if (plan.getTotalUnits() > 1 && plan.isFirst()) {
            return SceneContext.SceneType.ATMOSPHERIC;
        }
        if (plan.getTotalUnits() > 1 && plan.isLast()) {
            return SceneContext.SceneType.EMOTIONAL;
        }
        if (hinted != null) {
            return hinted;
        }
        return StringUtils.isNotBlank(outline.getConflict()) ? SceneContext.SceneType.ACTION : SceneContext.SceneType.DIALOGUE;
    }

    private SceneContext build(SceneContext.SceneType type, StoryBible.ChapterOutline outline) {
        String setting = outline.getSetting();
        String mood = outline.getMood();
        List<String> characters = outline.getCharacters() != null ? outline.getCharacters() : Collections.emptyList();
        switch (type) {
            case ACTION:
                if (StringUtils.isNotBlank(outline.getConflict())) {
                    return SceneContext.action(setting, mood, outline.getConflict(), null);
                }
                break;
            case DIALOGUE:
                if (!characters.isEmpty()) {
                    return SceneContext.dialogue(setting, mood, characters, outline.getConflict());
                }
                break;
            case EMOTIONAL:
                String focal = StringUtils.defaultIfBlank(outline.getFocalCharacter(),
                        characters.isEmpty() ? null : characters.get(0));
                if (StringUtils.isNotBlank(focal)) {
                    return SceneContext.emotional(setting, mood, focal, outline.getConflict());
                }
                break;
            default:
                break;
        }
        return SceneContext.atmospheric(setting, mood, null);
    }
}
