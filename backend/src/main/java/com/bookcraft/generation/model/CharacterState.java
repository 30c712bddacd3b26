package com.bookcraft.generation.model;

import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 角色的当前叙事状态
 */
@Data
public class CharacterState {

    private String name;

    private String role;

    private String description;

    /** 当前所在地点 */
    private String location;

    private String emotionalState;

    private String physicalState;

    /** 角色已经知道的信息 */
    private List<String> knowledge = new ArrayList<>();

    /** 对其他角色的关系描述，键为角色名 */
    private Map<String, String> relationships = new LinkedHashMap<>();

    private Integer firstAppearance;

    private Integer lastSeenChapter;

    public CharacterState() {
    }

    public CharacterState(String name) {
        this.name = name;
    }

    public CharacterState copy() {
        CharacterState copy = new CharacterState(name);
        copy.role = role;
        copy.description = description;
        copy.location = location;
        copy.emotionalState = emotionalState;
        copy.physicalState = physicalState;
        copy.knowledge = new ArrayList<>(knowledge);
        copy.relationships = new LinkedHashMap<>(relationships);
        copy.firstAppearance = firstAppearance;
        copy.lastSeenChapter = lastSeenChapter;
        return copy;
    }
}
