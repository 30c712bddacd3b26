package com.bookcraft.generation.model;

import lombok.Data;

import java.util.SortedSet;
import java.util.TreeSet;

/**
 * 世界观元素（地点、组织、规则等），同名元素再次出现时只扩展出现章节
 */
@Data
public class WorldBuildingElement {

    private String name;

    private String category;

    private String description;

    private SortedSet<Integer> chapters = new TreeSet<>();

    public WorldBuildingElement() {
    }

    public WorldBuildingElement(String name, String category, String description) {
        this.name = name;
        this.category = category;
        this.description = description;
    }

    public WorldBuildingElement copy() {
        WorldBuildingElement copy = new WorldBuildingElement(name, category, description);
        copy.chapters = new TreeSet<>(chapters);
        return copy;
    }
}
