package com.bookcraft.generation.model;

import lombok.Data;

import javax.validation.Valid;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 从单元正文中抽取出的叙事状态增量
 *
 * 未出现的字段表示"未报告"，合并时保留原值。
 */
@Data
public class TrackerUpdates {

    private List<@NotNull @Valid CharacterUpdate> characters = new ArrayList<>();

    private List<@NotNull @Valid PlotPointUpdate> plotPoints = new ArrayList<>();

    private List<@NotNull @Valid TimeReference> timeReferences = new ArrayList<>();

    private List<@NotNull @Valid WorldBuildingUpdate> worldBuilding = new ArrayList<>();

    private List<String> establishedFacts = new ArrayList<>();

    @Data
    public static class CharacterUpdate {

        @NotBlank
        private String name;

        private String location;

        private String emotionalState;

        private String physicalState;

        private String description;

        private List<String> newKnowledge = new ArrayList<>();

        private Map<String, String> relationships = new LinkedHashMap<>();
    }

    @Data
    public static class PlotPointUpdate {

        @NotBlank
        private String description;

        private String significance;

        private List<String> involvedCharacters = new ArrayList<>();
    }

    @Data
    public static class TimeReference {

        @NotBlank
        private String event;

        private String timeReference;
    }

    @Data
    public static class WorldBuildingUpdate {

        @NotBlank
        private String name;

        private String category;

        private String description;
    }
}
