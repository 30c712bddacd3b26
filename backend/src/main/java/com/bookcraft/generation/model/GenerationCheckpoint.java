package com.bookcraft.generation.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * 生成会话的持久化快照，断点续写的唯一依据
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GenerationCheckpoint {

    public static final String CURRENT_VERSION = "1.0";

    private Long bookId;

    private NarrativeState narrativeState;

    @Builder.Default
    private SortedSet<Integer> completedChapters = new TreeSet<>();

    /** 章节号 -> 已完成单元号 */
    @Builder.Default
    private Map<Integer, SortedSet<Integer>> completedUnits = new TreeMap<>();

    @Builder.Default
    private List<FailedUnit> failedUnits = new ArrayList<>();

    private LocalDateTime timestamp;

    @Builder.Default
    private String version = CURRENT_VERSION;
}
