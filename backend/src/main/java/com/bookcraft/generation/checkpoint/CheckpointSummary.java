package com.bookcraft.generation.checkpoint;

import com.bookcraft.generation.model.FailedUnit;
import com.bookcraft.generation.model.GenerationCheckpoint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 检查点概览（供接口展示）
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CheckpointSummary {

    private Long bookId;

    private int completedChapters;

    private Integer lastCompletedChapter;

    private int completedUnits;

    private int failedUnits;

    private int permanentlyFailedUnits;

    private int trackedCharacters;

    private LocalDateTime timestamp;

    private String version;

    public static CheckpointSummary of(GenerationCheckpoint checkpoint) {
        int units = checkpoint.getCompletedUnits().values().stream().mapToInt(java.util.Set::size).sum();
        int permanent = (int) checkpoint.getFailedUnits().stream().filter(FailedUnit::isPermanentlyFailed).count();
        return CheckpointSummary.builder()
                .bookId(checkpoint.getBookId())
                .completedChapters(checkpoint.getCompletedChapters().size())
                .lastCompletedChapter(checkpoint.getCompletedChapters().isEmpty() ? null : checkpoint.getCompletedChapters().last())
                .completedUnits(units)
                .failedUnits(checkpoint.getFailedUnits().size())
                .permanentlyFailedUnits(permanent)
                .trackedCharacters(checkpoint.getNarrativeState() == null ? 0 : checkpoint.getNarrativeState().getCharacters().size())
                .timestamp(checkpoint.getTimestamp())
                .version(checkpoint.getVersion())
                .build();
    }
}
